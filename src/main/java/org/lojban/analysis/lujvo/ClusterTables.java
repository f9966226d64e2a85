package org.lojban.analysis.lujvo;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The phonotactic tables: permissible consonant pairs, word-initial pairs, the pairs that
 * may close a zi'evla onset, forbidden triples and the vowel clusters.
 *
 * The default tables are read once from {@value #RESOURCE} on the classpath.
 */
public final class ClusterTables {

    private static final Logger log = LoggerFactory.getLogger(ClusterTables.class);

    static final String RESOURCE = "cluster-tables.properties";

    private final Set<String> valid;
    private final Set<String> mzValid;
    private final Set<String> initial;
    private final Set<String> zihevlaInitial;
    private final Set<String> bannedTriples;
    private final Set<String> startVowelClusters;
    private final Set<String> followVowelClusters;

    private static final class Holder {
        static final ClusterTables DEFAULT = loadDefault();
    }

    private ClusterTables(Properties properties) {
        this.valid = entries(properties, "valid");
        Set<String> withMz = new HashSet<>(valid);
        withMz.add("mz");
        this.mzValid = Collections.unmodifiableSet(withMz);
        this.initial = entries(properties, "initial");
        this.zihevlaInitial = entries(properties, "zihevla.initial");
        this.bannedTriples = entries(properties, "banned.triples");
        this.startVowelClusters = entries(properties, "vowels.start");
        this.followVowelClusters = entries(properties, "vowels.follow");
    }

    /**
     * Shared instance built from the bundled tables.
     */
    public static ClusterTables getDefault() {
        return Holder.DEFAULT;
    }

    /**
     * Reads tables in the format of the bundled {@value #RESOURCE}.
     */
    public static ClusterTables load(InputStream in) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return new ClusterTables(properties);
    }

    private static ClusterTables loadDefault() {
        try (InputStream in = ClusterTables.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IOException("Resource " + RESOURCE + " not found");
            }
            ClusterTables tables = load(in);
            log.info("Loaded {} consonant pairs and {} initial pairs from {}",
                    tables.valid.size(), tables.initial.size(), RESOURCE);
            return tables;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load cluster tables.", e);
        }
    }

    private static Set<String> entries(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing cluster table: " + key);
        }
        Set<String> set = new HashSet<>(Arrays.asList(value.trim().split("\\s+")));
        return Collections.unmodifiableSet(set);
    }

    public boolean isValid(String pair, boolean allowMz) {
        return (allowMz ? mzValid : valid).contains(pair);
    }

    public boolean isInitial(String pair) {
        return initial.contains(pair);
    }

    public boolean isZihevlaInitial(String pair) {
        return zihevlaInitial.contains(pair);
    }

    public boolean isBannedTriple(String triple) {
        return bannedTriples.contains(triple);
    }

    public boolean isStartVowelCluster(String vowels) {
        return startVowelClusters.contains(vowels);
    }

    public boolean isFollowVowelCluster(String vowels) {
        return followVowelClusters.contains(vowels);
    }
}
