package org.lojban.analysis.lujvo;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.fst.ByteSequenceOutputs;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.FSTCompiler;
import org.apache.lucene.util.fst.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AffixLookup} backed by two FSTs: source word to its space separated rafsi, and
 * rafsi to source word. Both are built in memory from a plain text list, one word per line
 * followed by its rafsi in priority order.
 *
 * Instances are immutable and safe to share between threads.
 */
public class RafsiDictionary implements AffixLookup {

    private static final Logger log = LoggerFactory.getLogger(RafsiDictionary.class);

    static final String RAFSI_FILE = "rafsi.txt";

    /**
     * Source word to rafsi list. Words without rafsi map to the empty output.
     */
    private final FST<BytesRef> rafsiForms;

    /**
     * Rafsi to the first source word listing it.
     */
    private final FST<BytesRef> sourceWords;

    private final int size;

    private static final class Holder {
        static final RafsiDictionary DEFAULT = loadDefault();
    }

    private RafsiDictionary(FST<BytesRef> rafsiForms, FST<BytesRef> sourceWords, int size) {
        this.rafsiForms = rafsiForms;
        this.sourceWords = sourceWords;
        this.size = size;
    }

    /**
     * Shared dictionary built from the bundled {@value #RAFSI_FILE}.
     */
    public static RafsiDictionary getDefault() {
        return Holder.DEFAULT;
    }

    /**
     * Builds a dictionary from an ordered map of source word to rafsi. When two words list
     * the same rafsi, the first in map order owns it.
     */
    public static RafsiDictionary build(SortedMap<String, List<String>> entries) {
        try {
            return of(entries);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build rafsi FSTs.", e);
        }
    }

    /**
     * Reads the text format: blank lines and lines starting with {@code #} are ignored.
     * When two lines list the same rafsi, the earlier line owns it.
     */
    public static RafsiDictionary load(InputStream in) throws IOException {
        Map<String, List<String>> lines = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                String[] fields = line.split("\\s+");
                String valsi = fields[0].toLowerCase(Locale.ROOT);
                if (!Letters.isOnlyLojbanCharacters(valsi)) {
                    throw new IOException("Line " + lineNo + ": not a Lojban word: " + fields[0]);
                }
                if (lines.containsKey(valsi)) {
                    log.warn("Line {}: duplicate entry for {} ignored", lineNo, valsi);
                    continue;
                }
                lines.put(valsi, new ArrayList<>(Arrays.asList(fields).subList(1, fields.length)));
            }
        }

        return of(lines);
    }

    /**
     * Rafsi owners are taken in the iteration order of {@code entries}.
     */
    private static RafsiDictionary of(Map<String, List<String>> entries) throws IOException {
        Map<String, String> owners = new LinkedHashMap<>();
        TreeMap<String, String> forms = new TreeMap<>();
        for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
            forms.put(entry.getKey(), String.join(" ", entry.getValue()));
            for (String rafsi : entry.getValue()) {
                owners.putIfAbsent(rafsi, entry.getKey());
            }
        }
        return new RafsiDictionary(compile(forms), compile(new TreeMap<>(owners)), forms.size());
    }

    private static RafsiDictionary loadDefault() {
        try (InputStream in = RafsiDictionary.class.getClassLoader().getResourceAsStream(RAFSI_FILE)) {
            if (in == null) {
                throw new IOException("Resource " + RAFSI_FILE + " not found");
            }
            RafsiDictionary dictionary = load(in);
            log.info("Loaded {} source words from {}", dictionary.size(), RAFSI_FILE);
            return dictionary;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load rafsi dictionary.", e);
        }
    }

    /**
     * Number of source words.
     */
    public int size() {
        return size;
    }

    @Override
    public List<String> rafsiFor(String valsi) {
        String forms = lookup(rafsiForms, valsi);
        if (forms == null || forms.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(Arrays.asList(forms.split(" ")));
    }

    @Override
    public boolean contains(String valsi) {
        return lookup(rafsiForms, valsi) != null;
    }

    @Override
    public String valsiForRafsi(String rafsi) {
        return lookup(sourceWords, rafsi);
    }

    private static String lookup(FST<BytesRef> fst, String key) {
        if (fst == null || key.isEmpty()) {
            return null;
        }
        try {
            BytesRef output = Util.get(fst, UTF16ToUTF32(key, new IntsRefBuilder()));
            return output == null ? null : output.utf8ToString();
        } catch (IOException e) {
            // in-memory FST reads do not fail
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Keys must arrive in sorted order, which a TreeMap of plain ASCII strings guarantees.
     */
    private static FST<BytesRef> compile(SortedMap<String, String> entries) throws IOException {
        if (entries.isEmpty()) {
            return null;
        }
        ByteSequenceOutputs outputs = ByteSequenceOutputs.getSingleton();
        FSTCompiler<BytesRef> compiler = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE4, outputs).build();
        IntsRefBuilder intsBuilder = new IntsRefBuilder();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            BytesRef output = entry.getValue().isEmpty() ? outputs.getNoOutput() : new BytesRef(entry.getValue());
            compiler.add(UTF16ToUTF32(entry.getKey(), intsBuilder), output);
        }
        FST.FSTMetadata<BytesRef> metadata = compiler.compile();
        return FST.fromFSTReader(metadata, compiler.getFSTReader());
    }

    /**
     * Convert a character sequence <code>s</code> into full unicode codepoints.
     */
    private static IntsRef UTF16ToUTF32(CharSequence s, IntsRefBuilder builder) {
        builder.clear();
        for (int charIdx = 0, charLimit = s.length(); charIdx < charLimit;) {
            final int u32 = Character.codePointAt(s, charIdx);
            builder.append(u32);
            charIdx += Character.charCount(u32);
        }
        return builder.get();
    }
}
