package org.lojban.analysis.lujvo;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

import org.apache.lucene.analysis.TokenFilterFactory;
import org.apache.lucene.analysis.TokenStream;

import org.lojban.analysis.lujvo.MorphologySettings.ConsonantRule;
import org.lojban.analysis.lujvo.MorphologySettings.YHyphens;

/**
 * Factory to construct a {@link LujvoTokenFilter} from configuration.
 *
 * <pre class="prettyprint">
 * &lt;filter name="lujvo" minWordSize="5" preserveOriginal="true" emitSourceWords="false"
 *         yHyphens="standard" expRafsiShapes="false" consonants="cluster" glides="false"
 *         allowMz="false"/&gt;
 * </pre>
 *
 * @lucene.spi {@value #NAME}
 */
public class LujvoTokenFilterFactory extends TokenFilterFactory {

    /** SPI name */
    public static final String NAME = "lujvo";

    private final int minWordSize;
    private final boolean preserveOriginal;
    private final boolean emitSourceWords;
    private final MorphologySettings settings;

    /**
     * Construct filter factory (used in configuration based construction)
     *
     * @param args input arguments from xml string
     */
    public LujvoTokenFilterFactory(Map<String, String> args) {
        super(args);
        minWordSize = getInt(args, "minWordSize", LujvoTokenFilter.DEFAULT_MIN_WORD_SIZE);
        preserveOriginal = getBoolean(args, "preserveOriginal", LujvoTokenFilter.DEFAULT_PRESERVE_ORIGINAL);
        emitSourceWords = getBoolean(args, "emitSourceWords", LujvoTokenFilter.DEFAULT_EMIT_SOURCE_WORDS);
        settings = MorphologySettings.builder()
                .yHyphens(YHyphens.valueOf(getEnumName(args, "yHyphens", YHyphens.values(), YHyphens.STANDARD)))
                .expRafsiShapes(getBoolean(args, "expRafsiShapes", false))
                .consonants(ConsonantRule.valueOf(
                        getEnumName(args, "consonants", ConsonantRule.values(), ConsonantRule.CLUSTER)))
                .glides(getBoolean(args, "glides", false))
                .allowMz(getBoolean(args, "allowMz", false))
                .build();
        if (!args.isEmpty()) {
            throw new IllegalArgumentException("There were unrecognized parameters, remove them: " + args);
        }
    }

    /** Default ctor for compatibility with SPI */
    public LujvoTokenFilterFactory() {
        throw defaultCtorException();
    }

    @Override
    public TokenStream create(TokenStream input) {
        return new LujvoTokenFilter(input, LujvoMorphology.getDefault(), settings,
                minWordSize, preserveOriginal, emitSourceWords);
    }

    MorphologySettings getSettings() {
        return settings;
    }

    /**
     * Reads an enum constant name, case insensitive.
     */
    private String getEnumName(Map<String, String> args, String name, Enum<?>[] values, Enum<?> defaultValue) {
        String[] allowed = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            allowed[i] = values[i].name();
        }
        String value = get(args, name, Arrays.asList(allowed), defaultValue.name(), false);
        return value.toUpperCase(Locale.ROOT);
    }
}
