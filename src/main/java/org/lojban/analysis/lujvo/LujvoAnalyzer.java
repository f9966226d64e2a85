package org.lojban.analysis.lujvo;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;

/**
 * Whitespace tokenizer followed by a {@link LujvoTokenFilter}.
 */
public class LujvoAnalyzer extends Analyzer {
    public final int minWordSize;
    public final boolean preserveOriginal;
    public final boolean emitSourceWords;
    private final MorphologySettings settings;
    private final LujvoMorphology morphology;

    public LujvoAnalyzer() {
        this(LujvoTokenFilter.DEFAULT_MIN_WORD_SIZE,
                LujvoTokenFilter.DEFAULT_PRESERVE_ORIGINAL,
                LujvoTokenFilter.DEFAULT_EMIT_SOURCE_WORDS,
                MorphologySettings.DEFAULT);
    }

    public LujvoAnalyzer(int minWordSize, boolean preserveOriginal, boolean emitSourceWords,
            MorphologySettings settings) {
        this(LujvoMorphology.getDefault(), minWordSize, preserveOriginal, emitSourceWords, settings);
    }

    public LujvoAnalyzer(LujvoMorphology morphology, int minWordSize, boolean preserveOriginal,
            boolean emitSourceWords, MorphologySettings settings) {
        this.morphology = morphology;
        this.minWordSize = minWordSize;
        this.preserveOriginal = preserveOriginal;
        this.emitSourceWords = emitSourceWords;
        this.settings = settings;
    }

    @Override
    protected TokenStreamComponents createComponents(String fieldName) {
        Tokenizer tokenizer = new WhitespaceTokenizer();
        LujvoTokenFilter tokenFilter = new LujvoTokenFilter(tokenizer, morphology, settings,
                minWordSize, preserveOriginal, emitSourceWords);
        return new TokenStreamComponents(tokenizer, tokenFilter);
    }
}
