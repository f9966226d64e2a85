package org.lojban.analysis.lujvo;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

import org.apache.lucene.analysis.TokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionLengthAttribute;
import org.apache.lucene.analysis.tokenattributes.TypeAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A lujvo decompounding token filter that maintains proper graphs of generated tokens.
 *
 * Every token that classifies as a lujvo (or a name made of rafsi) is followed by one token
 * per rafsi, each spanning one position and carrying the offsets of that rafsi inside the
 * original word. Hyphens are not emitted. With {@code emitSourceWords} the source word of
 * each rafsi is emitted instead.
 *
 * For "latkerlo tcanyja'a" with {@code preserveOriginal=true} (l=PositionLength,
 * inc=PositionIncrement):
 *
 * <pre>
 * (latkerlo,l:2,inc:1)                (tcanyja'a,l:2,inc:1)
 *          \                                   \
 *       (lat,l:1,inc:0) --> (kerlo,l:1,inc:1)  (tcan,l:1,inc:0) --> (ja'a,l:1,inc:1)
 * </pre>
 *
 * Tokens that are shorter than {@code minWordSize}, are root or loan words, or fail to
 * classify pass through unchanged.
 */
public class LujvoTokenFilter extends TokenFilter {

    private static final Logger log = LoggerFactory.getLogger(LujvoTokenFilter.class);

    static final int DEFAULT_MIN_WORD_SIZE = 5;
    static final boolean DEFAULT_PRESERVE_ORIGINAL = true;
    static final boolean DEFAULT_EMIT_SOURCE_WORDS = false;

    /** Token type of an emitted rafsi. */
    public static final String RAFSI_TYPE = "rafsi";
    /** Token type of an emitted source word. */
    public static final String SOURCE_WORD_TYPE = "veljvo";

    private final LujvoMorphology morphology;
    private final MorphologySettings settings;
    private final int minWordSize;
    private final boolean preserveOriginal;
    private final boolean emitSourceWords;

    private TokenAttributes currentToken = null;
    private LinkedList<TokenAttributes> tokenQueue;

    private final CharTermAttribute termAttr = addAttribute(CharTermAttribute.class);
    private final OffsetAttribute offsetAttr = addAttribute(OffsetAttribute.class);
    // 0 places a token at the same position as the one before it
    private final PositionIncrementAttribute posIncAttr = addAttribute(PositionIncrementAttribute.class);
    private final PositionLengthAttribute posLengthAttr = addAttribute(PositionLengthAttribute.class);
    private final TypeAttribute typeAttr = addAttribute(TypeAttribute.class);

    public LujvoTokenFilter(TokenStream input) {
        this(input, LujvoMorphology.getDefault(), MorphologySettings.DEFAULT,
                DEFAULT_MIN_WORD_SIZE, DEFAULT_PRESERVE_ORIGINAL, DEFAULT_EMIT_SOURCE_WORDS);
    }

    /**
     * @param input  The TokenStream from lucene
     * @param morphology  Rafsi list and cluster tables to split with
     * @param settings  Morphology rules a token must satisfy
     * @param minWordSize  The minimum length of a term to attempt decompounding on
     * @param preserveOriginal  Output the original token in addition to its pieces
     * @param emitSourceWords  Output the source word of each rafsi instead of the rafsi
     */
    public LujvoTokenFilter(TokenStream input, LujvoMorphology morphology, MorphologySettings settings,
            int minWordSize, boolean preserveOriginal, boolean emitSourceWords) {
        super(input);
        this.morphology = morphology;
        this.settings = settings;
        this.minWordSize = minWordSize;
        this.preserveOriginal = preserveOriginal;
        this.emitSourceWords = emitSourceWords;
        this.setup();
    }

    private void setup() {
        this.tokenQueue = new LinkedList<>();
        this.currentToken = null;
        this.clearAttributes();
    }

    @Override
    public final boolean incrementToken() throws IOException {
        if (tokenQueue.isEmpty()) {
            if (!input.incrementToken()) {
                return false;
            }
            currentToken = this.currentToken();

            if (this.termAttr.length() >= this.minWordSize) {
                tokenQueue = this.decompound(currentToken);
                if (!tokenQueue.isEmpty()) {
                    currentToken.posLength = tokenQueue.size();
                }
            }

            if (preserveOriginal || tokenQueue.isEmpty()) {
                this.setAttributes(currentToken);
                return true;
            }
        }

        this.clearAttributes();
        TokenAttributes token = tokenQueue.pop();
        this.setAttributes(token);
        return true;
    }

    @Override
    public void reset() throws IOException {
        this.setup();
        super.reset();
    }

    /**
     * Pieces of the token in emission order, or an empty queue if it is not a lujvo.
     */
    private LinkedList<TokenAttributes> decompound(TokenAttributes srcToken) {
        LinkedList<TokenAttributes> tokens = new LinkedList<>();
        String term = srcToken.getTerm().toString();
        List<String> terms;
        List<Span> spans;
        try {
            BrivlaAnalysis analysis = morphology.analyse(term, settings);
            WordType type = analysis.getType();
            if (type == WordType.ROOT || type == WordType.LOAN_SHAPE) {
                return tokens;
            }
            spans = LujvoMorphology.rafsiIndices(analysis.getPieces());
            terms = emitSourceWords ? morphology.getVeljvo(term, settings) : rafsiOf(analysis.getPieces());
        } catch (LujvoException e) {
            log.debug("Passing through {}: {}", term, e.getMessage());
            return tokens;
        }
        if (spans.size() < 2 || terms.size() != spans.size()) {
            return tokens;
        }

        // offsets can only be mapped into the token if normalising kept its length
        boolean mapOffsets = srcToken.offsetsMatchTerm() && LujvoMorphology.normalise(term).length() == term.length();
        String pieceType = emitSourceWords ? SOURCE_WORD_TYPE : RAFSI_TYPE;
        for (int i = 0; i < terms.size(); i++) {
            TokenAttributes token = srcToken.piece(terms.get(i), pieceType);
            if (mapOffsets) {
                Span span = spans.get(i);
                token.offsetStart = srcToken.offsetStart + span.start;
                token.offsetEnd = srcToken.offsetStart + span.end;
            }
            if (i > 0) {
                token.posIncrement = 1;
            } else if (preserveOriginal) {
                token.posIncrement = 0;
            }
            tokens.add(token);
        }
        return tokens;
    }

    private static List<String> rafsiOf(List<String> pieces) {
        List<String> rafsi = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            if (!LujvoMorphology.HYPHENS.contains(piece)) {
                rafsi.add(piece);
            }
        }
        return rafsi;
    }

    private void setAttributes(TokenAttributes token) {
        this.termAttr.setEmpty().append(token.getTerm());
        this.offsetAttr.setOffset(token.offsetStart, token.offsetEnd);
        this.posIncAttr.setPositionIncrement(token.posIncrement);
        this.posLengthAttr.setPositionLength(token.posLength);
        this.typeAttr.setType(token.type);
    }

    private TokenAttributes currentToken() {
        TokenAttributes token = new TokenAttributes(
                this.termAttr.toString(),
                this.offsetAttr.startOffset(),
                this.offsetAttr.endOffset(),
                this.posIncAttr.getPositionIncrement(),
                this.posLengthAttr.getPositionLength()
        );
        token.type = this.typeAttr.type();
        return token;
    }
}
