package org.lojban.analysis.lujvo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Entry point for building, splitting and classifying Lojban compound words (lujvo).
 *
 * Instances hold no mutable state and are safe to share between threads. Use
 * {@link #getDefault()} for the bundled rafsi list and cluster tables.
 */
public class LujvoMorphology {

    /**
     * Pieces that only glue rafsi together.
     */
    static final Set<String> HYPHENS = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("r", "n", "y", "'y", "y'", "'y'")));

    private static final String VOWELS = "aeiou";

    private final AffixLookup lookup;
    private final Phonotactics phonotactics;
    private final RafsiCandidates candidates;
    private final LujvoBuilder builder;
    private final LujvoSplitter splitter;
    private final ZihevlaChecker zihevlaChecker;
    private final BrivlaAnalyzer analyzer;

    private static final class Holder {
        static final LujvoMorphology DEFAULT =
                new LujvoMorphology(RafsiDictionary.getDefault(), ClusterTables.getDefault());
    }

    public LujvoMorphology(AffixLookup lookup, ClusterTables tables) {
        this.lookup = lookup;
        this.phonotactics = new Phonotactics(tables);
        this.candidates = new RafsiCandidates(this);
        this.builder = new LujvoBuilder(this);
        this.splitter = new LujvoSplitter(this);
        this.zihevlaChecker = new ZihevlaChecker(this);
        this.analyzer = new BrivlaAnalyzer(this);
    }

    public static LujvoMorphology getDefault() {
        return Holder.DEFAULT;
    }

    AffixLookup lookup() {
        return lookup;
    }

    Phonotactics phonotactics() {
        return phonotactics;
    }

    RafsiCandidates candidates() {
        return candidates;
    }

    LujvoBuilder builder() {
        return builder;
    }

    LujvoSplitter splitter() {
        return splitter;
    }

    ZihevlaChecker zihevlaChecker() {
        return zihevlaChecker;
    }

    BrivlaAnalyzer analyzer() {
        return analyzer;
    }

    /**
     * Converts a word to its standard spelling: one leading period removed, lower case,
     * {@code h} written as an apostrophe, commas dropped.
     */
    public static String normalise(String word) {
        if (word.isEmpty()) {
            return word;
        }
        String result = word.charAt(0) == '.' ? word.substring(1) : word;
        return result.toLowerCase(Locale.ROOT).replace('h', '\'').replace(",", "");
    }

    /**
     * Splits a tanru on whitespace and normalises every component.
     */
    static List<String> processTanru(String tanru) {
        String trimmed = tanru.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        return processTanru(Arrays.asList(trimmed.split("\\s+")));
    }

    static List<String> processTanru(List<String> tanru) {
        List<String> result = new ArrayList<>(tanru.size());
        for (String valsi : tanru) {
            result.add(normalise(valsi));
        }
        return result;
    }

    /**
     * Best lujvo for a whitespace separated tanru.
     *
     * @param generateCmevla build a consonant-final name instead of a brivla
     */
    public String getLujvo(String tanru, boolean generateCmevla, MorphologySettings settings) throws LujvoException {
        return getLujvoWithAnalytics(tanru, generateCmevla, settings).getLujvo();
    }

    public String getLujvo(List<String> tanru, boolean generateCmevla, MorphologySettings settings)
            throws LujvoException {
        return getLujvoWithAnalytics(tanru, generateCmevla, settings).getLujvo();
    }

    /**
     * Best lujvo together with its score and the position of every rafsi in it.
     */
    public LujvoResult getLujvoWithAnalytics(String tanru, boolean generateCmevla, MorphologySettings settings)
            throws LujvoException {
        return builder.build(processTanru(tanru), generateCmevla, settings);
    }

    public LujvoResult getLujvoWithAnalytics(List<String> tanru, boolean generateCmevla, MorphologySettings settings)
            throws LujvoException {
        return builder.build(processTanru(tanru), generateCmevla, settings);
    }

    /**
     * Splits a lujvo into rafsi and hyphens and checks it is in canonical form.
     *
     * @throws MalformedWordException if the word splits but is not what the builder makes
     */
    public List<String> decompose(String word, MorphologySettings settings) throws LujvoException {
        return decompose(word, false, settings);
    }

    /**
     * @param allowRnHyphens accept superfluous {@code r} and {@code n} hyphens
     */
    public List<String> decompose(String word, boolean allowRnHyphens, MorphologySettings settings)
            throws LujvoException {
        return splitter.decompose(normalise(word), allowRnHyphens, settings);
    }

    /**
     * Greedy split without the canonical form check.
     */
    public List<String> split(String word, MorphologySettings settings) throws LujvoException {
        return splitter.split(normalise(word), settings);
    }

    /**
     * Classifies a word and returns its pieces.
     *
     * @throws LujvoException {@link ErrorKind#NOT_BRIVLA} if the word is not a brivla or a
     *         decomposable name
     */
    public BrivlaAnalysis analyse(String word, MorphologySettings settings) throws LujvoException {
        return analyzer.analyse(word, settings);
    }

    public boolean isBrivla(String word, MorphologySettings settings) {
        return analyzer.isBrivla(word, settings);
    }

    public boolean isGismu(String word, boolean allowMz) {
        return phonotactics.isGismu(normalise(word), allowMz);
    }

    public boolean isValidRafsi(String rafsi, boolean allowMz) {
        return phonotactics.isValidRafsi(normalise(rafsi), allowMz);
    }

    public boolean isGismuOrLujvo(String word, boolean allowRnHyphens, boolean allowMz) throws LujvoException {
        return analyzer.isGismuOrLujvo(normalise(word), allowRnHyphens, allowMz);
    }

    /**
     * Whether a CV cmavo in front of the word would fuse with it.
     */
    public boolean isSlinkuhi(String word, boolean allowMz) throws LujvoException {
        return analyzer.isSlinkuhi(normalise(word), allowMz);
    }

    /**
     * Start and end of every piece that is not a hyphen, in the word the pieces spell.
     */
    public static List<Span> rafsiIndices(List<String> pieces) {
        List<Span> spans = new ArrayList<>(pieces.size());
        int position = 0;
        for (String piece : pieces) {
            if (!HYPHENS.contains(piece)) {
                spans.add(new Span(position, position + piece.length()));
            }
            position += piece.length();
        }
        return spans;
    }

    /**
     * Source words of a lujvo (veljvo), one per rafsi. Rafsi without a source word are
     * written as explicit components: {@code -raf-}, or {@code raf-} when adding an
     * {@code a} makes a word.
     *
     * @throws LujvoException {@link ErrorKind#DECOMPOSITION_FAILED} if the word is not a
     *         lujvo or a name
     */
    public List<String> getVeljvo(String word, MorphologySettings settings) throws LujvoException {
        return veljvoOf(analyzer.analyse(word, settings), settings.isAllowMz());
    }

    private List<String> veljvoOf(BrivlaAnalysis analysis, boolean allowMz) throws LujvoException {
        WordType type = analysis.getType();
        if (type != WordType.COMPOUND && type != WordType.EXTENDED_COMPOUND && type != WordType.NAME) {
            throw new LujvoException(ErrorKind.DECOMPOSITION_FAILED, "Valsi is of type " + type);
        }
        return sourceWords(analysis.getPieces(), allowMz);
    }

    private List<String> sourceWords(List<String> pieces, boolean allowMz) {
        MorphologySettings standard = MorphologySettings.standard(allowMz);
        List<String> result = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            String piece = pieces.get(i);
            if (HYPHENS.contains(piece)) {
                continue;
            }
            String selrafsi = selrafsi(piece);
            if (selrafsi != null) {
                result.add(selrafsi);
            } else if (i < pieces.size() - 2 && pieces.get(i + 1).charAt(0) == 'y'
                    && analyzer.isBrivla(piece + "a", standard)) {
                result.add(piece + "-");
            } else if (analyzer.isBrivla(piece, standard)) {
                result.add(piece);
            } else if (i == pieces.size() - 1 && analyzer.isBrivla(piece + "a", standard)) {
                result.add(piece + "-");
            } else {
                result.add("-" + piece + "-");
            }
        }
        return result;
    }

    /**
     * Source word of a rafsi, or {@code null}. A four letter rafsi is first read as a
     * root word with its last vowel dropped.
     */
    String selrafsi(String rafsi) {
        if (!rafsi.equals("brod") && rafsi.length() == 4 && rafsi.indexOf('\'') < 0) {
            for (int i = 0; i < VOWELS.length(); i++) {
                String gismu = rafsi + VOWELS.charAt(i);
                if (lookup.contains(gismu)) {
                    return gismu;
                }
            }
        }
        return lookup.valsiForRafsi(rafsi);
    }

    /**
     * Score the builder would give the word, summed over its pieces.
     *
     * @throws LujvoException if the word is not a lujvo or a name
     */
    public int scoreLujvo(String word, MorphologySettings settings) throws LujvoException {
        BrivlaAnalysis analysis = analyzer.analyse(word, settings);
        veljvoOf(analysis, settings.isAllowMz());
        int score = 0;
        for (String piece : analysis.getPieces()) {
            if (piece.equals("y") || piece.equals("n") || piece.equals("r")) {
                score += 1100 * piece.length();
            } else {
                score += LujvoBuilder.score(piece);
            }
        }
        return score;
    }
}
