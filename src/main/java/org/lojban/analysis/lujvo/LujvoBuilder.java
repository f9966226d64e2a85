package org.lojban.analysis.lujvo;

import static org.lojban.analysis.lujvo.Letters.containsConsonant;
import static org.lojban.analysis.lujvo.Letters.head;
import static org.lojban.analysis.lujvo.Letters.isConsonant;
import static org.lojban.analysis.lujvo.Letters.isGlide;
import static org.lojban.analysis.lujvo.Letters.isVowel;
import static org.lojban.analysis.lujvo.Letters.last;
import static org.lojban.analysis.lujvo.Letters.slice;
import static org.lojban.analysis.lujvo.Letters.stripHyphens;

import java.util.ArrayList;
import java.util.List;

import org.lojban.analysis.lujvo.MorphologySettings.ConsonantRule;
import org.lojban.analysis.lujvo.MorphologySettings.YHyphens;

/**
 * Builds the best scoring lujvo for a list of tanru components (jvozba).
 *
 * Components are added left to right. After each step only the best partial word is kept
 * for every combination of truncation risk, consonant count (capped at two) and final
 * letter, so the search stays linear in the number of components.
 */
final class LujvoBuilder {

    /**
     * Ways the word built so far could still fall apart.
     */
    enum Ambiguity {
        NONE,
        /** A leading CVC rafsi that a following CCV start could swallow (tosmabru). */
        RISK_RAFSI_TRUNCATION,
        /** A leading CVC+y that a following {@code 'V} could turn into cmavo (tosy'u'u). */
        RISK_APOSTROPHE_GLIDE
    }

    /**
     * A word in progress.
     */
    static final class Partial {
        final Ambiguity ambiguity;
        final int consonants;
        final int score;
        final String lujvo;
        final List<Span> spans;

        Partial(Ambiguity ambiguity, int consonants, int score, String lujvo, List<Span> spans) {
            this.ambiguity = ambiguity;
            this.consonants = consonants;
            this.score = score;
            this.lujvo = lujvo;
            this.spans = spans;
        }
    }

    /**
     * Best partial word per (ambiguity, consonants, final letter). Slots remember the order
     * in which they were first filled, and ties keep the earlier entry.
     */
    static final class StateTable {
        private static final String FINALS = "'abcdefgijklmnoprstuvxyz";

        private final Partial[][][] best = new Partial[3][3][FINALS.length()];
        private final int[][][] order = new int[3][3][FINALS.length()];
        private final int[][] filled = new int[3][3];

        void offer(Partial candidate) {
            if (candidate == null) {
                return;
            }
            int a = candidate.ambiguity.ordinal();
            int c = candidate.consonants;
            int f = FINALS.indexOf(last(candidate.lujvo));
            if (f < 0) {
                throw new IllegalStateException("Unexpected final letter in " + candidate.lujvo);
            }
            Partial current = best[a][c][f];
            if (current == null) {
                order[a][c][filled[a][c]++] = f;
                best[a][c][f] = candidate;
            } else if (current.score > candidate.score) {
                best[a][c][f] = candidate;
            }
        }

        List<Partial> entries(int ambiguity, int consonants) {
            List<Partial> result = new ArrayList<>(filled[ambiguity][consonants]);
            for (int i = 0; i < filled[ambiguity][consonants]; i++) {
                result.add(best[ambiguity][consonants][order[ambiguity][consonants][i]]);
            }
            return result;
        }
    }

    private final LujvoMorphology morphology;

    LujvoBuilder(LujvoMorphology morphology) {
        this.morphology = morphology;
    }

    /**
     * Score of a rafsi together with any hyphen it carries.
     */
    static int score(String rafsi) {
        int apostrophes = 0;
        int ys = 0;
        int vowels = 0;
        for (int i = 0; i < rafsi.length(); i++) {
            char c = rafsi.charAt(i);
            if (c == '\'') {
                apostrophes++;
            } else if (c == 'y') {
                ys++;
            } else if (isVowel(c)) {
                vowels++;
            }
        }
        return 1000 * rafsi.length()
                - 400 * apostrophes
                + 100 * ys
                - 10 * Shape.ignoringHyphens(rafsi).rank()
                - vowels;
    }

    /**
     * Builds the lujvo for already normalised components.
     *
     * @param generateCmevla build a consonant-final name instead of a brivla
     * @throws LujvoException if a component is invalid or no lujvo can be formed
     */
    LujvoResult build(List<String> valsiList, boolean generateCmevla, MorphologySettings settings)
            throws LujvoException {
        if (valsiList.isEmpty()) {
            throw new LujvoException(ErrorKind.NO_LUJVO_FOUND, "No lujvo found for {}");
        }
        List<List<RafsiCandidate>> candidates = morphology.candidates().forTanru(valsiList, settings);

        StateTable current = new StateTable();
        if (candidates.size() == 1) {
            for (RafsiCandidate only : candidates.get(0)) {
                current.offer(start(only, generateCmevla));
            }
        } else {
            for (RafsiCandidate first : candidates.get(0)) {
                Partial start = start(first, generateCmevla);
                for (RafsiCandidate second : candidates.get(1)) {
                    current.offer(combine(start, second, generateCmevla, candidates.size(), settings));
                }
            }
            for (List<RafsiCandidate> rafsiList : candidates.subList(2, candidates.size())) {
                StateTable next = new StateTable();
                for (RafsiCandidate rafsi : rafsiList) {
                    for (int a = 0; a < 3; a++) {
                        for (int c = 0; c < 3; c++) {
                            for (Partial partial : current.entries(a, c)) {
                                next.offer(combine(partial, rafsi, generateCmevla, 0, settings));
                            }
                        }
                    }
                }
                current = next;
            }
        }

        Partial best = null;
        for (Partial partial : current.entries(Ambiguity.NONE.ordinal(), 2)) {
            char end = last(partial.lujvo);
            boolean wanted = generateCmevla ? isConsonant(end) : isVowel(end);
            if (wanted && (best == null || partial.score < best.score)) {
                best = partial;
            }
        }
        if (best == null) {
            throw new LujvoException(ErrorKind.NO_LUJVO_FOUND, "No lujvo found for {" + String.join(" ", valsiList) + "}");
        }
        return new LujvoResult(best.lujvo, best.score, best.spans);
    }

    private static Partial start(RafsiCandidate rafsi, boolean generateCmevla) {
        Ambiguity ambiguity;
        if (Shape.ignoringHyphens(rafsi.form) != Shape.CVC || generateCmevla) {
            ambiguity = Ambiguity.NONE;
        } else if (last(rafsi.form) == 'y') {
            ambiguity = Ambiguity.RISK_APOSTROPHE_GLIDE;
        } else {
            ambiguity = Ambiguity.RISK_RAFSI_TRUNCATION;
        }
        List<Span> spans = new ArrayList<>(1);
        spans.add(new Span(0, stripHyphens(rafsi.form).length()));
        return new Partial(ambiguity, rafsi.consonants, score(rafsi.form), rafsi.form, spans);
    }

    /**
     * Appends one rafsi to a partial word, choosing the hyphen. Returns {@code null} when
     * the join is not allowed.
     *
     * @param tanruLen number of components; only passed for the first join
     */
    Partial combine(Partial partial, RafsiCandidate candidate, boolean generateCmevla, int tanruLen,
            MorphologySettings settings) {
        final String lujvo = partial.lujvo;
        final String rafsi = candidate.form;
        final char lujvoEnd = last(lujvo);
        final char rafsiStart = rafsi.charAt(0);
        final ClusterTables tables = morphology.phonotactics().tables();
        final boolean lujvoEndsInHyphen = lujvoEnd == 'y' || lujvoEnd == '\'';

        if (isConsonant(lujvoEnd) && isConsonant(rafsiStart)
                && !tables.isValid("" + lujvoEnd + rafsiStart, settings.isAllowMz())) {
            return null;
        }
        if (!lujvoEndsInHyphen && rafsiStart == '\'') {
            return null;
        }
        if (tables.isBannedTriple(lujvoEnd + head(rafsi, 2))) {
            return null;
        }
        Shape rafsiShape = Shape.ignoringHyphens(rafsi);
        if (!lujvoEndsInHyphen && rafsiShape == Shape.OTHER) {
            return null;
        }

        String hyphen = "";
        if (lujvoEnd == '\'') {
            if (rafsiStart == '\'' || settings.getYHyphens() != YHyphens.STANDARD) {
                hyphen = "y";
            } else {
                return null;
            }
        } else if (lujvo.length() <= 5 && !generateCmevla) {
            Shape lujvoShape = Shape.ignoringHyphens(lujvo);
            if (lujvoShape == Shape.CVHV || lujvoShape == Shape.CVV) {
                if (settings.getYHyphens() == YHyphens.FORCE_Y) {
                    hyphen = "'y";
                } else if (rafsiStart == 'r') {
                    hyphen = "n";
                } else {
                    hyphen = "r";
                }
            }
            if (tanruLen == 2 && rafsiShape == Shape.CCV) {
                hyphen = "";
            }
        }

        Ambiguity ambiguity = partial.ambiguity;
        if (ambiguity == Ambiguity.RISK_RAFSI_TRUNCATION) {
            if (!tables.isInitial("" + lujvoEnd + rafsiStart)) {
                ambiguity = Ambiguity.NONE;
            } else if (rafsiShape == Shape.CVCCV) {
                if (tables.isInitial(slice(rafsi, 2, 4))) {
                    return null;
                }
                ambiguity = Ambiguity.NONE;
            } else if (rafsiShape == Shape.CVC) {
                if (last(rafsi) == 'y') {
                    return null;
                }
            } else {
                ambiguity = Ambiguity.NONE;
            }
        } else if (ambiguity == Ambiguity.RISK_APOSTROPHE_GLIDE) {
            if (rafsiStart != '\'' || containsConsonant(rafsi)) {
                ambiguity = Ambiguity.NONE;
            }
        }

        int rafsiStartPos = lujvo.length() + hyphen.length() + (rafsiStart == '\'' ? 1 : 0);
        List<Span> spans = new ArrayList<>(partial.spans.size() + 1);
        spans.addAll(partial.spans);
        spans.add(new Span(rafsiStartPos, rafsiStartPos + stripHyphens(rafsi).length()));

        int newConsonants = candidate.consonants;
        if (hyphen.equals("n") || hyphen.equals("r")) {
            newConsonants = 2;
        } else if (settings.getConsonants() == ConsonantRule.CLUSTER && candidate.consonants != 2) {
            int i = lujvo.length() - 1;
            while (i > 0 && (lujvo.charAt(i) == '\'' || lujvo.charAt(i) == 'y')) {
                i--;
            }
            int j = 0;
            while (j < rafsi.length() - 1 && rafsi.charAt(j) == '\'') {
                j++;
            }
            boolean touching = isConsonant(lujvo.charAt(i))
                    && (isConsonant(rafsi.charAt(j)) || (settings.isGlides() && isGlide(rafsi.substring(j))));
            newConsonants = touching ? 2 : 0;
        }
        int totalConsonants = Math.min(2, partial.consonants + newConsonants);
        if (settings.getConsonants() == ConsonantRule.ONE_CONSONANT && totalConsonants > 0) {
            totalConsonants = 2;
        }

        int hyphenScore = hyphen.equals("'y") ? 1700 : 1100 * hyphen.length();
        return new Partial(ambiguity, totalConsonants, partial.score + hyphenScore + score(rafsi),
                lujvo + hyphen + rafsi, spans);
    }
}
