package org.lojban.analysis.lujvo;

import static org.lojban.analysis.lujvo.Letters.isConsonant;
import static org.lojban.analysis.lujvo.Letters.isVowel;

/**
 * Morphology rules specific to zi'evla and experimental rafsi shapes.
 *
 * A word that passes may still be invalid as a whole; the classifier checks the rest.
 */
final class ZihevlaChecker {

    private final LujvoMorphology morphology;

    ZihevlaChecker(LujvoMorphology morphology) {
        this.morphology = morphology;
    }

    /**
     * @param requireZihevla reject anything without a consonant cluster
     * @param expRafsiShapes allow one-syllable and vowel-initial shapes
     * @throws LujvoException {@link ErrorKind#NOT_ZIHEVLA} if a rule fails
     */
    WordShape check(final String valsi, boolean requireZihevla, boolean expRafsiShapes, boolean allowMz)
            throws LujvoException {
        if (requireZihevla && valsi.length() < 4) {
            throw notZihevla("too short to be zi'evla: {" + valsi + "}");
        }
        if (valsi.isEmpty()) {
            throw notZihevla("empty string");
        }
        final Phonotactics phonotactics = morphology.phonotactics();
        final ClusterTables tables = phonotactics.tables();
        final int len = valsi.length();

        int pos = 0;
        int numSyllables = 0;
        int clusterPos = -1;
        int numConsonants = 0;
        int finalConsonantPos = 0;

        while (pos < len) {
            char c = valsi.charAt(pos);
            int end = pos + 1;
            if (isConsonant(c)) {
                while (end < len && isConsonant(valsi.charAt(end))) {
                    end++;
                }
                String chunk = valsi.substring(pos, end);
                if (chunk.length() >= 2 && clusterPos < 0) {
                    if (numConsonants > 1) {
                        throw notZihevla("too many consonants before first cluster: {" + valsi + "}");
                    }
                    clusterPos = pos;
                }
                if (numSyllables == 0 && chunk.length() >= 2 && !tables.isInitial(chunk.substring(0, 2))) {
                    throw notZihevla("invalid word initial: {" + valsi + "}");
                }
                for (int i = 0; i < chunk.length() - 1; i++) {
                    String pair = chunk.substring(i, i + 2);
                    if (!tables.isValid(pair, allowMz)) {
                        throw notZihevla("invalid cluster {" + pair + "} in {" + valsi + "}");
                    }
                }
                for (int i = 0; i < chunk.length() - 2; i++) {
                    String triple = chunk.substring(i, i + 3);
                    if (tables.isBannedTriple(triple)) {
                        throw notZihevla("banned triple {" + triple + "} in {" + valsi + "}");
                    }
                }
                if (pos == 0) {
                    if (!phonotactics.isZihevlaInitialCluster(chunk)) {
                        throw notZihevla("invalid zi'evla initial cluster {" + chunk + "} in word {" + valsi + "}");
                    }
                } else if (!phonotactics.isZihevlaMiddleCluster(chunk)) {
                    throw notZihevla("invalid zi'evla middle cluster {" + chunk + "} in word {" + valsi + "}");
                }
                finalConsonantPos = pos;
                numConsonants += chunk.length();
            } else if (isVowel(c)) {
                while (end < len && isVowel(valsi.charAt(end))) {
                    end++;
                }
                String chunk = valsi.substring(pos, end);
                if (pos == 0) {
                    if (!tables.isStartVowelCluster(chunk) && !tables.isFollowVowelCluster(chunk)) {
                        throw notZihevla("starts with bad vowels: {" + valsi + "}");
                    }
                    numSyllables++;
                } else {
                    try {
                        numSyllables += phonotactics.splitVowelCluster(chunk).size();
                    } catch (LujvoException e) {
                        throw new LujvoException(ErrorKind.NOT_ZIHEVLA,
                                "vowel decomp error: {" + chunk + "} in {" + valsi + "}", e);
                    }
                }
            } else if (c == '\'') {
                if (pos < 1 || !isVowel(valsi.charAt(pos - 1))) {
                    throw notZihevla("' not preceded by vowel");
                }
                if (end >= len || !isVowel(valsi.charAt(end))) {
                    throw notZihevla("' not followed by vowel");
                }
            } else {
                throw notZihevla("unexpected character {" + c + "} in {" + valsi + "}");
            }
            pos = end;
        }

        if (numSyllables < 2 && (requireZihevla || !expRafsiShapes)) {
            throw notZihevla("too few syllables: {" + valsi + "}");
        } else if (numSyllables > 2 && clusterPos > 0) {
            // the part from the cluster on must not be a word of its own
            MorphologySettings standard = MorphologySettings.DEFAULT;
            if (morphology.analyzer().isBrivla(valsi.substring(clusterPos), standard)) {
                throw notZihevla("falls apart at cluster: {" + valsi.substring(0, clusterPos) + "_"
                        + valsi.substring(clusterPos) + "}");
            }
            for (int i = 0; i < clusterPos; i++) {
                int at = clusterPos - i;
                if (isConsonant(valsi.charAt(at)) && morphology.analyzer().isBrivla(valsi.substring(at), standard)) {
                    throw notZihevla("falls apart before cluster: {" + valsi.substring(0, at) + "_"
                            + valsi.substring(at) + "}");
                }
            }
        }

        if (clusterPos < 0) {
            if (requireZihevla) {
                throw notZihevla("no cluster: {" + valsi + "}");
            }
            if (!isConsonant(valsi.charAt(0)) && !expRafsiShapes) {
                throw notZihevla("not valid rafsi shape: {" + valsi + "}");
            }
            if (numConsonants > 1) {
                throw notZihevla("too many consonants without cluster: {" + valsi + "}");
            }
            if (finalConsonantPos > 0) {
                throw notZihevla("non-initial consonant(s) without cluster: {" + valsi + "}");
            }
            return WordShape.RAFSI_SHAPE;
        }

        boolean vowelConsonantStart = len > 1 && isVowel(valsi.charAt(0)) && isConsonant(valsi.charAt(1));
        if (!vowelConsonantStart && morphology.analyzer().isSlinkuhi(valsi, allowMz)) {
            throw notZihevla("slinku'i: {to," + valsi + "}");
        }
        return WordShape.LOAN_SHAPE;
    }

    private static LujvoException notZihevla(String message) {
        return new LujvoException(ErrorKind.NOT_ZIHEVLA, message);
    }
}
