package org.lojban.analysis.lujvo;

import static org.lojban.analysis.lujvo.Letters.dropLast;
import static org.lojban.analysis.lujvo.Letters.head;
import static org.lojban.analysis.lujvo.Letters.isConsonant;
import static org.lojban.analysis.lujvo.Letters.isGlide;
import static org.lojban.analysis.lujvo.Letters.isVowel;
import static org.lojban.analysis.lujvo.Letters.last;
import static org.lojban.analysis.lujvo.Letters.stripHyphens;
import static org.lojban.analysis.lujvo.Letters.tail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lojban.analysis.lujvo.MorphologySettings.ConsonantRule;
import org.lojban.analysis.lujvo.MorphologySettings.YHyphens;

/**
 * Classifies a word as root, compound, extended compound, loan word or name, and
 * returns its pieces.
 *
 * Strategies are tried in order: root word, regular lujvo via {@link LujvoSplitter},
 * single loan word, and finally a walk over the {@code y}-separated parts for extended
 * lujvo.
 */
final class BrivlaAnalyzer {

    private final LujvoMorphology morphology;

    BrivlaAnalyzer(LujvoMorphology morphology) {
        this.morphology = morphology;
    }

    /**
     * @throws LujvoException {@link ErrorKind#NOT_BRIVLA} if the word is neither a brivla
     *         nor a decomposable name
     */
    BrivlaAnalysis analyse(String word, MorphologySettings settings) throws LujvoException {
        try {
            return classify(word, settings);
        } catch (LujvoException e) {
            if (e.getKind() == ErrorKind.NOT_BRIVLA) {
                throw e;
            }
            throw new LujvoException(ErrorKind.NOT_BRIVLA, e.getMessage(), e);
        }
    }

    private BrivlaAnalysis classify(String word, MorphologySettings settings) throws LujvoException {
        final String valsi = LujvoMorphology.normalise(word);
        final Phonotactics phonotactics = morphology.phonotactics();
        final YHyphens yHyphens = settings.getYHyphens();
        final boolean allowMz = settings.isAllowMz();

        if (valsi.isEmpty()) {
            throw notBrivla("empty string");
        }
        final boolean cmevlatai;
        if (isConsonant(last(valsi))) {
            cmevlatai = true;
        } else if (isVowel(last(valsi))) {
            cmevlatai = false;
        } else {
            throw notBrivla("doesn't end in consonant or vowel: {" + valsi + "}");
        }

        if (cmevlatai) {
            if (phonotactics.isGismu(valsi + "a", allowMz)) {
                throw notBrivla("non-decomposable cmevla: {" + valsi + "}");
            }
        } else if (phonotactics.isGismu(valsi, allowMz)) {
            return new BrivlaAnalysis(WordType.ROOT, Collections.singletonList(valsi));
        }

        try {
            List<String> pieces = morphology.splitter().decompose(valsi, yHyphens != YHyphens.FORCE_Y, settings);
            return new BrivlaAnalysis(cmevlatai ? WordType.NAME : WordType.COMPOUND, pieces);
        } catch (LujvoException e) {
            if (!e.isDecompositionFailure()) {
                throw e;
            }
        }

        if (!(isVowel(valsi.charAt(0)) || isConsonant(valsi.charAt(0)))) {
            throw notBrivla("doesn't start with vowel or consonant: {" + valsi + "}");
        }

        String[] yParts = valsi.split("y", -1);
        if (yParts.length == 1) {
            if (cmevlatai) {
                throw notBrivla("non-decomposable cmevla: {" + valsi + "}");
            }
            try {
                morphology.zihevlaChecker().check(valsi, true, settings.isExpRafsiShapes(), allowMz);
            } catch (LujvoException e) {
                throw new LujvoException(ErrorKind.NOT_BRIVLA, "no hyphens, and not valid zi'evla", e);
            }
            return new BrivlaAnalysis(WordType.LOAN_SHAPE, Collections.singletonList(valsi));
        }

        List<String> resultParts = walkParts(valsi, yParts, cmevlatai, settings);

        if (!(valsi.length() > 1 && isVowel(valsi.charAt(0))
                && (isConsonant(valsi.charAt(1)) || valsi.charAt(1) == 'y'))) {
            if (isSlinkuhi(valsi, allowMz)) {
                throw notBrivla("slinku'i");
            }
        }
        return new BrivlaAnalysis(cmevlatai ? WordType.NAME : WordType.EXTENDED_COMPOUND, resultParts);
    }

    /**
     * Checks each {@code y}-separated part of an extended lujvo and collects the pieces.
     */
    private List<String> walkParts(String valsi, String[] yParts, boolean cmevlatai, MorphologySettings settings)
            throws LujvoException {
        final Phonotactics phonotactics = morphology.phonotactics();
        final YHyphens yHyphens = settings.getYHyphens();
        final boolean allowMz = settings.isAllowMz();
        final boolean expRafsiShapes = settings.isExpRafsiShapes();

        List<String> resultParts = new ArrayList<>();
        StringBuilder nextHyphen = new StringBuilder();
        boolean hasCluster = false;
        boolean isMahortai = true;
        boolean consonantBeforeBreak = false;
        int numConsonants = 0;

        for (int i = 0; i < yParts.length; i++) {
            String part = yParts[i];
            if (i != 0) {
                nextHyphen.append('y');
            }
            String partCopy = part;
            if (part.isEmpty()) {
                throw notBrivla("double y");
            }
            if (part.charAt(0) == '\'') {
                part = part.substring(1);
                partCopy = part;
                nextHyphen.append('\'');
                if (part.isEmpty()) {
                    throw notBrivla("that was only a '");
                }
                if (!(isVowel(part.charAt(0)) && !isGlide(part))) {
                    throw notBrivla("consonant or glide after ': {" + part + "}");
                }
            } else if (i > 0 && isVowel(part.charAt(0)) && !isGlide(part)) {
                throw notBrivla("non-glide vowel after y: {" + part + "}");
            }
            if (nextHyphen.length() > 0) {
                resultParts.add(nextHyphen.toString());
                nextHyphen.setLength(0);
            }

            if (Shape.of(part) == Shape.CVC) {
                resultParts.add(part);
                consonantBeforeBreak = true;
                numConsonants += 2;
                continue;
            }
            if (Shape.of(part + "a") == Shape.CCV) {
                throw notBrivla("can't drop vowel on CCV rafsi");
            }

            if (i > 0 && (isConsonant(part.charAt(0)) || isGlide(part))) {
                isMahortai = false;
            }
            if (consonantBeforeBreak && (isConsonant(part.charAt(0)) || (settings.isGlides() && isGlide(part)))) {
                hasCluster = true;
            }

            boolean canBeRafsi = true;
            boolean requireCluster = false;
            boolean didAddA = false;
            if (last(part) == '\'') {
                boolean nextStartsWithApostrophe = i < yParts.length - 1
                        && !yParts[i + 1].isEmpty() && yParts[i + 1].charAt(0) == '\'';
                if (yHyphens == YHyphens.STANDARD && !hasCluster && i < yParts.length - 1 && !nextStartsWithApostrophe) {
                    requireCluster = true;
                }
                part = dropLast(part);
                partCopy = part;
                nextHyphen.append('\'');
                if (part.isEmpty() || !isVowel(last(part))) {
                    throw notBrivla("non-vowel before ': " + part);
                }
            } else if (i < yParts.length - 1 || cmevlatai) {
                if (isVowel(last(part))) {
                    canBeRafsi = false;
                }
                part = part + "a";
                didAddA = true;
                requireCluster = true;
            }

            boolean didKaha = false;
            if (canBeRafsi) {
                List<String> foundParts = Collections.singletonList(part);
                List<String> split = splitOrNull(partCopy, settings);
                if (split != null && !split.isEmpty()) {
                    if (split.size() < 2 && !phonotactics.isValidRafsi(split.get(0), allowMz)) {
                        throw notBrivla("invalid rafsi: {" + split.get(0) + "}");
                    }
                    foundParts = split;
                    resultParts.addAll(split);
                    didKaha = true;
                }
                for (String piece : foundParts) {
                    Shape shape = Shape.of(piece);
                    if (shape == Shape.CVV || shape == Shape.CVHV) {
                        numConsonants += 1;
                    } else if (shape != Shape.OTHER) {
                        numConsonants += 2;
                        hasCluster = true;
                    }
                }
            }

            if (didKaha) {
                Shape shape = Shape.of(part);
                if ((shape == Shape.CVV || shape == Shape.CVHV) && requireCluster && !hasCluster) {
                    Shape second = Shape.of(yParts[1]);
                    boolean twoPartException = i == yParts.length - 2 && (second == Shape.CVV || second == Shape.CCV);
                    if (yHyphens == YHyphens.STANDARD || !twoPartException) {
                        throw notBrivla("falls off because y");
                    }
                }
                if (i == 0) {
                    checkTosmabru(part, didAddA, allowMz);
                }
            } else {
                boolean requireZihevla = requireCluster || !expRafsiShapes;
                WordShape shape;
                try {
                    shape = morphology.zihevlaChecker().check(part, requireZihevla, expRafsiShapes, allowMz);
                } catch (LujvoException e) {
                    throw new LujvoException(ErrorKind.NOT_BRIVLA, e.getMessage(), e);
                }
                if (shape == WordShape.LOAN_SHAPE) {
                    hasCluster = true;
                }
                if (isConsonant(part.charAt(0)) || (settings.isGlides() && isGlide(part))) {
                    numConsonants++;
                }
                resultParts.add(partCopy);
            }
            consonantBeforeBreak = false;
        }

        if (!hasCluster) {
            ConsonantRule rule = settings.getConsonants();
            if (rule == ConsonantRule.CLUSTER) {
                throw notBrivla("no clusters");
            } else if (rule == ConsonantRule.TWO_CONSONANTS && numConsonants < 2) {
                throw notBrivla("not enough consonants");
            } else if (rule == ConsonantRule.ONE_CONSONANT && numConsonants < 1) {
                throw notBrivla("not enough consonants");
            } else if (isMahortai) {
                throw notBrivla("cmavo shaped or maybe multiple cmavo shaped");
            }
        }
        return resultParts;
    }

    /**
     * The first part must not lose a leading CV, CVV or CV'V and leave a valid rafsi or
     * lujvo behind.
     */
    private void checkTosmabru(String part, boolean didAddA, boolean allowMz) throws LujvoException {
        String smabruPart = "";
        if (Shape.of(head(part, 4)) == Shape.CVHV) {
            smabruPart = tail(part, 4);
        } else if (Shape.of(head(part, 3)) == Shape.CVV) {
            smabruPart = tail(part, 3);
        } else if (part.length() > 1 && isConsonant(part.charAt(0)) && isVowel(part.charAt(1))) {
            smabruPart = tail(part, 2);
        }
        if (smabruPart.isEmpty()) {
            return;
        }
        smabruPart = didAddA ? dropLast(smabruPart) : stripHyphens(smabruPart);
        if (morphology.phonotactics().isValidRafsi(smabruPart, false)) {
            throw notBrivla("tosmabru");
        }
        if (decomposes(smabruPart, false, MorphologySettings.standard(allowMz))) {
            throw notBrivla("tosmabru");
        }
    }

    boolean isBrivla(String valsi, MorphologySettings settings) {
        try {
            return analyse(valsi, settings).getType() != WordType.NAME;
        } catch (LujvoException e) {
            return false;
        }
    }

    /**
     * True if a leading CV cmavo would merge with the word into a lujvo (slinku'i).
     */
    boolean isSlinkuhi(String valsi, boolean allowMz) throws LujvoException {
        return decomposes("to" + valsi, true, MorphologySettings.standard(allowMz));
    }

    boolean isGismuOrLujvo(String valsi, boolean allowRnHyphens, boolean allowMz) throws LujvoException {
        if (valsi.length() < 5 || !isVowel(last(valsi))) {
            return false;
        }
        if (morphology.phonotactics().isGismu(valsi, allowMz)) {
            return true;
        }
        return decomposes(valsi, allowRnHyphens, MorphologySettings.standard(allowMz));
    }

    private boolean decomposes(String valsi, boolean allowRnHyphens, MorphologySettings settings)
            throws LujvoException {
        try {
            morphology.splitter().decompose(valsi, allowRnHyphens, settings);
            return true;
        } catch (LujvoException e) {
            if (!e.isDecompositionFailure()) {
                throw e;
            }
            return false;
        }
    }

    private List<String> splitOrNull(String part, MorphologySettings settings) throws LujvoException {
        try {
            return morphology.splitter().split(part, settings);
        } catch (LujvoException e) {
            if (!e.isDecompositionFailure()) {
                throw e;
            }
            return null;
        }
    }

    private static LujvoException notBrivla(String message) {
        return new LujvoException(ErrorKind.NOT_BRIVLA, message);
    }
}
