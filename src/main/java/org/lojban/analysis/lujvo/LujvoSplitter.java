package org.lojban.analysis.lujvo;

import static org.lojban.analysis.lujvo.Letters.head;
import static org.lojban.analysis.lujvo.Letters.isConsonant;
import static org.lojban.analysis.lujvo.Letters.isVowel;
import static org.lojban.analysis.lujvo.Letters.slice;
import static org.lojban.analysis.lujvo.Letters.tail;

import java.util.ArrayList;
import java.util.List;

import org.lojban.analysis.lujvo.MorphologySettings.YHyphens;

/**
 * Splits a lujvo into rafsi and hyphens (jvokaha).
 *
 * {@link #split} is a greedy left to right pass that only checks clusters.
 * {@link #decompose} also rebuilds the word from the rafsi it found and rejects it unless
 * the builder produces the same form.
 */
final class LujvoSplitter {

    private final LujvoMorphology morphology;

    LujvoSplitter(LujvoMorphology morphology) {
        this.morphology = morphology;
    }

    /**
     * Greedy split. Only {@link MorphologySettings#getYHyphens()} and
     * {@link MorphologySettings#isAllowMz()} are used.
     *
     * @throws LujvoException {@link ErrorKind#INVALID_CLUSTER} or
     *         {@link ErrorKind#DECOMPOSITION_FAILED}
     */
    List<String> split(final String word, MorphologySettings settings) throws LujvoException {
        final ClusterTables tables = morphology.phonotactics().tables();
        final YHyphens yHyphens = settings.getYHyphens();
        List<String> pieces = new ArrayList<>();
        String rest = word;

        while (!rest.isEmpty()) {
            // a hyphen can neither start a word nor follow another hyphen
            if (!pieces.isEmpty() && lastPiece(pieces).length() != 1) {
                if (rest.charAt(0) == 'y') {
                    pieces.add("y");
                    rest = rest.substring(1);
                    continue;
                }
                if (yHyphens != YHyphens.FORCE_Y
                        && (rest.startsWith("nr") || (rest.charAt(0) == 'r' && rest.length() > 1 && isConsonant(rest.charAt(1))))) {
                    pieces.add(rest.substring(0, 1));
                    rest = rest.substring(1);
                    continue;
                }
                if (yHyphens != YHyphens.STANDARD && rest.startsWith("'y")) {
                    pieces.add("'y");
                    rest = rest.substring(2);
                    continue;
                }
            }

            String cvv = head(rest, 3);
            if (Shape.of(cvv) == Shape.CVV && isFallingDiphthong(slice(rest, 1, 3))) {
                pieces.add(cvv);
                rest = rest.substring(3);
                continue;
            }

            String four = head(rest, 4);
            Shape fourShape = Shape.of(four);
            if (fourShape == Shape.CVHV) {
                pieces.add(four);
                rest = rest.substring(4);
                continue;
            }
            if (fourShape == Shape.CVCC || fourShape == Shape.CCVC) {
                if (isVowel(rest.charAt(1))) {
                    if (!tables.isValid(rest.substring(2, 4), settings.isAllowMz())) {
                        throw new LujvoException(ErrorKind.INVALID_CLUSTER,
                                "Invalid cluster {" + rest.substring(2, 4) + "} in {" + word + "}");
                    }
                } else if (!tables.isInitial(rest.substring(0, 2))) {
                    throw new LujvoException(ErrorKind.INVALID_CLUSTER,
                            "Invalid initial cluster {" + rest.substring(0, 2) + "} in {" + word + "}");
                }
                // CVCCy and CCVCy, or the end of the word
                if (rest.length() == 4 || rest.charAt(4) == 'y') {
                    pieces.add(four);
                    if (rest.length() > 4) {
                        pieces.add("y");
                    }
                    rest = tail(rest, 5);
                    continue;
                }
            }

            Shape restShape = Shape.of(rest);
            if (restShape == Shape.CVCCV || restShape == Shape.CCVCV) {
                pieces.add(rest);
                return pieces;
            }

            Shape threeShape = Shape.of(cvv);
            if (threeShape == Shape.CVC) {
                pieces.add(cvv);
                rest = rest.substring(3);
                continue;
            }
            if (threeShape == Shape.CCV) {
                if (!tables.isInitial(rest.substring(0, 2))) {
                    throw new LujvoException(ErrorKind.INVALID_CLUSTER,
                            "Invalid initial cluster {" + rest.substring(0, 2) + "} in {" + word + "}");
                }
                pieces.add(cvv);
                rest = rest.substring(3);
                continue;
            }

            throw new LujvoException(ErrorKind.DECOMPOSITION_FAILED, "Failed to decompose {" + word + "}");
        }
        return pieces;
    }

    /**
     * Splits and verifies the word.
     *
     * @param allowRnHyphens accept {@code r} and {@code n} hyphens the builder would have
     *        left out
     * @throws MalformedWordException if the word splits but is not in canonical form
     */
    List<String> decompose(String word, boolean allowRnHyphens, MorphologySettings settings) throws LujvoException {
        List<String> pieces = split(word, settings);
        if (pieces.isEmpty()) {
            throw new LujvoException(ErrorKind.DECOMPOSITION_FAILED, "Failed to decompose {" + word + "}");
        }
        List<String> rafsiTanru = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            if (piece.length() > 2) {
                rafsiTanru.add("-" + piece + "-");
            }
        }
        // a lone rafsi is not a lujvo even though the builder accepts one component
        if (rafsiTanru.size() < 2) {
            throw new LujvoException(ErrorKind.DECOMPOSITION_FAILED, "Failed to decompose {" + word + "}: too few rafsi");
        }

        String correct;
        try {
            correct = morphology.builder()
                    .build(rafsiTanru, isConsonant(Letters.last(lastPiece(pieces))), settings.withoutExpRafsiShapes())
                    .getLujvo();
        } catch (LujvoException e) {
            if (e.getKind() != ErrorKind.NO_LUJVO_FOUND) {
                throw e;
            }
            throw new LujvoException(ErrorKind.DECOMPOSITION_FAILED, "no lujvo for " + rafsiTanru, e);
        }

        boolean canonical;
        if (allowRnHyphens && settings.getYHyphens() != YHyphens.FORCE_Y) {
            canonical = sameExceptRnHyphens(split(correct, MorphologySettings.standard(settings.isAllowMz())), pieces);
        } else {
            canonical = correct.equals(word);
        }
        if (!canonical) {
            throw new MalformedWordException(word, correct);
        }
        return pieces;
    }

    /**
     * Whether {@code other} is {@code correct} with extra {@code r}/{@code n} hyphens after
     * CVV or CV'V rafsi.
     */
    static boolean sameExceptRnHyphens(List<String> correct, List<String> other) {
        int i = 0;
        for (String part : correct) {
            if (i < other.size() && part.equals(other.get(i))) {
                i++;
                continue;
            }
            if (0 < i && i < other.size() - 1
                    && (other.get(i).equals("r") || other.get(i).equals("n"))
                    && isCvvShape(Shape.of(other.get(i - 1)))
                    && (i > 1 || isInitialConsonantShape(Shape.of(other.get(i + 1))))) {
                i++;
            }
            if (i < other.size() && part.equals(other.get(i))) {
                i++;
            } else {
                return false;
            }
        }
        return i == other.size();
    }

    private static boolean isCvvShape(Shape shape) {
        return shape == Shape.CVV || shape == Shape.CVHV;
    }

    private static boolean isInitialConsonantShape(Shape shape) {
        return shape == Shape.CCVCV || shape == Shape.CCVC || shape == Shape.CCV;
    }

    private static boolean isFallingDiphthong(String vowels) {
        return vowels.equals("ai") || vowels.equals("ei") || vowels.equals("oi") || vowels.equals("au");
    }

    private static String lastPiece(List<String> pieces) {
        return pieces.get(pieces.size() - 1);
    }
}
