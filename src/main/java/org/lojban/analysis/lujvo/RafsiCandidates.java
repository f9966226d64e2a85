package org.lojban.analysis.lujvo;

import static org.lojban.analysis.lujvo.Letters.isConsonant;
import static org.lojban.analysis.lujvo.Letters.isGlide;
import static org.lojban.analysis.lujvo.Letters.isOnlyLojbanCharacters;
import static org.lojban.analysis.lujvo.Letters.isVowel;
import static org.lojban.analysis.lujvo.Letters.last;
import static org.lojban.analysis.lujvo.Letters.slice;

import java.util.ArrayList;
import java.util.List;

import org.lojban.analysis.lujvo.MorphologySettings.ConsonantRule;

/**
 * Lists the candidate rafsi forms for every component of a tanru.
 *
 * A component is either a dictionary word, an explicit rafsi written {@code -rafsi-}, or an
 * explicit short form written {@code form-} that must become a root or loan word when an
 * {@code a} is appended.
 */
final class RafsiCandidates {

    /**
     * How a form takes its hyphen.
     */
    enum Form {
        /** A root or loan word without its final vowel. */
        SHORT_BRIVLA,
        /** A whole root or loan word. */
        LONG_BRIVLA,
        /** A rafsi outside the standard shapes. */
        EXPERIMENTAL_RAFSI,
        /** A standard rafsi; the hyphen follows from its {@link Shape}. */
        RAFSI
    }

    private final LujvoMorphology morphology;

    RafsiCandidates(LujvoMorphology morphology) {
        this.morphology = morphology;
    }

    List<List<RafsiCandidate>> forTanru(List<String> valsiList, MorphologySettings settings) throws LujvoException {
        List<List<RafsiCandidate>> result = new ArrayList<>(valsiList.size());
        for (int i = 0; i < valsiList.size(); i++) {
            boolean first = i == 0;
            boolean last = i == valsiList.size() - 1;
            result.add(forComponent(valsiList.get(i), first, last, settings));
        }
        return result;
    }

    List<RafsiCandidate> forComponent(String valsi, boolean first, boolean last, MorphologySettings settings)
            throws LujvoException {
        List<RafsiCandidate> candidates = new ArrayList<>();
        if (!valsi.isEmpty() && last(valsi) == '-') {
            explicitForms(valsi, first, last, settings, candidates);
        } else {
            dictionaryForms(valsi, first, last, settings, candidates);
        }
        return candidates;
    }

    private void explicitForms(String component, boolean first, boolean last, MorphologySettings settings,
            List<RafsiCandidate> out) throws LujvoException {
        boolean shortBrivla = component.charAt(0) != '-';
        String valsi = stripDashes(component);
        if (!isOnlyLojbanCharacters(valsi)) {
            throw new LujvoException(ErrorKind.NON_LOJBAN_CHARACTER, "Non-lojban character in {" + valsi + "}");
        }
        if (last(valsi) == '\'') {
            throw new LujvoException(ErrorKind.NON_LOJBAN_CHARACTER, "rafsi cannot end with ': {" + valsi + "}");
        }
        MorphologySettings analysis = settings.withoutConsonantRules();

        if (shortBrivla) {
            WordType type;
            try {
                type = morphology.analyzer().analyse(valsi + "a", analysis).getType();
            } catch (LujvoException e) {
                throw new LujvoException(ErrorKind.NO_LUJVO_FOUND, "rafsi + a is not a brivla: {" + valsi + "}", e);
            }
            if (type != WordType.LOAN_SHAPE && type != WordType.ROOT) {
                throw new LujvoException(ErrorKind.NO_LUJVO_FOUND, "rafsi + a is not a gismu or zi'evla: {" + valsi + "}");
            }
            if (valsi.length() >= 6 && isConsonant(last(valsi)) && splits(valsi, settings)) {
                throw new LujvoException(ErrorKind.NO_LUJVO_FOUND, "short zi'evla rafsi falls apart: {" + valsi + "}");
            }
            expand(valsi, Form.SHORT_BRIVLA, Shape.OTHER, first, last, settings, out);
            return;
        }

        Shape shape = Shape.of(valsi);
        if (shape != Shape.OTHER) {
            if (!morphology.phonotactics().isValidRafsi(valsi, settings.isAllowMz())) {
                throw new LujvoException(ErrorKind.INVALID_CLUSTER, "Invalid cluster in rafsi: -{" + valsi + "}-");
            }
            expand(valsi, Form.RAFSI, shape, first, last, settings, out);
            return;
        }

        Form form = null;
        WordType type = brivlaType(valsi, analysis);
        if (type == WordType.LOAN_SHAPE) {
            form = Form.LONG_BRIVLA;
        } else if (type == null && settings.isExpRafsiShapes()) {
            try {
                if (morphology.zihevlaChecker().check(valsi, false, true, settings.isAllowMz()) == WordShape.RAFSI_SHAPE) {
                    form = Form.EXPERIMENTAL_RAFSI;
                }
            } catch (LujvoException e) {
                throw new LujvoException(ErrorKind.NO_LUJVO_FOUND, "Not a valid rafsi shape: -{" + valsi + "}-", e);
            }
        }
        if (form == null) {
            throw new LujvoException(ErrorKind.NOT_ZIHEVLA, "Not a valid rafsi or zi'evla shape: -{" + valsi + "}-");
        }
        expand(valsi, form, shape, first, last, settings, out);
    }

    private void dictionaryForms(String valsi, boolean first, boolean last, MorphologySettings settings,
            List<RafsiCandidate> out) throws LujvoException {
        if (!isOnlyLojbanCharacters(valsi)) {
            throw new LujvoException(ErrorKind.NON_LOJBAN_CHARACTER, "Non-lojban character in {" + valsi + "}");
        }
        for (String rafsi : morphology.lookup().rafsiFor(valsi)) {
            Shape shape = Shape.of(rafsi);
            if (shape == Shape.OTHER) {
                if (settings.isExpRafsiShapes()) {
                    expand(rafsi, Form.EXPERIMENTAL_RAFSI, shape, first, last, settings, out);
                }
                continue;
            }
            expand(rafsi, Form.RAFSI, shape, first, last, settings, out);
        }

        WordType type = brivlaType(valsi, settings.withoutConsonantRules());
        if (type == WordType.ROOT) {
            expand(valsi.substring(0, valsi.length() - 1), Form.SHORT_BRIVLA, Shape.OTHER, first, last, settings, out);
        }
        if (type == WordType.ROOT || type == WordType.LOAN_SHAPE) {
            expand(valsi, Form.LONG_BRIVLA, Shape.OTHER, first, last, settings, out);
        }
    }

    /**
     * Classification of the word, or {@code null} if it is not a brivla.
     */
    private WordType brivlaType(String valsi, MorphologySettings settings) {
        try {
            return morphology.analyzer().analyse(valsi, settings).getType();
        } catch (LujvoException e) {
            return null;
        }
    }

    private boolean splits(String valsi, MorphologySettings settings) throws LujvoException {
        try {
            morphology.splitter().split(valsi, settings);
            return true;
        } catch (LujvoException e) {
            if (!e.isDecompositionFailure()) {
                throw e;
            }
            return false;
        }
    }

    /**
     * Adds the hyphenated forms of one rafsi for its position in the tanru.
     */
    void expand(String rafsi, Form form, Shape shape, boolean first, boolean last,
            MorphologySettings settings, List<RafsiCandidate> out) {
        if (!first && isVowel(rafsi.charAt(0)) && !isGlide(rafsi)) {
            rafsi = "'" + rafsi;
        }
        final boolean cluster = settings.getConsonants() == ConsonantRule.CLUSTER;

        switch (form) {
            case SHORT_BRIVLA:
                out.add(new RafsiCandidate(last ? rafsi : rafsi + "y", 2));
                return;
            case LONG_BRIVLA:
                if (last) {
                    out.add(new RafsiCandidate(rafsi, 2));
                } else {
                    out.add(new RafsiCandidate(rafsi + "'y", 2));
                }
                return;
            case EXPERIMENTAL_RAFSI: {
                int consonants = !cluster && (isConsonant(rafsi.charAt(0)) || (settings.isGlides() && isGlide(rafsi))) ? 1 : 0;
                if (last) {
                    out.add(new RafsiCandidate(rafsi, consonants));
                } else if (!first) {
                    out.add(new RafsiCandidate(rafsi + "'y", consonants));
                } else {
                    // a trailing ' marks a vowel-initial rafsi that needs a hyphen later
                    out.add(new RafsiCandidate(rafsi + "'", consonants));
                }
                return;
            }
            case RAFSI:
                break;
            default:
                throw new IllegalStateException("Unknown form: " + form);
        }

        switch (shape) {
            case CCVC:
            case CVCC:
                out.add(new RafsiCandidate(last ? rafsi : rafsi + "y", 2));
                break;
            case CCVCV:
            case CVCCV:
                if (last) {
                    out.add(new RafsiCandidate(rafsi, 2));
                } else if (!(shape == Shape.CVCCV && morphology.phonotactics().tables().isInitial(slice(rafsi, 2, 4)))) {
                    out.add(new RafsiCandidate(rafsi + "'y", 2));
                }
                break;
            case CVV:
            case CVHV: {
                int consonants = cluster ? 0 : 1;
                if (first) {
                    out.add(new RafsiCandidate(rafsi + "'", consonants));
                } else if (!last) {
                    out.add(new RafsiCandidate(rafsi + "'y", consonants));
                }
                out.add(new RafsiCandidate(rafsi, consonants));
                break;
            }
            case CCV:
                out.add(new RafsiCandidate(rafsi, 2));
                out.add(new RafsiCandidate(rafsi + "'y", 2));
                break;
            case CVC:
                out.add(new RafsiCandidate(rafsi, 2));
                if (!last) {
                    out.add(new RafsiCandidate(rafsi + "y", 2));
                }
                break;
            default:
                throw new IllegalStateException("Not a rafsi shape: " + shape + " for " + rafsi);
        }
    }

    private static String stripDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }
}
