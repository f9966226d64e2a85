package org.lojban.analysis.lujvo;

import static org.lojban.analysis.lujvo.Letters.isVowel;

import java.util.LinkedList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cluster and syllable rules that do not need the rafsi dictionary.
 */
final class Phonotactics {

    private static final String C = "[bcdfgjklmnprstvxz]";
    private static final String SONORANTS = "lmnr";

    // optional single consonant, then consonant+sonorant pairs
    private static final Pattern SONORANT_PAIRS = Pattern.compile("(" + C + ")?((?:" + C + "[lmnr])*)?");
    private static final Pattern MIDDLE_CLUSTER = Pattern.compile(
            "(" + C + ")?((?:" + C + "[lmnr])*)(?:([bcdfgjkpstvxz]" + C + "?[lmnr]?)|(" + C + "))");

    private final ClusterTables tables;

    Phonotactics(ClusterTables tables) {
        this.tables = tables;
    }

    ClusterTables tables() {
        return tables;
    }

    boolean isGismu(String valsi, boolean allowMz) {
        if (!Shape.isGismuShape(valsi)) {
            return false;
        }
        if (isVowel(valsi.charAt(1))) {
            return tables.isValid(valsi.substring(2, 4), allowMz);
        }
        return tables.isInitial(valsi.substring(0, 2));
    }

    boolean isValidRafsi(String rafsi, boolean allowMz) {
        Shape shape = Shape.of(rafsi);
        switch (shape) {
            case CVCCV:
            case CVCC:
                return tables.isValid(rafsi.substring(2, 4), allowMz);
            case CCVCV:
            case CCVC:
            case CCV:
                return tables.isInitial(rafsi.substring(0, 2));
            case HYPHEN:
            case OTHER:
                return false;
            default:
                return true;
        }
    }

    /**
     * Splits a run of vowels into syllables, reading glide syllables off the end.
     *
     * @throws LujvoException if the run cannot be split
     */
    List<String> splitVowelCluster(String vowels) throws LujvoException {
        final String original = vowels;
        LinkedList<String> result = new LinkedList<>();
        while (true) {
            String cluster;
            if (vowels.length() > 3 && tables.isFollowVowelCluster(vowels.substring(vowels.length() - 3))) {
                cluster = vowels.substring(vowels.length() - 3);
            } else if (vowels.length() > 2 && tables.isFollowVowelCluster(vowels.substring(vowels.length() - 2))) {
                cluster = vowels.substring(vowels.length() - 2);
            } else if (tables.isStartVowelCluster(vowels)) {
                result.addFirst(vowels);
                return result;
            } else {
                throw new LujvoException(ErrorKind.DECOMPOSITION_FAILED, "Couldn't decompose: {" + original + "}");
            }

            String rest = vowels.substring(0, vowels.length() - cluster.length());
            String restEnd = rest.length() > 2 ? rest.substring(rest.length() - 2) : rest;
            // a glide may not follow a falling diphthong
            if ((cluster.charAt(0) == 'i' && (restEnd.equals("ai") || restEnd.equals("ei") || restEnd.equals("oi")))
                    || (cluster.charAt(0) == 'u' && restEnd.equals("au"))) {
                throw new LujvoException(ErrorKind.DECOMPOSITION_FAILED, "Couldn't decompose: {" + original + "}");
            }
            result.addFirst(cluster);
            vowels = rest;
        }
    }

    boolean isZihevlaInitialCluster(String cluster) {
        if (cluster.length() > 3) {
            return false;
        }
        if (cluster.length() == 3) {
            return tables.isInitial(cluster.substring(0, 2)) && tables.isZihevlaInitial(cluster.substring(1));
        }
        if (cluster.length() == 2) {
            return tables.isInitial(cluster);
        }
        return true;
    }

    boolean isZihevlaMiddleCluster(String cluster) {
        final int len = cluster.length();
        if (len == 3) {
            if (SONORANTS.indexOf(cluster.charAt(1)) >= 0) {
                return true;
            }
            return tables.isValid(cluster.substring(0, 2), false) && tables.isInitial(cluster.substring(1));
        }
        if (len < 3) {
            // pairs are checked by the caller
            return true;
        }

        if (cluster.charAt(len - 2) == 'm' && tables.isInitial(cluster.substring(len - 2))) {
            String prefix = isZihevlaInitialCluster(cluster.substring(len - 3))
                    ? cluster.substring(0, len - 3)
                    : cluster.substring(0, len - 2);
            return SONORANT_PAIRS.matcher(prefix).matches();
        }

        Matcher m = MIDDLE_CLUSTER.matcher(cluster);
        if (!m.matches()) {
            return false;
        }
        // the closing part must be able to start a zi'evla
        String onset = m.group(3);
        return onset == null || isZihevlaInitialCluster(onset);
    }
}
