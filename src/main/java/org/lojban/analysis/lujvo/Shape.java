package org.lojban.analysis.lujvo;

import static org.lojban.analysis.lujvo.Letters.isConsonant;
import static org.lojban.analysis.lujvo.Letters.isVowel;

/**
 * Consonant/vowel shape of a rafsi or hyphen.
 *
 * The declaration order is the preference rank used when scoring: shapes declared
 * earlier are preferred.
 */
public enum Shape {
    HYPHEN, CVCCV, CVCC, CCVCV, CCVC, CVC, CVHV, CCV, CVV, OTHER;

    /**
     * Rank used by the lujvo score. {@link #OTHER} counts as zero.
     */
    public int rank() {
        return this == OTHER ? 0 : ordinal();
    }

    public static Shape of(CharSequence rafsi) {
        final int len = rafsi.length();
        if (len == 0) {
            return OTHER;
        }
        if (len == 2 && rafsi.charAt(0) == '\'' && rafsi.charAt(1) == 'y') {
            return HYPHEN;
        }
        final char c0 = rafsi.charAt(0);
        if (!isConsonant(c0) && len != 1) {
            return OTHER;
        }

        switch (len) {
            case 1:
                return isVowel(c0) ? OTHER : HYPHEN;
            case 3: {
                final char c1 = rafsi.charAt(1);
                final char c2 = rafsi.charAt(2);
                if (!isVowel(c2)) {
                    if (isVowel(c1) && isConsonant(c2)) {
                        return CVC;
                    }
                } else if (isVowel(c1)) {
                    return CVV;
                } else if (isConsonant(c1)) {
                    return CCV;
                }
                return OTHER;
            }
            case 4: {
                final char c1 = rafsi.charAt(1);
                final char c2 = rafsi.charAt(2);
                final char c3 = rafsi.charAt(3);
                if (isVowel(c1)) {
                    if (isVowel(c3)) {
                        if (c2 == '\'') {
                            return CVHV;
                        }
                    } else if (isConsonant(c2) && isConsonant(c3)) {
                        return CVCC;
                    }
                } else if (isConsonant(c1) && isVowel(c2) && isConsonant(c3)) {
                    return CCVC;
                }
                return OTHER;
            }
            case 5:
                if (isGismuShape(rafsi)) {
                    return isVowel(rafsi.charAt(2)) ? CCVCV : CVCCV;
                }
                return OTHER;
            default:
                return OTHER;
        }
    }

    /**
     * Shape of the rafsi once leading and trailing hyphen characters are removed.
     */
    public static Shape ignoringHyphens(String rafsi) {
        return of(Letters.stripHyphens(rafsi));
    }

    /**
     * CVCCV or CCVCV, without checking the cluster itself.
     */
    static boolean isGismuShape(CharSequence s) {
        return s.length() == 5
                && isConsonant(s.charAt(0))
                && isConsonant(s.charAt(3))
                && isVowel(s.charAt(4))
                && ((isVowel(s.charAt(1)) && isConsonant(s.charAt(2)))
                    || (isConsonant(s.charAt(1)) && isVowel(s.charAt(2))));
    }
}
