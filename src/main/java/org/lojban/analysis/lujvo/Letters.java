package org.lojban.analysis.lujvo;

import java.util.regex.Pattern;

/**
 * Character classes of the Lojban alphabet and a few string helpers shared by the
 * word builders and analysers.
 */
final class Letters {

    static final String VOWELS = "aeiou";
    static final String CONSONANTS = "bcdfgjklmnprstvxz";

    private static final Pattern ONLY_LOJBAN = Pattern.compile("[aeioubcdfgjklmnprstvxz']+");

    private Letters() {
    }

    static boolean isVowel(char c) {
        return VOWELS.indexOf(c) >= 0;
    }

    static boolean isConsonant(char c) {
        return CONSONANTS.indexOf(c) >= 0;
    }

    /**
     * A glide is an {@code i} or {@code u} followed by another vowel.
     */
    static boolean isGlide(CharSequence s) {
        return s.length() >= 2
                && (s.charAt(0) == 'i' || s.charAt(0) == 'u')
                && isVowel(s.charAt(1));
    }

    static boolean isOnlyLojbanCharacters(CharSequence s) {
        return ONLY_LOJBAN.matcher(s).matches();
    }

    static boolean containsConsonant(CharSequence s) {
        for (int i = 0; i < s.length(); i++) {
            if (isConsonant(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Removes leading and trailing {@code '} and {@code y} characters.
     */
    static String stripHyphens(String rafsi) {
        int start = 0;
        int end = rafsi.length();
        while (start < end && isHyphenChar(rafsi.charAt(start))) {
            start++;
        }
        while (end > start && isHyphenChar(rafsi.charAt(end - 1))) {
            end--;
        }
        return rafsi.substring(start, end);
    }

    private static boolean isHyphenChar(char c) {
        return c == '\'' || c == 'y';
    }

    static char last(CharSequence s) {
        return s.charAt(s.length() - 1);
    }

    /** The first {@code n} characters, or the whole string if it is shorter. */
    static String head(String s, int n) {
        return s.length() <= n ? s : s.substring(0, n);
    }

    /** Everything from {@code from} on, or the empty string. */
    static String tail(String s, int from) {
        return s.length() <= from ? "" : s.substring(from);
    }

    /** Characters {@code [from, to)}, clipped to the string. */
    static String slice(String s, int from, int to) {
        int end = Math.min(to, s.length());
        return from >= end ? "" : s.substring(from, end);
    }

    static String dropLast(String s) {
        return s.isEmpty() ? s : s.substring(0, s.length() - 1);
    }
}
