package com.toolfinder.search.dedup;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class TextSimilarity {
    private static final Pattern TRAILING_VERSION = Pattern.compile("\\s*v?\\d+(\\.\\d+)*(\\s*[-+]?\\w*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int AFFIX_MIN_LENGTH = 3;
    private static final double AFFIX_BONUS = 0.1;

    private TextSimilarity() {
    }

    public static double jaccard(String a, String b) {
        Set<String> wordsA = words(a);
        Set<String> wordsB = words(b);
        if (wordsA.isEmpty() || wordsB.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(wordsA);
        intersection.retainAll(wordsB);
        Set<String> union = new HashSet<>(wordsA);
        union.addAll(wordsB);
        return (double) intersection.size() / union.size();
    }

    /**
     * Word-level Jaccard plus a small bonus for long shared prefixes and suffixes, capped at 1.
     */
    public static double stringSimilarity(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        String left = a.trim().toLowerCase(Locale.ROOT);
        String right = b.trim().toLowerCase(Locale.ROOT);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        double score = jaccard(left, right) + affixBonus(left, right, true) + affixBonus(left, right, false);
        return Math.min(score, 1.0);
    }

    public static String stripVersion(String name) {
        if (name == null) {
            return "";
        }
        return TRAILING_VERSION.matcher(name.trim()).replaceFirst("").trim();
    }

    public static String trailingVersion(String name) {
        if (name == null) {
            return "";
        }
        String trimmed = name.trim();
        String stripped = stripVersion(trimmed);
        String version = trimmed.substring(stripped.length()).trim();
        if (version.startsWith("v") || version.startsWith("V")) {
            version = version.substring(1);
        }
        return version;
    }

    /**
     * Lower-cased, punctuation-free name without a trailing version token.
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        String value = WHITESPACE.matcher(name.toLowerCase(Locale.ROOT)).replaceAll(" ");
        value = NON_WORD.matcher(value).replaceAll("");
        return stripVersion(value);
    }

    private static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> words = new HashSet<>(Arrays.asList(WHITESPACE.split(text.trim().toLowerCase(Locale.ROOT))));
        words.remove("");
        return words;
    }

    private static double affixBonus(String a, String b, boolean prefix) {
        int minLength = Math.min(a.length(), b.length());
        int common = 0;
        for (int i = 0; i < minLength; i++) {
            char left = prefix ? a.charAt(i) : a.charAt(a.length() - 1 - i);
            char right = prefix ? b.charAt(i) : b.charAt(b.length() - 1 - i);
            if (left != right) {
                break;
            }
            common++;
        }
        return common > AFFIX_MIN_LENGTH ? ((double) common / minLength) * AFFIX_BONUS : 0.0;
    }
}
