package com.smartexam.compiler.validation;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text normalisation and word-set similarity used by duplicate detection and
 * time estimation.
 */
final class TextSimilarity {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextSimilarity() {}

    static String normalize(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    static List<String> words(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return List.of();
        return Arrays.stream(NON_WORD.split(normalized)).filter(w -> !w.isEmpty()).toList();
    }

    /** Jaccard index of the two word sets; two empty texts are not similar. */
    static double jaccard(String a, String b) {
        Set<String> left = new HashSet<>(words(a));
        Set<String> right = new HashSet<>(words(b));
        if (left.isEmpty() && right.isEmpty()) return 0.0;

        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return (double) left.size() / union.size();
    }
}
