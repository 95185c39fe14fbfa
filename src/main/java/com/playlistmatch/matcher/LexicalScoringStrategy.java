package com.playlistmatch.matcher;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Case-insensitive character-sequence similarity: {@code 2 * lcs / (len(a) + len(b))}, where {@code lcs} is the
 * length of the longest common subsequence.
 * <p>
 * Identical strings score 1.0, two empty strings score 1.0, and one empty string against a non-empty one
 * scores 0.0. Always available.
 */
public class LexicalScoringStrategy implements ScoringStrategy {
    private final LongestCommonSubsequence lcs = new LongestCommonSubsequence();

    @Override
    public String name() {
        return "lexical";
    }

    @Override
    public OptionalDouble similarity(String a, String b) {
        String left = a == null ? "" : a.toLowerCase(Locale.ROOT);
        String right = b == null ? "" : b.toLowerCase(Locale.ROOT);
        int total = left.length() + right.length();
        if (total == 0) {
            return OptionalDouble.of(1.0);
        }
        if (left.isEmpty() || right.isEmpty()) {
            return OptionalDouble.of(0.0);
        }
        if (left.equals(right)) {
            return OptionalDouble.of(1.0);
        }
        int common = lcs.apply(left, right);
        return OptionalDouble.of(2.0 * common / total);
    }
}
