package com.playlistmatch.matcher;

import java.util.Locale;

/**
 * Scoring mode used by {@link SimilarityScorer}.
 */
public enum MatchingMode {
    LEXICAL,
    SEMANTIC;

    /**
     * Parses a settings value such as {@code "lexical"} or {@code "SEMANTIC"}.
     * @param value settings value
     * @return the mode
     * @throws IllegalArgumentException if the value names no mode
     */
    public static MatchingMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Matching mode cannot be null or empty");
        }
        return MatchingMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
