package com.playlistmatch.matcher;

/**
 * Matching configuration consumed by {@link MatchService}.
 * Values are validated externally by {@link MatchSettingsService}; the compact constructor only guards the
 * invariants the engine relies on.
 *
 * @param mode lexical or semantic scoring
 * @param embeddingModelName model used in semantic mode
 * @param threshold minimum verification score for {@link MatchTier#MATCHED}, in [0, 1]
 * @param perQueryLimit results requested from the search provider per query
 * @param candidateCap advisory cap on distinct candidates per title
 */
public record MatchingConfig(MatchingMode mode, String embeddingModelName, double threshold,
                             int perQueryLimit, int candidateCap) {

    public static final double DEFAULT_THRESHOLD = 0.6;
    public static final int DEFAULT_PER_QUERY_LIMIT = 10;
    public static final int DEFAULT_CANDIDATE_CAP = 50;
    public static final String DEFAULT_MODEL = "all-mpnet-base-v2";

    public MatchingConfig {
        if (mode == null) {
            throw new IllegalArgumentException("Matching mode cannot be null");
        }
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Matching threshold must be between 0.0 and 1.0: " + threshold);
        }
        if (perQueryLimit < 1 || candidateCap < 1) {
            throw new IllegalArgumentException("Per-query limit and candidate cap must be positive");
        }
        embeddingModelName = embeddingModelName == null || embeddingModelName.isBlank()
            ? EmbeddingModelManager.LEXICAL_ONLY : embeddingModelName.trim();
    }

    public static MatchingConfig defaults() {
        return new MatchingConfig(MatchingMode.SEMANTIC, DEFAULT_MODEL, DEFAULT_THRESHOLD,
            DEFAULT_PER_QUERY_LIMIT, DEFAULT_CANDIDATE_CAP);
    }

    public static MatchingConfig lexical(double threshold) {
        return new MatchingConfig(MatchingMode.LEXICAL, EmbeddingModelManager.LEXICAL_ONLY, threshold,
            DEFAULT_PER_QUERY_LIMIT, DEFAULT_CANDIDATE_CAP);
    }
}
