package com.playlistmatch.matcher;

import java.util.OptionalDouble;

/**
 * One way of measuring how similar two strings are.
 * <p>
 * A strategy that cannot produce a score (e.g. no embedding model) returns empty, and
 * {@link SimilarityScorer} moves on to the next strategy in its chain.
 */
public interface ScoringStrategy {

    /**
     * @return short name used in logs
     */
    String name();

    /**
     * @param a first string
     * @param b second string
     * @return similarity in [0, 1], or empty if this strategy is unavailable
     */
    OptionalDouble similarity(String a, String b);
}
