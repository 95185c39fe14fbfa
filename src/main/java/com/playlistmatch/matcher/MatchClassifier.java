package com.playlistmatch.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Combines a title's candidates and their scores into a tiered {@link MatchResult}.
 * <p>
 * Best-candidate selection and the threshold check are separate steps: every candidate is scored, the highest
 * score wins (ties go to the candidate inserted first), and only then is the winner compared to the threshold.
 * A winner below the threshold is still returned as {@link MatchTier#LOW_CONFIDENCE};
 * {@link MatchTier#NOT_FOUND} is used only when there are no candidates at all.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class MatchClassifier {
    private static final Logger logger = LoggerFactory.getLogger(MatchClassifier.class);

    private final SimilarityScorer scorer;

    public MatchClassifier(SimilarityScorer scorer) {
        if (scorer == null) {
            throw new IllegalArgumentException("Similarity scorer cannot be null");
        }
        this.scorer = scorer;
    }

    /**
     * Classifies one title.
     * @param title raw title
     * @param candidates deduplicated candidates in insertion order (may be empty or null)
     * @param threshold minimum score for {@link MatchTier#MATCHED}
     * @param mode scoring mode
     * @return immutable result
     */
    public MatchResult classify(String title, List<Candidate> candidates, double threshold, MatchingMode mode) {
        if (candidates == null || candidates.isEmpty()) {
            return MatchResult.notFound(title);
        }
        Candidate best = null;
        double bestScore = -1.0;
        for (Candidate candidate : candidates) {
            if (candidate == null) continue;
            double s = scorer.verificationScore(title, candidate, mode);
            logger.trace("Score {} for '{}' vs '{}'", s, title, candidate.displayLabel());
            if (s > bestScore) {
                best = candidate;
                bestScore = s;
            }
        }
        if (best == null) {
            return MatchResult.notFound(title);
        }
        MatchTier tier = bestScore >= threshold ? MatchTier.MATCHED : MatchTier.LOW_CONFIDENCE;
        return new MatchResult(title, best, tier, bestScore);
    }
}
