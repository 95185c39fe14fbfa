package com.playlistmatch.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Computes how strongly a title matches a catalog candidate, in [0, 1].
 * <p>
 * Scoring chains, evaluated in order, first strategy that produces a score wins:
 * <ul>
 *   <li>{@link MatchingMode#SEMANTIC}: semantic, then lexical</li>
 *   <li>{@link MatchingMode#LEXICAL}: lexical</li>
 * </ul>
 * The lexical fallback in semantic mode is unconditional: when no embedding model is usable the score is still
 * produced, and the first fallback is logged at warning level.
 * <p>
 * Verification takes the maximum over several comparison granularities, so a title whose artist part parses
 * cleanly but whose track part is noisy (or the reverse) can still match:
 * <ul>
 *   <li>normalized title vs candidate label ({@code "{contributors} {name}"})</li>
 *   <li>normalized title vs candidate name</li>
 *   <li>parsed work vs candidate name</li>
 *   <li>parsed contributor vs candidate contributors, when a contributor was parsed</li>
 * </ul>
 * Incomplete candidates (no name or no contributors) always score 0.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class SimilarityScorer {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityScorer.class);

    private final TitleNormalizer normalizer;
    private final ArtistTitleParser parser;
    private final List<ScoringStrategy> lexicalChain;
    private final List<ScoringStrategy> semanticChain;
    private final AtomicBoolean fallbackLogged = new AtomicBoolean(false);

    public SimilarityScorer(EmbeddingModelManagerInterface embeddings) {
        this(new TitleNormalizer(), embeddings);
    }

    public SimilarityScorer(TitleNormalizer normalizer, EmbeddingModelManagerInterface embeddings) {
        this.normalizer = normalizer == null ? new TitleNormalizer() : normalizer;
        this.parser = new ArtistTitleParser(this.normalizer);
        ScoringStrategy lexical = new LexicalScoringStrategy();
        this.lexicalChain = List.of(lexical);
        List<ScoringStrategy> semantic = new ArrayList<>();
        if (embeddings != null) {
            semantic.add(new SemanticScoringStrategy(embeddings));
        }
        semantic.add(lexical);
        this.semanticChain = List.copyOf(semantic);
    }

    /**
     * Similarity of two strings under a mode.
     * @param a first string
     * @param b second string
     * @param mode scoring mode
     * @return score in [0, 1]
     */
    public double similarity(String a, String b, MatchingMode mode) {
        List<ScoringStrategy> chain = mode == MatchingMode.SEMANTIC ? semanticChain : lexicalChain;
        for (ScoringStrategy strategy : chain) {
            OptionalDouble result = strategy.similarity(a, b);
            if (result.isPresent()) {
                if (strategy != chain.get(0)) {
                    logFallback(chain.get(0), strategy);
                }
                return clamp(result.getAsDouble());
            }
        }
        return 0.0;
    }

    /**
     * Scores a title against a candidate's full label.
     * @param title raw title
     * @param candidate catalog candidate
     * @param mode scoring mode
     * @return score in [0, 1]; 0 for incomplete candidates
     */
    public double score(String title, Candidate candidate, MatchingMode mode) {
        if (candidate == null || !candidate.isComplete()) {
            return 0.0;
        }
        return similarity(normalizer.normalize(title), candidate.label(), mode);
    }

    /**
     * Maximum score over all comparison granularities.
     * @param title raw title
     * @param candidate catalog candidate
     * @param mode scoring mode
     * @return score in [0, 1]; 0 for incomplete candidates
     */
    public double verificationScore(String title, Candidate candidate, MatchingMode mode) {
        if (candidate == null || !candidate.isComplete()) {
            return 0.0;
        }
        String normalized = normalizer.normalize(title);
        ParsedTitle parsed = parser.parse(title);
        double best = similarity(normalized, candidate.label(), mode);
        best = Math.max(best, similarity(normalized, candidate.name(), mode));
        if (!parsed.work().isEmpty() && !parsed.work().equals(normalized)) {
            best = Math.max(best, similarity(parsed.work(), candidate.name(), mode));
        }
        if (parsed.hasContributor()) {
            best = Math.max(best, similarity(parsed.contributor(), candidate.contributorsJoined(), mode));
        }
        return best;
    }

    private void logFallback(ScoringStrategy preferred, ScoringStrategy used) {
        if (fallbackLogged.compareAndSet(false, true)) {
            logger.warn("{} scoring unavailable, falling back to {} scoring", preferred.name(), used.name());
        } else {
            logger.debug("{} scoring unavailable, used {} scoring", preferred.name(), used.name());
        }
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
