package com.playlistmatch.matcher;

/**
 * Immutable classification of one source title, created once by {@link MatchClassifier}.
 * <p>
 * {@code candidate} and {@code score} are null exactly when {@code tier} is {@link MatchTier#NOT_FOUND}.
 *
 * @param sourceTitle raw input title, verbatim
 * @param candidate best candidate, or null
 * @param tier classification tier
 * @param score best verification score, or null
 * @author Playlist Match Team
 * @since 1.0
 */
public record MatchResult(String sourceTitle, Candidate candidate, MatchTier tier, Double score) {

    public static MatchResult notFound(String sourceTitle) {
        return new MatchResult(sourceTitle, null, MatchTier.NOT_FOUND, null);
    }

    public boolean hasCandidate() {
        return candidate != null;
    }
}
