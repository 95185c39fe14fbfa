package com.playlistmatch.matcher;

import java.util.List;

/**
 * Outcome of {@link MatchServiceInterface#matchAll}.
 * <p>
 * {@code results} holds one entry per finalized title, in input order. When {@code cancelled} is true the list
 * is shorter than the input: titles after the cancellation point (including the one in flight) are absent.
 *
 * @param results finalized results
 * @param cancelled whether the batch was stopped by the cancellation predicate
 */
public record MatchBatchResult(List<MatchResult> results, boolean cancelled) {

    public MatchBatchResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public long countByTier(MatchTier tier) {
        return results.stream().filter(r -> r.tier() == tier).count();
    }
}
