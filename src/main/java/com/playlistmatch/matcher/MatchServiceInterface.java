package com.playlistmatch.matcher;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Interface for matching a batch of raw titles against a catalog.
 */
public interface MatchServiceInterface {

    /**
     * Matches every title in order.
     * @param titles raw titles
     * @param search catalog search provider
     * @param config matching configuration
     * @param progress called after each finalized title (may be null)
     * @param cancelled polled between titles and between queries (may be null)
     * @return one result per finalized title, in input order, and whether the batch was cancelled
     */
    MatchBatchResult matchAll(List<String> titles, CatalogSearchProvider search, MatchingConfig config,
                              MatchProgressListener progress, BooleanSupplier cancelled);

    /**
     * Matches one title.
     * @param title raw title
     * @param search catalog search provider
     * @param config matching configuration
     * @return classified result
     */
    MatchResult matchOne(String title, CatalogSearchProvider search, MatchingConfig config);
}
