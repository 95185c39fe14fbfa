package com.playlistmatch.matcher;

import java.util.List;

/**
 * Search function of the target catalog (e.g. a track search endpoint).
 * <p>
 * Implementations own transport concerns such as authentication, pacing and timeouts. Repeated calls with the
 * same query may return differently ranked results; the matching core does not assume determinism.
 */
@FunctionalInterface
public interface CatalogSearchProvider {

    /**
     * Searches the catalog.
     * @param query query string, possibly in the provider's field-scoped syntax
     * @param limit maximum number of results wanted
     * @return ranked candidates, best first
     */
    List<Candidate> search(String query, int limit);
}
