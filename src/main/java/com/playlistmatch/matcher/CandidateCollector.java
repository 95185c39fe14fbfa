package com.playlistmatch.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Drives a {@link CatalogSearchProvider} with each query of a title and merges the results.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Queries run in order; each asks the provider for up to {@code perQueryLimit} results.</li>
 *   <li>Candidates are deduplicated by id; the first occurrence wins and keeps its insertion position.</li>
 *   <li>Once {@code totalCap} distinct candidates are collected no further queries run. The cap is checked after
 *       a query's results are merged, so one query's results are never cut mid-way.</li>
 * </ul>
 * <p>
 * Error handling:
 * <ul>
 *   <li>A provider failure (exception or null result) is logged and that query contributes nothing; the
 *       remaining queries still execute.</li>
 *   <li>Null entries in a result list are skipped.</li>
 * </ul>
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class CandidateCollector {
    private static final Logger logger = LoggerFactory.getLogger(CandidateCollector.class);

    public List<Candidate> collect(List<String> queries, CatalogSearchProvider search, int perQueryLimit, int totalCap) {
        return collect(queries, search, perQueryLimit, totalCap, () -> false);
    }

    /**
     * Collects candidates for one title.
     * @param queries ordered queries (may be empty)
     * @param search catalog search provider
     * @param perQueryLimit results requested per query
     * @param totalCap advisory cap on distinct candidates
     * @param cancelled polled before each query; when true, collection stops
     * @return deduplicated candidates in first-insertion order
     */
    public List<Candidate> collect(List<String> queries, CatalogSearchProvider search, int perQueryLimit, int totalCap,
                                   BooleanSupplier cancelled) {
        if (search == null) {
            throw new IllegalArgumentException("Search provider cannot be null");
        }
        if (perQueryLimit < 1 || totalCap < 1) {
            throw new IllegalArgumentException("Per-query limit and total cap must be positive");
        }
        Map<String, Candidate> seen = new LinkedHashMap<>();
        if (queries == null) {
            return List.of();
        }
        for (String query : queries) {
            if (cancelled != null && cancelled.getAsBoolean()) {
                logger.debug("Candidate collection cancelled before query '{}'", query);
                break;
            }
            List<Candidate> results;
            try {
                results = search.search(query, perQueryLimit);
            } catch (RuntimeException e) {
                logger.warn("Search failed for query '{}': {}", query, e.getMessage());
                continue;
            }
            if (results == null) {
                logger.warn("Search returned no result list for query '{}'", query);
                continue;
            }
            int added = 0;
            for (Candidate candidate : results) {
                if (candidate == null) {
                    logger.debug("Skipping null candidate returned for query '{}'", query);
                    continue;
                }
                if (seen.putIfAbsent(candidate.id(), candidate) == null) {
                    added++;
                }
            }
            logger.debug("Query '{}' returned {} results, {} new", query, results.size(), added);
            if (seen.size() >= totalCap) {
                logger.debug("Candidate cap {} reached after query '{}'", totalCap, query);
                break;
            }
        }
        return List.copyOf(new ArrayList<>(seen.values()));
    }
}
