package com.playlistmatch.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Engine entry point: matches raw titles against a catalog, one title at a time.
 * <p>
 * Workflow per title:
 * <ul>
 *   <li>{@link QueryBuilder} turns the raw title into ordered queries.</li>
 *   <li>{@link CandidateCollector} runs them against the {@link CatalogSearchProvider} and merges the results.</li>
 *   <li>{@link MatchClassifier} scores every candidate and assigns the tier.</li>
 * </ul>
 * Titles are processed sequentially: each title issues paced calls to a remote search API, and parallel fan-out
 * would only invite throttling.
 * <p>
 * Cancellation: the predicate is polled before each title and between queries. When it fires the title in flight
 * is discarded and the batch returns the results finalized so far with {@code cancelled = true}.
 * <p>
 * A blank title builds no queries and resolves to {@link MatchTier#NOT_FOUND} without calling the provider.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class MatchService implements MatchServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(MatchService.class);

    private final QueryBuilder queryBuilder;
    private final CandidateCollector collector;
    private final MatchClassifier classifier;
    private final EmbeddingModelManagerInterface embeddings;

    public MatchService(QueryBuilder queryBuilder, CandidateCollector collector, MatchClassifier classifier,
                        EmbeddingModelManagerInterface embeddings) {
        if (queryBuilder == null || collector == null || classifier == null) {
            throw new IllegalArgumentException("Query builder, collector and classifier are required");
        }
        this.queryBuilder = queryBuilder;
        this.collector = collector;
        this.classifier = classifier;
        this.embeddings = embeddings;
    }

    /**
     * Wires the default pipeline around an embedding model manager.
     * @param embeddings model manager used for semantic scoring (may be null for lexical-only use)
     */
    public MatchService(EmbeddingModelManagerInterface embeddings) {
        this(new QueryBuilder(), new CandidateCollector(), new MatchClassifier(new SimilarityScorer(embeddings)),
            embeddings);
    }

    @Override
    public MatchBatchResult matchAll(List<String> titles, CatalogSearchProvider search, MatchingConfig config,
                                     MatchProgressListener progress, BooleanSupplier cancelled) {
        if (titles == null) {
            throw new IllegalArgumentException("Title list cannot be null");
        }
        if (search == null) {
            throw new IllegalArgumentException("Search provider cannot be null");
        }
        MatchingConfig cfg = config == null ? MatchingConfig.defaults() : config;
        MatchProgressListener listener = progress == null ? MatchProgressListener.NONE : progress;
        BooleanSupplier cancel = cancelled == null ? () -> false : cancelled;
        prepareEmbeddings(cfg);

        int total = titles.size();
        logger.info("Matching {} titles (mode={}, model={}, threshold={})",
            total, cfg.mode(), cfg.embeddingModelName(), cfg.threshold());
        List<MatchResult> results = new ArrayList<>(total);
        boolean wasCancelled = false;
        for (int i = 0; i < total; i++) {
            if (cancel.getAsBoolean()) {
                wasCancelled = true;
                break;
            }
            String title = titles.get(i);
            logger.info("[{}/{}] Title: {}", i + 1, total, title);
            List<String> queries = queryBuilder.buildQueries(title);
            List<Candidate> candidates = collector.collect(queries, search, cfg.perQueryLimit(), cfg.candidateCap(), cancel);
            if (cancel.getAsBoolean()) {
                wasCancelled = true;
                break;
            }
            MatchResult result = classifier.classify(title, candidates, cfg.threshold(), cfg.mode());
            logResult(result);
            results.add(result);
            notifyProgress(listener, i + 1, total, title);
        }
        MatchBatchResult batch = new MatchBatchResult(results, wasCancelled);
        logSummary(batch, total);
        return batch;
    }

    @Override
    public MatchResult matchOne(String title, CatalogSearchProvider search, MatchingConfig config) {
        MatchBatchResult batch = matchAll(List.of(title == null ? "" : title), search, config, null, null);
        return batch.results().get(0);
    }

    private void prepareEmbeddings(MatchingConfig cfg) {
        if (cfg.mode() != MatchingMode.SEMANTIC) {
            return;
        }
        if (embeddings == null) {
            logger.warn("Semantic matching requested without an embedding model manager; using string matching");
            return;
        }
        embeddings.configure(cfg.embeddingModelName());
    }

    private static void logResult(MatchResult result) {
        switch (result.tier()) {
            case MATCHED -> logger.info("    Matched: {} (score {})",
                result.candidate().displayLabel(), String.format("%.3f", result.score()));
            case LOW_CONFIDENCE -> logger.warn("    Low confidence: {} (score {})",
                result.candidate().displayLabel(), String.format("%.3f", result.score()));
            case NOT_FOUND -> logger.warn("    Not found in catalog");
        }
    }

    private static void notifyProgress(MatchProgressListener listener, int current, int total, String title) {
        try {
            listener.onProgress(current, total, Utils.shortLabel(title));
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed at {}/{}: {}", current, total, e.getMessage());
        }
    }

    private static void logSummary(MatchBatchResult batch, int total) {
        logger.info("Matching summary: matched={}, low confidence={}, not found={}, processed={}/{}{}",
            batch.countByTier(MatchTier.MATCHED),
            batch.countByTier(MatchTier.LOW_CONFIDENCE),
            batch.countByTier(MatchTier.NOT_FOUND),
            batch.results().size(), total,
            batch.cancelled() ? " (cancelled)" : "");
    }
}
