package com.playlistmatch.matcher;

import dev.langchain4j.data.embedding.Embedding;

import java.util.Optional;

/**
 * Interface for the embedding model lifecycle: configure, lazy load, encode, status and cache deletion.
 */
public interface EmbeddingModelManagerInterface {

    /**
     * Selects the model used by future lazy loads. Does not load anything.
     * @param modelName model name, or {@link EmbeddingModelManager#LEXICAL_ONLY}
     */
    void configure(String modelName);

    /**
     * Encodes text with the configured model, loading it on first use.
     * @param text text to encode
     * @return unit-normalized embedding, or empty when no model is usable
     */
    Optional<Embedding> encode(String text);

    /**
     * Loads the configured model now instead of on first use.
     * @return true if the configured model is loaded afterwards
     */
    boolean preload();

    /**
     * Checks the on-disk cache for a model without loading it.
     * @param modelName model name
     * @return true if the model's artifacts are cached
     */
    boolean isDownloaded(String modelName);

    /**
     * @return the current lifecycle state of the configured model
     */
    ModelStatus modelStatus();

    /**
     * @return human-readable status of the configured model
     */
    String status();

    /**
     * Removes a model's cached artifacts and, if it is loaded, its in-memory handle.
     * @param modelName model name
     * @return outcome with a message for the operator
     */
    DeleteOutcome delete(String modelName);

    /**
     * Result of {@link #delete(String)}.
     * @param deleted whether anything was removed
     * @param message operator-facing message
     */
    record DeleteOutcome(boolean deleted, String message) {}
}
