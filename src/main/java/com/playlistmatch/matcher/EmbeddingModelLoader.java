package com.playlistmatch.matcher;

import dev.langchain4j.model.embedding.EmbeddingModel;

import java.nio.file.Path;

/**
 * Materializes an embedding model from (and into) its cache directory.
 * {@link EmbeddingModelManager} serializes calls to {@link #load}.
 */
public interface EmbeddingModelLoader {

    /**
     * Loads the model, fetching its artifacts into {@code modelDirectory} first when they are missing.
     * @param modelName configured model name
     * @param modelDirectory cache directory for this model
     * @return the loaded model
     * @throws Exception on any network, disk or format failure
     */
    EmbeddingModel load(String modelName, Path modelDirectory) throws Exception;

    /**
     * Checks whether the model's artifacts are present, without loading them.
     * @param modelDirectory cache directory for the model
     * @return true if every artifact exists
     */
    boolean isCached(Path modelDirectory);
}
