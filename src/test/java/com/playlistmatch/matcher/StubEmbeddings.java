package com.playlistmatch.matcher;

import dev.langchain4j.data.embedding.Embedding;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Embedding manager stub returning fixed vectors; texts without a vector are reported as unavailable.
 */
class StubEmbeddings implements EmbeddingModelManagerInterface {
    private final Map<String, float[]> vectors = new HashMap<>();
    boolean available = true;
    int encodeCalls;

    StubEmbeddings put(String text, float... vector) {
        vectors.put(text, vector);
        return this;
    }

    @Override
    public void configure(String modelName) {
    }

    @Override
    public Optional<Embedding> encode(String text) {
        encodeCalls++;
        float[] v = vectors.get(text);
        if (!available || v == null) return Optional.empty();
        Embedding e = Embedding.from(v.clone());
        e.normalize();
        return Optional.of(e);
    }

    @Override
    public boolean preload() {
        return available;
    }

    @Override
    public boolean isDownloaded(String modelName) {
        return true;
    }

    @Override
    public ModelStatus modelStatus() {
        return available ? ModelStatus.LOADED : ModelStatus.LOAD_FAILED;
    }

    @Override
    public String status() {
        return modelStatus().description();
    }

    @Override
    public DeleteOutcome delete(String modelName) {
        return new DeleteOutcome(false, "stub");
    }
}
