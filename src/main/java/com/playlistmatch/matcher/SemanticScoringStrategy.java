package com.playlistmatch.matcher;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Cosine similarity of sentence embeddings produced by the {@link EmbeddingModelManagerInterface}.
 * <p>
 * Negative cosine values are clamped to 0: for title matching "less similar than unrelated" carries no extra
 * meaning. Unavailable when either text cannot be encoded.
 */
public class SemanticScoringStrategy implements ScoringStrategy {
    private final EmbeddingModelManagerInterface embeddings;

    public SemanticScoringStrategy(EmbeddingModelManagerInterface embeddings) {
        if (embeddings == null) {
            throw new IllegalArgumentException("Embedding model manager cannot be null");
        }
        this.embeddings = embeddings;
    }

    @Override
    public String name() {
        return "semantic";
    }

    @Override
    public OptionalDouble similarity(String a, String b) {
        Optional<Embedding> left = embeddings.encode(a);
        if (left.isEmpty()) {
            return OptionalDouble.empty();
        }
        Optional<Embedding> right = embeddings.encode(b);
        if (right.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (left.get().dimension() != right.get().dimension()) {
            return OptionalDouble.empty();
        }
        double cosine = CosineSimilarity.between(left.get(), right.get());
        if (Double.isNaN(cosine)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.max(0.0, Math.min(1.0, cosine)));
    }
}
