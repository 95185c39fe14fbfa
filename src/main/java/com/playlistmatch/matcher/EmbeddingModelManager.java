package com.playlistmatch.matcher;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the embedding model used for semantic scoring: which model is configured, whether it is loaded, and its
 * on-disk cache.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>{@code Unconfigured -> Configured} via {@link #configure(String)}; nothing is loaded yet.</li>
 *   <li>The first {@link #encode(String)} (or {@link #preload()}) loads the configured model through the
 *       {@link EmbeddingModelLoader}. The load runs once; concurrent first callers wait on the load lock and reuse
 *       the result.</li>
 *   <li>If the load fails the model name is remembered as failed and every later call returns empty (callers fall
 *       back to lexical scoring) until the name is configured again or the model is deleted.</li>
 *   <li>Configuring another name leaves the loaded model in memory; the next encode swaps it for the newly
 *       configured one.</li>
 * </ul>
 * <p>
 * Error handling: load, encode and delete failures are logged and reported through return values, never thrown.
 * <p>
 * One instance is meant to live for the whole process and be shared by everything that scores.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class EmbeddingModelManager implements EmbeddingModelManagerInterface {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingModelManager.class);

    /** Sentinel model name meaning "no model, string matching only". */
    public static final String LEXICAL_ONLY = "string_only";

    /** Model names offered to operators, smallest first. */
    public static final List<String> KNOWN_MODELS = List.of(
        LEXICAL_ONLY,
        "paraphrase-MiniLM-L3-v2",
        "all-MiniLM-L6-v2",
        "all-MiniLM-L12-v2",
        "all-mpnet-base-v2"
    );

    private final Path cacheDirectory;
    private final EmbeddingModelLoader loader;
    private final Object loadLock = new Object();
    private final Set<String> failedModels = ConcurrentHashMap.newKeySet();

    private volatile String configuredModelName;
    private volatile LoadedModel loaded;
    private volatile String loadingModelName;

    private record LoadedModel(String name, EmbeddingModel model) {}

    public EmbeddingModelManager(Path cacheDirectory, EmbeddingModelLoader loader) {
        if (cacheDirectory == null) {
            throw new IllegalArgumentException("Cache directory cannot be null");
        }
        if (loader == null) {
            throw new IllegalArgumentException("Model loader cannot be null");
        }
        this.cacheDirectory = cacheDirectory;
        this.loader = loader;
    }

    public EmbeddingModelManager(Path cacheDirectory) {
        this(cacheDirectory, new OnnxModelLoader());
    }

    @Override
    public void configure(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("Model name cannot be null or empty");
        }
        String name = modelName.trim();
        boolean retry = failedModels.remove(name);
        if (name.equals(configuredModelName)) {
            if (retry) {
                logger.info("Embedding model '{}' re-configured; the next use retries loading it", name);
            }
            return;
        }
        configuredModelName = name;
        logger.info("Embedding model configured: {}", name);
    }

    public String configuredModelName() {
        return configuredModelName;
    }

    public Path cacheDirectory() {
        return cacheDirectory;
    }

    /**
     * Cache directory of one model.
     * @param modelName model name
     * @return directory under the cache root
     */
    public Path modelDirectory(String modelName) {
        return cacheDirectory.resolve(Utils.sanitizeFilename(modelName));
    }

    @Override
    public Optional<Embedding> encode(String text) {
        EmbeddingModel model = currentModel();
        if (model == null) {
            return Optional.empty();
        }
        try {
            Embedding embedding = model.embed(text == null ? "" : text).content();
            if (embedding == null || !hasDirection(embedding.vector())) {
                logger.debug("Embedding model returned no usable vector for '{}'", Utils.shortLabel(text));
                return Optional.empty();
            }
            // Fresh copy so normalizing never touches an embedding the model may cache.
            Embedding normalized = Embedding.from(embedding.vector().clone());
            normalized.normalize();
            return Optional.of(normalized);
        } catch (RuntimeException e) {
            logger.warn("Embedding failed for '{}': {}", Utils.shortLabel(text), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean preload() {
        return currentModel() != null;
    }

    @Override
    public boolean isDownloaded(String modelName) {
        if (modelName == null || modelName.isBlank() || LEXICAL_ONLY.equals(modelName.trim())) {
            return false;
        }
        return loader.isCached(modelDirectory(modelName.trim()));
    }

    @Override
    public ModelStatus modelStatus() {
        String name = configuredModelName;
        if (name == null) return ModelStatus.NOT_CONFIGURED;
        if (LEXICAL_ONLY.equals(name)) return ModelStatus.LEXICAL_ONLY;
        LoadedModel current = loaded;
        if (current != null && current.name().equals(name)) return ModelStatus.LOADED;
        if (name.equals(loadingModelName)) return ModelStatus.LOADING;
        if (failedModels.contains(name)) return ModelStatus.LOAD_FAILED;
        return isDownloaded(name) ? ModelStatus.DOWNLOADED_NOT_LOADED : ModelStatus.NOT_DOWNLOADED;
    }

    @Override
    public String status() {
        String name = configuredModelName;
        ModelStatus status = modelStatus();
        return name == null ? status.description() : name + ": " + status.description();
    }

    @Override
    public DeleteOutcome delete(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            return new DeleteOutcome(false, "No model name given.");
        }
        String name = modelName.trim();
        if (LEXICAL_ONLY.equals(name)) {
            return new DeleteOutcome(false, "String-only mode has no cached model.");
        }
        boolean wasLoaded;
        synchronized (loadLock) {
            LoadedModel current = loaded;
            wasLoaded = current != null && current.name().equals(name);
            if (wasLoaded) {
                loaded = null;
                logger.info("Unloaded embedding model '{}'", name);
            }
            failedModels.remove(name);
        }
        Path dir = modelDirectory(name);
        if (!Files.exists(dir)) {
            return new DeleteOutcome(wasLoaded, wasLoaded
                ? "Model " + name + " unloaded; it was not in the cache."
                : "Model " + name + " is not in the cache.");
        }
        try {
            deleteRecursively(dir);
            logger.info("Deleted cached embedding model '{}' from {}", name, dir);
            return new DeleteOutcome(true, "Deleted model " + name + " from " + dir + ".");
        } catch (IOException e) {
            logger.warn("Failed to delete cached model '{}' at {}: {}", name, dir, e.getMessage());
            return new DeleteOutcome(false, "Failed to delete model " + name + ": " + e.getMessage());
        }
    }

    // Returns the configured model, loading it on first use; null when none is usable.
    private EmbeddingModel currentModel() {
        String name = configuredModelName;
        if (name == null || LEXICAL_ONLY.equals(name)) {
            return null;
        }
        LoadedModel current = loaded;
        if (current != null && current.name().equals(name)) {
            return current.model();
        }
        if (failedModels.contains(name)) {
            return null;
        }
        synchronized (loadLock) {
            current = loaded;
            if (current != null && current.name().equals(name)) {
                return current.model();
            }
            if (failedModels.contains(name)) {
                return null;
            }
            return load(name);
        }
    }

    // Caller holds loadLock.
    private EmbeddingModel load(String name) {
        Path dir = modelDirectory(name);
        loadingModelName = name;
        long start = System.currentTimeMillis();
        try {
            logger.info("Loading embedding model '{}' from {}", name, dir);
            EmbeddingModel model = loader.load(name, dir);
            if (model == null) {
                throw new IllegalStateException("loader returned no model");
            }
            loaded = new LoadedModel(name, model);
            logger.info("Embedding model '{}' loaded in {} ms", name, System.currentTimeMillis() - start);
            return model;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failedModels.add(name);
            logger.warn("Loading embedding model '{}' was interrupted. Falling back to string matching.", name);
            return null;
        } catch (Exception | LinkageError e) {
            // LinkageError covers a native runtime that cannot initialize (UnsatisfiedLinkError and the like).
            failedModels.add(name);
            logger.warn("Failed to load embedding model '{}': {}. Falling back to string matching.", name, e.toString());
            return null;
        } finally {
            loadingModelName = null;
        }
    }

    private static boolean hasDirection(float[] vector) {
        if (vector == null || vector.length == 0) return false;
        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        return norm > 0.0 && !Double.isNaN(norm) && !Double.isInfinite(norm);
    }

    private static void deleteRecursively(Path dir) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path p : paths) {
            Files.deleteIfExists(p);
        }
    }
}
