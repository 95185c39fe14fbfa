package com.playlistmatch.matcher;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.OnnxEmbeddingModel;
import dev.langchain4j.model.embedding.onnx.PoolingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;

/**
 * Loads sentence-transformer models exported to ONNX, caching their artifacts on disk.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Each model lives in its own directory holding {@code model.onnx} and {@code tokenizer.json}.</li>
 *   <li>Missing artifacts are downloaded from the Hugging Face hub ({@code sentence-transformers/<name>} unless the
 *       name already names an organization) into a temporary file, then moved into place, so an interrupted
 *       download never leaves a partial artifact in the cache.</li>
 *   <li>The cached files are opened as a LangChain4j {@link OnnxEmbeddingModel} with mean pooling, which is how
 *       sentence-transformers models pool their token embeddings.</li>
 * </ul>
 * <p>
 * Error handling: HTTP and I/O failures are thrown to the caller; {@link EmbeddingModelManager} logs them and
 * falls back to lexical scoring.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class OnnxModelLoader implements EmbeddingModelLoader {
    private static final Logger logger = LoggerFactory.getLogger(OnnxModelLoader.class);

    public static final String MODEL_FILE = "model.onnx";
    public static final String TOKENIZER_FILE = "tokenizer.json";
    public static final String DEFAULT_HUB_URL = "https://huggingface.co";
    private static final String DEFAULT_ORGANIZATION = "sentence-transformers";

    private final String hubUrl;
    private final HttpClient client;

    public OnnxModelLoader() {
        this(DEFAULT_HUB_URL);
    }

    public OnnxModelLoader(String hubUrl) {
        this.hubUrl = hubUrl.endsWith("/") ? hubUrl.substring(0, hubUrl.length() - 1) : hubUrl;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(30))
            .build();
    }

    @Override
    public EmbeddingModel load(String modelName, Path modelDirectory) throws IOException, InterruptedException {
        if (!isCached(modelDirectory)) {
            logger.info("Model '{}' not cached in {}. Downloading.", modelName, modelDirectory);
            download(modelName, modelDirectory);
        }
        return new OnnxEmbeddingModel(
            modelDirectory.resolve(MODEL_FILE).toString(),
            modelDirectory.resolve(TOKENIZER_FILE).toString(),
            PoolingMode.MEAN);
    }

    @Override
    public boolean isCached(Path modelDirectory) {
        if (modelDirectory == null) return false;
        return Files.isRegularFile(modelDirectory.resolve(MODEL_FILE))
            && Files.isRegularFile(modelDirectory.resolve(TOKENIZER_FILE));
    }

    /**
     * Hub repository for a model name, e.g. {@code sentence-transformers/all-MiniLM-L6-v2}.
     * @param modelName configured model name
     * @return repository id
     */
    static String repositoryFor(String modelName) {
        return modelName.contains("/") ? modelName : DEFAULT_ORGANIZATION + "/" + modelName;
    }

    private void download(String modelName, Path modelDirectory) throws IOException, InterruptedException {
        Files.createDirectories(modelDirectory);
        String base = hubUrl + "/" + repositoryFor(modelName) + "/resolve/main/";
        for (String[] artifact : List.of(
                new String[]{"onnx/" + MODEL_FILE, MODEL_FILE},
                new String[]{TOKENIZER_FILE, TOKENIZER_FILE})) {
            Path target = modelDirectory.resolve(artifact[1]);
            if (Files.isRegularFile(target)) continue;
            fetch(URI.create(base + artifact[0]), target);
        }
    }

    private void fetch(URI uri, Path target) throws IOException, InterruptedException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".part");
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .header("User-Agent", "PlaylistMatch/1.0")
                .GET()
                .build();
            HttpResponse<Path> response = client.send(request,
                HttpResponse.BodyHandlers.ofFile(tmp));
            if (response.statusCode() != 200) {
                throw new IOException("Download of " + uri + " failed with HTTP " + response.statusCode());
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.info("Downloaded {} ({} bytes)", target, Files.size(target));
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
