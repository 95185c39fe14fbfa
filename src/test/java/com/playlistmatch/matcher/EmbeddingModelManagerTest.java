package com.playlistmatch.matcher;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class EmbeddingModelManagerTest {
    private static final String MODEL = "all-MiniLM-L6-v2";

    @TempDir
    Path cacheDir;

    private CountingModelLoader loader;
    private EmbeddingModelManager manager;

    @BeforeEach
    void setUp() {
        loader = new CountingModelLoader();
        manager = new EmbeddingModelManager(cacheDir, loader);
    }

    private void cacheModel(String name) throws IOException {
        Path dir = manager.modelDirectory(name);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(OnnxModelLoader.MODEL_FILE), "onnx");
    }

    @Test
    void testUnconfiguredManagerEncodesNothing() {
        assertEquals(Optional.empty(), manager.encode("hello"));
        assertEquals(ModelStatus.NOT_CONFIGURED, manager.modelStatus());
        assertEquals(0, loader.loads.get());
    }

    @Test
    void testStringOnlyNeverLoads() {
        manager.configure(EmbeddingModelManager.LEXICAL_ONLY);
        assertTrue(manager.encode("hello").isEmpty());
        assertFalse(manager.preload());
        assertEquals(ModelStatus.LEXICAL_ONLY, manager.modelStatus());
        assertEquals(0, loader.loads.get());
    }

    @Test
    void testConfigureIsLazy() {
        manager.configure(MODEL);
        assertEquals(0, loader.loads.get());
        assertEquals(ModelStatus.NOT_DOWNLOADED, manager.modelStatus());
        assertTrue(manager.encode("hello").isPresent());
        assertTrue(manager.encode("world").isPresent());
        assertEquals(1, loader.loads.get());
        assertEquals(ModelStatus.LOADED, manager.modelStatus());
    }

    @Test
    void testBlankModelNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> manager.configure(" "));
        assertThrows(IllegalArgumentException.class, () -> manager.configure(null));
    }

    @Test
    void testFailedLoadIsRememberedUntilNameChanges() {
        loader.fail = true;
        manager.configure(MODEL);
        assertTrue(manager.encode("hello").isEmpty());
        assertTrue(manager.encode("again").isEmpty());
        assertFalse(manager.preload());
        assertEquals(1, loader.loads.get());
        assertEquals(ModelStatus.LOAD_FAILED, manager.modelStatus());

        loader.fail = false;
        manager.configure("all-MiniLM-L12-v2");
        assertTrue(manager.encode("hello").isPresent());
        assertEquals(2, loader.loads.get());
    }

    @Test
    void testConfiguringFailedModelAgainRetriesIt() {
        loader.fail = true;
        manager.configure(MODEL);
        assertFalse(manager.preload());
        assertEquals(ModelStatus.LOAD_FAILED, manager.modelStatus());

        loader.fail = false;
        manager.configure(MODEL);
        assertEquals(MODEL, manager.configuredModelName());
        assertNotEquals(ModelStatus.LOAD_FAILED, manager.modelStatus());
        assertTrue(manager.encode("hello").isPresent());
        assertEquals(2, loader.loads.get());
    }

    @Test
    void testNativeRuntimeErrorIsRememberedAsFailure() {
        loader.error = new UnsatisfiedLinkError("no onnxruntime in java.library.path");
        manager.configure(MODEL);
        assertTrue(assertDoesNotThrow(() -> manager.encode("hello")).isEmpty());
        assertTrue(manager.encode("again").isEmpty());
        assertEquals(1, loader.loads.get());
        assertEquals(ModelStatus.LOAD_FAILED, manager.modelStatus());
    }

    @Test
    void testConcurrentFirstUseLoadsOnce() throws InterruptedException {
        loader.delayMillis = 200;
        manager.configure(MODEL);
        int threads = 6;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        List<Optional<Embedding>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String text = "text " + i;
            Thread t = new Thread(() -> {
                try {
                    start.await();
                    Optional<Embedding> e = manager.encode(text);
                    synchronized (results) {
                        results.add(e);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
            t.start();
        }
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(1, loader.loads.get());
        assertEquals(threads, results.size());
        assertTrue(results.stream().allMatch(Optional::isPresent));
    }

    @Test
    void testIsDownloaded() throws IOException {
        assertFalse(manager.isDownloaded(MODEL));
        cacheModel(MODEL);
        assertTrue(manager.isDownloaded(MODEL));
        assertFalse(manager.isDownloaded(EmbeddingModelManager.LEXICAL_ONLY));
        manager.configure(MODEL);
        assertEquals(ModelStatus.DOWNLOADED_NOT_LOADED, manager.modelStatus());
    }

    @Test
    void testDeleteUnloadsAndRemovesCache() throws IOException {
        manager.configure(MODEL);
        cacheModel(MODEL);
        assertTrue(manager.preload());

        EmbeddingModelManagerInterface.DeleteOutcome outcome = manager.delete(MODEL);
        assertTrue(outcome.deleted());
        assertTrue(outcome.message().contains(MODEL));
        assertFalse(Files.exists(manager.modelDirectory(MODEL)));
        assertFalse(manager.isDownloaded(MODEL));
        assertEquals(ModelStatus.NOT_DOWNLOADED, manager.modelStatus());

        assertTrue(manager.encode("hello").isPresent());
        assertEquals(2, loader.loads.get());
    }

    @Test
    void testDeleteMissingModel() {
        EmbeddingModelManagerInterface.DeleteOutcome outcome = manager.delete(MODEL);
        assertFalse(outcome.deleted());
        assertFalse(manager.delete(EmbeddingModelManager.LEXICAL_ONLY).deleted());
        assertFalse(manager.delete("").deleted());
    }

    @Test
    void testDeleteClearsFailure() {
        loader.fail = true;
        manager.configure(MODEL);
        assertFalse(manager.preload());
        manager.delete(MODEL);
        loader.fail = false;
        assertTrue(manager.preload());
        assertEquals(2, loader.loads.get());
    }

    @Test
    void testEncodeNormalizesVectors() {
        loader.model = fixedModel(new float[]{3f, 4f});
        manager.configure(MODEL);
        float[] vector = manager.encode("anything").orElseThrow().vector();
        assertArrayEquals(new float[]{0.6f, 0.8f}, vector, 1e-6f);
    }

    @Test
    void testZeroVectorIsUnusable() {
        loader.model = fixedModel(new float[]{0f, 0f});
        manager.configure(MODEL);
        assertTrue(manager.encode("anything").isEmpty());
    }

    @Test
    void testEmbeddingFailureIsNotThrown() {
        loader.model = new EmbeddingModel() {
            @Override
            public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
                throw new IllegalStateException("onnx runtime error");
            }
        };
        manager.configure(MODEL);
        assertDoesNotThrow(() -> manager.encode("hello"));
        assertTrue(manager.encode("hello").isEmpty());
    }

    @Test
    void testStatusNamesConfiguredModel() {
        assertEquals(ModelStatus.NOT_CONFIGURED.description(), manager.status());
        manager.configure(MODEL);
        assertTrue(manager.status().startsWith(MODEL + ": "));
    }

    @Test
    void testModelDirectoryIsSanitized() {
        assertEquals(cacheDir.resolve("org_custom-model"), manager.modelDirectory("org/custom-model"));
    }

    private static EmbeddingModel fixedModel(float[] vector) {
        return new EmbeddingModel() {
            @Override
            public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
                return Response.from(segments.stream()
                    .map(s -> Embedding.from(vector.clone()))
                    .collect(Collectors.toList()));
            }
        };
    }
}
