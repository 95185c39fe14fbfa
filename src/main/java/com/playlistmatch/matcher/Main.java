package com.playlistmatch.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Main entry point for matching a list of video titles against a catalog export.
 * <p>
 * Usage: {@code Main <titles.txt> <catalog.csv> [settings.json]}
 * <ul>
 *   <li>{@code titles.txt}: one raw title per line; blank lines are skipped.</li>
 *   <li>{@code catalog.csv}: {@code id,name,contributors} rows, see {@link CsvCatalogSearchProvider}.</li>
 *   <li>{@code settings.json}: optional, see {@link MatchSettingsService}; defaults to {@code .app_settings.json}.</li>
 * </ul>
 * The report is written to {@code match-reports/<titles file>_<timestamp>.csv}.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final Path REPORT_DIR = Paths.get("match-reports");

    public static void main(String[] args) {
        if (args.length < 2) {
            logger.error("Usage: Main <titles.txt> <catalog.csv> [settings.json]");
            System.exit(2);
        }
        try {
            Path settings = Paths.get(args.length > 2 ? args[2] : MatchSettingsService.DEFAULT_SETTINGS_PATH);
            Path report = run(Paths.get(args[0]), Paths.get(args[1]), settings, REPORT_DIR);
            logger.info("Report written to {}", report.toAbsolutePath());
        } catch (IOException e) {
            logger.error("Matching failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Runs one batch end to end.
     * @param titlesFile file with one raw title per line
     * @param catalogFile catalog CSV
     * @param settingsFile settings JSON (may not exist)
     * @param reportDir directory for the CSV report
     * @return path of the written report
     * @throws IOException if an input cannot be read or the report cannot be written
     */
    static Path run(Path titlesFile, Path catalogFile, Path settingsFile, Path reportDir) throws IOException {
        MatchSettingsService settingsService = new MatchSettingsService();
        MatchingConfig config = settingsService.resolve(settingsFile);
        EmbeddingModelManager embeddings = new EmbeddingModelManager(settingsService.modelCacheDirectory());
        logger.info("Embedding model status: {}", embeddings.status());

        List<String> titles = readTitles(titlesFile);
        CatalogSearchProvider catalog = CsvCatalogSearchProvider.fromCsv(catalogFile);

        Thread worker = Thread.currentThread();
        MatchBatchResult batch = new MatchService(embeddings).matchAll(titles, catalog, config,
            (current, total, label) -> logger.debug("Progress {}/{}: {}", current, total, label),
            worker::isInterrupted);
        if (batch.cancelled()) {
            logger.warn("Matching cancelled after {} of {} titles", batch.results().size(), titles.size());
        }

        String stem = Utils.sanitizeFilename(titlesFile.getFileName().toString().replaceFirst("\\.[^.]*$", ""));
        String stamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        Path report = reportDir.resolve(stem + "_" + stamp + ".csv");
        new CsvService().writeMatchReport(batch.results(), report);
        return report;
    }

    static List<String> readTitles(Path titlesFile) throws IOException {
        return Files.readAllLines(titlesFile, StandardCharsets.UTF_8).stream()
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toList());
    }
}
