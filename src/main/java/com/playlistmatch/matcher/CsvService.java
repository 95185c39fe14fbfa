package com.playlistmatch.matcher;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Service for exporting match results to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>One row per source title, in batch order, so the report lines up with the input list.</li>
 *   <li>Not-found titles keep their row with empty candidate columns.</li>
 *   <li>Contributors are joined with {@code "; "}.</li>
 * </ul>
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String[] HEADER = {"SourceTitle", "Tier", "Score", "CandidateId", "CandidateName", "Contributors"};

    @Override
    public void writeMatchReport(List<MatchResult> results, Path target) throws IOException {
        if (results == null) {
            logger.warn("Attempted to write null result list to CSV: {}", target);
            throw new IllegalArgumentException("Result list cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("Target file cannot be null");
        }
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER);
            for (MatchResult result : results) {
                Candidate c = result.candidate();
                writer.writeNext(new String[]{
                    safe(result.sourceTitle()),
                    result.tier().label(),
                    result.score() == null ? "" : String.format(Locale.ROOT, "%.4f", result.score()),
                    c == null ? "" : safe(c.id()),
                    c == null ? "" : safe(c.name()),
                    c == null ? "" : safe(String.join("; ", c.contributors()))
                });
            }
        }
        logger.info("Wrote {} match results to CSV file: {}", results.size(), target);
    }

    /**
     * Collapses CR/LF characters into a single space so each result stays on one line.
     * @param s Input string
     * @return Sanitized string
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
