package com.playlistmatch.matcher;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV export of match results.
 */
public interface CsvServiceInterface {
    /**
     * Writes match results to a CSV file with a header row.
     * @param results results to export, in batch order
     * @param target output file; parent directories are created
     * @throws IOException if file writing fails
     */
    void writeMatchReport(List<MatchResult> results, Path target) throws IOException;
}
