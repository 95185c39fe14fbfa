package com.playlistmatch.matcher;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link CatalogSearchProvider} backed by an in-memory catalog, typically loaded from a CSV export.
 * <p>
 * CSV layout: header row, then {@code id,name,contributors} with contributors separated by {@code ;}.
 * <p>
 * Search ranks entries by how many distinct query tokens occur in the entry's contributors and name; entries
 * sharing no token are not returned, and ties keep catalog order. Field-scoped syntax such as
 * {@code artist:"A" track:"B"} is understood by dropping the field prefixes.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class CsvCatalogSearchProvider implements CatalogSearchProvider {
    private static final Logger logger = LoggerFactory.getLogger(CsvCatalogSearchProvider.class);

    private static final Pattern FIELD_PREFIX = Pattern.compile("\\b\\w+:(?=\")");
    private static final Pattern NON_TOKEN = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final List<Candidate> entries;
    private final List<Set<String>> entryTokens;

    public CsvCatalogSearchProvider(List<Candidate> entries) {
        this.entries = entries == null ? List.of() : List.copyOf(entries);
        this.entryTokens = this.entries.stream()
            .map(c -> tokens(c.label()))
            .collect(Collectors.toList());
    }

    /**
     * Loads a catalog CSV.
     * @param csvFile catalog file
     * @return provider over the file's rows; malformed rows are skipped
     * @throws IOException if the file cannot be read or parsed
     */
    public static CsvCatalogSearchProvider fromCsv(Path csvFile) throws IOException {
        List<Candidate> entries = new ArrayList<>();
        try (Reader in = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            List<String[]> rows = reader.readAll();
            for (int i = 1; i < rows.size(); i++) {
                String[] row = rows.get(i);
                if (row.length < 2 || row[0] == null || row[0].isBlank()) {
                    logger.warn("Skipping malformed catalog row {} in {}", i + 1, csvFile);
                    continue;
                }
                List<String> contributors = row.length > 2
                    ? Arrays.asList(row[2].split(";"))
                    : List.of();
                entries.add(new Candidate(row[0].trim(), row[1], contributors));
            }
        } catch (CsvException e) {
            throw new IOException("Failed to parse catalog " + csvFile + ": " + e.getMessage(), e);
        }
        logger.info("Loaded {} catalog entries from {}", entries.size(), csvFile);
        return new CsvCatalogSearchProvider(entries);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public List<Candidate> search(String query, int limit) {
        if (query == null || limit < 1) {
            return List.of();
        }
        Set<String> queryTokens = tokens(FIELD_PREFIX.matcher(query).replaceAll(""));
        if (queryTokens.isEmpty()) {
            return List.of();
        }
        List<int[]> hits = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            int overlap = 0;
            for (String token : queryTokens) {
                if (entryTokens.get(i).contains(token)) overlap++;
            }
            if (overlap > 0) hits.add(new int[]{i, overlap});
        }
        return hits.stream()
            .sorted(Comparator.comparingInt((int[] h) -> h[1]).reversed().thenComparingInt(h -> h[0]))
            .limit(limit)
            .map(h -> entries.get(h[0]))
            .collect(Collectors.toList());
    }

    private static Set<String> tokens(String text) {
        Set<String> tokens = new HashSet<>();
        for (String token : NON_TOKEN.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) tokens.add(token);
        }
        return tokens;
    }
}
