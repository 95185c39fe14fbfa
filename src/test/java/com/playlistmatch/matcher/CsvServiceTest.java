package com.playlistmatch.matcher;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {
    private final CsvService csvService = new CsvService();

    @Test
    void testWriteMatchReport(@TempDir Path dir) throws IOException, CsvException {
        Candidate heyJude = new Candidate("t1", "Hey Jude", List.of("The Beatles"));
        Candidate song = new Candidate("t3", "Song", List.of("Artist1", "Artist2"));
        List<MatchResult> results = List.of(
            new MatchResult("The Beatles - Hey Jude", heyJude, MatchTier.MATCHED, 1.0),
            new MatchResult("Artist1 & Artist2 - Something", song, MatchTier.LOW_CONFIDENCE, 0.41237),
            MatchResult.notFound("Unknown, \"quoted\" title")
        );
        Path target = dir.resolve("reports").resolve("batch.csv");
        csvService.writeMatchReport(results, target);

        try (Reader in = Files.newBufferedReader(target, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            List<String[]> lines = reader.readAll();
            assertEquals(4, lines.size());
            assertArrayEquals(CsvService.HEADER, lines.get(0));
            assertArrayEquals(new String[]{"The Beatles - Hey Jude", MatchTier.MATCHED.label(), "1.0000", "t1",
                "Hey Jude", "The Beatles"}, lines.get(1));
            assertArrayEquals(new String[]{"Artist1 & Artist2 - Something", MatchTier.LOW_CONFIDENCE.label(),
                "0.4124", "t3", "Song", "Artist1; Artist2"}, lines.get(2));
            assertArrayEquals(new String[]{"Unknown, \"quoted\" title", MatchTier.NOT_FOUND.label(), "", "", "", ""},
                lines.get(3));
        }
    }

    @Test
    void testMultilineTitleStaysOnOneRow(@TempDir Path dir) throws IOException, CsvException {
        Path target = dir.resolve("multiline.csv");
        csvService.writeMatchReport(List.of(MatchResult.notFound("Line one\nLine two")), target);
        try (Reader in = Files.newBufferedReader(target, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            assertEquals("Line one Line two", reader.readAll().get(1)[0]);
        }
    }

    @Test
    void testNullArgumentsRejected(@TempDir Path dir) {
        assertThrows(IllegalArgumentException.class, () -> csvService.writeMatchReport(null, dir.resolve("x.csv")));
        assertThrows(IllegalArgumentException.class, () -> csvService.writeMatchReport(List.of(), null));
    }
}
