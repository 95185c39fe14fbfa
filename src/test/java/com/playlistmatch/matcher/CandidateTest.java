package com.playlistmatch.matcher;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CandidateTest {

    @Test
    void testDisplayLabel() {
        assertEquals("Artist1, Artist2 - Song", new Candidate("1", "Song", List.of("Artist1", "Artist2")).displayLabel());
        assertEquals("Song", new Candidate("2", "Song", List.of()).displayLabel());
        assertEquals("Song", new Candidate("3", "Song", null).displayLabel());
    }

    @Test
    void testBlankContributorsAreDropped() {
        Candidate candidate = new Candidate("4", "  Song ", Arrays.asList(" Artist ", null, "  "));
        assertEquals(List.of("Artist"), candidate.contributors());
        assertEquals("Artist Song", candidate.label());
        assertTrue(candidate.isComplete());
        assertFalse(new Candidate("5", "Song", List.of(" ")).isComplete());
        assertFalse(new Candidate("6", null, List.of("Artist")).isComplete());
    }
}
