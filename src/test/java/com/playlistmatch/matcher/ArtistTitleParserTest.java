package com.playlistmatch.matcher;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ArtistTitleParserTest {
    private final ArtistTitleParser parser = new ArtistTitleParser();

    @Test
    void testDashSeparator() {
        ParsedTitle parsed = parser.parse("The Beatles - Hey Jude");
        assertEquals("The Beatles", parsed.contributor());
        assertEquals("Hey Jude", parsed.work());
    }

    @Test
    void testColonSeparator() {
        ParsedTitle parsed = parser.parse("Pink Floyd: Comfortably Numb");
        assertEquals("Pink Floyd", parsed.contributor());
        assertEquals("Comfortably Numb", parsed.work());
    }

    @Test
    void testByKeyword() {
        ParsedTitle parsed = parser.parse("Bohemian Rhapsody BY Queen");
        assertEquals("Queen", parsed.contributor());
        assertEquals("Bohemian Rhapsody", parsed.work());
    }

    @Test
    void testQuotedWork() {
        ParsedTitle parsed = parser.parse("Artist \"Song Title\"");
        assertEquals("Artist", parsed.contributor());
        assertEquals("Song Title", parsed.work());

        ParsedTitle curly = parser.parse("Artist “Song Title”");
        assertEquals("Artist", curly.contributor());
        assertEquals("Song Title", curly.work());
    }

    @Test
    void testNoPatternMatch() {
        ParsedTitle parsed = parser.parse("Random Words With No Separator");
        assertNull(parsed.contributor());
        assertFalse(parsed.hasContributor());
        assertEquals("Random Words With No Separator", parsed.work());
    }

    @Test
    void testNoiseIsRemovedBeforeParsing() {
        ParsedTitle parsed = parser.parse("Artist - Song (Live)");
        assertEquals("Artist", parsed.contributor());
        assertTrue(parsed.work().contains("Song"));
        assertFalse(parsed.work().contains("(Live)"));

        ParsedTitle cluttered = parser.parse("Metallica - Enter Sandman [Official Music Video] HD");
        assertEquals("Metallica", cluttered.contributor());
        assertEquals("Enter Sandman", cluttered.work());
    }

    @Test
    void testPipeBecomesDashSeparator() {
        ParsedTitle parsed = parser.parse("Daft Punk | One More Time");
        assertEquals("Daft Punk", parsed.contributor());
        assertEquals("One More Time", parsed.work());
    }

    @Test
    void testDashTakesPriorityOverColon() {
        ParsedTitle parsed = parser.parse("Artist - Song: Part 2");
        assertEquals("Artist", parsed.contributor());
        assertEquals("Song: Part 2", parsed.work());
    }

    @Test
    void testOnlyFirstDashSplits() {
        ParsedTitle parsed = parser.parse("Artist - Song - Remix Edit");
        assertEquals("Artist", parsed.contributor());
        assertEquals("Song - Remix Edit", parsed.work());
    }

    @Test
    void testEmptyInput() {
        ParsedTitle parsed = parser.parse("");
        assertNull(parsed.contributor());
        assertEquals("", parsed.work());
        assertEquals("", parser.parse(null).work());
    }
}
