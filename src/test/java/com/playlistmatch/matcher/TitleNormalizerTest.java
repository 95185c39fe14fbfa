package com.playlistmatch.matcher;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TitleNormalizerTest {
    private final TitleNormalizer normalizer = new TitleNormalizer();

    @Test
    void testRemovesBracketsAndParentheses() {
        String result = normalizer.normalize("Artist - Song [Official Video] (Remastered 2011)");
        assertEquals("Artist - Song", result);
    }

    @Test
    void testRemovesNoisePhrasesCaseInsensitive() {
        assertEquals("Artist - Song", normalizer.normalize("Artist - Song Official Video LYRICS hd"));
        assertEquals("Artist - Song Other", normalizer.normalize("Artist - Song feat. Other"));
        assertEquals("Artist - Song Other", normalizer.normalize("Artist - Song ft. Other"));
    }

    @Test
    void testNoisePhrasesOnlyMatchWholeWords() {
        assertEquals("Videodrome", normalizer.normalize("Videodrome"));
        assertEquals("Audioslave - Like a Stone", normalizer.normalize("Audioslave - Like a Stone"));
        assertEquals("Shadow of the Day", normalizer.normalize("Shadow of the Day"));
    }

    @Test
    void testReplacesSeparatorsWithHyphen() {
        assertEquals("Artist - Song", normalizer.normalize("Artist | Song"));
        assertEquals("Artist - Song", normalizer.normalize("Artist • Song"));
        assertEquals("Artist - Song", normalizer.normalize("Artist ● Song"));
    }

    @Test
    void testCollapsesWhitespace() {
        String result = normalizer.normalize("  Artist   -\tSong  ");
        assertEquals("Artist - Song", result);
        assertFalse(result.contains("  "));
    }

    @Test
    void testNullAndEmptyInput() {
        assertEquals("", normalizer.normalize(null));
        assertEquals("", normalizer.normalize(""));
        assertEquals("", normalizer.normalize("(Official Video)"));
    }

    @Test
    void testPhrasesJoinedByRemovalAreRemovedToo() {
        // Dropping "hd" brings "full song" together; a second pass must not change the result.
        assertEquals("", normalizer.normalize("full hd song"));
    }

    @Test
    void testIdempotence() {
        List<String> samples = List.of(
            "The Beatles - Hey Jude (Official Video)",
            "Artist | Song [HD] • Live",
            "((nested) brackets) remain)",
            "full hd song",
            "Official Official Video Video",
            "Song by Artist (Lyrics) [4K] 1080p",
            "  spaced   out  | title ",
            "Ünïcödé - 曲 (公式) 🎵",
            "[unclosed bracket - Song",
            "A ft. B feat. C featuring D",
            ""
        );
        for (String s : samples) {
            String once = normalizer.normalize(s);
            assertEquals(once, normalizer.normalize(once), "not idempotent for: " + s);
        }
    }

    @Test
    void testCustomNoisePhrases() {
        TitleNormalizer custom = new TitleNormalizer(List.of("remastered", "live at wembley"));
        assertEquals("Queen - Song", custom.normalize("Queen - Song Remastered Live   at Wembley"));
        // Default phrases are not applied when a custom list is given.
        assertEquals("Queen - Song Lyrics", custom.normalize("Queen - Song Lyrics"));
    }
}
