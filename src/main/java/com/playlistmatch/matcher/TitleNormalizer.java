package com.playlistmatch.matcher;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Strips noise from raw video titles before parsing, searching and scoring.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Removes bracketed {@code [...]} and parenthesized {@code (...)} spans, non-greedy, with their contents.</li>
 *   <li>Removes noise phrases ("official video", "lyrics", "hd", "feat." ...) as case-insensitive whole words.</li>
 *   <li>Replaces pipe and bullet separators with a hyphen.</li>
 *   <li>Collapses whitespace runs and trims.</li>
 * </ul>
 * The pass is repeated until the output stops changing, so {@code normalize(normalize(x)) == normalize(x)}:
 * removing one phrase can bring the words of another phrase together.
 * <p>
 * Never throws; null or empty input yields an empty string.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class TitleNormalizer {

    /** Default noise phrases, longest variants first. */
    public static final List<String> DEFAULT_NOISE_PHRASES = List.of(
        "official music video", "official video", "official audio",
        "lyric video", "music video", "full album", "full song",
        "lyrics", "audio", "video",
        "hd", "hq", "4k", "1080p", "720p",
        "official", "original", "explicit",
        "ft.", "feat.", "featuring"
    );

    private static final Pattern SQUARE_BRACKETS = Pattern.compile("\\[.*?]");
    private static final Pattern PARENTHESES = Pattern.compile("\\(.*?\\)");
    private static final Pattern SEPARATORS = Pattern.compile("[|•●]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Pattern noisePattern;

    public TitleNormalizer() {
        this(DEFAULT_NOISE_PHRASES);
    }

    /**
     * @param noisePhrases phrases removed as whole words, case-insensitively
     */
    public TitleNormalizer(List<String> noisePhrases) {
        this.noisePattern = compileNoisePattern(noisePhrases == null ? List.of() : noisePhrases);
    }

    /**
     * Normalizes a raw title.
     * @param raw raw title (may be null)
     * @return normalized title, possibly empty
     */
    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        // After the first pass every change shortens the string, so this terminates.
        String current = raw;
        String next = singlePass(current);
        while (!next.equals(current)) {
            current = next;
            next = singlePass(current);
        }
        return next;
    }

    private String singlePass(String title) {
        String result = SQUARE_BRACKETS.matcher(title).replaceAll("");
        result = PARENTHESES.matcher(result).replaceAll("");
        if (noisePattern != null) {
            result = noisePattern.matcher(result).replaceAll("");
        }
        result = SEPARATORS.matcher(result).replaceAll("-");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    private static Pattern compileNoisePattern(List<String> phrases) {
        List<String> alternatives = phrases.stream()
            .filter(p -> p != null && !p.isBlank())
            .map(p -> p.trim().toLowerCase(Locale.ROOT))
            .sorted((a, b) -> Integer.compare(b.length(), a.length()))
            .map(TitleNormalizer::phraseRegex)
            .collect(Collectors.toList());
        if (alternatives.isEmpty()) {
            return null;
        }
        // Whole word: no letter, digit or underscore directly before or after the phrase.
        return Pattern.compile("(?<![\\p{L}\\p{N}_])(?:" + String.join("|", alternatives) + ")(?![\\p{L}\\p{N}_])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String phraseRegex(String phrase) {
        return WHITESPACE.splitAsStream(phrase).map(Pattern::quote).collect(Collectors.joining("\\s+"));
    }
}
