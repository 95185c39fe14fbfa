package com.playlistmatch.matcher;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a best-effort (contributor, work) pair from a raw title.
 * <p>
 * The title is normalized first, then the patterns are tried in fixed priority order and the first one whose
 * sides are both non-blank wins:
 * <ol>
 *   <li>{@code "A - B"}</li>
 *   <li>{@code "A: B"}</li>
 *   <li>{@code "B by A"} (case-insensitive)</li>
 *   <li>{@code A "B"} (straight or curly quotes)</li>
 * </ol>
 * When nothing matches the contributor is null and the work is the normalized title.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class ArtistTitleParser {

    private static final Pattern BY_KEYWORD = Pattern.compile("^(.+?)\\s+by\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED_WORK = Pattern.compile("^(.+?)\\s+[\"“”](.+?)[\"“”]");

    private final TitleNormalizer normalizer;
    private final List<Function<String, Optional<ParsedTitle>>> patterns = List.of(
        t -> splitOnce(t, " - "),
        t -> splitOnce(t, ": "),
        t -> byKeyword(t),
        t -> quotedWork(t)
    );

    public ArtistTitleParser() {
        this(new TitleNormalizer());
    }

    public ArtistTitleParser(TitleNormalizer normalizer) {
        this.normalizer = normalizer == null ? new TitleNormalizer() : normalizer;
    }

    /**
     * Parses a raw title.
     * @param raw raw title (may be null)
     * @return parsed title; never null
     */
    public ParsedTitle parse(String raw) {
        String cleaned = normalizer.normalize(raw);
        for (Function<String, Optional<ParsedTitle>> pattern : patterns) {
            Optional<ParsedTitle> parsed = pattern.apply(cleaned);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        return new ParsedTitle(null, cleaned);
    }

    private static Optional<ParsedTitle> splitOnce(String title, String separator) {
        int idx = title.indexOf(separator);
        if (idx < 0) {
            return Optional.empty();
        }
        return pair(title.substring(0, idx), title.substring(idx + separator.length()));
    }

    private static Optional<ParsedTitle> byKeyword(String title) {
        Matcher m = BY_KEYWORD.matcher(title);
        return m.find() ? pair(m.group(2), m.group(1)) : Optional.empty();
    }

    private static Optional<ParsedTitle> quotedWork(String title) {
        Matcher m = QUOTED_WORK.matcher(title);
        return m.find() ? pair(m.group(1), m.group(2)) : Optional.empty();
    }

    private static Optional<ParsedTitle> pair(String contributor, String work) {
        String c = contributor.trim();
        String w = work.trim();
        if (c.isEmpty() || w.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedTitle(c, w));
    }
}
