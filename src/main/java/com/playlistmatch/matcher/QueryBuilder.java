package com.playlistmatch.matcher;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a raw title into search queries of increasing looseness.
 * <p>
 * Insertion order, skipping empty strings and exact duplicates:
 * <ol>
 *   <li>{@code "{contributor} {work}"} when a contributor was parsed</li>
 *   <li>the provider's structured field query when a contributor was parsed</li>
 *   <li>the normalized title</li>
 *   <li>the raw title, verbatim</li>
 * </ol>
 * A non-blank title always yields at least one query; a blank title yields none.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class QueryBuilder {
    private final TitleNormalizer normalizer;
    private final ArtistTitleParser parser;
    private final StructuredQueryFormatter structuredFormatter;

    public QueryBuilder() {
        this(new TitleNormalizer(), StructuredQueryFormatter.SPOTIFY);
    }

    public QueryBuilder(TitleNormalizer normalizer, StructuredQueryFormatter structuredFormatter) {
        this.normalizer = normalizer == null ? new TitleNormalizer() : normalizer;
        this.parser = new ArtistTitleParser(this.normalizer);
        this.structuredFormatter = structuredFormatter == null ? StructuredQueryFormatter.SPOTIFY : structuredFormatter;
    }

    /**
     * Builds the ordered, deduplicated query list for a title.
     * @param raw raw title (may be null)
     * @return immutable list of queries, possibly empty
     */
    public List<String> buildQueries(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        Set<String> queries = new LinkedHashSet<>();
        ParsedTitle parsed = parser.parse(raw);
        if (parsed.hasContributor() && !parsed.work().isBlank()) {
            add(queries, parsed.contributor() + " " + parsed.work());
            add(queries, structuredFormatter.format(parsed.contributor(), parsed.work()));
        }
        add(queries, normalizer.normalize(raw));
        add(queries, raw);
        return List.copyOf(new ArrayList<>(queries));
    }

    private static void add(Set<String> queries, String query) {
        if (query != null && !query.isEmpty()) {
            queries.add(query);
        }
    }
}
