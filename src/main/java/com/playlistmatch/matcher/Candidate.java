package com.playlistmatch.matcher;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable record representing one catalog entry returned by a {@link CatalogSearchProvider}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Created by the search provider adapter; read-only to the matching core.</li>
 *   <li>Identity is the catalog id: {@link CandidateCollector} deduplicates on it across queries.</li>
 *   <li>A missing name becomes an empty string and a missing contributor list becomes empty, so incomplete
 *       catalog records still flow through the batch and simply score 0 (see {@link #isComplete()}).</li>
 * </ul>
 *
 * @param id catalog-unique identifier (required)
 * @param name track name
 * @param contributors performing artists, in catalog order
 * @author Playlist Match Team
 * @since 1.0
 */
public record Candidate(String id, String name, List<String> contributors) {

    public Candidate {
        Objects.requireNonNull(id, "Candidate id cannot be null");
        name = name == null ? "" : name.trim();
        contributors = contributors == null
            ? List.of()
            : contributors.stream().filter(Objects::nonNull).map(String::trim).filter(c -> !c.isEmpty()).toList();
    }

    /**
     * Label used for scoring: contributors joined by a space, then the name.
     * @return formatted label, trimmed
     */
    public String label() {
        return (contributorsJoined() + " " + name).trim();
    }

    public String contributorsJoined() {
        return String.join(" ", contributors);
    }

    /**
     * Human-readable form for logs and reports, e.g. {@code "Artist1, Artist2 - Song"}; just the name when there
     * are no contributors.
     * @return display label
     */
    public String displayLabel() {
        if (contributors.isEmpty()) {
            return name;
        }
        return contributors.stream().collect(Collectors.joining(", ")) + " - " + name;
    }

    /**
     * @return true when both the name and at least one contributor are present
     */
    public boolean isComplete() {
        return !name.isBlank() && !contributors.isEmpty();
    }
}
