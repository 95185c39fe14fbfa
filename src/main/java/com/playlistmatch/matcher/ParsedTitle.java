package com.playlistmatch.matcher;

/**
 * Best-effort (contributor, work) pair extracted from a raw title by {@link ArtistTitleParser}.
 *
 * @param contributor artist part, or null when no separator pattern matched
 * @param work track part; never null, falls back to the normalized title
 */
public record ParsedTitle(String contributor, String work) {

    public ParsedTitle {
        work = work == null ? "" : work;
    }

    public boolean hasContributor() {
        return contributor != null && !contributor.isBlank();
    }
}
