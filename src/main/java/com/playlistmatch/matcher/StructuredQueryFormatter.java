package com.playlistmatch.matcher;

/**
 * Builds the search provider's field-scoped query for a parsed contributor and work.
 * The result is passed to the provider verbatim.
 */
@FunctionalInterface
public interface StructuredQueryFormatter {

    /** Spotify-style field syntax: {@code artist:"A" track:"B"}. */
    StructuredQueryFormatter SPOTIFY = (contributor, work) ->
        "artist:\"" + contributor + "\" track:\"" + work + "\"";

    String format(String contributor, String work);
}
