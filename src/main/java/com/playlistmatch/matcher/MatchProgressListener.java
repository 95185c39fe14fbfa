package com.playlistmatch.matcher;

/**
 * Receives progress after each title of a batch is finalized.
 * Implementations should return quickly; exceptions are logged and ignored by {@link MatchService}.
 */
@FunctionalInterface
public interface MatchProgressListener {

    MatchProgressListener NONE = (current, total, label) -> { };

    /**
     * @param current number of titles finalized so far (1-based)
     * @param total number of titles in the batch
     * @param shortLabel the finalized title, truncated for display
     */
    void onProgress(int current, int total, String shortLabel);
}
