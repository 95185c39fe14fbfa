package com.playlistmatch.matcher;

/**
 * Three-way outcome assigned to a title's best candidate.
 */
public enum MatchTier {
    MATCHED("matched"),
    LOW_CONFIDENCE("low_confidence"),
    // Reserved for titles whose candidate set was empty.
    NOT_FOUND("not_found");

    private final String label;

    MatchTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
