package com.playlistmatch.matcher;

/**
 * Lifecycle state reported by {@link EmbeddingModelManagerInterface#modelStatus()}.
 */
public enum ModelStatus {
    NOT_CONFIGURED("Not configured"),
    LEXICAL_ONLY("String matching only (no model needed)"),
    NOT_DOWNLOADED("Not downloaded (downloads on first use)"),
    DOWNLOADED_NOT_LOADED("Downloaded (loads on first use)"),
    LOADING("Loading"),
    LOADED("Loaded"),
    LOAD_FAILED("Load failed (using string matching)");

    private final String description;

    ModelStatus(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
