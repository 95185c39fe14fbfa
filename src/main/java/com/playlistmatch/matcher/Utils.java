package com.playlistmatch.matcher;

/**
 * Utility class for common helper methods used in matching, configuration and file operations.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class Utils {
    private static final int SHORT_LABEL_LENGTH = 50;

    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/\\\\:\\s]", "_");
    }

    /**
     * Truncates a title for progress reporting.
     * @param title raw title (may be null)
     * @return the first 50 characters of the title
     */
    public static String shortLabel(String title) {
        if (title == null) return "";
        if (title.length() <= SHORT_LABEL_LENGTH) return title;
        return title.substring(0, SHORT_LABEL_LENGTH);
    }

    /**
     * Reads a setting from the environment, then from JVM system properties.
     * @param key setting name
     * @param defaultVal value used when neither source defines the key
     * @return resolved value
     */
    public static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }
}
