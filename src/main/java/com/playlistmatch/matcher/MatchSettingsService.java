package com.playlistmatch.matcher;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the {@link MatchingConfig} for a run.
 * <p>
 * Sources, in order:
 * <ul>
 *   <li>A JSON settings file ({@code .app_settings.json} by default) with the keys {@code matching_mode},
 *       {@code embedding_model}, {@code matching_threshold}, {@code per_query_limit} and {@code candidate_cap}.
 *       Unknown keys (API credentials and the like) are ignored. A file that fails validation is not used.</li>
 *   <li>Environment variables, then JVM system properties: {@code MATCHING_MODE}, {@code EMBEDDING_MODEL},
 *       {@code MATCHING_THRESHOLD}, {@code MATCH_PER_QUERY_LIMIT}, {@code MATCH_CANDIDATE_CAP}.</li>
 *   <li>{@link MatchingConfig#defaults()}.</li>
 * </ul>
 * Choosing the {@code string_only} model always means lexical matching.
 *
 * @author Playlist Match Team
 * @since 1.0
 */
public class MatchSettingsService {
    private static final Logger logger = LoggerFactory.getLogger(MatchSettingsService.class);

    public static final String DEFAULT_SETTINGS_PATH = ".app_settings.json";
    public static final String KEY_MODE = "matching_mode";
    public static final String KEY_MODEL = "embedding_model";
    public static final String KEY_THRESHOLD = "matching_threshold";
    public static final String KEY_PER_QUERY_LIMIT = "per_query_limit";
    public static final String KEY_CANDIDATE_CAP = "candidate_cap";

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Validates raw settings values.
     * @param settings parsed settings map
     * @return error messages; empty when the settings are valid
     */
    public List<String> validate(Map<String, Object> settings) {
        List<String> errors = new ArrayList<>();
        if (settings == null) {
            errors.add("Settings are missing");
            return errors;
        }
        Object mode = settings.get(KEY_MODE);
        if (mode != null) {
            try {
                MatchingMode.fromString(String.valueOf(mode));
            } catch (IllegalArgumentException e) {
                errors.add("Matching mode must be 'lexical' or 'semantic'");
            }
        }
        Object model = settings.get(KEY_MODEL);
        if (model != null && !EmbeddingModelManager.KNOWN_MODELS.contains(String.valueOf(model))) {
            errors.add("Invalid embedding model. Must be one of: " + String.join(", ", EmbeddingModelManager.KNOWN_MODELS));
        }
        if (settings.containsKey(KEY_THRESHOLD)) {
            Object threshold = settings.get(KEY_THRESHOLD);
            if (!(threshold instanceof Number n) || Double.isNaN(n.doubleValue())
                    || n.doubleValue() < 0.0 || n.doubleValue() > 1.0) {
                errors.add("Matching confidence threshold must be a number between 0.0 and 1.0");
            }
        }
        for (String key : List.of(KEY_PER_QUERY_LIMIT, KEY_CANDIDATE_CAP)) {
            if (settings.containsKey(key)) {
                Object value = settings.get(key);
                if (!(value instanceof Integer i) || i < 1) {
                    errors.add(key + " must be a positive integer");
                }
            }
        }
        return errors;
    }

    /**
     * Loads and validates a JSON settings file.
     * @param settingsFile path to the file
     * @return the configuration, or empty if the file is missing, unreadable or invalid
     */
    public Optional<MatchingConfig> loadSettings(Path settingsFile) {
        if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
            logger.info("Settings file does not exist: {}", settingsFile);
            return Optional.empty();
        }
        Map<String, Object> settings;
        try {
            settings = mapper.readValue(settingsFile.toFile(), new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            logger.error("Failed to load settings from {}: {}", settingsFile, e.getMessage());
            return Optional.empty();
        }
        List<String> errors = validate(settings);
        if (!errors.isEmpty()) {
            logger.warn("Settings validation failed for {}: {}", settingsFile, errors);
            return Optional.empty();
        }
        logger.info("Using settings from {}", settingsFile);
        return Optional.of(toConfig(settings));
    }

    /**
     * Builds the configuration from environment variables and system properties.
     * Unparseable values are logged and replaced by defaults.
     * @return configuration
     */
    public MatchingConfig fromEnvironment() {
        MatchingConfig defaults = MatchingConfig.defaults();
        MatchingMode mode = defaults.mode();
        String modeValue = Utils.envOrProp("MATCHING_MODE", null);
        if (modeValue != null) {
            try {
                mode = MatchingMode.fromString(modeValue);
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring invalid MATCHING_MODE '{}'", modeValue);
            }
        }
        String model = Utils.envOrProp("EMBEDDING_MODEL", defaults.embeddingModelName());
        double threshold = parseDouble("MATCHING_THRESHOLD", defaults.threshold());
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            logger.warn("Ignoring out-of-range MATCHING_THRESHOLD {}", threshold);
            threshold = defaults.threshold();
        }
        int perQuery = parsePositiveInt("MATCH_PER_QUERY_LIMIT", defaults.perQueryLimit());
        int cap = parsePositiveInt("MATCH_CANDIDATE_CAP", defaults.candidateCap());
        return build(mode, model, threshold, perQuery, cap);
    }

    /**
     * Settings file when usable, otherwise the environment.
     * @param settingsFile settings file (may be null)
     * @return configuration
     */
    public MatchingConfig resolve(Path settingsFile) {
        return loadSettings(settingsFile).orElseGet(this::fromEnvironment);
    }

    /**
     * Root directory of the embedding model cache: {@code MODEL_CACHE_DIR}, or {@code ~/.cache/playlist-match/models}.
     * @return cache directory
     */
    public Path modelCacheDirectory() {
        String configured = Utils.envOrProp("MODEL_CACHE_DIR", null);
        if (configured != null) {
            return Paths.get(configured);
        }
        return Paths.get(System.getProperty("user.home"), ".cache", "playlist-match", "models");
    }

    private MatchingConfig toConfig(Map<String, Object> settings) {
        MatchingConfig defaults = MatchingConfig.defaults();
        Object mode = settings.get(KEY_MODE);
        Object model = settings.get(KEY_MODEL);
        Object threshold = settings.get(KEY_THRESHOLD);
        Object perQuery = settings.get(KEY_PER_QUERY_LIMIT);
        Object cap = settings.get(KEY_CANDIDATE_CAP);
        return build(
            mode == null ? defaults.mode() : MatchingMode.fromString(String.valueOf(mode)),
            model == null ? defaults.embeddingModelName() : String.valueOf(model),
            threshold == null ? defaults.threshold() : ((Number) threshold).doubleValue(),
            perQuery == null ? defaults.perQueryLimit() : (Integer) perQuery,
            cap == null ? defaults.candidateCap() : (Integer) cap);
    }

    private static MatchingConfig build(MatchingMode mode, String model, double threshold, int perQuery, int cap) {
        MatchingMode effective = EmbeddingModelManager.LEXICAL_ONLY.equals(model) ? MatchingMode.LEXICAL : mode;
        return new MatchingConfig(effective, model, threshold, perQuery, cap);
    }

    private static double parseDouble(String key, double defaultVal) {
        String value = Utils.envOrProp(key, null);
        if (value == null) return defaultVal;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {} '{}'", key, value);
            return defaultVal;
        }
    }

    private static int parsePositiveInt(String key, int defaultVal) {
        String value = Utils.envOrProp(key, null);
        if (value == null) return defaultVal;
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) return parsed;
        } catch (NumberFormatException e) {
            logger.debug("Could not parse {} '{}': {}", key, value, e.getMessage());
        }
        logger.warn("Ignoring invalid {} '{}'", key, value);
        return defaultVal;
    }
}
