package com.prism.perspective.infra.config;

import com.prism.perspective.api.model.PerspectiveRequest;

import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Engine settings read from environment variables, falling back to JVM system
 * properties of the same name.
 *
 * <ul>
 *   <li>{@code PRISM_PERSPECTIVES_FILE}: perspective definitions for the file loader</li>
 *   <li>{@code PRISM_REFERENCE_MAX_THREADS}: upper bound of parallel reference fetches (default 8)</li>
 *   <li>{@code PRISM_NESTED_CRITERIA_STRICT}: fail on unresolved nested criteria (default false)</li>
 *   <li>{@code PRISM_DEFAULT_EFFECTIVE_DATE}: effective date when a request has no {@code ed}</li>
 * </ul>
 */
public record EngineSettings(
        Optional<Path> perspectivesFile,
        int referenceMaxThreads,
        boolean strictNestedCriteria,
        String defaultEffectiveDate) {

    private static final Logger logger = Logger.getLogger(EngineSettings.class.getName());

    public static final String PERSPECTIVES_FILE = "PRISM_PERSPECTIVES_FILE";
    public static final String REFERENCE_MAX_THREADS = "PRISM_REFERENCE_MAX_THREADS";
    public static final String NESTED_CRITERIA_STRICT = "PRISM_NESTED_CRITERIA_STRICT";
    public static final String DEFAULT_EFFECTIVE_DATE = "PRISM_DEFAULT_EFFECTIVE_DATE";

    static final int DEFAULT_REFERENCE_MAX_THREADS = 8;

    public EngineSettings {
        if (referenceMaxThreads < 1) {
            throw new IllegalArgumentException("referenceMaxThreads must be positive: " + referenceMaxThreads);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(Optional.empty(), DEFAULT_REFERENCE_MAX_THREADS, false,
                PerspectiveRequest.DEFAULT_EFFECTIVE_DATE);
    }

    public static EngineSettings fromEnvironment() {
        String file = getEnvOrProperty(PERSPECTIVES_FILE, null);
        EngineSettings settings = new EngineSettings(
                file == null || file.isBlank() ? Optional.empty() : Optional.of(Path.of(file)),
                parseThreads(getEnvOrProperty(REFERENCE_MAX_THREADS, null)),
                Boolean.parseBoolean(getEnvOrProperty(NESTED_CRITERIA_STRICT, "false")),
                getEnvOrProperty(DEFAULT_EFFECTIVE_DATE, PerspectiveRequest.DEFAULT_EFFECTIVE_DATE));
        logger.fine(() -> "Engine settings: " + settings);
        return settings;
    }

    public EngineSettings withStrictNestedCriteria(boolean strict) {
        return new EngineSettings(perspectivesFile, referenceMaxThreads, strict, defaultEffectiveDate);
    }

    public EngineSettings withReferenceMaxThreads(int threads) {
        return new EngineSettings(perspectivesFile, threads, strictNestedCriteria, defaultEffectiveDate);
    }

    private static int parseThreads(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_REFERENCE_MAX_THREADS;
        }
        try {
            int threads = Integer.parseInt(raw.trim());
            if (threads > 0) {
                return threads;
            }
        } catch (NumberFormatException e) {
            logger.warning("Invalid " + REFERENCE_MAX_THREADS + " '" + raw + "': " + e.getMessage());
        }
        logger.warning("Using default " + REFERENCE_MAX_THREADS + "=" + DEFAULT_REFERENCE_MAX_THREADS);
        return DEFAULT_REFERENCE_MAX_THREADS;
    }

    /**
     * Value of an environment variable, falling back to the system property.
     */
    static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
