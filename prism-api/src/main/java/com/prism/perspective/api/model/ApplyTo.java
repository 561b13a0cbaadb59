package com.prism.perspective.api.model;

import com.prism.perspective.api.exceptions.ConfigurationException;

import java.util.Locale;

/**
 * Record kinds a rule or modifier applies to.
 */
public enum ApplyTo {
    POSITION,
    LOOKTHROUGH,
    BOTH;

    public boolean appliesTo(RecordMode mode) {
        return switch (this) {
            case BOTH -> true;
            case POSITION -> mode == RecordMode.POSITION;
            case LOOKTHROUGH -> mode == RecordMode.LOOKTHROUGH;
        };
    }

    /**
     * Parses the stored form. {@code holding} is a synonym of position and
     * {@code reference} of lookthrough; matching ignores case. A missing value
     * means both.
     */
    public static ApplyTo parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return BOTH;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "both" -> BOTH;
            case "holding", "position" -> POSITION;
            case "lookthrough", "reference" -> LOOKTHROUGH;
            default -> throw new ConfigurationException("Unknown apply_to value: " + raw);
        };
    }
}
