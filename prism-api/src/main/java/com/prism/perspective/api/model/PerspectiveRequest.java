package com.prism.perspective.api.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Parsed request envelope.
 *
 * @param perspectiveConfigurations config name to perspective id to requested modifiers
 * @param positionWeightLabels      weight columns of position records
 * @param lookthroughWeightLabels   weight columns of lookthrough records
 * @param verbose                   add removal summaries and scale factors to the output
 * @param flatten                   emit columnar blocks instead of per-record maps
 * @param effectiveDate             as-of date for reference data
 * @param systemVersionTimestamp    optional reference snapshot, may be null
 * @param customPerspectiveRules    raw custom perspective definitions, may be null
 * @param data                      the request root holding the containers
 */
public record PerspectiveRequest(
        Map<String, Map<Integer, List<String>>> perspectiveConfigurations,
        List<String> positionWeightLabels,
        List<String> lookthroughWeightLabels,
        boolean verbose,
        boolean flatten,
        String effectiveDate,
        String systemVersionTimestamp,
        JsonNode customPerspectiveRules,
        JsonNode data) {

    public static final String DEFAULT_EFFECTIVE_DATE = "2024-01-01";
    public static final List<String> DEFAULT_WEIGHT_LABELS = List.of("weight");
}
