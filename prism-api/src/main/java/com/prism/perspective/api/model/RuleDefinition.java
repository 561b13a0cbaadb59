package com.prism.perspective.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Rule as stored. {@code criteria} is either a JSON object or a string holding one,
 * and may carry a {@code required_columns} hint next to the filter itself.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDefinition(
        @JsonProperty("apply_to") String applyTo,
        @JsonProperty("criteria") JsonNode criteria,
        @JsonProperty("condition_for_next_rule") String conditionForNextRule,
        @JsonProperty("is_scaling_rule") Boolean scalingRule,
        @JsonProperty("scale_factor") Double scaleFactor
) {

    public Boolean scalingRule() {
        return scalingRule != null ? scalingRule : false;
    }

    /** Stored percentage, 100 when absent. */
    public Double scaleFactor() {
        return scaleFactor != null ? scaleFactor : Rule.DEFAULT_SCALE_PERCENT;
    }
}
