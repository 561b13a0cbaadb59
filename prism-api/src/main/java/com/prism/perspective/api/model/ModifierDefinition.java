package com.prism.perspective.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Modifier as declared in the supported-modifier table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModifierDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("apply_to") String applyTo,
        @JsonProperty("modifier_type") String type,
        @JsonProperty("criteria") JsonNode criteria,
        @JsonProperty("rule_result_operator") String ruleResultOperator,
        @JsonProperty("required_columns") Map<String, List<String>> requiredColumns,
        @JsonProperty("override_modifiers") List<String> overrideModifiers
) {

    public Map<String, List<String>> requiredColumns() {
        return requiredColumns != null ? requiredColumns : Map.of();
    }

    public List<String> overrideModifiers() {
        return overrideModifiers != null ? overrideModifiers : List.of();
    }
}
