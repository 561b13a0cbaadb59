package com.prism.perspective.api.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Perspective as stored, before criteria parsing. The source may split one
 * perspective across several entries with the same id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PerspectiveDefinition(
        @JsonProperty("id") Integer id,
        @JsonProperty("name") String name,
        @JsonProperty("is_active") Boolean active,
        @JsonProperty("is_compatible_with_sub_setting_service") @JsonAlias("is_supported") Boolean supported,
        @JsonProperty("rules") List<RuleDefinition> rules
) {

    public Boolean active() {
        return active != null ? active : true;
    }

    public Boolean supported() {
        return supported != null ? supported : true;
    }

    public List<RuleDefinition> rules() {
        return rules != null ? rules : List.of();
    }
}
