package com.prism.perspective.api.model;

import com.prism.perspective.api.exceptions.ConfigurationException;

/**
 * How a post-processing modifier joins the rule chain: {@code OR} rescues records
 * the rules dropped, {@code AND} restricts the ones they kept.
 */
public enum RuleResultOperator {
    AND,
    OR;

    public static RuleResultOperator parse(String raw) {
        if (raw == null || raw.isBlank() || raw.equalsIgnoreCase("and")) {
            return AND;
        }
        if (raw.equalsIgnoreCase("or")) {
            return OR;
        }
        throw new ConfigurationException("Unknown rule_result_operator: " + raw);
    }
}
