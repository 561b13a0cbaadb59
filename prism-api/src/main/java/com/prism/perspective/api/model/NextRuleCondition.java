package com.prism.perspective.api.model;

import com.prism.perspective.api.exceptions.ConfigurationException;

/**
 * How a rule's result combines with the rule that follows it.
 */
public enum NextRuleCondition {
    AND,
    OR,
    NONE;

    public static NextRuleCondition parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        if (raw.equalsIgnoreCase("and")) {
            return AND;
        }
        if (raw.equalsIgnoreCase("or")) {
            return OR;
        }
        throw new ConfigurationException("Unknown condition_for_next_rule: " + raw);
    }
}
