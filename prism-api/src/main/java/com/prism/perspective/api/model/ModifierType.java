package com.prism.perspective.api.model;

import com.prism.perspective.api.exceptions.ConfigurationException;

public enum ModifierType {
    /** Excludes matching records before any rule is consulted. */
    PRE_PROCESSING("PreProcessing"),
    /** Combined with the rule chain result through {@link RuleResultOperator}. */
    POST_PROCESSING("PostProcessing"),
    /** Marks the perspective for 100% rescaling. */
    SCALING("Scaling");

    private final String storedName;

    ModifierType(String storedName) {
        this.storedName = storedName;
    }

    public String storedName() {
        return storedName;
    }

    public static ModifierType parse(String raw) {
        for (ModifierType type : values()) {
            if (type.storedName.equalsIgnoreCase(raw)) {
                return type;
            }
        }
        throw new ConfigurationException("Unknown modifier type: " + raw);
    }
}
