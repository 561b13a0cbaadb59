package com.prism.perspective.api.model;

import java.util.List;

/**
 * Named, ordered list of rules. Custom perspectives supplied with a request carry
 * non-positive ids.
 */
public record Perspective(int id, String name, boolean active, boolean supported, List<Rule> rules) {

    public Perspective {
        rules = List.copyOf(rules);
    }

    public boolean isCustom() {
        return id <= 0;
    }
}
