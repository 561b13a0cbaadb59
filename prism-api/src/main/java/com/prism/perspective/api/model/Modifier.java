package com.prism.perspective.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named, process-wide adjustment applied on top of a perspective's rules.
 *
 * @param name               unique modifier name
 * @param applyTo            record kinds it applies to
 * @param type               pre-processing, post-processing or scaling
 * @param criteria           filter, may be null for scaling modifiers
 * @param ruleResultOperator how a post-processing modifier joins the rule chain
 * @param requiredColumns    reference table to column list needed by the criteria
 * @param overrideModifiers  modifiers deactivated when this one is active
 */
public record Modifier(
        String name,
        ApplyTo applyTo,
        ModifierType type,
        Criteria criteria,
        RuleResultOperator ruleResultOperator,
        Map<String, List<String>> requiredColumns,
        List<String> overrideModifiers) {

    public Modifier {
        requiredColumns = requiredColumns == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(requiredColumns));
        overrideModifiers = overrideModifiers == null ? List.of() : List.copyOf(overrideModifiers);
        if (ruleResultOperator == null) {
            ruleResultOperator = RuleResultOperator.AND;
        }
    }

    public boolean isApplicable(RecordMode mode) {
        return applyTo.appliesTo(mode);
    }
}
