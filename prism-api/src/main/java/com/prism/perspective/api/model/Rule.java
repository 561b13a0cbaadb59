package com.prism.perspective.api.model;

/**
 * One step of a perspective.
 *
 * @param name                 positional name, {@code rule_<index>}
 * @param applyTo              record kinds the rule applies to
 * @param criteria             filter, {@code null} matches everything
 * @param conditionForNextRule how the following rule joins the chain
 * @param scalingRule          scaling rules multiply the factor instead of filtering
 * @param scaleFactor          multiplier, already divided by 100
 */
public record Rule(
        String name,
        ApplyTo applyTo,
        Criteria criteria,
        NextRuleCondition conditionForNextRule,
        boolean scalingRule,
        double scaleFactor) {

    public static final double DEFAULT_SCALE_PERCENT = 100.0;

    public Rule {
        if (applyTo == null) {
            applyTo = ApplyTo.BOTH;
        }
        if (conditionForNextRule == null) {
            conditionForNextRule = NextRuleCondition.NONE;
        }
    }

    public boolean isApplicable(RecordMode mode) {
        return applyTo.appliesTo(mode);
    }
}
