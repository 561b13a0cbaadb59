package com.prism.perspective.infra.management;

import com.prism.perspective.api.model.ApplyTo;
import com.prism.perspective.api.model.Modifier;
import com.prism.perspective.api.model.ModifierDefinition;
import com.prism.perspective.api.model.ModifierType;
import com.prism.perspective.api.model.NextRuleCondition;
import com.prism.perspective.api.model.Perspective;
import com.prism.perspective.api.model.PerspectiveDefinition;
import com.prism.perspective.api.model.Rule;
import com.prism.perspective.api.model.RuleDefinition;
import com.prism.perspective.api.model.RuleResultOperator;
import com.prism.perspective.compiler.CriteriaParser;
import com.prism.perspective.runtime.model.PerspectiveConfiguration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns stored definitions into domain objects, parsing their criteria.
 */
public final class PerspectiveFactory {

    private final CriteriaParser criteriaParser;

    public PerspectiveFactory(CriteriaParser criteriaParser) {
        this.criteriaParser = criteriaParser;
    }

    /**
     * Builds a perspective, naming its rules {@code rule_<index>}.
     *
     * @param requiredColumns receives the {@code required_columns} hints of the rules
     */
    public Perspective perspective(int id, PerspectiveDefinition definition,
                                   Map<String, List<String>> requiredColumns) {
        List<Rule> rules = new ArrayList<>(definition.rules().size());
        for (int i = 0; i < definition.rules().size(); i++) {
            rules.add(rule("rule_" + i, definition.rules().get(i), requiredColumns));
        }
        return new Perspective(id, definition.name(), definition.active(), definition.supported(), rules);
    }

    public Rule rule(String name, RuleDefinition definition, Map<String, List<String>> requiredColumns) {
        CriteriaParser.ParsedCriteria parsed = criteriaParser.parse(definition.criteria());
        PerspectiveConfiguration.mergeRequiredColumns(requiredColumns, parsed.requiredColumns());
        return new Rule(
                name,
                ApplyTo.parse(definition.applyTo()),
                parsed.criteria(),
                NextRuleCondition.parse(definition.conditionForNextRule()),
                definition.scalingRule(),
                definition.scaleFactor() / 100.0);
    }

    public Modifier modifier(ModifierDefinition definition) {
        return new Modifier(
                definition.name(),
                ApplyTo.parse(definition.applyTo()),
                ModifierType.parse(definition.type()),
                criteriaParser.parseTree(definition.criteria()),
                RuleResultOperator.parse(definition.ruleResultOperator()),
                definition.requiredColumns(),
                definition.overrideModifiers());
    }
}
