package com.prism.perspective.core.processing;

import com.prism.perspective.api.exceptions.ConfigurationException;
import com.prism.perspective.api.exceptions.InvalidRequestException;
import com.prism.perspective.api.model.ApplyTo;
import com.prism.perspective.api.model.Modifier;
import com.prism.perspective.api.model.ModifierType;
import com.prism.perspective.api.model.NestedValues;
import com.prism.perspective.api.model.NextRuleCondition;
import com.prism.perspective.api.model.Perspective;
import com.prism.perspective.api.model.Rule;
import com.prism.perspective.api.model.RuleResultOperator;
import com.prism.perspective.compiler.CriteriaCompiler;
import com.prism.perspective.compiler.CriteriaParser;
import com.prism.perspective.runtime.evaluation.LazyFrame;
import com.prism.perspective.runtime.frame.Column;
import com.prism.perspective.runtime.frame.Frame;
import com.prism.perspective.runtime.model.PerspectiveConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PerspectiveProcessorTest {

    private static final CriteriaParser PARSER = new CriteriaParser();

    private static final Perspective EQUITIES = new Perspective(1, "Equities", true, true, List.of(
            rule("rule_0", "{\"column\": \"asset\", \"operator_type\": \"==\", \"value\": \"EQ\"}",
                    NextRuleCondition.NONE, false, 1.0)));

    // rule_1 is a scaling rule: skipped in the chain, but its AND decides how rule_2 joins
    private static final Perspective US_EQUITIES = new Perspective(2, "US Equities", true, true, List.of(
            rule("rule_0", "{\"column\": \"asset\", \"operator_type\": \"==\", \"value\": \"EQ\"}",
                    NextRuleCondition.OR, false, 1.0),
            rule("rule_1", "{\"column\": \"asset\", \"operator_type\": \"==\", \"value\": \"BOND\"}",
                    NextRuleCondition.AND, true, 0.5),
            rule("rule_2", "{\"column\": \"ccy\", \"operator_type\": \"==\", \"value\": \"USD\"}",
                    NextRuleCondition.NONE, false, 1.0)));

    private static final Perspective HALVED = new Perspective(3, "Halved", true, true, List.of(
            rule("rule_0", "{\"column\": \"asset\", \"operator_type\": \"==\", \"value\": \"EQ\"}",
                    NextRuleCondition.NONE, true, 0.5),
            rule("rule_1", "{\"column\": \"ccy\", \"operator_type\": \"==\", \"value\": \"EUR\"}",
                    NextRuleCondition.NONE, true, 0.5)));

    private static final Perspective EVERYTHING = new Perspective(4, "Everything", true, true, List.of());

    private static Rule rule(String name, String criteria, NextRuleCondition next, boolean scaling, double factor) {
        return new Rule(name, ApplyTo.BOTH, PARSER.parseTree(criteria), next, scaling, factor);
    }

    private static Map<String, Modifier> modifiers() {
        Map<String, Modifier> out = new LinkedHashMap<>();
        out.put("exclude_cash", new Modifier("exclude_cash", ApplyTo.BOTH, ModifierType.PRE_PROCESSING,
                PARSER.parseTree("{\"column\": \"asset\", \"operator_type\": \"==\", \"value\": \"CASH\"}"),
                null, Map.of(), List.of("rescue_cash")));
        out.put("rescue_cash", new Modifier("rescue_cash", ApplyTo.BOTH, ModifierType.POST_PROCESSING,
                PARSER.parseTree("{\"column\": \"asset\", \"operator_type\": \"==\", \"value\": \"CASH\"}"),
                RuleResultOperator.OR, Map.of(), List.of()));
        out.put("only_eur", new Modifier("only_eur", ApplyTo.BOTH, ModifierType.POST_PROCESSING,
                PARSER.parseTree("{\"column\": \"ccy\", \"operator_type\": \"==\", \"value\": \"EUR\"}"),
                RuleResultOperator.AND, Map.of(), List.of()));
        out.put("exclude_flagged", new Modifier("exclude_flagged", ApplyTo.BOTH, ModifierType.PRE_PROCESSING,
                PARSER.parseTree("{\"column\": \"flagged\", \"operator_type\": \"==\", \"value\": true}"),
                null, Map.of(), List.of()));
        out.put(PerspectiveProcessor.SCALE_HOLDINGS, new Modifier(PerspectiveProcessor.SCALE_HOLDINGS, ApplyTo.BOTH,
                ModifierType.SCALING, null, null, Map.of(), List.of()));
        out.put(PerspectiveProcessor.SCALE_LOOKTHROUGHS, new Modifier(PerspectiveProcessor.SCALE_LOOKTHROUGHS,
                ApplyTo.BOTH, ModifierType.SCALING, null, null, Map.of(), List.of()));
        return out;
    }

    private static PerspectiveProcessor processor(List<String> defaults) {
        Map<Integer, Perspective> perspectives = new LinkedHashMap<>();
        for (Perspective p : List.of(EQUITIES, US_EQUITIES, HALVED, EVERYTHING)) {
            perspectives.put(p.id(), p);
        }
        return new PerspectiveProcessor(
                new PerspectiveConfiguration(perspectives, modifiers(), defaults, Map.of()),
                new CriteriaCompiler());
    }

    private static Frame positions() {
        Map<String, Column> columns = new LinkedHashMap<>();
        columns.put("identifier", Column.ofStrings("a", "b", "c", "d"));
        columns.put("container", Column.ofStrings("h", "h", "h", "h"));
        columns.put("sub_portfolio_id", Column.ofStrings("default", "default", "default", "default"));
        columns.put("record_type", Column.ofStrings("position", "position", "position", "position"));
        columns.put("instrument_id", Column.ofLongs(1, 2, 3, 4));
        columns.put("asset", Column.ofStrings("EQ", "BOND", "CASH", "EQ"));
        columns.put("ccy", Column.ofStrings("EUR", "USD", "EUR", "USD"));
        columns.put("weight", Column.ofDoubles(0.4, 0.3, 0.2, 0.1));
        return Frame.of(columns);
    }

    private static Frame lookthroughs() {
        Map<String, Column> columns = new LinkedHashMap<>();
        columns.put("identifier", Column.ofStrings("l1", "l2", "l3"));
        columns.put("container", Column.ofStrings("h", "h", "h"));
        columns.put("sub_portfolio_id", Column.ofStrings("default", "default", "default"));
        columns.put("record_type", Column.ofStrings("essential_lookthroughs", "essential_lookthroughs",
                "essential_lookthroughs"));
        columns.put("instrument_id", Column.ofLongs(11, 12, 13));
        columns.put("parent_instrument_id", Column.ofLongs(1, 2, 1));
        columns.put("asset", Column.ofStrings("EQ", "EQ", "EQ"));
        columns.put("ccy", Column.ofStrings("EUR", "EUR", "EUR"));
        columns.put("weight", Column.ofDoubles(0.75, 0.5, 0.75));
        return Frame.of(columns);
    }

    private static Map<String, Map<Integer, List<String>>> request(int perspectiveId, String... modifiers) {
        Map<Integer, List<String>> perspectives = new LinkedHashMap<>();
        perspectives.put(perspectiveId, List.of(modifiers));
        return Map.of("cfg", perspectives);
    }

    private static PerspectivePlan plan(PerspectiveProcessor processor, Frame lookthroughs,
                                        Map<String, Map<Integer, List<String>>> request) {
        return processor.buildPlan(LazyFrame.of(positions()),
                lookthroughs == null ? null : LazyFrame.of(lookthroughs), request,
                List.of("weight"), List.of("weight"), NestedValues.none());
    }

    /** Identifiers whose factor is not null. */
    private static List<String> kept(Frame frame, String factor) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < frame.height(); i++) {
            if (!frame.column(factor).isNull(i)) {
                out.add((String) frame.column("identifier").get(i));
            }
        }
        return out;
    }

    @Test
    @DisplayName("Should name factor columns per configuration and sorted perspective id")
    void shouldNameFactorColumns() {
        Map<String, Map<Integer, List<String>>> request = new LinkedHashMap<>();
        Map<Integer, List<String>> ids = new LinkedHashMap<>();
        ids.put(4, List.of());
        ids.put(1, List.of());
        request.put("cfg", ids);

        PerspectivePlan plan = plan(processor(List.of()), null, request);

        assertThat(plan.factorColumns().all()).containsExactly("f_cfg_1", "f_cfg_4");
        assertThat(plan.hasLookthroughs()).isFalse();
        assertThat(plan.positions().collect().hasColumn("f_cfg_4")).isTrue();
    }

    @Test
    @DisplayName("Should rescue cash through the default post-processing modifier")
    void shouldApplyDefaultModifier() {
        Frame result = plan(processor(List.of("rescue_cash")), null, request(1)).positions().collect();

        assertThat(kept(result, "f_cfg_1")).containsExactly("a", "c", "d");
    }

    @Test
    @DisplayName("Should drop overridden modifiers")
    void shouldDropOverriddenModifiers() {
        Frame result = plan(processor(List.of("rescue_cash")), null, request(1, "exclude_cash"))
                .positions().collect();

        assertThat(kept(result, "f_cfg_1")).containsExactly("a", "d");
    }

    @Test
    @DisplayName("Should join post-processing modifiers in requested order")
    void shouldJoinPostProcessingModifiersInOrder() {
        // (EQ and EUR) or CASH
        Frame result = plan(processor(List.of("rescue_cash")), null, request(1, "only_eur"))
                .positions().collect();

        assertThat(kept(result, "f_cfg_1")).containsExactly("a", "c");
    }

    @Test
    @DisplayName("Should join rules using the condition of the preceding rule")
    void shouldChainRulesWithPrecedingCondition() {
        Frame result = plan(processor(List.of()), null, request(2)).positions().collect();

        // EQ and USD: the OR on rule_0 is ignored because rule_1 precedes rule_2
        assertThat(kept(result, "f_cfg_2")).containsExactly("d");
    }

    @Test
    void shouldMultiplyMatchingScaleFactors() {
        Frame result = plan(processor(List.of()), null, request(3)).positions().collect();

        Column factor = result.column("f_cfg_3");
        assertThat(factor.getDouble(0)).isCloseTo(0.25, within(1e-12));
        assertThat(factor.getDouble(1)).isEqualTo(1.0);
        assertThat(factor.getDouble(2)).isCloseTo(0.5, within(1e-12));
        assertThat(factor.getDouble(3)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void shouldKeepEverythingWithoutRules() {
        Frame result = plan(processor(List.of()), null, request(4)).positions().collect();

        assertThat(kept(result, "f_cfg_4")).containsExactly("a", "b", "c", "d");
        assertThat(result.column("f_cfg_4").getDouble(0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject a modifier reading a column the positions do not have")
    void shouldRejectModifierOnMissingColumn() {
        assertThatThrownBy(() -> plan(processor(List.of()), null, request(4, "exclude_flagged")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("exclude_flagged")
                .hasMessageContaining("'flagged'")
                .hasMessageContaining("positions");
    }

    @Test
    void shouldRejectRuleReadingColumnMissingFromLookthroughs() {
        Frame withoutCurrency = lookthroughs().drop(List.of("ccy"));

        assertThatThrownBy(() -> plan(processor(List.of()), withoutCurrency, request(2)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Rule 2 of perspective 2")
                .hasMessageContaining("'ccy'")
                .hasMessageContaining("lookthroughs");
    }

    @Test
    @DisplayName("Should rescale kept positions to sum to one")
    void shouldRescalePositions() {
        Frame result = plan(processor(List.of()), null, request(1, PerspectiveProcessor.SCALE_HOLDINGS))
                .positions().collect();

        Column factor = result.column("f_cfg_1");
        Column weight = result.column("weight");
        double total = 0.0;
        for (int i = 0; i < result.height(); i++) {
            if (!factor.isNull(i)) {
                total += weight.getDouble(i) * factor.getDouble(i);
            }
        }
        assertThat(total).isCloseTo(1.0, within(1e-12));
        assertThat(factor.getDouble(0)).isCloseTo(2.0, within(1e-12));
        assertThat(result.columnNames()).doesNotContain("sum_f_cfg_1_pos");
    }

    @Test
    @DisplayName("Should remove lookthroughs whose parent position was removed")
    void shouldSynchronizeLookthroughs() {
        PerspectivePlan plan = plan(processor(List.of()), lookthroughs(), request(1));

        Frame result = plan.lookthroughs().collect();

        assertThat(kept(result, "f_cfg_1")).containsExactly("l1", "l3");
        assertThat(result.columnNames()).doesNotContain("parent_f_cfg_1");
    }

    @Test
    @DisplayName("Should include essential lookthroughs when rescaling positions")
    void shouldIncludeEssentialLookthroughsInPositionRescale() {
        PerspectivePlan plan = plan(processor(List.of()), lookthroughs(),
                request(1, PerspectiveProcessor.SCALE_HOLDINGS));

        Column factor = plan.positions().collect().column("f_cfg_1");

        // positions contribute 0.4 + 0.1, kept lookthroughs 0.75 + 0.75
        assertThat(factor.getDouble(0)).isCloseTo(0.5, within(1e-12));
        assertThat(factor.getDouble(3)).isCloseTo(0.5, within(1e-12));
        assertThat(factor.isNull(1)).isTrue();
    }

    @Test
    @DisplayName("Should rescale lookthroughs within each parent")
    void shouldRescaleLookthroughs() {
        PerspectivePlan plan = plan(processor(List.of()), lookthroughs(),
                request(1, PerspectiveProcessor.SCALE_LOOKTHROUGHS));

        Column factor = plan.lookthroughs().collect().column("f_cfg_1");

        assertThat(factor.getDouble(0)).isCloseTo(1.0 / 1.5, within(1e-12));
        assertThat(factor.isNull(1)).isTrue();
        assertThat(factor.getDouble(2)).isCloseTo(1.0 / 1.5, within(1e-12));
    }

    @Test
    void shouldRequireParentInstrumentIdOnLookthroughs() {
        Frame broken = lookthroughs().drop(List.of("parent_instrument_id"));

        assertThatThrownBy(() -> plan(processor(List.of()), broken, request(1)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("parent_instrument_id");
    }
}
