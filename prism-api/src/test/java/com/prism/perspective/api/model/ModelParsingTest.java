package com.prism.perspective.api.model;

import com.prism.perspective.api.exceptions.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelParsingTest {

    @Test
    @DisplayName("Should map stored apply_to synonyms case-insensitively")
    void shouldParseApplyTo() {
        assertThat(ApplyTo.parse("Holding")).isEqualTo(ApplyTo.POSITION);
        assertThat(ApplyTo.parse("position")).isEqualTo(ApplyTo.POSITION);
        assertThat(ApplyTo.parse("REFERENCE")).isEqualTo(ApplyTo.LOOKTHROUGH);
        assertThat(ApplyTo.parse("lookthrough")).isEqualTo(ApplyTo.LOOKTHROUGH);
        assertThat(ApplyTo.parse("both")).isEqualTo(ApplyTo.BOTH);
        assertThat(ApplyTo.parse(null)).isEqualTo(ApplyTo.BOTH);
    }

    @Test
    @DisplayName("Should apply BOTH to every record mode and others to their own")
    void shouldCheckApplicability() {
        assertThat(ApplyTo.BOTH.appliesTo(RecordMode.LOOKTHROUGH)).isTrue();
        assertThat(ApplyTo.POSITION.appliesTo(RecordMode.LOOKTHROUGH)).isFalse();
        assertThat(ApplyTo.LOOKTHROUGH.appliesTo(RecordMode.LOOKTHROUGH)).isTrue();
    }

    @Test
    @DisplayName("Should reject unknown apply_to values")
    void shouldRejectUnknownApplyTo() {
        assertThatThrownBy(() -> ApplyTo.parse("everything"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("everything");
    }

    @Test
    @DisplayName("Should resolve operators by symbol and word")
    void shouldResolveOperators() {
        assertThat(CriteriaOperator.fromSymbol("==")).isEqualTo(CriteriaOperator.EQ);
        assertThat(CriteriaOperator.fromSymbol("=")).isEqualTo(CriteriaOperator.EQ);
        assertThat(CriteriaOperator.fromSymbol("NotIn")).isEqualTo(CriteriaOperator.NOT_IN);
        assertThat(CriteriaOperator.fromSymbol("isnotnull")).isEqualTo(CriteriaOperator.IS_NOT_NULL);
        assertThatThrownBy(() -> CriteriaOperator.fromSymbol("Contains"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should default rule result operator to AND")
    void shouldDefaultRuleResultOperator() {
        assertThat(RuleResultOperator.parse(null)).isEqualTo(RuleResultOperator.AND);
        assertThat(RuleResultOperator.parse("or")).isEqualTo(RuleResultOperator.OR);
        assertThat(NextRuleCondition.parse("Or")).isEqualTo(NextRuleCondition.OR);
        assertThat(NextRuleCondition.parse(null)).isEqualTo(NextRuleCondition.NONE);
    }

    @Test
    @DisplayName("Should recognize integer and float sentinels")
    void shouldRecognizeSentinels() {
        assertThat(NullSentinels.isSentinel(-2147483648L)).isTrue();
        assertThat(NullSentinels.isSentinel(NullSentinels.FLOAT_NULL)).isTrue();
        assertThat(NullSentinels.isSentinel(0L)).isFalse();
        assertThat(NullSentinels.isSentinel("x")).isFalse();
    }
}
