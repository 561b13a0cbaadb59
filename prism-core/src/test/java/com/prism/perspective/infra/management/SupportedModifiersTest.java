package com.prism.perspective.infra.management;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.perspective.api.exceptions.ConfigurationException;
import com.prism.perspective.api.model.ApplyTo;
import com.prism.perspective.api.model.Modifier;
import com.prism.perspective.api.model.ModifierDefinition;
import com.prism.perspective.api.model.ModifierType;
import com.prism.perspective.api.model.RuleResultOperator;
import com.prism.perspective.compiler.CriteriaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SupportedModifiersTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PerspectiveFactory factory = new PerspectiveFactory(new CriteriaParser(mapper));

    @Test
    @DisplayName("Should load the bundled modifier table")
    void shouldLoadBundledTable() {
        SupportedModifiers supported = SupportedModifiers.load(mapper, factory);

        assertThat(supported.modifiers()).hasSize(24);
        assertThat(supported.modifiers().keySet()).first().isEqualTo("exclude_other_net_assets");
        assertThat(supported.defaultModifiers()).containsExactly("exclude_perspective_level_simulated_cash");
    }

    @Test
    @DisplayName("Should parse types, operators and overrides")
    void shouldParseModifierAttributes() {
        Map<String, Modifier> modifiers = SupportedModifiers.load(mapper, factory).modifiers();

        Modifier rescue = modifiers.get("include_simulated_cash");
        assertThat(rescue.type()).isEqualTo(ModifierType.POST_PROCESSING);
        assertThat(rescue.ruleResultOperator()).isEqualTo(RuleResultOperator.OR);
        assertThat(rescue.applyTo()).isEqualTo(ApplyTo.BOTH);

        Modifier exclude = modifiers.get("exclude_simulated_cash");
        assertThat(exclude.type()).isEqualTo(ModifierType.PRE_PROCESSING);
        assertThat(exclude.overrideModifiers())
                .containsExactly("exclude_perspective_level_simulated_cash", "include_simulated_cash");

        Modifier scale = modifiers.get("scale_holdings_to_100_percent");
        assertThat(scale.type()).isEqualTo(ModifierType.SCALING);
        assertThat(scale.criteria()).isNull();

        assertThat(modifiers.get("exclude_other_net_assets_excl_investment_grade_accrual").requiredColumns())
                .containsEntry("PARENT_INSTRUMENT", List.of("instrument_subtype_id"));
    }

    @Test
    @DisplayName("Should reject duplicate modifier names")
    void shouldRejectDuplicates() {
        ModifierDefinition definition = new ModifierDefinition("exclude_x", "both", "PreProcessing",
                mapper.getNodeFactory().textNode("{\"column\": \"x\", \"operator_type\": \"==\", \"value\": 1}"),
                null, null, null);
        SupportedModifiers.Document document = new SupportedModifiers.Document(List.of(),
                List.of(definition, definition));

        assertThatThrownBy(() -> SupportedModifiers.fromDocument(document, factory))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate modifier: exclude_x");
    }

    @Test
    @DisplayName("Should reject defaults that are not defined")
    void shouldRejectUnknownDefault() {
        SupportedModifiers.Document document = new SupportedModifiers.Document(List.of("missing"), List.of());

        assertThatThrownBy(() -> SupportedModifiers.fromDocument(document, factory))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing");
    }
}
