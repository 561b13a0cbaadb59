package com.prism.perspective.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.perspective.api.exceptions.InvalidRequestException;
import com.prism.perspective.api.model.ApplyTo;
import com.prism.perspective.api.model.Perspective;
import com.prism.perspective.compiler.CriteriaParser;
import com.prism.perspective.infra.management.PerspectiveFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CustomPerspectiveParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final CustomPerspectiveParser parser =
            new CustomPerspectiveParser(new PerspectiveFactory(new CriteriaParser(mapper)), mapper);

    private CustomPerspectives parse(String json) throws Exception {
        return parser.parse(mapper.readTree(json));
    }

    @Test
    void shouldBuildCustomPerspectives() throws Exception {
        CustomPerspectives custom = parse("""
                {"-1": {"rules": [
                   {"apply_to": "holding", "condition_for_next_rule": "or",
                    "criteria": {"column": "rating", "operator_type": "==", "value": "AAA",
                                 "required_columns": {"INSTRUMENT": ["rating"]}}},
                   {"apply_to": "both", "is_scaling_rule": true, "scale_factor": 25,
                    "criteria": "{\\"column\\": \\"instrument_type\\", \\"operator_type\\": \\"==\\", \\"value\\": \\"BOND\\"}"}
                 ]},
                 "0": {"name": "Nothing", "rules": []}}
                """);

        assertThat(custom.perspectives()).containsOnlyKeys(-1);
        Perspective perspective = custom.perspectives().get(-1);
        assertThat(perspective.name()).isEqualTo("custom_perspective_-1");
        assertThat(perspective.isCustom()).isTrue();
        assertThat(perspective.rules()).extracting(r -> r.name())
                .containsExactly("custom_rule_-1_0", "custom_rule_-1_1");
        assertThat(perspective.rules().get(0).applyTo()).isEqualTo(ApplyTo.POSITION);
        assertThat(perspective.rules().get(1).scaleFactor()).isEqualTo(0.25);
        assertThat(custom.requiredColumns().get(-1)).containsEntry("INSTRUMENT", List.of("rating"));
    }

    @Test
    void shouldTreatMissingDefinitionsAsNone() throws Exception {
        assertThat(parser.parse(null).isEmpty()).isTrue();
        assertThat(parse("{}").isEmpty()).isTrue();
    }

    @Test
    void shouldRejectPositiveIdsBeforeBuildingAnything() {
        assertThatThrownBy(() -> parse("{\"-2\": {\"rules\": \"broken\"}, \"5\": {\"rules\": []}}"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("got 5");
    }

    @Test
    void shouldRejectIncompleteRules() {
        assertThatThrownBy(() -> parse("{\"-1\": {}}"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("no 'rules'");
        assertThatThrownBy(() -> parse("{\"-1\": {\"rules\": {}}}"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("must be a list");
        assertThatThrownBy(() -> parse("{\"-1\": {\"rules\": [{\"criteria\": {\"column\": \"a\", \"operator_type\": \"IsNull\"}}]}}"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("apply_to");
        assertThatThrownBy(() -> parse("{\"-1\": {\"rules\": [{\"apply_to\": \"both\"}]}}"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("criteria");
        assertThatThrownBy(() -> parse("{\"-1\": {\"rules\": [{\"apply_to\": \"both\", \"is_scaling_rule\": true,"
                + " \"criteria\": {\"column\": \"a\", \"operator_type\": \"IsNull\"}}]}}"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("scale_factor");
        assertThatThrownBy(() -> parse("{\"-1\": {\"rules\": [7]}}"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("must be an object");
    }
}
