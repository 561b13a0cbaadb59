package com.prism.perspective.core.engine;

import com.prism.perspective.api.model.Criteria;
import com.prism.perspective.api.model.NestedCriteria;
import com.prism.perspective.api.model.NestedValues;
import com.prism.perspective.api.model.NullSentinels;
import com.prism.perspective.compiler.CriteriaCompiler;
import com.prism.perspective.compiler.CriteriaParser;
import com.prism.perspective.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.prism.perspective.runtime.evaluation.LazyFrame;
import com.prism.perspective.runtime.frame.Column;
import com.prism.perspective.runtime.frame.Frame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NestedCriteriaPrecomputerTest {

    private final CriteriaParser parser = new CriteriaParser();
    private InMemoryMetricsRegistry metrics;
    private NestedCriteriaPrecomputer precomputer;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        precomputer = new NestedCriteriaPrecomputer(new CriteriaCompiler(), metrics);
    }

    private static Frame positions() {
        Map<String, Column> columns = new LinkedHashMap<>();
        columns.put("instrument_id", Column.ofLongs(1, 2, 3, 4, 5));
        columns.put("parent_instrument_id", Column.ofLongs(100, 200, NullSentinels.INT_NULL, 100, 300));
        columns.put("asset", Column.ofStrings("EQ", "BOND", "EQ", "EQ", "BOND"));
        return Frame.of(columns);
    }

    private Criteria memberOf(String nestedValue) {
        return parser.parseTree("{\"column\": \"instrument_id\", \"operator_type\": \"In\", \"value\": "
                + nestedValue + "}");
    }

    private static String cacheKey(Criteria criteria) {
        return ((NestedCriteria) ((Criteria.Leaf) criteria).value()).cacheKey();
    }

    @Test
    void shouldResolveDistinctValuesOfNestedColumn() {
        Criteria criteria = memberOf("{\"column\": \"parent_instrument_id\"}");

        NestedValues values = precomputer.precompute(positions(), List.of(criteria));

        assertThat(values.lookup(cacheKey(criteria))).contains(List.of(100L, 200L, 300L));
        assertThat(metrics.counterValue("nested_criteria_unresolved")).isZero();
    }

    @Test
    void shouldNarrowNestedColumnByFilter() {
        Criteria criteria = memberOf("{\"column\": \"parent_instrument_id\","
                + " \"criteria\": {\"column\": \"asset\", \"operator_type\": \"==\", \"value\": \"EQ\"}}");

        NestedValues values = precomputer.precompute(positions(), List.of(criteria));

        assertThat(values.lookup(cacheKey(criteria))).contains(List.of(100L));
    }

    @Test
    void shouldFilterOuterColumnByValuesOfNestedColumn() {
        Map<String, Column> columns = new LinkedHashMap<>();
        columns.put("instrument_id", Column.ofLongs(1, 2, 100));
        columns.put("parent_instrument_id", Column.ofLongs(100, 200, NullSentinels.INT_NULL));
        Frame frame = Frame.of(columns);
        Criteria criteria = memberOf("{\"column\": \"parent_instrument_id\"}");

        NestedValues values = precomputer.precompute(frame, List.of(criteria));
        Frame kept = LazyFrame.of(frame).filter(new CriteriaCompiler().compile(criteria, 1, values)).collect();

        assertThat(values.lookup(cacheKey(criteria))).contains(List.of(100L, 200L));
        assertThat(kept.column("instrument_id").get(0)).isEqualTo(100L);
        assertThat(kept.height()).isEqualTo(1);
    }

    @Test
    void shouldCountDefinitionsWhoseColumnIsMissing() {
        Criteria criteria = memberOf("{\"column\": \"issuer_id\"}");

        NestedValues values = precomputer.precompute(positions(), List.of(criteria));

        assertThat(values.isEmpty()).isTrue();
        assertThat(metrics.counterValue("nested_criteria_unresolved")).isEqualTo(1L);
    }

    @Test
    void shouldReturnNoneWithoutNestedCriteria() {
        Criteria plain = parser.parseTree("{\"column\": \"asset\", \"operator_type\": \"==\", \"value\": \"EQ\"}");
        List<Criteria> trees = new ArrayList<>();
        trees.add(plain);
        trees.add(null);

        assertThat(precomputer.precompute(positions(), trees)).isSameAs(NestedValues.none());
    }
}
