package com.prism.perspective.core.output;

import com.prism.perspective.core.processing.FactorColumns;
import com.prism.perspective.runtime.frame.Column;
import com.prism.perspective.runtime.frame.Frame;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OutputFormatterTest {

    private static final List<String> WEIGHTS = List.of("weight");

    private static Column factors(Double... values) {
        double[] out = new double[values.length];
        BitSet nulls = new BitSet(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                nulls.set(i);
            } else {
                out[i] = values[i];
            }
        }
        return Column.ofDoubles(out, nulls);
    }

    private static Frame positions() {
        Map<String, Column> columns = new LinkedHashMap<>();
        columns.put("identifier", Column.ofStrings("10", "20", "30"));
        columns.put("container", Column.ofStrings("h", "h", "h"));
        columns.put("weight", Column.ofDoubles(0.5, 0.3, 0.2));
        columns.put("f_cfg_1", factors(1.0, null, 2.0));
        columns.put("f_cfg_2", factors(null, null, null));
        return Frame.of(columns);
    }

    private static Frame lookthroughs() {
        Map<String, Column> columns = new LinkedHashMap<>();
        columns.put("identifier", Column.ofStrings("l1", "l2", "l3", "l4"));
        columns.put("container", Column.ofStrings("h", "h", "h", "h"));
        columns.put("record_type", Column.ofStrings("essential_lookthroughs", "essential_lookthroughs",
                "essential_lookthroughs", "essential_lookthroughs"));
        columns.put("parent_instrument_id", Column.ofLongs(100, 100, 100, 100));
        columns.put("weight", Column.ofLongs(1, 2, 3, 4));
        columns.put("f_cfg_1", factors(null, null, null, 1.0));
        columns.put("f_cfg_2", factors(null, null, null, null));
        return Frame.of(columns);
    }

    private static FactorColumns factorColumns() {
        Map<String, List<Integer>> ids = new LinkedHashMap<>();
        ids.put("cfg", List.of(2, 1));
        ids.put("unused", List.of());
        return FactorColumns.of(ids);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> at(Map<String, Object> map, String... path) {
        Map<String, Object> current = map;
        for (String key : path) {
            current = (Map<String, Object>) current.get(key);
        }
        return current;
    }

    @Test
    void shouldEmitWeightedKeptRecords() {
        Map<String, Object> response = OutputFormatter.format(positions(), lookthroughs(), factorColumns(),
                WEIGHTS, WEIGHTS, false, false);

        Map<String, Object> configs = at(response, OutputFormatter.PERSPECTIVE_CONFIGURATIONS);
        assertThat(configs).containsOnlyKeys("cfg");
        assertThat(at(configs, "cfg").keySet()).containsExactly("1", "2");

        Map<String, Object> container = at(configs, "cfg", "1", "h");
        Map<String, Object> positions = at(container, "positions");
        assertThat(positions.keySet()).containsExactly("10", "30");
        assertThat((Double) at(positions, "30").get("weight")).isCloseTo(0.4, within(1e-12));
        assertThat(at(container, "essential_lookthroughs", "l4")).containsEntry("weight", 4.0);
        assertThat(container).doesNotContainKeys(OutputFormatter.REMOVED_SUMMARY, OutputFormatter.SCALE_FACTORS);

        assertThat(at(configs, "cfg", "2")).isEmpty();
    }

    @Test
    void shouldSummarizeRemovedRecordsInVerboseMode() {
        Map<String, Object> response = OutputFormatter.format(positions(), lookthroughs(), factorColumns(),
                WEIGHTS, WEIGHTS, true, false);

        Map<String, Object> container = at(response, OutputFormatter.PERSPECTIVE_CONFIGURATIONS, "cfg", "1", "h");
        Map<String, Object> summary = at(container, OutputFormatter.REMOVED_SUMMARY);

        assertThat(at(summary, "positions").keySet()).containsExactly("20");
        assertThat(at(summary, "positions", "20")).containsEntry("weight", 0.3);
        assertThat(at(summary, "essential_lookthroughs", "100")).containsEntry("weight", 6L);
        assertThat((Double) at(container, OutputFormatter.SCALE_FACTORS).get("weight")).isCloseTo(0.7, within(1e-12));

        // nothing kept, so no scale factors for perspective 2
        Map<String, Object> removedEverything = at(response, OutputFormatter.PERSPECTIVE_CONFIGURATIONS, "cfg", "2", "h");
        assertThat(removedEverything).containsOnlyKeys(OutputFormatter.REMOVED_SUMMARY);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldFlattenRecordBlocksIntoColumns() {
        Map<String, Object> response = OutputFormatter.format(positions(), lookthroughs(), factorColumns(),
                WEIGHTS, WEIGHTS, false, true);

        Map<String, Object> container = at(response, OutputFormatter.PERSPECTIVE_CONFIGURATIONS, "cfg", "1", "h");
        Map<String, List<Object>> positions = (Map<String, List<Object>>) container.get("positions");
        assertThat(positions.get("identifier")).containsExactly(10L, 30L);
        assertThat(positions.get("weight")).containsExactly(0.5, 0.4);

        Map<String, List<Object>> lookthroughs = (Map<String, List<Object>>) container.get("essential_lookthroughs");
        assertThat(lookthroughs.get("identifier")).containsExactly("l4");
    }

    @Test
    void shouldOmitLookthroughsWhenNoneWereSent() {
        Map<String, Object> response = OutputFormatter.format(positions(), null, factorColumns(),
                WEIGHTS, WEIGHTS, false, false);

        Map<String, Object> container = at(response, OutputFormatter.PERSPECTIVE_CONFIGURATIONS, "cfg", "1", "h");
        assertThat(container).containsOnlyKeys("positions");
    }

    @Test
    void shouldBuildEmptyResponse() {
        assertThat(OutputFormatter.emptyResponse())
                .containsOnlyKeys(OutputFormatter.PERSPECTIVE_CONFIGURATIONS);
        assertThat(at(OutputFormatter.emptyResponse(), OutputFormatter.PERSPECTIVE_CONFIGURATIONS)).isEmpty();
    }
}
