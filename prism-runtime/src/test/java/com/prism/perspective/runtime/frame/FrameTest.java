package com.prism.perspective.runtime.frame;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameTest {

    @Test
    @DisplayName("Should build columns from rows in first-seen order")
    void shouldBuildFromRows() {
        Frame frame = Frame.fromRows(List.of(
                Map.of("id", "1"),
                Map.of("id", "2", "weight", 0.5)));

        assertThat(frame.height()).isEqualTo(2);
        assertThat(frame.columnNames()).containsExactly("id", "weight");
        assertThat(frame.column("weight").isNull(0)).isTrue();
    }

    @Test
    @DisplayName("Should filter rows dropping false and null mask values")
    void shouldFilterRows() {
        Frame frame = Frame.of(Map.of("v", Column.ofLongs(1, 2, 3)));
        Column mask = Column.fromValues(java.util.Arrays.asList(true, null, false));

        Frame filtered = frame.filter(mask);

        assertThat(filtered.height()).isEqualTo(1);
        assertThat(filtered.column("v").get(0)).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should partition rows by key columns preserving order")
    void shouldPartitionByKeys() {
        Frame frame = Frame.fromRows(List.of(
                Map.of("c", "A", "v", 1L),
                Map.of("c", "B", "v", 2L),
                Map.of("c", "A", "v", 3L)));

        Map<List<Object>, Frame> parts = frame.partitionBy(List.of("c"));

        assertThat(parts).hasSize(2);
        assertThat(parts.get(List.of("A")).column("v")).isEqualTo(Column.ofLongs(1, 3));
    }

    @Test
    @DisplayName("Should fail with available columns when a column is missing")
    void shouldFailOnMissingColumn() {
        Frame frame = Frame.of(Map.of("v", Column.ofLongs(1)));

        assertThatThrownBy(() -> frame.column("x"))
                .isInstanceOf(FrameException.class)
                .hasMessageContaining("Column not found: x");
    }
}
