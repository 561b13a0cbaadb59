package com.prism.perspective.infra.loader;

import com.prism.perspective.api.exceptions.ReferenceLoadException;
import com.prism.perspective.api.model.ReferenceQuery;
import com.prism.perspective.runtime.frame.Column;
import com.prism.perspective.runtime.frame.Frame;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryReferenceLoaderTest {

    private static Frame instruments() {
        Map<String, Column> columns = new LinkedHashMap<>();
        columns.put("instrument_id", Column.ofLongs(1, 2, 3, 1));
        columns.put("ed", Column.ofStrings("2024-01-01", "2024-01-01", "2024-01-01", "2023-12-31"));
        columns.put("instrument_type", Column.ofStrings("EQUITY", "BOND", "CASH", "FUND"));
        columns.put("currency", Column.ofStrings("EUR", "USD", "EUR", "CHF"));
        return Frame.of(columns);
    }

    @Test
    void shouldFilterByIdsAndEffectiveDate() {
        InMemoryReferenceLoader loader = new InMemoryReferenceLoader().withTable("INSTRUMENT", instruments());

        Frame result = loader.load(new ReferenceQuery("INSTRUMENT", List.of("instrument_type"),
                List.of(1L, 3L), "2024-01-01", null));

        assertThat(result.columnNames()).containsExactly("instrument_id", "instrument_type");
        assertThat(result.height()).isEqualTo(2);
        assertThat(result.column("instrument_type").get(0)).isEqualTo("EQUITY");
        assertThat(result.column("instrument_type").get(1)).isEqualTo("CASH");
        assertThat(loader.queries()).hasSize(1);
    }

    @Test
    void shouldFailForUnknownTable() {
        InMemoryReferenceLoader loader = new InMemoryReferenceLoader();

        assertThatThrownBy(() -> loader.load(new ReferenceQuery("MISSING", List.of(), List.of(1L), "2024-01-01", null)))
                .isInstanceOf(ReferenceLoadException.class)
                .hasMessageContaining("MISSING")
                .extracting(e -> ((ReferenceLoadException) e).getTable())
                .isEqualTo("MISSING");
    }

    @Test
    void shouldFailForUnknownColumn() {
        InMemoryReferenceLoader loader = new InMemoryReferenceLoader().withTable("INSTRUMENT", instruments());

        assertThatThrownBy(() -> loader.load(new ReferenceQuery("INSTRUMENT", List.of("rating"),
                List.of(1L), "2024-01-01", null)))
                .isInstanceOf(ReferenceLoadException.class)
                .hasMessageContaining("unknown column rating");
    }

    @Test
    void shouldRequireInstrumentIdColumn() {
        Frame table = Frame.of(Map.of("currency", Column.ofStrings("EUR")));

        assertThatThrownBy(() -> new InMemoryReferenceLoader().withTable("BROKEN", table))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
