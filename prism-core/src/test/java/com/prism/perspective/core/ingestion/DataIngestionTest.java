package com.prism.perspective.core.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.perspective.api.model.NullSentinels;
import com.prism.perspective.runtime.frame.DataType;
import com.prism.perspective.runtime.frame.Frame;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DataIngestionTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String REQUEST = """
            {
              "ed": "2024-01-01",
              "perspective_configurations": {"cfg": {"1": []}},
              "holding": {
                "position_type": "holding",
                "positions": {
                  "p1": {"instrument_identifier": 100, "weight": 0.6, "liquidity_type_id": 1, "price": 10.5,
                         "sub_portfolio_id": 7},
                  "p2": {"instrument_identifier": 200, "weight": null, "liquidity_type_id": null, "price": null,
                         "rating": null}
                },
                "essential_lookthroughs": {
                  "l1": {"instrument_identifier": 300, "parent_instrument_id": 100, "weight": 0.5}
                },
                "other_lookthroughs": "not an object"
              },
              "benchmark": {
                "position_type": "benchmark",
                "positions": {
                  "b1": {"instrument_identifier": 100, "weight": 1.0, "liquidity_type_id": 2, "price": 1.25}
                }
              }
            }
            """;

    private static IngestedFrames ingest(String json) throws Exception {
        JsonNode node = MAPPER.readTree(json);
        return DataIngestion.buildFrames(node, List.of("weight"));
    }

    @Test
    @DisplayName("Should flatten containers into position and lookthrough rows")
    void shouldFlattenContainers() throws Exception {
        IngestedFrames frames = ingest(REQUEST);
        Frame positions = frames.positions();
        Frame lookthroughs = frames.lookthroughs();

        assertThat(positions.height()).isEqualTo(3);
        assertThat(positions.column("identifier").get(0)).isEqualTo("p1");
        assertThat(positions.column("container").get(2)).isEqualTo("benchmark");
        assertThat(positions.column("position_type").get(0)).isEqualTo("holding");
        assertThat(positions.column("record_type").get(1)).isEqualTo("position");
        assertThat(positions.column("instrument_id").get(1)).isEqualTo(200L);

        assertThat(frames.hasLookthroughs()).isTrue();
        assertThat(lookthroughs.height()).isEqualTo(1);
        assertThat(lookthroughs.column("record_type").get(0)).isEqualTo("essential_lookthroughs");
        assertThat(lookthroughs.column("parent_instrument_id").get(0)).isEqualTo(100L);
    }

    @Test
    @DisplayName("Should default sub portfolio and perspective id")
    void shouldStandardizeColumns() throws Exception {
        Frame positions = ingest(REQUEST).positions();

        assertThat(positions.column("sub_portfolio_id").type()).isEqualTo(DataType.STRING);
        assertThat(positions.column("sub_portfolio_id").get(0)).isEqualTo("7");
        assertThat(positions.column("sub_portfolio_id").get(1)).isEqualTo("default");
        assertThat(positions.column("perspective_id").get(0)).isEqualTo(NullSentinels.INT_NULL);
        assertThat(ingest(REQUEST).lookthroughs().column("sub_portfolio_id").get(0)).isEqualTo("default");
    }

    @Test
    @DisplayName("Should fill numeric nulls with sentinels but keep weight nulls")
    void shouldFillSentinels() throws Exception {
        Frame positions = ingest(REQUEST).positions();

        assertThat(positions.column("liquidity_type_id").get(1)).isEqualTo(NullSentinels.INT_NULL);
        assertThat(positions.column("price").get(1)).isEqualTo(NullSentinels.FLOAT_NULL);
        assertThat(positions.column("weight").isNull(1)).isTrue();
        assertThat(positions.column("rating").type()).isEqualTo(DataType.NULL);
        assertThat(positions.column("rating").nullCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should return empty frames when there are no positions")
    void shouldReturnEmptyFrames() throws Exception {
        IngestedFrames frames = ingest("{\"ed\": \"2024-01-01\", \"holding\": {\"position_type\": \"holding\"}}");

        assertThat(frames.hasPositions()).isFalse();
        assertThat(frames.hasLookthroughs()).isFalse();
    }

    @Test
    void shouldLeaveLookthroughsEmptyWhenNoneAreSent() throws Exception {
        IngestedFrames frames = ingest("""
                {"h": {"position_type": "holding", "positions": {"p": {"instrument_identifier": 1, "weight": 1.0}}}}
                """);

        assertThat(frames.hasPositions()).isTrue();
        assertThat(frames.hasLookthroughs()).isFalse();
        assertThat(frames.lookthroughs().isEmpty()).isTrue();
    }
}
