package com.prism.perspective.core.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.prism.perspective.api.model.NullSentinels;
import com.prism.perspective.runtime.frame.Column;
import com.prism.perspective.runtime.frame.DataType;
import com.prism.perspective.runtime.frame.Frame;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds position and lookthrough frames from the containers of a request.
 * <p>
 * A container is any top-level object holding a {@code position_type}. Its
 * {@code positions} entries become position rows; every other object-valued key
 * containing {@code lookthrough} becomes lookthrough rows whose {@code record_type}
 * is that key. Rows carry {@code container}, {@code position_type} and their entry
 * key as {@code identifier}.
 * <p>
 * Columns are then standardized: {@code instrument_identifier} is copied to
 * {@code instrument_id}, {@code sub_portfolio_id} defaults to {@code "default"},
 * {@code perspective_id} is added when missing, and nulls of numeric columns other
 * than the weight columns are replaced by {@link NullSentinels}.
 */
public final class DataIngestion {
    private static final Logger logger = Logger.getLogger(DataIngestion.class.getName());

    public static final String CONTAINER = "container";
    public static final String POSITION_TYPE = "position_type";
    public static final String IDENTIFIER = "identifier";
    public static final String RECORD_TYPE = "record_type";
    public static final String POSITIONS = "positions";
    public static final String POSITION_RECORD_TYPE = "position";
    public static final String LOOKTHROUGH = "lookthrough";
    public static final String INSTRUMENT_ID = "instrument_id";
    public static final String INSTRUMENT_IDENTIFIER = "instrument_identifier";
    public static final String PARENT_INSTRUMENT_ID = "parent_instrument_id";
    public static final String SUB_PORTFOLIO_ID = "sub_portfolio_id";
    public static final String PERSPECTIVE_ID = "perspective_id";
    public static final String DEFAULT_SUB_PORTFOLIO = "default";

    private DataIngestion() {
        throw new AssertionError("No instances");
    }

    /**
     * @param data         request root
     * @param weightLabels columns left out of sentinel filling
     */
    public static IngestedFrames buildFrames(JsonNode data, Collection<String> weightLabels) {
        List<Map<String, Object>> positionRows = new ArrayList<>();
        List<Map<String, Object>> lookthroughRows = new ArrayList<>();
        extractRows(data, positionRows, lookthroughRows);

        if (positionRows.isEmpty()) {
            logger.fine("Request holds no positions");
            return IngestedFrames.empty();
        }
        Frame positions = fillNulls(standardize(Frame.fromRows(positionRows)), weightLabels);
        Frame lookthroughs = lookthroughRows.isEmpty()
                ? Frame.empty()
                : fillNulls(standardize(Frame.fromRows(lookthroughRows)), weightLabels);
        logger.fine(() -> String.format("Ingested %d positions and %d lookthroughs",
                positions.height(), lookthroughs.height()));
        return new IngestedFrames(positions, lookthroughs);
    }

    static void extractRows(JsonNode data, List<Map<String, Object>> positions,
                            List<Map<String, Object>> lookthroughs) {
        if (data == null || !data.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> containers = data.fields();
        while (containers.hasNext()) {
            Map.Entry<String, JsonNode> container = containers.next();
            JsonNode body = container.getValue();
            if (!body.isObject() || !body.has(POSITION_TYPE)) {
                continue;
            }
            Object positionType = toValue(body.get(POSITION_TYPE));

            JsonNode positionEntries = body.get(POSITIONS);
            if (positionEntries != null && positionEntries.isObject()) {
                addRows(positionEntries, container.getKey(), positionType, POSITION_RECORD_TYPE, positions);
            }
            Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().contains(LOOKTHROUGH) && field.getValue().isObject()) {
                    addRows(field.getValue(), container.getKey(), positionType, field.getKey(), lookthroughs);
                }
            }
        }
    }

    private static void addRows(JsonNode entries, String container, Object positionType, String recordType,
                                List<Map<String, Object>> out) {
        Iterator<Map.Entry<String, JsonNode>> it = entries.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> attributes = entry.getValue().fields();
            while (attributes.hasNext()) {
                Map.Entry<String, JsonNode> attribute = attributes.next();
                row.put(attribute.getKey(), toValue(attribute.getValue()));
            }
            row.put(CONTAINER, container);
            row.put(POSITION_TYPE, positionType);
            row.put(IDENTIFIER, entry.getKey());
            row.put(RECORD_TYPE, recordType);
            out.add(row);
        }
    }

    static Frame standardize(Frame frame) {
        Frame out = frame;
        if (out.hasColumn(INSTRUMENT_IDENTIFIER)) {
            out = out.withColumn(INSTRUMENT_ID, out.column(INSTRUMENT_IDENTIFIER));
        }
        if (out.hasColumn(SUB_PORTFOLIO_ID)) {
            out = out.withColumn(SUB_PORTFOLIO_ID, asStrings(out.column(SUB_PORTFOLIO_ID)).fillNull(DEFAULT_SUB_PORTFOLIO));
        } else {
            out = out.withColumn(SUB_PORTFOLIO_ID, Column.constant(DEFAULT_SUB_PORTFOLIO, out.height()));
        }
        if (!out.hasColumn(PERSPECTIVE_ID)) {
            out = out.withColumn(PERSPECTIVE_ID, Column.constant(NullSentinels.INT_NULL, out.height()));
        }
        return out;
    }

    static Frame fillNulls(Frame frame, Collection<String> excluded) {
        Map<String, Column> filled = new LinkedHashMap<>();
        for (String name : frame.columnNames()) {
            if (excluded.contains(name)) {
                continue;
            }
            Column column = frame.column(name);
            if (column.nullCount() == 0) {
                continue;
            }
            if (column.type() == DataType.LONG) {
                filled.put(name, column.fillNull(NullSentinels.INT_NULL));
            } else if (column.type() == DataType.DOUBLE) {
                filled.put(name, column.fillNull(NullSentinels.FLOAT_NULL));
            }
        }
        return filled.isEmpty() ? frame : frame.withColumns(filled);
    }

    private static Column asStrings(Column column) {
        if (column.type() == DataType.STRING) {
            return column;
        }
        String[] out = new String[column.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = column.isNull(i) ? null : String.valueOf(column.get(i));
        }
        return Column.ofStrings(out);
    }

    /**
     * Plain value of a JSON attribute. Nested objects and arrays are kept as their
     * JSON text.
     */
    static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return node.toString();
    }
}
