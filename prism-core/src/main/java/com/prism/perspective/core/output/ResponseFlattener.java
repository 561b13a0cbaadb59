package com.prism.perspective.core.output;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.prism.perspective.core.ingestion.DataIngestion.IDENTIFIER;
import static com.prism.perspective.core.ingestion.DataIngestion.LOOKTHROUGH;
import static com.prism.perspective.core.ingestion.DataIngestion.POSITIONS;

/**
 * Rewrites record blocks from row form into columnar form:
 * <pre>
 * {"123": {"weight": 0.5}, "456": {"weight": 0.2}}
 *   becomes
 * {"identifier": [123, 456], "weight": [0.5, 0.2]}
 * </pre>
 * Only {@code positions} and keys containing {@code lookthrough} are rewritten.
 */
public final class ResponseFlattener {

    static final int DECIMAL_PLACES = 13;

    private ResponseFlattener() {
        throw new AssertionError("No instances");
    }

    /**
     * Flattens every container of {@code results} in place.
     *
     * @param results configuration to perspective to container maps
     */
    @SuppressWarnings("unchecked")
    public static void flatten(Map<String, Object> results) {
        for (Object perspectives : results.values()) {
            for (Object containers : ((Map<String, Object>) perspectives).values()) {
                for (Object container : ((Map<String, Object>) containers).values()) {
                    flattenContainer((Map<String, Object>) container);
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static void flattenContainer(Map<String, Object> container) {
        for (Map.Entry<String, Object> block : container.entrySet()) {
            String key = block.getKey();
            if (POSITIONS.equals(key) || key.contains(LOOKTHROUGH)) {
                block.setValue(toColumns((Map<String, Object>) block.getValue()));
            }
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, List<Object>> toColumns(Map<String, Object> entries) {
        Map<String, List<Object>> out = new LinkedHashMap<>();
        List<Object> identifiers = new ArrayList<>(entries.size());
        out.put(IDENTIFIER, identifiers);
        entries.forEach((id, values) -> {
            identifiers.add(identifier(id));
            ((Map<String, Object>) values).forEach((label, value) ->
                    out.computeIfAbsent(label, k -> new ArrayList<>()).add(round(value)));
        });
        return out;
    }

    static Object identifier(String id) {
        try {
            return Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            return id;
        }
    }

    static Object round(Object value) {
        if (value instanceof Double d && Double.isFinite(d)) {
            return new BigDecimal(d).setScale(DECIMAL_PLACES, RoundingMode.HALF_EVEN).doubleValue();
        }
        return value;
    }
}
