package com.prism.perspective.core.processing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Names of the factor columns a plan adds, by configuration and perspective id.
 * Perspective ids are kept in ascending order within each configuration.
 */
public final class FactorColumns {

    private static final String PREFIX = "f_";

    private final Map<String, Map<Integer, String>> columns;

    private FactorColumns(Map<String, Map<Integer, String>> columns) {
        this.columns = columns;
    }

    public static String name(String configName, int perspectiveId) {
        return PREFIX + configName + "_" + perspectiveId;
    }

    public static FactorColumns of(Map<String, ? extends Iterable<Integer>> perspectiveIds) {
        Map<String, Map<Integer, String>> out = new LinkedHashMap<>();
        perspectiveIds.forEach((config, ids) -> {
            List<Integer> sorted = new ArrayList<>();
            ids.forEach(sorted::add);
            Collections.sort(sorted);
            Map<Integer, String> byId = new LinkedHashMap<>();
            for (Integer id : sorted) {
                byId.put(id, name(config, id));
            }
            out.put(config, Collections.unmodifiableMap(byId));
        });
        return new FactorColumns(Collections.unmodifiableMap(out));
    }

    public Map<String, Map<Integer, String>> byConfiguration() {
        return columns;
    }

    public List<String> all() {
        List<String> out = new ArrayList<>();
        columns.values().forEach(byId -> out.addAll(byId.values()));
        return out;
    }

    public boolean isEmpty() {
        return all().isEmpty();
    }

    @Override
    public String toString() {
        return "FactorColumns" + columns;
    }
}
