package com.prism.perspective.core.output;

import com.prism.perspective.core.processing.FactorColumns;
import com.prism.perspective.runtime.frame.Column;
import com.prism.perspective.runtime.frame.DataType;
import com.prism.perspective.runtime.frame.Frame;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.prism.perspective.core.ingestion.DataIngestion.CONTAINER;
import static com.prism.perspective.core.ingestion.DataIngestion.IDENTIFIER;
import static com.prism.perspective.core.ingestion.DataIngestion.PARENT_INSTRUMENT_ID;
import static com.prism.perspective.core.ingestion.DataIngestion.POSITIONS;
import static com.prism.perspective.core.ingestion.DataIngestion.RECORD_TYPE;

/**
 * Turns collected frames into the nested response:
 * <pre>
 * perspective_configurations.config.perspective_id.container
 *     .positions.identifier.weight_label = weight * factor
 *     .record_type.identifier.weight_label = weight * factor
 * </pre>
 * Only records with a non-null factor are emitted. In verbose mode each container
 * also gets {@code removed_positions_weight_summary}, listing removed positions one
 * by one but summing removed lookthroughs per parent instrument, and
 * {@code scale_factors}, the raw kept weight of containers that lost positions.
 */
public final class OutputFormatter {

    public static final String PERSPECTIVE_CONFIGURATIONS = "perspective_configurations";
    public static final String REMOVED_SUMMARY = "removed_positions_weight_summary";
    public static final String SCALE_FACTORS = "scale_factors";
    static final String DEFAULT_LOOKTHROUGH_KEY = "lookthrough";

    private OutputFormatter() {
        throw new AssertionError("No instances");
    }

    public static Map<String, Object> emptyResponse() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put(PERSPECTIVE_CONFIGURATIONS, new LinkedHashMap<String, Object>());
        return response;
    }

    /**
     * @param positions    collected positions holding every factor column
     * @param lookthroughs collected lookthroughs, may be null
     */
    public static Map<String, Object> format(Frame positions, Frame lookthroughs, FactorColumns factorColumns,
                                             List<String> positionWeights, List<String> lookthroughWeights,
                                             boolean verbose, boolean flatten) {
        List<String> positionLabels = presentColumns(positions, positionWeights);
        List<String> lookthroughLabels = lookthroughs == null ? List.of() : presentColumns(lookthroughs, lookthroughWeights);

        Map<String, Object> results = new LinkedHashMap<>();
        factorColumns.byConfiguration().forEach((config, columns) -> {
            if (columns.isEmpty()) {
                return;
            }
            Map<String, Object> byPerspective = new LinkedHashMap<>();
            columns.forEach((id, column) -> {
                Map<String, Object> containers = new LinkedHashMap<>();
                addPositions(containers, positions, column, positionLabels, verbose);
                if (lookthroughs != null && !lookthroughs.isEmpty()) {
                    addLookthroughs(containers, lookthroughs, column, lookthroughLabels, verbose);
                }
                byPerspective.put(String.valueOf(id), containers);
            });
            results.put(config, byPerspective);
        });

        if (flatten) {
            ResponseFlattener.flatten(results);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put(PERSPECTIVE_CONFIGURATIONS, results);
        return response;
    }

    private static void addPositions(Map<String, Object> containers, Frame positions, String factorColumn,
                                     List<String> labels, boolean verbose) {
        if (labels.isEmpty() || !positions.hasColumn(factorColumn)) {
            return;
        }
        Column factor = positions.column(factorColumn);
        Frame kept = positions.filter(notNullMask(factor, true));
        for (Map.Entry<List<Object>, Frame> part : kept.partitionBy(List.of(CONTAINER)).entrySet()) {
            container(containers, part.getKey().get(0))
                    .put(POSITIONS, weightedEntries(part.getValue(), factorColumn, labels));
        }
        if (!verbose) {
            return;
        }

        Frame removed = positions.filter(notNullMask(factor, false));
        if (removed.isEmpty()) {
            return;
        }
        Set<Object> removedContainers = new LinkedHashSet<>();
        for (Map.Entry<List<Object>, Frame> part : removed.partitionBy(List.of(CONTAINER)).entrySet()) {
            removedContainers.add(part.getKey().get(0));
            summary(containers, part.getKey().get(0)).put(POSITIONS, rawEntries(part.getValue(), labels));
        }

        for (Map.Entry<List<Object>, IntArrayList> group : kept.groupIndices(List.of(CONTAINER)).entrySet()) {
            Object container = group.getKey().get(0);
            if (!removedContainers.contains(container)) {
                continue;
            }
            Map<String, Object> sums = new LinkedHashMap<>();
            for (String label : labels) {
                Number sum = sum(kept.column(label), group.getValue());
                if (sum != null) {
                    sums.put(label, sum);
                }
            }
            container(containers, container).put(SCALE_FACTORS, sums);
        }
    }

    private static void addLookthroughs(Map<String, Object> containers, Frame lookthroughs, String factorColumn,
                                        List<String> labels, boolean verbose) {
        if (labels.isEmpty() || !lookthroughs.hasColumn(factorColumn)) {
            return;
        }
        Column factor = lookthroughs.column(factorColumn);
        Frame kept = lookthroughs.filter(notNullMask(factor, true));
        for (Map.Entry<List<Object>, Frame> part : kept.partitionBy(List.of(CONTAINER, RECORD_TYPE)).entrySet()) {
            container(containers, part.getKey().get(0))
                    .put(recordTypeKey(part.getKey().get(1)), weightedEntries(part.getValue(), factorColumn, labels));
        }
        if (!verbose || !lookthroughs.hasColumn(PARENT_INSTRUMENT_ID)) {
            return;
        }

        Frame removed = lookthroughs.filter(notNullMask(factor, false));
        Column parents = removed.column(PARENT_INSTRUMENT_ID);
        for (Map.Entry<List<Object>, IntArrayList> group
                : removed.groupIndices(List.of(CONTAINER, RECORD_TYPE, PARENT_INSTRUMENT_ID)).entrySet()) {
            List<Object> key = group.getKey();
            IntArrayList rows = group.getValue();
            Map<String, Object> sums = new LinkedHashMap<>();
            for (String label : labels) {
                sums.put(label, sum(removed.column(label), rows));
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> byParent = (Map<String, Object>) summary(containers, key.get(0))
                    .computeIfAbsent(recordTypeKey(key.get(1)), k -> new LinkedHashMap<String, Object>());
            byParent.put(String.valueOf(parents.get(rows.getInt(0))), sums);
        }
    }

    private static Map<String, Object> weightedEntries(Frame records, String factorColumn, List<String> labels) {
        Column identifiers = records.column(IDENTIFIER);
        Column factor = records.column(factorColumn);
        List<Column> weights = new ArrayList<>(labels.size());
        labels.forEach(label -> weights.add(records.column(label)));

        Map<String, Object> out = new LinkedHashMap<>();
        for (int row = 0; row < records.height(); row++) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int w = 0; w < labels.size(); w++) {
                Column weight = weights.get(w);
                values.put(labels.get(w), weight.isNull(row) || factor.isNull(row)
                        ? null : weight.getDouble(row) * factor.getDouble(row));
            }
            out.put(String.valueOf(identifiers.get(row)), values);
        }
        return out;
    }

    private static Map<String, Object> rawEntries(Frame records, List<String> labels) {
        Column identifiers = records.column(IDENTIFIER);
        Map<String, Object> out = new LinkedHashMap<>();
        for (int row = 0; row < records.height(); row++) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String label : labels) {
                values.put(label, records.column(label).get(row));
            }
            out.put(String.valueOf(identifiers.get(row)), values);
        }
        return out;
    }

    /**
     * Sum over {@code rows}, ignoring nulls. Integral columns sum to a {@code Long};
     * a column without numbers yields null.
     */
    static Number sum(Column column, IntArrayList rows) {
        if (column.type() == DataType.LONG) {
            long total = 0;
            for (int k = 0; k < rows.size(); k++) {
                if (!column.isNull(rows.getInt(k))) {
                    total += column.getLong(rows.getInt(k));
                }
            }
            return total;
        }
        if (column.type() == DataType.DOUBLE) {
            double total = 0.0;
            for (int k = 0; k < rows.size(); k++) {
                if (!column.isNull(rows.getInt(k))) {
                    total += column.getDouble(rows.getInt(k));
                }
            }
            return total;
        }
        return column.type() == DataType.NULL ? 0L : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> container(Map<String, Object> containers, Object name) {
        return (Map<String, Object>) containers.computeIfAbsent(String.valueOf(name),
                k -> new LinkedHashMap<String, Object>());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> summary(Map<String, Object> containers, Object name) {
        return (Map<String, Object>) container(containers, name)
                .computeIfAbsent(REMOVED_SUMMARY, k -> new LinkedHashMap<String, Object>());
    }

    private static String recordTypeKey(Object recordType) {
        return recordType == null ? DEFAULT_LOOKTHROUGH_KEY : String.valueOf(recordType);
    }

    private static Column notNullMask(Column factor, boolean kept) {
        boolean[] mask = new boolean[factor.size()];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = factor.isNull(i) != kept;
        }
        return Column.ofBooleans(mask);
    }

    private static List<String> presentColumns(Frame frame, List<String> labels) {
        List<String> out = new ArrayList<>(labels.size());
        for (String label : labels) {
            if (frame.hasColumn(label)) {
                out.add(label);
            }
        }
        return out;
    }
}
