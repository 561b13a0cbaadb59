package com.prism.perspective.runtime.frame;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, materialized table: an ordered set of equally sized named columns.
 * <p>
 * Every transformation returns a new frame that shares untouched columns with its
 * input. Frames are what a lazy plan collects into and what it starts from.
 */
public final class Frame {

    private static final Frame EMPTY = new Frame(new LinkedHashMap<>(), 0);

    private final LinkedHashMap<String, Column> columns;
    private final int height;

    private Frame(LinkedHashMap<String, Column> columns, int height) {
        this.columns = columns;
        this.height = height;
    }

    public static Frame empty() {
        return EMPTY;
    }

    public static Frame of(Map<String, Column> columns) {
        if (columns.isEmpty()) {
            return EMPTY;
        }
        int height = -1;
        for (Map.Entry<String, Column> e : columns.entrySet()) {
            int size = e.getValue().size();
            if (height < 0) {
                height = size;
            } else if (size != height) {
                throw new FrameException("Column '" + e.getKey() + "' has " + size
                        + " rows, expected " + height);
            }
        }
        return new Frame(new LinkedHashMap<>(columns), height);
    }

    /**
     * Builds a frame from row maps. Column order follows first appearance; a key
     * absent from a row is a null in that row.
     */
    public static Frame fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            names.addAll(row.keySet());
        }
        LinkedHashMap<String, Column> out = new LinkedHashMap<>();
        for (String name : names) {
            List<Object> values = new ArrayList<>(rows.size());
            for (Map<String, ?> row : rows) {
                values.add(row.get(name));
            }
            out.put(name, Column.fromValues(values));
        }
        return out.isEmpty() ? EMPTY : new Frame(out, rows.size());
    }

    public int height() {
        return height;
    }

    public boolean isEmpty() {
        return height == 0;
    }

    public List<String> columnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Column column(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new FrameException("Column not found: " + name + " (available: " + columns.keySet() + ")");
        }
        return column;
    }

    public Frame withColumn(String name, Column column) {
        if (!columns.isEmpty() && column.size() != height) {
            throw new FrameException("Column '" + name + "' has " + column.size()
                    + " rows, expected " + height);
        }
        LinkedHashMap<String, Column> out = new LinkedHashMap<>(columns);
        out.put(name, column);
        return new Frame(out, columns.isEmpty() ? column.size() : height);
    }

    public Frame withColumns(Map<String, Column> added) {
        Frame result = this;
        for (Map.Entry<String, Column> e : added.entrySet()) {
            result = result.withColumn(e.getKey(), e.getValue());
        }
        return result;
    }

    public Frame select(Collection<String> names) {
        LinkedHashMap<String, Column> out = new LinkedHashMap<>();
        for (String name : names) {
            out.put(name, column(name));
        }
        return new Frame(out, out.isEmpty() ? 0 : height);
    }

    public Frame drop(Collection<String> names) {
        LinkedHashMap<String, Column> out = new LinkedHashMap<>(columns);
        names.forEach(out::remove);
        return new Frame(out, out.isEmpty() ? 0 : height);
    }

    /**
     * Renames columns; names missing from this frame are ignored.
     */
    public Frame rename(Map<String, String> mapping) {
        LinkedHashMap<String, Column> out = new LinkedHashMap<>();
        for (Map.Entry<String, Column> e : columns.entrySet()) {
            out.put(mapping.getOrDefault(e.getKey(), e.getKey()), e.getValue());
        }
        return new Frame(out, height);
    }

    public Frame take(int[] indices) {
        LinkedHashMap<String, Column> out = new LinkedHashMap<>();
        for (Map.Entry<String, Column> e : columns.entrySet()) {
            out.put(e.getKey(), e.getValue().take(indices));
        }
        return new Frame(out, indices.length);
    }

    /**
     * Keeps rows where {@code mask} is true; false and null both drop the row.
     */
    public Frame filter(Column mask) {
        if (mask.type() != DataType.BOOLEAN && mask.type() != DataType.NULL) {
            throw new FrameException("Filter mask must be BOOLEAN, was " + mask.type());
        }
        IntArrayList keep = new IntArrayList();
        for (int i = 0; i < mask.size(); i++) {
            if (!mask.isNull(i) && mask.getBoolean(i)) {
                keep.add(i);
            }
        }
        return take(keep.toIntArray());
    }

    /**
     * Row indices grouped by the values of {@code keys}, groups in first-seen order.
     * Null key values form their own group.
     */
    public Map<List<Object>, IntArrayList> groupIndices(List<String> keys) {
        List<Column> keyColumns = keyColumns(keys);
        Object2ObjectLinkedOpenHashMap<List<Object>, IntArrayList> groups = new Object2ObjectLinkedOpenHashMap<>();
        for (int row = 0; row < height; row++) {
            groups.computeIfAbsent(keyAt(keyColumns, row), k -> new IntArrayList()).add(row);
        }
        return groups;
    }

    /**
     * Splits this frame by the values of {@code keys}, preserving row order within
     * each partition.
     */
    public Map<List<Object>, Frame> partitionBy(List<String> keys) {
        Map<List<Object>, Frame> out = new LinkedHashMap<>();
        groupIndices(keys).forEach((key, rows) -> out.put(key, take(rows.toIntArray())));
        return out;
    }

    public Map<String, Object> row(int index) {
        Map<String, Object> row = new LinkedHashMap<>();
        columns.forEach((name, column) -> row.put(name, column.get(index)));
        return row;
    }

    List<Column> keyColumns(List<String> keys) {
        List<Column> out = new ArrayList<>(keys.size());
        for (String key : keys) {
            out.add(column(key));
        }
        return out;
    }

    /**
     * Normalized composite key of a row. Integral doubles collapse onto longs so that
     * a LONG key column matches a DOUBLE one holding the same value.
     */
    static List<Object> keyAt(List<Column> keyColumns, int row) {
        Object[] key = new Object[keyColumns.size()];
        for (int k = 0; k < key.length; k++) {
            key[k] = normalizeKey(keyColumns.get(k).get(row));
        }
        return Arrays.asList(key);
    }

    static Object normalizeKey(Object value) {
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)
                && Math.abs(d) < 9.0E15) {
            return d.longValue();
        }
        return value;
    }

    @Override
    public String toString() {
        return "Frame{height=" + height + ", columns=" + columns.keySet() + "}";
    }
}
