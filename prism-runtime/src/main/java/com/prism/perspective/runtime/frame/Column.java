package com.prism.perspective.runtime.frame;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, typed column of values with a null mask.
 * <p>
 * Numeric and boolean data live in primitive arrays; a set bit in the null mask
 * marks a missing value regardless of what the backing array holds at that slot.
 * Columns are never mutated after construction, so they are freely shared between
 * frames produced by different plan nodes.
 */
public final class Column {

    private final DataType type;
    private final int size;
    private final long[] longs;
    private final double[] doubles;
    private final boolean[] booleans;
    private final String[] strings;
    private final BitSet nulls;

    private Column(DataType type, int size, long[] longs, double[] doubles,
                   boolean[] booleans, String[] strings, BitSet nulls) {
        this.type = type;
        this.size = size;
        this.longs = longs;
        this.doubles = doubles;
        this.booleans = booleans;
        this.strings = strings;
        this.nulls = nulls;
    }

    public static Column ofLongs(long[] values, BitSet nulls) {
        return new Column(DataType.LONG, values.length, values, null, null, null, copy(nulls));
    }

    public static Column ofLongs(long... values) {
        return ofLongs(values, new BitSet());
    }

    public static Column ofDoubles(double[] values, BitSet nulls) {
        return new Column(DataType.DOUBLE, values.length, null, values, null, null, copy(nulls));
    }

    public static Column ofDoubles(double... values) {
        return ofDoubles(values, new BitSet());
    }

    public static Column ofBooleans(boolean[] values, BitSet nulls) {
        return new Column(DataType.BOOLEAN, values.length, null, null, values, null, copy(nulls));
    }

    public static Column ofBooleans(boolean... values) {
        return ofBooleans(values, new BitSet());
    }

    /**
     * Builds a string column; {@code null} entries become nulls.
     */
    public static Column ofStrings(String... values) {
        BitSet mask = new BitSet(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                mask.set(i);
            }
        }
        return new Column(DataType.STRING, values.length, null, null, null, values.clone(), mask);
    }

    public static Column nulls(int size) {
        BitSet mask = new BitSet(size);
        mask.set(0, size);
        return new Column(DataType.NULL, size, null, null, null, null, mask);
    }

    /**
     * Repeats a scalar value {@code size} times. The column type follows the Java
     * type of the value: integral numbers become LONG, other numbers DOUBLE.
     */
    public static Column constant(Object value, int size) {
        if (value == null) {
            return nulls(size);
        }
        if (value instanceof Boolean b) {
            boolean[] v = new boolean[size];
            Arrays.fill(v, b);
            return ofBooleans(v, new BitSet());
        }
        if (isIntegral(value)) {
            long[] v = new long[size];
            Arrays.fill(v, ((Number) value).longValue());
            return ofLongs(v, new BitSet());
        }
        if (value instanceof Number n) {
            double[] v = new double[size];
            Arrays.fill(v, n.doubleValue());
            return ofDoubles(v, new BitSet());
        }
        if (value instanceof String s) {
            String[] v = new String[size];
            Arrays.fill(v, s);
            return ofStrings(v);
        }
        throw new FrameException("Unsupported literal type: " + value.getClass().getName());
    }

    /**
     * Infers a column from boxed values. Booleans, integral numbers, other numbers and
     * strings map to BOOLEAN, LONG, DOUBLE and STRING; integral and fractional numbers
     * widen to DOUBLE; any other mix falls back to STRING.
     */
    public static Column fromValues(List<?> values) {
        int n = values.size();
        boolean anyBool = false;
        boolean anyLong = false;
        boolean anyDouble = false;
        boolean anyOther = false;
        for (Object v : values) {
            if (v == null) {
                continue;
            }
            if (v instanceof Boolean) {
                anyBool = true;
            } else if (isIntegral(v)) {
                anyLong = true;
            } else if (v instanceof Number) {
                anyDouble = true;
            } else {
                anyOther = true;
            }
        }

        int kinds = (anyBool ? 1 : 0) + (anyLong || anyDouble ? 1 : 0) + (anyOther ? 1 : 0);
        if (kinds == 0) {
            return nulls(n);
        }
        BitSet mask = new BitSet(n);
        if (kinds > 1 || anyOther) {
            String[] out = new String[n];
            for (int i = 0; i < n; i++) {
                Object v = values.get(i);
                out[i] = v == null ? null : String.valueOf(v);
            }
            return ofStrings(out);
        }
        if (anyBool) {
            boolean[] out = new boolean[n];
            for (int i = 0; i < n; i++) {
                Object v = values.get(i);
                if (v == null) {
                    mask.set(i);
                } else {
                    out[i] = (Boolean) v;
                }
            }
            return ofBooleans(out, mask);
        }
        if (anyDouble) {
            double[] out = new double[n];
            for (int i = 0; i < n; i++) {
                Object v = values.get(i);
                if (v == null) {
                    mask.set(i);
                } else {
                    out[i] = ((Number) v).doubleValue();
                }
            }
            return ofDoubles(out, mask);
        }
        long[] out = new long[n];
        for (int i = 0; i < n; i++) {
            Object v = values.get(i);
            if (v == null) {
                mask.set(i);
            } else {
                out[i] = ((Number) v).longValue();
            }
        }
        return ofLongs(out, mask);
    }

    public DataType type() {
        return type;
    }

    public int size() {
        return size;
    }

    public boolean isNull(int row) {
        return nulls.get(row);
    }

    public int nullCount() {
        return nulls.cardinality();
    }

    public long getLong(int row) {
        return switch (type) {
            case LONG -> longs[row];
            case DOUBLE -> (long) doubles[row];
            default -> throw new FrameException("Column of type " + type + " has no long values");
        };
    }

    public double getDouble(int row) {
        return switch (type) {
            case LONG -> longs[row];
            case DOUBLE -> doubles[row];
            default -> throw new FrameException("Column of type " + type + " has no numeric values");
        };
    }

    public boolean getBoolean(int row) {
        if (type != DataType.BOOLEAN) {
            throw new FrameException("Column of type " + type + " has no boolean values");
        }
        return booleans[row];
    }

    public String getString(int row) {
        if (type != DataType.STRING) {
            throw new FrameException("Column of type " + type + " has no string values");
        }
        return strings[row];
    }

    /**
     * Boxed value at {@code row}, or {@code null}.
     */
    public Object get(int row) {
        if (nulls.get(row)) {
            return null;
        }
        return switch (type) {
            case LONG -> longs[row];
            case DOUBLE -> doubles[row];
            case BOOLEAN -> booleans[row];
            case STRING -> strings[row];
            case NULL -> null;
        };
    }

    /**
     * Gathers rows by index. A negative index yields a null, which is how unmatched
     * rows of a left join are represented.
     */
    public Column take(int[] indices) {
        int n = indices.length;
        BitSet mask = new BitSet(n);
        for (int i = 0; i < n; i++) {
            if (indices[i] < 0 || nulls.get(indices[i])) {
                mask.set(i);
            }
        }
        switch (type) {
            case LONG: {
                long[] out = new long[n];
                for (int i = 0; i < n; i++) {
                    if (indices[i] >= 0) {
                        out[i] = longs[indices[i]];
                    }
                }
                return new Column(type, n, out, null, null, null, mask);
            }
            case DOUBLE: {
                double[] out = new double[n];
                for (int i = 0; i < n; i++) {
                    if (indices[i] >= 0) {
                        out[i] = doubles[indices[i]];
                    }
                }
                return new Column(type, n, null, out, null, null, mask);
            }
            case BOOLEAN: {
                boolean[] out = new boolean[n];
                for (int i = 0; i < n; i++) {
                    if (indices[i] >= 0) {
                        out[i] = booleans[indices[i]];
                    }
                }
                return new Column(type, n, null, null, out, null, mask);
            }
            case STRING: {
                String[] out = new String[n];
                for (int i = 0; i < n; i++) {
                    if (indices[i] >= 0) {
                        out[i] = strings[indices[i]];
                    }
                }
                return new Column(type, n, null, null, null, out, mask);
            }
            default:
                return nulls(n);
        }
    }

    /**
     * Replaces nulls with {@code value}. An integral fill value keeps a LONG column
     * LONG; a fractional one widens it to DOUBLE.
     */
    public Column fillNull(Object value) {
        if (value == null || nulls.isEmpty()) {
            return this;
        }
        if (type == DataType.NULL) {
            return constant(value, size);
        }
        if (type == DataType.LONG && isIntegral(value)) {
            long fill = ((Number) value).longValue();
            long[] out = longs.clone();
            for (int i = nulls.nextSetBit(0); i >= 0; i = nulls.nextSetBit(i + 1)) {
                out[i] = fill;
            }
            return ofLongs(out, new BitSet());
        }
        if (type.isNumeric() && value instanceof Number n) {
            double fill = n.doubleValue();
            double[] out = new double[size];
            for (int i = 0; i < size; i++) {
                out[i] = nulls.get(i) ? fill : getDouble(i);
            }
            return ofDoubles(out, new BitSet());
        }
        if (type == DataType.STRING && value instanceof String s) {
            String[] out = strings.clone();
            for (int i = nulls.nextSetBit(0); i >= 0; i = nulls.nextSetBit(i + 1)) {
                out[i] = s;
            }
            return ofStrings(out);
        }
        if (type == DataType.BOOLEAN && value instanceof Boolean b) {
            boolean[] out = booleans.clone();
            for (int i = nulls.nextSetBit(0); i >= 0; i = nulls.nextSetBit(i + 1)) {
                out[i] = b;
            }
            return ofBooleans(out, new BitSet());
        }
        throw new FrameException("Cannot fill " + type + " column with " + value.getClass().getSimpleName());
    }

    static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte;
    }

    private static BitSet copy(BitSet nulls) {
        return nulls == null ? new BitSet() : (BitSet) nulls.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Column other) || other.type != type || other.size != size) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (!Objects.equals(get(i), other.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = type.hashCode() * 31 + size;
        for (int i = 0; i < Math.min(size, 16); i++) {
            h = h * 31 + Objects.hashCode(get(i));
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Column{").append(type).append(", [");
        for (int i = 0; i < Math.min(size, 10); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(get(i));
        }
        if (size > 10) {
            sb.append(", ...");
        }
        return sb.append("]}").toString();
    }
}
