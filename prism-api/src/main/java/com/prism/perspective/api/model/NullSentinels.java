package com.prism.perspective.api.model;

/**
 * Values that stand in for a missing number in non-weight numeric columns, so that
 * comparisons and membership tests see a concrete value instead of a null.
 */
public final class NullSentinels {

    public static final long INT_NULL = -2147483648L;
    public static final double FLOAT_NULL = -2147483648.49438;

    private NullSentinels() {
        throw new AssertionError("No instances");
    }

    public static boolean isSentinel(Object value) {
        if (value instanceof Long l) {
            return l == INT_NULL;
        }
        if (value instanceof Double d) {
            return d == FLOAT_NULL || d == (double) INT_NULL;
        }
        return false;
    }
}
