package com.prism.perspective.runtime.frame;

/**
 * Physical type of a {@link Column}.
 */
public enum DataType {
    LONG,
    DOUBLE,
    BOOLEAN,
    STRING,
    /** Column with no known type whose every value is null. */
    NULL;

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }

    /**
     * Common supertype of two column types, used when branches of a conditional
     * expression are merged into one column.
     */
    public static DataType unify(DataType a, DataType b) {
        if (a == b) {
            return a;
        }
        if (a == NULL) {
            return b;
        }
        if (b == NULL) {
            return a;
        }
        if (a.isNumeric() && b.isNumeric()) {
            return DOUBLE;
        }
        throw new FrameException("Cannot unify column types " + a + " and " + b);
    }
}
