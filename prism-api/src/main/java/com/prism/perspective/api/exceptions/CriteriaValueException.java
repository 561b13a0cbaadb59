package com.prism.perspective.api.exceptions;

/**
 * A string-encoded criteria value could not be parsed.
 */
public class CriteriaValueException extends ConfigurationException {

    public enum Reason {
        /** List literal such as {@code "(1,2"} that cannot be split into items. */
        MALFORMED_LIST,
        /** Range literal that is neither {@code fncriteria:a:b} nor a two-element list. */
        MALFORMED_RANGE,
        /** Value of a type the operator cannot use. */
        UNSUPPORTED_VALUE
    }

    private final Reason reason;
    private final Object rawValue;

    public CriteriaValueException(Reason reason, Object rawValue, String message) {
        super(message + " (value: " + rawValue + ")");
        this.reason = reason;
        this.rawValue = rawValue;
    }

    public Reason getReason() {
        return reason;
    }

    public Object getRawValue() {
        return rawValue;
    }
}
