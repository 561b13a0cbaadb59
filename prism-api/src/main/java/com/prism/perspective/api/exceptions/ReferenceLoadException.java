package com.prism.perspective.api.exceptions;

/**
 * A reference table could not be fetched. The whole request is aborted.
 */
public class ReferenceLoadException extends PerspectiveException {

    private final String table;

    public ReferenceLoadException(String table, String message, Throwable cause) {
        super("Failed to load reference table " + table + ": " + message, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
