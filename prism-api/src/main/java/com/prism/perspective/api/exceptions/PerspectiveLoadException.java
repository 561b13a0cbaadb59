package com.prism.perspective.api.exceptions;

/**
 * The perspective definitions could not be read from their source.
 */
public class PerspectiveLoadException extends PerspectiveException {

    public PerspectiveLoadException(String message) {
        super(message);
    }

    public PerspectiveLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
