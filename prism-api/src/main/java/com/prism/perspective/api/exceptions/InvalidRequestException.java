package com.prism.perspective.api.exceptions;

/**
 * The request itself is malformed, e.g. a custom perspective with a positive id
 * or a rule without criteria.
 */
public class InvalidRequestException extends PerspectiveException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
