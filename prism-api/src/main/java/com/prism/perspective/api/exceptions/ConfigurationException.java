package com.prism.perspective.api.exceptions;

/**
 * Invalid or inconsistent perspective configuration: malformed criteria, an
 * unknown operator, or a request naming a perspective or modifier that is not
 * configured.
 */
public class ConfigurationException extends PerspectiveException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
