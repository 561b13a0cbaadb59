package com.prism.perspective.runtime.frame;

/**
 * Thrown when a frame operation or lazy plan cannot be executed, for example
 * arithmetic on a string column or a join on a missing key.
 */
public class FrameException extends RuntimeException {

    public FrameException(String message) {
        super(message);
    }

    public FrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
