/*
 * Copyright (c) 2025 Prism Perspective Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.prism.perspective.api.exceptions;

/**
 * Base type of every error raised while loading configuration or processing a
 * perspective request.
 * <p>
 * Unchecked so that the pipeline does not have to declare failures it cannot
 * recover from; a request either completes or fails as a whole.
 */
public class PerspectiveException extends RuntimeException {

    public PerspectiveException(String message) {
        super(message);
    }

    public PerspectiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public PerspectiveException(Throwable cause) {
        super(cause);
    }
}
