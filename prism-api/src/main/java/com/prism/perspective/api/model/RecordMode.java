package com.prism.perspective.api.model;

/**
 * Which of the two record relations an expression is being built for.
 */
public enum RecordMode {
    POSITION,
    LOOKTHROUGH
}
