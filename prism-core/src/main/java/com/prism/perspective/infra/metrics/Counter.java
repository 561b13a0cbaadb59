package com.prism.perspective.infra.metrics;

/**
 * Event count, one {@link #increment()} per occurrence. Thread-safe.
 */
@FunctionalInterface
public interface Counter {
    void increment();
}
