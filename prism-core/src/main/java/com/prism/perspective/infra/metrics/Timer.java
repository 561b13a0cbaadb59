package com.prism.perspective.infra.metrics;

import java.time.Duration;

/**
 * Duration sink for pipeline steps. Thread-safe.
 */
@FunctionalInterface
public interface Timer {

    /**
     * @param duration elapsed time measured by the caller, never negative
     */
    void record(Duration duration);
}
