package com.prism.perspective.infra.metrics;

/**
 * Point-in-time level, such as the number of perspectives currently loaded.
 */
@FunctionalInterface
public interface Gauge {
    void set(double value);
}
