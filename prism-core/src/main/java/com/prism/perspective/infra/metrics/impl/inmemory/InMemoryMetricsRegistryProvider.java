package com.prism.perspective.infra.metrics.impl.inmemory;

import com.prism.perspective.infra.metrics.MetricsRegistry;
import com.prism.perspective.infra.metrics.api.MetricsRegistryProvider;

/**
 * Registered by the test classpath so engine tests can read counters and step
 * timings back.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    static final int PRIORITY = 1000;

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return PRIORITY;
    }
}
