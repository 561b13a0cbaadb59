package com.prism.perspective.infra.metrics.internal;

import com.prism.perspective.infra.metrics.Counter;
import com.prism.perspective.infra.metrics.Gauge;
import com.prism.perspective.infra.metrics.MetricsRegistry;
import com.prism.perspective.infra.metrics.Timer;

/**
 * Fallback used when no provider is registered.
 */
final class NoOpMetricsRegistry implements MetricsRegistry {

    private static final Counter COUNTER = () -> {
    };

    private static final Gauge GAUGE = value -> {
    };

    private static final Timer TIMER = duration -> {
    };

    @Override
    public Counter counter(String name, String... tags) {
        return COUNTER;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return GAUGE;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return TIMER;
    }
}
