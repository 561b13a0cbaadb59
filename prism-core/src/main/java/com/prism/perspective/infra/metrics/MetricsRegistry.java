/*
 * Copyright (c) 2025 Prism Perspective Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.prism.perspective.infra.metrics;

import com.prism.perspective.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Metrics entry point used by the engine and the configuration manager.
 *
 * <p>The implementation is discovered with {@link java.util.ServiceLoader} through
 * {@link com.prism.perspective.infra.metrics.api.MetricsRegistryProvider}; without
 * a provider every metric is a no-op.
 *
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.timer("pipeline_step_duration", "step", "plan").record(elapsed);
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * @param name metric name, lowercase with underscores
     * @param tags alternating label keys and values
     */
    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
