package com.prism.perspective.infra.metrics.api;

import com.prism.perspective.infra.metrics.MetricsRegistry;

/**
 * Plugs a {@link MetricsRegistry} into the engine. Implementations are listed in
 * {@code META-INF/services/com.prism.perspective.infra.metrics.api.MetricsRegistryProvider};
 * the one with the highest {@link #priority()} is used.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    int priority();
}
