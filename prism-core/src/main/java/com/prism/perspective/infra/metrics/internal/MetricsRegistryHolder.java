package com.prism.perspective.infra.metrics.internal;

import com.prism.perspective.infra.metrics.MetricsRegistry;
import com.prism.perspective.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazily resolved process-wide registry.
 *
 * <p><b>Internal.</b> Use {@link MetricsRegistry#getInstance()}.
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry INSTANCE;

    static {
        MetricsRegistryProvider provider = StreamSupport.stream(
                        ServiceLoader.load(MetricsRegistryProvider.class).spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider != null) {
            INSTANCE = provider.create();
            logger.info(String.format("Metrics provider: %s (priority %d)",
                    provider.getClass().getSimpleName(), provider.priority()));
        } else {
            INSTANCE = new NoOpMetricsRegistry();
            logger.fine("No metrics provider found, metrics are disabled");
        }
    }

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }
}
