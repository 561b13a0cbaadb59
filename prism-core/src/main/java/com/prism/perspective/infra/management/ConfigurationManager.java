/*
 * Copyright (c) 2025 Prism Perspective Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.prism.perspective.infra.management;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.perspective.api.IConfigurationManager;
import com.prism.perspective.api.IPerspectiveLoader;
import com.prism.perspective.api.model.Perspective;
import com.prism.perspective.api.model.PerspectiveDefinition;
import com.prism.perspective.compiler.CriteriaParser;
import com.prism.perspective.infra.metrics.MetricsRegistry;
import com.prism.perspective.runtime.model.PerspectiveConfiguration;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads perspective definitions and the supported modifiers into an immutable
 * {@link PerspectiveConfiguration}.
 * <p>
 * The active snapshot sits in an {@link AtomicReference}: requests read it without
 * locking and a reload swaps in a complete new snapshot. The initial load happens
 * in the constructor and fails fast; a failed reload leaves the previous snapshot
 * active.
 */
public class ConfigurationManager implements IConfigurationManager {
    private static final Logger logger = Logger.getLogger(ConfigurationManager.class.getName());

    private final IPerspectiveLoader loader;
    private final String systemVersionTimestamp;
    private final SupportedModifiers supportedModifiers;
    private final PerspectiveFactory factory;
    private final Tracer tracer;
    private final MetricsRegistry metrics;

    private final AtomicReference<PerspectiveConfiguration> active = new AtomicReference<>();
    private final ScheduledExecutorService refreshExecutor;

    public ConfigurationManager(IPerspectiveLoader loader, String systemVersionTimestamp, Tracer tracer) {
        this(loader, systemVersionTimestamp, tracer, new ObjectMapper());
    }

    public ConfigurationManager(IPerspectiveLoader loader, String systemVersionTimestamp, Tracer tracer,
                                ObjectMapper mapper) {
        this(loader, systemVersionTimestamp, tracer, new PerspectiveFactory(new CriteriaParser(mapper)), mapper);
    }

    private ConfigurationManager(IPerspectiveLoader loader, String systemVersionTimestamp, Tracer tracer,
                                 PerspectiveFactory factory, ObjectMapper mapper) {
        this(loader, systemVersionTimestamp, tracer, factory, SupportedModifiers.load(mapper, factory));
    }

    public ConfigurationManager(IPerspectiveLoader loader, String systemVersionTimestamp, Tracer tracer,
                                PerspectiveFactory factory, SupportedModifiers supportedModifiers) {
        this.loader = loader;
        this.systemVersionTimestamp = systemVersionTimestamp;
        this.tracer = tracer;
        this.factory = factory;
        this.supportedModifiers = supportedModifiers;
        this.metrics = MetricsRegistry.getInstance();
        this.refreshExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Perspective-Refresh");
            t.setDaemon(true);
            return t;
        });

        reloadInternal(); // Initial load, fail fast
    }

    @Override
    public PerspectiveConfiguration getConfiguration() {
        return active.get();
    }

    public PerspectiveFactory getPerspectiveFactory() {
        return factory;
    }

    /**
     * Reloads perspectives. On failure the previous snapshot stays active and the
     * error is rethrown.
     */
    @Override
    public void reload() {
        try {
            reloadInternal();
        } catch (RuntimeException e) {
            metrics.counter("configuration_reload_failures").increment();
            logger.log(Level.SEVERE, "Failed to reload perspectives. Previous configuration remains active.", e);
            throw e;
        }
    }

    /**
     * Reloads periodically until {@link #shutdown()}.
     */
    public void start(Duration interval) {
        long millis = interval.toMillis();
        refreshExecutor.scheduleAtFixedRate(this::scheduledReload, millis, millis, TimeUnit.MILLISECONDS);
    }

    public void shutdown() {
        refreshExecutor.shutdown();
    }

    private void scheduledReload() {
        try {
            reload();
        } catch (RuntimeException e) {
            // already logged and counted by reload()
            logger.fine("Scheduled reload skipped: " + e.getMessage());
        }
    }

    private void reloadInternal() {
        Span span = tracer.spanBuilder("load-perspectives").startSpan();
        try (Scope scope = span.makeCurrent()) {
            Map<Integer, PerspectiveDefinition> definitions = loader.loadPerspectives(systemVersionTimestamp);
            PerspectiveConfiguration configuration = build(definitions);
            active.set(configuration);

            span.setAttribute("perspectives.loaded", configuration.perspectives().size());
            span.setAttribute("perspectives.skipped", definitions.size() - configuration.perspectives().size());
            metrics.gauge("perspectives_loaded").set(configuration.perspectives().size());
            logger.info("Loaded configuration: " + configuration);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private PerspectiveConfiguration build(Map<Integer, PerspectiveDefinition> definitions) {
        Map<Integer, Perspective> perspectives = new LinkedHashMap<>();
        Map<Integer, Map<String, List<String>>> requiredColumns = new LinkedHashMap<>();

        definitions.forEach((id, definition) -> {
            if (!definition.active() || !definition.supported()) {
                logger.fine(() -> "Skipping inactive or unsupported perspective " + id);
                return;
            }
            Map<String, List<String>> columns = new LinkedHashMap<>();
            perspectives.put(id, factory.perspective(id, definition, columns));
            if (!columns.isEmpty()) {
                requiredColumns.put(id, columns);
            }
        });

        return new PerspectiveConfiguration(perspectives, supportedModifiers.modifiers(),
                supportedModifiers.defaultModifiers(), requiredColumns);
    }
}
