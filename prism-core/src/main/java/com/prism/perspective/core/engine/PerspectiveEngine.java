/*
 * Copyright (c) 2025 Prism Perspective Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.prism.perspective.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.perspective.api.ICriteriaCompiler;
import com.prism.perspective.api.IConfigurationManager;
import com.prism.perspective.api.IPerspectiveEngine;
import com.prism.perspective.api.IReferenceLoader;
import com.prism.perspective.api.exceptions.ConfigurationException;
import com.prism.perspective.api.exceptions.InvalidRequestException;
import com.prism.perspective.api.model.Criteria;
import com.prism.perspective.api.model.NestedValues;
import com.prism.perspective.api.model.PerspectiveRequest;
import com.prism.perspective.api.model.Rule;
import com.prism.perspective.compiler.CriteriaCompiler;
import com.prism.perspective.core.ingestion.DataIngestion;
import com.prism.perspective.core.ingestion.IngestedFrames;
import com.prism.perspective.core.ingestion.ReferenceDataJoiner;
import com.prism.perspective.core.output.OutputFormatter;
import com.prism.perspective.core.processing.PerspectivePlan;
import com.prism.perspective.core.processing.PerspectiveProcessor;
import com.prism.perspective.infra.config.EngineSettings;
import com.prism.perspective.infra.loader.JsonFilePerspectiveLoader;
import com.prism.perspective.infra.management.ConfigurationManager;
import com.prism.perspective.infra.management.PerspectiveFactory;
import com.prism.perspective.infra.metrics.MetricsRegistry;
import com.prism.perspective.runtime.evaluation.LazyFrame;
import com.prism.perspective.runtime.frame.Frame;
import com.prism.perspective.runtime.frame.FrameException;
import com.prism.perspective.runtime.model.PerspectiveConfiguration;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one request through the pipeline. Perspectives and modifiers are loaded
 * beforehand by the configuration manager; per request the engine
 * <ol>
 *   <li>parses the request, merges custom perspectives and resolves the required
 *       reference tables;</li>
 *   <li>builds the position and lookthrough frames;</li>
 *   <li>fetches and joins reference data;</li>
 *   <li>precomputes nested criteria value sets;</li>
 *   <li>builds the factor plan;</li>
 *   <li>collects both plans in one pass;</li>
 *   <li>formats the response.</li>
 * </ol>
 * Each step runs in its own span and records a {@code pipeline_step_duration}
 * timer tagged with the step name. The engine is stateless between requests and
 * safe to share across threads.
 */
public class PerspectiveEngine implements IPerspectiveEngine {
    private static final Logger logger = Logger.getLogger(PerspectiveEngine.class.getName());

    static final String STEP_TIMER = "pipeline_step_duration";

    private final IConfigurationManager configurationManager;
    private final CustomPerspectiveParser customPerspectiveParser;
    private final RequestParser requestParser;
    private final ReferenceDataJoiner referenceDataJoiner;
    private final ICriteriaCompiler compiler;
    private final NestedCriteriaPrecomputer nestedCriteriaPrecomputer;
    private final Tracer tracer;
    private final MetricsRegistry metrics;

    public PerspectiveEngine(ConfigurationManager configurationManager, IReferenceLoader referenceLoader,
                             EngineSettings settings, Tracer tracer) {
        this(configurationManager, configurationManager.getPerspectiveFactory(), referenceLoader,
                settings, tracer, new ObjectMapper());
    }

    public PerspectiveEngine(IConfigurationManager configurationManager, PerspectiveFactory factory,
                             IReferenceLoader referenceLoader, EngineSettings settings, Tracer tracer,
                             ObjectMapper mapper) {
        this.configurationManager = configurationManager;
        this.customPerspectiveParser = new CustomPerspectiveParser(factory, mapper);
        this.requestParser = new RequestParser(settings.defaultEffectiveDate());
        this.referenceDataJoiner = new ReferenceDataJoiner(referenceLoader, settings.referenceMaxThreads());
        this.compiler = new CriteriaCompiler(settings.strictNestedCriteria());
        this.nestedCriteriaPrecomputer = new NestedCriteriaPrecomputer(compiler);
        this.tracer = tracer;
        this.metrics = MetricsRegistry.getInstance();
    }

    /**
     * Engine over the perspective file named by {@link EngineSettings#perspectivesFile()}.
     *
     * @throws ConfigurationException if no perspective file is configured
     */
    public static PerspectiveEngine fromSettings(EngineSettings settings, IReferenceLoader referenceLoader,
                                                 Tracer tracer) {
        ObjectMapper mapper = new ObjectMapper();
        JsonFilePerspectiveLoader loader = new JsonFilePerspectiveLoader(settings.perspectivesFile()
                .orElseThrow(() -> new ConfigurationException(EngineSettings.PERSPECTIVES_FILE + " is not set")),
                mapper);
        ConfigurationManager manager = new ConfigurationManager(loader, null, tracer, mapper);
        return new PerspectiveEngine(manager, manager.getPerspectiveFactory(), referenceLoader, settings,
                tracer, mapper);
    }

    @Override
    public Map<String, Object> process(JsonNode json) {
        Span span = tracer.spanBuilder("process-request").startSpan();
        try (Scope scope = span.makeCurrent()) {
            Map<String, Object> response = doProcess(json, span);
            metrics.counter("perspective_requests", "outcome", "success").increment();
            return response;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            metrics.counter("perspective_requests", "outcome", "failure").increment();
            logger.log(Level.WARNING, "Request failed: " + e.getMessage(), e);
            if (e instanceof FrameException) {
                throw new InvalidRequestException("Request data cannot be evaluated: " + e.getMessage(), e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    private Map<String, Object> doProcess(JsonNode json, Span span) {
        PreparedRequest prepared = step("parse-request", () -> prepare(json));
        PerspectiveRequest request = prepared.request();
        span.setAttribute("configurations", request.perspectiveConfigurations().size());
        span.setAttribute("custom_perspectives", prepared.customCount());

        List<String> weightLabels = new ArrayList<>(request.positionWeightLabels());
        weightLabels.addAll(request.lookthroughWeightLabels());
        IngestedFrames ingested = step("build-frames", () -> DataIngestion.buildFrames(request.data(), weightLabels));
        if (!ingested.hasPositions()) {
            logger.info("Request holds no positions, returning an empty response");
            return OutputFormatter.emptyResponse();
        }
        span.setAttribute("positions", ingested.positions().height());
        span.setAttribute("lookthroughs", ingested.lookthroughs().height());

        IngestedFrames frames = step("load-reference-data", () -> referenceDataJoiner.join(ingested,
                prepared.requiredTables(), request.effectiveDate(), request.systemVersionTimestamp()));

        PerspectiveConfiguration configuration = prepared.configuration();
        NestedValues nestedValues = step("precompute-nested-criteria", () -> nestedCriteriaPrecomputer.precompute(
                frames.positions(), criteriaOf(configuration, request.perspectiveConfigurations())));

        PerspectivePlan plan = step("build-plan", () -> new PerspectiveProcessor(configuration, compiler).buildPlan(
                LazyFrame.of(frames.positions()),
                frames.hasLookthroughs() ? LazyFrame.of(frames.lookthroughs()) : null,
                request.perspectiveConfigurations(),
                request.positionWeightLabels(),
                request.lookthroughWeightLabels(),
                nestedValues));

        List<Frame> collected = step("collect", () -> LazyFrame.collectAll(plan.hasLookthroughs()
                ? List.of(plan.positions(), plan.lookthroughs())
                : List.of(plan.positions())));

        return step("format-output", () -> OutputFormatter.format(
                collected.get(0),
                plan.hasLookthroughs() ? collected.get(1) : null,
                plan.factorColumns(),
                request.positionWeightLabels(),
                request.lookthroughWeightLabels(),
                request.verbose(),
                request.flatten()));
    }

    private PreparedRequest prepare(JsonNode json) {
        PerspectiveRequest request = requestParser.parse(json);
        CustomPerspectives custom = customPerspectiveParser.parse(request.customPerspectiveRules());
        PerspectiveConfiguration configuration = configurationManager.getConfiguration()
                .withCustomPerspectives(custom.perspectives(), custom.requiredColumns());

        for (Map<Integer, List<String>> perspectives : request.perspectiveConfigurations().values()) {
            perspectives.forEach((id, modifiers) -> {
                configuration.requirePerspective(id);
                modifiers.forEach(configuration::requireModifier);
            });
        }
        Map<String, List<String>> requiredTables =
                RequiredTablesResolver.resolve(configuration, request.perspectiveConfigurations());
        logger.fine(() -> "Required reference tables: " + requiredTables);
        return new PreparedRequest(request, configuration, requiredTables, custom.perspectives().size());
    }

    /**
     * Criteria of the requested perspectives and of every modifier active for them.
     */
    static List<Criteria> criteriaOf(PerspectiveConfiguration configuration,
                                     Map<String, Map<Integer, List<String>>> requested) {
        List<Criteria> trees = new ArrayList<>();
        Set<String> modifiers = new LinkedHashSet<>();
        for (Map<Integer, List<String>> perspectives : requested.values()) {
            perspectives.forEach((id, names) -> {
                for (Rule rule : configuration.requirePerspective(id).rules()) {
                    trees.add(rule.criteria());
                }
                modifiers.addAll(configuration.activeModifiers(names));
            });
        }
        for (String name : modifiers) {
            trees.add(configuration.requireModifier(name).criteria());
        }
        return trees;
    }

    private <T> T step(String name, Supplier<T> body) {
        Span span = tracer.spanBuilder(name).startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            return body.get();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            metrics.timer(STEP_TIMER, "step", name).record(Duration.ofNanos(System.nanoTime() - start));
            span.end();
        }
    }

    private record PreparedRequest(PerspectiveRequest request, PerspectiveConfiguration configuration,
                                   Map<String, List<String>> requiredTables, int customCount) {
    }
}
