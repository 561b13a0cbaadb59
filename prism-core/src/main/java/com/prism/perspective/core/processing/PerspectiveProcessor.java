/*
 * Copyright (c) 2025 Prism Perspective Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.prism.perspective.core.processing;

import com.prism.perspective.api.ICriteriaCompiler;
import com.prism.perspective.api.exceptions.ConfigurationException;
import com.prism.perspective.api.exceptions.InvalidRequestException;
import com.prism.perspective.api.model.Criteria;
import com.prism.perspective.api.model.Modifier;
import com.prism.perspective.api.model.ModifierType;
import com.prism.perspective.api.model.NestedValues;
import com.prism.perspective.api.model.NextRuleCondition;
import com.prism.perspective.api.model.Perspective;
import com.prism.perspective.api.model.RecordMode;
import com.prism.perspective.api.model.Rule;
import com.prism.perspective.api.model.RuleResultOperator;
import com.prism.perspective.runtime.evaluation.LazyFrame;
import com.prism.perspective.runtime.expr.Expr;
import com.prism.perspective.runtime.expr.Exprs;
import com.prism.perspective.runtime.model.PerspectiveConfiguration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static com.prism.perspective.core.ingestion.DataIngestion.CONTAINER;
import static com.prism.perspective.core.ingestion.DataIngestion.INSTRUMENT_ID;
import static com.prism.perspective.core.ingestion.DataIngestion.PARENT_INSTRUMENT_ID;
import static com.prism.perspective.core.ingestion.DataIngestion.RECORD_TYPE;
import static com.prism.perspective.core.ingestion.DataIngestion.SUB_PORTFOLIO_ID;
import static com.prism.perspective.runtime.expr.Exprs.col;
import static com.prism.perspective.runtime.expr.Exprs.lit;
import static com.prism.perspective.runtime.expr.Exprs.when;

/**
 * Plans the factor columns of every requested perspective.
 * <p>
 * For each {@code (configuration, perspective)} a factor column
 * {@code f_<configuration>_<id>} is added to both relations: the scale factor
 * where the record is kept, null where it is removed. Lookthroughs then lose
 * their factor wherever the parent position was removed, and perspectives with a
 * scaling modifier are rescaled so that kept weights sum to one.
 * <p>
 * Nothing is evaluated here; the returned {@link PerspectivePlan} is collected by
 * the caller in a single pass.
 */
public class PerspectiveProcessor {
    private static final Logger logger = Logger.getLogger(PerspectiveProcessor.class.getName());

    public static final String SCALE_HOLDINGS = "scale_holdings_to_100_percent";
    public static final String SCALE_LOOKTHROUGHS = "scale_lookthroughs_to_100_percent";
    public static final String ESSENTIAL_LOOKTHROUGHS = "essential_lookthroughs";

    static final List<String> POSITION_RESCALE_KEYS = List.of(CONTAINER, SUB_PORTFOLIO_ID);
    static final List<String> LOOKTHROUGH_RESCALE_KEYS =
            List.of(CONTAINER, PARENT_INSTRUMENT_ID, SUB_PORTFOLIO_ID, RECORD_TYPE);
    private static final List<String> SYNC_KEYS = List.of(INSTRUMENT_ID, SUB_PORTFOLIO_ID);
    private static final String PARENT_PREFIX = "parent_";

    private final PerspectiveConfiguration configuration;
    private final ICriteriaCompiler compiler;

    public PerspectiveProcessor(PerspectiveConfiguration configuration, ICriteriaCompiler compiler) {
        this.configuration = configuration;
        this.compiler = compiler;
    }

    /**
     * @param positions         position records
     * @param lookthroughs      lookthrough records, {@code null} when there are none
     * @param configurations    configuration name to perspective id to requested modifiers
     * @param positionWeights   position weight labels, the first one drives rescaling
     * @param lookthroughWeights lookthrough weight labels, the first one drives rescaling
     * @param nestedValues      resolved nested membership sets
     */
    public PerspectivePlan buildPlan(LazyFrame positions, LazyFrame lookthroughs,
                                     Map<String, Map<Integer, List<String>>> configurations,
                                     List<String> positionWeights, List<String> lookthroughWeights,
                                     NestedValues nestedValues) {
        Map<String, Iterable<Integer>> ids = new LinkedHashMap<>();
        configurations.forEach((config, perspectives) -> ids.put(config, perspectives.keySet()));
        FactorColumns factorColumns = FactorColumns.of(ids);

        Map<String, Expr> positionFactors = new LinkedHashMap<>();
        Map<String, Expr> lookthroughFactors = new LinkedHashMap<>();
        List<String> rescalePositions = new ArrayList<>();
        List<String> rescaleLookthroughs = new ArrayList<>();

        factorColumns.byConfiguration().forEach((config, columns) -> columns.forEach((id, column) -> {
            Perspective perspective = configuration.requirePerspective(id);
            List<String> requested = configurations.get(config).get(id);
            List<String> active = configuration.activeModifiers(requested == null ? List.of() : requested);

            requireColumns(perspective, active, RecordMode.POSITION, positions, nestedValues);
            positionFactors.put(column, factorExpression(perspective, active, RecordMode.POSITION, nestedValues));
            if (lookthroughs != null) {
                requireColumns(perspective, active, RecordMode.LOOKTHROUGH, lookthroughs, nestedValues);
                lookthroughFactors.put(column,
                        factorExpression(perspective, active, RecordMode.LOOKTHROUGH, nestedValues));
            }
            if (configuration.hasScalingModifier(active, SCALE_HOLDINGS)) {
                rescalePositions.add(column);
            }
            if (configuration.hasScalingModifier(active, SCALE_LOOKTHROUGHS)) {
                rescaleLookthroughs.add(column);
            }
        }));

        LazyFrame positionPlan = positions.withColumns(positionFactors);
        LazyFrame lookthroughPlan = null;
        if (lookthroughs != null) {
            lookthroughPlan = synchronize(positionPlan, lookthroughs.withColumns(lookthroughFactors),
                    factorColumns.all());
        }

        if (!rescalePositions.isEmpty()) {
            positionPlan = rescalePositions(positionPlan, lookthroughPlan, rescalePositions,
                    positionWeights.get(0), lookthroughWeights.get(0));
        }
        if (lookthroughPlan != null && !rescaleLookthroughs.isEmpty()) {
            lookthroughPlan = rescaleLookthroughs(lookthroughPlan, rescaleLookthroughs, lookthroughWeights.get(0));
        }
        logger.fine(() -> String.format("Planned %d factor columns, rescaling %d position and %d lookthrough columns",
                factorColumns.all().size(), rescalePositions.size(), rescaleLookthroughs.size()));
        return new PerspectivePlan(positionPlan, lookthroughPlan, factorColumns);
    }

    /**
     * Fails when a rule or modifier applicable to {@code mode} reads a column the
     * records do not have.
     *
     * @throws ConfigurationException naming the column and the rule or modifier reading it
     */
    void requireColumns(Perspective perspective, List<String> activeModifiers, RecordMode mode, LazyFrame records,
                        NestedValues nestedValues) {
        List<Rule> rules = perspective.rules();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (rule.isApplicable(mode)) {
                requireColumns(rule.criteria(), perspective.id(), mode, records, nestedValues,
                        "Rule " + i + " of perspective " + perspective.id());
            }
        }
        for (String name : activeModifiers) {
            Modifier modifier = configuration.requireModifier(name);
            if (modifier.type() != ModifierType.SCALING && modifier.isApplicable(mode)) {
                requireColumns(modifier.criteria(), perspective.id(), mode, records, nestedValues,
                        "Modifier " + name + " (perspective " + perspective.id() + ")");
            }
        }
    }

    private void requireColumns(Criteria criteria, Integer perspectiveId, RecordMode mode, LazyFrame records,
                                NestedValues nestedValues, String owner) {
        for (String column : compiler.compile(criteria, perspectiveId, nestedValues).columns()) {
            if (!records.hasColumn(column)) {
                throw new ConfigurationException(owner + " reads column '" + column + "', missing from "
                        + (mode == RecordMode.POSITION ? "positions" : "lookthroughs"));
            }
        }
    }

    /**
     * {@code when(keep).then(scale).otherwise(null)}.
     */
    public Expr factorExpression(Perspective perspective, List<String> activeModifiers, RecordMode mode,
                                 NestedValues nestedValues) {
        return when(keepExpression(perspective, activeModifiers, mode, nestedValues))
                .then(scaleExpression(perspective, mode, nestedValues))
                .otherwise(null);
    }

    /**
     * Whether a record survives the perspective.
     * <ol>
     *   <li>every applicable pre-processing modifier excludes its matches;</li>
     *   <li>applicable non-scaling rules form a chain, each joining with OR when the
     *       rule just before it in the perspective's list says so, AND otherwise;
     *       no such rule keeps everything;</li>
     *   <li>applicable post-processing modifiers join the chain with their own operator.</li>
     * </ol>
     */
    public Expr keepExpression(Perspective perspective, List<String> activeModifiers, RecordMode mode,
                               NestedValues nestedValues) {
        Integer id = perspective.id();
        Expr keep = Exprs.TRUE;
        List<Modifier> postProcessing = new ArrayList<>();
        for (String name : activeModifiers) {
            Modifier modifier = configuration.requireModifier(name);
            if (!modifier.isApplicable(mode)) {
                continue;
            }
            if (modifier.type() == ModifierType.PRE_PROCESSING) {
                keep = keep.and(compiler.compile(modifier.criteria(), id, nestedValues).not());
            } else if (modifier.type() == ModifierType.POST_PROCESSING) {
                postProcessing.add(modifier);
            }
        }

        List<Rule> rules = perspective.rules();
        Expr chain = null;
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (rule.scalingRule() || !rule.isApplicable(mode)) {
                continue;
            }
            Expr criteria = compiler.compile(rule.criteria(), id, nestedValues);
            if (chain == null) {
                chain = criteria;
            } else if (rules.get(i - 1).conditionForNextRule() == NextRuleCondition.OR) {
                chain = chain.or(criteria);
            } else {
                chain = chain.and(criteria);
            }
        }
        if (chain == null) {
            chain = Exprs.TRUE;
        }

        for (Modifier modifier : postProcessing) {
            Expr criteria = compiler.compile(modifier.criteria(), id, nestedValues);
            chain = modifier.ruleResultOperator() == RuleResultOperator.OR
                    ? chain.or(criteria) : chain.and(criteria);
        }
        return keep.and(chain);
    }

    /**
     * Product of the scale factors of the applicable scaling rules a record matches,
     * 1.0 when it matches none.
     */
    public Expr scaleExpression(Perspective perspective, RecordMode mode, NestedValues nestedValues) {
        Expr scale = lit(1.0);
        for (Rule rule : perspective.rules()) {
            if (!rule.scalingRule() || !rule.isApplicable(mode)) {
                continue;
            }
            Expr criteria = compiler.compile(rule.criteria(), perspective.id(), nestedValues);
            scale = when(criteria).then(scale.mul(lit(rule.scaleFactor()))).otherwise(scale);
        }
        return scale;
    }

    /**
     * Nulls each lookthrough factor whose parent position, matched on
     * {@code (parent_instrument_id, sub_portfolio_id)}, was removed.
     */
    LazyFrame synchronize(LazyFrame positions, LazyFrame lookthroughs, List<String> factorColumns) {
        if (factorColumns.isEmpty()) {
            return lookthroughs;
        }
        if (!positions.hasColumn(INSTRUMENT_ID)) {
            throw new InvalidRequestException("Positions need " + INSTRUMENT_ID + " when lookthroughs are present");
        }
        if (!lookthroughs.hasColumn(PARENT_INSTRUMENT_ID)) {
            throw new InvalidRequestException("Lookthrough records need " + PARENT_INSTRUMENT_ID);
        }
        List<String> selected = new ArrayList<>(SYNC_KEYS);
        selected.addAll(factorColumns);
        Map<String, String> renames = new LinkedHashMap<>();
        Map<String, Expr> nullified = new LinkedHashMap<>();
        for (String column : factorColumns) {
            renames.put(column, PARENT_PREFIX + column);
            nullified.put(column, when(col(PARENT_PREFIX + column).isNull()).then(null).otherwise(col(column)));
        }
        LazyFrame parents = positions.select(selected).unique(SYNC_KEYS).rename(renames);

        List<String> original = lookthroughs.columnNames();
        return lookthroughs
                .leftJoin(parents, List.of(PARENT_INSTRUMENT_ID, SUB_PORTFOLIO_ID), SYNC_KEYS)
                .withColumns(nullified)
                .select(original);
    }

    /**
     * Divides each factor by the per {@code (container, sub_portfolio_id)} sum of
     * {@code weight * factor} over positions plus essential lookthroughs. Groups
     * whose sum is zero keep their factors.
     */
    LazyFrame rescalePositions(LazyFrame positions, LazyFrame lookthroughs, List<String> columns,
                               String positionWeight, String lookthroughWeight) {
        Map<String, Expr> positionSums = new LinkedHashMap<>();
        Map<String, Expr> lookthroughSums = new LinkedHashMap<>();
        for (String column : columns) {
            positionSums.put(positionSumName(column), col(positionWeight).mul(col(column)));
            lookthroughSums.put(lookthroughSumName(column), col(lookthroughWeight).mul(col(column)));
        }

        List<String> original = positions.columnNames();
        LazyFrame joined = positions.leftJoin(positions.groupBySum(POSITION_RESCALE_KEYS, positionSums),
                POSITION_RESCALE_KEYS);
        boolean withLookthroughs = lookthroughs != null && lookthroughs.hasColumn(RECORD_TYPE);
        if (withLookthroughs) {
            LazyFrame essential = lookthroughs.filter(col(RECORD_TYPE).eq(ESSENTIAL_LOOKTHROUGHS));
            joined = joined.leftJoin(essential.groupBySum(POSITION_RESCALE_KEYS, lookthroughSums),
                    POSITION_RESCALE_KEYS);
        }

        Map<String, Expr> rescaled = new LinkedHashMap<>();
        for (String column : columns) {
            Expr denominator = col(positionSumName(column)).fillNull(0.0);
            if (withLookthroughs) {
                denominator = denominator.add(col(lookthroughSumName(column)).fillNull(0.0));
            }
            rescaled.put(column, divideUnlessZero(column, denominator));
        }
        return joined.withColumns(rescaled).select(original);
    }

    /**
     * Divides each factor by the window sum of {@code weight * factor} over
     * {@code (container, parent_instrument_id, sub_portfolio_id, record_type)}.
     */
    LazyFrame rescaleLookthroughs(LazyFrame lookthroughs, List<String> columns, String lookthroughWeight) {
        Map<String, Expr> rescaled = new LinkedHashMap<>();
        for (String column : columns) {
            Expr total = col(lookthroughWeight).mul(col(column)).sumOver(LOOKTHROUGH_RESCALE_KEYS);
            rescaled.put(column, divideUnlessZero(column, total));
        }
        return lookthroughs.withColumns(rescaled);
    }

    private static Expr divideUnlessZero(String column, Expr denominator) {
        return when(denominator.ne(0.0)).then(col(column).div(denominator)).otherwise(col(column));
    }

    private static String positionSumName(String column) {
        return "sum_" + column + "_pos";
    }

    private static String lookthroughSumName(String column) {
        return "sum_" + column + "_lt";
    }
}
