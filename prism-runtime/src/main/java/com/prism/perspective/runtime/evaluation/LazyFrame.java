package com.prism.perspective.runtime.evaluation;

import com.prism.perspective.runtime.expr.Expr;
import com.prism.perspective.runtime.frame.Frame;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deferred query over a {@link Frame}.
 * <p>
 * Every builder method appends a node and returns a new {@code LazyFrame}; nothing
 * is computed until {@link #collect()} or {@link #collectAll(List)}. Plans built from
 * a common prefix share that prefix, and a single {@code collectAll} evaluates
 * the shared part once.
 *
 * <pre>{@code
 * LazyFrame plan = LazyFrame.of(positions)
 *         .withColumn("f", when(col("liquidity_type_id").eq(2L)).then(1.0).otherwise(null))
 *         .filter(col("f").isNotNull());
 * Frame kept = plan.collect();
 * }</pre>
 */
public final class LazyFrame {

    private final PlanNode node;

    private LazyFrame(PlanNode node) {
        this.node = node;
    }

    public static LazyFrame of(Frame frame) {
        return new LazyFrame(new PlanNode.Source(frame));
    }

    /**
     * Column names this plan will produce.
     */
    public List<String> columnNames() {
        return node.schema();
    }

    public boolean hasColumn(String name) {
        return node.schema().contains(name);
    }

    public LazyFrame withColumn(String name, Expr expr) {
        Map<String, Expr> single = new LinkedHashMap<>();
        single.put(name, expr);
        return withColumns(single);
    }

    /**
     * Adds or replaces columns. All expressions are evaluated against this plan's
     * output, so one expression cannot see a column added by another in the same call.
     */
    public LazyFrame withColumns(Map<String, Expr> exprs) {
        if (exprs.isEmpty()) {
            return this;
        }
        return new LazyFrame(new PlanNode.WithColumns(node, exprs));
    }

    public LazyFrame filter(Expr predicate) {
        return new LazyFrame(new PlanNode.Filter(node, predicate));
    }

    public LazyFrame select(List<String> names) {
        return new LazyFrame(new PlanNode.Select(node, names));
    }

    public LazyFrame rename(Map<String, String> mapping) {
        return new LazyFrame(new PlanNode.Rename(node, mapping));
    }

    public LazyFrame unique(List<String> subset) {
        return new LazyFrame(new PlanNode.Unique(node, subset));
    }

    public LazyFrame leftJoin(LazyFrame right, List<String> leftOn, List<String> rightOn) {
        return new LazyFrame(new PlanNode.LeftJoin(node, right.node, leftOn, rightOn));
    }

    public LazyFrame leftJoin(LazyFrame right, List<String> on) {
        return leftJoin(right, on, on);
    }

    /**
     * Groups by {@code keys} and sums each expression per group.
     */
    public LazyFrame groupBySum(List<String> keys, Map<String, Expr> sums) {
        return new LazyFrame(new PlanNode.GroupBySum(node, keys, sums));
    }

    public Frame collect() {
        return new PlanExecutor().execute(node);
    }

    /**
     * Collects several plans in one run, evaluating shared sub-plans once.
     */
    public static List<Frame> collectAll(List<LazyFrame> plans) {
        PlanExecutor executor = new PlanExecutor();
        List<Frame> out = new ArrayList<>(plans.size());
        for (LazyFrame plan : plans) {
            out.add(executor.execute(plan.node()));
        }
        return out;
    }

    PlanNode node() {
        return node;
    }

    /**
     * Human-readable description of the last operator, for logs.
     */
    public String describe() {
        return node.describe();
    }

    @Override
    public String toString() {
        return "LazyFrame{" + node.describe() + "}";
    }
}
