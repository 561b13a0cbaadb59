package com.prism.perspective.core.engine;

import com.prism.perspective.api.ICriteriaCompiler;
import com.prism.perspective.api.model.Criteria;
import com.prism.perspective.api.model.NestedValues;
import com.prism.perspective.api.model.NullSentinels;
import com.prism.perspective.compiler.NestedCriteriaCollector;
import com.prism.perspective.compiler.NestedCriteriaCollector.NestedMembership;
import com.prism.perspective.infra.metrics.MetricsRegistry;
import com.prism.perspective.runtime.evaluation.LazyFrame;
import com.prism.perspective.runtime.frame.Column;
import com.prism.perspective.runtime.frame.Frame;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Resolves the value sets of nested membership criteria before compilation.
 * <p>
 * For each nested definition the distinct non-null, non-sentinel values of its
 * column are collected across the positions, narrowed by its filter when it has
 * one. A definition whose column is missing from the positions is left out and
 * counted; the compiler then decides what the leaf means.
 */
public class NestedCriteriaPrecomputer {
    private static final Logger logger = Logger.getLogger(NestedCriteriaPrecomputer.class.getName());

    private final ICriteriaCompiler compiler;
    private final MetricsRegistry metrics;

    public NestedCriteriaPrecomputer(ICriteriaCompiler compiler) {
        this(compiler, MetricsRegistry.getInstance());
    }

    NestedCriteriaPrecomputer(ICriteriaCompiler compiler, MetricsRegistry metrics) {
        this.compiler = compiler;
        this.metrics = metrics;
    }

    public NestedValues precompute(Frame positions, Collection<Criteria> trees) {
        Map<String, NestedMembership> memberships = NestedCriteriaCollector.collect(trees);
        if (memberships.isEmpty()) {
            return NestedValues.none();
        }
        Map<String, List<Object>> resolved = new LinkedHashMap<>();
        for (NestedMembership membership : memberships.values()) {
            if (!positions.hasColumn(membership.column())) {
                metrics.counter("nested_criteria_unresolved").increment();
                logger.warning("Cannot resolve nested criteria, positions have no column '"
                        + membership.column() + "': " + membership.cacheKey());
                continue;
            }
            resolved.put(membership.cacheKey(), distinctValues(positions, membership));
        }
        logger.fine(() -> "Resolved " + resolved.size() + " of " + memberships.size() + " nested criteria");
        return NestedValues.of(resolved);
    }

    private List<Object> distinctValues(Frame positions, NestedMembership membership) {
        LazyFrame plan = LazyFrame.of(positions);
        if (membership.filter() != null) {
            plan = plan.filter(compiler.compile(membership.filter()));
        }
        Frame matching = plan.select(List.of(membership.column())).collect();
        Column values = matching.column(membership.column());
        Set<Object> out = new LinkedHashSet<>();
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (value != null && !NullSentinels.isSentinel(value)) {
                out.add(value);
            }
        }
        return new ArrayList<>(out);
    }
}
