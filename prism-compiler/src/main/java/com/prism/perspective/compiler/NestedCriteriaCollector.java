package com.prism.perspective.compiler;

import com.prism.perspective.api.model.Criteria;
import com.prism.perspective.api.model.NestedCriteria;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Walks criteria trees to find what must be resolved before compilation: nested
 * membership value sets and the reference tables leaves name.
 */
public final class NestedCriteriaCollector {

    private NestedCriteriaCollector() {
        throw new AssertionError("No instances");
    }

    /**
     * Nested membership leaf to resolve.
     *
     * @param cacheKey key the resolved value set is stored under
     * @param column   column whose distinct values form the set
     * @param filter   records contributing values, {@code null} for all records
     */
    public record NestedMembership(String cacheKey, String column, Criteria filter) {
    }

    /**
     * Distinct nested memberships across all trees, keyed by cache key.
     */
    public static Map<String, NestedMembership> collect(Collection<Criteria> trees) {
        Map<String, NestedMembership> out = new LinkedHashMap<>();
        for (Criteria tree : trees) {
            visit(tree, out);
        }
        return out;
    }

    /**
     * {@code table_name} values declared on leaves, in first-seen order.
     */
    public static Set<String> referencedTables(Collection<Criteria> trees) {
        Set<String> out = new LinkedHashSet<>();
        for (Criteria tree : trees) {
            collectTables(tree, out);
        }
        return out;
    }

    private static void visit(Criteria node, Map<String, NestedMembership> out) {
        if (node == null) {
            return;
        }
        if (node instanceof Criteria.And and) {
            and.children().forEach(child -> visit(child, out));
        } else if (node instanceof Criteria.Or or) {
            or.children().forEach(child -> visit(child, out));
        } else if (node instanceof Criteria.Not not) {
            visit(not.child(), out);
        } else if (node instanceof Criteria.Leaf leaf && leaf.value() instanceof NestedCriteria nested) {
            out.putIfAbsent(nested.cacheKey(),
                    new NestedMembership(nested.cacheKey(), nested.column(), nested.filter()));
        }
    }

    private static void collectTables(Criteria node, Set<String> out) {
        if (node == null) {
            return;
        }
        if (node instanceof Criteria.And and) {
            and.children().forEach(child -> collectTables(child, out));
        } else if (node instanceof Criteria.Or or) {
            or.children().forEach(child -> collectTables(child, out));
        } else if (node instanceof Criteria.Not not) {
            collectTables(not.child(), out);
        } else if (node instanceof Criteria.Leaf leaf) {
            if (leaf.tableName() != null && !leaf.tableName().isBlank()) {
                out.add(leaf.tableName());
            }
            if (leaf.value() instanceof NestedCriteria nested) {
                collectTables(nested.filter(), out);
            }
        }
    }
}
