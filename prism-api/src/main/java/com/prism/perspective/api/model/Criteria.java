/*
 * Copyright (c) 2025 Prism Perspective Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.prism.perspective.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Boolean filter tree over record columns.
 * <p>
 * A leaf compares one column with a value; {@link And}, {@link Or} and {@link Not}
 * combine subtrees. Leaf values are plain Java values as read from JSON
 * ({@code Long}, {@code Double}, {@code String}, {@code Boolean}, {@code List}),
 * or a {@link NestedCriteria} for membership tests whose value set is computed
 * from the data.
 */
public sealed interface Criteria permits Criteria.Leaf, Criteria.And, Criteria.Or, Criteria.Not {

    /**
     * @param column    record column the leaf reads
     * @param operator  comparison to apply
     * @param value     operand, may be null for null checks
     * @param tableName reference table the column comes from, if any
     */
    record Leaf(String column, CriteriaOperator operator, Object value, String tableName) implements Criteria {
        public Leaf {
            Objects.requireNonNull(column, "column");
            Objects.requireNonNull(operator, "operator");
        }
    }

    record And(List<Criteria> children) implements Criteria {
        public And {
            children = List.copyOf(children);
        }
    }

    record Or(List<Criteria> children) implements Criteria {
        public Or {
            children = List.copyOf(children);
        }
    }

    record Not(Criteria child) implements Criteria {
        public Not {
            Objects.requireNonNull(child, "child");
        }
    }

    static Leaf leaf(String column, CriteriaOperator operator, Object value) {
        return new Leaf(column, operator, value, null);
    }

    static And and(Criteria... children) {
        return new And(List.of(children));
    }

    static Or or(Criteria... children) {
        return new Or(List.of(children));
    }

    static Not not(Criteria child) {
        return new Not(child);
    }
}
