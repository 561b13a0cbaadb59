package com.prism.perspective.core.processing;

import com.prism.perspective.runtime.evaluation.LazyFrame;

/**
 * Deferred computation of all factor columns of one request.
 *
 * @param positions     position plan
 * @param lookthroughs  lookthrough plan, {@code null} when the request holds none
 * @param factorColumns columns the plans add
 */
public record PerspectivePlan(LazyFrame positions, LazyFrame lookthroughs, FactorColumns factorColumns) {

    public boolean hasLookthroughs() {
        return lookthroughs != null;
    }
}
