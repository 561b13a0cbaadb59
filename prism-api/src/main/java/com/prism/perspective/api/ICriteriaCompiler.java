package com.prism.perspective.api;

import com.prism.perspective.api.model.Criteria;
import com.prism.perspective.api.model.NestedValues;
import com.prism.perspective.runtime.expr.Expr;

/**
 * Contract for turning a criteria tree into a boolean column expression.
 */
public interface ICriteriaCompiler {

    /**
     * Compiles {@code criteria}.
     *
     * @param criteria      tree to compile, {@code null} yields a constant true
     * @param perspectiveId substituted for the {@code perspective_id} token in string
     *                      values, may be null
     * @param nestedValues  value sets of nested membership criteria
     * @return boolean expression
     */
    Expr compile(Criteria criteria, Integer perspectiveId, NestedValues nestedValues);

    default Expr compile(Criteria criteria) {
        return compile(criteria, null, NestedValues.none());
    }
}
