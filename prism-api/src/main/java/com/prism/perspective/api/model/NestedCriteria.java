package com.prism.perspective.api.model;

import java.util.Objects;

/**
 * Membership operand naming another column: the value set is the distinct
 * non-null values of {@code column} across the positions, optionally narrowed
 * to the records matching {@code filter}.
 * <pre>
 * {"column": "parent_instrument_id"}
 * {"column": "parent_instrument_id", "criteria": {"column": "asset_class", "operator_type": "==", "value": "FUND"}}
 * </pre>
 *
 * @param cacheKey canonical JSON of the nested definition, used to look up the
 *                 precomputed value set
 * @param column   column whose distinct values form the set
 * @param filter   records contributing values, {@code null} for all records
 */
public record NestedCriteria(String cacheKey, String column, Criteria filter) {

    public NestedCriteria {
        Objects.requireNonNull(cacheKey, "cacheKey");
        Objects.requireNonNull(column, "column");
    }

    public NestedCriteria(String cacheKey, String column) {
        this(cacheKey, column, null);
    }
}
