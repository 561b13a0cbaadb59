package com.prism.perspective.api.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Value sets resolved for nested membership criteria, keyed by
 * {@link NestedCriteria#cacheKey()}.
 */
public final class NestedValues {

    private static final NestedValues NONE = new NestedValues(Map.of());

    private final Map<String, List<Object>> values;

    private NestedValues(Map<String, List<Object>> values) {
        this.values = values;
    }

    public static NestedValues none() {
        return NONE;
    }

    public static NestedValues of(Map<String, List<Object>> values) {
        return values.isEmpty() ? NONE : new NestedValues(Map.copyOf(values));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Optional<List<Object>> lookup(String cacheKey) {
        return Optional.ofNullable(values.get(cacheKey));
    }

    public int size() {
        return values.size();
    }
}
