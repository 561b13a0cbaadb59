package com.prism.perspective.core.engine;

import com.prism.perspective.api.model.Perspective;

import java.util.List;
import java.util.Map;

/**
 * Perspectives defined inside a request.
 *
 * @param perspectives    id to perspective, ids are never positive
 * @param requiredColumns id to the reference columns their criteria declared
 */
public record CustomPerspectives(Map<Integer, Perspective> perspectives,
                                 Map<Integer, Map<String, List<String>>> requiredColumns) {

    public static CustomPerspectives none() {
        return new CustomPerspectives(Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return perspectives.isEmpty();
    }
}
