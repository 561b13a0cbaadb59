/*
 * Copyright (c) 2025 Prism Perspective Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.prism.perspective.runtime.model;

import com.prism.perspective.api.exceptions.ConfigurationException;
import com.prism.perspective.api.model.Modifier;
import com.prism.perspective.api.model.ModifierType;
import com.prism.perspective.api.model.Perspective;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of everything needed to plan a request: active perspectives,
 * the supported modifiers and the reference columns each of them needs.
 * <p>
 * A snapshot is shared read-only by concurrent requests. Custom perspectives are
 * never added to a shared snapshot; {@link #withCustomPerspectives} returns a
 * request-scoped copy instead.
 */
public final class PerspectiveConfiguration {

    private final Map<Integer, Perspective> perspectives;
    private final Map<String, Modifier> modifiers;
    private final List<String> defaultModifiers;
    private final Map<Integer, Map<String, List<String>>> requiredColumnsByPerspective;

    public PerspectiveConfiguration(Map<Integer, Perspective> perspectives,
                                    Map<String, Modifier> modifiers,
                                    List<String> defaultModifiers,
                                    Map<Integer, Map<String, List<String>>> requiredColumnsByPerspective) {
        this.perspectives = Collections.unmodifiableMap(new LinkedHashMap<>(perspectives));
        this.modifiers = Collections.unmodifiableMap(new LinkedHashMap<>(modifiers));
        this.defaultModifiers = List.copyOf(defaultModifiers);
        this.requiredColumnsByPerspective = Collections.unmodifiableMap(new LinkedHashMap<>(requiredColumnsByPerspective));
    }

    public Map<Integer, Perspective> perspectives() {
        return perspectives;
    }

    public Map<String, Modifier> modifiers() {
        return modifiers;
    }

    public List<String> defaultModifiers() {
        return defaultModifiers;
    }

    public Optional<Perspective> perspective(int id) {
        return Optional.ofNullable(perspectives.get(id));
    }

    public Perspective requirePerspective(int id) {
        Perspective perspective = perspectives.get(id);
        if (perspective == null) {
            throw new ConfigurationException("Unknown or inactive perspective: " + id);
        }
        return perspective;
    }

    public Optional<Modifier> modifier(String name) {
        return Optional.ofNullable(modifiers.get(name));
    }

    public Modifier requireModifier(String name) {
        Modifier modifier = modifiers.get(name);
        if (modifier == null) {
            throw new ConfigurationException("Unknown modifier: " + name);
        }
        return modifier;
    }

    /**
     * Modifier name to the names it overrides, for modifiers that override anything.
     */
    public Map<String, List<String>> modifierOverrides() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        modifiers.forEach((name, modifier) -> {
            if (!modifier.overrideModifiers().isEmpty()) {
                out.put(name, modifier.overrideModifiers());
            }
        });
        return out;
    }

    /**
     * Requested modifiers plus the defaults, minus every modifier named in the
     * override list of another member of that union. Requested order comes first,
     * then defaults.
     */
    public List<String> activeModifiers(Collection<String> requested) {
        Set<String> union = new LinkedHashSet<>(requested);
        union.addAll(defaultModifiers);

        Set<String> overridden = new LinkedHashSet<>();
        for (String name : union) {
            Modifier modifier = modifiers.get(name);
            if (modifier != null) {
                for (String target : modifier.overrideModifiers()) {
                    if (!target.equals(name)) {
                        overridden.add(target);
                    }
                }
            }
        }
        List<String> active = new ArrayList<>();
        for (String name : union) {
            if (!overridden.contains(name)) {
                active.add(name);
            }
        }
        return active;
    }

    public boolean hasScalingModifier(Collection<String> activeModifiers, String name) {
        if (!activeModifiers.contains(name)) {
            return false;
        }
        Modifier modifier = modifiers.get(name);
        return modifier != null && modifier.type() == ModifierType.SCALING;
    }

    /**
     * Ordered, de-duplicated union of the reference columns the named modifiers need.
     */
    public Map<String, List<String>> requiredColumnsForModifiers(Collection<String> modifierNames) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String name : modifierNames) {
            Modifier modifier = modifiers.get(name);
            if (modifier != null) {
                mergeRequiredColumns(out, modifier.requiredColumns());
            }
        }
        return out;
    }

    public Map<String, List<String>> requiredColumnsForPerspective(int perspectiveId) {
        return requiredColumnsByPerspective.getOrDefault(perspectiveId, Map.of());
    }

    /**
     * Copy of this configuration with request-supplied perspectives added. Existing
     * perspectives with the same ids are replaced in the copy only.
     */
    public PerspectiveConfiguration withCustomPerspectives(Map<Integer, Perspective> custom,
                                                           Map<Integer, Map<String, List<String>>> customRequiredColumns) {
        if (custom.isEmpty()) {
            return this;
        }
        Map<Integer, Perspective> mergedPerspectives = new LinkedHashMap<>(perspectives);
        mergedPerspectives.putAll(custom);
        Map<Integer, Map<String, List<String>>> mergedColumns = new LinkedHashMap<>(requiredColumnsByPerspective);
        mergedColumns.putAll(customRequiredColumns);
        return new PerspectiveConfiguration(mergedPerspectives, modifiers, defaultModifiers, mergedColumns);
    }

    /**
     * Adds {@code columns} to {@code target}, keeping first-seen order and skipping
     * duplicates.
     */
    public static void mergeRequiredColumns(Map<String, List<String>> target, Map<String, List<String>> columns) {
        columns.forEach((table, names) -> {
            List<String> existing = target.computeIfAbsent(table, t -> new ArrayList<>());
            for (String name : names) {
                if (!existing.contains(name)) {
                    existing.add(name);
                }
            }
        });
    }

    @Override
    public String toString() {
        return "PerspectiveConfiguration{perspectives=" + perspectives.size()
                + ", modifiers=" + modifiers.size()
                + ", defaults=" + defaultModifiers + "}";
    }
}
