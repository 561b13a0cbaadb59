package com.prism.perspective.infra.management;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.perspective.api.exceptions.ConfigurationException;
import com.prism.perspective.api.model.Modifier;
import com.prism.perspective.api.model.ModifierDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * The fixed table of modifiers the engine supports, read from the classpath
 * resource {@value #RESOURCE}.
 */
public final class SupportedModifiers {
    private static final Logger logger = Logger.getLogger(SupportedModifiers.class.getName());

    public static final String RESOURCE = "prism/supported-modifiers.json";

    private final Map<String, Modifier> modifiers;
    private final List<String> defaultModifiers;

    public SupportedModifiers(Map<String, Modifier> modifiers, List<String> defaultModifiers) {
        this.modifiers = Collections.unmodifiableMap(new LinkedHashMap<>(modifiers));
        this.defaultModifiers = List.copyOf(defaultModifiers);
        for (String name : this.defaultModifiers) {
            if (!modifiers.containsKey(name)) {
                throw new ConfigurationException("Default modifier is not defined: " + name);
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(
            @JsonProperty("default_modifiers") List<String> defaultModifiers,
            @JsonProperty("modifiers") List<ModifierDefinition> modifiers) {
    }

    /**
     * Reads the bundled table.
     *
     * @throws ConfigurationException if the resource is missing or malformed
     */
    public static SupportedModifiers load(ObjectMapper mapper, PerspectiveFactory factory) {
        ClassLoader classLoader = SupportedModifiers.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("Modifier table not found on classpath: " + RESOURCE);
            }
            return fromDocument(mapper.readValue(in, Document.class), factory);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read modifier table " + RESOURCE, e);
        }
    }

    static SupportedModifiers fromDocument(Document document, PerspectiveFactory factory) {
        Map<String, Modifier> out = new LinkedHashMap<>();
        for (ModifierDefinition definition : document.modifiers()) {
            if (out.put(definition.name(), factory.modifier(definition)) != null) {
                throw new ConfigurationException("Duplicate modifier: " + definition.name());
            }
        }
        List<String> defaults = document.defaultModifiers() != null ? document.defaultModifiers() : List.of();
        logger.info(String.format("Loaded %d supported modifiers, defaults %s", out.size(), defaults));
        return new SupportedModifiers(out, defaults);
    }

    public Map<String, Modifier> modifiers() {
        return modifiers;
    }

    public List<String> defaultModifiers() {
        return defaultModifiers;
    }
}
