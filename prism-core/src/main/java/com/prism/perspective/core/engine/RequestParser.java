package com.prism.perspective.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.prism.perspective.api.exceptions.InvalidRequestException;
import com.prism.perspective.api.model.PerspectiveRequest;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the request envelope and applies its defaults.
 */
public final class RequestParser {

    static final String PERSPECTIVE_CONFIGURATIONS = "perspective_configurations";
    static final String POSITION_WEIGHT_LABELS = "position_weight_labels";
    static final String LOOKTHROUGH_WEIGHT_LABELS = "lookthrough_weight_labels";
    static final String VERBOSE_OUTPUT = "verbose_output";
    static final String FLATTEN_RESPONSE = "flatten_response";
    static final String EFFECTIVE_DATE = "ed";
    static final String SYSTEM_VERSION_TIMESTAMP = "system_version_timestamp";
    static final String CUSTOM_PERSPECTIVE_RULES = "custom_perspective_rules";

    private final String defaultEffectiveDate;

    public RequestParser(String defaultEffectiveDate) {
        this.defaultEffectiveDate = defaultEffectiveDate;
    }

    /**
     * @throws InvalidRequestException if the envelope is not an object, lacks
     *         {@code perspective_configurations} or holds ill-typed fields
     */
    public PerspectiveRequest parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidRequestException("Request must be a JSON object");
        }
        Map<String, Map<Integer, List<String>>> configurations = parseConfigurations(root.get(PERSPECTIVE_CONFIGURATIONS));

        List<String> positionWeights = labels(root.get(POSITION_WEIGHT_LABELS), POSITION_WEIGHT_LABELS);
        if (positionWeights == null) {
            positionWeights = PerspectiveRequest.DEFAULT_WEIGHT_LABELS;
        }
        List<String> lookthroughWeights = labels(root.get(LOOKTHROUGH_WEIGHT_LABELS), LOOKTHROUGH_WEIGHT_LABELS);
        if (lookthroughWeights == null) {
            lookthroughWeights = positionWeights;
        }

        JsonNode custom = root.get(CUSTOM_PERSPECTIVE_RULES);
        return new PerspectiveRequest(
                configurations,
                positionWeights,
                lookthroughWeights,
                root.path(VERBOSE_OUTPUT).asBoolean(false),
                root.path(FLATTEN_RESPONSE).asBoolean(false),
                text(root, EFFECTIVE_DATE, defaultEffectiveDate),
                text(root, SYSTEM_VERSION_TIMESTAMP, null),
                custom == null || custom.isNull() ? null : custom,
                root);
    }

    private static Map<String, Map<Integer, List<String>>> parseConfigurations(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new InvalidRequestException(PERSPECTIVE_CONFIGURATIONS + " is required");
        }
        if (!node.isObject()) {
            throw new InvalidRequestException(PERSPECTIVE_CONFIGURATIONS + " must be an object");
        }
        Map<String, Map<Integer, List<String>>> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> configs = node.fields();
        while (configs.hasNext()) {
            Map.Entry<String, JsonNode> config = configs.next();
            if (!config.getValue().isObject()) {
                throw new InvalidRequestException("Configuration '" + config.getKey()
                        + "' must map perspective ids to modifier lists");
            }
            Map<Integer, List<String>> perspectives = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> entries = config.getValue().fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                List<String> modifiers = labels(entry.getValue(), config.getKey() + "." + entry.getKey());
                perspectives.put(perspectiveId(entry.getKey()), modifiers == null ? List.of() : modifiers);
            }
            out.put(config.getKey(), perspectives);
        }
        return out;
    }

    static int perspectiveId(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Perspective id is not an integer: " + raw, e);
        }
    }

    private static List<String> labels(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new InvalidRequestException(field + " must be a list of strings");
        }
        List<String> out = new ArrayList<>(node.size());
        node.forEach(item -> out.add(item.asText()));
        return out;
    }

    private static String text(JsonNode root, String field, String fallback) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? fallback : node.asText();
    }
}
