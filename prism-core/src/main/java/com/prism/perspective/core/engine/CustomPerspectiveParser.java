package com.prism.perspective.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.perspective.api.exceptions.InvalidRequestException;
import com.prism.perspective.api.model.Perspective;
import com.prism.perspective.api.model.Rule;
import com.prism.perspective.api.model.RuleDefinition;
import com.prism.perspective.infra.management.PerspectiveFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Validates and builds the {@code custom_perspective_rules} of a request.
 * <p>
 * Ids must not be positive, so they can never shadow a stored perspective. Every
 * rule needs {@code criteria} and {@code apply_to}, and scaling rules also need
 * {@code scale_factor}. A perspective with an empty rule list is skipped. Rules
 * are named {@code custom_rule_<id>_<index>}.
 */
public class CustomPerspectiveParser {
    private static final Logger logger = Logger.getLogger(CustomPerspectiveParser.class.getName());

    private final PerspectiveFactory factory;
    private final ObjectMapper mapper;

    public CustomPerspectiveParser(PerspectiveFactory factory, ObjectMapper mapper) {
        this.factory = factory;
        this.mapper = mapper;
    }

    public CustomPerspectives parse(JsonNode definitions) {
        if (definitions == null || definitions.isNull() || definitions.isEmpty()) {
            return CustomPerspectives.none();
        }
        if (!definitions.isObject()) {
            throw new InvalidRequestException("custom_perspective_rules must map perspective ids to definitions");
        }

        List<Integer> ids = new ArrayList<>();
        Iterator<String> names = definitions.fieldNames();
        while (names.hasNext()) {
            int id = RequestParser.perspectiveId(names.next());
            if (id > 0) {
                throw new InvalidRequestException("Custom perspective ids must be zero or negative, got " + id);
            }
            ids.add(id);
        }

        Map<Integer, Perspective> perspectives = new LinkedHashMap<>();
        Map<Integer, Map<String, List<String>>> requiredColumns = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = definitions.fields();
        int index = 0;
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            int id = ids.get(index++);
            JsonNode rules = field.getValue().get("rules");
            if (rules == null || rules.isNull()) {
                throw new InvalidRequestException("Custom perspective " + id + " has no 'rules'");
            }
            if (!rules.isArray()) {
                throw new InvalidRequestException("Custom perspective " + id + ": 'rules' must be a list");
            }
            if (rules.isEmpty()) {
                logger.fine(() -> "Custom perspective " + id + " has no rules, skipping");
                continue;
            }

            Map<String, List<String>> columns = new LinkedHashMap<>();
            List<Rule> built = new ArrayList<>(rules.size());
            for (int i = 0; i < rules.size(); i++) {
                built.add(factory.rule("custom_rule_" + id + "_" + i, definition(id, i, rules.get(i)), columns));
            }
            JsonNode name = field.getValue().get("name");
            perspectives.put(id, new Perspective(id,
                    name == null || name.isNull() ? "custom_perspective_" + id : name.asText(),
                    true, true, built));
            requiredColumns.put(id, columns);
        }
        logger.fine(() -> "Parsed custom perspectives " + perspectives.keySet());
        return new CustomPerspectives(perspectives, requiredColumns);
    }

    private RuleDefinition definition(int id, int index, JsonNode rule) {
        String where = "Custom perspective " + id + " rule " + index;
        if (!rule.isObject()) {
            throw new InvalidRequestException(where + " must be an object");
        }
        if (missing(rule, "criteria")) {
            throw new InvalidRequestException(where + " is missing 'criteria'");
        }
        if (missing(rule, "apply_to")) {
            throw new InvalidRequestException(where + " is missing 'apply_to'");
        }
        if (rule.path("is_scaling_rule").asBoolean(false) && missing(rule, "scale_factor")) {
            throw new InvalidRequestException(where + " is a scaling rule without 'scale_factor'");
        }
        try {
            return mapper.treeToValue(rule, RuleDefinition.class);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException(where + " is malformed: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean missing(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull();
    }
}
