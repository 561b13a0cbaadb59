package com.prism.perspective.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prism.perspective.api.exceptions.ConfigurationException;
import com.prism.perspective.api.model.Criteria;
import com.prism.perspective.api.model.CriteriaOperator;
import com.prism.perspective.api.model.NestedCriteria;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts stored criteria JSON into {@link Criteria} trees.
 * <p>
 * Accepted node shapes:
 * <pre>
 * {"and": [ ... ]}   {"or": [ ... ]}   {"not": { ... }}
 * {"column": "liquidity_type_id", "operator_type": "==", "value": 2}
 * {"column": "instrument_id", "operator_type": "In", "value": {"column": "parent_instrument_id"}}
 * </pre>
 * A membership leaf whose value is an object names the column supplying the value
 * set, optionally with a {@code criteria} filter over the contributing records.
 * {@code operator} is accepted as an alias of {@code operator_type}. Criteria may
 * also arrive as a string holding that JSON. A top-level {@code required_columns}
 * entry is a hint naming reference columns the criteria read; it is returned
 * separately and never becomes part of the tree.
 */
public final class CriteriaParser {

    static final String REQUIRED_COLUMNS = "required_columns";
    static final String NESTED_FILTER = "criteria";

    private final ObjectMapper mapper;
    private final ObjectMapper canonicalMapper;

    public CriteriaParser() {
        this(new ObjectMapper());
    }

    public CriteriaParser(ObjectMapper mapper) {
        this.mapper = mapper;
        this.canonicalMapper = mapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * Criteria plus the reference columns its hint declared.
     *
     * @param criteria        parsed tree, {@code null} when the input is empty
     * @param requiredColumns table to columns, empty when there was no hint
     */
    public record ParsedCriteria(Criteria criteria, Map<String, List<String>> requiredColumns) {
    }

    /**
     * Parses stored criteria, extracting and removing the {@code required_columns} hint.
     *
     * @throws ConfigurationException if the JSON or the tree is malformed
     */
    public ParsedCriteria parse(JsonNode raw) {
        JsonNode node = unwrapText(raw);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new ParsedCriteria(null, Map.of());
        }
        if (!node.isObject()) {
            throw new ConfigurationException("Criteria must be a JSON object: " + node);
        }

        Map<String, List<String>> requiredColumns = Map.of();
        ObjectNode object = (ObjectNode) node;
        if (object.has(REQUIRED_COLUMNS)) {
            requiredColumns = parseRequiredColumns(object.get(REQUIRED_COLUMNS));
            object = object.deepCopy();
            object.remove(REQUIRED_COLUMNS);
        }
        Criteria criteria = object.isEmpty() ? null : parseNode(object);
        return new ParsedCriteria(criteria, requiredColumns);
    }

    /**
     * Parses a tree that carries no hint.
     */
    public Criteria parseTree(JsonNode raw) {
        return parse(raw).criteria();
    }

    public Criteria parseTree(String json) {
        return parseTree(mapper.getNodeFactory().textNode(json));
    }

    private Criteria parseNode(JsonNode node) {
        if (!node.isObject()) {
            throw new ConfigurationException("Criteria node must be an object: " + node);
        }
        if (node.has("and")) {
            return new Criteria.And(parseChildren(node.get("and"), "and"));
        }
        if (node.has("or")) {
            return new Criteria.Or(parseChildren(node.get("or"), "or"));
        }
        if (node.has("not")) {
            return new Criteria.Not(parseNode(node.get("not")));
        }
        return parseLeaf(node);
    }

    private List<Criteria> parseChildren(JsonNode children, String combinator) {
        if (!children.isArray()) {
            throw new ConfigurationException("'" + combinator + "' expects a list, got: " + children);
        }
        List<Criteria> out = new ArrayList<>(children.size());
        for (JsonNode child : children) {
            out.add(parseNode(child));
        }
        return out;
    }

    private Criteria.Leaf parseLeaf(JsonNode node) {
        String column = text(node, "column");
        String operatorSymbol = text(node, "operator_type");
        if (operatorSymbol == null) {
            operatorSymbol = text(node, "operator");
        }
        if (column == null || operatorSymbol == null) {
            throw new ConfigurationException("Criteria leaf needs 'column' and 'operator_type': " + node);
        }
        CriteriaOperator operator = CriteriaOperator.fromSymbol(operatorSymbol);
        JsonNode valueNode = node.get("value");

        Object value;
        if (valueNode != null && valueNode.isObject()) {
            if (!operator.isMembership()) {
                throw new ConfigurationException("Operator " + operatorSymbol
                        + " does not accept a nested criteria value: " + node);
            }
            value = parseNested(valueNode);
        } else {
            value = toJava(valueNode);
        }
        return new Criteria.Leaf(column, operator, value, text(node, "table_name"));
    }

    private NestedCriteria parseNested(JsonNode node) {
        String column = text(node, "column");
        if (column == null || column.isBlank()) {
            throw new ConfigurationException("Nested criteria value needs a 'column': " + node);
        }
        JsonNode filter = unwrapText(node.get(NESTED_FILTER));
        Criteria filterTree = filter == null || filter.isNull() || filter.isEmpty() ? null : parseNode(filter);
        return new NestedCriteria(canonicalKey(node), column, filterTree);
    }

    /**
     * Canonical JSON of a nested value with keys sorted at every level, so that
     * equal definitions map to the same precomputed value set.
     */
    public String canonicalKey(JsonNode value) {
        try {
            Object plain = canonicalMapper.treeToValue(value, Object.class);
            return canonicalMapper.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Cannot serialize nested criteria: " + value, e);
        }
    }

    private Map<String, List<String>> parseRequiredColumns(JsonNode hint) {
        JsonNode node = unwrapText(hint);
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new ConfigurationException("required_columns must map tables to column lists: " + node);
        }
        Map<String, List<String>> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> columns = new ArrayList<>();
            if (field.getValue().isArray()) {
                field.getValue().forEach(c -> columns.add(c.asText()));
            } else {
                columns.add(field.getValue().asText());
            }
            out.put(field.getKey(), columns);
        }
        return out;
    }

    private JsonNode unwrapText(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return node;
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed criteria JSON: " + text, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Plain Java value of a JSON scalar or array: {@code Long} for integral numbers,
     * {@code Double} for others, lists for arrays.
     */
    static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isArray()) {
            List<Object> out = new ArrayList<>(node.size());
            node.forEach(item -> out.add(toJava(item)));
            return out;
        }
        if (node.isObject()) {
            throw new ConfigurationException("Unexpected object value: " + node);
        }
        return node.asText();
    }
}
