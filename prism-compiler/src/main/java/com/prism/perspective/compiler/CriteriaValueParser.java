package com.prism.perspective.compiler;

import com.prism.perspective.api.exceptions.CriteriaValueException;
import com.prism.perspective.api.exceptions.CriteriaValueException.Reason;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the string encodings criteria values arrive in.
 * <ul>
 *   <li>lists: {@code "(1,2,3)"}, {@code "[1,2,3]"}, {@code "('USD','EUR')"}</li>
 *   <li>ranges: {@code "fncriteria:<low>:<high>"} or a two-element list</li>
 *   <li>scalars: surrounding quotes are removed</li>
 * </ul>
 */
public final class CriteriaValueParser {

    public static final String PERSPECTIVE_ID_TOKEN = "perspective_id";
    static final String RANGE_PREFIX = "fncriteria:";

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private CriteriaValueParser() {
        throw new AssertionError("No instances");
    }

    /**
     * Parses a membership list. Items that look like integers become {@code Long},
     * other items are trimmed and unquoted strings. A non-list, non-string value
     * becomes a one-element list.
     *
     * @throws CriteriaValueException with {@link Reason#MALFORMED_LIST} if the
     *         opening and closing delimiters do not match
     */
    public static List<Object> parseList(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) {
                    out.add(item instanceof String s ? parseListItem(s) : item);
                }
            }
            return out;
        }
        if (!(raw instanceof String text)) {
            return List.of(raw);
        }

        String trimmed = text.trim();
        boolean opens = trimmed.startsWith("(") || trimmed.startsWith("[");
        boolean closes = trimmed.endsWith(")") || trimmed.endsWith("]");
        if (opens != closes) {
            throw new CriteriaValueException(Reason.MALFORMED_LIST, raw, "Unbalanced list delimiters");
        }
        String body = strip(trimmed, "[]()");
        if (body.contains("(") || body.contains(")") || body.contains("[") || body.contains("]")) {
            throw new CriteriaValueException(Reason.MALFORMED_LIST, raw, "Nested lists are not supported");
        }

        List<Object> out = new ArrayList<>();
        for (String part : body.split(",")) {
            String item = part.trim();
            if (!item.isEmpty()) {
                Object parsed = parseListItem(item);
                if (!"".equals(parsed)) {
                    out.add(parsed);
                }
            }
        }
        return out;
    }

    /**
     * Parses range bounds. Numeric bounds become {@code Double}; other bounds stay
     * unquoted strings so that textual ranges such as dates still compare.
     *
     * @throws CriteriaValueException with {@link Reason#MALFORMED_RANGE} for any other shape
     */
    public static List<Object> parseRange(Object raw) {
        if (raw instanceof String text && text.startsWith(RANGE_PREFIX)) {
            String[] parts = text.split(":", -1);
            if (parts.length != 3 || parts[1].isBlank() || parts[2].isBlank()) {
                throw new CriteriaValueException(Reason.MALFORMED_RANGE, raw,
                        "Expected fncriteria:<low>:<high>");
            }
            return List.of(parseBound(parts[1]), parseBound(parts[2]));
        }
        if (raw instanceof List<?> list && list.size() == 2 && list.get(0) != null && list.get(1) != null) {
            return List.of(normalizeBound(list.get(0)), normalizeBound(list.get(1)));
        }
        throw new CriteriaValueException(Reason.MALFORMED_RANGE, raw, "Unsupported range value");
    }

    /**
     * Removes surrounding single or double quotes from strings; other values pass
     * through unchanged.
     */
    public static Object parseScalar(Object raw) {
        return raw instanceof String s ? strip(s, "'\"") : raw;
    }

    /**
     * Replaces the {@code perspective_id} token in string values, including strings
     * inside lists.
     */
    public static Object substitutePerspectiveId(Object value, Integer perspectiveId) {
        if (perspectiveId == null) {
            return value;
        }
        if (value instanceof String s && s.contains(PERSPECTIVE_ID_TOKEN)) {
            return s.replace(PERSPECTIVE_ID_TOKEN, String.valueOf(perspectiveId));
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(substitutePerspectiveId(item, perspectiveId));
            }
            return out;
        }
        return value;
    }

    private static Object parseListItem(String item) {
        String unquoted = strip(item.trim(), "'\"").trim();
        if (INTEGER.matcher(unquoted).matches()) {
            try {
                return Long.parseLong(unquoted);
            } catch (NumberFormatException e) {
                return unquoted;
            }
        }
        return unquoted;
    }

    private static Object parseBound(String raw) {
        String unquoted = strip(raw.trim(), "'\"");
        try {
            return Double.parseDouble(unquoted);
        } catch (NumberFormatException e) {
            return unquoted;
        }
    }

    private static Object normalizeBound(Object bound) {
        if (bound instanceof Number n) {
            return n.doubleValue();
        }
        return bound instanceof String s ? parseBound(s) : bound;
    }

    /** Strips any of {@code chars} from both ends. */
    static String strip(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
