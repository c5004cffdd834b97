package io.typeflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Value path helpers. Paths read like {@code items[2].name}; the root value itself is {@code $}.
 * Keys that are empty or contain path syntax are quoted, with {@code "} and {@code \} escaped by
 * a backslash: key {@code a.b} under {@code attrs} is {@code attrs["a.b"]}.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class ValuePaths {

    public static final String ROOT = "$";

    private ValuePaths() {}

    public static String field(String parent, String name) {
        if (needsQuoting(name)) {
            return (ROOT.equals(parent) ? "" : parent) + "[" + quote(name) + "]";
        }
        return ROOT.equals(parent) ? name : parent + "." + name;
    }

    public static String index(String parent, int index) {
        return (ROOT.equals(parent) ? "" : parent) + "[" + index + "]";
    }

    /**
     * Flattens a value into its resolved leaves: every scalar reachable from the root, keyed by
     * path, in document order. JSON {@code null} marks an absent value and is not a leaf.
     */
    public static Map<String, JsonNode> leaves(JsonNode value) {
        Map<String, JsonNode> leaves = new LinkedHashMap<>();
        collect(value, ROOT, leaves);
        return leaves;
    }

    /** Looks up the node at {@code path}, if present and not {@code null}. */
    public static Optional<JsonNode> get(JsonNode value, String path) {
        if (value == null) {
            return Optional.empty();
        }
        if (ROOT.equals(path)) {
            return value.isNull() || value.isMissingNode() ? Optional.empty() : Optional.of(value);
        }
        JsonNode current = value;
        int i = 0;
        while (i < path.length() && current != null) {
            char c = path.charAt(i);
            if (c == '[' && i + 1 < path.length() && path.charAt(i + 1) == '"') {
                StringBuilder key = new StringBuilder();
                int j = i + 2;
                while (j < path.length() && path.charAt(j) != '"') {
                    if (path.charAt(j) == '\\' && j + 1 < path.length()) {
                        j++;
                    }
                    key.append(path.charAt(j++));
                }
                if (j + 1 >= path.length() || path.charAt(j + 1) != ']') {
                    return Optional.empty();
                }
                current = current.isObject() ? current.get(key.toString()) : null;
                i = j + 2;
            } else if (c == '[') {
                int close = path.indexOf(']', i);
                if (close < 0) {
                    return Optional.empty();
                }
                int index;
                try {
                    index = Integer.parseInt(path.substring(i + 1, close));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
                current = current.isArray() ? current.get(index) : null;
                i = close + 1;
            } else {
                if (c == '.') {
                    i++;
                }
                int end = i;
                while (end < path.length() && path.charAt(end) != '.' && path.charAt(end) != '[') {
                    end++;
                }
                current = current.isObject() ? current.get(path.substring(i, end)) : null;
                i = end;
            }
        }
        if (current == null || current.isNull() || current.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    private static boolean needsQuoting(String name) {
        if (name.isEmpty() || ROOT.equals(name)) {
            return true;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '.' || c == '[' || c == ']' || c == '"' || c == '\\') {
                return true;
            }
        }
        return false;
    }

    private static String quote(String name) {
        return "\"" + name.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static void collect(JsonNode node, String path, Map<String, JsonNode> leaves) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                collect(entry.getValue(), field(path, entry.getKey()), leaves);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                collect(node.get(i), index(path, i), leaves);
            }
        } else {
            leaves.put(path, node);
        }
    }
}
