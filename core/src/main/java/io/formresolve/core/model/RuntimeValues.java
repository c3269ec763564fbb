package io.formresolve.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Raw input values of one request, keyed by field id. Immutable snapshot: values are converted to
 * Jackson trees at construction, so the caller's map is never read again nor mutated.
 */
public final class RuntimeValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final RuntimeValues EMPTY = new RuntimeValues(Map.of());

    private final Map<String, JsonNode> values;

    private RuntimeValues(Map<String, JsonNode> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /** Returns an empty value set. */
    public static RuntimeValues empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot from plain Java values (strings, numbers, booleans, lists, maps, or Jackson
     * nodes). {@code null} values are kept as JSON null.
     */
    public static RuntimeValues of(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        Map<String, JsonNode> converted = new LinkedHashMap<>();
        raw.forEach((key, value) -> converted.put(key, toNode(value)));
        return new RuntimeValues(converted);
    }

    /**
     * Builds a snapshot from a JSON object.
     *
     * @throws IllegalArgumentException if {@code node} is not an object
     */
    public static RuntimeValues fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("runtime values must be a JSON object");
        }
        Map<String, JsonNode> converted = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : node.properties()) {
            converted.put(entry.getKey(), entry.getValue().deepCopy());
        }
        return new RuntimeValues(converted);
    }

    private static JsonNode toNode(Object value) {
        if (value instanceof JsonNode node) {
            return node.deepCopy();
        }
        return MAPPER.valueToTree(value);
    }

    /** Returns the raw value of a field, or {@link MissingNode} if none was supplied. */
    public JsonNode get(String fieldId) {
        JsonNode node = values.get(fieldId);
        return node != null ? node : MissingNode.getInstance();
    }

    public boolean has(String fieldId) {
        return values.containsKey(fieldId);
    }

    public Set<String> fieldIds() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        // Values may carry credentials; only the keys are printed.
        return "RuntimeValues" + values.keySet();
    }
}
