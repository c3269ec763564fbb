package io.formresolve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shared JSON node helpers for condition evaluation, canonical resolution and coercion.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class JsonNodeUtils {

    private JsonNodeUtils() {}

    /** Returns {@code true} for {@code null}, {@code NullNode} and {@code MissingNode}. */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * Determines whether a raw input carries a value.
     *
     * <ul>
     * <li>absent nodes: empty</li>
     * <li>text: empty when blank after trimming</li>
     * <li>arrays: empty when no element carries a value</li>
     * <li>objects: empty when they have no properties</li>
     * <li>numbers and booleans: never empty</li>
     * </ul>
     */
    public static boolean hasValue(JsonNode node) {
        if (isAbsent(node)) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().trim().isEmpty();
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (hasValue(element)) {
                    return true;
                }
            }
            return false;
        }
        if (node.isObject()) {
            return !node.isEmpty();
        }
        return true;
    }

    /**
     * Returns the trimmed text of a scalar node (text, number, boolean), or {@code null} for absent
     * nodes and containers.
     */
    public static String scalarText(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) {
            return null;
        }
        return node.asText().trim();
    }
}
