package io.formresolve.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.formresolve.core.model.ValueKind;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Converts raw input values to the type declared by their canonical parameter.
 *
 * <p>
 * Empty inputs are never coerced: an empty number field is omitted, not turned into zero.
 * Thread-safe, stateless apart from the shared {@link ObjectMapper}.
 */
public final class ValueCoercer {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final int MAX_EXPANDED_DIGITS = 40;

    /** Outcome of one coercion. */
    public record Coercion(Status status, JsonNode value, String reason) {

        /** Coercion outcome kind. */
        public enum Status {
            VALUE,
            EMPTY,
            INVALID
        }

        public static Coercion of(JsonNode value) {
            return new Coercion(Status.VALUE, Objects.requireNonNull(value), null);
        }

        public static Coercion empty() {
            return new Coercion(Status.EMPTY, null, null);
        }

        public static Coercion invalid(String reason) {
            return new Coercion(Status.INVALID, null, reason);
        }

        public boolean hasValue() {
            return status == Status.VALUE;
        }

        public boolean isEmpty() {
            return status == Status.EMPTY;
        }

        public boolean isInvalid() {
            return status == Status.INVALID;
        }
    }

    /**
     * Coerces a raw value.
     *
     * @param raw  the raw input, may be {@code null} or a missing node
     * @param kind the declared value kind
     * @return the coerced value, {@code empty} for empty inputs, or {@code invalid} with a reason
     */
    public Coercion coerce(JsonNode raw, ValueKind kind) {
        if (!JsonNodeUtils.hasValue(raw)) {
            return Coercion.empty();
        }
        return switch (kind) {
            case STRING -> toText(raw);
            case NUMBER -> toNumber(raw);
            case BOOLEAN -> toBoolean(raw);
            case ARRAY -> toArray(raw);
            case JSON -> toJson(raw);
        };
    }

    private static Coercion toText(JsonNode raw) {
        if (raw.isContainerNode()) {
            return Coercion.invalid("expected text, got " + describe(raw));
        }
        // Text is kept verbatim; only the emptiness check trims.
        return Coercion.of(raw.isTextual() ? raw : NODES.textNode(raw.asText()));
    }

    private static Coercion toNumber(JsonNode raw) {
        if (raw.isNumber()) {
            if ((raw.isDouble() || raw.isFloat()) && !Double.isFinite(raw.doubleValue())) {
                return Coercion.invalid(raw.asText() + " is out of range");
            }
            return normalize(raw.decimalValue(), raw.asText());
        }
        if (!raw.isTextual()) {
            return Coercion.invalid("expected a number, got " + describe(raw));
        }
        String text = raw.asText().trim();
        BigDecimal number;
        try {
            number = new BigDecimal(text);
        } catch (NumberFormatException e) {
            return Coercion.invalid("'" + text + "' is not a number");
        }
        return normalize(number, text);
    }

    /**
     * Integral values become long or BigInteger nodes; fractions and integers too large to expand
     * cheaply stay BigDecimal.
     */
    private static Coercion normalize(BigDecimal number, String text) {
        try {
            BigDecimal stripped = number.stripTrailingZeros();
            if (stripped.scale() > 0) {
                return Coercion.of(NODES.numberNode(number));
            }
            if (stripped.precision() - stripped.scale() > MAX_EXPANDED_DIGITS) {
                return Coercion.of(NODES.numberNode(stripped));
            }
            if (stripped.precision() - stripped.scale() <= 18) {
                return Coercion.of(NODES.numberNode(stripped.longValueExact()));
            }
            return Coercion.of(NODES.numberNode(stripped.toBigIntegerExact()));
        } catch (ArithmeticException e) {
            return Coercion.invalid("'" + text + "' is out of range");
        }
    }

    private static Coercion toBoolean(JsonNode raw) {
        if (raw.isBoolean()) {
            return Coercion.of(raw);
        }
        if (raw.isTextual()) {
            String text = raw.asText().trim();
            if ("true".equalsIgnoreCase(text)) {
                return Coercion.of(NODES.booleanNode(true));
            }
            if ("false".equalsIgnoreCase(text)) {
                return Coercion.of(NODES.booleanNode(false));
            }
            return Coercion.invalid("'" + text + "' is not a boolean");
        }
        return Coercion.invalid("expected a boolean, got " + describe(raw));
    }

    private static Coercion toArray(JsonNode raw) {
        ArrayNode items = NODES.arrayNode();
        if (raw.isArray()) {
            for (JsonNode element : raw) {
                if (!JsonNodeUtils.hasValue(element)) {
                    continue;
                }
                items.add(element.isTextual() ? NODES.textNode(element.asText().trim()) : element);
            }
        } else if (raw.isTextual()) {
            for (String part : raw.asText().split(",")) {
                String item = part.trim();
                if (!item.isEmpty()) {
                    items.add(item);
                }
            }
        } else if (raw.isObject()) {
            return Coercion.invalid("expected a list, got an object");
        } else {
            items.add(NODES.textNode(raw.asText()));
        }
        return items.isEmpty() ? Coercion.empty() : Coercion.of(items);
    }

    private static Coercion toJson(JsonNode raw) {
        if (!raw.isTextual()) {
            return Coercion.of(raw);
        }
        String text = raw.asText().trim();
        try {
            return Coercion.of(MAPPER.readTree(text));
        } catch (JsonProcessingException e) {
            return Coercion.invalid("not valid JSON: " + e.getOriginalMessage());
        }
    }

    private static String describe(JsonNode raw) {
        return raw.getNodeType().name().toLowerCase();
    }
}
