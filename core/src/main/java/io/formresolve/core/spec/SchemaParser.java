package io.formresolve.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.formresolve.core.error.SchemaDefinitionException;
import io.formresolve.core.error.SchemaParseException;
import io.formresolve.core.model.CompositeRule;
import io.formresolve.core.model.Condition;
import io.formresolve.core.model.FieldMode;
import io.formresolve.core.model.FieldSpec;
import io.formresolve.core.model.FormSchema;
import io.formresolve.core.model.OperationRule;
import io.formresolve.core.model.RequirementRule;
import io.formresolve.core.model.UnknownValuePolicy;
import io.formresolve.core.model.ValueKind;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses YAML form schema documents into {@link FormSchema} instances.
 *
 * <p>
 * Loading runs in two phases. The document is first checked against the bundled JSON Schema
 * ({@code schemas/form-schema.json}); every structural problem is reported at once in a single
 * {@link SchemaParseException}. The parsed document is then handed to {@link SchemaValidator},
 * which rejects semantic defects (unknown references, cycles, ambiguous precedence) with a typed
 * load error and computes the dependency order.
 *
 * <p>
 * Thread-safe: the YAML mapper and the compiled document schema are shared and immutable.
 */
public final class SchemaParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String DOCUMENT_SCHEMA_RESOURCE = "/schemas/form-schema.json";
    private static final JsonSchema DOCUMENT_SCHEMA = loadDocumentSchema();

    private final UnknownValuePolicy defaultPolicy;
    private final SchemaValidator validator = new SchemaValidator();

    /** Creates a parser whose default unknown-value policy is {@code strict-throw}. */
    public SchemaParser() {
        this(UnknownValuePolicy.STRICT_THROW);
    }

    /**
     * Creates a parser.
     *
     * @param defaultPolicy policy applied to operation blocks that omit {@code unknown-value-policy}
     */
    public SchemaParser(UnknownValuePolicy defaultPolicy) {
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy must not be null");
    }

    /** The policy applied when a schema omits {@code unknown-value-policy}. */
    public UnknownValuePolicy defaultPolicy() {
        return defaultPolicy;
    }

    /**
     * Parses the schema file at the given path.
     *
     * @throws SchemaParseException                                 if the YAML is unreadable or
     *                                                              structurally invalid
     * @throws SchemaDefinitionException                           if it is semantically invalid
     * @throws io.formresolve.core.error.DependencyCycleException   if dependencies form a cycle
     */
    public FormSchema parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    /**
     * Parses a schema from YAML text.
     *
     * @param yaml   the schema document
     * @param source label used in error messages
     */
    public FormSchema parse(String yaml, String source) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    private FormSchema parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new SchemaParseException("Schema document must be a YAML mapping", null, source);
        }
        validateStructure(root, source);

        String id = root.get("id").asText();
        String version = root.get("version").asText();
        String description = root.hasNonNull("description") ? root.get("description").asText() : null;

        List<FieldSpec> fields = new ArrayList<>();
        for (JsonNode fieldNode : root.get("fields")) {
            fields.add(parseField(fieldNode));
        }

        Map<String, List<String>> explicitGroups = new LinkedHashMap<>();
        JsonNode groupsNode = root.get("canonical-groups");
        if (groupsNode != null && !groupsNode.isNull()) {
            for (Map.Entry<String, JsonNode> entry : groupsNode.properties()) {
                explicitGroups.put(entry.getKey(), textList(entry.getValue()));
            }
        }

        OperationRule operationRule = parseOperation(root.get("operation"), id, source);

        Map<String, RequirementRule> actions = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : root.get("actions").properties()) {
            actions.put(entry.getKey(), parseAction(entry.getKey(), entry.getValue()));
        }

        SchemaDraft draft =
                new SchemaDraft(id, version, description, fields, explicitGroups, operationRule, actions);
        return validator.validate(draft, source);
    }

    private void validateStructure(JsonNode root, String source) {
        Set<ValidationMessage> errors = DOCUMENT_SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new SchemaParseException("Invalid schema document: " + detail, extractIdSafe(root), source);
        }
    }

    private static FieldSpec parseField(JsonNode node) {
        return new FieldSpec(
                node.get("id").asText(),
                node.hasNonNull("canonical") ? node.get("canonical").asText() : null,
                node.hasNonNull("mode") ? FieldMode.fromSchema(node.get("mode").asText()) : null,
                node.hasNonNull("condition") ? parseCondition(node.get("condition")) : null,
                textList(node.get("depends-on")),
                node.path("required").asBoolean(false),
                node.hasNonNull("kind") ? ValueKind.fromSchema(node.get("kind").asText()) : null);
    }

    /**
     * A scalar {@code value} is a one-element list; a {@code null} entry (or a bare {@code null})
     * makes the condition match an absent input.
     */
    private static Condition parseCondition(JsonNode node) {
        List<String> values = new ArrayList<>();
        boolean matchesAbsent = false;
        JsonNode valueNode = node.get("value");
        if (valueNode.isArray()) {
            for (JsonNode element : valueNode) {
                if (element.isNull()) {
                    matchesAbsent = true;
                } else {
                    values.add(element.asText().trim());
                }
            }
        } else if (valueNode.isNull()) {
            matchesAbsent = true;
        } else {
            values.add(valueNode.asText().trim());
        }
        Condition and = node.hasNonNull("and") ? parseCondition(node.get("and")) : null;
        return new Condition(
                node.get("field").asText(), values, matchesAbsent, node.path("negate").asBoolean(false), and);
    }

    private OperationRule parseOperation(JsonNode node, String schemaId, String source) {
        if (node == null || node.isNull()) {
            return null;
        }
        Map<String, String> mapping = new LinkedHashMap<>();
        Map<String, String> rawKeys = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : node.get("mapping").properties()) {
            String key = entry.getKey().trim();
            String previous = rawKeys.putIfAbsent(key, entry.getKey());
            if (previous != null) {
                throw new SchemaDefinitionException(
                        "Schema '" + schemaId + "': Operation mapping keys '" + previous + "' and '"
                                + entry.getKey() + "' collide after trimming",
                        schemaId,
                        source);
            }
            mapping.put(key, entry.getValue().asText());
        }
        UnknownValuePolicy policy = node.hasNonNull("unknown-value-policy")
                ? UnknownValuePolicy.fromSchema(node.get("unknown-value-policy").asText())
                : defaultPolicy;
        return new OperationRule(
                node.get("discriminator").asText(),
                mapping,
                node.hasNonNull("default") ? node.get("default").asText() : null,
                policy);
    }

    private static RequirementRule parseAction(String actionId, JsonNode node) {
        if (node == null || node.isNull()) {
            return new RequirementRule(actionId, null, null, null, null);
        }
        List<CompositeRule> composites = new ArrayList<>();
        for (JsonNode group : node.path("any-of")) {
            composites.add(new CompositeRule.AnyOf(textList(group)));
        }
        for (JsonNode group : node.path("at-most-one-of")) {
            composites.add(new CompositeRule.AtMostOneOf(textList(group)));
        }
        Map<String, JsonNode> defaults = new LinkedHashMap<>();
        JsonNode defaultsNode = node.get("defaults");
        if (defaultsNode != null && defaultsNode.isObject()) {
            for (Map.Entry<String, JsonNode> entry : defaultsNode.properties()) {
                defaults.put(entry.getKey(), entry.getValue().deepCopy());
            }
        }
        return new RequirementRule(
                actionId, textList(node.get("params")), textList(node.get("required")), composites, defaults);
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(element -> values.add(element.asText()));
        }
        return values;
    }

    private static String extractIdSafe(JsonNode root) {
        JsonNode idNode = root.get("id");
        return idNode != null && idNode.isTextual() ? idNode.asText() : null;
    }

    private static JsonSchema loadDocumentSchema() {
        try (InputStream in = SchemaParser.class.getResourceAsStream(DOCUMENT_SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DOCUMENT_SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(JSON_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DOCUMENT_SCHEMA_RESOURCE, e);
        }
    }
}
