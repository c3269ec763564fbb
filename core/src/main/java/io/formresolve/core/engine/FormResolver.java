package io.formresolve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.formresolve.core.model.CanonicalGroup;
import io.formresolve.core.model.FieldSpec;
import io.formresolve.core.model.FormSchema;
import io.formresolve.core.model.ResolvedForm;
import io.formresolve.core.model.RuntimeValues;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes visibility, readiness and canonical values for one request in a single pass over the
 * schema's dependency order.
 *
 * <p>
 * The walk relies on {@link FormSchema#fieldOrder()}: when a field is reached, every member of
 * each group it depends on has already been classified, so the effective value of the dependency
 * is final. Only active members feed canonical values.
 *
 * <p>
 * Thread-safe: all per-request state lives on the stack.
 */
public final class FormResolver {

    private final ConditionEvaluator conditionEvaluator;
    private final DependencyResolver dependencyResolver;
    private final CanonicalValueResolver canonicalValueResolver;

    public FormResolver() {
        this(new ConditionEvaluator(), new DependencyResolver(), new CanonicalValueResolver());
    }

    public FormResolver(
            ConditionEvaluator conditionEvaluator,
            DependencyResolver dependencyResolver,
            CanonicalValueResolver canonicalValueResolver) {
        this.conditionEvaluator = conditionEvaluator;
        this.dependencyResolver = dependencyResolver;
        this.canonicalValueResolver = canonicalValueResolver;
    }

    /**
     * Resolves a schema against raw values.
     *
     * @param schema the loaded schema
     * @param values raw input values of this request
     * @return the resolution snapshot; sets are in schema field order
     */
    public ResolvedForm resolve(FormSchema schema, RuntimeValues values) {
        Set<String> visible = new HashSet<>();
        Set<String> ready = new HashSet<>();
        Set<String> active = new HashSet<>();
        Map<String, Optional<JsonNode>> effective = new HashMap<>();

        for (String fieldId : schema.fieldOrder()) {
            FieldSpec field = schema.requireField(fieldId);
            boolean isVisible = conditionEvaluator.evaluate(field.condition(), values);
            boolean isReady = dependencyResolver.isReady(field, dependency -> {
                CanonicalGroup group = schema.groupOf(dependency);
                return effective
                        .computeIfAbsent(
                                group.canonicalParamId(),
                                id -> canonicalValueResolver.resolve(group, values, active::contains))
                        .isPresent();
            });
            if (isVisible) {
                visible.add(fieldId);
            }
            if (isReady) {
                ready.add(fieldId);
            }
            if (isVisible && isReady) {
                active.add(fieldId);
            }
        }

        Map<String, JsonNode> canonicalValues = new LinkedHashMap<>();
        for (CanonicalGroup group : schema.canonicalGroups().values()) {
            canonicalValueResolver
                    .resolve(group, values, active::contains)
                    .ifPresent(value -> canonicalValues.put(group.canonicalParamId(), value));
        }
        return new ResolvedForm(inFieldOrder(schema, visible), inFieldOrder(schema, ready), canonicalValues);
    }

    private static Set<String> inFieldOrder(FormSchema schema, Set<String> ids) {
        Set<String> ordered = new LinkedHashSet<>();
        for (String fieldId : schema.fields().keySet()) {
            if (ids.contains(fieldId)) {
                ordered.add(fieldId);
            }
        }
        return ordered;
    }
}
