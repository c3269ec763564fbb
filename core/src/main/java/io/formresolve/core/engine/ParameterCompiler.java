package io.formresolve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formresolve.core.model.CanonicalGroup;
import io.formresolve.core.model.CompileResult;
import io.formresolve.core.model.CompositeRule;
import io.formresolve.core.model.FieldSpec;
import io.formresolve.core.model.FormSchema;
import io.formresolve.core.model.RequirementRule;
import io.formresolve.core.model.ResolvedForm;
import io.formresolve.core.model.ValidationError;
import io.formresolve.core.model.Violation;
import io.formresolve.core.model.ViolationCode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Validates resolved canonical values against an action's requirement rule and builds its typed
 * payload.
 *
 * <p>
 * Every check runs on every call; violations are collected into one {@link ValidationError}, in
 * the order: required values, composite rules, coercion failures. A payload is returned only when
 * no violation was found, and it holds exactly the action's declared keys that have a value.
 *
 * <p>
 * Thread-safe, stateless.
 */
public final class ParameterCompiler {

    private final ValueCoercer coercer;

    public ParameterCompiler() {
        this(new ValueCoercer());
    }

    public ParameterCompiler(ValueCoercer coercer) {
        this.coercer = coercer;
    }

    /**
     * Compiles the payload of an action.
     *
     * @param schema   the loaded schema
     * @param actionId the selected action
     * @param form     the request's resolution snapshot
     * @return VALID with the payload, or INVALID with all violations
     * @throws IllegalArgumentException if the schema declares no such action
     */
    public CompileResult compile(FormSchema schema, String actionId, ResolvedForm form) {
        RequirementRule rule = schema.requirementRule(actionId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Schema '" + schema.id() + "' declares no action '" + actionId + "'"));

        Map<String, JsonNode> effective = new LinkedHashMap<>();
        for (String key : rule.payloadKeys()) {
            JsonNode value = form.canonicalValue(key).orElse(null);
            if (value == null) {
                value = rule.defaults().get(key);
            }
            if (value != null) {
                effective.put(key, value);
            }
        }

        Map<String, ValueCoercer.Coercion> coerced = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : effective.entrySet()) {
            coerced.put(entry.getKey(), coercer.coerce(entry.getValue(), schema.kindOf(entry.getKey())));
        }
        // Presence is judged after coercion: an array of separators is as absent as no value.
        Predicate<String> supplied = param -> {
            ValueCoercer.Coercion coercion = coerced.get(param);
            if (coercion == null) {
                coercion = coercer.coerce(form.canonicalValue(param).orElse(null), schema.kindOf(param));
            }
            return !coercion.isEmpty();
        };

        List<Violation> violations = new ArrayList<>();
        Set<String> reported = new HashSet<>();
        for (String param : rule.required()) {
            if (!supplied.test(param) && reported.add(param)) {
                violations.add(missing(schema, actionId, param, form));
            }
        }
        for (FieldSpec field : schema.fields().values()) {
            String param = field.canonicalParamId();
            if (field.required()
                    && form.isActive(field.id())
                    && !supplied.test(param)
                    && reported.add(param)) {
                violations.add(missing(schema, actionId, param, form));
            }
        }

        for (CompositeRule composite : rule.composites()) {
            if (!composite.isSatisfiedBy(supplied)) {
                violations.add(new Violation(
                        ViolationCode.COMPOSITE_UNSATISFIED,
                        composite.params().get(0),
                        "For action '" + actionId + "', " + composite.describe()));
            }
        }

        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, ValueCoercer.Coercion> entry : coerced.entrySet()) {
            String param = entry.getKey();
            ValueCoercer.Coercion coercion = entry.getValue();
            if (coercion.hasValue()) {
                payload.set(param, coercion.value());
            } else if (coercion.isInvalid()) {
                violations.add(new Violation(
                        ViolationCode.INVALID_VALUE,
                        param,
                        "Invalid value for '" + param + "' (" + schema.kindOf(param).schemaName() + "): "
                                + coercion.reason()));
            }
        }

        if (!violations.isEmpty()) {
            return CompileResult.invalid(schema.id(), new ValidationError(actionId, violations));
        }
        return CompileResult.valid(schema.id(), actionId, payload);
    }

    private static Violation missing(FormSchema schema, String actionId, String param, ResolvedForm form) {
        CanonicalGroup group = schema.canonicalGroups().get(param);
        if (group != null) {
            for (String memberId : group.fieldIds()) {
                if (form.isVisible(memberId) && !form.isReady(memberId)) {
                    List<String> waitingOn = new ArrayList<>();
                    for (String dependency : schema.requireField(memberId).dependsOn()) {
                        String dependencyParam = schema.requireField(dependency).canonicalParamId();
                        if (form.canonicalValue(dependencyParam).isEmpty()) {
                            waitingOn.add(dependency);
                        }
                    }
                    return new Violation(
                            ViolationCode.DEPENDENCY_NOT_READY,
                            param,
                            "Parameter '" + param + "' for action '" + actionId + "' is waiting on " + waitingOn);
                }
            }
        }
        return new Violation(
                ViolationCode.MISSING_REQUIRED,
                param,
                "Missing required parameter '" + param + "' for action '" + actionId + "'");
    }
}
