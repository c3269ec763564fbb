package io.formresolve.core.engine;

import io.formresolve.core.error.DependencyCycleException;
import io.formresolve.core.model.CanonicalGroup;
import io.formresolve.core.model.FieldSpec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Orders fields so that every field comes after the fields whose values it waits on, and decides
 * readiness at request time.
 *
 * <p>
 * A {@code depends-on} entry names a field, but readiness reads the <em>effective</em> value of
 * that field's canonical group. The ordering graph therefore places every member of the
 * dependency's group before the dependent field. Ties are broken by declaration order, so the same
 * schema always yields the same order.
 *
 * <p>
 * Thread-safe, stateless.
 */
public final class DependencyResolver {

    /**
     * Computes the dependency order of a schema's fields.
     *
     * @param fields          field specs in declaration order
     * @param canonicalGroups canonical id to group
     * @return field ids, each after all members of the groups it depends on
     * @throws DependencyCycleException if the dependencies do not form a DAG (schema id and source
     *                                  are left {@code null}; the caller adds them)
     * @throws IllegalArgumentException if a dependency names an undeclared field
     */
    public List<String> orderFields(List<FieldSpec> fields, Map<String, CanonicalGroup> canonicalGroups) {
        Map<String, Integer> position = new HashMap<>();
        Map<String, FieldSpec> byId = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            position.put(field.id(), position.size());
            byId.put(field.id(), field);
        }

        Map<String, Set<String>> predecessors = new LinkedHashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        for (FieldSpec field : fields) {
            Set<String> preds = new LinkedHashSet<>();
            for (String dependency : field.dependsOn()) {
                FieldSpec target = byId.get(dependency);
                if (target == null) {
                    throw new IllegalArgumentException(
                            "Field '" + field.id() + "' depends on undeclared field '" + dependency + "'");
                }
                CanonicalGroup group = canonicalGroups.get(target.canonicalParamId());
                preds.addAll(group != null ? group.fieldIds() : List.of(dependency));
            }
            predecessors.put(field.id(), preds);
            for (String pred : preds) {
                successors.computeIfAbsent(pred, k -> new ArrayList<>()).add(field.id());
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (FieldSpec field : fields) {
            int degree = predecessors.get(field.id()).size();
            inDegree.put(field.id(), degree);
            if (degree == 0) {
                ready.add(position.get(field.id()));
            }
        }

        List<String> order = new ArrayList<>(fields.size());
        while (!ready.isEmpty()) {
            String next = fields.get(ready.poll()).id();
            order.add(next);
            for (String successor : successors.getOrDefault(next, List.of())) {
                int remaining = inDegree.merge(successor, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(position.get(successor));
                }
            }
        }

        if (order.size() < fields.size()) {
            Set<String> unresolved = new LinkedHashSet<>(byId.keySet());
            order.forEach(unresolved::remove);
            List<String> cycle = findCycle(unresolved, predecessors);
            throw new DependencyCycleException(
                    "Dependency cycle: " + String.join(" -> ", cycle), cycle, null, null);
        }
        return Collections.unmodifiableList(order);
    }

    /**
     * Returns {@code true} if every dependency of the field has a non-empty effective value.
     *
     * @param field               the field to check
     * @param hasEffectiveValue   tells whether the canonical group of a dependency field has a
     *                            non-empty effective value
     */
    public boolean isReady(FieldSpec field, Predicate<String> hasEffectiveValue) {
        for (String dependency : field.dependsOn()) {
            if (!hasEffectiveValue.test(dependency)) {
                return false;
            }
        }
        return true;
    }

    // Every unresolved node keeps at least one unresolved predecessor, so walking predecessors from
    // any of them must revisit a node.
    private static List<String> findCycle(Set<String> unresolved, Map<String, Set<String>> predecessors) {
        List<String> path = new ArrayList<>();
        Map<String, Integer> seenAt = new HashMap<>();
        String current = unresolved.iterator().next();
        while (!seenAt.containsKey(current)) {
            seenAt.put(current, path.size());
            path.add(current);
            current = predecessors.get(current).stream()
                    .filter(unresolved::contains)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("unresolved field without unresolved dependency"));
        }
        List<String> cycle = new ArrayList<>(path.subList(seenAt.get(current), path.size()));
        cycle.add(current);
        return cycle;
    }
}
