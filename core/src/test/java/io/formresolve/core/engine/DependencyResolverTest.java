package io.formresolve.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formresolve.core.error.DependencyCycleException;
import io.formresolve.core.model.CanonicalGroup;
import io.formresolve.core.model.FieldMode;
import io.formresolve.core.model.FieldSpec;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DependencyResolver")
class DependencyResolverTest {

    private final DependencyResolver resolver = new DependencyResolver();

    private static FieldSpec field(String id, String... dependsOn) {
        return new FieldSpec(id, null, null, null, List.of(dependsOn), false, null);
    }

    private static Map<String, CanonicalGroup> singletonGroups(List<FieldSpec> fields) {
        return fields.stream()
                .collect(java.util.stream.Collectors.toMap(
                        FieldSpec::id, f -> new CanonicalGroup(f.id(), List.of(f.id()))));
    }

    @Test
    void independentFieldsKeepDeclarationOrder() {
        List<FieldSpec> fields = List.of(field("c"), field("a"), field("b"));
        assertThat(resolver.orderFields(fields, singletonGroups(fields))).containsExactly("c", "a", "b");
    }

    @Test
    void dependencyComesBeforeDependent() {
        List<FieldSpec> fields = List.of(field("range", "sheet"), field("sheet", "credential"), field("credential"));
        assertThat(resolver.orderFields(fields, singletonGroups(fields)))
                .containsExactly("credential", "sheet", "range");
    }

    @Test
    void tiesAreBrokenByDeclarationOrder() {
        List<FieldSpec> fields = List.of(field("x", "base"), field("y"), field("base"), field("z", "base"));
        assertThat(resolver.orderFields(fields, singletonGroups(fields)))
                .containsExactly("y", "base", "x", "z");
    }

    @Test
    void everyGroupMemberOfADependencyComesFirst() {
        FieldSpec range = field("range", "sheet");
        FieldSpec sheet = field("sheet");
        FieldSpec manualSheet =
                new FieldSpec("manualSheet", "sheet", FieldMode.ADVANCED, null, List.of(), false, null);
        List<FieldSpec> fields = List.of(range, sheet, manualSheet);
        Map<String, CanonicalGroup> groups = Map.of(
                "range", new CanonicalGroup("range", List.of("range")),
                "sheet", new CanonicalGroup("sheet", List.of("sheet", "manualSheet")));

        assertThat(resolver.orderFields(fields, groups)).containsExactly("sheet", "manualSheet", "range");
    }

    @Test
    void cycleIsRejectedWithItsPath() {
        List<FieldSpec> fields = List.of(field("a", "c"), field("b", "a"), field("c", "b"));

        assertThatThrownBy(() -> resolver.orderFields(fields, singletonGroups(fields)))
                .isInstanceOf(DependencyCycleException.class)
                .hasMessageContaining("Dependency cycle")
                .satisfies(e -> {
                    List<String> cycle = ((DependencyCycleException) e).cycle();
                    assertThat(cycle).hasSize(4);
                    assertThat(cycle.get(0)).isEqualTo(cycle.get(3));
                    assertThat(Set.copyOf(cycle)).containsExactlyInAnyOrder("a", "b", "c");
                });
    }

    @Test
    void selfDependencyIsACycle() {
        List<FieldSpec> fields = List.of(field("a", "a"));
        assertThatThrownBy(() -> resolver.orderFields(fields, singletonGroups(fields)))
                .isInstanceOf(DependencyCycleException.class)
                .satisfies(e -> assertThat(((DependencyCycleException) e).cycle()).containsExactly("a", "a"));
    }

    @Test
    void dependingOnASiblingOfTheOwnGroupIsACycle() {
        FieldSpec folder = field("folder", "manualFolder");
        FieldSpec manualFolder =
                new FieldSpec("manualFolder", "folder", FieldMode.ADVANCED, null, List.of(), false, null);
        Map<String, CanonicalGroup> groups =
                Map.of("folder", new CanonicalGroup("folder", List.of("folder", "manualFolder")));

        assertThatThrownBy(() -> resolver.orderFields(List.of(folder, manualFolder), groups))
                .isInstanceOf(DependencyCycleException.class);
    }

    @Test
    void unknownDependencyIsAnArgumentError() {
        List<FieldSpec> fields = List.of(field("a", "ghost"));
        assertThatThrownBy(() -> resolver.orderFields(fields, singletonGroups(fields)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void readyWhenEveryDependencyHasAValue() {
        FieldSpec range = field("range", "sheet", "credential");
        assertThat(resolver.isReady(range, id -> true)).isTrue();
        assertThat(resolver.isReady(range, id -> !id.equals("credential"))).isFalse();
        assertThat(resolver.isReady(field("free"), id -> false)).isTrue();
    }
}
