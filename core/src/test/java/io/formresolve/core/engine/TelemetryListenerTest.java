package io.formresolve.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formresolve.core.error.DependencyCycleException;
import io.formresolve.core.model.CompileResult;
import io.formresolve.core.model.RuntimeValues;
import io.formresolve.core.spec.SchemaParser;
import io.formresolve.core.spi.TelemetryListener;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** A registered listener receives load and compile events; a failing listener changes nothing. */
@DisplayName("TelemetryListenerTest")
class TelemetryListenerTest {

    private static final Path MAIL = Path.of("src/test/resources/schemas/mail.yaml");

    private CapturingTelemetryListener listener;
    private FormEngine engine;

    @BeforeEach
    void setUp() {
        listener = new CapturingTelemetryListener();
        engine = new FormEngine(new SchemaParser(), listener);
    }

    @Test
    @DisplayName("Schema load → loaded event")
    void schemaLoadEmitsEvent() {
        engine.loadSchema(MAIL);

        assertThat(listener.loaded).singleElement().satisfies(event -> {
            assertThat(event.schemaId()).isEqualTo("mail");
            assertThat(event.version()).isEqualTo("1.0.0");
            assertThat(event.source()).endsWith("mail.yaml");
        });
    }

    @Test
    @DisplayName("Rejected schema → rejected event")
    void rejectedSchemaEmitsEvent() {
        Path cycle = Path.of("src/test/resources/schemas/invalid/cycle.yaml");

        assertThatThrownBy(() -> engine.loadSchema(cycle)).isInstanceOf(DependencyCycleException.class);

        assertThat(listener.rejected).singleElement().satisfies(event -> {
            assertThat(event.source()).endsWith("cycle.yaml");
            assertThat(event.errorDetail()).contains("Dependency cycle");
        });
    }

    @Test
    @DisplayName("Valid compile → completed event")
    void validCompileEmitsCompleted() {
        engine.loadSchema(MAIL);

        engine.compile("mail", RuntimeValues.of(Map.of("operation", "read")));

        assertThat(listener.completed).singleElement().satisfies(event -> {
            assertThat(event.schemaId()).isEqualTo("mail");
            assertThat(event.actionId()).isEqualTo("mail_read");
            assertThat(event.payloadKeys()).isEqualTo(1);
        });
        assertThat(listener.rejectedCompilations).isEmpty();
    }

    @Test
    @DisplayName("Invalid compile → rejected compilation event")
    void invalidCompileEmitsRejected() {
        engine.loadSchema(MAIL);

        engine.compile("mail", RuntimeValues.of(Map.of("operation", "delete")));

        assertThat(listener.rejectedCompilations).singleElement().satisfies(event -> {
            assertThat(event.outcome()).isEqualTo("INVALID");
            assertThat(event.violationCount()).isEqualTo(2);
        });
    }

    @Test
    @DisplayName("Throwing listener does not affect results")
    void throwingListenerIsIgnored() {
        FormEngine guarded = new FormEngine(new SchemaParser(), new ThrowingTelemetryListener());
        guarded.loadSchema(MAIL);

        CompileResult result = guarded.compile("mail", RuntimeValues.of(Map.of("operation", "read")));

        assertThat(result.isValid()).isTrue();
    }

    static final class CapturingTelemetryListener implements TelemetryListener {

        final List<SchemaLoadedEvent> loaded = new CopyOnWriteArrayList<>();
        final List<SchemaRejectedEvent> rejected = new CopyOnWriteArrayList<>();
        final List<CompilationCompletedEvent> completed = new CopyOnWriteArrayList<>();
        final List<CompilationRejectedEvent> rejectedCompilations = new CopyOnWriteArrayList<>();

        @Override
        public void onSchemaLoaded(SchemaLoadedEvent event) {
            loaded.add(event);
        }

        @Override
        public void onSchemaRejected(SchemaRejectedEvent event) {
            rejected.add(event);
        }

        @Override
        public void onCompilationCompleted(CompilationCompletedEvent event) {
            completed.add(event);
        }

        @Override
        public void onCompilationRejected(CompilationRejectedEvent event) {
            rejectedCompilations.add(event);
        }
    }

    static final class ThrowingTelemetryListener implements TelemetryListener {

        @Override
        public void onSchemaLoaded(SchemaLoadedEvent event) {
            throw new IllegalStateException("boom");
        }

        @Override
        public void onSchemaRejected(SchemaRejectedEvent event) {
            throw new IllegalStateException("boom");
        }

        @Override
        public void onCompilationCompleted(CompilationCompletedEvent event) {
            throw new IllegalStateException("boom");
        }

        @Override
        public void onCompilationRejected(CompilationRejectedEvent event) {
            throw new IllegalStateException("boom");
        }
    }
}
