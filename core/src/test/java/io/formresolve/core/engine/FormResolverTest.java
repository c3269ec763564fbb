package io.formresolve.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.formresolve.core.model.FormSchema;
import io.formresolve.core.model.ResolvedForm;
import io.formresolve.core.model.RuntimeValues;
import io.formresolve.core.spec.SchemaParser;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FormResolver")
class FormResolverTest {

    private static FormSchema mail;
    private static FormSchema sheets;

    private final FormResolver resolver = new FormResolver();

    @BeforeAll
    static void loadSchemas() {
        SchemaParser parser = new SchemaParser();
        mail = parser.parse(Path.of("src/test/resources/schemas/mail.yaml"));
        sheets = parser.parse(Path.of("src/test/resources/schemas/sheets.yaml"));
    }

    @Test
    @DisplayName("advanced entry supplies the value when the picker is blank")
    void manualEntryWinsOverBlankPicker() {
        RuntimeValues values =
                RuntimeValues.of(Map.of("operation", "read", "folder", "", "manualFolder", "Archive"));

        ResolvedForm form = resolver.resolve(mail, values);

        assertThat(form.canonicalValue("folder")).map(JsonNode::asText).hasValue("Archive");
    }

    @Test
    void visibleFieldsFollowTheOperation() {
        ResolvedForm form = resolver.resolve(mail, RuntimeValues.of(Map.of("operation", "delete")));

        assertThat(form.visible()).containsExactly("operation", "credential", "id", "confirm");
    }

    @Test
    void valuesOfHiddenFieldsNeverSurface() {
        RuntimeValues values = RuntimeValues.of(Map.of("operation", "send", "folder", "Inbox", "to", "a@b.c"));

        ResolvedForm form = resolver.resolve(mail, values);

        assertThat(form.isVisible("folder")).isFalse();
        assertThat(form.canonicalValue("folder")).isEmpty();
        assertThat(form.canonicalValue("to")).map(JsonNode::asText).hasValue("a@b.c");
    }

    @Test
    void fieldWaitsOnItsDependency() {
        ResolvedForm form = resolver.resolve(mail, RuntimeValues.of(Map.of("operation", "read")));

        assertThat(form.isVisible("labels")).isTrue();
        assertThat(form.isReady("labels")).isFalse();
        assertThat(form.isActive("labels")).isFalse();

        ResolvedForm withCredential =
                resolver.resolve(mail, RuntimeValues.of(Map.of("operation", "read", "credential", "tok")));
        assertThat(withCredential.isActive("labels")).isTrue();
    }

    @Test
    void inactiveFieldDoesNotFeedItsCanonicalValue() {
        RuntimeValues values = RuntimeValues.of(Map.of("operation", "read", "labels", "a,b"));

        assertThat(resolver.resolve(mail, values).canonicalValue("labels")).isEmpty();
    }

    @Test
    @DisplayName("a dependency is met by any member of its canonical group")
    void dependencyReadsTheEffectiveGroupValue() {
        RuntimeValues values = RuntimeValues.of(Map.of("operation", "read", "manualSpreadsheetId", "sheet-1"));

        ResolvedForm form = resolver.resolve(sheets, values);

        assertThat(form.isReady("spreadsheetId")).isFalse();
        assertThat(form.isActive("manualSpreadsheetId")).isTrue();
        assertThat(form.isReady("range")).isTrue();
        assertThat(form.canonicalValue("spreadsheetId")).map(JsonNode::asText).hasValue("sheet-1");
    }

    @Test
    void activeSetIsInFieldDeclarationOrder() {
        RuntimeValues values =
                RuntimeValues.of(Map.of("operation", "write", "credential", "tok", "range", "A1:B2"));

        ResolvedForm form = resolver.resolve(sheets, values);

        assertThat(form.active())
                .containsExactly(
                        "operation",
                        "credential",
                        "spreadsheetId",
                        "manualSpreadsheetId",
                        "values",
                        "includeHeaders");
    }

    @Test
    void chainedConditionNeedsEveryLink() {
        RuntimeValues noRange = RuntimeValues.of(Map.of("operation", "write"));
        RuntimeValues withRange = RuntimeValues.of(Map.of("operation", "write", "range", "A1"));

        assertThat(resolver.resolve(sheets, noRange).isVisible("includeHeaders")).isFalse();
        assertThat(resolver.resolve(sheets, withRange).isVisible("includeHeaders")).isTrue();
    }

    @Test
    void resolutionIsIdempotent() {
        RuntimeValues values = RuntimeValues.of(
                Map.of("operation", "read", "folder", "Inbox", "manualFolder", "Archive", "credential", "tok"));

        assertThat(resolver.resolve(mail, values)).isEqualTo(resolver.resolve(mail, values));
    }
}
