package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.diagnostics.Diagnostic;
import org.cuepoint.compiler.frontend.ast.ImportCategory;
import org.cuepoint.compiler.frontend.ast.Program;
import org.cuepoint.compiler.registry.Registries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.cuepoint.compiler.AstFixtures.*;

/**
 * Unit tests for {@link LabelReferenceValidationHandler}.
 */
@Tag("unit")
class LabelReferenceValidationHandlerTest {

    private final LabelReferenceValidationHandler handler = new LabelReferenceValidationHandler();

    private static Program withLabelsImport(String labelId) {
        return program(List.of(defaultImport(ImportCategory.LABELS, "./labels.json")), List.of(),
                raf(span("0s", "1s", call("addController", str("LabelController"), str(labelId)))));
    }

    @Test
    void knownLabelPasses() throws TransformException {
        Registries registries = ValidationTestSupport.withLabels(List.of("welcome", "goodbye"), List.of("en-US"));

        assertThat(ValidationTestSupport.run(handler, withLabelsImport("welcome"), registries)).isEmpty();
    }

    @Test
    void unknownLabelGetsSuggestion() throws TransformException {
        Registries registries = ValidationTestSupport.withLabels(List.of("welcome", "goodbye"), List.of("en-US"));

        List<Diagnostic> result = ValidationTestSupport.run(handler, withLabelsImport("welcom"), registries);

        assertThat(result).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.UNKNOWN_LABEL);
            assertThat(d.message()).isEqualTo("Unknown label ID: 'welcom'");
            assertThat(d.hint()).isEqualTo("Did you mean: 'welcome'?");
        });
    }

    @Test
    void labelWithoutImportIsReported() throws TransformException {
        var program = program(raf(span("0s", "1s", call("addController", str("LabelController"), str("welcome")))));

        List<Diagnostic> result = ValidationTestSupport.run(handler, program);

        assertThat(result).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.NO_LABELS_IMPORT);
            assertThat(d.message()).isEqualTo("Label ID parameter used but no labels imported");
        });
    }

    @Test
    void importedButUnloadedLabelsAreNotChecked() throws TransformException {
        assertThat(ValidationTestSupport.run(handler, withLabelsImport("anything"))).isEmpty();
    }

    @Test
    void labelInStaggerBodyIsReportedOnce() throws TransformException {
        var program = program(raf(stagger("1s", List.of(str("#a"), str("#b")), "1s",
                call("addController", str("LabelController"), str("welcome")))));

        List<Diagnostic> result = ValidationTestSupport.run(handler, program);

        assertThat(result).extracting(Diagnostic::code).containsExactly(DiagnosticCode.NO_LABELS_IMPORT);
    }
}
