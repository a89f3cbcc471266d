package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.diagnostics.Diagnostic;
import org.cuepoint.compiler.frontend.ast.AssetType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.cuepoint.compiler.AstFixtures.*;

/**
 * Unit tests for {@link AssetTypeValidationHandler}.
 */
@Tag("unit")
class AssetTypeValidationHandlerTest {

    private final AssetTypeValidationHandler handler = new AssetTypeValidationHandler();

    @Test
    void infersKnownExtensions() throws TransformException {
        var program = program(List.of(
                namedImport("intro", "./intro.html", null),
                namedImport("theme", "./theme.css", null),
                namedImport("clip", "./clip.mp4", null)), List.of(), raf(span("0s", "1s", call("log"))));

        assertThat(ValidationTestSupport.run(handler, program)).isEmpty();
    }

    @Test
    void ambiguousExtensionNeedsExplicitType() throws TransformException {
        var program = program(List.of(namedImport("music", "./music.ogg", null)), List.of(),
                raf(span("0s", "1s", call("log"))));

        List<Diagnostic> result = ValidationTestSupport.run(handler, program);

        assertThat(result).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.AMBIGUOUS_EXTENSION);
            assertThat(d.message()).isEqualTo("Ambiguous file extension '.ogg', please specify type explicitly");
        });
    }

    @Test
    void explicitTypeSilencesInference() throws TransformException {
        var program = program(List.of(
                namedImport("music", "./music.ogg", AssetType.MEDIA),
                namedImport("data", "./data.xyz", AssetType.HTML)), List.of(), raf(span("0s", "1s", call("log"))));

        assertThat(ValidationTestSupport.run(handler, program)).isEmpty();
    }

    @Test
    void unknownExtensionIsReported() throws TransformException {
        var program = program(List.of(namedImport("data", "./data.xyz", null)), List.of(),
                raf(span("0s", "1s", call("log"))));

        assertThat(ValidationTestSupport.run(handler, program))
                .singleElement()
                .satisfies(d -> assertThat(d.message())
                        .isEqualTo("Unknown file extension '.xyz', please specify type: html, css, or media"));
    }
}
