package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.diagnostics.Diagnostic;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.cuepoint.compiler.AstFixtures.*;

@Tag("unit")
class ActionDefinitionValidationHandlerTest {

    @Test
    void secondDefinitionWithSameNameIsReported() throws TransformException {
        var program = program(List.of(),
                List.of(action("fadeIn", List.of(), call("log")), action("fadeIn", List.of(), call("log"))),
                raf(span("0s", "1s", call("fadeIn"))));

        List<Diagnostic> result = ValidationTestSupport.run(new ActionDefinitionValidationHandler(), program);

        assertThat(result).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.DUPLICATE_ACTION);
            assertThat(d.message()).isEqualTo("Action 'fadeIn' is already defined");
        });
    }
}
