package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.diagnostics.Diagnostic;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.cuepoint.compiler.AstFixtures.*;

/**
 * Unit tests for {@link TimingValidationHandler}.
 */
@Tag("unit")
class TimingValidationHandlerTest {

    private final TimingValidationHandler handler = new TimingValidationHandler();

    @Test
    void acceptsWellFormedRanges() throws TransformException {
        List<Diagnostic> result = ValidationTestSupport.run(handler, program(raf(span("0s", "5s", call("log")))));

        assertThat(result).isEmpty();
    }

    @Test
    void reportsNegativeStartTime() throws TransformException {
        // Given: at 0s - 1s..5s
        var program = program(raf(span(minus(time("0s"), time("1s")), time("5s"), body(call("log")))));

        // When
        List<Diagnostic> result = ValidationTestSupport.run(handler, program);

        // Then
        assertThat(result).hasSize(1);
        assertThat(result.get(0).code()).isEqualTo(DiagnosticCode.NEGATIVE_START_TIME);
        assertThat(result.get(0).message()).contains("start time").contains("-1s");
        assertThat(result.get(0).hint()).isNotBlank();
    }

    @Test
    void reportsEndBeforeStart() throws TransformException {
        List<Diagnostic> result = ValidationTestSupport.run(handler, program(raf(span("5s", "2s", call("log")))));

        assertThat(result).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.INVALID_TIME_RANGE);
            assertThat(d.message()).isEqualTo("Timeline event end time (2s) must be greater than start time (5s)");
        });
    }

    @Test
    void reportsNonPositiveSequenceStep() throws TransformException {
        List<Diagnostic> result = ValidationTestSupport.run(handler,
                program(raf(sequence(step("1s", call("log")), step("0s", call("log"))))));

        assertThat(result).extracting(Diagnostic::code).containsExactly(DiagnosticCode.NON_POSITIVE_SEQUENCE_DURATION);
        assertThat(result.get(0).message()).contains("got 0s");
    }

    @Test
    void reportsZeroStaggerDelayOncePerBlock() throws TransformException {
        // Given: stagger 0s over three items
        var program = program(raf(stagger("0s", List.of(str("a"), str("b"), str("c")), "1s", call("log"))));

        // When
        List<Diagnostic> result = ValidationTestSupport.run(handler, program);

        // Then
        assertThat(result).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.NON_POSITIVE_STAGGER_DELAY);
            assertThat(d.message()).contains("delay");
        });
    }

    @Test
    void reportsZeroStaggerDuration() throws TransformException {
        var program = program(raf(stagger("100ms", List.of(str("a"), str("b")), "0s", call("log"))));

        List<Diagnostic> result = ValidationTestSupport.run(handler, program);

        assertThat(result).extracting(Diagnostic::code).containsExactly(DiagnosticCode.NON_POSITIVE_STAGGER_DURATION);
    }

    @Test
    void checksStaggerBlockWithoutItems() throws TransformException {
        // Given: a stagger block with invalid timing and no items
        var program = program(raf(stagger("0s", List.of(), "0s", call("log"))));

        // When
        List<Diagnostic> result = ValidationTestSupport.run(handler, program);

        // Then: both parameters are reported although no action was produced
        assertThat(result).extracting(Diagnostic::code).containsExactly(
                DiagnosticCode.NON_POSITIVE_STAGGER_DELAY,
                DiagnosticCode.NON_POSITIVE_STAGGER_DURATION);
        assertThat(result).allSatisfy(d -> assertThat(d.message()).contains("got 0s"));
    }

    @Test
    void formatsSecondsWithoutTrailingZeros() {
        assertThat(TimingValidationHandler.seconds(2.0)).isEqualTo("2s");
        assertThat(TimingValidationHandler.seconds(0.25)).isEqualTo("0.25s");
        assertThat(TimingValidationHandler.seconds(-1)).isEqualTo("-1s");
        assertThat(TimingValidationHandler.seconds(0)).isEqualTo("0s");
    }
}
