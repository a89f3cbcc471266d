package org.cuepoint.compiler.diagnostics;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.api.Severity;
import org.cuepoint.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DiagnosticsEngine}.
 */
@Tag("unit")
class DiagnosticsEngineTest {

    private final SourceInfo at = new SourceInfo("main.eligian", 3, 5);

    @Test
    void severityComesFromTheCode() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.report(DiagnosticCode.EMPTY_TIMELINE, "Timeline 'main' has no events", at);

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.warnings()).singleElement()
                .extracting(Diagnostic::severity).isEqualTo(Severity.WARNING);
    }

    @Test
    void blankHintFallsBackToTheDefaultHint() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.report(DiagnosticCode.UNKNOWN_OPERATION, "Unknown operation 'fadeIm'", "  ", at);
        engine.report(DiagnosticCode.UNKNOWN_OPERATION, "Unknown operation 'fadeOutt'", "Did you mean 'fadeOut'?", at);

        assertThat(engine.getDiagnostics()).extracting(Diagnostic::hint)
                .containsExactly(DiagnosticCode.UNKNOWN_OPERATION.defaultHint(), "Did you mean 'fadeOut'?");
        assertThat(engine.errors()).hasSize(2);
    }

    @Test
    void keepsReportingOrderAndFormatsSummary() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.report(DiagnosticCode.MISSING_TIMELINE, "Program has no timeline", null);
        engine.report(DiagnosticCode.NEGATIVE_START_TIME, "Start time is negative", at);

        String summary = engine.summary();

        assertThat(summary.split("\n")).hasSize(2);
        assertThat(summary).startsWith("[ERROR] <document>: Program has no timeline (MISSING_TIMELINE)");
        assertThat(summary).contains("NEGATIVE_START_TIME");
        assertThatThrownBy(() -> engine.getDiagnostics().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
