package org.cuepoint.compiler.diagnostics;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings)
 * produced while validating or loading a document.
 * <p>
 * This decouples error reporting from the actual compiler logic. Reporting never
 * interrupts the caller; every rule keeps running so that all problems are seen at once.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a diagnostic with an explicit hint.
     *
     * @param code     The diagnostic code; it determines the severity.
     * @param message  The message.
     * @param hint     The hint, or {@code null} to use the code's default hint.
     * @param location The location, may be {@code null}.
     */
    public void report(DiagnosticCode code, String message, String hint, SourceInfo location) {
        String effectiveHint = hint == null || hint.isBlank() ? code.defaultHint() : hint;
        diagnostics.add(new Diagnostic(code.severity(), code, message, effectiveHint, location));
    }

    /**
     * Reports a diagnostic using the code's default hint.
     *
     * @param code     The diagnostic code.
     * @param message  The message.
     * @param location The location, may be {@code null}.
     */
    public void report(DiagnosticCode code, String message, SourceInfo location) {
        report(code, message, null, location);
    }

    /**
     * Adds diagnostics that were collected elsewhere, e.g. while loading registries.
     *
     * @param others The diagnostics to add.
     */
    public void addAll(List<Diagnostic> others) {
        diagnostics.addAll(others);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics in reporting order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return The error diagnostics in reporting order.
     */
    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    /**
     * @return The warning diagnostics in reporting order.
     */
    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
