package org.cuepoint.compiler.diagnostics;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.api.Severity;
import org.cuepoint.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error or warning)
 * that occurs during the validation of a document.
 *
 * @param severity The severity, fixed by the code.
 * @param code The code identifying the rule that produced the diagnostic.
 * @param message The diagnostic message.
 * @param hint An actionable hint; never empty.
 * @param location Where the issue occurred, or {@code null} if it concerns the whole document.
 */
public record Diagnostic(
        Severity severity,
        DiagnosticCode code,
        String message,
        String hint,
        SourceInfo location
) {

    /**
     * @return {@code true} if this diagnostic is an error.
     */
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String where = location != null ? location.toString() : "<document>";
        return String.format("[%s] %s: %s (%s) hint: %s", severity, where, message, code, hint);
    }
}
