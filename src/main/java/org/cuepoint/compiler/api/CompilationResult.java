package org.cuepoint.compiler.api;

import org.cuepoint.compiler.diagnostics.Diagnostic;
import org.cuepoint.compiler.ir.IrDocument;

import java.util.List;

/**
 * The outcome of one compilation.
 *
 * @param lowered     The document as produced by lowering.
 * @param optimized   The document after the optimization passes.
 * @param diagnostics Every problem found, errors and warnings, in report order.
 * @param json        The emitted configuration.
 */
public record CompilationResult(
        IrDocument lowered,
        IrDocument optimized,
        List<Diagnostic> diagnostics,
        String json
) {
    public CompilationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if at least one diagnostic is an error.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
