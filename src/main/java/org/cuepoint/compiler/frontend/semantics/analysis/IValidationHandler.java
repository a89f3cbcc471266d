package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;

/**
 * Interface for the independent rules of the validator.
 * Each handler checks one family of invariants and reports every violation it finds.
 */
@FunctionalInterface
public interface IValidationHandler {
    /**
     * Checks a document.
     * @param ctx The validation context.
     * @param diagnostics The engine for reporting problems.
     */
    void validate(ValidationContext ctx, DiagnosticsEngine diagnostics);
}
