package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;
import org.cuepoint.compiler.ir.IrActionDefinition;

import java.util.HashSet;
import java.util.Set;

/**
 * Reports action definitions that reuse the name of an earlier one.
 */
public class ActionDefinitionValidationHandler implements IValidationHandler {

    @Override
    public void validate(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        Set<String> seen = new HashSet<>();
        for (IrActionDefinition def : ctx.document().actions()) {
            if (!seen.add(def.name())) {
                diagnostics.report(DiagnosticCode.DUPLICATE_ACTION,
                        "Action '" + def.name() + "' is already defined",
                        def.source());
            }
        }
    }
}
