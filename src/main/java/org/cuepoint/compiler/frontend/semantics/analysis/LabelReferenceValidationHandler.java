package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;
import org.cuepoint.compiler.frontend.semantics.ValidationContext.OperationSite;
import org.cuepoint.compiler.ir.IrOperation;
import org.cuepoint.compiler.ir.IrValue;
import org.cuepoint.compiler.operations.BoundArgument;
import org.cuepoint.compiler.operations.ParameterType;
import org.cuepoint.compiler.registry.LabelRegistry;

import java.util.List;

/**
 * Checks label ID arguments against the labels file the document imports.
 */
public class LabelReferenceValidationHandler implements IValidationHandler {

    @Override
    public void validate(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        LabelRegistry labels = ctx.registries().labels();
        boolean imported = ctx.imports().hasLabelsImport();
        boolean loaded = labels.hasLabelsFor(ctx.documentUri());
        List<String> known = loaded ? labels.labelIdsForDocument(ctx.documentUri()) : List.of();

        for (OperationSite site : ctx.operationSites()) {
            if (!(site.operation() instanceof IrOperation.RawOperation raw)) continue;
            List<BoundArgument> bound = ctx.catalog().bindCall(raw.systemName(), raw.arguments());
            for (int i = 0; i < bound.size(); i++) {
                BoundArgument arg = bound.get(i);
                if (site.repeatsArgument(i)) continue;
                if (arg.parameter() == null || arg.parameter().type() != ParameterType.LABEL_ID) continue;
                if (!(arg.value() instanceof IrValue.Str str)) continue;

                if (!imported) {
                    diagnostics.report(DiagnosticCode.NO_LABELS_IMPORT,
                            "Label ID parameter used but no labels imported",
                            raw.source());
                } else if (loaded && !known.contains(str.value())) {
                    diagnostics.report(DiagnosticCode.UNKNOWN_LABEL,
                            "Unknown label ID: '" + str.value() + "'",
                            ctx.suggestionHint(str.value(), known, "Available label IDs"),
                            raw.source());
                }
            }
        }
    }
}
