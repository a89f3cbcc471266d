package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.ast.NamedImport;
import org.cuepoint.compiler.frontend.semantics.AssetTypeInference;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;

/**
 * Requires an explicit {@code as <type>} on named imports whose extension does not determine the asset type.
 */
public class AssetTypeValidationHandler implements IValidationHandler {

    @Override
    public void validate(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        for (NamedImport imp : ctx.imports().namedImports()) {
            if (imp.assetType() != null || imp.path() == null) continue;

            String extension = AssetTypeInference.extensionOf(imp.path());
            if (AssetTypeInference.isAmbiguous(imp.path())) {
                diagnostics.report(DiagnosticCode.AMBIGUOUS_EXTENSION,
                        "Ambiguous file extension '." + extension + "', please specify type explicitly",
                        "Add 'as media' if '" + imp.path() + "' is an audio or video file",
                        imp.source());
            } else if (AssetTypeInference.infer(imp.path()).isEmpty()) {
                String shown = extension.isEmpty() ? "(none)" : "." + extension;
                diagnostics.report(DiagnosticCode.UNKNOWN_EXTENSION,
                        "Unknown file extension '" + shown + "', please specify type: html, css, or media",
                        imp.source());
            }
        }
    }
}
