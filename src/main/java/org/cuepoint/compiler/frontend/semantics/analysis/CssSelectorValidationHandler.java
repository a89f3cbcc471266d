package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;
import org.cuepoint.compiler.frontend.semantics.ValidationContext.OperationSite;
import org.cuepoint.compiler.ir.IrOperation;
import org.cuepoint.compiler.ir.IrValue;
import org.cuepoint.compiler.operations.BoundArgument;
import org.cuepoint.compiler.operations.ParameterType;
import org.cuepoint.compiler.registry.CssRegistry;
import org.cuepoint.compiler.registry.InvalidSelectorException;
import org.cuepoint.compiler.registry.ParsedSelector;
import org.cuepoint.compiler.registry.SelectorParser;

import java.util.List;
import java.util.Set;

/**
 * Checks selector and class-name arguments against the stylesheets the document imports.
 * <p>
 * Every unknown token is reported on its own, once per place it is written: a literal in a stagger
 * body is checked on the first item only. The check is skipped for documents without a loaded
 * stylesheet, since then nothing is known about the available classes.
 */
public class CssSelectorValidationHandler implements IValidationHandler {

    @Override
    public void validate(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        CssRegistry css = ctx.registries().css();
        if (!css.hasStylesFor(ctx.documentUri())) {
            return;
        }
        Set<String> classes = css.classesForDocument(ctx.documentUri());
        Set<String> ids = css.idsForDocument(ctx.documentUri());

        for (OperationSite site : ctx.operationSites()) {
            if (!(site.operation() instanceof IrOperation.RawOperation raw)) continue;
            List<BoundArgument> bound = ctx.catalog().bindCall(raw.systemName(), raw.arguments());
            for (int i = 0; i < bound.size(); i++) {
                BoundArgument arg = bound.get(i);
                if (site.repeatsArgument(i)) continue;
                if (arg.parameter() == null || !(arg.value() instanceof IrValue.Str str)) continue;
                if (arg.parameter().type() == ParameterType.SELECTOR) {
                    checkSelector(str.value(), classes, ids, raw, ctx, diagnostics);
                } else if (arg.parameter().type() == ParameterType.CLASS_NAME) {
                    checkClassNames(str.value(), classes, raw, ctx, diagnostics);
                }
            }
        }
    }

    private void checkSelector(String selector, Set<String> classes, Set<String> ids,
                               IrOperation op, ValidationContext ctx, DiagnosticsEngine diagnostics) {
        ParsedSelector parsed;
        try {
            parsed = SelectorParser.parse(selector);
        } catch (InvalidSelectorException e) {
            diagnostics.report(DiagnosticCode.INVALID_SELECTOR,
                    "Invalid CSS selector '" + selector + "': " + e.getMessage(),
                    op.source());
            return;
        }
        for (String cls : parsed.classes()) {
            if (!classes.contains(cls)) {
                diagnostics.report(DiagnosticCode.UNKNOWN_CSS_CLASS,
                        "Unknown CSS class in selector: '" + cls + "'",
                        ctx.suggestionHint(cls, classes, "Available CSS classes"),
                        op.source());
            }
        }
        for (String id : parsed.ids()) {
            if (!ids.contains(id)) {
                diagnostics.report(DiagnosticCode.UNKNOWN_CSS_ID,
                        "Unknown CSS ID in selector: '" + id + "'",
                        ctx.suggestionHint(id, ids, "Available CSS IDs"),
                        op.source());
            }
        }
    }

    private void checkClassNames(String value, Set<String> classes,
                                 IrOperation op, ValidationContext ctx, DiagnosticsEngine diagnostics) {
        for (String token : value.trim().split("\\s+")) {
            String cls = token.startsWith(".") ? token.substring(1) : token;
            if (cls.isEmpty() || classes.contains(cls)) continue;
            diagnostics.report(DiagnosticCode.UNKNOWN_CSS_CLASS,
                    "Unknown CSS class: '" + cls + "'",
                    ctx.suggestionHint(cls, classes, "Available CSS classes"),
                    op.source());
        }
    }
}
