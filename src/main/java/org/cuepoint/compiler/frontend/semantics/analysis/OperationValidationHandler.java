package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;
import org.cuepoint.compiler.frontend.semantics.ValidationContext.OperationSite;
import org.cuepoint.compiler.ir.IrActionDefinition;
import org.cuepoint.compiler.ir.IrOperation;
import org.cuepoint.compiler.operations.OperationCatalog;
import org.cuepoint.compiler.operations.OperationSignature;

import java.util.List;
import java.util.Optional;

/**
 * Checks every call against its callee: built-in operations must exist in the catalog and receive a
 * fitting number of arguments, {@code addController} must name a known controller, and action calls
 * must not pass more arguments than the action declares. The calls of a stagger body are checked once,
 * not once per item.
 */
public class OperationValidationHandler implements IValidationHandler {

    @Override
    public void validate(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        for (OperationSite site : ctx.operationSites()) {
            IrOperation op = site.operation();
            if (site.staggerCopy()) {
                checkStaggeredController(site, ctx, diagnostics);
            } else if (op instanceof IrOperation.RawOperation raw) {
                checkRawOperation(raw, ctx, diagnostics);
            } else if (op instanceof IrOperation.ActionCall call) {
                checkActionCall(call, ctx, diagnostics);
            }
        }
    }

    /**
     * Later items of a stagger block repeat the calls of the first item; only a controller name
     * taken from the item can differ.
     */
    private void checkStaggeredController(OperationSite site, ValidationContext ctx, DiagnosticsEngine diagnostics) {
        if (site.operation() instanceof IrOperation.RawOperation raw
                && OperationCatalog.ADD_CONTROLLER.equals(raw.systemName())
                && !raw.arguments().isEmpty()
                && !site.repeatsArgument(0)) {
            resolveController(raw, ctx, diagnostics);
        }
    }

    private void checkRawOperation(IrOperation.RawOperation op, ValidationContext ctx, DiagnosticsEngine diagnostics) {
        OperationCatalog catalog = ctx.catalog();
        Optional<OperationSignature> signature = catalog.find(op.systemName());
        if (signature.isEmpty()) {
            diagnostics.report(DiagnosticCode.UNKNOWN_OPERATION,
                    "Unknown operation: \"" + op.systemName() + "\"",
                    ctx.suggestionHint(op.systemName(), catalog.operationNames(), "Available operations"),
                    op.source());
            return;
        }
        if (OperationCatalog.ADD_CONTROLLER.equals(op.systemName()) && !op.arguments().isEmpty()) {
            checkController(op, ctx, diagnostics);
            return;
        }
        checkCount("Operation", signature.get(), op.arguments().size(), op, diagnostics);
    }

    private void checkController(IrOperation.RawOperation op, ValidationContext ctx, DiagnosticsEngine diagnostics) {
        Optional<OperationSignature> controller = resolveController(op, ctx, diagnostics);
        if (controller.isPresent()) {
            checkCount("Controller", controller.get(), op.arguments().size() - 1, op, diagnostics);
        }
    }

    private Optional<OperationSignature> resolveController(IrOperation.RawOperation op, ValidationContext ctx,
                                                           DiagnosticsEngine diagnostics) {
        Optional<String> name = OperationCatalog.controllerNameOf(op.arguments());
        if (name.isEmpty()) {
            diagnostics.report(DiagnosticCode.UNKNOWN_CONTROLLER,
                    "Controller name must be a string literal",
                    "Available controllers: " + String.join(", ", ctx.catalog().controllerNames()),
                    op.source());
            return Optional.empty();
        }
        Optional<OperationSignature> controller = ctx.catalog().findController(name.get());
        if (controller.isEmpty()) {
            diagnostics.report(DiagnosticCode.UNKNOWN_CONTROLLER,
                    "Unknown controller: '" + name.get() + "'",
                    ctx.suggestionHint(name.get(), ctx.catalog().controllerNames(), "Available controllers"),
                    op.source());
        }
        return controller;
    }

    private void checkCount(String kind, OperationSignature signature, int count, IrOperation op, DiagnosticsEngine diagnostics) {
        if (count < signature.requiredCount() || count > signature.totalCount()) {
            diagnostics.report(DiagnosticCode.ARGUMENT_COUNT,
                    kind + " \"" + signature.systemName() + "\" expects " + signature.expectedCount()
                            + " parameter(s), but got " + count,
                    "Expected: " + signature.usage(),
                    op.source());
        }
    }

    private void checkActionCall(IrOperation.ActionCall call, ValidationContext ctx, DiagnosticsEngine diagnostics) {
        Optional<IrActionDefinition> definition = ctx.document().findAction(call.actionName());
        if (definition.isEmpty()) {
            return;
        }
        List<String> params = definition.get().parameters();
        if (call.arguments().size() > params.size()) {
            diagnostics.report(DiagnosticCode.ACTION_ARGUMENT_COUNT,
                    "Action '" + call.actionName() + "' expects at most " + params.size()
                            + " argument(s), but got " + call.arguments().size(),
                    "Expected: " + call.actionName() + "(" + String.join(", ", params) + ")",
                    call.source());
        }
    }
}
