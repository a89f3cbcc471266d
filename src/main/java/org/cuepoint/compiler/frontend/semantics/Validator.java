package org.cuepoint.compiler.frontend.semantics;

import org.cuepoint.compiler.diagnostics.Diagnostic;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.semantics.analysis.ActionDefinitionValidationHandler;
import org.cuepoint.compiler.frontend.semantics.analysis.AssetTypeValidationHandler;
import org.cuepoint.compiler.frontend.semantics.analysis.CssSelectorValidationHandler;
import org.cuepoint.compiler.frontend.semantics.analysis.IValidationHandler;
import org.cuepoint.compiler.frontend.semantics.analysis.ImportValidationHandler;
import org.cuepoint.compiler.frontend.semantics.analysis.LabelReferenceValidationHandler;
import org.cuepoint.compiler.frontend.semantics.analysis.LanguageValidationHandler;
import org.cuepoint.compiler.frontend.semantics.analysis.OperationValidationHandler;
import org.cuepoint.compiler.frontend.semantics.analysis.TimelineValidationHandler;
import org.cuepoint.compiler.frontend.semantics.analysis.TimingValidationHandler;
import org.cuepoint.compiler.ir.IrDocument;
import org.cuepoint.compiler.operations.OperationCatalog;
import org.cuepoint.compiler.registry.Registries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Performs semantic validation of a lowered document against its imports and the registries.
 * <p>
 * Validation is collect-all: every registered handler runs on every document, regardless of what
 * earlier handlers found, and nothing is thrown. The validator keeps no state between calls; the
 * result depends only on the document, its imports and the registry contents.
 */
public class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final List<IValidationHandler> handlers = new ArrayList<>();
    private final OperationCatalog catalog;
    private final int maxSuggestionDistance;

    /**
     * Constructs a validator with the default rules.
     * @param catalog The built-in operation catalog.
     * @param maxSuggestionDistance The largest edit distance for "did you mean" suggestions.
     */
    public Validator(OperationCatalog catalog, int maxSuggestionDistance) {
        this.catalog = catalog;
        this.maxSuggestionDistance = maxSuggestionDistance;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        handlers.add(new TimingValidationHandler());
        handlers.add(new ImportValidationHandler());
        handlers.add(new AssetTypeValidationHandler());
        handlers.add(new TimelineValidationHandler());
        handlers.add(new ActionDefinitionValidationHandler());
        handlers.add(new OperationValidationHandler());
        handlers.add(new CssSelectorValidationHandler());
        handlers.add(new LabelReferenceValidationHandler());
        handlers.add(new LanguageValidationHandler());
    }

    /**
     * Adds a rule that runs after the default ones.
     * @param handler The rule.
     */
    public void register(IValidationHandler handler) {
        handlers.add(handler);
    }

    /**
     * Validates a document.
     * @param document The lowered document.
     * @param imports The document's imports.
     * @param registries The registries to check references against.
     * @return All diagnostics, ordered by rule and then by position within the document.
     */
    public List<Diagnostic> validate(IrDocument document, ImportGraph imports, Registries registries) {
        ValidationContext ctx = new ValidationContext(document, imports, registries, catalog, maxSuggestionDistance);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        for (IValidationHandler handler : handlers) {
            handler.validate(ctx, diagnostics);
        }
        LOG.debug("Validated {}: {} error(s), {} warning(s)",
                document.documentUri(), diagnostics.errors().size(), diagnostics.warnings().size());
        return diagnostics.getDiagnostics();
    }
}
