package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.diagnostics.Diagnostic;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.ast.Program;
import org.cuepoint.compiler.frontend.irgen.IrGenerator;
import org.cuepoint.compiler.frontend.semantics.ImportGraph;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;
import org.cuepoint.compiler.operations.OperationCatalog;
import org.cuepoint.compiler.registry.CssFileMetadata;
import org.cuepoint.compiler.registry.LabelGroupMetadata;
import org.cuepoint.compiler.registry.Registries;

import java.util.LinkedHashSet;
import java.util.List;

import static org.cuepoint.compiler.AstFixtures.DOC_URI;

/**
 * Runs a single validation rule over a hand-built document.
 */
final class ValidationTestSupport {

    static final OperationCatalog CATALOG = OperationCatalog.loadDefault();
    static final String STYLES_URI = "/project/styles.css";
    static final String LABELS_URI = "/project/labels.json";

    private ValidationTestSupport() {
    }

    static List<Diagnostic> run(IValidationHandler handler, Program program) throws TransformException {
        return run(handler, program, Registries.create());
    }

    static List<Diagnostic> run(IValidationHandler handler, Program program, Registries registries) throws TransformException {
        ValidationContext ctx = new ValidationContext(
                new IrGenerator().generate(program), ImportGraph.from(program), registries, CATALOG, 2);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        handler.validate(ctx, diagnostics);
        return diagnostics.getDiagnostics();
    }

    static Registries withStyles(List<String> classes, List<String> ids) {
        Registries registries = Registries.create();
        registries.css().updateFile(STYLES_URI, new CssFileMetadata(new LinkedHashSet<>(classes), new LinkedHashSet<>(ids)));
        registries.css().registerImports(DOC_URI, List.of(STYLES_URI));
        return registries;
    }

    static Registries withLabels(List<String> labelIds, List<String> localeCodes) {
        Registries registries = Registries.create();
        registries.labels().updateFile(LABELS_URI, labelIds.stream()
                .map(id -> new LabelGroupMetadata(id, localeCodes.size(), localeCodes))
                .toList());
        registries.labels().registerImports(DOC_URI, List.of(LABELS_URI));
        registries.locales().updateFile(LABELS_URI, localeCodes);
        registries.locales().registerImports(DOC_URI, List.of(LABELS_URI));
        return registries;
    }
}
