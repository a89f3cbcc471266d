package org.cuepoint.compiler.registry;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.api.SourceInfo;
import org.cuepoint.compiler.assets.FileLoadException;
import org.cuepoint.compiler.assets.IAssetLoader;
import org.cuepoint.compiler.assets.PathSecurityException;
import org.cuepoint.compiler.diagnostics.Diagnostic;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.ast.DefaultImport;
import org.cuepoint.compiler.frontend.ast.ImportCategory;
import org.cuepoint.compiler.frontend.ast.ImportStatement;
import org.cuepoint.compiler.frontend.semantics.ImportGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns the lifecycle of the registries: fills them when a document is opened, replaces a file's
 * entry when the file changes and forgets a document when it is closed.
 * <p>
 * Loading problems never throw; they are returned as diagnostics located at the import that caused them.
 */
public class RegistryLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryLoader.class);

    private final Registries registries;
    private final IAssetLoader assets;

    /**
     * @param registries The registries to fill.
     * @param assets     Access to the imported files.
     */
    public RegistryLoader(Registries registries, IAssetLoader assets) {
        this.registries = registries;
        this.assets = assets;
    }

    /**
     * Loads the stylesheets and the labels file a document imports and associates them with the document.
     *
     * @param documentUri  The document URI.
     * @param documentPath The path of the document on disk; imports are resolved against its directory.
     * @param imports      The document's imports.
     * @return The problems found while loading, empty if all files were loaded.
     */
    public List<Diagnostic> loadDocument(String documentUri, String documentPath, ImportGraph imports) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<String> stylesheets = new ArrayList<>();
        for (ImportStatement imp : imports.stylesheetImports()) {
            Optional<String> resolved = resolve(documentPath, imp, diagnostics);
            if (resolved.isEmpty()) continue;
            stylesheets.add(resolved.get());
            loadStylesheet(resolved.get(), imp.source(), diagnostics);
        }
        registries.css().registerImports(documentUri, stylesheets);

        List<String> labelFiles = new ArrayList<>();
        Optional<DefaultImport> labelsImport = imports.defaultImport(ImportCategory.LABELS);
        if (labelsImport.isPresent()) {
            Optional<String> resolved = resolve(documentPath, labelsImport.get(), diagnostics);
            if (resolved.isPresent()) {
                labelFiles.add(resolved.get());
                loadLabels(resolved.get(), labelsImport.get().source(), diagnostics);
            }
        }
        registries.labels().registerImports(documentUri, labelFiles);
        registries.locales().registerImports(documentUri, labelFiles);

        LOG.debug("Registered {} stylesheet(s) and {} labels file(s) for {}", stylesheets.size(), labelFiles.size(), documentUri);
        return diagnostics.getDiagnostics();
    }

    /**
     * Re-reads a changed file and replaces its registry entries.
     *
     * @param fileUri The file URI as registered.
     * @return The problems found while reloading.
     */
    public List<Diagnostic> reloadFile(String fileUri) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        if (registries.css().hasFile(fileUri) || registries.css().isImportedByAnyDocument(fileUri)) {
            loadStylesheet(fileUri, null, diagnostics);
        }
        if (registries.labels().hasFile(fileUri) || registries.labels().isImportedByAnyDocument(fileUri)) {
            loadLabels(fileUri, null, diagnostics);
        }
        return diagnostics.getDiagnostics();
    }

    /**
     * Removes a document from all registries.
     *
     * @param documentUri The document URI.
     */
    public void closeDocument(String documentUri) {
        registries.css().clearDocument(documentUri);
        registries.labels().clearDocument(documentUri);
        registries.locales().clearDocument(documentUri);
        LOG.debug("Cleared registries for {}", documentUri);
    }

    private Optional<String> resolve(String documentPath, ImportStatement imp, DiagnosticsEngine diagnostics) {
        try {
            return Optional.of(assets.resolvePath(documentPath, imp.path()));
        } catch (PathSecurityException e) {
            LOG.warn("Rejected import '{}' of {}: {}", imp.path(), documentPath, e.getMessage());
            diagnostics.report(DiagnosticCode.PATH_TRAVERSAL, e.getMessage(), imp.source());
            return Optional.empty();
        }
    }

    private void loadStylesheet(String fileUri, SourceInfo location, DiagnosticsEngine diagnostics) {
        try {
            CssFileMetadata metadata = CssParser.parse(assets.loadFile(fileUri));
            registries.css().updateFile(fileUri, metadata);
            LOG.debug("Loaded stylesheet {}: {} classes, {} ids", fileUri, metadata.classes().size(), metadata.ids().size());
        } catch (FileLoadException e) {
            LOG.warn("Failed to load stylesheet {}: {}", fileUri, e.getMessage());
            registries.css().removeFile(fileUri);
            diagnostics.report(DiagnosticCode.ASSET_LOAD_FAILED, e.getMessage(), location);
        } catch (CssParseException e) {
            LOG.warn("Failed to parse stylesheet {}: {}", fileUri, e.getMessage());
            registries.css().removeFile(fileUri);
            diagnostics.report(DiagnosticCode.INVALID_STYLESHEET, "Invalid CSS in " + fileUri + ": " + e.getMessage(), location);
        }
    }

    private void loadLabels(String fileUri, SourceInfo location, DiagnosticsEngine diagnostics) {
        try {
            ParsedLocales parsed = LocalesParser.parse(assets.loadFile(fileUri));
            registries.labels().updateFile(fileUri, parsed.labels());
            registries.locales().updateFile(fileUri, parsed.localeCodes());
            LOG.debug("Loaded labels {}: {} labels in {} locale(s)", fileUri, parsed.labels().size(), parsed.localeCodes().size());
        } catch (FileLoadException e) {
            LOG.warn("Failed to load labels {}: {}", fileUri, e.getMessage());
            registries.labels().removeFile(fileUri);
            registries.locales().removeFile(fileUri);
            diagnostics.report(DiagnosticCode.ASSET_LOAD_FAILED, e.getMessage(), location);
        } catch (LabelsParseException e) {
            LOG.warn("Failed to parse labels {}: {}", fileUri, e.getMessage());
            registries.labels().removeFile(fileUri);
            registries.locales().removeFile(fileUri);
            diagnostics.report(DiagnosticCode.INVALID_LABELS_FILE, "Invalid labels file " + fileUri + ": " + e.getMessage(), location);
        }
    }
}
