package org.cuepoint.compiler.frontend.semantics;

import org.cuepoint.compiler.frontend.ast.AssetType;
import org.cuepoint.compiler.frontend.ast.DefaultImport;
import org.cuepoint.compiler.frontend.ast.ImportCategory;
import org.cuepoint.compiler.frontend.ast.ImportStatement;
import org.cuepoint.compiler.frontend.ast.NamedImport;
import org.cuepoint.compiler.frontend.ast.Program;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The imports of one document, with the queries the validator and the registry loader need.
 *
 * @param documentUri The document URI.
 * @param imports     The import statements in source order.
 */
public record ImportGraph(String documentUri, List<ImportStatement> imports) {

    public ImportGraph {
        imports = List.copyOf(imports);
    }

    /**
     * @param program A parsed document.
     * @return The document's import graph.
     */
    public static ImportGraph from(Program program) {
        return new ImportGraph(program.documentUri(), program.imports());
    }

    /**
     * @param category An import category.
     * @return All default imports of that category, in source order.
     */
    public List<DefaultImport> defaultImports(ImportCategory category) {
        List<DefaultImport> out = new ArrayList<>();
        for (ImportStatement imp : imports) {
            if (imp instanceof DefaultImport d && d.category() == category) out.add(d);
        }
        return out;
    }

    /**
     * @param category An import category.
     * @return The first default import of that category.
     */
    public Optional<DefaultImport> defaultImport(ImportCategory category) {
        return defaultImports(category).stream().findFirst();
    }

    /**
     * @return The named imports in source order.
     */
    public List<NamedImport> namedImports() {
        List<NamedImport> out = new ArrayList<>();
        for (ImportStatement imp : imports) {
            if (imp instanceof NamedImport n) out.add(n);
        }
        return out;
    }

    /**
     * @return {@code true} if the document imports a labels file.
     */
    public boolean hasLabelsImport() {
        return defaultImport(ImportCategory.LABELS).isPresent();
    }

    /**
     * @return The imports that bring stylesheets into the document: the default styles import and
     *         named imports of CSS type, in source order.
     */
    public List<ImportStatement> stylesheetImports() {
        List<ImportStatement> out = new ArrayList<>();
        for (ImportStatement imp : imports) {
            if (imp instanceof DefaultImport d && d.category() == ImportCategory.STYLES) {
                out.add(d);
            } else if (imp instanceof NamedImport n && AssetTypeInference.effectiveType(n).orElse(null) == AssetType.CSS) {
                out.add(n);
            }
        }
        return out;
    }
}
