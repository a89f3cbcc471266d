package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.ast.DefaultImport;
import org.cuepoint.compiler.frontend.ast.ImportCategory;
import org.cuepoint.compiler.frontend.ast.ImportStatement;
import org.cuepoint.compiler.frontend.ast.NamedImport;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks import statements: one default import per category, unique import names that are neither
 * keywords nor built-in operation names, and relative paths.
 */
public class ImportValidationHandler implements IValidationHandler {

    /** Keywords of the source language that cannot be used as import names. */
    public static final Set<String> RESERVED_KEYWORDS = Set.of(
            "if", "else", "for", "break", "continue", "at", "action", "timeline",
            "layout", "styles", "provider", "import", "from", "as", "true", "false");

    private static final String RESERVED_HINT = "Reserved keywords: " + String.join(", ", new TreeSet<>(RESERVED_KEYWORDS));

    @Override
    public void validate(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        checkDefaultImports(ctx, diagnostics);
        checkNamedImports(ctx, diagnostics);
        for (ImportStatement imp : ctx.imports().imports()) {
            String path = imp.path();
            if (path == null || !(path.startsWith("./") || path.startsWith("../"))) {
                diagnostics.report(DiagnosticCode.ABSOLUTE_IMPORT_PATH,
                        "Import path must be relative to the document (got '" + path + "')",
                        imp.source());
            }
        }
    }

    private void checkDefaultImports(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        for (ImportCategory category : ImportCategory.values()) {
            List<DefaultImport> imports = ctx.imports().defaultImports(category);
            String type = category.keyword();
            for (int i = 1; i < imports.size(); i++) {
                diagnostics.report(DiagnosticCode.DUPLICATE_DEFAULT_IMPORT,
                        "Duplicate '" + type + "' import, only one " + type + " import is allowed",
                        "Remove duplicate " + type + " import statements",
                        imports.get(i).source());
            }
        }
    }

    private void checkNamedImports(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        Set<String> seen = new HashSet<>();
        for (NamedImport imp : ctx.imports().namedImports()) {
            String name = imp.name();
            if (!seen.add(name)) {
                diagnostics.report(DiagnosticCode.DUPLICATE_IMPORT_NAME,
                        "Duplicate import name '" + name + "', import names must be unique",
                        imp.source());
                continue;
            }
            if (RESERVED_KEYWORDS.contains(name)) {
                diagnostics.report(DiagnosticCode.RESERVED_KEYWORD_IMPORT_NAME,
                        "Cannot use reserved keyword '" + name + "' as import name",
                        RESERVED_HINT,
                        imp.source());
            } else if (ctx.catalog().contains(name)) {
                diagnostics.report(DiagnosticCode.OPERATION_NAME_CONFLICT,
                        "Cannot use operation name '" + name + "' as import name",
                        imp.source());
            }
        }
    }
}
