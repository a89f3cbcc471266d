package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;
import org.cuepoint.compiler.ir.IrLanguage;
import org.cuepoint.compiler.registry.LocaleRegistry;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the languages block: unique codes, exactly one default when several languages are
 * declared, and translations for every language in the imported labels.
 */
public class LanguageValidationHandler implements IValidationHandler {

    @Override
    public void validate(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        List<IrLanguage> languages = ctx.document().languages();
        if (languages.isEmpty()) return;

        Set<String> seen = new HashSet<>();
        for (IrLanguage lang : languages) {
            if (!seen.add(lang.code())) {
                diagnostics.report(DiagnosticCode.DUPLICATE_LANGUAGE,
                        "Duplicate language code '" + lang.code() + "'",
                        lang.source());
            }
        }

        if (languages.size() > 1) {
            List<IrLanguage> defaults = languages.stream().filter(IrLanguage::isDefault).toList();
            if (defaults.isEmpty()) {
                diagnostics.report(DiagnosticCode.MISSING_DEFAULT_LANGUAGE,
                        "Multiple languages are declared but none is marked as default",
                        languages.get(0).source());
            }
            for (int i = 1; i < defaults.size(); i++) {
                diagnostics.report(DiagnosticCode.MULTIPLE_DEFAULT_LANGUAGES,
                        "Only one language can be the default ('" + defaults.get(0).code() + "' is already the default)",
                        defaults.get(i).source());
            }
        }

        LocaleRegistry locales = ctx.registries().locales();
        if (!locales.hasLocalesFor(ctx.documentUri())) return;
        List<String> known = locales.localeCodesForDocument(ctx.documentUri());
        for (IrLanguage lang : languages) {
            if (!known.contains(lang.code())) {
                diagnostics.report(DiagnosticCode.UNKNOWN_LOCALE,
                        "Language '" + lang.code() + "' has no translations in the imported labels",
                        ctx.suggestionHint(lang.code(), known, "Translated locales"),
                        lang.source());
            }
        }
    }
}
