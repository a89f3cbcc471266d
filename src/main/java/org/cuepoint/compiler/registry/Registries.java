package org.cuepoint.compiler.registry;

/**
 * Handle on the process-scoped registries, passed explicitly to the components that read or fill them.
 *
 * @param css     The CSS registry.
 * @param labels  The label registry.
 * @param locales The locale registry.
 */
public record Registries(CssRegistry css, LabelRegistry labels, LocaleRegistry locales) {

    /**
     * @return A fresh set of empty registries.
     */
    public static Registries create() {
        return new Registries(new CssRegistry(), new LabelRegistry(), new LocaleRegistry());
    }
}
