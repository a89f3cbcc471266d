package org.cuepoint.compiler.frontend.ast;

import java.util.Locale;

/**
 * The categories of default imports. A document may import at most one file per category.
 */
public enum ImportCategory {
    LAYOUT,
    STYLES,
    PROVIDER,
    LABELS;

    /**
     * @return The keyword introducing this import in the source language.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
