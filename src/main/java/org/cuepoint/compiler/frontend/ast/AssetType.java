package org.cuepoint.compiler.frontend.ast;

import java.util.Locale;

/**
 * The kind of asset a named import refers to.
 */
public enum AssetType {
    HTML,
    CSS,
    MEDIA;

    /**
     * @return The type name as written after {@code as}.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
