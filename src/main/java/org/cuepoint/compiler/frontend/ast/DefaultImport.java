package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

/**
 * An import of the default file for a category, e.g. {@code layout "./layout.html"}.
 *
 * @param category The import category.
 * @param path     The imported path.
 * @param source   The source position.
 */
public record DefaultImport(ImportCategory category, String path, SourceInfo source) implements ImportStatement {
}
