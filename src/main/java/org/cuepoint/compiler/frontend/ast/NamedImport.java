package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

/**
 * A named asset import, e.g. {@code import intro from "./intro.html"} or
 * {@code import theme from "./theme.ogg" as media}.
 *
 * @param name      The import name.
 * @param path      The imported path.
 * @param assetType The explicit type annotation, or {@code null} when it is to be inferred.
 * @param source    The source position.
 */
public record NamedImport(String name, String path, AssetType assetType, SourceInfo source) implements ImportStatement {
}
