package org.cuepoint.compiler.frontend.ast;

/**
 * An import statement, either a category default ({@code styles "./main.css"})
 * or a named asset ({@code import intro from "./intro.html"}).
 */
public sealed interface ImportStatement extends AstNode permits DefaultImport, NamedImport {

    /**
     * @return The path as written in the source.
     */
    String path();
}
