package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The tree is produced by the external parser with all scopes already resolved;
 * the compiler only reads it.
 */
public interface AstNode {

    /**
     * @return The position of this node in the source document.
     */
    SourceInfo source();
}
