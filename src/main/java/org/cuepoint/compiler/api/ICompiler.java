package org.cuepoint.compiler.api;

import org.cuepoint.compiler.frontend.ast.Program;

/**
 * Defines the public interface of the timeline compiler.
 */
public interface ICompiler {

    /**
     * Compiles a parsed document: lowering, validation, optimization and emission.
     *
     * @param program The syntax tree of the document.
     * @return The intermediate documents, all diagnostics and the configuration JSON.
     * @throws CompilationException if the tree cannot be lowered or the IR cannot be emitted.
     */
    CompilationResult compile(Program program) throws CompilationException;
}
