package org.cuepoint.compiler.api;

/**
 * Thrown when lowering meets a syntax tree the parser could not have produced,
 * for example a node kind without a registered converter or a missing mandatory field.
 * This signals a broken contract between parser and compiler and is never user-facing.
 */
public class TransformException extends CompilationException {

    /**
     * @param message The detail message.
     * @param location Where the offending node was found, may be {@code null}.
     */
    public TransformException(String message, SourceInfo location) {
        super(message, location, null);
    }

    /**
     * @param message The detail message.
     */
    public TransformException(String message) {
        super(message);
    }
}
