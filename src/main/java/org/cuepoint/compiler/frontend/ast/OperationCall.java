package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * A call of a built-in operation or of a user-defined action. Which of the two it is
 * is decided during lowering.
 *
 * @param name      The callee name.
 * @param arguments The arguments in source order.
 * @param source    The source position.
 */
public record OperationCall(String name, List<Argument> arguments, SourceInfo source) implements AstNode {
    public OperationCall {
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }
}
