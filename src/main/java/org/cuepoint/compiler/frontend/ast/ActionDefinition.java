package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * A user-defined action. Endable actions have a separate list of operations run when the
 * timeline action calling them ends.
 *
 * @param name            The action name.
 * @param parameters      The parameter names in declaration order.
 * @param startOperations Operations run when the action starts.
 * @param endOperations   Operations run when the action ends; empty for non-endable actions.
 * @param endable         Whether the action was declared endable.
 * @param source          The source position.
 */
public record ActionDefinition(
        String name,
        List<String> parameters,
        List<OperationCall> startOperations,
        List<OperationCall> endOperations,
        boolean endable,
        SourceInfo source
) implements AstNode {
    public ActionDefinition {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        startOperations = startOperations != null ? List.copyOf(startOperations) : List.of();
        endOperations = endOperations != null ? List.copyOf(endOperations) : List.of();
    }
}
