package org.cuepoint.compiler.operations;

/**
 * A parameter of a built-in operation or controller.
 *
 * @param name     The name under which the argument is written into the operation data.
 * @param type     The parameter type.
 * @param required Whether the argument must be supplied.
 */
public record OperationParameter(String name, ParameterType type, boolean required) {
}
