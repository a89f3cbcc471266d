package org.cuepoint.compiler.operations;

import org.cuepoint.compiler.ir.IrValue;

/**
 * An argument matched to the parameter it fills.
 *
 * @param parameter The parameter, or {@code null} if the argument matches none.
 * @param name      The parameter name, or the keyword of an unmatched keyword argument;
 *                  {@code null} for an unmatched positional argument.
 * @param value     The argument value.
 */
public record BoundArgument(OperationParameter parameter, String name, IrValue value) {
}
