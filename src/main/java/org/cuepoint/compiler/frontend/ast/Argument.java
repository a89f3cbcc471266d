package org.cuepoint.compiler.frontend.ast;

/**
 * A call argument.
 *
 * @param name  The keyword name, or {@code null} for a positional argument.
 * @param value The argument value.
 */
public record Argument(String name, Expression value) {

    /**
     * @param value The argument value.
     * @return A positional argument.
     */
    public static Argument positional(Expression value) {
        return new Argument(null, value);
    }
}
