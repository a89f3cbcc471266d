package org.cuepoint.compiler.frontend.ast;

/**
 * A time expression: a literal such as {@code 1.5s} or {@code 500ms}, or arithmetic over literals.
 */
public sealed interface TimeExpression permits TimeExpression.TimeLiteral, TimeExpression.BinaryTimeExpression {

    /**
     * A time literal kept as written in the source.
     *
     * @param text The literal text.
     */
    record TimeLiteral(String text) implements TimeExpression {}

    /**
     * A binary expression over time values.
     *
     * @param operator The operator.
     * @param left     The left operand.
     * @param right    The right operand.
     */
    record BinaryTimeExpression(Operator operator, TimeExpression left, TimeExpression right) implements TimeExpression {}

    enum Operator {
        PLUS, MINUS, TIMES, DIVIDE
    }

    /**
     * @param text The literal text.
     * @return A literal expression.
     */
    static TimeExpression literal(String text) {
        return new TimeLiteral(text);
    }
}
