package org.cuepoint.compiler.frontend.time;

import org.cuepoint.compiler.frontend.ast.TimeExpression;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts time literals and time expressions into seconds.
 * <p>
 * Both operations are total: text that is not a valid literal evaluates to {@code 0}
 * and a division by zero yields {@code 0}. Malformed literals are rejected by the parser
 * before they reach the compiler.
 */
public final class TimeEvaluator {

    private static final Pattern TIME_LITERAL = Pattern.compile("^(\\d+(?:\\.\\d+)?)(s|ms)$");

    private TimeEvaluator() {
        // Static utility
    }

    /**
     * Evaluates a time literal.
     *
     * @param text A literal such as {@code 5s}, {@code 1.5s} or {@code 500ms}.
     * @return The time in seconds, or {@code 0} if the text is not a time literal.
     */
    public static double evaluate(String text) {
        if (text == null) {
            return 0;
        }
        Matcher m = TIME_LITERAL.matcher(text);
        if (!m.matches()) {
            return 0;
        }
        double value = Double.parseDouble(m.group(1));
        return "ms".equals(m.group(2)) ? value / 1000.0 : value;
    }

    /**
     * Evaluates a time expression.
     *
     * @param expression The expression.
     * @return The time in seconds.
     */
    public static double evaluate(TimeExpression expression) {
        if (expression instanceof TimeExpression.TimeLiteral lit) {
            return evaluate(lit.text());
        }
        if (expression instanceof TimeExpression.BinaryTimeExpression bin) {
            double left = evaluate(bin.left());
            double right = evaluate(bin.right());
            switch (bin.operator()) {
                case PLUS:
                    return left + right;
                case MINUS:
                    return left - right;
                case TIMES:
                    return left * right;
                case DIVIDE:
                    return right == 0 ? 0 : left / right;
                default:
                    return 0;
            }
        }
        return 0;
    }
}
