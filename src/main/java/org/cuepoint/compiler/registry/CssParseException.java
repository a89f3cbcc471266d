package org.cuepoint.compiler.registry;

/**
 * Thrown when a stylesheet is structurally broken (unbalanced braces, unterminated comment or string).
 */
public class CssParseException extends Exception {

    private final int line;

    /**
     * @param message The problem.
     * @param line    The 1-based line where it was detected.
     */
    public CssParseException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    /**
     * @return The 1-based line where the problem was detected.
     */
    public int line() {
        return line;
    }
}
