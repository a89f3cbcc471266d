package org.cuepoint.compiler.registry;

/**
 * Thrown when a CSS selector cannot be parsed.
 */
public class InvalidSelectorException extends Exception {

    /**
     * @param message What is wrong with the selector.
     */
    public InvalidSelectorException(String message) {
        super(message);
    }
}
