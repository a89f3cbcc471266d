package org.cuepoint.compiler.registry;

/**
 * Thrown when a labels file is not valid JSON or does not have a supported shape.
 */
public class LabelsParseException extends Exception {

    /**
     * @param message The problem.
     * @param cause   The underlying parse error, may be {@code null}.
     */
    public LabelsParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
