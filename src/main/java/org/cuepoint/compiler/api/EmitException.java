package org.cuepoint.compiler.api;

/**
 * Thrown by the emitter when the IR holds a value the JSON configuration cannot represent.
 * The offending location is reported as a field path into the emitted document,
 * e.g. {@code timelines[0].timelineActions[2].duration.end}.
 */
public class EmitException extends CompilationException {

    private final String fieldPath;

    /**
     * @param message The detail message.
     * @param fieldPath The path of the field that could not be written.
     */
    public EmitException(String message, String fieldPath) {
        this(message, fieldPath, null);
    }

    /**
     * @param message The detail message.
     * @param fieldPath The path of the field that could not be written.
     * @param cause The serializer failure.
     */
    public EmitException(String message, String fieldPath, Throwable cause) {
        super(message + " (at " + fieldPath + ")", cause);
        this.fieldPath = fieldPath;
    }

    /**
     * @return The path of the field that could not be written.
     */
    public String fieldPath() {
        return fieldPath;
    }
}
