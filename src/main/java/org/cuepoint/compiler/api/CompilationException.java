package org.cuepoint.compiler.api;

/**
 * A fatal compiler failure: the document cannot be turned into a configuration at all.
 * <p>
 * Problems in the user's document are never thrown; they are reported as diagnostics.
 * An exception here means the compiler received input its own contract rules out.
 */
public class CompilationException extends Exception {

    private final SourceInfo location;

    /**
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(message, (SourceInfo) null, null);
    }

    /**
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * @param message The detail message.
     * @param location Where in the document the failure was found, may be {@code null}.
     * @param cause The cause, may be {@code null}.
     */
    public CompilationException(String message, SourceInfo location, Throwable cause) {
        super(location != null ? message + " at " + location : message, cause);
        this.location = location;
    }

    /**
     * @return Where in the document the failure was found, or {@code null}.
     */
    public SourceInfo location() {
        return location;
    }
}
