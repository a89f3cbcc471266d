package org.cuepoint.compiler.assets;

/**
 * Thrown when an asset cannot be read.
 */
public class FileLoadException extends Exception {

    /**
     * Why the file could not be loaded.
     */
    public enum Reason {
        NOT_FOUND,
        PERMISSION_DENIED,
        READ_ERROR
    }

    private final String path;
    private final Reason reason;

    /**
     * @param path   The path that was read.
     * @param reason The failure category.
     * @param cause  The underlying exception, may be {@code null}.
     */
    public FileLoadException(String path, Reason reason, Throwable cause) {
        super(describe(path, reason), cause);
        this.path = path;
        this.reason = reason;
    }

    private static String describe(String path, Reason reason) {
        switch (reason) {
            case NOT_FOUND:
                return "File not found: " + path;
            case PERMISSION_DENIED:
                return "Permission denied: " + path;
            default:
                return "Could not read file: " + path;
        }
    }

    /**
     * @return The path that was read.
     */
    public String path() {
        return path;
    }

    /**
     * @return The failure category.
     */
    public Reason reason() {
        return reason;
    }
}
