package org.cuepoint.compiler.assets;

/**
 * Thrown when a relative import path resolves outside the directory of the importing document.
 */
public class PathSecurityException extends Exception {

    private final String relativePath;

    /**
     * @param relativePath The offending path as written.
     * @param baseDirectory The directory it must stay within.
     */
    public PathSecurityException(String relativePath, String baseDirectory) {
        super("Path '" + relativePath + "' resolves outside of '" + baseDirectory + "'");
        this.relativePath = relativePath;
    }

    /**
     * @return The offending path as written.
     */
    public String relativePath() {
        return relativePath;
    }
}
