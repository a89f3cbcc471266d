package org.cuepoint.compiler.assets;

/**
 * Access to the files a document imports. The compiler uses it only to fill the registries,
 * never while a document is being compiled.
 */
public interface IAssetLoader {

    /**
     * @param path An absolute path.
     * @return {@code true} if a regular file exists at the path.
     */
    boolean fileExists(String path);

    /**
     * Reads a file as UTF-8 text.
     *
     * @param path An absolute path.
     * @return The file content.
     * @throws FileLoadException if the file is missing or unreadable.
     */
    String loadFile(String path) throws FileLoadException;

    /**
     * Resolves a path relative to the directory of a source file.
     *
     * @param sourcePath   The path of the importing document.
     * @param relativePath The path as written in the import.
     * @return The normalized absolute path.
     * @throws PathSecurityException if the result lies outside the source file's directory.
     */
    String resolvePath(String sourcePath, String relativePath) throws PathSecurityException;
}
