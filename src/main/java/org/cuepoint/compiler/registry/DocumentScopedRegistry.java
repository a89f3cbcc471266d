package org.cuepoint.compiler.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Base for the registries: immutable per-file entries plus the association of documents with the
 * files they import.
 * <p>
 * Readers never lock. Writers are serialized and replace a file's entry with a single map put,
 * so a concurrent reader sees either the old or the new entry, never a mix.
 *
 * @param <V> The immutable entry type stored per file.
 */
public abstract class DocumentScopedRegistry<V> {

    private final Map<String, V> entriesByFile = new ConcurrentHashMap<>();
    private final Map<String, List<String>> filesByDocument = new ConcurrentHashMap<>();

    /**
     * Stores or replaces the entry of a file.
     *
     * @param fileUri The file URI.
     * @param entry   The new entry.
     */
    public synchronized void updateFile(String fileUri, V entry) {
        entriesByFile.put(fileUri, entry);
    }

    /**
     * Removes the entry of a file.
     *
     * @param fileUri The file URI.
     */
    public synchronized void removeFile(String fileUri) {
        entriesByFile.remove(fileUri);
    }

    /**
     * Records which files a document imports, replacing any earlier association.
     *
     * @param documentUri The document URI.
     * @param fileUris    The imported file URIs in import order.
     */
    public synchronized void registerImports(String documentUri, List<String> fileUris) {
        filesByDocument.put(documentUri, List.copyOf(fileUris));
    }

    /**
     * Forgets a document. Files no other document imports are removed as well.
     *
     * @param documentUri The document URI.
     */
    public synchronized void clearDocument(String documentUri) {
        List<String> released = filesByDocument.remove(documentUri);
        if (released == null) return;
        for (String file : released) {
            boolean stillReferenced = filesByDocument.values().stream().anyMatch(files -> files.contains(file));
            if (!stillReferenced) {
                entriesByFile.remove(file);
            }
        }
    }

    /**
     * @param fileUri The file URI.
     * @return The entry of the file, if loaded.
     */
    public Optional<V> entryFor(String fileUri) {
        return Optional.ofNullable(entriesByFile.get(fileUri));
    }

    /**
     * @param fileUri The file URI.
     * @return {@code true} if the file has an entry.
     */
    public boolean hasFile(String fileUri) {
        return entriesByFile.containsKey(fileUri);
    }

    /**
     * @param fileUri The file URI.
     * @return {@code true} if some document imports the file.
     */
    public boolean isImportedByAnyDocument(String fileUri) {
        return filesByDocument.values().stream().anyMatch(files -> files.contains(fileUri));
    }

    /**
     * @param documentUri The document URI.
     * @return The files the document imports, in import order.
     */
    public List<String> importsOf(String documentUri) {
        return filesByDocument.getOrDefault(documentUri, List.of());
    }

    /**
     * @param documentUri The document URI.
     * @return The loaded entries of the files the document imports, in import order.
     */
    protected List<V> entriesForDocument(String documentUri) {
        List<V> out = new ArrayList<>();
        for (String file : importsOf(documentUri)) {
            V entry = entriesByFile.get(file);
            if (entry != null) out.add(entry);
        }
        return Collections.unmodifiableList(out);
    }
}
