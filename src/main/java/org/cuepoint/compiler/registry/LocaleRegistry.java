package org.cuepoint.compiler.registry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The locale codes translated by the labels file each document imports.
 */
public class LocaleRegistry extends DocumentScopedRegistry<List<String>> {

    @Override
    public synchronized void updateFile(String fileUri, List<String> localeCodes) {
        super.updateFile(fileUri, List.copyOf(localeCodes));
    }

    /**
     * @param documentUri The document URI.
     * @return {@code true} if locale information for the document is loaded.
     */
    public boolean hasLocalesFor(String documentUri) {
        return !entriesForDocument(documentUri).isEmpty();
    }

    /**
     * @param documentUri The document URI.
     * @return The locale codes reachable from the document, in file order without duplicates.
     */
    public List<String> localeCodesForDocument(String documentUri) {
        Set<String> out = new LinkedHashSet<>();
        for (List<String> codes : entriesForDocument(documentUri)) out.addAll(codes);
        return List.copyOf(out);
    }
}
