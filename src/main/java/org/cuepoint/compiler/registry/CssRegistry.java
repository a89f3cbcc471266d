package org.cuepoint.compiler.registry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Class and ID names of the stylesheets each document imports.
 */
public class CssRegistry extends DocumentScopedRegistry<CssFileMetadata> {

    /**
     * @param documentUri The document URI.
     * @return {@code true} if at least one stylesheet of the document is loaded.
     */
    public boolean hasStylesFor(String documentUri) {
        return !entriesForDocument(documentUri).isEmpty();
    }

    /**
     * @param documentUri The document URI.
     * @return All class names reachable from the document, in stylesheet import order.
     */
    public Set<String> classesForDocument(String documentUri) {
        Set<String> out = new LinkedHashSet<>();
        for (CssFileMetadata m : entriesForDocument(documentUri)) out.addAll(m.classes());
        return Collections.unmodifiableSet(out);
    }

    /**
     * @param documentUri The document URI.
     * @return All ID names reachable from the document, in stylesheet import order.
     */
    public Set<String> idsForDocument(String documentUri) {
        Set<String> out = new LinkedHashSet<>();
        for (CssFileMetadata m : entriesForDocument(documentUri)) out.addAll(m.ids());
        return Collections.unmodifiableSet(out);
    }
}
