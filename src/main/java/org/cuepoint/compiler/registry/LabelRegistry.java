package org.cuepoint.compiler.registry;

import java.util.ArrayList;
import java.util.List;

/**
 * The labels of the labels file each document imports.
 */
public class LabelRegistry extends DocumentScopedRegistry<List<LabelGroupMetadata>> {

    @Override
    public synchronized void updateFile(String fileUri, List<LabelGroupMetadata> labels) {
        super.updateFile(fileUri, List.copyOf(labels));
    }

    /**
     * @param documentUri The document URI.
     * @return {@code true} if the document's labels file is loaded.
     */
    public boolean hasLabelsFor(String documentUri) {
        return !entriesForDocument(documentUri).isEmpty();
    }

    /**
     * @param documentUri The document URI.
     * @return The labels reachable from the document, in file order.
     */
    public List<LabelGroupMetadata> labelsForDocument(String documentUri) {
        List<LabelGroupMetadata> out = new ArrayList<>();
        for (List<LabelGroupMetadata> labels : entriesForDocument(documentUri)) out.addAll(labels);
        return List.copyOf(out);
    }

    /**
     * @param documentUri The document URI.
     * @return The label IDs reachable from the document, in file order.
     */
    public List<String> labelIdsForDocument(String documentUri) {
        return labelsForDocument(documentUri).stream().map(LabelGroupMetadata::id).toList();
    }
}
