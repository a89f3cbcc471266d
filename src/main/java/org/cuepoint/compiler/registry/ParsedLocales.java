package org.cuepoint.compiler.registry;

import java.util.List;

/**
 * The content of a labels file as the registries need it.
 *
 * @param localeCodes The locale codes the file translates, in file order.
 * @param labels      The labels, sorted by ID.
 */
public record ParsedLocales(List<String> localeCodes, List<LabelGroupMetadata> labels) {
    public ParsedLocales {
        localeCodes = List.copyOf(localeCodes);
        labels = List.copyOf(labels);
    }
}
