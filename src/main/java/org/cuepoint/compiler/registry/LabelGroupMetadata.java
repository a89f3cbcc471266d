package org.cuepoint.compiler.registry;

import java.util.List;

/**
 * Summary of one label of a labels file.
 *
 * @param id               The label ID.
 * @param translationCount The number of languages that translate the label.
 * @param languageCodes    Those languages, sorted.
 */
public record LabelGroupMetadata(String id, int translationCount, List<String> languageCodes) {
    public LabelGroupMetadata {
        languageCodes = List.copyOf(languageCodes);
    }
}
