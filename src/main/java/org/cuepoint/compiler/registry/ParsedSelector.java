package org.cuepoint.compiler.registry;

import java.util.List;

/**
 * Class and ID tokens of a selector, in order of occurrence. Repeated tokens are kept.
 *
 * @param classes The class tokens.
 * @param ids     The ID tokens.
 */
public record ParsedSelector(List<String> classes, List<String> ids) {
    public ParsedSelector {
        classes = List.copyOf(classes);
        ids = List.copyOf(ids);
    }
}
