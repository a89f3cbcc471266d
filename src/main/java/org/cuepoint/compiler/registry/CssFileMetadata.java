package org.cuepoint.compiler.registry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The class and ID names defined by one stylesheet, in order of first appearance.
 *
 * @param classes The class names.
 * @param ids     The ID names.
 */
public record CssFileMetadata(Set<String> classes, Set<String> ids) {
    public CssFileMetadata {
        classes = Collections.unmodifiableSet(new LinkedHashSet<>(classes));
        ids = Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }
}
