package org.cuepoint.compiler.operations;

import java.util.Optional;

/**
 * Parameter types of built-in operations. Some types carry cross-file meaning and are
 * checked against the registries.
 */
public enum ParameterType {
    /** A CSS selector, checked against the CSS registry. */
    SELECTOR("selector"),
    /** A CSS class name, checked against the CSS registry. */
    CLASS_NAME("className"),
    /** A label ID, checked against the label registry. */
    LABEL_ID("labelId"),
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    ANY("any");

    private final String jsonName;

    ParameterType(String jsonName) {
        this.jsonName = jsonName;
    }

    /**
     * @return The name used in the catalog resource.
     */
    public String jsonName() {
        return jsonName;
    }

    /**
     * @param name A catalog type name.
     * @return The matching type, if any.
     */
    public static Optional<ParameterType> fromJsonName(String name) {
        for (ParameterType t : values()) {
            if (t.jsonName.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
