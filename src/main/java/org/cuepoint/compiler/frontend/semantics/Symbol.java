package org.cuepoint.compiler.frontend.semantics;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * Represents a symbol declared in a document.
 *
 * @param name       The declared name.
 * @param type       The kind of symbol.
 * @param parameters The parameter names, for actions.
 * @param source     Where the symbol was declared.
 */
public record Symbol(String name, Type type, List<String> parameters, SourceInfo source) {

    /**
     * The type of a symbol.
     */
    public enum Type {
        ACTION
    }

    public Symbol {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }
}
