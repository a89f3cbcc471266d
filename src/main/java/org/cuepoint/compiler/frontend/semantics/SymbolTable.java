package org.cuepoint.compiler.frontend.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document-level symbol table. Lowering resolves callee names against it to tell
 * action calls apart from built-in operations.
 * <p>
 * Names are case-sensitive. When a name is defined twice the first definition wins;
 * duplicates are reported by the validator, not here.
 */
public class SymbolTable {

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    /**
     * Defines a symbol unless one with the same name exists.
     *
     * @param symbol The symbol to define.
     * @return {@code true} if the symbol was added, {@code false} if the name was taken.
     */
    public boolean define(Symbol symbol) {
        return symbols.putIfAbsent(symbol.name(), symbol) == null;
    }

    /**
     * Resolves a symbol by name.
     *
     * @param name The name to resolve.
     * @return The symbol, or empty if the name is not defined.
     */
    public Optional<Symbol> resolve(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * Resolves an action by name.
     *
     * @param name The name to resolve.
     * @return The action symbol, or empty if the name is not a defined action.
     */
    public Optional<Symbol> resolveAction(String name) {
        return resolve(name).filter(s -> s.type() == Symbol.Type.ACTION);
    }

    /**
     * @return All symbols in definition order.
     */
    public List<Symbol> all() {
        return Collections.unmodifiableList(List.copyOf(symbols.values()));
    }
}
