package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * The {@code languages { ... }} block of a document.
 *
 * @param entries The declared languages in source order.
 * @param source  The source position.
 */
public record LanguagesBlock(List<LanguageEntry> entries, SourceInfo source) implements AstNode {
    public LanguagesBlock {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }
}
