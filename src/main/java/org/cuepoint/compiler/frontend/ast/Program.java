package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * The root of a parsed document.
 *
 * @param documentUri The URI of the document, used to scope registry lookups and generated IDs.
 * @param imports     The import statements in source order.
 * @param languages   The languages block, or {@code null} if the document declares none.
 * @param actions     The action definitions in source order.
 * @param timelines   The timelines in source order.
 * @param source      The position of the document start.
 */
public record Program(
        String documentUri,
        List<ImportStatement> imports,
        LanguagesBlock languages,
        List<ActionDefinition> actions,
        List<Timeline> timelines,
        SourceInfo source
) implements AstNode {
    public Program {
        imports = imports != null ? List.copyOf(imports) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
        timelines = timelines != null ? List.copyOf(timelines) : List.of();
    }
}
