package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

/**
 * One language of a languages block, e.g. {@code * "en-US" "English"}.
 *
 * @param code      The locale code.
 * @param label     The display label.
 * @param isDefault Whether the entry carries the default marker.
 * @param source    The source position.
 */
public record LanguageEntry(String code, String label, boolean isDefault, SourceInfo source) implements AstNode {
}
