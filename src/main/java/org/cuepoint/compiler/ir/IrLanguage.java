package org.cuepoint.compiler.ir;

import org.cuepoint.compiler.api.SourceInfo;

/**
 * A declared language.
 */
public record IrLanguage(String code, String label, boolean isDefault, SourceInfo source) implements IrItem {}
