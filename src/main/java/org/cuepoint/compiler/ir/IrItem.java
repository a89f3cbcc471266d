package org.cuepoint.compiler.ir;

import org.cuepoint.compiler.api.SourceInfo;

/**
 * Marker interface for IR elements produced by lowering and consumed by the
 * validator, optimizer and emitter. Every item carries source information
 * for diagnostics.
 */
public interface IrItem {
	SourceInfo source();
}
