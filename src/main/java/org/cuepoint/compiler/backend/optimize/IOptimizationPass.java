package org.cuepoint.compiler.backend.optimize;

import org.cuepoint.compiler.ir.IrDocument;

/**
 * A transformation of the IR applied before emission.
 * <p>
 * Passes are total: they cannot fail and always return a document, possibly the input itself.
 */
public interface IOptimizationPass {

	/**
	 * @return A short name used in log output.
	 */
	String name();

	/**
	 * Applies this pass.
	 *
	 * @param document The input document, never modified.
	 * @return The optimized document.
	 */
	IrDocument apply(IrDocument document);
}
