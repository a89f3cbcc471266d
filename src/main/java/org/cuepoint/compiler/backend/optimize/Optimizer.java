package org.cuepoint.compiler.backend.optimize;

import org.cuepoint.compiler.ir.IrDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phase: runs the registered optimization passes over a validated document.
 * The phase has no error channel; it always returns a document.
 */
public final class Optimizer {

	private static final Logger LOG = LoggerFactory.getLogger(Optimizer.class);

	private final OptimizationRegistry registry;

	/**
	 * @param registry The passes to run.
	 */
	public Optimizer(OptimizationRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Creates an optimizer with the default passes.
	 */
	public Optimizer() {
		this(OptimizationRegistry.initializeWithDefaults());
	}

	/**
	 * Optimizes a document.
	 *
	 * @param document The input document.
	 * @return The optimized document.
	 */
	public IrDocument optimize(IrDocument document) {
		IrDocument current = document;
		for (IOptimizationPass pass : registry.passes()) {
			int before = countActions(current);
			current = pass.apply(current);
			LOG.debug("Pass {} on {}: {} -> {} timeline action(s)", pass.name(), document.documentUri(), before, countActions(current));
		}
		return current;
	}

	private static int countActions(IrDocument document) {
		return document.timelines().stream().mapToInt(t -> t.actions().size()).sum();
	}
}
