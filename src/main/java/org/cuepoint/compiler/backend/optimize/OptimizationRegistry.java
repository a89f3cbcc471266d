package org.cuepoint.compiler.backend.optimize;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for optimization passes applied in order.
 */
public final class OptimizationRegistry {

	private final List<IOptimizationPass> passes = new ArrayList<>();

	/**
	 * Registers a new pass.
	 * @param pass The pass to register.
	 */
	public void register(IOptimizationPass pass) { passes.add(pass); }

	/**
	 * @return The list of registered passes.
	 */
	public List<IOptimizationPass> passes() { return passes; }

	/**
	 * Initializes a new registry with the default passes.
	 * @return A new registry with default passes.
	 */
	public static OptimizationRegistry initializeWithDefaults() {
		OptimizationRegistry reg = new OptimizationRegistry();
		reg.register(new DeadActionEliminationPass());
		return reg;
	}
}
