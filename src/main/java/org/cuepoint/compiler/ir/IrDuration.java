package org.cuepoint.compiler.ir;

/**
 * The active interval of a timeline action, in seconds.
 * <p>
 * No invariant is enforced here: invalid intervals must survive lowering so that
 * the validator can report them.
 */
public record IrDuration(double start, double end) {

	/**
	 * @return {@code true} if both bounds are finite numbers.
	 */
	public boolean isWellFormed() {
		return Double.isFinite(start) && Double.isFinite(end);
	}
}
