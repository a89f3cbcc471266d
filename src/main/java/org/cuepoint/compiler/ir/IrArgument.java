package org.cuepoint.compiler.ir;

/**
 * A lowered call argument.
 *
 * @param name  The keyword name, or {@code null} for a positional argument.
 * @param value The value.
 */
public record IrArgument(String name, IrValue value) {

	/**
	 * @return {@code true} if the argument is positional.
	 */
	public boolean isPositional() {
		return name == null;
	}
}
