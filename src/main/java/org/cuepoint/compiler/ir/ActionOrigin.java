package org.cuepoint.compiler.ir;

/**
 * Records which timing construct produced a timeline action, so that construct-specific
 * rules can be checked on the IR.
 */
public sealed interface ActionOrigin permits ActionOrigin.Timed, ActionOrigin.SequenceStep, ActionOrigin.StaggerItem {

	/** An {@code at} event. */
	record Timed() implements ActionOrigin {}

	/**
	 * A step of a sequence.
	 *
	 * @param index        The step index within its sequence.
	 * @param stepDuration The evaluated step duration.
	 */
	record SequenceStep(int index, double stepDuration) implements ActionOrigin {}

	/**
	 * An item of a stagger block.
	 *
	 * @param index        The item index within its block.
	 * @param delay        The evaluated stagger delay.
	 * @param itemDuration The evaluated per-item duration.
	 */
	record StaggerItem(int index, double delay, double itemDuration) implements ActionOrigin {}
}
