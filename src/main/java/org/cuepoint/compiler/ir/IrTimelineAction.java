package org.cuepoint.compiler.ir;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * One action on a timeline.
 *
 * @param id              The deterministic action ID.
 * @param name            A readable name derived from the first call.
 * @param duration        The active interval.
 * @param startOperations Operations run at the start, in execution order.
 * @param endOperations   Operations run at the end, in execution order.
 * @param origin          The timing construct that produced this action.
 * @param source          The source position of the event.
 */
public record IrTimelineAction(
		String id,
		String name,
		IrDuration duration,
		List<IrOperation> startOperations,
		List<IrOperation> endOperations,
		ActionOrigin origin,
		SourceInfo source
) implements IrItem {
	public IrTimelineAction {
		startOperations = List.copyOf(startOperations);
		endOperations = List.copyOf(endOperations);
	}
}
