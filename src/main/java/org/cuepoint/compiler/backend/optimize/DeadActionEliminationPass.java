package org.cuepoint.compiler.backend.optimize;

import org.cuepoint.compiler.ir.IrDocument;
import org.cuepoint.compiler.ir.IrDuration;
import org.cuepoint.compiler.ir.IrTimeline;
import org.cuepoint.compiler.ir.IrTimelineAction;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes timeline actions that can never run: those ending at or before their start and those
 * starting before zero. Actions whose bounds are not finite numbers are kept.
 * <p>
 * The pass only filters; surviving actions keep their order, timing and IDs. Each decision depends
 * on the action alone, so applying the pass to its own output changes nothing.
 */
public final class DeadActionEliminationPass implements IOptimizationPass {

	@Override
	public String name() {
		return "dead-action-elimination";
	}

	@Override
	public IrDocument apply(IrDocument document) {
		List<IrTimeline> timelines = new ArrayList<>(document.timelines().size());
		boolean changed = false;
		for (IrTimeline timeline : document.timelines()) {
			List<IrTimelineAction> kept = new ArrayList<>(timeline.actions().size());
			for (IrTimelineAction action : timeline.actions()) {
				if (isReachable(action.duration())) kept.add(action);
			}
			if (kept.size() == timeline.actions().size()) {
				timelines.add(timeline);
			} else {
				timelines.add(timeline.withActions(kept));
				changed = true;
			}
		}
		return changed ? document.withTimelines(timelines) : document;
	}

	/**
	 * @param duration An action's interval.
	 * @return {@code false} if the action can never run.
	 */
	static boolean isReachable(IrDuration duration) {
		if (!duration.isWellFormed()) {
			return true;
		}
		if (duration.end() <= duration.start()) {
			return false;
		}
		return duration.start() >= 0;
	}
}
