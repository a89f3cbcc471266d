package org.cuepoint.compiler.ir;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * A lowered timeline.
 *
 * @param id                The deterministic timeline ID.
 * @param name              The timeline name.
 * @param provider          The provider driving the timeline.
 * @param containerSelector The container element selector.
 * @param mediaSource       The media file, or {@code null}.
 * @param actions           The timeline actions in execution order.
 * @param staggerBlocks     The stagger blocks of the timeline in source order.
 * @param source            The source position of the declaration.
 */
public record IrTimeline(
		String id,
		String name,
		TimelineProvider provider,
		String containerSelector,
		String mediaSource,
		List<IrTimelineAction> actions,
		List<IrStaggerBlock> staggerBlocks,
		SourceInfo source
) implements IrItem {
	public IrTimeline {
		actions = List.copyOf(actions);
		staggerBlocks = staggerBlocks != null ? List.copyOf(staggerBlocks) : List.of();
	}

	/**
	 * @param newActions The replacement actions.
	 * @return A copy of this timeline with the given actions and the same stagger blocks.
	 */
	public IrTimeline withActions(List<IrTimelineAction> newActions) {
		return new IrTimeline(id, name, provider, containerSelector, mediaSource, newActions, staggerBlocks, source);
	}

	/**
	 * @return The largest action end time, or {@code 0} when the timeline has no actions.
	 */
	public double duration() {
		double max = 0;
		for (IrTimelineAction a : actions) {
			max = Math.max(max, a.duration().end());
		}
		return max;
	}
}
