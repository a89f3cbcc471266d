package org.cuepoint.compiler.frontend.irgen.converters;

import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.frontend.ast.TimelineEvent;
import org.cuepoint.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.cuepoint.compiler.frontend.irgen.IrGenContext;
import org.cuepoint.compiler.frontend.time.TimeEvaluator;
import org.cuepoint.compiler.ir.ActionOrigin;
import org.cuepoint.compiler.ir.IrDuration;
import org.cuepoint.compiler.ir.IrTimelineAction;

import java.util.List;

/**
 * Converts a {@code sequence} block into one timeline action per step. The first step starts at the
 * timeline cursor; each following step starts where the previous one ends.
 */
public final class SequenceBlockConverter implements IAstNodeToIrConverter<TimelineEvent.SequenceBlock> {

	@Override
	public void convert(TimelineEvent.SequenceBlock node, IrGenContext ctx) throws TransformException {
		List<TimelineEvent.SequenceItem> items = node.items();
		double offset = ctx.cursor();
		for (int i = 0; i < items.size(); i++) {
			TimelineEvent.SequenceItem item = items.get(i);
			if (item == null || item.body() == null || item.duration() == null) {
				throw new TransformException("Sequence step " + i + " without body or duration", node.source());
			}
			double stepDuration = TimeEvaluator.evaluate(item.duration());
			double start = offset;
			double end = start + stepDuration;

			ctx.pushPath("step[" + i + "]");
			try {
				ctx.emitAction(new IrTimelineAction(
						ctx.idFor(""),
						ctx.nameOf(item.body()),
						new IrDuration(start, end),
						ctx.lowerCalls(item.body().startCalls(), "start", null),
						ctx.lowerCalls(item.body().endCalls(), "end", null),
						new ActionOrigin.SequenceStep(i, stepDuration),
						item.source()));
			} finally {
				ctx.popPath();
			}
			offset = end;
		}
	}
}
