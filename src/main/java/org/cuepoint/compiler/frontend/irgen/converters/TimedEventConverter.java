package org.cuepoint.compiler.frontend.irgen.converters;

import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.frontend.ast.TimeRange;
import org.cuepoint.compiler.frontend.ast.TimelineEvent;
import org.cuepoint.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.cuepoint.compiler.frontend.irgen.IrGenContext;
import org.cuepoint.compiler.frontend.time.TimeEvaluator;
import org.cuepoint.compiler.ir.ActionOrigin;
import org.cuepoint.compiler.ir.IrDuration;
import org.cuepoint.compiler.ir.IrTimelineAction;

/**
 * Converts {@code at} events. A span {@code T1..T2} maps to {@code [T1, T2]}; a point with a
 * duration {@code T for D} maps to {@code [T, T + D]}.
 */
public final class TimedEventConverter implements IAstNodeToIrConverter<TimelineEvent.TimedEvent> {

	@Override
	public void convert(TimelineEvent.TimedEvent node, IrGenContext ctx) throws TransformException {
		if (node.range() == null || node.body() == null) {
			throw new TransformException("Timed event without time range or body", node.source());
		}
		double start;
		double end;
		if (node.range() instanceof TimeRange.SpanRange span) {
			start = TimeEvaluator.evaluate(span.start());
			end = TimeEvaluator.evaluate(span.end());
		} else if (node.range() instanceof TimeRange.PointRange point) {
			start = TimeEvaluator.evaluate(point.start());
			end = start + TimeEvaluator.evaluate(point.duration());
		} else {
			throw new TransformException("Unsupported time range " + node.range().getClass().getSimpleName(), node.source());
		}

		ctx.emitAction(new IrTimelineAction(
				ctx.idFor(""),
				ctx.nameOf(node.body()),
				new IrDuration(start, end),
				ctx.lowerCalls(node.body().startCalls(), "start", null),
				ctx.lowerCalls(node.body().endCalls(), "end", null),
				new ActionOrigin.Timed(),
				node.source()));
	}
}
