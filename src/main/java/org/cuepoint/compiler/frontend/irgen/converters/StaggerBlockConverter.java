package org.cuepoint.compiler.frontend.irgen.converters;

import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.frontend.ast.Expression;
import org.cuepoint.compiler.frontend.ast.TimelineEvent;
import org.cuepoint.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.cuepoint.compiler.frontend.irgen.IrGenContext;
import org.cuepoint.compiler.frontend.time.TimeEvaluator;
import org.cuepoint.compiler.ir.ActionOrigin;
import org.cuepoint.compiler.ir.IrDuration;
import org.cuepoint.compiler.ir.IrStaggerBlock;
import org.cuepoint.compiler.ir.IrTimelineAction;
import org.cuepoint.compiler.ir.IrValue;

import java.util.List;

/**
 * Converts a {@code stagger} block into one timeline action per item. Item {@code i} starts at
 * {@code cursor + i * delay} and lasts the block's duration; item references in the body are
 * replaced by the item value.
 */
public final class StaggerBlockConverter implements IAstNodeToIrConverter<TimelineEvent.StaggerBlock> {

	@Override
	public void convert(TimelineEvent.StaggerBlock node, IrGenContext ctx) throws TransformException {
		if (node.delay() == null || node.duration() == null || node.body() == null) {
			throw new TransformException("Stagger block without delay, duration or body", node.source());
		}
		double base = ctx.cursor();
		double delay = TimeEvaluator.evaluate(node.delay());
		double itemDuration = TimeEvaluator.evaluate(node.duration());
		List<Expression> items = node.items();
		ctx.emitStaggerBlock(new IrStaggerBlock(delay, itemDuration, items.size(), node.source()));

		for (int i = 0; i < items.size(); i++) {
			IrValue item = ctx.lowerValue(items.get(i), null);
			double start = base + i * delay;

			ctx.pushPath("item[" + i + "]");
			try {
				ctx.emitAction(new IrTimelineAction(
						ctx.idFor(""),
						ctx.nameOf(node.body()),
						new IrDuration(start, start + itemDuration),
						ctx.lowerCalls(node.body().startCalls(), "start", item),
						ctx.lowerCalls(node.body().endCalls(), "end", item),
						new ActionOrigin.StaggerItem(i, delay, itemDuration),
						node.source()));
			} finally {
				ctx.popPath();
			}
		}
	}
}
