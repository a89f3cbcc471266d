package org.cuepoint.compiler.frontend.irgen.converters;

import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.frontend.ast.ActionDefinition;
import org.cuepoint.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.cuepoint.compiler.frontend.irgen.IrGenContext;
import org.cuepoint.compiler.ir.IrActionDefinition;

/**
 * Converts a user-defined action. Calls inside the body are resolved like calls on a timeline,
 * so actions may call other actions.
 */
public final class ActionDefinitionConverter implements IAstNodeToIrConverter<ActionDefinition> {

	@Override
	public void convert(ActionDefinition node, IrGenContext ctx) throws TransformException {
		if (node.name() == null || node.name().isBlank()) {
			throw new TransformException("Action definition without a name", node.source());
		}
		ctx.emitDefinition(new IrActionDefinition(
				ctx.idFor(""),
				node.name(),
				node.parameters(),
				ctx.lowerCalls(node.startOperations(), "start", null),
				ctx.lowerCalls(node.endOperations(), "end", null),
				node.endable(),
				node.source()));
	}
}
