package org.cuepoint.compiler.ir;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * A lowered user-defined action.
 */
public record IrActionDefinition(
		String id,
		String name,
		List<String> parameters,
		List<IrOperation> startOperations,
		List<IrOperation> endOperations,
		boolean endable,
		SourceInfo source
) implements IrItem {
	public IrActionDefinition {
		parameters = List.copyOf(parameters);
		startOperations = List.copyOf(startOperations);
		endOperations = List.copyOf(endOperations);
	}
}
