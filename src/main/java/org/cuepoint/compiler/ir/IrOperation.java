package org.cuepoint.compiler.ir;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * An operation inside a timeline action or an action definition.
 */
public sealed interface IrOperation extends IrItem permits IrOperation.RawOperation, IrOperation.ActionCall {

	String id();

	List<IrArgument> arguments();

	/**
	 * A call of a built-in runtime operation. The name is not checked during lowering.
	 */
	record RawOperation(String id, String systemName, List<IrArgument> arguments, SourceInfo source) implements IrOperation {
		public RawOperation {
			arguments = List.copyOf(arguments);
		}
	}

	/**
	 * A call of a user-defined action of the same document.
	 */
	record ActionCall(String id, String actionName, List<IrArgument> arguments, SourceInfo source) implements IrOperation {
		public ActionCall {
			arguments = List.copyOf(arguments);
		}
	}
}
