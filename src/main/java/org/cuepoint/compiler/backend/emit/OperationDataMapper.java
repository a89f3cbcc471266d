package org.cuepoint.compiler.backend.emit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.cuepoint.compiler.api.EmitException;
import org.cuepoint.compiler.ir.IrActionDefinition;
import org.cuepoint.compiler.ir.IrArgument;
import org.cuepoint.compiler.ir.IrDocument;
import org.cuepoint.compiler.ir.IrOperation;
import org.cuepoint.compiler.operations.BoundArgument;
import org.cuepoint.compiler.operations.OperationCatalog;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns IR operations into runtime operation objects {@code {"id", "systemName", "operationData"}}.
 * <p>
 * Built-in operations name their positional arguments after the catalog parameters; arguments the
 * catalog cannot place are collected under {@code args}. Action calls become a {@code requestAction}
 * followed by {@code startAction} or {@code endAction}, and {@code addController} becomes
 * {@code getControllerInstance} followed by {@code addControllerToElement}.
 */
final class OperationDataMapper {

	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	private final OperationCatalog catalog;
	private final IrDocument document;

	OperationDataMapper(OperationCatalog catalog, IrDocument document) {
		this.catalog = catalog;
		this.document = document;
	}

	/**
	 * Appends the runtime operations for an operation that runs when its owner starts, or that
	 * is listed explicitly in an end list.
	 *
	 * @param op   The IR operation.
	 * @param out  The operation array being filled.
	 * @param path The field path of {@code out}, used in error messages.
	 */
	void append(IrOperation op, ArrayNode out, String path) throws EmitException {
		if (op instanceof IrOperation.RawOperation raw) {
			appendRaw(raw, out, path);
		} else if (op instanceof IrOperation.ActionCall call) {
			out.add(operation(derivedId(call.id(), "request"), "requestAction", requestData(call)));
			String dataPath = path + "[" + out.size() + "].operationData";
			out.add(operation(derivedId(call.id(), "start"), "startAction", actionData(call, dataPath)));
		}
	}

	/**
	 * Appends the end counterpart of a start operation. Only calls of endable actions have one.
	 */
	void appendEndCounterpart(IrOperation op, ArrayNode out, String path) throws EmitException {
		if (op instanceof IrOperation.ActionCall call && isEndable(call)) {
			out.add(operation(derivedId(call.id(), "end-request"), "requestAction", requestData(call)));
			String dataPath = path + "[" + out.size() + "].operationData";
			out.add(operation(derivedId(call.id(), "end"), "endAction", actionData(call, dataPath)));
		}
	}

	private void appendRaw(IrOperation.RawOperation raw, ArrayNode out, String path) throws EmitException {
		Optional<String> controller = OperationCatalog.ADD_CONTROLLER.equals(raw.systemName())
				? OperationCatalog.controllerNameOf(raw.arguments())
				: Optional.empty();
		if (controller.isPresent()) {
			ObjectNode instanceData = NODES.objectNode();
			instanceData.put("systemName", controller.get());
			out.add(operation(raw.id(), "getControllerInstance", instanceData));

			ObjectNode attachData = NODES.objectNode();
			String attachPath = path + "[" + out.size() + "].operationData";
			List<BoundArgument> bound = catalog.bindCall(raw.systemName(), raw.arguments());
			if (bound.isEmpty()) {
				writeUnbound(raw.arguments().subList(1, raw.arguments().size()), attachData, attachPath);
			} else {
				writeBound(bound.subList(1, bound.size()), attachData, attachPath);
			}
			out.add(operation(derivedId(raw.id(), "attach"), "addControllerToElement", attachData));
			return;
		}
		ObjectNode data = NODES.objectNode();
		String dataPath = path + "[" + out.size() + "].operationData";
		if (catalog.contains(raw.systemName())) {
			writeBound(catalog.bindCall(raw.systemName(), raw.arguments()), data, dataPath);
		} else {
			writeUnbound(raw.arguments(), data, dataPath);
		}
		out.add(operation(raw.id(), raw.systemName(), data));
	}

	private static void writeBound(List<BoundArgument> bound, ObjectNode data, String path) throws EmitException {
		ArrayNode extra = null;
		for (BoundArgument arg : bound) {
			if (arg.name() != null) {
				data.set(arg.name(), JsonValues.toJson(arg.value(), path + "." + arg.name()));
			} else {
				if (extra == null) extra = NODES.arrayNode();
				extra.add(JsonValues.toJson(arg.value(), path + ".args[" + extra.size() + "]"));
			}
		}
		if (extra != null) data.set("args", extra);
	}

	private static void writeUnbound(List<IrArgument> arguments, ObjectNode data, String path) throws EmitException {
		List<BoundArgument> bound = new ArrayList<>(arguments.size());
		for (IrArgument a : arguments) {
			bound.add(new BoundArgument(null, a.name(), a.value()));
		}
		writeBound(bound, data, path);
	}

	private static ObjectNode requestData(IrOperation.ActionCall call) {
		ObjectNode data = NODES.objectNode();
		data.put("systemName", call.actionName());
		return data;
	}

	private ObjectNode actionData(IrOperation.ActionCall call, String path) throws EmitException {
		List<String> params = document.findAction(call.actionName())
				.map(IrActionDefinition::parameters)
				.orElse(List.of());
		List<BoundArgument> bound = new ArrayList<>(call.arguments().size());
		int position = 0;
		for (IrArgument a : call.arguments()) {
			if (a.isPositional()) {
				String name = position < params.size() ? params.get(position) : null;
				position++;
				bound.add(new BoundArgument(null, name, a.value()));
			} else {
				bound.add(new BoundArgument(null, a.name(), a.value()));
			}
		}
		ObjectNode actionOperationData = NODES.objectNode();
		writeBound(bound, actionOperationData, path + ".actionOperationData");
		ObjectNode data = NODES.objectNode();
		data.set("actionOperationData", actionOperationData);
		return data;
	}

	private boolean isEndable(IrOperation.ActionCall call) {
		return document.findAction(call.actionName()).map(IrActionDefinition::endable).orElse(false);
	}

	private static ObjectNode operation(String id, String systemName, JsonNode data) {
		ObjectNode node = NODES.objectNode();
		node.put("id", id);
		node.put("systemName", systemName);
		node.set("operationData", data);
		return node;
	}

	// Runtime operations expanded from one IR operation need IDs of their own.
	private static String derivedId(String id, String suffix) {
		return UUID.nameUUIDFromBytes((id + "/" + suffix).getBytes(StandardCharsets.UTF_8)).toString();
	}
}
