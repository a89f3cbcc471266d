package org.cuepoint.compiler.backend.emit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.cuepoint.compiler.api.EmitException;
import org.cuepoint.compiler.ir.IrValue;

import java.util.Map;

/**
 * Converts IR values and numbers to JSON nodes.
 */
final class JsonValues {

	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	// Whole numbers below this magnitude are written without a fraction.
	private static final double INTEGRAL_LIMIT = 1e15;

	private JsonValues() {}

	static JsonNode toJson(IrValue value, String path) throws EmitException {
		if (value instanceof IrValue.Num n) {
			return number(n.value(), path);
		}
		if (value instanceof IrValue.Str s) {
			return NODES.textNode(s.value());
		}
		if (value instanceof IrValue.Bool b) {
			return NODES.booleanNode(b.value());
		}
		if (value instanceof IrValue.Ref r) {
			return NODES.textNode(r.expression());
		}
		if (value instanceof IrValue.ListVal list) {
			ArrayNode array = NODES.arrayNode();
			for (IrValue element : list.elements()) {
				array.add(toJson(element, path + "[" + array.size() + "]"));
			}
			return array;
		}
		if (value instanceof IrValue.MapVal map) {
			ObjectNode object = NODES.objectNode();
			for (Map.Entry<String, IrValue> e : map.entries().entrySet()) {
				object.set(e.getKey(), toJson(e.getValue(), path + "." + e.getKey()));
			}
			return object;
		}
		return NODES.nullNode();
	}

	/**
	 * @param value The number to write.
	 * @param path  The field path, used in the error message.
	 * @return An integral node for whole numbers, a double node otherwise.
	 * @throws EmitException if the number is NaN or infinite.
	 */
	static JsonNode number(double value, String path) throws EmitException {
		if (!Double.isFinite(value)) {
			throw new EmitException("Cannot represent non-finite number " + value, path);
		}
		if (value == Math.rint(value) && Math.abs(value) < INTEGRAL_LIMIT) {
			return NODES.numberNode((long) value);
		}
		return NODES.numberNode(value);
	}
}
