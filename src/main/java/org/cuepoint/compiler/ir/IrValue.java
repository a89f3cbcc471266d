package org.cuepoint.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small, typed value system used for operation arguments. Designed to be
 * easily serializable and extensible without leaking Object.
 */
public sealed interface IrValue permits IrValue.Num, IrValue.Str, IrValue.Bool, IrValue.Null, IrValue.ListVal, IrValue.MapVal, IrValue.Ref {
	/**
	 * Represents a number.
	 * @param value The double value.
	 */
	record Num(double value) implements IrValue {}

	/**
	 * Represents a string value.
	 * @param value The string value.
	 */
	record Str(String value) implements IrValue {}

	/**
	 * Represents a boolean value.
	 * @param value The boolean value.
	 */
	record Bool(boolean value) implements IrValue {}

	/**
	 * Represents the null literal.
	 */
	record Null() implements IrValue {}

	/**
	 * Represents a list of IrValue elements.
	 * @param elements The list of IrValue elements.
	 */
	record ListVal(List<IrValue> elements) implements IrValue {
		public ListVal {
			elements = List.copyOf(elements);
		}
	}

	/**
	 * Represents a map of string keys to IrValue values, in insertion order.
	 * @param entries The map of string keys to IrValue values.
	 */
	record MapVal(Map<String, IrValue> entries) implements IrValue {
		public MapVal {
			entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
		}
	}

	/**
	 * Represents a reference resolved by the runtime, e.g. {@code $operationdata.items}.
	 * @param expression The reference text.
	 */
	record Ref(String expression) implements IrValue {}
}
