package org.cuepoint.compiler.frontend.irgen;

import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.frontend.ast.Argument;
import org.cuepoint.compiler.frontend.ast.AstNode;
import org.cuepoint.compiler.frontend.ast.EventBody;
import org.cuepoint.compiler.frontend.ast.Expression;
import org.cuepoint.compiler.frontend.ast.OperationCall;
import org.cuepoint.compiler.frontend.semantics.Symbol;
import org.cuepoint.compiler.frontend.semantics.SymbolTable;
import org.cuepoint.compiler.ir.IrActionDefinition;
import org.cuepoint.compiler.ir.IrArgument;
import org.cuepoint.compiler.ir.IrOperation;
import org.cuepoint.compiler.ir.IrStaggerBlock;
import org.cuepoint.compiler.ir.IrTimelineAction;
import org.cuepoint.compiler.ir.IrValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable context passed to converters during IR generation of one document.
 * Provides emission utilities, ID construction, operation lowering and the timeline cursor.
 * <p>
 * The context is confined to a single {@link IrGenerator#generate} call.
 */
public final class IrGenContext {

	private final String documentUri;
	private final IrConverterRegistry registry;
	private final SymbolTable symbols;
	private final IdGenerator ids;
	private final Deque<String> path = new ArrayDeque<>();
	private final List<IrActionDefinition> definitions = new ArrayList<>();
	private List<IrTimelineAction> timelineActions = new ArrayList<>();
	private List<IrStaggerBlock> staggerBlocks = new ArrayList<>();
	private double cursor;

	/**
	 * Constructs a new IR generation context.
	 * @param documentUri The URI of the document being lowered.
	 * @param registry The registry for resolving AST node converters.
	 * @param symbols The document's action symbols.
	 * @param ids The ID generator.
	 */
	public IrGenContext(String documentUri, IrConverterRegistry registry, SymbolTable symbols, IdGenerator ids) {
		this.documentUri = documentUri;
		this.registry = registry;
		this.symbols = symbols;
		this.ids = ids;
	}

	/**
	 * Converts the given AST node by resolving and invoking the appropriate converter.
	 * @param node The node to convert.
	 * @throws TransformException if the node cannot be lowered.
	 */
	public void convert(AstNode node) throws TransformException {
		registry.resolve(node).convert(node, this);
	}

	// --- Paths and IDs ---

	/**
	 * Enters a path segment; IDs created until the matching {@link #popPath()} are nested under it.
	 * @param segment The segment, e.g. {@code event[3]}.
	 */
	public void pushPath(String segment) {
		path.addLast(segment);
	}

	/**
	 * Leaves the innermost path segment.
	 */
	public void popPath() {
		if (!path.isEmpty()) path.removeLast();
	}

	/**
	 * @return The current structural path.
	 */
	public String currentPath() {
		return String.join("/", path);
	}

	/**
	 * @param relativePath A path relative to the current one, or empty for the current path itself.
	 * @return The deterministic ID for that path.
	 */
	public String idFor(String relativePath) {
		String current = currentPath();
		String full = relativePath.isEmpty() ? current : (current.isEmpty() ? relativePath : current + "/" + relativePath);
		return ids.idFor(documentUri, full);
	}

	// --- Emission ---

	/**
	 * Starts collecting the actions of a new timeline and resets the cursor to zero.
	 */
	public void beginTimeline() {
		timelineActions = new ArrayList<>();
		staggerBlocks = new ArrayList<>();
		cursor = 0;
	}

	/**
	 * @return The actions emitted since {@link #beginTimeline()}.
	 */
	public List<IrTimelineAction> endTimeline() {
		List<IrTimelineAction> result = List.copyOf(timelineActions);
		timelineActions = new ArrayList<>();
		return result;
	}

	/**
	 * Emits a timeline action and moves the cursor to its end.
	 * @param action The action.
	 */
	public void emitAction(IrTimelineAction action) {
		timelineActions.add(action);
		cursor = action.duration().end();
	}

	/**
	 * Records the timing of a stagger block of the current timeline. The cursor does not move.
	 * @param block The block.
	 */
	public void emitStaggerBlock(IrStaggerBlock block) {
		staggerBlocks.add(block);
	}

	/**
	 * @return The stagger blocks recorded since {@link #beginTimeline()}.
	 */
	public List<IrStaggerBlock> staggerBlocks() {
		return List.copyOf(staggerBlocks);
	}

	/**
	 * Emits a lowered action definition.
	 * @param definition The definition.
	 */
	public void emitDefinition(IrActionDefinition definition) {
		definitions.add(definition);
	}

	/**
	 * @return The definitions emitted so far.
	 */
	public List<IrActionDefinition> definitions() {
		return List.copyOf(definitions);
	}

	/**
	 * @return The end time of the most recently emitted action of the current timeline, 0 if none.
	 */
	public double cursor() {
		return cursor;
	}

	// --- Operations ---

	/**
	 * Lowers a list of calls. Each call gets the ID of {@code <prefix>[index]} under the current path.
	 *
	 * @param calls  The calls.
	 * @param prefix The path prefix, e.g. {@code start}.
	 * @param item   The current stagger item, or {@code null} outside of stagger blocks.
	 * @return The lowered operations in source order.
	 * @throws TransformException if a call is malformed.
	 */
	public List<IrOperation> lowerCalls(List<OperationCall> calls, String prefix, IrValue item) throws TransformException {
		List<IrOperation> out = new ArrayList<>(calls.size());
		for (int i = 0; i < calls.size(); i++) {
			out.add(lowerCall(calls.get(i), idFor(prefix + "[" + i + "]"), item));
		}
		return out;
	}

	/**
	 * Lowers a single call. The callee becomes an {@link IrOperation.ActionCall} when it names an
	 * action of this document and an {@link IrOperation.RawOperation} otherwise; unknown names are
	 * left for the validator.
	 * <p>
	 * Inside a stagger block, an argument-less call of an action with parameters receives the item
	 * as its first argument.
	 */
	private IrOperation lowerCall(OperationCall call, String id, IrValue item) throws TransformException {
		if (call == null || call.name() == null || call.name().isBlank()) {
			throw new TransformException("Operation call without a callee name", call != null ? call.source() : null);
		}
		List<IrArgument> args = new ArrayList<>(call.arguments().size());
		for (Argument a : call.arguments()) {
			args.add(new IrArgument(a.name(), lowerValue(a.value(), item)));
		}
		Optional<Symbol> action = symbols.resolveAction(call.name());
		if (action.isPresent()) {
			if (item != null && args.isEmpty() && !action.get().parameters().isEmpty()) {
				args.add(new IrArgument(null, item));
			}
			return new IrOperation.ActionCall(id, call.name(), args, call.source());
		}
		return new IrOperation.RawOperation(id, call.name(), args, call.source());
	}

	/**
	 * Lowers an argument expression.
	 *
	 * @param expression The expression.
	 * @param item       The value that item references stand for, or {@code null} outside of stagger blocks.
	 * @return The IR value.
	 * @throws TransformException if the expression is null or an item reference appears outside a stagger block.
	 */
	public IrValue lowerValue(Expression expression, IrValue item) throws TransformException {
		if (expression == null) {
			throw new TransformException("Missing argument expression");
		}
		if (expression instanceof Expression.StringLiteral s) return new IrValue.Str(s.value());
		if (expression instanceof Expression.NumberLiteral n) return new IrValue.Num(n.value());
		if (expression instanceof Expression.BooleanLiteral b) return new IrValue.Bool(b.value());
		if (expression instanceof Expression.NullLiteral) return new IrValue.Null();
		if (expression instanceof Expression.PropertyChain p) return new IrValue.Ref(p.text());
		if (expression instanceof Expression.ArrayLiteral a) {
			List<IrValue> elements = new ArrayList<>(a.elements().size());
			for (Expression e : a.elements()) elements.add(lowerValue(e, item));
			return new IrValue.ListVal(elements);
		}
		if (expression instanceof Expression.ObjectLiteral o) {
			Map<String, IrValue> entries = new LinkedHashMap<>();
			for (Map.Entry<String, Expression> e : o.entries().entrySet()) {
				entries.put(e.getKey(), lowerValue(e.getValue(), item));
			}
			return new IrValue.MapVal(entries);
		}
		if (expression instanceof Expression.ItemReference ref) {
			if (item == null) {
				throw new TransformException("Stagger item reference outside of a stagger block", ref.source());
			}
			return item;
		}
		throw new TransformException("Unsupported expression kind " + expression.getClass().getSimpleName(), expression.source());
	}

	/**
	 * @param body An event body.
	 * @return A readable action name: the first callee, or {@code "action"} for an empty body.
	 */
	public String nameOf(EventBody body) {
		if (!body.startCalls().isEmpty()) return body.startCalls().get(0).name();
		if (!body.endCalls().isEmpty()) return body.endCalls().get(0).name();
		return "action";
	}
}
