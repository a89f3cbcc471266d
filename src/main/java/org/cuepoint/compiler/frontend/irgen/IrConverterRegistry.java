package org.cuepoint.compiler.frontend.irgen;

import org.cuepoint.compiler.frontend.ast.ActionDefinition;
import org.cuepoint.compiler.frontend.ast.AstNode;
import org.cuepoint.compiler.frontend.ast.TimelineEvent;
import org.cuepoint.compiler.frontend.irgen.converters.ActionDefinitionConverter;
import org.cuepoint.compiler.frontend.irgen.converters.SequenceBlockConverter;
import org.cuepoint.compiler.frontend.irgen.converters.StaggerBlockConverter;
import org.cuepoint.compiler.frontend.irgen.converters.TimedEventConverter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps syntax tree node types to the converters that lower them.
 * <p>
 * Nodes are records, so lookup tries the node's own class and then the interfaces it
 * implements directly (e.g. a converter registered for a sealed event interface). Anything
 * else goes to the fallback converter.
 */
public final class IrConverterRegistry {

	private final Map<Class<? extends AstNode>, IAstNodeToIrConverter<? extends AstNode>> byType = new HashMap<>();
	private final IAstNodeToIrConverter<AstNode> fallback;

	private IrConverterRegistry(IAstNodeToIrConverter<AstNode> fallback) {
		this.fallback = fallback;
	}

	/**
	 * Registers the converter for a node type, replacing any earlier one.
	 *
	 * @param nodeType  The node record or interface.
	 * @param converter The converter.
	 * @param <T>       The node type.
	 */
	public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
		byType.put(nodeType, converter);
	}

	/**
	 * @param node A syntax tree node.
	 * @return The converter for the node; the fallback if none is registered.
	 */
	@SuppressWarnings("unchecked")
	public IAstNodeToIrConverter<AstNode> resolve(AstNode node) {
		IAstNodeToIrConverter<?> found = byType.get(node.getClass());
		if (found == null) {
			for (Class<?> i : node.getClass().getInterfaces()) {
				found = byType.get(i);
				if (found != null) break;
			}
		}
		return found != null ? (IAstNodeToIrConverter<AstNode>) found : fallback;
	}

	/**
	 * Lists the permitted subtypes of a sealed node type that have no registered converter.
	 *
	 * @param sealedType A sealed AST interface.
	 * @return The uncovered subtypes, empty when every subtype has a converter.
	 */
	public List<Class<?>> uncoveredSubtypes(Class<? extends AstNode> sealedType) {
		List<Class<?>> missing = new ArrayList<>();
		Class<?>[] permitted = sealedType.getPermittedSubclasses();
		if (permitted == null) return missing;
		for (Class<?> sub : permitted) {
			if (!byType.containsKey(sub)) missing.add(sub);
		}
		return missing;
	}

	/**
	 * @param fallback The converter for node types nobody registered.
	 * @return An empty registry.
	 */
	public static IrConverterRegistry initialize(IAstNodeToIrConverter<AstNode> fallback) {
		return new IrConverterRegistry(fallback);
	}

	/**
	 * Builds the registry used by {@link IrGenerator}: one converter per timeline event kind
	 * plus the action definition converter, with a fallback that rejects everything else.
	 *
	 * @return The populated registry.
	 * @throws IllegalStateException if a timeline event kind has no converter.
	 */
	public static IrConverterRegistry initializeWithDefaults() {
		IrConverterRegistry reg = initialize(new DefaultAstNodeToIrConverter());
		reg.register(ActionDefinition.class, new ActionDefinitionConverter());
		reg.register(TimelineEvent.TimedEvent.class, new TimedEventConverter());
		reg.register(TimelineEvent.SequenceBlock.class, new SequenceBlockConverter());
		reg.register(TimelineEvent.StaggerBlock.class, new StaggerBlockConverter());
		List<Class<?>> missing = reg.uncoveredSubtypes(TimelineEvent.class);
		if (!missing.isEmpty()) {
			throw new IllegalStateException("Timeline event kinds without IR converter: " + missing);
		}
		return reg;
	}
}
