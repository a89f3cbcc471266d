package org.cuepoint.compiler.ir;

import java.util.List;
import java.util.Optional;

/**
 * The lowered form of one document. Instances are immutable; later stages
 * return modified copies.
 *
 * @param id             The deterministic configuration ID.
 * @param documentUri    The URI of the source document.
 * @param layoutTemplate The layout import path, or {@code null}.
 * @param languages      The declared languages in source order.
 * @param actions        The user-defined actions in source order.
 * @param timelines      The timelines in source order.
 */
public record IrDocument(
		String id,
		String documentUri,
		String layoutTemplate,
		List<IrLanguage> languages,
		List<IrActionDefinition> actions,
		List<IrTimeline> timelines
) {
	public IrDocument {
		languages = List.copyOf(languages);
		actions = List.copyOf(actions);
		timelines = List.copyOf(timelines);
	}

	/**
	 * @param newTimelines The replacement timelines.
	 * @return A copy of this document with the given timelines.
	 */
	public IrDocument withTimelines(List<IrTimeline> newTimelines) {
		return new IrDocument(id, documentUri, layoutTemplate, languages, actions, newTimelines);
	}

	/**
	 * Finds the first action definition with the given name.
	 *
	 * @param name The action name.
	 * @return The definition, if any.
	 */
	public Optional<IrActionDefinition> findAction(String name) {
		return actions.stream().filter(a -> a.name().equals(name)).findFirst();
	}
}
