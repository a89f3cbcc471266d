package org.cuepoint.compiler.backend.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.cuepoint.compiler.api.EmitException;
import org.cuepoint.compiler.ir.IrActionDefinition;
import org.cuepoint.compiler.ir.IrDocument;
import org.cuepoint.compiler.ir.IrLanguage;
import org.cuepoint.compiler.ir.IrOperation;
import org.cuepoint.compiler.ir.IrTimeline;
import org.cuepoint.compiler.ir.IrTimelineAction;
import org.cuepoint.compiler.operations.OperationCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Phase: writes an optimized {@link IrDocument} as the runtime JSON configuration.
 * <p>
 * Field order is fixed and all IDs come from the IR, so the same document always produces
 * byte-identical output. A value the configuration cannot represent stops emission with an
 * {@link EmitException} naming the field path.
 */
public final class Emitter {

	private static final Logger LOG = LoggerFactory.getLogger(Emitter.class);

	private final ObjectMapper mapper = new ObjectMapper();
	private final OperationCatalog catalog;
	private final EmitterOptions options;

	/**
	 * @param catalog The operation catalog used to name positional arguments.
	 * @param options The document-independent settings.
	 */
	public Emitter(OperationCatalog catalog, EmitterOptions options) {
		this.catalog = catalog;
		this.options = options;
	}

	/**
	 * Serializes the document.
	 *
	 * @param document The document to emit.
	 * @return The configuration JSON.
	 * @throws EmitException if a value cannot be represented.
	 */
	public String emit(IrDocument document) throws EmitException {
		ObjectNode root = toJson(document);
		try {
			String json = options.prettyPrint()
					? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root)
					: mapper.writeValueAsString(root);
			LOG.debug("Emitted configuration {} ({} characters)", document.id(), json.length());
			return json;
		} catch (JsonProcessingException e) {
			throw new EmitException("Failed to serialize configuration: " + e.getOriginalMessage(), "$", e);
		}
	}

	/**
	 * Builds the configuration tree without serializing it.
	 *
	 * @param document The document to emit.
	 * @return The configuration root object.
	 * @throws EmitException if a value cannot be represented.
	 */
	public ObjectNode toJson(IrDocument document) throws EmitException {
		OperationDataMapper operations = new OperationDataMapper(catalog, document);

		ObjectNode root = mapper.createObjectNode();
		root.put("$schema", options.schemaUrl());
		root.put("id", document.id());
		root.putObject("engine").put("systemName", options.engineSystemName());
		root.put("containerSelector", options.defaultContainerSelector());
		root.put("language", defaultLanguage(document.languages()));
		root.put("layoutTemplate", document.layoutTemplate() != null
				? document.layoutTemplate()
				: options.defaultLayoutTemplate());
		root.set("availableLanguages", languages(document.languages()));
		root.putArray("labels");
		root.putArray("initActions");

		ArrayNode actions = root.putArray("actions");
		for (int i = 0; i < document.actions().size(); i++) {
			actions.add(action(document.actions().get(i), "actions[" + i + "]", operations));
		}
		root.putArray("eventActions");

		ArrayNode timelines = root.putArray("timelines");
		for (int i = 0; i < document.timelines().size(); i++) {
			timelines.add(timeline(document.timelines().get(i), "timelines[" + i + "]", operations));
		}
		return root;
	}

	private String defaultLanguage(List<IrLanguage> languages) {
		for (IrLanguage l : languages) {
			if (l.isDefault()) return l.code();
		}
		if (languages.size() == 1) return languages.get(0).code();
		return options.defaultLanguage();
	}

	private ArrayNode languages(List<IrLanguage> languages) {
		ArrayNode array = mapper.createArrayNode();
		if (languages.isEmpty()) {
			ObjectNode fallback = array.addObject();
			fallback.put("code", options.defaultLanguage());
			fallback.put("label", options.defaultLanguage());
			return array;
		}
		for (IrLanguage l : languages) {
			ObjectNode node = array.addObject();
			node.put("code", l.code());
			node.put("label", l.label());
		}
		return array;
	}

	private ObjectNode action(IrActionDefinition definition, String path, OperationDataMapper operations) throws EmitException {
		ObjectNode node = mapper.createObjectNode();
		node.put("id", definition.id());
		node.put("name", definition.name());
		node.set("startOperations", startList(definition.startOperations(), path + ".startOperations", operations));
		node.set("endOperations", endList(List.of(), definition.endOperations(), path + ".endOperations", operations));
		return node;
	}

	private ObjectNode timeline(IrTimeline timeline, String path, OperationDataMapper operations) throws EmitException {
		ObjectNode node = mapper.createObjectNode();
		node.put("id", timeline.id());
		if (timeline.mediaSource() != null) {
			node.put("uri", timeline.mediaSource());
		}
		node.put("type", timeline.provider().runtimeType());
		ArrayNode actions = mapper.createArrayNode();
		for (int i = 0; i < timeline.actions().size(); i++) {
			actions.add(timelineAction(timeline.actions().get(i), path + ".timelineActions[" + i + "]", operations));
		}
		node.set("duration", JsonValues.number(timeline.duration(), path + ".duration"));
		node.put("loop", false);
		node.put("selector", timeline.containerSelector());
		node.set("timelineActions", actions);
		return node;
	}

	private ObjectNode timelineAction(IrTimelineAction action, String path, OperationDataMapper operations) throws EmitException {
		ObjectNode node = mapper.createObjectNode();
		node.put("id", action.id());
		node.put("name", action.name());
		ObjectNode duration = node.putObject("duration");
		duration.set("start", JsonValues.number(action.duration().start(), path + ".duration.start"));
		duration.set("end", JsonValues.number(action.duration().end(), path + ".duration.end"));
		node.set("startOperations", startList(action.startOperations(), path + ".startOperations", operations));
		node.set("endOperations", endList(action.startOperations(), action.endOperations(), path + ".endOperations", operations));
		return node;
	}

	private ArrayNode startList(List<IrOperation> start, String path, OperationDataMapper operations) throws EmitException {
		ArrayNode array = mapper.createArrayNode();
		for (IrOperation op : start) {
			operations.append(op, array, path);
		}
		return array;
	}

	/**
	 * Builds an end list: the end halves of endable action calls in {@code start}, followed by the
	 * operations listed for the end phase.
	 */
	private ArrayNode endList(List<IrOperation> start, List<IrOperation> end, String path, OperationDataMapper operations) throws EmitException {
		ArrayNode array = mapper.createArrayNode();
		for (IrOperation op : start) {
			operations.appendEndCounterpart(op, array, path);
		}
		for (IrOperation op : end) {
			operations.append(op, array, path);
		}
		return array;
	}
}
