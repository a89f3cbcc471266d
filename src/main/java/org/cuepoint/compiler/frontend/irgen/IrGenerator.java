package org.cuepoint.compiler.frontend.irgen;

import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.frontend.ast.ActionDefinition;
import org.cuepoint.compiler.frontend.ast.DefaultImport;
import org.cuepoint.compiler.frontend.ast.ImportCategory;
import org.cuepoint.compiler.frontend.ast.ImportStatement;
import org.cuepoint.compiler.frontend.ast.LanguageEntry;
import org.cuepoint.compiler.frontend.ast.Program;
import org.cuepoint.compiler.frontend.ast.Timeline;
import org.cuepoint.compiler.frontend.ast.TimelineEvent;
import org.cuepoint.compiler.frontend.semantics.Symbol;
import org.cuepoint.compiler.frontend.semantics.SymbolTable;
import org.cuepoint.compiler.ir.IrDocument;
import org.cuepoint.compiler.ir.IrLanguage;
import org.cuepoint.compiler.ir.IrStaggerBlock;
import org.cuepoint.compiler.ir.IrTimeline;
import org.cuepoint.compiler.ir.IrTimelineAction;
import org.cuepoint.compiler.ir.TimelineProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase: Generates IR from a parsed document by delegating to converters
 * resolved via the {@link IrConverterRegistry}.
 * <p>
 * Lowering is total for every tree the parser can produce: each event yields its actions, none are
 * dropped, and unknown callee names are kept for the validator. It never touches registries or files.
 */
public final class IrGenerator {

	private static final Logger LOG = LoggerFactory.getLogger(IrGenerator.class);

	private final IrConverterRegistry registry;
	private final IdGenerator ids;

	/**
	 * Creates a new IR generator.
	 *
	 * @param registry The converter registry.
	 * @param ids      The ID generator.
	 */
	public IrGenerator(IrConverterRegistry registry, IdGenerator ids) {
		this.registry = registry;
		this.ids = ids;
	}

	/**
	 * Creates a generator with the default converters and name-based IDs.
	 */
	public IrGenerator() {
		this(IrConverterRegistry.initializeWithDefaults(), new NameBasedIdGenerator());
	}

	/**
	 * Lowers a document.
	 *
	 * @param program The parsed document.
	 * @return The IR document.
	 * @throws TransformException if the tree violates the parser contract.
	 */
	public IrDocument generate(Program program) throws TransformException {
		if (program == null) {
			throw new TransformException("No program to lower");
		}
		SymbolTable symbols = new SymbolTable();
		for (ActionDefinition def : program.actions()) {
			symbols.define(new Symbol(def.name(), Symbol.Type.ACTION, def.parameters(), def.source()));
		}

		IrGenContext ctx = new IrGenContext(program.documentUri(), registry, symbols, ids);

		List<ActionDefinition> actions = program.actions();
		for (int i = 0; i < actions.size(); i++) {
			ctx.pushPath("action[" + i + "]");
			try {
				ctx.convert(actions.get(i));
			} finally {
				ctx.popPath();
			}
		}

		List<IrTimeline> timelines = new ArrayList<>();
		List<Timeline> sourceTimelines = program.timelines();
		for (int t = 0; t < sourceTimelines.size(); t++) {
			ctx.pushPath("timeline[" + t + "]");
			try {
				timelines.add(lowerTimeline(sourceTimelines.get(t), ctx));
			} finally {
				ctx.popPath();
			}
		}

		List<IrLanguage> languages = new ArrayList<>();
		if (program.languages() != null) {
			for (LanguageEntry e : program.languages().entries()) {
				languages.add(new IrLanguage(e.code(), e.label(), e.isDefault(), e.source()));
			}
		}

		IrDocument document = new IrDocument(
				ids.idFor(program.documentUri(), "document"),
				program.documentUri(),
				layoutTemplateOf(program),
				languages,
				ctx.definitions(),
				timelines);
		if (LOG.isDebugEnabled()) {
			int actionCount = timelines.stream().mapToInt(tl -> tl.actions().size()).sum();
			LOG.debug("Lowered {}: {} timeline(s), {} timeline action(s), {} action definition(s)",
					program.documentUri(), timelines.size(), actionCount, document.actions().size());
		}
		return document;
	}

	private IrTimeline lowerTimeline(Timeline timeline, IrGenContext ctx) throws TransformException {
		TimelineProvider provider = TimelineProvider.fromKeyword(timeline.provider())
				.orElseThrow(() -> new TransformException("Unknown timeline provider '" + timeline.provider() + "'", timeline.source()));

		ctx.beginTimeline();
		List<TimelineEvent> events = timeline.events();
		for (int e = 0; e < events.size(); e++) {
			TimelineEvent event = events.get(e);
			if (event == null) {
				throw new TransformException("Null event in timeline '" + timeline.name() + "'", timeline.source());
			}
			ctx.pushPath("event[" + e + "]");
			try {
				ctx.convert(event);
			} finally {
				ctx.popPath();
			}
		}
		List<IrStaggerBlock> staggerBlocks = ctx.staggerBlocks();
		List<IrTimelineAction> actions = ctx.endTimeline();

		return new IrTimeline(
				ctx.idFor(""),
				timeline.name(),
				provider,
				timeline.containerSelector(),
				timeline.sourceFile(),
				actions,
				staggerBlocks,
				timeline.source());
	}

	private static String layoutTemplateOf(Program program) {
		for (ImportStatement imp : program.imports()) {
			if (imp instanceof DefaultImport d && d.category() == ImportCategory.LAYOUT) {
				return d.path();
			}
		}
		return null;
	}
}
