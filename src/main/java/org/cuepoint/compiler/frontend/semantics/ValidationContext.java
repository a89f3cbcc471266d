package org.cuepoint.compiler.frontend.semantics;

import org.cuepoint.compiler.ir.ActionOrigin;
import org.cuepoint.compiler.ir.IrActionDefinition;
import org.cuepoint.compiler.ir.IrArgument;
import org.cuepoint.compiler.ir.IrDocument;
import org.cuepoint.compiler.ir.IrOperation;
import org.cuepoint.compiler.ir.IrTimeline;
import org.cuepoint.compiler.ir.IrTimelineAction;
import org.cuepoint.compiler.operations.OperationCatalog;
import org.cuepoint.compiler.registry.Registries;
import org.cuepoint.compiler.util.StringSimilarity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything a validation rule may look at. Rules read the context and report to a
 * diagnostics engine; they never modify anything reachable from here.
 *
 * @param document              The lowered document.
 * @param imports               The document's imports.
 * @param registries            The registries, read only.
 * @param catalog               The built-in operation catalog.
 * @param maxSuggestionDistance The largest edit distance for "did you mean" suggestions.
 */
public record ValidationContext(
        IrDocument document,
        ImportGraph imports,
        Registries registries,
        OperationCatalog catalog,
        int maxSuggestionDistance
) {

    private static final int PREVIEW_SIZE = 5;

    /**
     * @return The URI of the document under validation.
     */
    public String documentUri() {
        return document.documentUri();
    }

    /**
     * One operation to check, together with what it shares with the other copies of a stagger body.
     * <p>
     * A stagger block is lowered to one copy of its body per item. Arguments that are equal in every
     * copy of a block come from the body itself and are reported on the first item only.
     *
     * @param operation       The operation.
     * @param staggerCopy     Whether the operation belongs to a stagger item after the first.
     * @param sharedArguments Positions of the arguments that are equal in every copy of the block.
     */
    public record OperationSite(IrOperation operation, boolean staggerCopy, Set<Integer> sharedArguments) {

        public OperationSite {
            sharedArguments = Set.copyOf(sharedArguments);
        }

        /**
         * @param index An argument position.
         * @return Whether the argument was already seen on the first item of the same stagger block.
         */
        public boolean repeatsArgument(int index) {
            return staggerCopy && sharedArguments.contains(index);
        }
    }

    /**
     * @return All operations of the document: those of action definitions first, then those of
     *         timeline actions, each in execution order.
     */
    public List<OperationSite> operationSites() {
        List<OperationSite> out = new ArrayList<>();
        for (IrActionDefinition def : document.actions()) {
            def.startOperations().forEach(op -> out.add(new OperationSite(op, false, Set.of())));
            def.endOperations().forEach(op -> out.add(new OperationSite(op, false, Set.of())));
        }
        for (IrTimeline timeline : document.timelines()) {
            List<IrTimelineAction> actions = timeline.actions();
            int i = 0;
            while (i < actions.size()) {
                int blockEnd = i + 1;
                if (actions.get(i).origin() instanceof ActionOrigin.StaggerItem) {
                    while (blockEnd < actions.size()
                            && actions.get(blockEnd).origin() instanceof ActionOrigin.StaggerItem item
                            && item.index() > 0) {
                        blockEnd++;
                    }
                }
                addBlock(actions.subList(i, blockEnd), out);
                i = blockEnd;
            }
        }
        return out;
    }

    private static void addBlock(List<IrTimelineAction> copies, List<OperationSite> out) {
        List<List<IrOperation>> start = new ArrayList<>();
        List<List<IrOperation>> end = new ArrayList<>();
        for (IrTimelineAction copy : copies) {
            start.add(copy.startOperations());
            end.add(copy.endOperations());
        }
        for (int k = 0; k < copies.size(); k++) {
            addCopy(start, k, out);
            addCopy(end, k, out);
        }
    }

    private static void addCopy(List<List<IrOperation>> copies, int k, List<OperationSite> out) {
        List<IrOperation> ops = copies.get(k);
        for (int p = 0; p < ops.size(); p++) {
            out.add(new OperationSite(ops.get(p), k > 0, sharedArguments(copies, p)));
        }
    }

    private static Set<Integer> sharedArguments(List<List<IrOperation>> copies, int position) {
        List<IrOperation> first = copies.get(0);
        if (position >= first.size()) {
            return Set.of();
        }
        List<IrArgument> reference = first.get(position).arguments();
        Set<Integer> shared = new HashSet<>();
        for (int a = 0; a < reference.size(); a++) {
            shared.add(a);
        }
        for (List<IrOperation> ops : copies) {
            if (ops.size() != first.size()) {
                return Set.of();
            }
            List<IrArgument> args = ops.get(position).arguments();
            shared.removeIf(a -> a >= args.size() || !args.get(a).equals(reference.get(a)));
        }
        return shared;
    }

    /**
     * Builds the hint for an unknown token: the nearest known token if one is close enough,
     * otherwise a preview of the known tokens.
     *
     * @param token          The unknown token.
     * @param candidates     The known tokens, in registry order.
     * @param availableLabel The label of the preview, e.g. {@code Available label IDs}.
     * @return The hint, or {@code null} when there are no candidates at all.
     */
    public String suggestionHint(String token, Collection<String> candidates, String availableLabel) {
        Optional<String> closest = StringSimilarity.closest(token, candidates, maxSuggestionDistance);
        if (closest.isPresent()) {
            return "Did you mean: '" + closest.get() + "'?";
        }
        if (candidates.isEmpty()) {
            return null;
        }
        String preview = candidates.stream().limit(PREVIEW_SIZE).collect(Collectors.joining(", "));
        return availableLabel + ": " + preview + (candidates.size() > PREVIEW_SIZE ? ", ..." : "");
    }
}
