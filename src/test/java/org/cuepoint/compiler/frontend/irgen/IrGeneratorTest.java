package org.cuepoint.compiler.frontend.irgen;

import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.frontend.ast.ImportCategory;
import org.cuepoint.compiler.frontend.ast.Program;
import org.cuepoint.compiler.frontend.ast.TimelineEvent;
import org.cuepoint.compiler.ir.ActionOrigin;
import org.cuepoint.compiler.ir.IrDocument;
import org.cuepoint.compiler.ir.IrOperation;
import org.cuepoint.compiler.ir.IrTimeline;
import org.cuepoint.compiler.ir.IrTimelineAction;
import org.cuepoint.compiler.ir.IrValue;
import org.cuepoint.compiler.ir.TimelineProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.cuepoint.compiler.AstFixtures.*;

/**
 * Unit tests for {@link IrGenerator}: timing of every event kind, callee resolution and ID stability.
 */
@Tag("unit")
class IrGeneratorTest {

    private final IrGenerator generator = new IrGenerator();

    private IrTimeline lowerSingle(TimelineEvent... events) throws TransformException {
        IrDocument doc = generator.generate(program(raf(events)));
        assertThat(doc.timelines()).hasSize(1);
        return doc.timelines().get(0);
    }

    @Test
    void spanEventUsesStartAndEnd() throws TransformException {
        IrTimeline tl = lowerSingle(span("1s", "5s", call("selectElement", str("#title"))));

        IrTimelineAction action = tl.actions().get(0);
        assertThat(action.duration().start()).isEqualTo(1.0);
        assertThat(action.duration().end()).isEqualTo(5.0);
        assertThat(action.name()).isEqualTo("selectElement");
        assertThat(action.origin()).isInstanceOf(ActionOrigin.Timed.class);
    }

    @Test
    void pointEventEndsAfterItsDuration() throws TransformException {
        IrTimeline tl = lowerSingle(point("2s", "500ms", call("log")));

        assertThat(tl.actions().get(0).duration().start()).isEqualTo(2.0);
        assertThat(tl.actions().get(0).duration().end()).isEqualTo(2.5);
    }

    @Test
    void sequenceStepsAreCumulative() throws TransformException {
        // Given
        TimelineEvent seq = sequence(step("2s", call("log")), step("3s", call("log")), step("1s", call("log")));

        // When
        IrTimeline tl = lowerSingle(seq);

        // Then
        assertThat(tl.actions()).extracting(a -> a.duration().start()).containsExactly(0.0, 2.0, 5.0);
        assertThat(tl.actions()).extracting(a -> a.duration().end()).containsExactly(2.0, 5.0, 6.0);
        assertThat(tl.actions().get(1).origin()).isEqualTo(new ActionOrigin.SequenceStep(1, 3.0));
    }

    @Test
    void sequenceStartsAtTheEndOfThePreviousEvent() throws TransformException {
        IrTimeline tl = lowerSingle(span("0s", "4s", call("log")), sequence(step("1s", call("log"))));

        assertThat(tl.actions().get(1).duration().start()).isEqualTo(4.0);
        assertThat(tl.actions().get(1).duration().end()).isEqualTo(5.0);
    }

    @Test
    void staggerOffsetsEachItemByTheDelay() throws TransformException {
        // Given
        TimelineEvent block = stagger("200ms", List.of(str(".a"), str(".b"), str(".c")), "1s",
                call("selectElement", item()));

        // When
        IrTimeline tl = lowerSingle(block);

        // Then
        assertThat(tl.actions()).hasSize(3);
        assertThat(tl.actions()).extracting(a -> a.duration().start()).containsExactly(0.0, 0.2, 0.4);
        assertThat(tl.actions().get(2).duration().end()).isCloseTo(1.4, within(1e-9));
        IrOperation op = tl.actions().get(1).startOperations().get(0);
        assertThat(op.arguments().get(0).value()).isEqualTo(new IrValue.Str(".b"));
        assertThat(tl.actions().get(0).origin()).isEqualTo(new ActionOrigin.StaggerItem(0, 0.2, 1.0));
    }

    @Test
    void staggerWithoutItemsStillRecordsItsTiming() throws TransformException {
        IrTimeline tl = lowerSingle(stagger("0s", List.of(), "2s", call("log")));

        assertThat(tl.actions()).isEmpty();
        assertThat(tl.staggerBlocks()).singleElement().satisfies(block -> {
            assertThat(block.delay()).isZero();
            assertThat(block.itemDuration()).isEqualTo(2.0);
            assertThat(block.itemCount()).isZero();
        });
    }

    @Test
    void staggerBindsItemToFirstParameterOfArgumentlessActionCall() throws TransformException {
        // Given
        Program program = program(List.of(),
                List.of(action("highlight", List.of("selector"), call("selectElement", ref("operationdata", "selector")))),
                raf(stagger("1s", List.of(str("#one"), str("#two")), "1s", call("highlight"))));

        // When
        IrDocument doc = generator.generate(program);

        // Then
        IrOperation op = doc.timelines().get(0).actions().get(1).startOperations().get(0);
        assertThat(op).isInstanceOf(IrOperation.ActionCall.class);
        assertThat(op.arguments()).hasSize(1);
        assertThat(op.arguments().get(0).value()).isEqualTo(new IrValue.Str("#two"));
    }

    @Test
    void callsToDefinedActionsBecomeActionCalls() throws TransformException {
        Program program = program(List.of(),
                List.of(action("fadeIn", List.of(), call("addClass", str("visible")))),
                raf(span("0s", "1s", call("fadeIn"), call("unknownThing"))));

        IrDocument doc = generator.generate(program);

        List<IrOperation> ops = doc.timelines().get(0).actions().get(0).startOperations();
        assertThat(ops.get(0)).isInstanceOf(IrOperation.ActionCall.class);
        assertThat(ops.get(1)).isInstanceOf(IrOperation.RawOperation.class);
        assertThat(((IrOperation.RawOperation) ops.get(1)).systemName()).isEqualTo("unknownThing");
        assertThat(doc.actions()).hasSize(1);
        assertThat(doc.actions().get(0).startOperations()).hasSize(1);
    }

    @Test
    void loweringIsDeterministic() throws TransformException {
        Program program = program(raf(span("0s", "1s", call("log")), sequence(step("1s", call("log")))));

        IrDocument first = generator.generate(program);
        IrDocument second = new IrGenerator().generate(program);

        assertThat(second).isEqualTo(first);
        assertThat(first.timelines().get(0).actions()).extracting(IrTimelineAction::id).doesNotHaveDuplicates();
    }

    @Test
    void keepsProviderSourceAndLayout() throws TransformException {
        Program program = program(List.of(defaultImport(ImportCategory.LAYOUT, "./layout.html")), List.of(),
                timeline("video", "./intro.mp4", span("0s", "1s", call("log"))));

        IrDocument doc = generator.generate(program);

        assertThat(doc.layoutTemplate()).isEqualTo("./layout.html");
        assertThat(doc.timelines().get(0).provider()).isEqualTo(TimelineProvider.VIDEO);
        assertThat(doc.timelines().get(0).mediaSource()).isEqualTo("./intro.mp4");
    }

    @Test
    void unknownProviderIsAStructuralError() {
        Program program = program(timeline("hologram", null, span("0s", "1s", call("log"))));

        assertThatThrownBy(() -> generator.generate(program))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("hologram");
    }

    @Test
    void itemReferenceOutsideStaggerIsAStructuralError() {
        Program program = program(raf(span("0s", "1s", call("selectElement", item()))));

        assertThatThrownBy(() -> generator.generate(program))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("outside of a stagger block");
    }

    @Test
    void defaultRegistryCoversEveryTimelineEvent() {
        IrConverterRegistry registry = IrConverterRegistry.initializeWithDefaults();

        assertThat(registry.uncoveredSubtypes(TimelineEvent.class)).isEmpty();
    }

    @Test
    void registryWithoutConvertersFallsBackToFailingConverter() {
        IrGenerator bare = new IrGenerator(IrConverterRegistry.initialize(new DefaultAstNodeToIrConverter()),
                new NameBasedIdGenerator());

        assertThatThrownBy(() -> bare.generate(program(raf(span("0s", "1s", call("log"))))))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("No IR converter registered");
    }
}
