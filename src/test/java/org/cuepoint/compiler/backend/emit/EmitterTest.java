package org.cuepoint.compiler.backend.emit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.cuepoint.compiler.api.EmitException;
import org.cuepoint.compiler.api.SourceInfo;
import org.cuepoint.compiler.ir.IrActionDefinition;
import org.cuepoint.compiler.ir.IrDocument;
import org.cuepoint.compiler.ir.IrLanguage;
import org.cuepoint.compiler.ir.IrOperation;
import org.cuepoint.compiler.ir.IrValue;
import org.cuepoint.compiler.ir.TimelineProvider;
import org.cuepoint.compiler.operations.OperationCatalog;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.cuepoint.compiler.IrFixtures.*;

/**
 * Unit tests for {@link Emitter}: schema shape, operation mapping and error paths.
 */
@Tag("unit")
class EmitterTest {

    private static final OperationCatalog CATALOG = OperationCatalog.loadDefault();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Emitter emitter = new Emitter(CATALOG, EmitterOptions.defaults());

    private static JsonNode parse(String json) throws Exception {
        return MAPPER.readTree(json);
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Test
    void writesTopLevelFieldsInFixedOrder() throws Exception {
        // Given
        IrDocument doc = document(timeline(TimelineProvider.RAF, null, action("a1", 0, 5, raw("op1", "log"))));

        // When
        JsonNode root = parse(emitter.emit(doc));

        // Then
        assertThat(fieldNames(root)).containsExactly("$schema", "id", "engine", "containerSelector", "language",
                "layoutTemplate", "availableLanguages", "labels", "initActions", "actions", "eventActions", "timelines");
        assertThat(root.get("$schema").asText()).endsWith("eligius-configuration.json");
        assertThat(root.get("id").asText()).isEqualTo("doc-1");
        assertThat(root.get("engine").get("systemName").asText()).isEqualTo("Eligius");
        assertThat(root.get("containerSelector").asText()).isEqualTo("body");
        assertThat(root.get("layoutTemplate").asText()).isEqualTo("default");
        assertThat(root.get("language").asText()).isEqualTo("en-US");
        assertThat(root.get("availableLanguages")).hasSize(1);
    }

    @Test
    void writesTimelines() throws Exception {
        IrDocument doc = document(timeline(TimelineProvider.VIDEO, "./intro.mp4",
                action("a1", 0, 5),
                action("a2", 2, 7.5)));

        JsonNode timeline = parse(emitter.emit(doc)).get("timelines").get(0);

        assertThat(fieldNames(timeline)).containsExactly("id", "uri", "type", "duration", "loop", "selector", "timelineActions");
        assertThat(timeline.get("uri").asText()).isEqualTo("./intro.mp4");
        assertThat(timeline.get("type").asText()).isEqualTo("mediaplayer");
        assertThat(timeline.get("duration").asDouble()).isEqualTo(7.5);
        assertThat(timeline.get("loop").asBoolean()).isFalse();
        assertThat(timeline.get("selector").asText()).isEqualTo("#container");
        JsonNode first = timeline.get("timelineActions").get(0);
        assertThat(fieldNames(first)).containsExactly("id", "name", "duration", "startOperations", "endOperations");
        assertThat(first.get("duration").get("start").isIntegralNumber()).isTrue();
        assertThat(first.get("duration").get("end").asInt()).isEqualTo(5);
    }

    @Test
    void animationTimelineHasNoUri() throws Exception {
        JsonNode timeline = parse(emitter.emit(document(timeline(TimelineProvider.RAF, null)))).get("timelines").get(0);

        assertThat(timeline.has("uri")).isFalse();
        assertThat(timeline.get("type").asText()).isEqualTo("animation");
        assertThat(timeline.get("duration").asInt()).isZero();
    }

    @Test
    void namesArgumentsAfterCatalogParameters() throws Exception {
        // Given
        Map<String, IrValue> props = new LinkedHashMap<>();
        props.put("opacity", n(1));
        IrDocument doc = document(timeline(TimelineProvider.RAF, null, action("a1", 0, 1,
                raw("op1", "selectElement", arg(s("#title"))),
                raw("op2", "animate", arg(new IrValue.MapVal(props)), arg(n(250)), arg("animationEasing", s("swing"))),
                raw("op3", "customThing", arg(s("x")), arg("flag", new IrValue.Bool(true))))));

        // When
        JsonNode ops = parse(emitter.emit(doc)).get("timelines").get(0).get("timelineActions").get(0).get("startOperations");

        // Then
        assertThat(ops).hasSize(3);
        assertThat(ops.get(0).get("id").asText()).isEqualTo("op1");
        assertThat(ops.get(0).get("systemName").asText()).isEqualTo("selectElement");
        assertThat(ops.get(0).get("operationData").get("selector").asText()).isEqualTo("#title");
        JsonNode animate = ops.get(1).get("operationData");
        assertThat(fieldNames(animate)).containsExactly("animationProperties", "animationDuration", "animationEasing");
        assertThat(animate.get("animationProperties").get("opacity").asInt()).isEqualTo(1);
        JsonNode custom = ops.get(2).get("operationData");
        assertThat(custom.get("args").get(0).asText()).isEqualTo("x");
        assertThat(custom.get("flag").asBoolean()).isTrue();
    }

    @Test
    void expandsCallsOfEndableActions() throws Exception {
        // Given
        IrActionDefinition fade = new IrActionDefinition("def-1", "fade", List.of("selector"),
                List.of(raw("d1", "selectElement", arg(new IrValue.Ref("$operationdata.selector")))),
                List.of(raw("d2", "removeClass", arg(s("visible")))), true, SourceInfo.UNKNOWN);
        IrOperation call = actionCall("call-1", "fade", arg(s("#box")));
        IrDocument doc = document(List.of(fade), timeline(TimelineProvider.RAF, null, action("a1", 0, 2, call)));

        // When
        JsonNode root = parse(emitter.emit(doc));

        // Then
        JsonNode action = root.get("timelines").get(0).get("timelineActions").get(0);
        JsonNode start = action.get("startOperations");
        assertThat(start).extracting(op -> op.get("systemName").asText()).containsExactly("requestAction", "startAction");
        assertThat(start.get(0).get("operationData").get("systemName").asText()).isEqualTo("fade");
        assertThat(start.get(1).get("operationData").get("actionOperationData").get("selector").asText()).isEqualTo("#box");
        JsonNode end = action.get("endOperations");
        assertThat(end).extracting(op -> op.get("systemName").asText()).containsExactly("requestAction", "endAction");
        assertThat(end.get(1).get("operationData").get("actionOperationData").get("selector").asText()).isEqualTo("#box");

        JsonNode definition = root.get("actions").get(0);
        assertThat(fieldNames(definition)).containsExactly("id", "name", "startOperations", "endOperations");
        assertThat(definition.get("startOperations").get(0).get("operationData").get("selector").asText())
                .isEqualTo("$operationdata.selector");
        assertThat(definition.get("endOperations").get(0).get("operationData").get("className").asText()).isEqualTo("visible");
    }

    @Test
    void plainActionCallsHaveNoEndCounterpart() throws Exception {
        IrActionDefinition log = new IrActionDefinition("def-1", "note", List.of(),
                List.of(raw("d1", "log")), List.of(), false, SourceInfo.UNKNOWN);
        IrDocument doc = document(List.of(log), timeline(TimelineProvider.RAF, null, action("a1", 0, 2, actionCall("c1", "note"))));

        JsonNode action = parse(emitter.emit(doc)).get("timelines").get(0).get("timelineActions").get(0);

        assertThat(action.get("startOperations")).hasSize(2);
        assertThat(action.get("endOperations")).isEmpty();
    }

    @Test
    void expandsAddController() throws Exception {
        IrDocument doc = document(timeline(TimelineProvider.RAF, null, action("a1", 0, 1,
                raw("op1", "addController", arg(s("LabelController")), arg(s("welcome"))))));

        JsonNode ops = parse(emitter.emit(doc)).get("timelines").get(0).get("timelineActions").get(0).get("startOperations");

        assertThat(ops).hasSize(2);
        assertThat(ops.get(0).get("systemName").asText()).isEqualTo("getControllerInstance");
        assertThat(ops.get(0).get("operationData").get("systemName").asText()).isEqualTo("LabelController");
        assertThat(ops.get(1).get("systemName").asText()).isEqualTo("addControllerToElement");
        assertThat(ops.get(1).get("operationData").get("labelId").asText()).isEqualTo("welcome");
        assertThat(ops.get(1).get("id").asText()).isNotEqualTo("op1");
    }

    @Test
    void nonFiniteDurationFailsWithFieldPath() {
        IrDocument doc = document(timeline(TimelineProvider.RAF, null,
                action("a1", 0, 1),
                action("a2", 0, Double.NaN)));

        assertThatThrownBy(() -> emitter.emit(doc))
                .isInstanceOf(EmitException.class)
                .satisfies(e -> assertThat(((EmitException) e).fieldPath())
                        .isEqualTo("timelines[0].timelineActions[1].duration.end"));
    }

    @Test
    void nonFiniteArgumentFailsWithFieldPath() {
        IrDocument doc = document(timeline(TimelineProvider.RAF, null, action("a1", 0, 1,
                raw("op1", "log"),
                raw("op2", "wait", arg(n(Double.POSITIVE_INFINITY))))));

        assertThatThrownBy(() -> emitter.emit(doc))
                .isInstanceOf(EmitException.class)
                .satisfies(e -> assertThat(((EmitException) e).fieldPath())
                        .isEqualTo("timelines[0].timelineActions[0].startOperations[1].operationData.milliseconds"));
    }

    @Test
    void usesDeclaredDefaultLanguageAndLayout() throws Exception {
        IrDocument doc = new IrDocument("doc-1", "file:///x.eligian", "./layout.html",
                List.of(new IrLanguage("en-US", "English", false, SourceInfo.UNKNOWN),
                        new IrLanguage("nl-NL", "Nederlands", true, SourceInfo.UNKNOWN)),
                List.of(), List.of());

        JsonNode root = parse(emitter.emit(doc));

        assertThat(root.get("language").asText()).isEqualTo("nl-NL");
        assertThat(root.get("layoutTemplate").asText()).isEqualTo("./layout.html");
        assertThat(root.get("availableLanguages")).extracting(l -> l.get("code").asText()).containsExactly("en-US", "nl-NL");
        assertThat(root.get("availableLanguages").get(1).get("label").asText()).isEqualTo("Nederlands");
    }

    @Test
    void outputIsDeterministicAndHonoursPrettyPrint() throws Exception {
        IrDocument doc = document(timeline(TimelineProvider.RAF, null, action("a1", 0, 1, raw("op1", "log"))));
        EmitterOptions compact = new EmitterOptions("s", "Eligius", "body", "en-US", "default", false);

        String first = emitter.emit(doc);
        String second = emitter.emit(doc);
        String flat = new Emitter(CATALOG, compact).emit(doc);

        assertThat(second).isEqualTo(first);
        assertThat(first).contains("\n");
        assertThat(flat).doesNotContain("\n").startsWith("{\"$schema\":\"s\"");
    }
}
