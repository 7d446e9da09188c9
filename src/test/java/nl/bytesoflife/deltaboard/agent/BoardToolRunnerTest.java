package nl.bytesoflife.deltaboard.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import nl.bytesoflife.deltaboard.config.BoardSettings;
import nl.bytesoflife.deltaboard.document.BoardDocument;
import nl.bytesoflife.deltaboard.history.UndoRedoManager;
import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.ConnectorEndpoint;
import nl.bytesoflife.deltaboard.model.ObjectType;
import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.model.PortName;
import nl.bytesoflife.deltaboard.model.ShapeKind;
import nl.bytesoflife.deltaboard.model.ShapePayload;
import nl.bytesoflife.deltaboard.model.TablePayload;
import nl.bytesoflife.deltaboard.model.TextPayload;
import nl.bytesoflife.deltaboard.store.IdGenerator;
import nl.bytesoflife.deltaboard.store.ObjectPatch;
import nl.bytesoflife.deltaboard.store.ObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BoardToolRunnerTest {

    private BoardDocument document;
    private ObjectStore liveStore;

    @BeforeEach
    void setUp() {
        document = BoardDocument.create("site-a");
        liveStore = new ObjectStore(document, BoardSettings.defaults(), IdGenerator.sequential("o"));
    }

    private BoardToolRunner runner() {
        return new BoardToolRunner(document, new Point(0, 0), "ai:test", BoardSettings.defaults(),
                IdGenerator.sequential("n"));
    }

    private static String createdId(ObjectNode result) {
        assertTrue(result.hasNonNull("id"), () -> "expected a created id in " + result);
        return result.get("id").asText();
    }

    private static BoardObject mirrored(BoardToolRunner runner, String id) {
        return runner.getMirror().objects().get(id);
    }

    private String frame(BoardToolRunner runner, String title, double x, double y, double w, double h) {
        return createdId(runner.invoke("createFrame", Map.of("title", title, "x", x, "y", y, "width", w, "height", h)));
    }

    @Test
    void nothingReachesTheBoardBeforeApply() {
        liveStore.create(ObjectType.STICKY, 0, 0);
        BoardToolRunner runner = runner();

        String id = createdId(runner.invoke("createStickyNote", Map.of("text", "hi")));
        runner.invoke("deleteObject", Map.of("objectId", "o1"));

        assertNotNull(mirrored(runner, id));
        assertEquals(1, document.objects().size());
        assertNotNull(document.objects().get("o1"));
        assertNull(document.objects().get(id));
    }

    @Test
    void applyCommitsCreatedObjectsAtTheTop() {
        liveStore.create(ObjectType.STICKY, 0, 0);
        BoardToolRunner runner = runner();
        String id = createdId(runner.invoke("createStickyNote", Map.of("text", "hi", "color", "blue")));

        MutationSummary summary = runner.applyToDoc();

        assertEquals(List.of(id), summary.createdIds());
        assertEquals(List.of("o1", id), document.zOrder().toList());
        BoardObject created = document.objects().get(id);
        assertEquals("ai:test", created.getCreatedBy());
        assertEquals("hi", ObjectStore.displayText(created));
        assertEquals("blue", created.getPayload().color());
        assertEquals(1, summary.toolCalls().size());
    }

    @Test
    void createdThenEditedIsReportedOnlyAsCreated() {
        BoardToolRunner runner = runner();
        String id = createdId(runner.invoke("createStickyNote", Map.of("text", "hi")));
        runner.invoke("moveObject", Map.of("objectId", id, "x", 400, "y", 400));
        runner.invoke("updateText", Map.of("objectId", id, "newText", "bye"));

        MutationSummary summary = runner.applyToDoc();

        assertEquals(List.of(id), summary.createdIds());
        assertTrue(summary.updatedIds().isEmpty());
        BoardObject live = document.objects().get(id);
        assertEquals(400, live.getX());
        assertEquals("bye", ObjectStore.displayText(live));
    }

    @Test
    void createdThenDeletedLeavesNoTrace() {
        BoardToolRunner runner = runner();
        String id = createdId(runner.invoke("createStickyNote", Map.of("text", "hi")));
        runner.invoke("deleteObject", Map.of("objectId", id));

        MutationSummary summary = runner.applyToDoc();

        assertTrue(summary.isEmpty());
        assertEquals(0, document.objects().size());
        assertEquals(2, summary.toolCalls().size());
    }

    @Test
    void editsOfExistingObjectsAreUpdates() {
        BoardObject sticky = liveStore.create(ObjectType.STICKY, 0, 0);
        BoardToolRunner runner = runner();

        ObjectNode result = runner.invoke("changeColor", Map.of("objectId", sticky.getId(), "color", "green"));
        assertTrue(result.get("ok").asBoolean());
        MutationSummary summary = runner.applyToDoc();

        assertEquals(List.of(sticky.getId()), summary.updatedIds());
        assertEquals("green", document.objects().get(sticky.getId()).getPayload().color());
    }

    @Test
    void deletionsLeaveTheZOrder() {
        BoardObject a = liveStore.create(ObjectType.STICKY, 0, 0);
        BoardObject b = liveStore.create(ObjectType.STICKY, 500, 0);
        BoardToolRunner runner = runner();
        runner.invoke("deleteObject", Map.of("objectId", a.getId()));

        MutationSummary summary = runner.applyToDoc();

        assertEquals(List.of(a.getId()), summary.deletedIds());
        assertNull(document.objects().get(a.getId()));
        assertEquals(List.of(b.getId()), document.zOrder().toList());
    }

    @Test
    void reparentingOnTheMirrorCountsAsUpdate() {
        BoardObject sticky = liveStore.create(ObjectType.STICKY, 500, 500);
        BoardToolRunner runner = runner();

        String frameId = frame(runner, "Ideas", 400, 400, 400, 400);
        MutationSummary summary = runner.applyToDoc();

        assertEquals(List.of(frameId), summary.createdIds());
        assertEquals(List.of(sticky.getId()), summary.updatedIds());
        assertEquals(frameId, document.objects().get(sticky.getId()).getParentFrameId());
        assertEquals(List.of(sticky.getId()), document.objects().get(frameId).frame().children());
    }

    @Test
    void unknownToolThrowsAndIsNotLogged() {
        BoardToolRunner runner = runner();
        UnknownToolException e = assertThrows(UnknownToolException.class,
                () -> runner.invoke("createsticky", Map.of()));
        assertEquals("createsticky", e.getToolName());
        assertTrue(runner.getToolCalls().isEmpty());
    }

    @Test
    void missingObjectsReportNotFound() {
        BoardToolRunner runner = runner();
        ObjectNode result = runner.invoke("moveObject", Map.of("objectId", "ghost", "x", 1, "y", 1));

        assertFalse(result.get("ok").asBoolean());
        assertEquals("Object not found", result.get("error").asText());
        assertEquals("NOT_FOUND", result.get("kind").asText());
        assertEquals(1, runner.getToolCalls().size());
        assertEquals("moveObject", runner.getToolCalls().get(0).toolName());
    }

    @Test
    void connectorsRejectBoxEdits() {
        BoardToolRunner runner = runner();
        String a = createdId(runner.invoke("createStickyNote", Map.of("x", 0, "y", 0)));
        String b = createdId(runner.invoke("createStickyNote", Map.of("x", 400, "y", 0)));
        String c = createdId(runner.invoke("createConnector", Map.of("fromId", a, "toId", b)));

        assertEquals("Connectors cannot be moved directly",
                runner.invoke("moveObject", Map.of("objectId", c, "x", 5, "y", 5)).get("error").asText());
        assertEquals("Connectors cannot be resized",
                runner.invoke("resizeObject", Map.of("objectId", c, "width", 50, "height", 50)).get("error").asText());
        assertEquals("Connectors cannot change color",
                runner.invoke("changeColor", Map.of("objectId", c, "color", "red")).get("error").asText());
        ObjectNode rotate = runner.invoke("rotateObject", Map.of("objectId", c, "angleDegrees", 45));
        assertEquals("Connectors cannot be rotated", rotate.get("error").asText());
        assertEquals("UNSUPPORTED_OPERATION", rotate.get("kind").asText());
    }

    @Test
    void shapesRejectTextUpdates() {
        BoardToolRunner runner = runner();
        String shape = createdId(runner.invoke("createShape", Map.of("type", "ellipse")));

        ObjectNode result = runner.invoke("updateText", Map.of("objectId", shape, "newText", "nope"));

        assertEquals("Object type does not support text updates", result.get("error").asText());
        assertEquals(ShapeKind.ELLIPSE, ((ShapePayload) mirrored(runner, shape).getPayload()).kind());
    }

    @Test
    void framesAndTablesAcceptTextUpdatesAsTitles() {
        BoardToolRunner runner = runner();
        String frame = frame(runner, "Old", 0, 0, 360, 240);

        assertTrue(runner.invoke("updateText", Map.of("objectId", frame, "newText", "New")).get("ok").asBoolean());
        assertEquals("New", mirrored(runner, frame).frame().title());
    }

    @Test
    void autoPlacementWalksAGridAroundTheViewport() {
        BoardToolRunner runner = runner();
        String first = createdId(runner.invoke("createStickyNote", Map.of()));
        String second = createdId(runner.invoke("createStickyNote", Map.of()));
        runner.invoke("createStickyNote", Map.of());
        String fourth = createdId(runner.invoke("createStickyNote", Map.of()));

        assertEquals(-305, mirrored(runner, first).getX());
        assertEquals(-245, mirrored(runner, first).getY());
        assertEquals(-75, mirrored(runner, second).getX());
        assertEquals(-305, mirrored(runner, fourth).getX());
        assertEquals(-75, mirrored(runner, fourth).getY());
    }

    @Test
    void explicitCoordinatesSkipAutoPlacement() {
        BoardToolRunner runner = runner();
        String id = createdId(runner.invoke("createStickyNote", Map.of("x", 12, "y", 34)));
        assertEquals(12, mirrored(runner, id).getX());
        assertEquals(34, mirrored(runner, id).getY());
        assertEquals(new Point(-305, -245), runner.nextPlacement(150, 150));
    }

    @Test
    void connectorToMissingObjectIsFree() {
        BoardToolRunner runner = runner();
        String id = createdId(runner.invoke("createConnector", Map.of("fromId", "ghost")));

        BoardObject connector = mirrored(runner, id);
        assertEquals(ConnectorEndpoint.free(-230, -170), connector.connector().from());
        assertEquals(ConnectorEndpoint.free(-50, -110), connector.connector().to());
    }

    @Test
    void connectorBindsToExistingObjectsWithPorts() {
        BoardObject target = liveStore.create(ObjectType.STICKY, 0, 0);
        BoardToolRunner runner = runner();
        String id = createdId(runner.invoke("createConnector", Map.of(
                "fromId", target.getId(), "fromPort", "e", "toPoint", Map.of("x", 600, "y", 75))));

        BoardObject connector = mirrored(runner, id);
        assertEquals(ConnectorEndpoint.bound(target.getId(), PortName.E), connector.connector().from());
        assertEquals(ConnectorEndpoint.free(600, 75), connector.connector().to());
    }

    @Test
    void rotationIsStoredNormalized() {
        BoardToolRunner runner = runner();
        String id = createdId(runner.invoke("createShape", Map.of()));
        runner.invoke("rotateObject", Map.of("objectId", id, "angleDegrees", -90));
        assertEquals(270, mirrored(runner, id).getRotation());
    }

    @Test
    void tableHeadersFillTheFirstRow() {
        BoardToolRunner runner = runner();
        String id = createdId(runner.invoke("createTable", Map.of(
                "title", "Team",
                "headers", List.of("Name", "Role"),
                "data", List.of(List.of("Ann", "Dev")),
                "x", 0, "y", 0)));

        BoardObject table = mirrored(runner, id);
        TablePayload payload = (TablePayload) table.getPayload();
        assertEquals(List.of("c1", "c2"), payload.columns());
        assertEquals(List.of("r1", "r2"), payload.rows());
        assertEquals("Name", payload.cells().get("r1:c1"));
        assertEquals("Dev", payload.cells().get("r2:c2"));
        assertEquals("Team", payload.title());
        assertEquals(240, table.getWidth());
        assertEquals(TablePayload.TITLE_HEIGHT + 2 * TablePayload.DEFAULT_ROW_HEIGHT, table.getHeight());
    }

    @Test
    void arrangeObjectsInGridMovesValidMembers() {
        BoardToolRunner runner = runner();
        String a = createdId(runner.invoke("createStickyNote", Map.of("x", 900, "y", 900)));
        String b = createdId(runner.invoke("createStickyNote", Map.of("x", 20, "y", 700)));
        String c = createdId(runner.invoke("createStickyNote", Map.of("x", 300, "y", 40)));

        ObjectNode result = runner.invoke("arrangeObjectsInGrid", Map.of(
                "objectIds", List.of(a, "ghost", b, c, a), "columns", 2, "gapX", 10, "gapY", 10,
                "originX", 0, "originY", 0));

        assertTrue(result.get("ok").asBoolean());
        assertEquals(3, result.get("movedIds").size());
        assertEquals(new Point(0, 0), position(mirrored(runner, a)));
        assertEquals(new Point(160, 0), position(mirrored(runner, b)));
        assertEquals(new Point(0, 160), position(mirrored(runner, c)));

        ObjectNode empty = runner.invoke("arrangeObjectsInGrid", Map.of("objectIds", List.of("ghost")));
        assertEquals("No valid objects", empty.get("error").asText());
    }

    @Test
    void batchCreateReportsEachItem() {
        BoardToolRunner runner = runner();
        ObjectNode result = runner.invoke("batchCreate", Map.of("items", List.of(
                Map.of("type", "sticky", "text", "a", "x", 0, "y", 0),
                Map.of("type", "ellipse", "x", 300, "y", 0),
                Map.of("type", "blob"))));

        assertFalse(result.get("ok").asBoolean());
        JsonNode results = result.get("results");
        assertEquals(3, results.size());
        String ellipse = results.get(1).get("id").asText();
        assertEquals(ShapeKind.ELLIPSE, ((ShapePayload) mirrored(runner, ellipse).getPayload()).kind());
        assertEquals("UNSUPPORTED_OPERATION", results.get(2).get("kind").asText());
        assertEquals(2, runner.getMirror().objects().size());
        assertEquals(1, runner.getToolCalls().size());
    }

    @Test
    void unknownColorKeepsTheCurrentOne() {
        BoardObject sticky = liveStore.create(ObjectType.STICKY, 0, 0, 150, 150, ObjectPatch.create().color("blue"));
        BoardToolRunner runner = runner();

        ObjectNode result = runner.invoke("changeColor", Map.of("objectId", sticky.getId(), "color", "magenta"));
        assertTrue(result.get("ok").asBoolean());
        assertEquals("blue", mirrored(runner, sticky.getId()).getPayload().color());

        result = runner.invoke("batchUpdate", Map.of("items", List.of(
                Map.of("objectId", sticky.getId(), "color", "plaid"))));
        assertTrue(result.get("ok").asBoolean());
        assertEquals("blue", mirrored(runner, sticky.getId()).getPayload().color());

        assertTrue(runner.applyToDoc().updatedIds().isEmpty());
    }

    @Test
    void textWithoutColorGetsTheTextDefault() {
        BoardToolRunner runner = runner();
        String id = createdId(runner.invoke("createText", Map.of("content", "note", "x", 0, "y", 0)));
        assertEquals(TextPayload.DEFAULT_COLOR, mirrored(runner, id).getPayload().color());
    }

    @Test
    void batchUpdateAppliesNamedFields() {
        BoardObject sticky = liveStore.create(ObjectType.STICKY, 0, 0);
        BoardToolRunner runner = runner();

        ObjectNode result = runner.invoke("batchUpdate", Map.of("items", List.of(
                Map.of("objectId", sticky.getId(), "x", 500, "color", "green", "newText", "moved"),
                Map.of("objectId", "ghost", "x", 1))));

        assertFalse(result.get("ok").asBoolean());
        JsonNode first = result.get("results").get(0);
        assertTrue(first.get("ok").asBoolean());
        assertEquals(sticky.getId(), first.get("objectId").asText());
        assertEquals("NOT_FOUND", result.get("results").get(1).get("kind").asText());
        assertEquals("ghost", result.get("results").get(1).get("objectId").asText());

        BoardObject updated = mirrored(runner, sticky.getId());
        assertEquals(500, updated.getX());
        assertEquals(0, updated.getY());
        assertEquals("green", updated.getPayload().color());
        assertEquals("moved", ObjectStore.displayText(updated));
    }

    @Test
    void batchDeleteCountsCascadedIdsAsDeleted() {
        BoardObject frame = liveStore.create(ObjectType.FRAME, 0, 0, 360, 240, null);
        BoardObject child = liveStore.create(ObjectType.STICKY, 50, 50);
        BoardToolRunner runner = runner();

        ObjectNode result = runner.invoke("batchDelete", Map.of("objectIds",
                List.of(frame.getId(), child.getId(), "ghost")));

        JsonNode results = result.get("results");
        assertTrue(results.get(0).get("ok").asBoolean());
        assertTrue(results.get(1).get("ok").asBoolean());
        assertEquals("NOT_FOUND", results.get(2).get("kind").asText());
        assertEquals("ghost", results.get(2).get("objectId").asText());

        MutationSummary summary = runner.applyToDoc();
        assertEquals(2, summary.deletedIds().size());
        assertEquals(0, document.objects().size());
        assertEquals(0, document.zOrder().size());
    }

    @Test
    void boardStateIsCompactAndFramesFirst() {
        liveStore.create(ObjectType.STICKY, 1000, 1000);
        liveStore.update("o1", ObjectPatch.create().text("x".repeat(300)));
        liveStore.create(ObjectType.FRAME, 0, 0, 360, 240, null);
        BoardToolRunner runner = runner();

        ObjectNode state = runner.invoke("getBoardState", Map.of());

        assertEquals(2, state.get("objectCount").asInt());
        assertEquals(0, state.get("viewportCenter").get("x").asDouble());
        JsonNode objects = state.get("objects");
        assertEquals("frame", objects.get(0).get("type").asText());
        assertEquals("Frame", objects.get(0).get("title").asText());
        assertEquals(BoardToolRunner.STATE_TEXT_LIMIT, objects.get(1).get("text").asText().length());
        assertFalse(objects.get(1).has("parentFrameId"));
    }

    @Test
    void overlappingSwotFramesAreRelaidOnApply() {
        BoardToolRunner runner = runner();
        String s = frame(runner, "Strengths", 0, 0, 300, 200);
        String w = frame(runner, "Weaknesses", 100, 0, 300, 200);
        String o = frame(runner, "Opportunities", 0, 100, 300, 200);
        String t = frame(runner, "Threats", 100, 100, 300, 200);
        String note = createdId(runner.invoke("createStickyNote", Map.of("x", 10, "y", 10, "width", 50, "height", 50)));
        assertEquals(s, mirrored(runner, note).getParentFrameId());

        MutationSummary summary = runner.applyToDoc();

        assertEquals(List.of(s, w, o, t, note), summary.createdIds());
        assertEquals(new Point(-112, -62), position(document.objects().get(s)));
        assertEquals(new Point(212, -62), position(document.objects().get(w)));
        assertEquals(new Point(-112, 162), position(document.objects().get(o)));
        assertEquals(new Point(212, 162), position(document.objects().get(t)));
        assertEquals(new Point(-102, -52), position(document.objects().get(note)));
        assertEquals(s, document.objects().get(note).getParentFrameId());
        for (String id : List.of(s, w, o, t)) {
            assertNull(document.objects().get(id).getParentFrameId());
        }
    }

    @Test
    void templateFramesAreWrappedByTheLargestTitledFrame() {
        BoardToolRunner runner = runner();
        String outer = frame(runner, "SWOT Analysis", 0, 0, 360, 240);
        String s = frame(runner, "Strengths", 100, 120, 372, 578);
        String w = frame(runner, "Weaknesses", 500, 120, 372, 578);
        String o = frame(runner, "Opportunities", 100, 730, 372, 578);
        String t = frame(runner, "Threats", 500, 730, 372, 578);

        runner.applyToDoc();

        BoardObject wrapped = document.objects().get(outer);
        assertEquals(76, wrapped.getX());
        assertEquals(64, wrapped.getY());
        assertEquals(820, wrapped.getWidth());
        assertEquals(1268, wrapped.getHeight());
        for (String id : List.of(s, w, o, t)) {
            assertEquals(outer, document.objects().get(id).getParentFrameId());
        }
        assertEquals(Set.of(s, w, o, t), Set.copyOf(wrapped.frame().children()));
        assertEquals(new Point(100, 120), position(document.objects().get(s)));
    }

    @Test
    void fewFramesAreLeftAlone() {
        BoardToolRunner runner = runner();
        String container = frame(runner, "Container", 0, 0, 800, 600);
        String section = frame(runner, "Section", 2000, 0, 300, 200);

        runner.applyToDoc();

        assertEquals(800, document.objects().get(container).getWidth());
        assertEquals(new Point(2000, 0), position(document.objects().get(section)));
    }

    @Test
    void applyingTwiceOrInvokingAfterApplyFails() {
        BoardToolRunner runner = runner();
        runner.invoke("createStickyNote", Map.of());
        runner.applyToDoc();

        assertThrows(IllegalStateException.class, runner::applyToDoc);
        assertThrows(IllegalStateException.class, () -> runner.invoke("createStickyNote", Map.of()));
    }

    @Test
    void appliedSessionUndoesAsOneStep() {
        liveStore.create(ObjectType.STICKY, 0, 0);
        UndoRedoManager history = new UndoRedoManager(document);
        BoardToolRunner runner = runner();
        runner.invoke("createStickyNote", Map.of("text", "a"));
        runner.invoke("createStickyNote", Map.of("text", "b"));
        runner.invoke("deleteObject", Map.of("objectId", "o1"));
        runner.applyToDoc();

        assertEquals(1, history.getUndoDepth());
        assertEquals(2, document.objects().size());

        history.undo();
        assertEquals(List.of("o1"), document.zOrder().toList());
        assertEquals(1, document.objects().size());
    }

    @Test
    void defaultActorIdIsFresh() {
        BoardToolRunner first = new BoardToolRunner(document, new Point(0, 0));
        BoardToolRunner second = new BoardToolRunner(document, new Point(0, 0));

        assertTrue(first.getActorId().startsWith(BoardToolRunner.ACTOR_PREFIX));
        assertNotEquals(first.getActorId(), second.getActorId());
    }

    @Test
    void viewportCenterIsClamped() {
        BoardToolRunner runner = new BoardToolRunner(document, new Point(Double.NaN, 1e12));
        assertEquals(new Point(0, 100_000), runner.getViewportCenter());
    }

    private static Point position(BoardObject obj) {
        return new Point(obj.getX(), obj.getY());
    }
}
