package nl.bytesoflife.deltaboard.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import nl.bytesoflife.deltaboard.config.BoardSettings;
import nl.bytesoflife.deltaboard.connector.ConnectorResolver;
import nl.bytesoflife.deltaboard.document.BoardDocument;
import nl.bytesoflife.deltaboard.document.DocumentChange;
import nl.bytesoflife.deltaboard.document.ObjectMap;
import nl.bytesoflife.deltaboard.document.OrderList;
import nl.bytesoflife.deltaboard.document.Transaction;
import nl.bytesoflife.deltaboard.document.TransactionOrigin;
import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.ConnectorEndpoint;
import nl.bytesoflife.deltaboard.model.ConnectorPayload;
import nl.bytesoflife.deltaboard.model.ConnectorStyle;
import nl.bytesoflife.deltaboard.model.ObjectType;
import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.model.PortName;
import nl.bytesoflife.deltaboard.model.ShapeKind;
import nl.bytesoflife.deltaboard.model.ShapePayload;
import nl.bytesoflife.deltaboard.model.TablePayload;
import nl.bytesoflife.deltaboard.model.TextSize;
import nl.bytesoflife.deltaboard.model.TextStyle;
import nl.bytesoflife.deltaboard.store.BoardObjectJson;
import nl.bytesoflife.deltaboard.store.IdGenerator;
import nl.bytesoflife.deltaboard.store.ObjectPatch;
import nl.bytesoflife.deltaboard.store.ObjectStore;
import nl.bytesoflife.deltaboard.store.RandomIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs agent tool calls against a private mirror of a board and commits the result as one diff.
 * <p>
 * The mirror is snapshotted at construction; nothing reaches the live document until
 * {@link #applyToDoc()}. Dropping the runner without applying has no effect on the board.
 * A runner is used by one session on one thread.
 */
public class BoardToolRunner {

    private static final Logger log = LoggerFactory.getLogger(BoardToolRunner.class);

    public static final String ACTOR_PREFIX = "ai:";
    public static final int PLACEMENT_COLUMNS = 3;
    public static final Point CONNECTOR_DEFAULT_SPAN = new Point(180, 60);
    static final int STATE_TEXT_LIMIT = 160;
    static final int STATE_TITLE_LIMIT = 80;

    /**
     * One registered tool.
     */
    @FunctionalInterface
    public interface ToolHandler {
        ObjectNode handle(ObjectNode args);
    }

    private final BoardDocument document;
    private final BoardSettings settings;
    private final BoardMirror mirror;
    private final ObjectStore store;
    private final ObjectMap objects;
    private final ConnectorResolver resolver;
    private final ToolArgumentValidator validator;
    private final FrameLayoutNormalizer normalizer;
    private final MutationTracker tracker = new MutationTracker();
    private final Map<ToolName, ToolHandler> tools = new EnumMap<>(ToolName.class);
    private final List<ToolCall> toolCalls = new ArrayList<>();
    private final Point viewportCenter;
    private final String actorId;

    private int placementCount;
    private boolean applied;

    public BoardToolRunner(BoardDocument document, Point viewportCenter) {
        this(document, viewportCenter, null, BoardSettings.defaults(), new RandomIdGenerator());
    }

    /**
     * @param actorId written into {@code createdBy}; null picks a fresh {@code ai:} id
     */
    public BoardToolRunner(BoardDocument document, Point viewportCenter, String actorId,
                           BoardSettings settings, IdGenerator ids) {
        this.document = document;
        this.settings = settings;
        this.actorId = actorId != null ? actorId : ACTOR_PREFIX + new RandomIdGenerator().nextId();
        this.viewportCenter = clampViewport(viewportCenter, settings.coordinateLimit());
        this.mirror = BoardMirror.snapshot(document);
        this.store = new ObjectStore(mirror.getDocument(), settings, ids).withActor(this.actorId);
        this.objects = mirror.objects();
        this.resolver = store.getResolver();
        this.validator = new ToolArgumentValidator(settings);
        this.normalizer = new FrameLayoutNormalizer(settings);
        mirror.getDocument().registerTransactionListener(this::track);

        registerTool(ToolName.CREATE_STICKY_NOTE, this::createStickyNote)
                .registerTool(ToolName.CREATE_SHAPE, this::createShape)
                .registerTool(ToolName.CREATE_FRAME, this::createFrame)
                .registerTool(ToolName.CREATE_CONNECTOR, this::createConnector)
                .registerTool(ToolName.CREATE_TEXT, this::createText)
                .registerTool(ToolName.CREATE_TABLE, this::createTable)
                .registerTool(ToolName.MOVE_OBJECT, this::moveObject)
                .registerTool(ToolName.ARRANGE_OBJECTS_IN_GRID, this::arrangeObjectsInGrid)
                .registerTool(ToolName.RESIZE_OBJECT, this::resizeObject)
                .registerTool(ToolName.UPDATE_TEXT, this::updateText)
                .registerTool(ToolName.CHANGE_COLOR, this::changeColor)
                .registerTool(ToolName.ROTATE_OBJECT, this::rotateObject)
                .registerTool(ToolName.DELETE_OBJECT, this::deleteObject)
                .registerTool(ToolName.GET_BOARD_STATE, args -> getBoardState())
                .registerTool(ToolName.BATCH_CREATE, this::batchCreate)
                .registerTool(ToolName.BATCH_UPDATE, this::batchUpdate)
                .registerTool(ToolName.BATCH_DELETE, this::batchDelete);
        log.debug("Agent session {} started with {} objects", this.actorId, objects.size());
    }

    public BoardToolRunner registerTool(ToolName tool, ToolHandler handler) {
        tools.put(tool, handler);
        return this;
    }

    /**
     * Validates and runs one call, then records it in the call log.
     *
     * @throws UnknownToolException when {@code toolName} is not a known tool; nothing is logged
     */
    public ObjectNode invoke(String toolName, JsonNode rawArgs) {
        ToolName tool = ToolName.fromWireName(toolName);
        if (tool == null) {
            log.warn("Rejected call to unknown tool '{}'", toolName);
            throw new UnknownToolException(toolName);
        }
        if (applied) {
            throw new IllegalStateException("Agent session " + actorId + " was already applied");
        }
        ObjectNode args = validator.validate(tool, rawArgs);
        ObjectNode result = run(tool, args);
        toolCalls.add(new ToolCall(tool.getWireName(), args, result));
        if (ToolResults.isOk(result)) {
            log.debug("Tool {} ok", tool.getWireName());
        } else {
            log.warn("Tool {} failed: {}", tool.getWireName(), result.path("error").asText());
        }
        return result;
    }

    public ObjectNode invoke(String toolName, Map<String, ?> rawArgs) {
        return invoke(toolName, (JsonNode) BoardObjectJson.MAPPER.valueToTree(rawArgs));
    }

    private ObjectNode run(ToolName tool, ObjectNode args) {
        ToolHandler handler = tools.get(tool);
        if (handler == null) {
            throw new UnknownToolException(tool.getWireName());
        }
        return handler.handle(args);
    }

    /**
     * Tidies the frames this session created, then writes every created and updated record and
     * every deletion into the live document in one {@link TransactionOrigin#AGENT} transaction.
     * New ids are appended to the z-order.
     *
     * @throws IllegalStateException when called twice
     */
    public MutationSummary applyToDoc() {
        if (applied) {
            throw new IllegalStateException("Agent session " + actorId + " was already applied");
        }
        applied = true;

        List<String> newFrames = new ArrayList<>();
        for (String id : tracker.getCreatedIds()) {
            BoardObject obj = objects.get(id);
            if (obj != null && obj.isFrame()) newFrames.add(id);
        }
        normalizer.apply(mirror.getDocument(), store.getContainment(), newFrames);

        List<String> createdIds = new ArrayList<>();
        for (String id : mirror.getOrder()) {
            if (tracker.isCreated(id)) createdIds.add(id);
        }
        for (String id : tracker.getCreatedIds()) {
            if (!createdIds.contains(id)) createdIds.add(id);
        }
        List<String> updatedIds = tracker.getUpdatedIds();
        List<String> deletedIds = tracker.getDeletedIds();

        document.transact(TransactionOrigin.AGENT, () -> {
            ObjectMap live = document.objects();
            OrderList zOrder = document.zOrder();
            for (String id : deletedIds) {
                live.delete(id);
                int index = zOrder.indexOf(id);
                if (index >= 0) zOrder.delete(index, 1);
            }
            for (String id : updatedIds) {
                BoardObject obj = objects.get(id);
                if (obj != null) live.set(obj);
            }
            for (String id : createdIds) {
                BoardObject obj = objects.get(id);
                if (obj == null) continue;
                live.set(obj);
                if (!zOrder.contains(id)) zOrder.push(id);
            }
        });

        log.info("Agent {} committed {} created, {} updated, {} deleted over {} calls",
                actorId, createdIds.size(), updatedIds.size(), deletedIds.size(), toolCalls.size());
        return new MutationSummary(createdIds, updatedIds, deletedIds, toolCalls);
    }

    public List<ToolCall> getToolCalls() {
        return List.copyOf(toolCalls);
    }

    public String getActorId() {
        return actorId;
    }

    public Point getViewportCenter() {
        return viewportCenter;
    }

    /**
     * The session's private copy. Writes to it only reach the board through {@link #applyToDoc()}.
     */
    public BoardMirror getMirror() {
        return mirror;
    }

    private void track(Transaction transaction) {
        for (DocumentChange change : transaction.changes()) {
            if (!(change instanceof DocumentChange.ObjectChange oc)) continue;
            if (oc.isInsert()) {
                tracker.markCreated(oc.id());
            } else if (oc.isDelete()) {
                tracker.markDeleted(oc.id());
            } else {
                tracker.markUpdated(oc.id());
            }
        }
    }

    // ---- create ----

    private ObjectNode createStickyNote(ObjectNode a) {
        double width = a.get("width").asDouble();
        double height = a.get("height").asDouble();
        Point at = placement(a, width, height);
        BoardObject obj = store.create(ObjectType.STICKY, at.x(), at.y(), width, height,
                ObjectPatch.create().text(a.get("text").asText()).color(a.get("color").asText()));
        return ToolResults.created(obj.getId());
    }

    private ObjectNode createShape(ObjectNode a) {
        double width = a.get("width").asDouble();
        double height = a.get("height").asDouble();
        Point at = placement(a, width, height);
        BoardObject obj = store.create(ObjectType.SHAPE, at.x(), at.y(), width, height,
                ObjectPatch.create()
                        .shapeKind(ShapeKind.fromWireName(a.get("type").asText()))
                        .color(a.get("color").asText())
                        .strokeColor(ShapePayload.DEFAULT_STROKE));
        return ToolResults.created(obj.getId());
    }

    private ObjectNode createFrame(ObjectNode a) {
        double width = a.get("width").asDouble();
        double height = a.get("height").asDouble();
        Point at = placement(a, width, height);
        BoardObject obj = store.create(ObjectType.FRAME, at.x(), at.y(), width, height,
                ObjectPatch.create().title(a.get("title").asText()));
        return ToolResults.created(obj.getId());
    }

    private ObjectNode createText(ObjectNode a) {
        double width = a.get("width").asDouble();
        double height = a.get("height").asDouble();
        Point at = placement(a, width, height);
        TextStyle style = new TextStyle(a.get("bold").asBoolean(), a.get("italic").asBoolean(),
                TextSize.fromWireName(a.get("fontSize").asText()));
        BoardObject obj = store.create(ObjectType.TEXT, at.x(), at.y(), width, height,
                ObjectPatch.create()
                        .content(a.get("content").asText())
                        .color(a.get("color").asText())
                        .textStyle(style));
        return ToolResults.created(obj.getId());
    }

    /**
     * Header names fill the first row when given; data rows follow.
     */
    private ObjectNode createTable(ObjectNode a) {
        JsonNode headers = a.get("headers");
        JsonNode data = a.get("data");
        int columnCount = a.get("numColumns").asInt();
        int rowCount = a.get("numRows").asInt() + (headers.size() > 0 ? 1 : 0);

        List<String> columns = new ArrayList<>();
        Map<String, Double> widths = new LinkedHashMap<>();
        for (int i = 1; i <= columnCount; i++) {
            columns.add("c" + i);
            widths.put("c" + i, TablePayload.DEFAULT_COLUMN_WIDTH);
        }
        List<String> rows = new ArrayList<>();
        Map<String, Double> heights = new LinkedHashMap<>();
        for (int i = 1; i <= rowCount; i++) {
            rows.add("r" + i);
            heights.put("r" + i, TablePayload.DEFAULT_ROW_HEIGHT);
        }

        Map<String, String> cells = new LinkedHashMap<>();
        int rowIndex = 0;
        if (headers.size() > 0) {
            for (int c = 0; c < headers.size() && c < columnCount; c++) {
                cells.put(TablePayload.cellKey(rows.get(0), columns.get(c)), headers.get(c).asText());
            }
            rowIndex = 1;
        }
        for (JsonNode row : data) {
            if (rowIndex >= rowCount) break;
            for (int c = 0; c < row.size() && c < columnCount; c++) {
                String value = row.get(c).asText();
                if (!value.isEmpty()) cells.put(TablePayload.cellKey(rows.get(rowIndex), columns.get(c)), value);
            }
            rowIndex++;
        }

        double width = columnCount * TablePayload.DEFAULT_COLUMN_WIDTH;
        double height = TablePayload.TITLE_HEIGHT + rowCount * TablePayload.DEFAULT_ROW_HEIGHT;
        Point at = placement(a, width, height);
        BoardObject obj = store.create(ObjectType.TABLE, at.x(), at.y(), width, height,
                ObjectPatch.create()
                        .title(a.get("title").asText())
                        .color(a.get("color").asText())
                        .tableGrid(columns, rows, widths, heights)
                        .cells(cells));
        return ToolResults.created(obj.getId());
    }

    /**
     * Ends bind to existing non-connector objects; anything else becomes a free point.
     */
    private ObjectNode createConnector(ObjectNode a) {
        Point defaultPoint = nextPlacement(0, 0);
        Point fromPoint = point(a.get("fromPoint"), defaultPoint);
        Point toPoint = point(a.get("toPoint"), defaultPoint.translate(
                CONNECTOR_DEFAULT_SPAN.x(), CONNECTOR_DEFAULT_SPAN.y()));

        ConnectorEndpoint from = endpoint(a.get("fromId"), a.get("fromPort"), fromPoint);
        ConnectorEndpoint to = endpoint(a.get("toId"), a.get("toPort"), toPoint);
        ConnectorStyle style = ConnectorStyle.fromWireName(a.get("style").asText());

        BoardObject obj = store.create(ObjectType.CONNECTOR, fromPoint.x(), fromPoint.y(), 0, 0,
                ObjectPatch.create().from(from).to(to).connectorStyle(style));
        return ToolResults.created(obj.getId());
    }

    private ConnectorEndpoint endpoint(JsonNode id, JsonNode port, Point fallback) {
        if (id != null && id.isTextual()) {
            BoardObject target = objects.get(id.asText());
            if (target != null && !target.isConnector()) {
                PortName portName = port != null && port.isTextual() ? PortName.fromWireName(port.asText()) : null;
                return ConnectorEndpoint.bound(target.getId(), portName);
            }
        }
        return ConnectorEndpoint.free(fallback);
    }

    // ---- update ----

    private ObjectNode moveObject(ObjectNode a) {
        BoardObject obj = find(a);
        if (obj == null) return ToolResults.notFound();
        if (obj.isConnector()) return ToolResults.unsupported("Connectors cannot be moved directly");
        store.moveTo(obj.getId(), a.get("x").asDouble(), a.get("y").asDouble());
        return ToolResults.ok();
    }

    private ObjectNode resizeObject(ObjectNode a) {
        BoardObject obj = find(a);
        if (obj == null) return ToolResults.notFound();
        if (obj.isConnector()) return ToolResults.unsupported("Connectors cannot be resized");
        store.resize(obj.getId(), obj.getX(), obj.getY(), a.get("width").asDouble(), a.get("height").asDouble());
        return ToolResults.ok();
    }

    private ObjectNode updateText(ObjectNode a) {
        BoardObject obj = find(a);
        if (obj == null) return ToolResults.notFound();
        if (obj.getType() == ObjectType.SHAPE || obj.isConnector()) {
            return ToolResults.unsupported("Object type does not support text updates");
        }
        store.updateText(obj.getId(), a.get("newText").asText());
        return ToolResults.ok();
    }

    private ObjectNode changeColor(ObjectNode a) {
        BoardObject obj = find(a);
        if (obj == null) return ToolResults.notFound();
        if (obj.isConnector()) return ToolResults.unsupported("Connectors cannot change color");
        if (a.get("color").isTextual()) {
            store.updateColor(obj.getId(), a.get("color").asText());
        }
        return ToolResults.ok();
    }

    private ObjectNode rotateObject(ObjectNode a) {
        BoardObject obj = find(a);
        if (obj == null) return ToolResults.notFound();
        if (obj.isConnector()) return ToolResults.unsupported("Connectors cannot be rotated");
        store.update(obj.getId(), ObjectPatch.create().rotation(a.get("angleDegrees").asDouble()));
        return ToolResults.ok();
    }

    private ObjectNode deleteObject(ObjectNode a) {
        BoardObject obj = find(a);
        if (obj == null) return ToolResults.notFound();
        store.delete(obj.getId());
        return ToolResults.ok();
    }

    private ObjectNode arrangeObjectsInGrid(ObjectNode a) {
        List<BoardObject> members = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode id : a.get("objectIds")) {
            BoardObject obj = objects.get(id.asText());
            if (obj != null && !obj.isConnector() && seen.add(obj.getId())) members.add(obj);
        }
        if (members.isEmpty()) {
            return ToolResults.failure(ToolResults.FailureKind.NOT_FOUND, "No valid objects");
        }

        int columns = a.get("columns").isNumber()
                ? a.get("columns").asInt() : GridArranger.defaultColumns(members.size());
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        for (BoardObject obj : members) {
            minX = Math.min(minX, obj.getX());
            minY = Math.min(minY, obj.getY());
        }
        Point origin = new Point(
                a.get("originX").isNumber() ? a.get("originX").asDouble() : minX,
                a.get("originY").isNumber() ? a.get("originY").asDouble() : minY);

        Map<String, Point> targets = GridArranger.layout(members, columns,
                a.get("gapX").asDouble(), a.get("gapY").asDouble(), origin);
        ObjectNode result = ToolResults.ok();
        ArrayNode moved = result.putArray("movedIds");
        for (Map.Entry<String, Point> target : targets.entrySet()) {
            store.moveTo(target.getKey(), target.getValue().x(), target.getValue().y());
            moved.add(target.getKey());
        }
        return result;
    }

    // ---- batch ----

    private ObjectNode batchCreate(ObjectNode a) {
        List<ObjectNode> results = new ArrayList<>();
        for (JsonNode item : a.get("items")) {
            ToolName tool = ToolName.fromWireName(item.path("tool").asText(null));
            if (tool == null) {
                results.add(ToolResults.unsupported("Unsupported item type: " + item.path("type").asText("")));
            } else {
                results.add(run(tool, (ObjectNode) item.get("args")));
            }
        }
        return batchResult(results);
    }

    private ObjectNode batchUpdate(ObjectNode a) {
        List<ObjectNode> results = new ArrayList<>();
        for (JsonNode item : a.get("items")) {
            results.add(updateItem((ObjectNode) item));
        }
        return batchResult(results);
    }

    /**
     * Applies the named fields of one batch item in order: position, size, text, color, angle.
     * Stops at the first field the object does not support.
     */
    private ObjectNode updateItem(ObjectNode item) {
        BoardObject obj = find(item);
        if (obj == null) {
            ObjectNode result = ToolResults.notFound();
            result.set("objectId", item.get("objectId"));
            return result;
        }
        String id = obj.getId();
        ObjectNode failure = null;

        if (item.get("x").isNumber() || item.get("y").isNumber()) {
            failure = firstFailure(failure, moveObject(args(id)
                    .put("x", item.get("x").isNumber() ? item.get("x").asDouble() : obj.getX())
                    .put("y", item.get("y").isNumber() ? item.get("y").asDouble() : obj.getY())));
        }
        if (failure == null && (item.get("width").isNumber() || item.get("height").isNumber())) {
            BoardObject current = objects.get(id);
            failure = firstFailure(failure, resizeObject(args(id)
                    .put("width", item.get("width").isNumber() ? item.get("width").asDouble() : current.getWidth())
                    .put("height", item.get("height").isNumber() ? item.get("height").asDouble() : current.getHeight())));
        }
        if (failure == null && item.get("newText").isTextual()) {
            failure = firstFailure(failure, updateText(args(id).put("newText", item.get("newText").asText())));
        }
        if (failure == null && item.get("color").isTextual()) {
            failure = firstFailure(failure, changeColor(args(id).put("color", item.get("color").asText())));
        }
        if (failure == null && item.get("angleDegrees").isNumber()) {
            failure = firstFailure(failure, rotateObject(args(id).put("angleDegrees", item.get("angleDegrees").asDouble())));
        }
        if (failure != null) return failure.put("objectId", id);
        return ToolResults.ok().put("objectId", id);
    }

    /**
     * Ids that disappeared earlier in the same batch, for example as descendants of a deleted
     * frame, count as deleted.
     */
    private ObjectNode batchDelete(ObjectNode a) {
        Set<String> existing = new HashSet<>(objects.ids());
        List<ObjectNode> results = new ArrayList<>();
        for (JsonNode idNode : a.get("objectIds")) {
            String id = idNode.asText();
            ObjectNode result;
            if (objects.has(id)) {
                result = deleteObject(args(id));
            } else if (existing.contains(id)) {
                result = ToolResults.ok();
            } else {
                result = ToolResults.notFound();
            }
            results.add(result.put("objectId", id));
        }
        return batchResult(results);
    }

    private static ObjectNode batchResult(List<ObjectNode> results) {
        boolean ok = true;
        ObjectNode out = BoardObjectJson.MAPPER.createObjectNode();
        ArrayNode array = BoardObjectJson.MAPPER.createArrayNode();
        for (ObjectNode result : results) {
            ok &= ToolResults.isOk(result);
            array.add(result);
        }
        out.put("ok", ok);
        out.set("results", array);
        return out;
    }

    private static ObjectNode firstFailure(ObjectNode current, ObjectNode result) {
        if (current != null) return current;
        return ToolResults.isOk(result) ? null : result;
    }

    // ---- read ----

    /**
     * Compact projection for the agent: frames first, then paint order. Long texts are clipped.
     */
    public ObjectNode getBoardState() {
        ObjectNode state = BoardObjectJson.MAPPER.createObjectNode();
        state.put("objectCount", objects.size());
        ObjectNode center = state.putObject("viewportCenter");
        center.put("x", viewportCenter.x());
        center.put("y", viewportCenter.y());
        ArrayNode list = state.putArray("objects");
        for (BoardObject obj : store.getAll()) {
            list.add(compact(obj));
        }
        return state;
    }

    private ObjectNode compact(BoardObject obj) {
        ObjectNode node = BoardObjectJson.MAPPER.createObjectNode();
        node.put("id", obj.getId());
        node.put("type", obj.getType().getWireName());
        node.put("x", obj.getX());
        node.put("y", obj.getY());
        node.put("width", obj.getWidth());
        node.put("height", obj.getHeight());
        node.put("rotation", obj.getRotation());
        if (obj.getPayload().color() != null) node.put("color", obj.getPayload().color());
        if (obj.getParentFrameId() != null) node.put("parentFrameId", obj.getParentFrameId());

        switch (obj.getType()) {
            case STICKY -> node.put("text", clip(ObjectStore.displayText(obj), STATE_TEXT_LIMIT));
            case TEXT -> node.put("content", clip(ObjectStore.displayText(obj), STATE_TEXT_LIMIT));
            case FRAME, TABLE -> node.put("title", clip(ObjectStore.displayText(obj), STATE_TITLE_LIMIT));
            case SHAPE -> node.put("shapeKind", ((ShapePayload) obj.getPayload()).kind().getWireName());
            case CONNECTOR -> {
                ConnectorPayload connector = obj.connector();
                node.put("fromId", connector.from().objectId());
                node.put("toId", connector.to().objectId());
                ConnectorResolver.Ends ends = resolver.ends(obj);
                putPoint(node, "fromPoint", ends.start());
                putPoint(node, "toPoint", ends.end());
                node.put("style", connector.style().getWireName());
            }
        }
        return node;
    }

    // ---- helpers ----

    /**
     * Next slot of a three-column grid around the viewport center, shifted so the object's
     * center lands on the slot.
     */
    Point nextPlacement(double width, double height) {
        int col = placementCount % PLACEMENT_COLUMNS;
        int row = placementCount / PLACEMENT_COLUMNS;
        placementCount++;
        double originX = viewportCenter.x() - settings.placementGapX();
        double originY = viewportCenter.y() - settings.placementGapY();
        return new Point(
                Math.round(originX + col * settings.placementGapX() - width / 2),
                Math.round(originY + row * settings.placementGapY() - height / 2));
    }

    private Point placement(ObjectNode a, double width, double height) {
        JsonNode x = a.get("x");
        JsonNode y = a.get("y");
        if (x == null || y == null || !x.isNumber() || !y.isNumber()) {
            return nextPlacement(width, height);
        }
        return new Point(x.asDouble(), y.asDouble());
    }

    private BoardObject find(ObjectNode a) {
        JsonNode id = a.get("objectId");
        return id != null && id.isTextual() ? objects.get(id.asText()) : null;
    }

    private static ObjectNode args(String objectId) {
        ObjectNode node = BoardObjectJson.MAPPER.createObjectNode();
        node.put("objectId", objectId);
        return node;
    }

    private static Point point(JsonNode node, Point fallback) {
        if (node == null || !node.isObject()) return fallback;
        return new Point(node.path("x").asDouble(), node.path("y").asDouble());
    }

    private static void putPoint(ObjectNode node, String field, Point p) {
        ObjectNode point = node.putObject(field);
        point.put("x", p.x());
        point.put("y", p.y());
    }

    private static String clip(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }

    private static Point clampViewport(Point center, double limit) {
        if (center == null) return new Point(0, 0);
        return new Point(clampCoordinate(center.x(), limit), clampCoordinate(center.y(), limit));
    }

    private static double clampCoordinate(double value, double limit) {
        if (Double.isNaN(value)) return 0;
        return Math.max(-limit, Math.min(limit, value));
    }
}
