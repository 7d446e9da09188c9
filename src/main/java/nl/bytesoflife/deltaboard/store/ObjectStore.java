package nl.bytesoflife.deltaboard.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import nl.bytesoflife.deltaboard.config.BoardSettings;
import nl.bytesoflife.deltaboard.connector.ConnectorResolver;
import nl.bytesoflife.deltaboard.document.BoardDocument;
import nl.bytesoflife.deltaboard.document.ObjectMap;
import nl.bytesoflife.deltaboard.document.OrderList;
import nl.bytesoflife.deltaboard.document.TransactionOrigin;
import nl.bytesoflife.deltaboard.geometry.BoardGeometry;
import nl.bytesoflife.deltaboard.geometry.Port;
import nl.bytesoflife.deltaboard.geometry.SpatialIndex;
import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.Bounds;
import nl.bytesoflife.deltaboard.model.ConnectorEndpoint;
import nl.bytesoflife.deltaboard.model.ConnectorPayload;
import nl.bytesoflife.deltaboard.model.ConnectorSide;
import nl.bytesoflife.deltaboard.model.FramePayload;
import nl.bytesoflife.deltaboard.model.ObjectType;
import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.model.StickyPayload;
import nl.bytesoflife.deltaboard.model.TablePayload;
import nl.bytesoflife.deltaboard.model.TextPayload;
import nl.bytesoflife.deltaboard.model.TextSize;
import nl.bytesoflife.deltaboard.model.TextStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Interactive CRUD over the board document. Every mutating call runs as one transaction under
 * the store's current origin. Calls against missing ids or unsupported variants are silent no-ops.
 */
public class ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(ObjectStore.class);

    public static final String LOCAL_ACTOR = "local";
    public static final Point DUPLICATE_OFFSET = new Point(20, 20);

    private final BoardDocument document;
    private final ObjectMap objects;
    private final OrderList zOrder;
    private final BoardSettings settings;
    private final IdGenerator ids;
    private final ObjectFactory factory;
    private final ContainmentSynchronizer containment;
    private final ConnectorResolver resolver;

    private String actorId = LOCAL_ACTOR;
    private TransactionOrigin origin = TransactionOrigin.LOCAL;

    public ObjectStore(BoardDocument document) {
        this(document, BoardSettings.defaults(), new RandomIdGenerator());
    }

    public ObjectStore(BoardDocument document, BoardSettings settings, IdGenerator ids) {
        this.document = document;
        this.objects = document.objects();
        this.zOrder = document.zOrder();
        this.settings = settings;
        this.ids = ids;
        this.factory = new ObjectFactory(settings);
        this.containment = new ContainmentSynchronizer(objects);
        this.resolver = new ConnectorResolver(objects);
    }

    public ObjectStore withActor(String actorId) {
        this.actorId = actorId;
        return this;
    }

    public BoardDocument getDocument() { return document; }
    public BoardSettings getSettings() { return settings; }
    public ConnectorResolver getResolver() { return resolver; }
    public ContainmentSynchronizer getContainment() { return containment; }
    public TransactionOrigin getOrigin() { return origin; }

    /**
     * Runs {@code action} with every transaction tagged {@code origin}, then restores the previous origin.
     */
    public void withOrigin(TransactionOrigin origin, Runnable action) {
        TransactionOrigin previous = this.origin;
        this.origin = origin;
        try {
            action.run();
        } finally {
            this.origin = previous;
        }
    }

    // ---- create ----

    public BoardObject create(ObjectType type, double x, double y) {
        return create(type, x, y, ObjectFactory.defaultWidth(type), ObjectFactory.defaultHeight(type), null);
    }

    public BoardObject create(ObjectType type, double x, double y, double width, double height, ObjectPatch extra) {
        BoardObject obj = factory.create(ids.nextId(), type, x, y, width, height, extra, actorId);
        transact(() -> {
            objects.set(obj);
            zOrder.push(obj.getId());
            containment.sync(obj.getId());
        });
        return objects.get(obj.getId());
    }

    /**
     * A connector with both ends free at {@code (x, y)}, ready to be dragged out.
     */
    public BoardObject startConnector(double x, double y) {
        return create(ObjectType.CONNECTOR, x, y, 0, 0, null);
    }

    /**
     * Re-inserts a complete record, keeping its id. Used for history replay and imports.
     */
    public void createFromSnapshot(BoardObject snapshot) {
        BoardObject obj = factory.normalize(snapshot);
        transact(() -> {
            objects.set(obj);
            if (!zOrder.contains(obj.getId())) {
                zOrder.push(obj.getId());
            }
            containment.sync(obj.getId());
        });
    }

    // ---- update ----

    public void update(String id, ObjectPatch patch) {
        BoardObject obj = objects.get(id);
        if (obj == null || patch == null || patch.isEmpty()) return;
        BoardObject next = factory.normalize(patch.applyTo(obj));
        transact(() -> {
            objects.set(next);
            containment.sync(id);
        });
    }

    public void moveTo(String id, double x, double y) {
        BoardObject obj = objects.get(id);
        if (obj == null) return;
        move(List.of(id), x - obj.getX(), y - obj.getY());
    }

    /**
     * Moves objects by a delta. Frames carry all their descendants along. Containment is synced
     * once every position has been written.
     */
    public void move(Collection<String> idsToMove, double dx, double dy) {
        if (idsToMove.isEmpty() || (dx == 0 && dy == 0)) return;
        Set<String> moveSet = ObjectGraph.expandFrames(objects, List.copyOf(idsToMove));
        transact(() -> {
            List<String> moved = new ArrayList<>();
            for (String id : moveSet) {
                BoardObject obj = objects.get(id);
                if (obj == null) continue;
                objects.set(obj.translate(dx, dy));
                moved.add(id);
            }
            containment.syncAll(moved);
        });
    }

    /**
     * @return false for missing objects and connectors, which have no box to resize
     */
    public boolean resize(String id, double x, double y, double width, double height) {
        BoardObject obj = objects.get(id);
        if (obj == null || obj.isConnector()) return false;
        BoardObject next = factory.normalize(obj.withBounds(x, y, width, height));
        transact(() -> {
            objects.set(next);
            containment.sync(id);
        });
        return true;
    }

    /**
     * Rotates each object's center about {@code pivot} and adds the delta to its own rotation.
     * The pivot defaults to the center of the selection's combined box. Connectors are skipped.
     */
    public void rotate(Collection<String> idsToRotate, double deltaAngle, Point pivot) {
        if (idsToRotate.isEmpty() || deltaAngle == 0) return;
        List<BoardObject> current = new ArrayList<>();
        for (String id : idsToRotate) {
            BoardObject obj = objects.get(id);
            if (obj != null && !obj.isConnector()) current.add(obj);
        }
        if (current.isEmpty()) return;

        Point center = pivot;
        if (center == null) {
            Bounds box = BoardGeometry.selectionBounds(current);
            center = box.center();
        }
        Point rotationPivot = center;
        transact(() -> {
            List<String> rotated = new ArrayList<>();
            for (BoardObject obj : current) {
                Point c = BoardGeometry.center(obj);
                Point next = BoardGeometry.rotatePoint(c, rotationPivot, deltaAngle);
                objects.set(obj.withPosition(next.x() - obj.getWidth() / 2, next.y() - obj.getHeight() / 2)
                        .withRotation(BoardGeometry.normalizeAngle(obj.getRotation() + deltaAngle)));
                rotated.add(obj.getId());
            }
            containment.syncAll(rotated);
        });
    }

    /**
     * Writes the text field of the variant: content for text, text for stickies, title for
     * frames and tables. Other variants are left alone.
     */
    public void updateText(String id, String value) {
        BoardObject obj = objects.get(id);
        if (obj == null || value == null) return;
        ObjectPatch patch = switch (obj.getType()) {
            case TEXT -> ObjectPatch.create().content(value);
            case STICKY -> ObjectPatch.create().text(value);
            case FRAME, TABLE -> ObjectPatch.create().title(value);
            case SHAPE, CONNECTOR -> null;
        };
        if (patch == null) return;
        BoardObject next = patch.applyTo(obj);
        transact(() -> objects.set(next));
    }

    /**
     * Null arguments keep the current value. Only text objects carry a style.
     */
    public void updateTextStyle(String id, Boolean bold, Boolean italic, TextSize size) {
        BoardObject obj = objects.get(id);
        if (obj == null || !(obj.getPayload() instanceof TextPayload text)) return;
        TextStyle style = text.style();
        if (bold != null) style = style.withBold(bold);
        if (italic != null) style = style.withItalic(italic);
        if (size != null) style = style.withSize(size);
        BoardObject next = obj.withPayload(text.withStyle(style));
        transact(() -> objects.set(next));
    }

    public void updateColor(String id, String color) {
        BoardObject obj = objects.get(id);
        if (obj == null || obj.isConnector() || color == null) return;
        BoardObject next = obj.withPayload(obj.getPayload().withColor(color));
        transact(() -> objects.set(next));
    }

    public void updateConnectorEndpoint(String id, ConnectorSide side, ConnectorEndpoint endpoint) {
        BoardObject obj = objects.get(id);
        if (obj == null || !obj.isConnector() || side == null || endpoint == null) return;
        if (endpoint.objectId() != null && !objects.has(endpoint.objectId())) return;
        BoardObject next = obj.withPayload(side.replace(obj.connector(), endpoint));
        transact(() -> objects.set(next));
    }

    // ---- delete ----

    /**
     * Deletes objects and the descendants of any frame among them. Surviving connectors bound to
     * a deleted object are frozen at the endpoint's last resolved position.
     */
    public void delete(Collection<String> idsToDelete) {
        if (idsToDelete.isEmpty()) return;
        Set<String> deleting = new LinkedHashSet<>();
        for (String id : ObjectGraph.expandFrames(objects, List.copyOf(new LinkedHashSet<>(idsToDelete)))) {
            if (objects.has(id)) deleting.add(id);
        }
        if (deleting.isEmpty()) return;

        transact(() -> {
            for (BoardObject obj : objects.values()) {
                if (!obj.isConnector() || deleting.contains(obj.getId())) continue;
                BoardObject detached = resolver.detach(obj, deleting);
                if (detached != obj) objects.set(detached);
            }
            for (String id : deleting) {
                BoardObject obj = objects.get(id);
                String parentId = obj.getParentFrameId();
                if (parentId == null || deleting.contains(parentId)) continue;
                BoardObject parent = objects.get(parentId);
                if (parent != null && parent.isFrame()) {
                    objects.set(parent.withPayload(parent.frame().withoutChild(id)));
                }
            }
            Set<String> orphans = new LinkedHashSet<>();
            for (String id : deleting) {
                orphans.addAll(ObjectGraph.linkedChildren(objects, id));
            }
            orphans.removeAll(deleting);
            for (String id : deleting) {
                objects.delete(id);
                int index = zOrder.indexOf(id);
                if (index >= 0) zOrder.delete(index, 1);
            }
            containment.syncAll(orphans);
        });
        log.debug("Deleted {} objects", deleting.size());
    }

    public void delete(String id) {
        delete(List.of(id));
    }

    // ---- clipboard ----

    public List<String> duplicate(Collection<String> selection) {
        return pasteSerialized(serializeSelection(selection), DUPLICATE_OFFSET, true);
    }

    /**
     * Snapshot of the selection in paint order. Connector ends bound outside the selection become
     * free points and frame children outside the selection are dropped.
     */
    public ArrayNode serializeSelection(Collection<String> selection) {
        Set<String> wanted = new HashSet<>(selection);
        List<BoardObject> selected = new ArrayList<>();
        for (BoardObject obj : getAll()) {
            if (wanted.contains(obj.getId())) selected.add(obj);
        }
        Set<String> selectedIds = new HashSet<>();
        for (BoardObject obj : selected) selectedIds.add(obj.getId());

        List<BoardObject> clones = new ArrayList<>();
        for (BoardObject obj : selected) {
            BoardObject clone = obj;
            if (obj.isConnector()) {
                Set<String> outside = new HashSet<>();
                for (ConnectorSide side : ConnectorSide.values()) {
                    String bound = side.endpointOf(obj.connector()).objectId();
                    if (bound != null && !selectedIds.contains(bound)) outside.add(bound);
                }
                clone = resolver.detach(obj, outside);
            } else if (obj.isFrame()) {
                FramePayload frame = obj.frame();
                clone = obj.withPayload(frame.withChildren(
                        frame.children().stream().filter(selectedIds::contains).toList()));
            }
            clones.add(clone);
        }
        return BoardObjectJson.writeAll(clones);
    }

    /**
     * Inserts copies of serialized objects under fresh ids. With {@code relativeOffset} the copies
     * shift by {@code placement}; otherwise they are centered on it.
     *
     * @return the new ids in insertion order
     */
    public List<String> pasteSerialized(JsonNode payload, Point placement, boolean relativeOffset) {
        List<BoardObject> source = BoardObjectJson.readAll(payload);
        if (source.isEmpty()) return List.of();

        Map<String, String> idMap = new LinkedHashMap<>();
        for (BoardObject obj : source) {
            idMap.put(obj.getId(), ids.nextId());
        }

        List<BoardObject> clones = new ArrayList<>();
        for (BoardObject obj : source) {
            clones.add(remap(obj, idMap));
        }

        List<BoardObject> placeable = clones.stream().filter(o -> !o.isConnector()).toList();
        if (!placeable.isEmpty()) {
            Bounds box = Bounds.union(placeable.stream()
                    .map(o -> new Bounds(o.getX(), o.getY(), Math.max(0, o.getWidth()), Math.max(0, o.getHeight())))
                    .toList());
            Point c = box.center();
            double dx = relativeOffset ? placement.x() : placement.x() - c.x();
            double dy = relativeOffset ? placement.y() : placement.y() - c.y();
            clones.replaceAll(o -> o.translate(dx, dy));
        }

        List<String> newIds = new ArrayList<>();
        transact(() -> {
            for (BoardObject clone : clones) {
                BoardObject obj = factory.normalize(clone);
                objects.set(obj);
                zOrder.push(obj.getId());
                newIds.add(obj.getId());
            }
            containment.syncAll(newIds);
        });
        log.debug("Pasted {} objects", newIds.size());
        return newIds;
    }

    private BoardObject remap(BoardObject obj, Map<String, String> idMap) {
        BoardObject next = obj.withId(idMap.get(obj.getId()))
                .withCreatedBy(actorId)
                .withParentFrameId(obj.getParentFrameId() != null ? idMap.get(obj.getParentFrameId()) : null);
        if (next.getPayload() instanceof ConnectorPayload connector) {
            ConnectorPayload remapped = connector;
            for (ConnectorSide side : ConnectorSide.values()) {
                if (side.endpointOf(connector) instanceof ConnectorEndpoint.Bound bound) {
                    String mapped = idMap.get(bound.objectId());
                    ConnectorEndpoint endpoint = mapped != null
                            ? ConnectorEndpoint.bound(mapped, bound.port())
                            : ConnectorEndpoint.free(obj.getX(), obj.getY());
                    remapped = side.replace(remapped, endpoint);
                }
            }
            next = next.withPayload(remapped);
        } else if (next.getPayload() instanceof FramePayload frame) {
            next = next.withPayload(frame.withChildren(
                    frame.children().stream().map(idMap::get).filter(id -> id != null).toList()));
        }
        return next;
    }

    // ---- order ----

    public void bringToFront(String id) {
        int index = zOrder.indexOf(id);
        if (index < 0 || index == zOrder.size() - 1) return;
        transact(() -> {
            zOrder.delete(index, 1);
            zOrder.push(id);
        });
    }

    /**
     * Topmost non-connector object whose nearest port lies within the attach radius of the point.
     */
    public AttachTarget getAttachableAtPoint(double x, double y, Collection<String> excludeIds) {
        Set<String> excluded = excludeIds == null ? Set.of() : new HashSet<>(excludeIds);
        double radius = settings.attachRadius();

        SpatialIndex index = new SpatialIndex();
        for (BoardObject obj : objects.values()) {
            if (!obj.isConnector() && !excluded.contains(obj.getId())) index.insert(obj);
        }
        Set<String> near = new HashSet<>();
        for (BoardObject obj : index.queryNeighbors(x, y, radius)) {
            near.add(obj.getId());
        }
        if (near.isEmpty()) return null;

        List<String> order = zOrder.toList();
        for (int i = order.size() - 1; i >= 0; i--) {
            String id = order.get(i);
            if (!near.contains(id)) continue;
            BoardObject obj = objects.get(id);
            if (obj == null) continue;
            Port port = BoardGeometry.closestPort(obj, x, y);
            if (port != null && port.distanceTo(x, y) <= radius) {
                return new AttachTarget(obj, port);
            }
        }
        return null;
    }

    // ---- tables ----

    public void updateTableCell(String tableId, String rowId, String columnId, String text) {
        BoardObject obj = objects.get(tableId);
        if (obj == null || !(obj.getPayload() instanceof TablePayload table) || text == null) return;
        if (!table.rows().contains(rowId) || !table.columns().contains(columnId)) return;
        Map<String, String> cells = new HashMap<>(table.cells());
        cells.put(TablePayload.cellKey(rowId, columnId), text);
        update(tableId, ObjectPatch.create().cells(cells));
    }

    public void updateTableRowHeight(String tableId, String rowId, double height) {
        BoardObject obj = objects.get(tableId);
        if (obj == null || !(obj.getPayload() instanceof TablePayload table)) return;
        if (!table.rows().contains(rowId) || !Double.isFinite(height)) return;
        Map<String, Double> heights = new HashMap<>(table.rowHeights());
        heights.put(rowId, Math.max(settings.minObjectSize(), height));
        updateGrid(tableId, table, table.columns(), table.rows(), table.columnWidths(), heights, table.cells());
    }

    public void addTableColumn(String tableId) {
        BoardObject obj = objects.get(tableId);
        if (obj == null || !(obj.getPayload() instanceof TablePayload table)) return;
        String columnId = "c" + ids.nextId();
        List<String> columns = new ArrayList<>(table.columns());
        columns.add(columnId);
        Map<String, Double> widths = new HashMap<>(table.columnWidths());
        widths.put(columnId, TablePayload.DEFAULT_COLUMN_WIDTH);
        updateGrid(tableId, table, columns, table.rows(), widths, table.rowHeights(), table.cells());
    }

    public void addTableRow(String tableId) {
        BoardObject obj = objects.get(tableId);
        if (obj == null || !(obj.getPayload() instanceof TablePayload table)) return;
        String rowId = "r" + ids.nextId();
        List<String> rows = new ArrayList<>(table.rows());
        rows.add(rowId);
        Map<String, Double> heights = new HashMap<>(table.rowHeights());
        heights.put(rowId, TablePayload.DEFAULT_ROW_HEIGHT);
        updateGrid(tableId, table, table.columns(), rows, table.columnWidths(), heights, table.cells());
    }

    /**
     * Removes a column and its cells. The last column is never removed.
     */
    public void deleteTableColumn(String tableId, String columnId) {
        BoardObject obj = objects.get(tableId);
        if (obj == null || !(obj.getPayload() instanceof TablePayload table)) return;
        if (table.columns().size() <= 1 || !table.columns().contains(columnId)) return;
        List<String> columns = new ArrayList<>(table.columns());
        columns.remove(columnId);
        Map<String, Double> widths = new HashMap<>(table.columnWidths());
        widths.remove(columnId);
        Map<String, String> cells = new HashMap<>(table.cells());
        for (String rowId : table.rows()) {
            cells.remove(TablePayload.cellKey(rowId, columnId));
        }
        updateGrid(tableId, table, columns, table.rows(), widths, table.rowHeights(), cells);
    }

    /**
     * Removes a row and its cells. The last row is never removed.
     */
    public void deleteTableRow(String tableId, String rowId) {
        BoardObject obj = objects.get(tableId);
        if (obj == null || !(obj.getPayload() instanceof TablePayload table)) return;
        if (table.rows().size() <= 1 || !table.rows().contains(rowId)) return;
        List<String> rows = new ArrayList<>(table.rows());
        rows.remove(rowId);
        Map<String, Double> heights = new HashMap<>(table.rowHeights());
        heights.remove(rowId);
        Map<String, String> cells = new HashMap<>(table.cells());
        for (String columnId : table.columns()) {
            cells.remove(TablePayload.cellKey(rowId, columnId));
        }
        updateGrid(tableId, table, table.columns(), rows, table.columnWidths(), heights, cells);
    }

    private void updateGrid(String tableId, TablePayload table, List<String> columns, List<String> rows,
                            Map<String, Double> widths, Map<String, Double> heights, Map<String, String> cells) {
        TablePayload next = table.withGrid(columns, rows, widths, heights, cells);
        update(tableId, ObjectPatch.create()
                .tableGrid(columns, rows, widths, heights)
                .cells(cells)
                .size(next.totalWidth(), next.totalHeight()));
    }

    // ---- reads ----

    public BoardObject getObject(String id) {
        return objects.get(id);
    }

    /**
     * Every object in z-order, frames first.
     */
    public List<BoardObject> getAll() {
        List<BoardObject> frames = new ArrayList<>();
        List<BoardObject> others = new ArrayList<>();
        for (String id : zOrder.toList()) {
            BoardObject obj = objects.get(id);
            if (obj == null) continue;
            (obj.isFrame() ? frames : others).add(obj);
        }
        frames.addAll(others);
        return frames;
    }

    public List<String> getZOrder() {
        return zOrder.toList();
    }

    /**
     * Text shown for an object: sticky text, text content, frame or table title.
     */
    public static String displayText(BoardObject obj) {
        if (obj.getPayload() instanceof StickyPayload sticky) return sticky.text();
        if (obj.getPayload() instanceof TextPayload text) return text.content();
        if (obj.getPayload() instanceof FramePayload frame) return frame.title();
        if (obj.getPayload() instanceof TablePayload table) return table.title();
        return null;
    }

    private void transact(Runnable body) {
        document.transact(origin, body);
    }
}
