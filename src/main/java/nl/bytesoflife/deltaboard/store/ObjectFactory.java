package nl.bytesoflife.deltaboard.store;

import nl.bytesoflife.deltaboard.config.BoardSettings;
import nl.bytesoflife.deltaboard.geometry.BoardGeometry;
import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.ConnectorEndpoint;
import nl.bytesoflife.deltaboard.model.ConnectorPayload;
import nl.bytesoflife.deltaboard.model.ConnectorStyle;
import nl.bytesoflife.deltaboard.model.FramePayload;
import nl.bytesoflife.deltaboard.model.ObjectPayload;
import nl.bytesoflife.deltaboard.model.ObjectType;
import nl.bytesoflife.deltaboard.model.ShapeKind;
import nl.bytesoflife.deltaboard.model.ShapePayload;
import nl.bytesoflife.deltaboard.model.StickyPayload;
import nl.bytesoflife.deltaboard.model.TablePayload;
import nl.bytesoflife.deltaboard.model.TextPayload;
import nl.bytesoflife.deltaboard.model.TextStyle;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds new objects with per-variant defaults and enforces the per-object invariants
 * (size floor, rotation range) shared by every mutation path.
 */
public class ObjectFactory {

    private final BoardSettings settings;

    public ObjectFactory(BoardSettings settings) {
        this.settings = settings;
    }

    public static double defaultWidth(ObjectType type) {
        return switch (type) {
            case STICKY -> 150;
            case SHAPE -> 200;
            case TEXT -> 220;
            case FRAME -> 360;
            case CONNECTOR -> 0;
            case TABLE -> 3 * TablePayload.DEFAULT_COLUMN_WIDTH;
        };
    }

    public static double defaultHeight(ObjectType type) {
        return switch (type) {
            case STICKY -> 150;
            case SHAPE -> 120;
            case TEXT -> 60;
            case FRAME -> 240;
            case CONNECTOR -> 0;
            case TABLE -> TablePayload.TITLE_HEIGHT + 3 * TablePayload.DEFAULT_ROW_HEIGHT;
        };
    }

    /**
     * Variant defaults. Connectors start with both ends free at {@code (x, y)}.
     */
    public static ObjectPayload defaultPayload(ObjectType type, double x, double y) {
        return switch (type) {
            case STICKY -> new StickyPayload("", "yellow");
            case SHAPE -> new ShapePayload(ShapeKind.RECTANGLE, null, ShapePayload.DEFAULT_STROKE);
            case TEXT -> new TextPayload("", TextPayload.DEFAULT_COLOR, TextStyle.DEFAULT);
            case CONNECTOR -> new ConnectorPayload(ConnectorEndpoint.free(x, y), ConnectorEndpoint.free(x, y),
                    ConnectorStyle.ARROW, List.of());
            case FRAME -> new FramePayload(FramePayload.DEFAULT_TITLE, FramePayload.DEFAULT_COLOR, List.of());
            case TABLE -> defaultTable();
        };
    }

    private static TablePayload defaultTable() {
        List<String> columns = List.of("c1", "c2", "c3");
        List<String> rows = List.of("r1", "r2", "r3");
        Map<String, Double> widths = new LinkedHashMap<>();
        for (String c : columns) widths.put(c, TablePayload.DEFAULT_COLUMN_WIDTH);
        Map<String, Double> heights = new LinkedHashMap<>();
        for (String r : rows) heights.put(r, TablePayload.DEFAULT_ROW_HEIGHT);
        return new TablePayload(TablePayload.DEFAULT_TITLE, TablePayload.DEFAULT_COLOR,
                columns, rows, widths, heights, Map.of());
    }

    /**
     * A fresh object with defaults, {@code extra} merged on top and invariants applied.
     */
    public BoardObject create(String id, ObjectType type, double x, double y, double width, double height,
                              ObjectPatch extra, String createdBy) {
        BoardObject obj = new BoardObject(id, x, y, width, height, 0, createdBy, null, defaultPayload(type, x, y));
        if (extra != null) {
            obj = extra.applyTo(obj);
        }
        return normalize(obj);
    }

    /**
     * Clamps width and height to the floor and folds rotation into [0, 360).
     * Connectors keep their zero box.
     */
    public BoardObject normalize(BoardObject obj) {
        double rotation = BoardGeometry.normalizeAngle(obj.getRotation());
        if (obj.isConnector()) {
            return obj.withBounds(obj.getX(), obj.getY(), 0, 0).withRotation(rotation);
        }
        double min = settings.minObjectSize();
        double width = Double.isFinite(obj.getWidth()) ? Math.max(min, obj.getWidth()) : min;
        double height = Double.isFinite(obj.getHeight()) ? Math.max(min, obj.getHeight()) : min;
        return obj.withBounds(obj.getX(), obj.getY(), width, height).withRotation(rotation);
    }
}
