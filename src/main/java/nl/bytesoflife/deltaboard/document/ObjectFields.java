package nl.bytesoflife.deltaboard.document;

import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.ConnectorEndpoint;
import nl.bytesoflife.deltaboard.model.ConnectorPayload;
import nl.bytesoflife.deltaboard.model.ConnectorStyle;
import nl.bytesoflife.deltaboard.model.FramePayload;
import nl.bytesoflife.deltaboard.model.ObjectPayload;
import nl.bytesoflife.deltaboard.model.ObjectType;
import nl.bytesoflife.deltaboard.model.PayloadVisitor;
import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.model.ShapeKind;
import nl.bytesoflife.deltaboard.model.ShapePayload;
import nl.bytesoflife.deltaboard.model.StickyPayload;
import nl.bytesoflife.deltaboard.model.TablePayload;
import nl.bytesoflife.deltaboard.model.TextPayload;
import nl.bytesoflife.deltaboard.model.TextStyle;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits a {@link BoardObject} into its top-level fields and puts it back together. Fields are
 * the unit of replication: concurrent writes to different fields of one object both survive.
 * Values are immutable (boxed numbers, strings, enums, records, copied collections).
 */
final class ObjectFields {

    static final String TYPE = "type";
    static final String X = "x";
    static final String Y = "y";
    static final String WIDTH = "width";
    static final String HEIGHT = "height";
    static final String ROTATION = "rotation";
    static final String CREATED_BY = "createdBy";
    static final String PARENT_FRAME_ID = "parentFrameId";
    static final String COLOR = "color";
    static final String TEXT = "text";
    static final String SHAPE_KIND = "shapeKind";
    static final String STROKE_COLOR = "strokeColor";
    static final String CONTENT = "content";
    static final String STYLE = "style";
    static final String FROM = "from";
    static final String TO = "to";
    static final String POINTS = "points";
    static final String TITLE = "title";
    static final String CHILDREN = "children";
    static final String COLUMNS = "columns";
    static final String ROWS = "rows";
    static final String COLUMN_WIDTHS = "columnWidths";
    static final String ROW_HEIGHTS = "rowHeights";
    static final String CELLS = "cells";

    private ObjectFields() {
    }

    static Map<String, Object> read(BoardObject obj) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TYPE, obj.getType());
        fields.put(X, obj.getX());
        fields.put(Y, obj.getY());
        fields.put(WIDTH, obj.getWidth());
        fields.put(HEIGHT, obj.getHeight());
        fields.put(ROTATION, obj.getRotation());
        fields.put(CREATED_BY, obj.getCreatedBy());
        fields.put(PARENT_FRAME_ID, obj.getParentFrameId());
        obj.getPayload().accept(new PayloadReader(fields));
        return fields;
    }

    /**
     * Fields whose value differs between two states of the same object, mapped to their value in {@code after}.
     */
    static Map<String, Object> diff(BoardObject before, BoardObject after) {
        Map<String, Object> from = read(before);
        Map<String, Object> to = read(after);
        Map<String, Object> changed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : to.entrySet()) {
            if (!from.containsKey(entry.getKey()) || !Objects.equals(from.get(entry.getKey()), entry.getValue())) {
                changed.put(entry.getKey(), entry.getValue());
            }
        }
        return changed;
    }

    /**
     * Rebuilds an object. Missing or mistyped payload fields take the variant defaults.
     *
     * @throws IllegalStateException when the type field was never written
     */
    static BoardObject assemble(String id, Map<String, Object> fields) {
        ObjectType type = value(fields, TYPE, ObjectType.class);
        if (type == null) {
            throw new IllegalStateException("Object " + id + " has no type field");
        }
        double x = number(fields, X, 0);
        double y = number(fields, Y, 0);
        String color = value(fields, COLOR, String.class);
        ObjectPayload payload = switch (type) {
            case STICKY -> new StickyPayload(value(fields, TEXT, String.class), color);
            case SHAPE -> new ShapePayload(value(fields, SHAPE_KIND, ShapeKind.class), color,
                    value(fields, STROKE_COLOR, String.class));
            case TEXT -> new TextPayload(value(fields, CONTENT, String.class), color,
                    value(fields, STYLE, TextStyle.class));
            case CONNECTOR -> new ConnectorPayload(endpoint(fields, FROM, x, y), endpoint(fields, TO, x, y),
                    value(fields, STYLE, ConnectorStyle.class), list(fields, POINTS));
            case FRAME -> new FramePayload(value(fields, TITLE, String.class), color, list(fields, CHILDREN));
            case TABLE -> new TablePayload(value(fields, TITLE, String.class), color,
                    list(fields, COLUMNS), list(fields, ROWS),
                    map(fields, COLUMN_WIDTHS), map(fields, ROW_HEIGHTS), map(fields, CELLS));
        };
        return new BoardObject(id, x, y, number(fields, WIDTH, 0), number(fields, HEIGHT, 0),
                number(fields, ROTATION, 0), value(fields, CREATED_BY, String.class),
                value(fields, PARENT_FRAME_ID, String.class), payload);
    }

    /**
     * {@code current} with the fields that changed between {@code from} and {@code to} set to their
     * value in {@code to}. Fields the two states agree on keep whatever {@code current} holds.
     */
    static BoardObject overlay(BoardObject current, BoardObject from, BoardObject to) {
        Map<String, Object> changed = diff(from, to);
        if (changed.isEmpty()) return current;
        Map<String, Object> fields = read(current);
        fields.putAll(changed);
        return assemble(current.getId(), fields);
    }

    private static <T> T value(Map<String, Object> fields, String key, Class<T> type) {
        Object value = fields.get(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    private static double number(Map<String, Object> fields, String key, double fallback) {
        Object value = fields.get(key);
        return value instanceof Number n ? n.doubleValue() : fallback;
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> list(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        return value instanceof List<?> l ? (List<T>) l : null;
    }

    @SuppressWarnings("unchecked")
    private static <V> Map<String, V> map(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        return value instanceof Map<?, ?> m ? (Map<String, V>) m : null;
    }

    private static ConnectorEndpoint endpoint(Map<String, Object> fields, String key, double x, double y) {
        ConnectorEndpoint endpoint = value(fields, key, ConnectorEndpoint.class);
        return endpoint != null ? endpoint : ConnectorEndpoint.free(new Point(x, y));
    }

    private static final class PayloadReader implements PayloadVisitor<Void> {

        private final Map<String, Object> fields;

        PayloadReader(Map<String, Object> fields) {
            this.fields = fields;
        }

        @Override
        public Void visitSticky(StickyPayload sticky) {
            fields.put(TEXT, sticky.text());
            fields.put(COLOR, sticky.color());
            return null;
        }

        @Override
        public Void visitShape(ShapePayload shape) {
            fields.put(SHAPE_KIND, shape.kind());
            fields.put(COLOR, shape.color());
            fields.put(STROKE_COLOR, shape.strokeColor());
            return null;
        }

        @Override
        public Void visitText(TextPayload text) {
            fields.put(CONTENT, text.content());
            fields.put(COLOR, text.color());
            fields.put(STYLE, text.style());
            return null;
        }

        @Override
        public Void visitConnector(ConnectorPayload connector) {
            fields.put(FROM, connector.from());
            fields.put(TO, connector.to());
            fields.put(STYLE, connector.style());
            fields.put(POINTS, connector.points());
            return null;
        }

        @Override
        public Void visitFrame(FramePayload frame) {
            fields.put(TITLE, frame.title());
            fields.put(COLOR, frame.color());
            fields.put(CHILDREN, frame.children());
            return null;
        }

        @Override
        public Void visitTable(TablePayload table) {
            fields.put(TITLE, table.title());
            fields.put(COLOR, table.color());
            fields.put(COLUMNS, table.columns());
            fields.put(ROWS, table.rows());
            fields.put(COLUMN_WIDTHS, table.columnWidths());
            fields.put(ROW_HEIGHTS, table.rowHeights());
            fields.put(CELLS, table.cells());
            return null;
        }
    }
}
