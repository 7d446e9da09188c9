package nl.bytesoflife.deltaboard.store;

import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.ConnectorEndpoint;
import nl.bytesoflife.deltaboard.model.ConnectorPayload;
import nl.bytesoflife.deltaboard.model.ConnectorStyle;
import nl.bytesoflife.deltaboard.model.FramePayload;
import nl.bytesoflife.deltaboard.model.ObjectPayload;
import nl.bytesoflife.deltaboard.model.PayloadVisitor;
import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.model.ShapeKind;
import nl.bytesoflife.deltaboard.model.ShapePayload;
import nl.bytesoflife.deltaboard.model.StickyPayload;
import nl.bytesoflife.deltaboard.model.TablePayload;
import nl.bytesoflife.deltaboard.model.TextPayload;
import nl.bytesoflife.deltaboard.model.TextStyle;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a board object. Unset fields leave the target untouched; fields that do not
 * apply to the target's variant are ignored. Containment bookkeeping ({@code parentFrameId},
 * frame children) is never patchable.
 */
public final class ObjectPatch {

    private Double x;
    private Double y;
    private Double width;
    private Double height;
    private Double rotation;
    private String createdBy;

    private String text;
    private String content;
    private String title;
    private String color;
    private String strokeColor;
    private ShapeKind shapeKind;
    private TextStyle textStyle;

    private ConnectorEndpoint from;
    private ConnectorEndpoint to;
    private ConnectorStyle connectorStyle;
    private List<Point> points;

    private List<String> columns;
    private List<String> rows;
    private Map<String, Double> columnWidths;
    private Map<String, Double> rowHeights;
    private Map<String, String> cells;

    public static ObjectPatch create() {
        return new ObjectPatch();
    }

    public ObjectPatch x(double x) { this.x = x; return this; }
    public ObjectPatch y(double y) { this.y = y; return this; }
    public ObjectPatch position(double x, double y) { this.x = x; this.y = y; return this; }
    public ObjectPatch width(double width) { this.width = width; return this; }
    public ObjectPatch height(double height) { this.height = height; return this; }
    public ObjectPatch size(double width, double height) { this.width = width; this.height = height; return this; }
    public ObjectPatch rotation(double rotation) { this.rotation = rotation; return this; }
    public ObjectPatch createdBy(String createdBy) { this.createdBy = createdBy; return this; }

    /** Sticky note text. */
    public ObjectPatch text(String text) { this.text = text; return this; }
    /** Text object content. */
    public ObjectPatch content(String content) { this.content = content; return this; }
    /** Frame or table title. */
    public ObjectPatch title(String title) { this.title = title; return this; }
    public ObjectPatch color(String color) { this.color = color; return this; }
    public ObjectPatch strokeColor(String strokeColor) { this.strokeColor = strokeColor; return this; }
    public ObjectPatch shapeKind(ShapeKind shapeKind) { this.shapeKind = shapeKind; return this; }
    public ObjectPatch textStyle(TextStyle textStyle) { this.textStyle = textStyle; return this; }

    public ObjectPatch from(ConnectorEndpoint from) { this.from = from; return this; }
    public ObjectPatch to(ConnectorEndpoint to) { this.to = to; return this; }
    public ObjectPatch connectorStyle(ConnectorStyle style) { this.connectorStyle = style; return this; }
    public ObjectPatch points(List<Point> points) { this.points = points; return this; }

    public ObjectPatch tableGrid(List<String> columns, List<String> rows,
                                 Map<String, Double> columnWidths, Map<String, Double> rowHeights) {
        this.columns = columns;
        this.rows = rows;
        this.columnWidths = columnWidths;
        this.rowHeights = rowHeights;
        return this;
    }

    public ObjectPatch cells(Map<String, String> cells) { this.cells = cells; return this; }

    public Double getX() { return x; }
    public Double getY() { return y; }
    public Double getWidth() { return width; }
    public Double getHeight() { return height; }
    public Double getRotation() { return rotation; }
    public String getTitle() { return title; }
    public String getColor() { return color; }

    public boolean isEmpty() {
        return x == null && y == null && width == null && height == null && rotation == null && createdBy == null
                && text == null && content == null && title == null && color == null && strokeColor == null
                && shapeKind == null && textStyle == null && from == null && to == null && connectorStyle == null
                && points == null && columns == null && rows == null && columnWidths == null
                && rowHeights == null && cells == null;
    }

    /**
     * Merges this patch into {@code target}. No size floor or angle normalization happens here.
     */
    public BoardObject applyTo(BoardObject target) {
        BoardObject next = target.withBounds(
                x != null ? x : target.getX(),
                y != null ? y : target.getY(),
                width != null ? width : target.getWidth(),
                height != null ? height : target.getHeight());
        if (rotation != null) next = next.withRotation(rotation);
        if (createdBy != null) next = next.withCreatedBy(createdBy);
        return next.withPayload(applyTo(target.getPayload()));
    }

    public ObjectPayload applyTo(ObjectPayload payload) {
        return payload.accept(new PayloadVisitor<ObjectPayload>() {
            @Override
            public ObjectPayload visitSticky(StickyPayload sticky) {
                return new StickyPayload(or(text, sticky.text()), or(color, sticky.color()));
            }

            @Override
            public ObjectPayload visitShape(ShapePayload shape) {
                return new ShapePayload(or(shapeKind, shape.kind()), or(color, shape.color()),
                        or(strokeColor, shape.strokeColor()));
            }

            @Override
            public ObjectPayload visitText(TextPayload textPayload) {
                return new TextPayload(or(content, textPayload.content()), or(color, textPayload.color()),
                        or(textStyle, textPayload.style()));
            }

            @Override
            public ObjectPayload visitConnector(ConnectorPayload connector) {
                return new ConnectorPayload(or(from, connector.from()), or(to, connector.to()),
                        or(connectorStyle, connector.style()), or(points, connector.points()));
            }

            @Override
            public ObjectPayload visitFrame(FramePayload frame) {
                return new FramePayload(or(title, frame.title()), or(color, frame.color()), frame.children());
            }

            @Override
            public ObjectPayload visitTable(TablePayload table) {
                return new TablePayload(or(title, table.title()), or(color, table.color()),
                        or(columns, table.columns()), or(rows, table.rows()),
                        or(columnWidths, table.columnWidths()), or(rowHeights, table.rowHeights()),
                        or(cells, table.cells()));
            }
        });
    }

    private static <T> T or(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
