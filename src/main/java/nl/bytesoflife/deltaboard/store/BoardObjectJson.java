package nl.bytesoflife.deltaboard.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.ConnectorEndpoint;
import nl.bytesoflife.deltaboard.model.ConnectorPayload;
import nl.bytesoflife.deltaboard.model.ConnectorStyle;
import nl.bytesoflife.deltaboard.model.FramePayload;
import nl.bytesoflife.deltaboard.model.ObjectPayload;
import nl.bytesoflife.deltaboard.model.ObjectType;
import nl.bytesoflife.deltaboard.model.PayloadVisitor;
import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.model.PortName;
import nl.bytesoflife.deltaboard.model.ShapeKind;
import nl.bytesoflife.deltaboard.model.ShapePayload;
import nl.bytesoflife.deltaboard.model.StickyPayload;
import nl.bytesoflife.deltaboard.model.TablePayload;
import nl.bytesoflife.deltaboard.model.TextPayload;
import nl.bytesoflife.deltaboard.model.TextSize;
import nl.bytesoflife.deltaboard.model.TextStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flat JSON form of board objects, used for the clipboard and for agent results.
 * Unknown fields are ignored on read and missing ones get the variant's defaults.
 */
public final class BoardObjectJson {

    private static final Logger log = LoggerFactory.getLogger(BoardObjectJson.class);

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private BoardObjectJson() {
    }

    public static ArrayNode writeAll(List<BoardObject> objects) {
        ArrayNode array = MAPPER.createArrayNode();
        for (BoardObject obj : objects) {
            array.add(write(obj));
        }
        return array;
    }

    public static ObjectNode write(BoardObject obj) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", obj.getId());
        node.put("type", obj.getType().getWireName());
        node.put("x", obj.getX());
        node.put("y", obj.getY());
        node.put("width", obj.getWidth());
        node.put("height", obj.getHeight());
        node.put("rotation", obj.getRotation());
        node.put("createdBy", obj.getCreatedBy());
        node.put("parentFrameId", obj.getParentFrameId());
        obj.getPayload().accept(new PayloadWriter(node));
        return node;
    }

    /**
     * Reads every well-formed entry of a JSON array; malformed entries are logged and skipped.
     */
    public static List<BoardObject> readAll(JsonNode array) {
        List<BoardObject> out = new ArrayList<>();
        if (array == null || !array.isArray()) return out;
        for (JsonNode node : array) {
            try {
                out.add(read(node));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed board object: {}", e.getMessage());
            }
        }
        return out;
    }

    /**
     * @throws IllegalArgumentException when the id is missing or the type is unknown
     */
    public static BoardObject read(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object");
        }
        String id = text(node, "id", null);
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Object has no id");
        }
        String typeName = text(node, "type", null);
        ObjectType type = ObjectType.fromWireName(typeName);
        if (type == null) {
            throw new IllegalArgumentException("Object " + id + " has unknown type '" + typeName + "'");
        }

        double x = number(node, "x", 0);
        double y = number(node, "y", 0);
        ObjectPayload payload = readPayload(type, typeName, node, x, y);
        return new BoardObject(id, x, y,
                number(node, "width", ObjectFactory.defaultWidth(type)),
                number(node, "height", ObjectFactory.defaultHeight(type)),
                number(node, "rotation", 0),
                text(node, "createdBy", null),
                text(node, "parentFrameId", null),
                payload);
    }

    private static ObjectPayload readPayload(ObjectType type, String typeName, JsonNode node, double x, double y) {
        String color = text(node, "color", null);
        return switch (type) {
            case STICKY -> new StickyPayload(text(node, "text", ""), color);
            case SHAPE -> {
                ShapeKind kind = ShapeKind.fromWireName(text(node, "shapeKind", typeName));
                yield new ShapePayload(kind, color, text(node, "strokeColor", null));
            }
            case TEXT -> new TextPayload(text(node, "content", ""), color, readStyle(node.get("style")));
            case CONNECTOR -> new ConnectorPayload(
                    readEndpoint(node, "from", x, y),
                    readEndpoint(node, "to", x, y),
                    ConnectorStyle.fromWireName(text(node, "style", null)),
                    readPoints(node.get("points")));
            case FRAME -> new FramePayload(text(node, "title", null), color, readStrings(node.get("children")));
            case TABLE -> new TablePayload(text(node, "title", null), color,
                    readStrings(node.get("columns")), readStrings(node.get("rows")),
                    readNumbers(node.get("columnWidths")), readNumbers(node.get("rowHeights")),
                    readTexts(node.get("cells")));
        };
    }

    private static TextStyle readStyle(JsonNode node) {
        if (node == null || !node.isObject()) return TextStyle.DEFAULT;
        return new TextStyle(node.path("bold").asBoolean(false), node.path("italic").asBoolean(false),
                TextSize.fromWireName(node.path("size").asText(null)));
    }

    /**
     * A bound id wins over a stored point; without either the end sits at the connector origin.
     */
    private static ConnectorEndpoint readEndpoint(JsonNode node, String prefix, double x, double y) {
        String objectId = text(node, prefix + "Id", null);
        if (objectId != null && !objectId.isBlank()) {
            return ConnectorEndpoint.bound(objectId, PortName.fromWireName(text(node, prefix + "Port", null)));
        }
        Point point = readPoint(node.get(prefix + "Point"));
        return ConnectorEndpoint.free(point != null ? point : new Point(x, y));
    }

    private static Point readPoint(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        JsonNode px = node.get("x");
        JsonNode py = node.get("y");
        if (px == null || py == null || !px.isNumber() || !py.isNumber()) return null;
        return new Point(px.asDouble(), py.asDouble());
    }

    private static List<Point> readPoints(JsonNode node) {
        List<Point> points = new ArrayList<>();
        if (node == null || !node.isArray()) return points;
        for (JsonNode element : node) {
            Point p = readPoint(element);
            if (p != null) points.add(p);
        }
        return points;
    }

    private static List<String> readStrings(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || !node.isArray()) return out;
        for (JsonNode element : node) {
            if (element.isTextual()) out.add(element.asText());
        }
        return out;
    }

    private static Map<String, Double> readNumbers(JsonNode node) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) return out;
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue().isNumber()) out.put(e.getKey(), e.getValue().asDouble());
        }
        return out;
    }

    private static Map<String, String> readTexts(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) return out;
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue().isTextual()) out.put(e.getKey(), e.getValue().asText());
        }
        return out;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : fallback;
    }

    private static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) return fallback;
        double d = value.asDouble();
        return Double.isFinite(d) ? d : fallback;
    }

    private static ObjectNode pointNode(Point p) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("x", p.x());
        node.put("y", p.y());
        return node;
    }

    private static final class PayloadWriter implements PayloadVisitor<Void> {

        private final ObjectNode node;

        PayloadWriter(ObjectNode node) {
            this.node = node;
        }

        @Override
        public Void visitSticky(StickyPayload sticky) {
            node.put("text", sticky.text());
            node.put("color", sticky.color());
            return null;
        }

        @Override
        public Void visitShape(ShapePayload shape) {
            node.put("shapeKind", shape.kind().getWireName());
            node.put("color", shape.color());
            node.put("strokeColor", shape.strokeColor());
            return null;
        }

        @Override
        public Void visitText(TextPayload text) {
            node.put("content", text.content());
            node.put("color", text.color());
            ObjectNode style = node.putObject("style");
            style.put("bold", text.style().bold());
            style.put("italic", text.style().italic());
            style.put("size", text.style().size().getWireName());
            return null;
        }

        @Override
        public Void visitConnector(ConnectorPayload connector) {
            writeEndpoint("from", connector.from());
            writeEndpoint("to", connector.to());
            node.put("style", connector.style().getWireName());
            ArrayNode points = node.putArray("points");
            for (Point p : connector.points()) {
                points.add(pointNode(p));
            }
            return null;
        }

        private void writeEndpoint(String prefix, ConnectorEndpoint endpoint) {
            if (endpoint instanceof ConnectorEndpoint.Bound bound) {
                node.put(prefix + "Id", bound.objectId());
                node.put(prefix + "Port", bound.port() != null ? bound.port().getWireName() : null);
                node.putNull(prefix + "Point");
            } else {
                node.putNull(prefix + "Id");
                node.putNull(prefix + "Port");
                node.set(prefix + "Point", pointNode(((ConnectorEndpoint.Free) endpoint).point()));
            }
        }

        @Override
        public Void visitFrame(FramePayload frame) {
            node.put("title", frame.title());
            node.put("color", frame.color());
            ArrayNode children = node.putArray("children");
            frame.children().forEach(children::add);
            return null;
        }

        @Override
        public Void visitTable(TablePayload table) {
            node.put("title", table.title());
            node.put("color", table.color());
            ArrayNode columns = node.putArray("columns");
            table.columns().forEach(columns::add);
            ArrayNode rows = node.putArray("rows");
            table.rows().forEach(rows::add);
            ObjectNode widths = node.putObject("columnWidths");
            for (String c : table.columns()) widths.put(c, table.columnWidth(c));
            ObjectNode heights = node.putObject("rowHeights");
            for (String r : table.rows()) heights.put(r, table.rowHeight(r));
            ObjectNode cells = node.putObject("cells");
            new TreeMap<>(table.cells()).forEach(cells::put);
            return null;
        }
    }
}
