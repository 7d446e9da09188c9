package nl.bytesoflife.deltaboard.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import nl.bytesoflife.deltaboard.config.BoardSettings;
import nl.bytesoflife.deltaboard.geometry.BoardGeometry;
import nl.bytesoflife.deltaboard.model.TextPayload;
import nl.bytesoflife.deltaboard.store.BoardObjectJson;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalizes raw agent arguments. Nothing is rejected: out-of-range numbers are clamped,
 * unknown enum values and wrongly typed fields fall back to defaults, strings are truncated.
 * Optional coordinates stay null so the runner can auto-place.
 */
public class ToolArgumentValidator {

    public static final List<String> PALETTE = List.of(
            "yellow", "blue", "green", "pink", "purple", "orange", "red", "teal", "black");
    public static final List<String> CONNECTOR_STYLES = List.of("line", "arrow");
    public static final List<String> TEXT_SIZES = List.of("small", "medium", "large");
    public static final List<String> SHAPE_KINDS = List.of("rectangle", "ellipse");

    public static final int MAX_BATCH_ITEMS = 100;
    public static final int MAX_GRID_IDS = 500;
    public static final int MAX_STICKY_TEXT = 2000;
    public static final int MAX_TEXT = 4000;
    public static final int MAX_FRAME_TITLE = 160;
    public static final int MAX_TABLE_TITLE = 200;
    public static final int MAX_TABLE_COLUMNS = 20;
    public static final int MAX_TABLE_ROWS = 100;
    public static final int MAX_HEADER_TEXT = 200;
    public static final int MAX_CELL_TEXT = 500;
    public static final int MAX_ID_LENGTH = 128;

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");

    private final double coordinateLimit;

    public ToolArgumentValidator(BoardSettings settings) {
        this.coordinateLimit = settings.coordinateLimit();
    }

    public ObjectNode validate(ToolName tool, JsonNode raw) {
        JsonNode a = raw != null && raw.isObject() ? raw : BoardObjectJson.MAPPER.createObjectNode();
        return switch (tool) {
            case CREATE_STICKY_NOTE -> stickyNote(a);
            case CREATE_SHAPE -> shape(a);
            case CREATE_FRAME -> frame(a);
            case CREATE_CONNECTOR -> connector(a);
            case CREATE_TEXT -> text(a);
            case CREATE_TABLE -> table(a);
            case MOVE_OBJECT -> move(a);
            case ARRANGE_OBJECTS_IN_GRID -> arrange(a);
            case RESIZE_OBJECT -> resize(a);
            case UPDATE_TEXT -> updateText(a);
            case CHANGE_COLOR -> changeColor(a);
            case ROTATE_OBJECT -> rotate(a);
            case DELETE_OBJECT -> delete(a);
            case GET_BOARD_STATE -> node();
            case BATCH_CREATE -> batchCreate(a);
            case BATCH_UPDATE -> batchUpdate(a);
            case BATCH_DELETE -> batchDelete(a);
        };
    }

    private ObjectNode stickyNote(JsonNode a) {
        ObjectNode out = node();
        out.put("text", clampText(a.get("text"), MAX_STICKY_TEXT, ""));
        coordOrNull(out, a, "x");
        coordOrNull(out, a, "y");
        out.put("width", clampNumber(a.get("width"), 24, 2000, 150));
        out.put("height", clampNumber(a.get("height"), 24, 2000, 150));
        out.put("color", sanitizeColor(a.get("color"), "yellow"));
        return out;
    }

    private ObjectNode shape(JsonNode a) {
        ObjectNode out = node();
        String kind = oneOf(a.get("type"), SHAPE_KINDS, "rectangle");
        out.put("type", kind);
        coordOrNull(out, a, "x");
        coordOrNull(out, a, "y");
        out.put("width", clampNumber(a.get("width"), 24, 2000, 200));
        out.put("height", clampNumber(a.get("height"), 24, 2000, 120));
        out.put("color", sanitizeColor(a.get("color"), kind.equals("ellipse") ? "teal" : "blue"));
        return out;
    }

    private ObjectNode frame(JsonNode a) {
        ObjectNode out = node();
        out.put("title", clampText(a.get("title"), MAX_FRAME_TITLE, "Frame"));
        coordOrNull(out, a, "x");
        coordOrNull(out, a, "y");
        out.put("width", clampNumber(a.get("width"), 120, 4000, 360));
        out.put("height", clampNumber(a.get("height"), 120, 4000, 240));
        return out;
    }

    private ObjectNode connector(JsonNode a) {
        ObjectNode out = node();
        putStringOrNull(out, "fromId", a.get("fromId"));
        putStringOrNull(out, "toId", a.get("toId"));
        putStringOrNull(out, "fromPort", a.get("fromPort"));
        putStringOrNull(out, "toPort", a.get("toPort"));
        pointOrNull(out, a, "fromPoint");
        pointOrNull(out, a, "toPoint");
        out.put("style", oneOf(a.get("style"), CONNECTOR_STYLES, "arrow"));
        return out;
    }

    private ObjectNode text(JsonNode a) {
        ObjectNode out = node();
        out.put("content", clampText(a.get("content"), MAX_TEXT, ""));
        coordOrNull(out, a, "x");
        coordOrNull(out, a, "y");
        out.put("width", clampNumber(a.get("width"), 24, 2000, 220));
        out.put("height", clampNumber(a.get("height"), 24, 2000, 60));
        out.put("fontSize", oneOf(a.get("fontSize"), TEXT_SIZES, "medium"));
        out.put("bold", truthy(a.get("bold")));
        out.put("italic", truthy(a.get("italic")));
        out.put("color", sanitizeColor(a.get("color"), TextPayload.DEFAULT_COLOR));
        return out;
    }

    private ObjectNode table(JsonNode a) {
        ObjectNode out = node();
        out.put("title", clampText(a.get("title"), MAX_TABLE_TITLE, "Table"));

        ArrayNode headers = out.putArray("headers");
        JsonNode rawHeaders = a.get("headers");
        if (rawHeaders != null && rawHeaders.isArray()) {
            for (JsonNode h : rawHeaders) {
                if (headers.size() >= MAX_TABLE_COLUMNS) break;
                if (h.isTextual()) headers.add(truncate(h.asText(), MAX_HEADER_TEXT));
            }
        }

        ArrayNode data = out.putArray("data");
        JsonNode rawData = a.get("data");
        if (rawData != null && rawData.isArray()) {
            for (JsonNode row : rawData) {
                if (data.size() >= MAX_TABLE_ROWS) break;
                ArrayNode cells = data.addArray();
                if (!row.isArray()) continue;
                for (JsonNode cell : row) {
                    if (cells.size() >= MAX_TABLE_COLUMNS) break;
                    cells.add(clampText(cell, MAX_CELL_TEXT, ""));
                }
            }
        }

        int columns = headers.size() > 0
                ? headers.size() : (int) clampNumber(a.get("numColumns"), 1, MAX_TABLE_COLUMNS, 3);
        int rows = data.size() > 0
                ? data.size() : (int) clampNumber(a.get("numRows"), 1, MAX_TABLE_ROWS, 3);
        out.put("numColumns", columns);
        out.put("numRows", rows);
        coordOrNull(out, a, "x");
        coordOrNull(out, a, "y");
        JsonNode color = a.get("color");
        out.put("color", color != null && color.isTextual() && HEX_COLOR.matcher(color.asText()).matches()
                ? color.asText() : "#e2e8f0");
        return out;
    }

    private ObjectNode move(JsonNode a) {
        ObjectNode out = node();
        putStringOrNull(out, "objectId", a.get("objectId"));
        out.put("x", clampCoordinate(a.get("x")));
        out.put("y", clampCoordinate(a.get("y")));
        return out;
    }

    private ObjectNode arrange(JsonNode a) {
        ObjectNode out = node();
        ArrayNode ids = out.putArray("objectIds");
        collectIds(a.get("objectIds"), ids, MAX_GRID_IDS);
        JsonNode columns = a.get("columns");
        if (columns != null && columns.isNumber()) {
            out.put("columns", (int) clampNumber(columns, 1, 24, 3));
        } else {
            out.putNull("columns");
        }
        out.put("gapX", clampNumber(a.get("gapX"), 0, 1000, 24));
        out.put("gapY", clampNumber(a.get("gapY"), 0, 1000, 24));
        coordOrNull(out, a, "originX");
        coordOrNull(out, a, "originY");
        return out;
    }

    private ObjectNode resize(JsonNode a) {
        ObjectNode out = node();
        putStringOrNull(out, "objectId", a.get("objectId"));
        out.put("width", clampNumber(a.get("width"), 24, 4000, 120));
        out.put("height", clampNumber(a.get("height"), 24, 4000, 80));
        return out;
    }

    private ObjectNode updateText(JsonNode a) {
        ObjectNode out = node();
        putStringOrNull(out, "objectId", a.get("objectId"));
        out.put("newText", clampText(a.get("newText"), MAX_TEXT, ""));
        return out;
    }

    /**
     * An unknown color becomes null and the object keeps its current one.
     */
    private ObjectNode changeColor(JsonNode a) {
        ObjectNode out = node();
        putStringOrNull(out, "objectId", a.get("objectId"));
        out.put("color", sanitizeColor(a.get("color"), null));
        return out;
    }

    private ObjectNode rotate(JsonNode a) {
        ObjectNode out = node();
        putStringOrNull(out, "objectId", a.get("objectId"));
        out.put("angleDegrees", normalizeAngle(a.get("angleDegrees")));
        return out;
    }

    private ObjectNode delete(JsonNode a) {
        ObjectNode out = node();
        putStringOrNull(out, "objectId", a.get("objectId"));
        return out;
    }

    /**
     * Each item becomes {@code {tool, args}} with its own arguments validated for that tool.
     * Items with an unknown type keep {@code tool: null}.
     */
    private ObjectNode batchCreate(JsonNode a) {
        ObjectNode out = node();
        ArrayNode items = out.putArray("items");
        for (JsonNode item : capped(a.get("items"))) {
            ObjectNode entry = items.addObject();
            String type = item.path("type").isTextual() ? item.get("type").asText() : null;
            ToolName tool = createToolFor(type);
            entry.put("type", type);
            if (tool == null) {
                entry.putNull("tool");
                continue;
            }
            ObjectNode source = item.isObject() ? ((ObjectNode) item).deepCopy() : node();
            if (tool == ToolName.CREATE_SHAPE) {
                source.put("type", SHAPE_KINDS.contains(type) ? type : source.path("kind").asText("rectangle"));
            }
            entry.put("tool", tool.getWireName());
            entry.set("args", validate(tool, source));
        }
        return out;
    }

    /**
     * Absent fields stay null so the runner only touches what the item names.
     */
    private ObjectNode batchUpdate(JsonNode a) {
        ObjectNode out = node();
        ArrayNode items = out.putArray("items");
        for (JsonNode item : capped(a.get("items"))) {
            ObjectNode entry = items.addObject();
            putStringOrNull(entry, "objectId", item.get("objectId"));
            coordOrNull(entry, item, "x");
            coordOrNull(entry, item, "y");
            sizeOrNull(entry, item, "width");
            sizeOrNull(entry, item, "height");
            JsonNode newText = item.get("newText");
            if (newText != null && newText.isTextual()) {
                entry.put("newText", truncate(newText.asText(), MAX_TEXT));
            } else {
                entry.putNull("newText");
            }
            entry.put("color", sanitizeColor(item.get("color"), null));
            JsonNode angle = item.get("angleDegrees");
            if (angle != null && angle.isNumber()) {
                entry.put("angleDegrees", normalizeAngle(angle));
            } else {
                entry.putNull("angleDegrees");
            }
        }
        return out;
    }

    private ObjectNode batchDelete(JsonNode a) {
        ObjectNode out = node();
        collectIds(a.get("objectIds"), out.putArray("objectIds"), MAX_BATCH_ITEMS);
        return out;
    }

    static ToolName createToolFor(String itemType) {
        if (itemType == null) return null;
        return switch (itemType) {
            case "sticky", "stickyNote" -> ToolName.CREATE_STICKY_NOTE;
            case "shape", "rectangle", "ellipse" -> ToolName.CREATE_SHAPE;
            case "frame" -> ToolName.CREATE_FRAME;
            case "text" -> ToolName.CREATE_TEXT;
            case "connector" -> ToolName.CREATE_CONNECTOR;
            case "table" -> ToolName.CREATE_TABLE;
            default -> null;
        };
    }

    // ---- primitives ----

    static double clampNumber(JsonNode value, double min, double max, double fallback) {
        if (value == null || !value.isNumber()) return fallback;
        double d = value.asDouble();
        if (Double.isNaN(d)) return fallback;
        return Math.max(min, Math.min(max, d));
    }

    static String clampText(JsonNode value, int max, String fallback) {
        if (value == null || !value.isTextual()) return fallback;
        return truncate(value.asText(), max);
    }

    static String sanitizeColor(JsonNode value, String fallback) {
        return oneOf(value, PALETTE, fallback);
    }

    /**
     * Folds any finite angle into [0, 360). Non-numbers become 0.
     */
    static double normalizeAngle(JsonNode value) {
        if (value == null || !value.isNumber() || !Double.isFinite(value.asDouble())) return 0;
        return BoardGeometry.normalizeAngle(value.asDouble());
    }

    private static String oneOf(JsonNode value, List<String> allowed, String fallback) {
        if (value == null || !value.isTextual()) return fallback;
        return allowed.contains(value.asText()) ? value.asText() : fallback;
    }

    private static boolean truthy(JsonNode value) {
        if (value == null || value.isNull()) return false;
        if (value.isBoolean()) return value.asBoolean();
        if (value.isNumber()) return value.asDouble() != 0;
        if (value.isTextual()) return !value.asText().isEmpty();
        return true;
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }

    private double clampCoordinate(JsonNode value) {
        return clampNumber(value, -coordinateLimit, coordinateLimit, 0);
    }

    private void coordOrNull(ObjectNode out, JsonNode a, String field) {
        JsonNode value = a.get(field);
        if (value != null && value.isNumber()) {
            out.put(field, clampCoordinate(value));
        } else {
            out.putNull(field);
        }
    }

    private void pointOrNull(ObjectNode out, JsonNode a, String field) {
        JsonNode value = a.get(field);
        if (value != null && value.isObject()) {
            ObjectNode point = out.putObject(field);
            point.put("x", clampCoordinate(value.get("x")));
            point.put("y", clampCoordinate(value.get("y")));
        } else {
            out.putNull(field);
        }
    }

    private static void sizeOrNull(ObjectNode out, JsonNode a, String field) {
        JsonNode value = a.get(field);
        if (value != null && value.isNumber()) {
            out.put(field, clampNumber(value, 24, 4000, 24));
        } else {
            out.putNull(field);
        }
    }

    /**
     * Ids and port names, capped at {@value #MAX_ID_LENGTH} characters.
     */
    private static void putStringOrNull(ObjectNode out, String field, JsonNode value) {
        if (value != null && value.isTextual()) {
            out.put(field, truncate(value.asText(), MAX_ID_LENGTH));
        } else {
            out.putNull(field);
        }
    }

    private static void collectIds(JsonNode raw, ArrayNode into, int max) {
        if (raw == null || !raw.isArray()) return;
        for (JsonNode id : raw) {
            if (into.size() >= max) break;
            if (id.isTextual()) into.add(truncate(id.asText(), MAX_ID_LENGTH));
        }
    }

    private static List<JsonNode> capped(JsonNode raw) {
        if (raw == null || !raw.isArray()) return List.of();
        List<JsonNode> items = new ArrayList<>();
        for (JsonNode item : raw) {
            if (items.size() >= MAX_BATCH_ITEMS) break;
            if (item.isObject()) items.add(item);
        }
        return items;
    }

    private static ObjectNode node() {
        return BoardObjectJson.MAPPER.createObjectNode();
    }
}
