package nl.bytesoflife.deltaboard.model;

import java.util.Locale;

public enum ObjectType {
    STICKY("sticky"),
    SHAPE("shape"),
    TEXT("text"),
    CONNECTOR("connector"),
    FRAME("frame"),
    TABLE("table");

    private final String wireName;

    ObjectType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a wire name. The legacy shape names "rectangle" and "ellipse" map to {@link #SHAPE}.
     * Returns null for anything else.
     */
    public static ObjectType fromWireName(String name) {
        if (name == null) return null;
        String lower = name.toLowerCase(Locale.ROOT).trim();
        if (lower.equals("rectangle") || lower.equals("ellipse")) return SHAPE;
        for (ObjectType type : values()) {
            if (type.wireName.equals(lower)) return type;
        }
        return null;
    }
}
