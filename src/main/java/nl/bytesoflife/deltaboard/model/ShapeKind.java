package nl.bytesoflife.deltaboard.model;

import java.util.Locale;

public enum ShapeKind {
    RECTANGLE("rectangle"),
    ELLIPSE("ellipse");

    private final String wireName;

    ShapeKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static ShapeKind fromWireName(String name) {
        if (name == null) return null;
        return switch (name.toLowerCase(Locale.ROOT).trim()) {
            case "rectangle" -> RECTANGLE;
            case "ellipse" -> ELLIPSE;
            default -> null;
        };
    }
}
