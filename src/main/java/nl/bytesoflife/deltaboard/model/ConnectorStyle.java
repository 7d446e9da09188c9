package nl.bytesoflife.deltaboard.model;

import java.util.Locale;

public enum ConnectorStyle {
    LINE("line"),
    ARROW("arrow");

    private final String wireName;

    ConnectorStyle(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static ConnectorStyle fromWireName(String name) {
        if (name == null) return null;
        return switch (name.toLowerCase(Locale.ROOT).trim()) {
            case "line" -> LINE;
            case "arrow" -> ARROW;
            default -> null;
        };
    }
}
