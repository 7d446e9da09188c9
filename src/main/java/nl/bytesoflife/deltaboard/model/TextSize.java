package nl.bytesoflife.deltaboard.model;

import java.util.Locale;

public enum TextSize {
    SMALL("small"),
    MEDIUM("medium"),
    LARGE("large");

    private final String wireName;

    TextSize(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static TextSize fromWireName(String name) {
        if (name == null) return null;
        return switch (name.toLowerCase(Locale.ROOT).trim()) {
            case "small" -> SMALL;
            case "medium" -> MEDIUM;
            case "large" -> LARGE;
            default -> null;
        };
    }
}
