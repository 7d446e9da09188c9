package nl.bytesoflife.deltaboard.agent;

/**
 * Tools the agent may call, by wire name.
 */
public enum ToolName {
    CREATE_STICKY_NOTE("createStickyNote", true),
    CREATE_SHAPE("createShape", true),
    CREATE_FRAME("createFrame", true),
    CREATE_CONNECTOR("createConnector", true),
    CREATE_TEXT("createText", true),
    CREATE_TABLE("createTable", true),
    MOVE_OBJECT("moveObject", true),
    ARRANGE_OBJECTS_IN_GRID("arrangeObjectsInGrid", true),
    RESIZE_OBJECT("resizeObject", true),
    UPDATE_TEXT("updateText", true),
    CHANGE_COLOR("changeColor", true),
    ROTATE_OBJECT("rotateObject", true),
    DELETE_OBJECT("deleteObject", true),
    GET_BOARD_STATE("getBoardState", false),
    BATCH_CREATE("batchCreate", true),
    BATCH_UPDATE("batchUpdate", true),
    BATCH_DELETE("batchDelete", true);

    private final String wireName;
    private final boolean mutating;

    ToolName(String wireName, boolean mutating) {
        this.wireName = wireName;
        this.mutating = mutating;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isMutating() {
        return mutating;
    }

    /**
     * Exact, case-sensitive lookup. Returns null for unknown names.
     */
    public static ToolName fromWireName(String name) {
        if (name == null) return null;
        for (ToolName tool : values()) {
            if (tool.wireName.equals(name)) return tool;
        }
        return null;
    }
}
