package nl.bytesoflife.deltaboard.model;

import java.util.List;
import java.util.Map;

/**
 * Grid of text cells. Cells are keyed {@code rowId:columnId}.
 */
public record TablePayload(String title, String color,
                           List<String> columns, List<String> rows,
                           Map<String, Double> columnWidths, Map<String, Double> rowHeights,
                           Map<String, String> cells) implements ObjectPayload {

    public static final double TITLE_HEIGHT = 28;
    public static final double DEFAULT_COLUMN_WIDTH = 120;
    public static final double DEFAULT_ROW_HEIGHT = 32;
    public static final String DEFAULT_TITLE = "Table";
    public static final String DEFAULT_COLOR = "#e2e8f0";

    public TablePayload {
        if (title == null) title = DEFAULT_TITLE;
        if (color == null) color = DEFAULT_COLOR;
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
        columnWidths = columnWidths == null ? Map.of() : Map.copyOf(columnWidths);
        rowHeights = rowHeights == null ? Map.of() : Map.copyOf(rowHeights);
        cells = cells == null ? Map.of() : Map.copyOf(cells);
    }

    public static String cellKey(String rowId, String columnId) {
        return rowId + ":" + columnId;
    }

    @Override
    public ObjectType type() {
        return ObjectType.TABLE;
    }

    @Override
    public <R> R accept(PayloadVisitor<R> visitor) {
        return visitor.visitTable(this);
    }

    @Override
    public TablePayload withColor(String color) {
        return new TablePayload(title, color, columns, rows, columnWidths, rowHeights, cells);
    }

    public TablePayload withTitle(String title) {
        return new TablePayload(title, color, columns, rows, columnWidths, rowHeights, cells);
    }

    public TablePayload withGrid(List<String> columns, List<String> rows,
                                 Map<String, Double> columnWidths, Map<String, Double> rowHeights,
                                 Map<String, String> cells) {
        return new TablePayload(title, color, columns, rows, columnWidths, rowHeights, cells);
    }

    public String cell(String rowId, String columnId) {
        return cells.getOrDefault(cellKey(rowId, columnId), "");
    }

    public double columnWidth(String columnId) {
        return columnWidths.getOrDefault(columnId, DEFAULT_COLUMN_WIDTH);
    }

    public double rowHeight(String rowId) {
        return rowHeights.getOrDefault(rowId, DEFAULT_ROW_HEIGHT);
    }

    public double totalWidth() {
        double width = 0;
        for (String column : columns) {
            width += columnWidth(column);
        }
        return width;
    }

    public double totalHeight() {
        double height = TITLE_HEIGHT;
        for (String row : rows) {
            height += rowHeight(row);
        }
        return height;
    }
}
