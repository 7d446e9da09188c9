package nl.bytesoflife.deltaboard.agent;

import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.Point;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-major grid placement with uniform cells sized to the largest member.
 */
public final class GridArranger {

    private GridArranger() {
    }

    /**
     * Columns for {@code count} items when the caller does not choose: ceil(sqrt(count)).
     */
    public static int defaultColumns(int count) {
        return Math.max(1, (int) Math.ceil(Math.sqrt(count)));
    }

    /**
     * Target top-left corner per object id, in input order.
     *
     * @param origin grid top-left; null uses the group's current top-left
     */
    public static Map<String, Point> layout(List<BoardObject> objects, int columns, double gapX, double gapY,
                                            Point origin) {
        Map<String, Point> targets = new LinkedHashMap<>();
        if (objects.isEmpty()) return targets;
        if (columns < 1) {
            throw new IllegalArgumentException("Grid needs at least one column, got " + columns);
        }

        double cellWidth = 0;
        double cellHeight = 0;
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        for (BoardObject obj : objects) {
            cellWidth = Math.max(cellWidth, obj.getWidth());
            cellHeight = Math.max(cellHeight, obj.getHeight());
            minX = Math.min(minX, obj.getX());
            minY = Math.min(minY, obj.getY());
        }
        Point start = origin != null ? origin : new Point(minX, minY);

        for (int i = 0; i < objects.size(); i++) {
            int col = i % columns;
            int row = i / columns;
            targets.put(objects.get(i).getId(), new Point(
                    start.x() + col * (cellWidth + gapX),
                    start.y() + row * (cellHeight + gapY)));
        }
        return targets;
    }

    /**
     * Total extent of a grid produced by {@link #layout}.
     */
    static Point extent(List<BoardObject> objects, int columns, double gapX, double gapY) {
        double cellWidth = 0;
        double cellHeight = 0;
        for (BoardObject obj : objects) {
            cellWidth = Math.max(cellWidth, obj.getWidth());
            cellHeight = Math.max(cellHeight, obj.getHeight());
        }
        int usedColumns = Math.min(columns, objects.size());
        int rows = (objects.size() + columns - 1) / columns;
        return new Point(
                usedColumns * cellWidth + Math.max(0, usedColumns - 1) * gapX,
                rows * cellHeight + Math.max(0, rows - 1) * gapY);
    }
}
