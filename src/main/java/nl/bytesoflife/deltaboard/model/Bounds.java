package nl.bytesoflife.deltaboard.model;

import java.util.Collection;

/**
 * Axis-aligned rectangle in world space.
 */
public record Bounds(double x, double y, double width, double height) {

    public Bounds {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Bounds must have a non-negative size: " + width + "x" + height);
        }
    }

    public static Bounds fromEdges(double minX, double minY, double maxX, double maxY) {
        return new Bounds(minX, minY, Math.max(0, maxX - minX), Math.max(0, maxY - minY));
    }

    /**
     * Smallest rectangle covering all given boxes, or null when the collection is empty.
     */
    public static Bounds union(Collection<Bounds> boxes) {
        if (boxes.isEmpty()) return null;
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Bounds b : boxes) {
            minX = Math.min(minX, b.x);
            minY = Math.min(minY, b.y);
            maxX = Math.max(maxX, b.right());
            maxY = Math.max(maxY, b.bottom());
        }
        return fromEdges(minX, minY, maxX, maxY);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double area() {
        return width * height;
    }

    public Point center() {
        return new Point(x + width / 2, y + height / 2);
    }

    /**
     * True when the interiors overlap; touching edges do not count.
     */
    public boolean overlaps(Bounds other) {
        return x < other.right() && other.x < right() && y < other.bottom() && other.y < bottom();
    }

    public boolean contains(double px, double py) {
        return px >= x && px <= right() && py >= y && py <= bottom();
    }

    public Bounds expand(double margin) {
        return new Bounds(x - margin, y - margin, width + 2 * margin, height + 2 * margin);
    }
}
