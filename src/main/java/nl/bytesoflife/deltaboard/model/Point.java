package nl.bytesoflife.deltaboard.model;

/**
 * A world-space coordinate.
 */
public record Point(double x, double y) {

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    public double distanceTo(double px, double py) {
        return Math.hypot(px - x, py - y);
    }
}
