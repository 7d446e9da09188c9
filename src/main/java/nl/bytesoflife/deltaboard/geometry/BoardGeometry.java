package nl.bytesoflife.deltaboard.geometry;

import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.Bounds;
import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.model.PortName;
import nl.bytesoflife.deltaboard.model.ShapeKind;
import nl.bytesoflife.deltaboard.model.ShapePayload;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Pure geometry over board objects. Angles are in degrees, rotation is about the object's center.
 */
public final class BoardGeometry {

    /** Slack for corner-on-edge tests after a rotate/inverse-rotate round trip. */
    public static final double EPSILON = 1e-7;

    public static final double FRAME_TITLE_HEIGHT = 32;
    public static final double FRAME_BORDER = 12;

    private BoardGeometry() {
    }

    public static double normalizeAngle(double degrees) {
        if (!Double.isFinite(degrees)) return 0;
        double a = degrees % 360;
        if (a < 0) a += 360;
        // tiny negatives round up to 360.0, and -0.0 must read as 0
        return a >= 360 || a == 0 ? 0 : a;
    }

    public static Point rotatePoint(double px, double py, double cx, double cy, double angleDegrees) {
        if (angleDegrees == 0) return new Point(px, py);
        AffineTransformation rotation = AffineTransformation.rotationInstance(Math.toRadians(angleDegrees), cx, cy);
        Coordinate out = new Coordinate();
        rotation.transform(new Coordinate(px, py), out);
        return new Point(out.x, out.y);
    }

    public static Point rotatePoint(Point p, Point pivot, double angleDegrees) {
        return rotatePoint(p.x(), p.y(), pivot.x(), pivot.y(), angleDegrees);
    }

    public static Point inverseRotatePoint(double px, double py, double cx, double cy, double angleDegrees) {
        return rotatePoint(px, py, cx, cy, -angleDegrees);
    }

    public static Point center(BoardObject obj) {
        return new Point(obj.getX() + obj.getWidth() / 2, obj.getY() + obj.getHeight() / 2);
    }

    /**
     * Corners clockwise from the unrotated top-left, rotated into world space.
     */
    public static List<Point> corners(BoardObject obj) {
        double x = obj.getX();
        double y = obj.getY();
        double w = obj.getWidth();
        double h = obj.getHeight();
        List<Point> points = List.of(
                new Point(x, y),
                new Point(x + w, y),
                new Point(x + w, y + h),
                new Point(x, y + h));
        double angle = obj.getRotation();
        if (angle == 0) return points;
        Point c = center(obj);
        List<Point> rotated = new ArrayList<>(4);
        for (Point p : points) {
            rotated.add(rotatePoint(p, c, angle));
        }
        return rotated;
    }

    /**
     * Axis-aligned bounding box of the rotated object.
     */
    public static Bounds aabb(BoardObject obj) {
        Envelope env = envelope(obj);
        return Bounds.fromEdges(env.getMinX(), env.getMinY(), env.getMaxX(), env.getMaxY());
    }

    public static Envelope envelope(BoardObject obj) {
        Envelope env = new Envelope();
        for (Point p : corners(obj)) {
            env.expandToInclude(p.x(), p.y());
        }
        return env;
    }

    /**
     * Combined box of the given objects. Connectors are skipped here because their extent depends
     * on other objects; use the connector resolver when they must be included.
     */
    public static Bounds selectionBounds(Collection<BoardObject> objects) {
        List<Bounds> boxes = new ArrayList<>();
        for (BoardObject obj : objects) {
            if (obj.isConnector()) continue;
            boxes.add(aabb(obj));
        }
        return Bounds.union(boxes);
    }

    public static boolean pointInRotatedRect(double px, double py, BoardObject obj) {
        Point c = center(obj);
        Point local = inverseRotatePoint(px, py, c.x(), c.y(), obj.getRotation());
        return local.x() >= obj.getX() - EPSILON
                && local.x() <= obj.getX() + obj.getWidth() + EPSILON
                && local.y() >= obj.getY() - EPSILON
                && local.y() <= obj.getY() + obj.getHeight() + EPSILON;
    }

    /**
     * Hit test against the object's visible outline: ellipses use the ellipse equation,
     * every other non-connector variant its rotated rectangle.
     */
    public static boolean pointInObject(double px, double py, BoardObject obj) {
        if (obj.isConnector()) return false;
        if (obj.getPayload() instanceof ShapePayload shape && shape.kind() == ShapeKind.ELLIPSE) {
            double rx = obj.getWidth() / 2;
            double ry = obj.getHeight() / 2;
            if (rx <= 0 || ry <= 0) return false;
            Point c = center(obj);
            Point local = inverseRotatePoint(px, py, c.x(), c.y(), obj.getRotation());
            double nx = (local.x() - c.x()) / rx;
            double ny = (local.y() - c.y()) / ry;
            return nx * nx + ny * ny <= 1 + EPSILON;
        }
        return pointInRotatedRect(px, py, obj);
    }

    /**
     * True when all four rotated corners of {@code child} lie inside the rotated rectangle of {@code container}.
     */
    public static boolean containsObject(BoardObject container, BoardObject child) {
        for (Point p : corners(child)) {
            if (!pointInRotatedRect(p.x(), p.y(), container)) return false;
        }
        return true;
    }

    /**
     * The eight ports, computed on the unrotated box and rotated about the center.
     * Connectors have no ports.
     */
    public static List<Port> ports(BoardObject obj) {
        if (obj.isConnector()) return List.of();
        List<Port> ports = new ArrayList<>(PortName.values().length);
        for (PortName name : PortName.values()) {
            ports.add(new Port(name, portPosition(obj, name)));
        }
        return ports;
    }

    public static Point portPosition(BoardObject obj, PortName name) {
        if (obj.isConnector() || name == null) return null;
        double px = obj.getX() + obj.getWidth() * name.getFractionX();
        double py = obj.getY() + obj.getHeight() * name.getFractionY();
        return rotatePoint(px, py, obj.getX() + obj.getWidth() / 2, obj.getY() + obj.getHeight() / 2, obj.getRotation());
    }

    /**
     * Euclidean-nearest of the eight ports, or null for connectors.
     */
    public static Port closestPort(BoardObject obj, double px, double py) {
        Port best = null;
        double bestDist = Double.POSITIVE_INFINITY;
        for (Port port : ports(obj)) {
            double d = port.distanceTo(px, py);
            if (d < bestDist) {
                bestDist = d;
                best = port;
            }
        }
        return best;
    }

    public static double distancePointToSegment(double px, double py, double ax, double ay, double bx, double by) {
        double dx = bx - ax;
        double dy = by - ay;
        if (dx == 0 && dy == 0) {
            return Math.hypot(px - ax, py - ay);
        }
        double t = ((px - ax) * dx + (py - ay) * dy) / (dx * dx + dy * dy);
        t = Math.max(0, Math.min(1, t));
        return Math.hypot(px - (ax + t * dx), py - (ay + t * dy));
    }

    /**
     * Which part of a frame a point falls on, or null when it misses the frame.
     */
    public static FrameHitArea frameHitArea(double px, double py, BoardObject frame) {
        if (!pointInObject(px, py, frame)) return null;

        Point c = center(frame);
        Point local = inverseRotatePoint(px, py, c.x(), c.y(), frame.getRotation());
        double lx = local.x();
        double ly = local.y();

        if (ly <= frame.getY() + FRAME_TITLE_HEIGHT) return FrameHitArea.TITLE;

        boolean nearBorder = Math.abs(lx - frame.getX()) <= FRAME_BORDER
                || Math.abs(lx - (frame.getX() + frame.getWidth())) <= FRAME_BORDER
                || Math.abs(ly - (frame.getY() + frame.getHeight())) <= FRAME_BORDER;
        return nearBorder ? FrameHitArea.BORDER : FrameHitArea.INSIDE;
    }
}
