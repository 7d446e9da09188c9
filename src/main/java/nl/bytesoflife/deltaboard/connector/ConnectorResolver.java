package nl.bytesoflife.deltaboard.connector;

import nl.bytesoflife.deltaboard.document.ObjectMap;
import nl.bytesoflife.deltaboard.geometry.BoardGeometry;
import nl.bytesoflife.deltaboard.geometry.Port;
import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.Bounds;
import nl.bytesoflife.deltaboard.model.ConnectorEndpoint;
import nl.bytesoflife.deltaboard.model.ConnectorPayload;
import nl.bytesoflife.deltaboard.model.ConnectorSide;
import nl.bytesoflife.deltaboard.model.Point;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Turns connector endpoints into world coordinates against a set of live objects.
 * <p>
 * A bound endpoint resolves to its object's named port, or the object's center when no port is
 * named. A bound endpoint whose object is gone resolves to the connector's own origin.
 */
public class ConnectorResolver {

    public static final double DEFAULT_HIT_TOLERANCE = 8;

    private final ObjectMap objects;

    public ConnectorResolver(ObjectMap objects) {
        this.objects = objects;
    }

    /**
     * Resolved start and end of a connector.
     */
    public record Ends(Point start, Point end) {
    }

    public Point resolve(BoardObject connector, ConnectorSide side) {
        ConnectorEndpoint endpoint = side.endpointOf(connector.connector());
        Point p = resolve(endpoint);
        return p != null ? p : new Point(connector.getX(), connector.getY());
    }

    /**
     * Concrete point of one endpoint, or null when it is bound to an object that no longer exists.
     */
    public Point resolve(ConnectorEndpoint endpoint) {
        if (endpoint instanceof ConnectorEndpoint.Free free) {
            return free.point();
        }
        ConnectorEndpoint.Bound bound = (ConnectorEndpoint.Bound) endpoint;
        BoardObject target = objects.get(bound.objectId());
        if (target == null || target.isConnector()) return null;
        if (bound.port() == null) return BoardGeometry.center(target);
        return BoardGeometry.portPosition(target, bound.port());
    }

    public Ends ends(BoardObject connector) {
        return new Ends(resolve(connector, ConnectorSide.FROM), resolve(connector, ConnectorSide.TO));
    }

    /**
     * Start, waypoints and end in drawing order.
     */
    public List<Point> path(BoardObject connector) {
        Ends ends = ends(connector);
        List<Point> path = new ArrayList<>();
        path.add(ends.start());
        path.addAll(connector.connector().points());
        path.add(ends.end());
        return path;
    }

    /**
     * Replaces every endpoint bound to one of {@code removedIds} with a free point frozen at its
     * current resolved position. Must run while the removed objects still exist.
     * Returns the connector unchanged when nothing references the removed ids.
     */
    public BoardObject detach(BoardObject connector, Set<String> removedIds) {
        ConnectorPayload payload = connector.connector();
        ConnectorPayload next = payload;
        for (ConnectorSide side : ConnectorSide.values()) {
            ConnectorEndpoint endpoint = side.endpointOf(payload);
            String boundId = endpoint.objectId();
            if (boundId != null && removedIds.contains(boundId)) {
                next = side.replace(next, ConnectorEndpoint.free(resolve(connector, side)));
            }
        }
        return next == payload ? connector : connector.withPayload(next);
    }

    /**
     * Like {@link BoardGeometry#selectionBounds}, but connectors contribute their resolved path.
     */
    public Bounds selectionBounds(Collection<BoardObject> selection) {
        List<Bounds> boxes = new ArrayList<>();
        for (BoardObject obj : selection) {
            if (obj.isConnector()) {
                double minX = Double.POSITIVE_INFINITY;
                double minY = Double.POSITIVE_INFINITY;
                double maxX = Double.NEGATIVE_INFINITY;
                double maxY = Double.NEGATIVE_INFINITY;
                for (Point p : path(obj)) {
                    minX = Math.min(minX, p.x());
                    minY = Math.min(minY, p.y());
                    maxX = Math.max(maxX, p.x());
                    maxY = Math.max(maxY, p.y());
                }
                boxes.add(Bounds.fromEdges(minX, minY, maxX, maxY));
            } else {
                boxes.add(BoardGeometry.aabb(obj));
            }
        }
        return Bounds.union(boxes);
    }

    public boolean hits(BoardObject connector, double px, double py) {
        return hits(connector, px, py, DEFAULT_HIT_TOLERANCE);
    }

    public boolean hits(BoardObject connector, double px, double py, double tolerance) {
        List<Point> path = path(connector);
        for (int i = 1; i < path.size(); i++) {
            Point a = path.get(i - 1);
            Point b = path.get(i);
            if (BoardGeometry.distancePointToSegment(px, py, a.x(), a.y(), b.x(), b.y()) <= tolerance) {
                return true;
            }
        }
        return false;
    }

    /**
     * Nearest port of a live object to a query point, or null when the object is missing or a connector.
     */
    public Port closestPort(String objectId, double px, double py) {
        BoardObject target = objects.get(objectId);
        if (target == null) return null;
        return BoardGeometry.closestPort(target, px, py);
    }
}
