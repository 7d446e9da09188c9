package nl.bytesoflife.deltaboard.model;

/**
 * One end of a connector: either bound to a port of another object, or a literal point.
 */
public sealed interface ConnectorEndpoint permits ConnectorEndpoint.Bound, ConnectorEndpoint.Free {

    static ConnectorEndpoint bound(String objectId, PortName port) {
        return new Bound(objectId, port);
    }

    static ConnectorEndpoint free(Point point) {
        return new Free(point);
    }

    static ConnectorEndpoint free(double x, double y) {
        return new Free(new Point(x, y));
    }

    /**
     * Bound object id, or null for a free endpoint.
     */
    default String objectId() {
        return this instanceof Bound b ? b.objectId() : null;
    }

    default boolean isBoundTo(String id) {
        return this instanceof Bound b && b.objectId().equals(id);
    }

    /**
     * Resolved dynamically against the live object; the port may be null, in which case
     * the resolver falls back to the object's center.
     */
    record Bound(String objectId, PortName port) implements ConnectorEndpoint {
        public Bound {
            if (objectId == null || objectId.isBlank()) {
                throw new IllegalArgumentException("Bound endpoint requires an object id");
            }
        }
    }

    record Free(Point point) implements ConnectorEndpoint {
        public Free {
            if (point == null) {
                throw new IllegalArgumentException("Free endpoint requires a point");
            }
        }

        public Free translate(double dx, double dy) {
            return new Free(point.translate(dx, dy));
        }
    }
}
