package nl.bytesoflife.deltaboard.model;

import java.util.List;

/**
 * A directed link. Each end is independently bound or free.
 *
 * @param from   start endpoint
 * @param to     end endpoint
 * @param style  line or arrow head
 * @param points intermediate waypoints in world space
 */
public record ConnectorPayload(ConnectorEndpoint from, ConnectorEndpoint to,
                               ConnectorStyle style, List<Point> points) implements ObjectPayload {

    public ConnectorPayload {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Connector requires both endpoints");
        }
        if (style == null) style = ConnectorStyle.ARROW;
        points = points == null ? List.of() : List.copyOf(points);
    }

    @Override
    public ObjectType type() {
        return ObjectType.CONNECTOR;
    }

    @Override
    public <R> R accept(PayloadVisitor<R> visitor) {
        return visitor.visitConnector(this);
    }

    @Override
    public String color() {
        return null;
    }

    @Override
    public ConnectorPayload withColor(String color) {
        return this;
    }

    public ConnectorPayload withFrom(ConnectorEndpoint from) {
        return new ConnectorPayload(from, to, style, points);
    }

    public ConnectorPayload withTo(ConnectorEndpoint to) {
        return new ConnectorPayload(from, to, style, points);
    }

    public ConnectorPayload withStyle(ConnectorStyle style) {
        return new ConnectorPayload(from, to, style, points);
    }

    public boolean references(String objectId) {
        return from.isBoundTo(objectId) || to.isBoundTo(objectId);
    }

    /**
     * Shifts free endpoints and waypoints. Bound endpoints follow their objects.
     */
    public ConnectorPayload translate(double dx, double dy) {
        ConnectorEndpoint nextFrom = from instanceof ConnectorEndpoint.Free f ? f.translate(dx, dy) : from;
        ConnectorEndpoint nextTo = to instanceof ConnectorEndpoint.Free t ? t.translate(dx, dy) : to;
        List<Point> shifted = points.stream().map(p -> p.translate(dx, dy)).toList();
        return new ConnectorPayload(nextFrom, nextTo, style, shifted);
    }
}
