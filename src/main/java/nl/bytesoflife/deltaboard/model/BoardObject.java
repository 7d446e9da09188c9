package nl.bytesoflife.deltaboard.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A placeable board entity. Common geometry lives here, variant data in the {@link ObjectPayload}.
 * Instances are immutable; every mutation produces a copy that is written back to the document.
 * <p>
 * {@code parentFrameId} is a weak back-reference: a lookup key into the same document, never an owner.
 */
public final class BoardObject {

    private final String id;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final double rotation;
    private final String createdBy;
    private final String parentFrameId;
    private final ObjectPayload payload;

    public BoardObject(String id, double x, double y, double width, double height, double rotation,
                       String createdBy, String parentFrameId, ObjectPayload payload) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Object id must not be blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Object " + id + " has no payload");
        }
        this.id = id;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.rotation = rotation;
        this.createdBy = createdBy;
        this.parentFrameId = parentFrameId;
        this.payload = payload;
    }

    public String getId() { return id; }
    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }
    public double getRotation() { return rotation; }
    public String getCreatedBy() { return createdBy; }
    public String getParentFrameId() { return parentFrameId; }
    public ObjectPayload getPayload() { return payload; }

    public ObjectType getType() {
        return payload.type();
    }

    public boolean isFrame() {
        return payload instanceof FramePayload;
    }

    public boolean isConnector() {
        return payload instanceof ConnectorPayload;
    }

    public double area() {
        return width * height;
    }

    /**
     * The frame payload; callers check {@link #isFrame()} first.
     */
    public FramePayload frame() {
        if (payload instanceof FramePayload frame) return frame;
        throw new IllegalStateException("Object " + id + " is a " + getType().getWireName() + ", not a frame");
    }

    public ConnectorPayload connector() {
        if (payload instanceof ConnectorPayload connector) return connector;
        throw new IllegalStateException("Object " + id + " is a " + getType().getWireName() + ", not a connector");
    }

    public BoardObject withId(String id) {
        return new BoardObject(id, x, y, width, height, rotation, createdBy, parentFrameId, payload);
    }

    public BoardObject withPosition(double x, double y) {
        return new BoardObject(id, x, y, width, height, rotation, createdBy, parentFrameId, payload);
    }

    public BoardObject withBounds(double x, double y, double width, double height) {
        return new BoardObject(id, x, y, width, height, rotation, createdBy, parentFrameId, payload);
    }

    public BoardObject withRotation(double rotation) {
        return new BoardObject(id, x, y, width, height, rotation, createdBy, parentFrameId, payload);
    }

    public BoardObject withCreatedBy(String createdBy) {
        return new BoardObject(id, x, y, width, height, rotation, createdBy, parentFrameId, payload);
    }

    public BoardObject withParentFrameId(String parentFrameId) {
        return new BoardObject(id, x, y, width, height, rotation, createdBy, parentFrameId, payload);
    }

    public BoardObject withPayload(ObjectPayload payload) {
        return new BoardObject(id, x, y, width, height, rotation, createdBy, parentFrameId, payload);
    }

    /**
     * Shifts the object by a delta. For connectors the free endpoints and waypoints move too.
     */
    public BoardObject translate(double dx, double dy) {
        ObjectPayload nextPayload = payload instanceof ConnectorPayload c ? c.translate(dx, dy) : payload;
        return new BoardObject(id, x + dx, y + dy, width, height, rotation, createdBy, parentFrameId, nextPayload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoardObject that)) return false;
        return Double.compare(that.x, x) == 0
                && Double.compare(that.y, y) == 0
                && Double.compare(that.width, width) == 0
                && Double.compare(that.height, height) == 0
                && Double.compare(that.rotation, rotation) == 0
                && id.equals(that.id)
                && Objects.equals(createdBy, that.createdBy)
                && Objects.equals(parentFrameId, that.parentFrameId)
                && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, x, y, width, height, rotation, createdBy, parentFrameId, payload);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s[%s %.1f,%.1f %.1fx%.1f rot=%.1f parent=%s]",
                getType().getWireName(), id, x, y, width, height, rotation, parentFrameId);
    }
}
