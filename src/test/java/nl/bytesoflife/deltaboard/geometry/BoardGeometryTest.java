package nl.bytesoflife.deltaboard.geometry;

import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.Bounds;
import nl.bytesoflife.deltaboard.model.ObjectType;
import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.model.PortName;
import nl.bytesoflife.deltaboard.model.ShapeKind;
import nl.bytesoflife.deltaboard.model.ShapePayload;
import nl.bytesoflife.deltaboard.store.ObjectFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoardGeometryTest {

    private static final double TOLERANCE = 1e-6;

    private static BoardObject object(String id, ObjectType type, double x, double y, double w, double h, double rotation) {
        return new BoardObject(id, x, y, w, h, rotation, "local", null, ObjectFactory.defaultPayload(type, x, y));
    }

    @ParameterizedTest
    @CsvSource({"0, 0", "-90, 270", "400, 40", "360, 0", "720.5, 0.5", "-360, 0"})
    void normalizeAngleFoldsIntoHalfOpenRange(double input, double expected) {
        assertEquals(expected, BoardGeometry.normalizeAngle(input), TOLERANCE);
    }

    @Test
    void normalizeAngleMapsNonFiniteToZero() {
        assertEquals(0, BoardGeometry.normalizeAngle(Double.NaN));
        assertEquals(0, BoardGeometry.normalizeAngle(Double.POSITIVE_INFINITY));
    }

    @Test
    void containsObjectRequiresAllCorners() {
        BoardObject frame = object("f", ObjectType.FRAME, 0, 0, 360, 240, 0);
        assertTrue(BoardGeometry.containsObject(frame, object("s", ObjectType.STICKY, 50, 50, 150, 150, 0)));
        assertFalse(BoardGeometry.containsObject(frame, object("s", ObjectType.STICKY, 300, 50, 150, 150, 0)));
    }

    @Test
    void containsObjectUsesRotatedCorners() {
        BoardObject frame = object("f", ObjectType.FRAME, 0, 0, 200, 200, 0);
        BoardObject flush = object("s", ObjectType.STICKY, 0, 0, 200, 200, 0);
        assertTrue(BoardGeometry.containsObject(frame, flush));
        // corners of a 45 degree square poke out of an equally sized frame
        assertFalse(BoardGeometry.containsObject(frame, flush.withRotation(45)));

        BoardObject small = object("t", ObjectType.STICKY, 50, 50, 100, 100, 45);
        assertTrue(BoardGeometry.containsObject(frame, small));
    }

    @Test
    void containsObjectInsideRotatedContainer() {
        BoardObject frame = object("f", ObjectType.FRAME, 0, 0, 400, 100, 90);
        // rotated frame covers x 150..250, y -150..250
        assertTrue(BoardGeometry.containsObject(frame, object("s", ObjectType.STICKY, 160, -100, 80, 300, 0)));
        assertFalse(BoardGeometry.containsObject(frame, object("s", ObjectType.STICKY, 10, 10, 80, 80, 0)));
    }

    @Test
    void portPositionOnUnrotatedBox() {
        BoardObject box = object("b", ObjectType.SHAPE, 0, 0, 100, 50, 0);
        assertEquals(new Point(100, 25), BoardGeometry.portPosition(box, PortName.E));
        assertEquals(new Point(50, 0), BoardGeometry.portPosition(box, PortName.N));
        assertEquals(new Point(0, 50), BoardGeometry.portPosition(box, PortName.SW));
    }

    @Test
    void portPositionRotatesAboutCenter() {
        BoardObject box = object("b", ObjectType.SHAPE, 0, 0, 100, 50, 90);
        Point east = BoardGeometry.portPosition(box, PortName.E);
        assertEquals(50, east.x(), TOLERANCE);
        assertEquals(75, east.y(), TOLERANCE);
    }

    @Test
    void connectorsHaveNoPorts() {
        BoardObject connector = object("c", ObjectType.CONNECTOR, 0, 0, 0, 0, 0);
        assertTrue(BoardGeometry.ports(connector).isEmpty());
        assertNull(BoardGeometry.closestPort(connector, 0, 0));
    }

    @Test
    void closestPortPicksEuclideanNearest() {
        BoardObject box = object("b", ObjectType.SHAPE, 0, 0, 100, 50, 0);
        assertEquals(PortName.E, BoardGeometry.closestPort(box, 110, 20).name());
        assertEquals(PortName.NW, BoardGeometry.closestPort(box, -5, -5).name());
        assertEquals(8, BoardGeometry.ports(box).size());
    }

    @Test
    void ellipseHitTestIgnoresCorners() {
        BoardObject ellipse = new BoardObject("e", 0, 0, 100, 100, 0, "local", null,
                new ShapePayload(ShapeKind.ELLIPSE, "teal", ShapePayload.DEFAULT_STROKE));
        assertTrue(BoardGeometry.pointInObject(50, 50, ellipse));
        assertFalse(BoardGeometry.pointInObject(2, 2, ellipse));

        BoardObject rectangle = object("r", ObjectType.SHAPE, 0, 0, 100, 100, 0);
        assertTrue(BoardGeometry.pointInObject(2, 2, rectangle));
    }

    @Test
    void distanceToSegmentClampsToEnds() {
        assertEquals(5, BoardGeometry.distancePointToSegment(5, 5, 0, 0, 10, 0), TOLERANCE);
        assertEquals(5, BoardGeometry.distancePointToSegment(-3, 4, 0, 0, 10, 0), TOLERANCE);
        assertEquals(5, BoardGeometry.distancePointToSegment(3, 4, 0, 0, 0, 0), TOLERANCE);
    }

    @Test
    void frameHitAreas() {
        BoardObject frame = object("f", ObjectType.FRAME, 0, 0, 360, 240, 0);
        assertEquals(FrameHitArea.TITLE, BoardGeometry.frameHitArea(100, 10, frame));
        assertEquals(FrameHitArea.BORDER, BoardGeometry.frameHitArea(5, 100, frame));
        assertEquals(FrameHitArea.BORDER, BoardGeometry.frameHitArea(100, 235, frame));
        assertEquals(FrameHitArea.INSIDE, BoardGeometry.frameHitArea(100, 100, frame));
        assertNull(BoardGeometry.frameHitArea(500, 500, frame));
    }

    @Test
    void selectionBoundsSkipsConnectors() {
        Bounds box = BoardGeometry.selectionBounds(List.of(
                object("a", ObjectType.STICKY, 0, 0, 100, 100, 0),
                object("b", ObjectType.STICKY, 200, 50, 100, 100, 0),
                object("c", ObjectType.CONNECTOR, 1000, 1000, 0, 0, 0)));
        assertEquals(new Bounds(0, 0, 300, 150), box);
    }

    @Test
    void aabbOfRotatedSquare() {
        Bounds box = BoardGeometry.aabb(object("s", ObjectType.STICKY, 0, 0, 100, 100, 45));
        double half = Math.sqrt(2) * 50;
        assertEquals(50 - half, box.x(), TOLERANCE);
        assertEquals(2 * half, box.width(), TOLERANCE);
    }
}
