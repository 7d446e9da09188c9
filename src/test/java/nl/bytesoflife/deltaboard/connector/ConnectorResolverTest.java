package nl.bytesoflife.deltaboard.connector;

import nl.bytesoflife.deltaboard.document.BoardDocument;
import nl.bytesoflife.deltaboard.document.TransactionOrigin;
import nl.bytesoflife.deltaboard.geometry.Port;
import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.Bounds;
import nl.bytesoflife.deltaboard.model.ConnectorEndpoint;
import nl.bytesoflife.deltaboard.model.ConnectorPayload;
import nl.bytesoflife.deltaboard.model.ConnectorSide;
import nl.bytesoflife.deltaboard.model.ConnectorStyle;
import nl.bytesoflife.deltaboard.model.ObjectType;
import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.model.PortName;
import nl.bytesoflife.deltaboard.store.ObjectFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConnectorResolverTest {

    private BoardDocument document;
    private ConnectorResolver resolver;

    private static BoardObject shape(String id, double x, double y, double w, double h) {
        return new BoardObject(id, x, y, w, h, 0, "local", null, ObjectFactory.defaultPayload(ObjectType.SHAPE, x, y));
    }

    private static BoardObject connector(String id, ConnectorEndpoint from, ConnectorEndpoint to, List<Point> points) {
        return new BoardObject(id, 10, 10, 0, 0, 0, "local", null,
                new ConnectorPayload(from, to, ConnectorStyle.ARROW, points));
    }

    @BeforeEach
    void setUp() {
        document = BoardDocument.create("site-a");
        document.transact(TransactionOrigin.LOCAL, () -> {
            document.objects().set(shape("a", 0, 0, 100, 50));
            document.objects().set(shape("b", 300, 0, 100, 50));
        });
        resolver = new ConnectorResolver(document.objects());
    }

    @Test
    void boundEndpointsResolveToPorts() {
        BoardObject c = connector("c", ConnectorEndpoint.bound("a", PortName.E),
                ConnectorEndpoint.bound("b", PortName.W), List.of());

        ConnectorResolver.Ends ends = resolver.ends(c);

        assertEquals(new Point(100, 25), ends.start());
        assertEquals(new Point(300, 25), ends.end());
    }

    @Test
    void boundEndpointWithoutPortUsesCenter() {
        assertEquals(new Point(50, 25), resolver.resolve(ConnectorEndpoint.bound("a", null)));
    }

    @Test
    void missingTargetFallsBackToConnectorOrigin() {
        BoardObject c = connector("c", ConnectorEndpoint.bound("gone", PortName.N),
                ConnectorEndpoint.free(500, 500), List.of());

        assertNull(resolver.resolve(ConnectorEndpoint.bound("gone", PortName.N)));
        assertEquals(new Point(10, 10), resolver.resolve(c, ConnectorSide.FROM));
        assertEquals(new Point(500, 500), resolver.resolve(c, ConnectorSide.TO));
    }

    @Test
    void pathIncludesWaypointsInOrder() {
        BoardObject c = connector("c", ConnectorEndpoint.bound("a", PortName.E),
                ConnectorEndpoint.bound("b", PortName.W), List.of(new Point(200, 200)));

        assertEquals(List.of(new Point(100, 25), new Point(200, 200), new Point(300, 25)), resolver.path(c));
    }

    @Test
    void detachFreezesOnlyRemovedEnds() {
        BoardObject c = connector("c", ConnectorEndpoint.bound("a", PortName.E),
                ConnectorEndpoint.bound("b", PortName.W), List.of());

        BoardObject detached = resolver.detach(c, Set.of("a"));

        assertEquals(ConnectorEndpoint.free(100, 25), detached.connector().from());
        assertEquals(ConnectorEndpoint.bound("b", PortName.W), detached.connector().to());
    }

    @Test
    void detachReturnsSameInstanceWhenUnreferenced() {
        BoardObject c = connector("c", ConnectorEndpoint.bound("a", PortName.E),
                ConnectorEndpoint.free(0, 0), List.of());

        assertSame(c, resolver.detach(c, Set.of("b")));
    }

    @Test
    void hitsWithinTolerance() {
        BoardObject c = connector("c", ConnectorEndpoint.bound("a", PortName.E),
                ConnectorEndpoint.bound("b", PortName.W), List.of());

        assertTrue(resolver.hits(c, 200, 30));
        assertTrue(resolver.hits(c, 200, 33));
        assertFalse(resolver.hits(c, 200, 40));
        assertTrue(resolver.hits(c, 200, 40, 20));
    }

    @Test
    void selectionBoundsUseResolvedPath() {
        BoardObject c = connector("c", ConnectorEndpoint.bound("a", PortName.E),
                ConnectorEndpoint.free(250, 300), List.of());

        Bounds bounds = resolver.selectionBounds(List.of(c));

        assertEquals(100, bounds.x(), 1e-9);
        assertEquals(25, bounds.y(), 1e-9);
        assertEquals(150, bounds.width(), 1e-9);
        assertEquals(275, bounds.height(), 1e-9);
    }

    @Test
    void closestPortOfLiveObject() {
        Port port = resolver.closestPort("b", 290, 20);
        assertEquals(PortName.W, port.name());
        assertNull(resolver.closestPort("missing", 0, 0));
    }
}
