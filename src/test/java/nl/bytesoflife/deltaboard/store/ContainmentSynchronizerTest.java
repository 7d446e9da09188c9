package nl.bytesoflife.deltaboard.store;

import nl.bytesoflife.deltaboard.document.BoardDocument;
import nl.bytesoflife.deltaboard.document.ObjectMap;
import nl.bytesoflife.deltaboard.document.TransactionOrigin;
import nl.bytesoflife.deltaboard.geometry.SpatialIndex;
import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.FramePayload;
import nl.bytesoflife.deltaboard.model.ObjectType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContainmentSynchronizerTest {

    private BoardDocument document;
    private ObjectMap objects;
    private ContainmentSynchronizer containment;

    private static BoardObject frame(String id, double x, double y, double w, double h, String parent, List<String> children) {
        return new BoardObject(id, x, y, w, h, 0, "local", parent, new FramePayload("F " + id, null, children));
    }

    private static BoardObject sticky(String id, double x, double y, double w, double h) {
        return new BoardObject(id, x, y, w, h, 0, "local", null, ObjectFactory.defaultPayload(ObjectType.STICKY, x, y));
    }

    private void put(BoardObject... list) {
        document.transact(TransactionOrigin.LOCAL, () -> {
            for (BoardObject obj : list) objects.set(obj);
        });
    }

    private void syncAll(String... ids) {
        document.transact(TransactionOrigin.LOCAL, () -> containment.syncAll(List.of(ids)));
    }

    @BeforeEach
    void setUp() {
        document = BoardDocument.create("site-a");
        objects = document.objects();
        containment = new ContainmentSynchronizer(objects);
    }

    @Test
    void frameNeverNestsIntoItsOwnDescendant() {
        // b is listed under a but geometrically swallows it
        put(frame("a", 100, 100, 100, 100, null, List.of("b")),
                frame("b", 0, 0, 1000, 1000, "a", List.of()));

        SpatialIndex frames = new SpatialIndex();
        frames.insertAll(objects.values());
        assertNull(containment.findContainer(objects.get("a"), frames));
    }

    @Test
    void inconsistentTreeSettlesWithoutCycle() {
        put(frame("a", 100, 100, 100, 100, null, List.of("b")),
                frame("b", 0, 0, 1000, 1000, "a", List.of()));

        syncAll("a", "b");

        assertEquals("b", objects.get("a").getParentFrameId());
        assertNull(objects.get("b").getParentFrameId());
        assertTrue(objects.get("a").frame().children().isEmpty());
        assertEquals(List.of("a"), objects.get("b").frame().children());
    }

    @Test
    void equalAreaTieGoesToLowerId() {
        put(frame("f2", 0, 0, 400, 400, null, List.of()),
                frame("f1", 10, 10, 400, 400, null, List.of()),
                sticky("s", 50, 50, 100, 100));

        syncAll("s");

        assertEquals("f1", objects.get("s").getParentFrameId());
    }

    @Test
    void staleChildEntriesArePruned() {
        put(frame("f", 0, 0, 400, 400, null, List.of("ghost", "s")),
                sticky("s", 50, 50, 100, 100));

        syncAll("f");

        assertEquals(List.of("s"), objects.get("f").frame().children());
        assertEquals("f", objects.get("s").getParentFrameId());
    }

    @Test
    void connectorsAreNeverContained() {
        BoardObject connector = new BoardObject("c", 50, 50, 0, 0, 0, "local", null,
                ObjectFactory.defaultPayload(ObjectType.CONNECTOR, 50, 50));
        put(frame("f", 0, 0, 400, 400, null, List.of()), connector);

        syncAll("f", "c");

        assertNull(objects.get("c").getParentFrameId());
        assertTrue(objects.get("f").frame().children().isEmpty());
    }

    @Test
    void secondPassTouchesNothing() {
        put(frame("outer", 0, 0, 1000, 1000, null, List.of()),
                frame("inner", 100, 100, 200, 200, null, List.of()),
                sticky("s", 150, 150, 50, 50));
        syncAll("outer", "inner", "s");

        Set<String> touched = containment.syncAll(objects.ids());

        assertTrue(touched.isEmpty());
    }

    @Test
    void deepNestingUsesWorklist() {
        BoardObject[] frames = new BoardObject[200];
        for (int i = 0; i < frames.length; i++) {
            double inset = i * 10;
            frames[i] = frame("f" + i, inset, inset, 4000 - 2 * inset, 4000 - 2 * inset, null, List.of());
        }
        put(frames);

        document.transact(TransactionOrigin.LOCAL, () -> containment.syncAll(objects.ids()));

        for (int i = 1; i < frames.length; i++) {
            assertEquals("f" + (i - 1), objects.get("f" + i).getParentFrameId());
        }
        assertTrue(ObjectGraph.hasAncestor(objects, "f199", "f0"));
        assertEquals(199, ObjectGraph.descendants(objects, "f0").size());
    }
}
