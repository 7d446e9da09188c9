package nl.bytesoflife.deltaboard.geometry;

import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.Bounds;
import nl.bytesoflife.deltaboard.model.ObjectType;
import nl.bytesoflife.deltaboard.store.ObjectFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SpatialIndexTest {

    private SpatialIndex index;

    private static BoardObject sticky(String id, double x, double y) {
        return new BoardObject(id, x, y, 100, 100, 0, "local", null,
                ObjectFactory.defaultPayload(ObjectType.STICKY, x, y));
    }

    private static Set<String> ids(List<BoardObject> objects) {
        return objects.stream().map(BoardObject::getId).collect(Collectors.toSet());
    }

    @BeforeEach
    void setUp() {
        index = new SpatialIndex();
        index.insertAll(List.of(sticky("a", 0, 0), sticky("b", 500, 0), sticky("c", 1000, 1000)));
    }

    @Test
    void queryIntersectingFindsOverlappingBoxes() {
        assertEquals(3, index.size());
        assertEquals(Set.of("a", "b"), ids(index.queryIntersecting(new Bounds(50, 50, 500, 10))));
        assertTrue(index.queryIntersecting(new Bounds(2000, 2000, 10, 10)).isEmpty());
    }

    @Test
    void queryNeighborsUsesSearchDistance() {
        assertEquals(Set.of("a"), ids(index.queryNeighbors(110, 50, 20)));
        assertTrue(index.queryNeighbors(300, 50, 20).isEmpty());
    }
}
