package nl.bytesoflife.deltaboard.geometry;

import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.Bounds;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.Collection;
import java.util.List;

/**
 * Envelope index over board objects, keyed by each object's rotated bounding box.
 * Built lazily on first query; inserts after that are not allowed by the underlying STRtree.
 */
public class SpatialIndex {

    private final STRtree tree = new STRtree();
    private boolean built = false;
    private int size = 0;

    public void insert(BoardObject obj) {
        tree.insert(BoardGeometry.envelope(obj), obj);
        size++;
    }

    public void insertAll(Collection<BoardObject> objects) {
        for (BoardObject obj : objects) {
            insert(obj);
        }
    }

    public int size() {
        return size;
    }

    /**
     * Candidates whose box intersects the given box. Callers still run the exact test.
     */
    @SuppressWarnings("unchecked")
    public List<BoardObject> queryIntersecting(Bounds bounds) {
        if (size == 0) return List.of();
        ensureBuilt();
        Envelope search = new Envelope(bounds.x(), bounds.right(), bounds.y(), bounds.bottom());
        return (List<BoardObject>) tree.query(search);
    }

    @SuppressWarnings("unchecked")
    public List<BoardObject> queryNeighbors(double x, double y, double searchDistance) {
        if (size == 0) return List.of();
        ensureBuilt();
        Envelope search = new Envelope(x, x, y, y);
        search.expandBy(searchDistance);
        return (List<BoardObject>) tree.query(search);
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }
}
