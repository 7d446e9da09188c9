package nl.bytesoflife.deltaboard.store;

import nl.bytesoflife.deltaboard.document.ObjectMap;
import nl.bytesoflife.deltaboard.geometry.BoardGeometry;
import nl.bytesoflife.deltaboard.geometry.SpatialIndex;
import nl.bytesoflife.deltaboard.model.BoardObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps {@code parentFrameId} and frame children lists in line with geometry.
 * <p>
 * An object belongs to the smallest-area frame whose rotated rectangle encloses all four of its
 * rotated corners. Frames are never placed inside their own descendants. When a synced object is
 * a frame, everything currently linked to it or geometrically overlapping it is re-synced too.
 * <p>
 * Works against any {@link ObjectMap}, so the live document and the agent mirror share it.
 * Callers wrap {@link #syncAll} in a transaction when the map is transactional.
 */
public class ContainmentSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(ContainmentSynchronizer.class);

    private static final int MAX_PASSES = 8;

    private final ObjectMap objects;

    public ContainmentSynchronizer(ObjectMap objects) {
        this.objects = objects;
    }

    public Set<String> sync(String id) {
        return syncAll(Set.of(id));
    }

    /**
     * Syncs every id in {@code ids}, plus the members of any frame among them.
     * Geometry must be final before calling; only parent links and children lists change.
     * Passes repeat until one changes nothing, since a frame that changes parent can open up
     * a container for a frame that was already visited.
     *
     * @return ids of objects that were rewritten
     */
    public Set<String> syncAll(Collection<String> ids) {
        Set<String> touched = new LinkedHashSet<>();
        if (ids.isEmpty()) return touched;

        SpatialIndex frameIndex = new SpatialIndex();
        SpatialIndex objectIndex = new SpatialIndex();
        for (BoardObject obj : objects.values()) {
            if (obj.isConnector()) continue;
            objectIndex.insert(obj);
            if (obj.isFrame()) frameIndex.insert(obj);
        }

        Set<String> seeds = new LinkedHashSet<>(ids);
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            Set<String> changed = syncPass(seeds, frameIndex, objectIndex);
            if (changed.isEmpty()) break;
            touched.addAll(changed);
            seeds.addAll(changed);
        }
        if (!touched.isEmpty()) {
            log.debug("Containment sync of {} ids rewrote {}", ids.size(), touched.size());
        }
        return touched;
    }

    private Set<String> syncPass(Set<String> seeds, SpatialIndex frameIndex, SpatialIndex objectIndex) {
        Set<String> touched = new LinkedHashSet<>();
        Deque<String> worklist = new ArrayDeque<>(seeds);
        Set<String> visited = new HashSet<>();
        while (!worklist.isEmpty()) {
            String id = worklist.poll();
            if (!visited.add(id)) continue;

            BoardObject obj = objects.get(id);
            if (obj == null || obj.isConnector()) continue;

            syncOne(obj, frameIndex, touched);

            if (obj.isFrame()) {
                BoardObject frame = pruneChildren(objects.get(id), touched);
                Set<String> members = new LinkedHashSet<>(frame.frame().children());
                members.addAll(ObjectGraph.linkedChildren(objects, id));
                for (BoardObject candidate : objectIndex.queryIntersecting(BoardGeometry.aabb(frame))) {
                    members.add(candidate.getId());
                }
                members.remove(id);
                for (String member : members) {
                    if (!visited.contains(member)) worklist.add(member);
                }
            }
        }
        return touched;
    }

    /**
     * The frame {@code obj} belongs in, or null. Does not write anything.
     */
    public BoardObject findContainer(BoardObject obj, SpatialIndex frameIndex) {
        Set<String> descendants = obj.isFrame() ? ObjectGraph.descendants(objects, obj.getId()) : Set.of();
        BoardObject best = null;
        for (BoardObject indexed : frameIndex.queryIntersecting(BoardGeometry.aabb(obj))) {
            String frameId = indexed.getId();
            if (frameId.equals(obj.getId()) || descendants.contains(frameId)) continue;
            BoardObject frame = objects.get(frameId);
            if (frame == null || !frame.isFrame()) continue;
            if (!BoardGeometry.containsObject(frame, obj)) continue;
            if (best == null || frame.area() < best.area()
                    || (frame.area() == best.area() && frameId.compareTo(best.getId()) < 0)) {
                best = frame;
            }
        }
        return best;
    }

    private void syncOne(BoardObject obj, SpatialIndex frameIndex, Set<String> touched) {
        String id = obj.getId();
        BoardObject container = findContainer(obj, frameIndex);
        String nextParent = container != null ? container.getId() : null;
        String currentParent = obj.getParentFrameId();

        if (!Objects.equals(currentParent, nextParent)) {
            if (currentParent != null) {
                BoardObject previous = objects.get(currentParent);
                if (previous != null && previous.isFrame()) {
                    write(previous.withPayload(previous.frame().withoutChild(id)), touched);
                }
            }
            write(obj.withParentFrameId(nextParent), touched);
            log.trace("Reparented {} from {} to {}", id, currentParent, nextParent);
        }

        if (nextParent != null) {
            BoardObject parent = objects.get(nextParent);
            write(parent.withPayload(parent.frame().withChild(id)), touched);
        }
    }

    /**
     * Drops children entries whose object is gone or links to another frame. Members that still
     * belong here re-attach when they are synced.
     */
    private BoardObject pruneChildren(BoardObject frame, Set<String> touched) {
        List<String> kept = new ArrayList<>();
        for (String childId : frame.frame().children()) {
            BoardObject child = objects.get(childId);
            if (child != null && frame.getId().equals(child.getParentFrameId())) kept.add(childId);
        }
        if (kept.size() == frame.frame().children().size()) return frame;
        BoardObject pruned = frame.withPayload(frame.frame().withChildren(kept));
        write(pruned, touched);
        return pruned;
    }

    private void write(BoardObject next, Set<String> touched) {
        BoardObject current = objects.get(next.getId());
        if (next.equals(current)) return;
        objects.set(next);
        touched.add(next.getId());
    }
}
