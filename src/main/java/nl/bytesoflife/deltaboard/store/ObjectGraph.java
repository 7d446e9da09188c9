package nl.bytesoflife.deltaboard.store;

import nl.bytesoflife.deltaboard.document.ObjectMap;
import nl.bytesoflife.deltaboard.model.BoardObject;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only queries over the frame tree. Parent links are plain ids resolved through the map.
 */
public final class ObjectGraph {

    private ObjectGraph() {
    }

    /**
     * All objects transitively listed under {@code frameId}'s children, breadth first.
     * Missing ids are skipped and a corrupted tree cannot loop.
     */
    public static Set<String> descendants(ObjectMap objects, String frameId) {
        Set<String> out = new LinkedHashSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        worklist.add(frameId);
        while (!worklist.isEmpty()) {
            BoardObject frame = objects.get(worklist.poll());
            if (frame == null || !frame.isFrame()) continue;
            for (String childId : frame.frame().children()) {
                if (childId.equals(frameId) || !out.add(childId)) continue;
                worklist.add(childId);
            }
        }
        return out;
    }

    /**
     * Ids plus the descendants of every frame among them, in input order first.
     */
    public static Set<String> expandFrames(ObjectMap objects, List<String> ids) {
        Set<String> expanded = new LinkedHashSet<>(ids);
        for (String id : ids) {
            BoardObject obj = objects.get(id);
            if (obj != null && obj.isFrame()) {
                expanded.addAll(descendants(objects, id));
            }
        }
        return expanded;
    }

    /**
     * Objects whose parent link points at {@code frameId}, whether or not the frame lists them.
     */
    public static Set<String> linkedChildren(ObjectMap objects, String frameId) {
        Set<String> out = new LinkedHashSet<>();
        for (BoardObject obj : objects.values()) {
            if (frameId.equals(obj.getParentFrameId())) out.add(obj.getId());
        }
        return out;
    }

    /**
     * True when following parent links up from {@code id} reaches {@code ancestorId}.
     */
    public static boolean hasAncestor(ObjectMap objects, String id, String ancestorId) {
        Set<String> seen = new LinkedHashSet<>();
        BoardObject current = objects.get(id);
        while (current != null && current.getParentFrameId() != null && seen.add(current.getId())) {
            if (current.getParentFrameId().equals(ancestorId)) return true;
            current = objects.get(current.getParentFrameId());
        }
        return false;
    }
}
