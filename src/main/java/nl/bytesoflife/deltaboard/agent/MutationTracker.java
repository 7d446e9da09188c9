package nl.bytesoflife.deltaboard.agent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Created, updated and deleted id sets of an agent session, kept disjoint so they form a
 * minimal diff against the snapshot.
 */
public class MutationTracker {

    private final Set<String> created = new LinkedHashSet<>();
    private final Set<String> updated = new LinkedHashSet<>();
    private final Set<String> deleted = new LinkedHashSet<>();

    public void markCreated(String id) {
        created.add(id);
        deleted.remove(id);
    }

    /**
     * Ignored for ids created in this session; they are written in full anyway.
     */
    public void markUpdated(String id) {
        if (!created.contains(id)) updated.add(id);
    }

    /**
     * An id created and deleted in the same session leaves no trace.
     */
    public void markDeleted(String id) {
        updated.remove(id);
        if (!created.remove(id)) {
            deleted.add(id);
        }
    }

    public boolean isCreated(String id) {
        return created.contains(id);
    }

    public List<String> getCreatedIds() {
        return List.copyOf(created);
    }

    public List<String> getUpdatedIds() {
        return List.copyOf(updated);
    }

    public List<String> getDeletedIds() {
        return List.copyOf(deleted);
    }
}
