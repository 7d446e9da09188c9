package nl.bytesoflife.deltaboard.document;

import java.util.List;

/**
 * Replication unit: the changes of one local transaction stamped with the producing site
 * and its Lamport clock. Remote replicas merge these with last-writer-wins per object field.
 */
public record DocumentUpdate(String siteId, long clock, List<DocumentChange> changes) {

    public DocumentUpdate {
        if (siteId == null || siteId.isBlank()) {
            throw new IllegalArgumentException("Update requires a site id");
        }
        changes = List.copyOf(changes);
    }
}
