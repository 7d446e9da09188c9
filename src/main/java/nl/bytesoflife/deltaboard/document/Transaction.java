package nl.bytesoflife.deltaboard.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A committed, atomic group of changes as observed by local listeners.
 *
 * @param revision document revision after this transaction
 * @param origin   what produced it
 * @param changes  changes in the order they were applied
 */
public record Transaction(long revision, TransactionOrigin origin, List<DocumentChange> changes) {

    public Transaction {
        changes = List.copyOf(changes);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /**
     * The changes that undo this transaction, in the order they must be applied.
     */
    public List<DocumentChange> inverseChanges() {
        List<DocumentChange> inverse = new ArrayList<>(changes.size());
        for (DocumentChange change : changes) {
            inverse.add(change.inverse());
        }
        Collections.reverse(inverse);
        return inverse;
    }

    public Set<String> touchedObjectIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (DocumentChange change : changes) {
            if (change instanceof DocumentChange.ObjectChange oc) {
                ids.add(oc.id());
            }
        }
        return ids;
    }
}
