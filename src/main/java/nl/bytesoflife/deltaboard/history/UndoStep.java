package nl.bytesoflife.deltaboard.history;

import nl.bytesoflife.deltaboard.document.DocumentChange;
import nl.bytesoflife.deltaboard.document.Transaction;
import nl.bytesoflife.deltaboard.document.TransactionOrigin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One or more coalesced transactions that undo and redo together. Replayed through
 * {@link nl.bytesoflife.deltaboard.document.BoardDocument#applyChanges}, so only the fields the
 * step wrote are reverted.
 */
public class UndoStep {

    private final TransactionOrigin origin;
    private final List<DocumentChange> changes = new ArrayList<>();
    private int transactionCount;

    UndoStep(Transaction first) {
        this.origin = first.origin();
        append(first);
    }

    void append(Transaction transaction) {
        changes.addAll(transaction.changes());
        transactionCount++;
    }

    public TransactionOrigin getOrigin() {
        return origin;
    }

    public int getTransactionCount() {
        return transactionCount;
    }

    public List<DocumentChange> forwardChanges() {
        return Collections.unmodifiableList(changes);
    }

    public List<DocumentChange> inverseChanges() {
        List<DocumentChange> inverse = new ArrayList<>(changes.size());
        for (int i = changes.size() - 1; i >= 0; i--) {
            inverse.add(changes.get(i).inverse());
        }
        return inverse;
    }
}
