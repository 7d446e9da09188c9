package nl.bytesoflife.deltaboard.document;

import java.util.List;

/**
 * The replicated board document: an object map plus a z-order list, mutated only inside
 * atomic transactions. Every component gets this handle explicitly; there is no shared global.
 */
public interface BoardDocument {

    static BoardDocument create(String siteId) {
        return new InMemoryBoardDocument(siteId);
    }

    /**
     * Rebuilds a replica by merging an update log. The same set of updates yields the same
     * object contents and order membership regardless of their order in the list.
     */
    static BoardDocument fromLog(String siteId, List<DocumentUpdate> updates) {
        BoardDocument document = create(siteId);
        for (DocumentUpdate update : updates) {
            document.applyUpdate(update);
        }
        return document;
    }

    String getSiteId();

    ObjectMap objects();

    OrderList zOrder();

    /**
     * Runs {@code body} as one atomic unit. Nested calls join the outermost transaction and keep its origin.
     * If the body throws, all of its writes are rolled back and the exception propagates.
     */
    void transact(TransactionOrigin origin, Runnable body);

    /**
     * Applies recorded changes in one transaction, tolerating drift since they were recorded.
     * Inserts and deletes act on the whole object. An update rewrites only the fields that differ
     * between its before and after state, leaving fields written since untouched, and is skipped
     * when the object no longer exists. Order changes remove and insert by id.
     */
    void applyChanges(TransactionOrigin origin, List<DocumentChange> changes);

    /**
     * Merges an update produced by another replica, last-writer-wins per object field and per
     * object existence. Updates this replica produced itself are ignored.
     */
    void applyUpdate(DocumentUpdate update);

    boolean isInTransaction();

    long getRevision();

    void registerTransactionListener(TransactionListener listener);

    void unregisterTransactionListener(TransactionListener listener);

    void registerUpdateListener(UpdateListener listener);

    void unregisterUpdateListener(UpdateListener listener);
}
