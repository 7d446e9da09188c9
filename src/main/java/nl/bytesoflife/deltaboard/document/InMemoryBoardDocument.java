package nl.bytesoflife.deltaboard.document;

import nl.bytesoflife.deltaboard.model.BoardObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Single-replica document kept in memory. Writes outside {@link #transact} run in an implicit
 * {@link TransactionOrigin#LOCAL} transaction. Not thread-safe: one participant drives it from one thread.
 * <p>
 * Every top-level field of an object carries its own Lamport stamp, and so does the object's
 * existence. Remote writes win field by field; a field update never brings a deleted object back.
 * Field values of objects that are not visible (deleted, or updated before their insert arrived)
 * are kept so that replicas converge whatever the arrival order.
 */
class InMemoryBoardDocument implements BoardDocument {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBoardDocument.class);

    private final String siteId;
    private final Map<String, BoardObject> objects = new LinkedHashMap<>();
    private final List<String> order = new ArrayList<>();
    private final Map<String, Stamp> existenceStamps = new HashMap<>();
    private final Map<FieldKey, Stamp> fieldStamps = new HashMap<>();
    private final Map<String, Map<String, Object>> hiddenFields = new HashMap<>();
    private final Map<String, Stamp> membershipStamps = new HashMap<>();

    private final ObjectMap objectView = new ObjectMapView();
    private final OrderList orderView = new OrderListView();

    private final List<TransactionListener> transactionListeners = new ArrayList<>();
    private final List<UpdateListener> updateListeners = new ArrayList<>();

    private long clock;
    private long revision;

    private ActiveTransaction active;

    InMemoryBoardDocument(String siteId) {
        if (siteId == null || siteId.isBlank()) {
            throw new IllegalArgumentException("Site id must not be blank");
        }
        this.siteId = siteId;
    }

    @Override
    public String getSiteId() {
        return siteId;
    }

    @Override
    public ObjectMap objects() {
        return objectView;
    }

    @Override
    public OrderList zOrder() {
        return orderView;
    }

    @Override
    public boolean isInTransaction() {
        return active != null;
    }

    @Override
    public long getRevision() {
        return revision;
    }

    @Override
    public void transact(TransactionOrigin origin, Runnable body) {
        if (active != null) {
            body.run();
            return;
        }
        run(origin, new Stamp(clock + 1, siteId), false, body);
    }

    @Override
    public void applyChanges(TransactionOrigin origin, List<DocumentChange> changes) {
        transact(origin, () -> {
            for (DocumentChange change : changes) {
                if (change instanceof DocumentChange.ObjectChange oc) {
                    applyObjectChange(oc);
                } else if (change instanceof DocumentChange.OrderChange orderChange) {
                    applyOrderSplice(orderChange);
                }
            }
        });
    }

    @Override
    public void applyUpdate(DocumentUpdate update) {
        if (update.siteId().equals(siteId)) return;
        if (active != null) {
            throw new IllegalStateException("Remote updates cannot be merged inside a local transaction");
        }
        clock = Math.max(clock, update.clock());
        Stamp stamp = new Stamp(update.clock(), update.siteId());

        run(TransactionOrigin.REMOTE, stamp, true, () -> {
            for (DocumentChange change : update.changes()) {
                if (change instanceof DocumentChange.ObjectChange oc) {
                    mergeObjectChange(oc, stamp);
                } else if (change instanceof DocumentChange.OrderChange orderChange) {
                    for (String id : orderChange.removed()) {
                        if (!wins(stamp, membershipStamps.get(id))) continue;
                        int idx = order.indexOf(id);
                        if (idx >= 0) removeRange(idx, 1);
                        stampMembership(id);
                    }
                    int insertAt = Math.min(orderChange.index(), order.size());
                    for (String id : orderChange.inserted()) {
                        if (!wins(stamp, membershipStamps.get(id))) continue;
                        if (!order.contains(id)) {
                            insertRange(insertAt++, List.of(id));
                        }
                        stampMembership(id);
                    }
                }
            }
        });
    }

    @Override
    public void registerTransactionListener(TransactionListener listener) {
        transactionListeners.add(listener);
    }

    @Override
    public void unregisterTransactionListener(TransactionListener listener) {
        transactionListeners.remove(listener);
    }

    @Override
    public void registerUpdateListener(UpdateListener listener) {
        updateListeners.add(listener);
    }

    @Override
    public void unregisterUpdateListener(UpdateListener listener) {
        updateListeners.remove(listener);
    }

    private void run(TransactionOrigin origin, Stamp stamp, boolean remote, Runnable body) {
        ActiveTransaction tx = new ActiveTransaction(origin, stamp, remote);
        active = tx;
        try {
            body.run();
        } catch (RuntimeException | Error e) {
            rollback(tx);
            active = null;
            throw e;
        }
        active = null;
        commit(tx);
    }

    private void commit(ActiveTransaction tx) {
        if (tx.changes.isEmpty()) return;

        revision++;
        if (!tx.remote) {
            clock = tx.stamp.clock();
        }
        Transaction transaction = new Transaction(revision, tx.origin, tx.changes);
        log.trace("Committed revision {} ({}, {} changes)", revision, tx.origin, tx.changes.size());

        if (!tx.remote) {
            DocumentUpdate update = new DocumentUpdate(siteId, tx.stamp.clock(), tx.changes);
            for (UpdateListener listener : List.copyOf(updateListeners)) {
                listener.onUpdate(update);
            }
        }
        for (TransactionListener listener : List.copyOf(transactionListeners)) {
            listener.onTransaction(transaction);
        }
    }

    private void rollback(ActiveTransaction tx) {
        List<DocumentChange> changes = tx.changes;
        for (int i = changes.size() - 1; i >= 0; i--) {
            DocumentChange change = changes.get(i);
            if (change instanceof DocumentChange.ObjectChange oc) {
                if (oc.before() == null) {
                    objects.remove(oc.id());
                } else {
                    objects.put(oc.id(), oc.before());
                }
            } else if (change instanceof DocumentChange.OrderChange orderChange) {
                for (int n = 0; n < orderChange.inserted().size(); n++) {
                    order.remove(orderChange.index());
                }
                order.addAll(orderChange.index(), orderChange.removed());
            }
        }
        restore(existenceStamps, tx.previousExistenceStamps);
        restore(fieldStamps, tx.previousFieldStamps);
        restore(hiddenFields, tx.previousHiddenFields);
        restore(membershipStamps, tx.previousMembershipStamps);
        log.debug("Rolled back {} transaction with {} changes", tx.origin, changes.size());
    }

    private static <K, V> void restore(Map<K, V> target, Map<K, V> previous) {
        for (Map.Entry<K, V> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                target.remove(entry.getKey());
            } else {
                target.put(entry.getKey(), entry.getValue());
            }
        }
    }

    private static boolean wins(Stamp incoming, Stamp current) {
        return current == null || incoming.compareTo(current) >= 0;
    }

    /**
     * Replays a recorded change against the current state. Inserts and deletes act on the whole
     * object; an update only rewrites the fields it changed, and is dropped if the object is gone.
     */
    private void applyObjectChange(DocumentChange.ObjectChange change) {
        if (change.isDelete()) {
            objectView.delete(change.id());
        } else if (change.isInsert()) {
            objectView.set(change.after());
        } else {
            BoardObject current = objects.get(change.id());
            if (current == null) return;
            objectView.set(ObjectFields.overlay(current, change.before(), change.after()));
        }
    }

    private void mergeObjectChange(DocumentChange.ObjectChange change, Stamp stamp) {
        String id = change.id();
        Map<String, Object> incoming;
        if (change.isDelete()) {
            incoming = Map.of();
        } else if (change.isInsert()) {
            incoming = ObjectFields.read(change.after());
        } else {
            incoming = ObjectFields.diff(change.before(), change.after());
        }

        BoardObject visible = objects.get(id);
        Map<String, Object> state = visible != null
                ? ObjectFields.read(visible)
                : new LinkedHashMap<>(hiddenFields.getOrDefault(id, Map.of()));
        for (Map.Entry<String, Object> entry : incoming.entrySet()) {
            FieldKey key = new FieldKey(id, entry.getKey());
            if (!wins(stamp, fieldStamps.get(key))) continue;
            state.put(entry.getKey(), entry.getValue());
            stampField(key);
        }

        boolean alive = visible != null;
        if ((change.isInsert() || change.isDelete()) && wins(stamp, existenceStamps.get(id))) {
            alive = change.isInsert();
            stampExistence(id);
        }

        if (alive) {
            BoardObject after = ObjectFields.assemble(id, state);
            setHidden(id, null);
            if (!after.equals(visible)) {
                objects.put(id, after);
                record(new DocumentChange.ObjectChange(id, visible, after));
            }
        } else {
            setHidden(id, state);
            if (visible != null) {
                objects.remove(id);
                record(new DocumentChange.ObjectChange(id, visible, null));
            }
        }
    }

    private void applyOrderSplice(DocumentChange.OrderChange change) {
        for (String id : change.removed()) {
            int idx = order.indexOf(id);
            if (idx >= 0) removeRange(idx, 1);
        }
        int insertAt = Math.min(change.index(), order.size());
        for (String id : change.inserted()) {
            if (!order.contains(id)) {
                insertRange(insertAt++, List.of(id));
            }
        }
    }

    private void record(DocumentChange change) {
        active.changes.add(change);
    }

    private void stampExistence(String id) {
        if (!active.previousExistenceStamps.containsKey(id)) {
            active.previousExistenceStamps.put(id, existenceStamps.get(id));
        }
        existenceStamps.put(id, active.stamp);
    }

    private void stampField(FieldKey key) {
        if (!active.previousFieldStamps.containsKey(key)) {
            active.previousFieldStamps.put(key, fieldStamps.get(key));
        }
        fieldStamps.put(key, active.stamp);
    }

    private void stampFields(String id, Set<String> fields) {
        for (String field : fields) {
            stampField(new FieldKey(id, field));
        }
    }

    /**
     * Keeps or clears the field values of an object that is not visible.
     */
    private void setHidden(String id, Map<String, Object> fields) {
        if (!active.previousHiddenFields.containsKey(id)) {
            active.previousHiddenFields.put(id, hiddenFields.get(id));
        }
        if (fields == null) {
            hiddenFields.remove(id);
        } else {
            hiddenFields.put(id, fields);
        }
    }

    private void stampMembership(String id) {
        if (!active.previousMembershipStamps.containsKey(id)) {
            active.previousMembershipStamps.put(id, membershipStamps.get(id));
        }
        membershipStamps.put(id, active.stamp);
    }

    private void insertRange(int index, List<String> ids) {
        order.addAll(index, ids);
        record(new DocumentChange.OrderChange(index, List.of(), ids));
        for (String id : ids) {
            stampMembership(id);
        }
    }

    private void removeRange(int index, int count) {
        List<String> slice = order.subList(index, index + count);
        List<String> removed = List.copyOf(slice);
        slice.clear();
        record(new DocumentChange.OrderChange(index, removed, List.of()));
        for (String id : removed) {
            stampMembership(id);
        }
    }

    private final class ObjectMapView implements ObjectMap {

        @Override
        public BoardObject get(String id) {
            return id == null ? null : objects.get(id);
        }

        @Override
        public void set(BoardObject object) {
            if (active == null) {
                transact(TransactionOrigin.LOCAL, () -> set(object));
                return;
            }
            String id = object.getId();
            BoardObject before = objects.get(id);
            if (Objects.equals(before, object)) return;
            objects.put(id, object);
            record(new DocumentChange.ObjectChange(id, before, object));
            if (before == null) {
                stampExistence(id);
                stampFields(id, ObjectFields.read(object).keySet());
                setHidden(id, null);
            } else {
                stampFields(id, ObjectFields.diff(before, object).keySet());
            }
        }

        @Override
        public boolean delete(String id) {
            if (active == null) {
                boolean[] deleted = new boolean[1];
                transact(TransactionOrigin.LOCAL, () -> deleted[0] = delete(id));
                return deleted[0];
            }
            BoardObject before = objects.remove(id);
            if (before == null) return false;
            record(new DocumentChange.ObjectChange(id, before, null));
            stampExistence(id);
            setHidden(id, ObjectFields.read(before));
            return true;
        }

        @Override
        public Set<String> ids() {
            return new LinkedHashSet<>(objects.keySet());
        }

        @Override
        public Collection<BoardObject> values() {
            return List.copyOf(objects.values());
        }

        @Override
        public int size() {
            return objects.size();
        }
    }

    private final class OrderListView implements OrderList {

        @Override
        public int size() {
            return order.size();
        }

        @Override
        public String get(int index) {
            return order.get(index);
        }

        @Override
        public void push(List<String> ids) {
            if (ids.isEmpty()) return;
            if (active == null) {
                transact(TransactionOrigin.LOCAL, () -> push(ids));
                return;
            }
            insertRange(order.size(), ids);
        }

        @Override
        public void delete(int index, int count) {
            if (count <= 0) return;
            if (index < 0 || index + count > order.size()) {
                throw new IndexOutOfBoundsException("Cannot delete " + count + " entries at " + index
                        + " from z-order of size " + order.size());
            }
            if (active == null) {
                transact(TransactionOrigin.LOCAL, () -> delete(index, count));
                return;
            }
            removeRange(index, count);
        }

        @Override
        public int indexOf(String id) {
            return order.indexOf(id);
        }

        @Override
        public List<String> toList() {
            return List.copyOf(order);
        }
    }

    private record Stamp(long clock, String siteId) implements Comparable<Stamp> {
        @Override
        public int compareTo(Stamp other) {
            int byClock = Long.compare(clock, other.clock);
            return byClock != 0 ? byClock : siteId.compareTo(other.siteId);
        }
    }

    private record FieldKey(String id, String field) {
    }

    private static final class ActiveTransaction {
        final TransactionOrigin origin;
        final Stamp stamp;
        final boolean remote;
        final List<DocumentChange> changes = new ArrayList<>();
        final Map<String, Stamp> previousExistenceStamps = new HashMap<>();
        final Map<FieldKey, Stamp> previousFieldStamps = new HashMap<>();
        final Map<String, Map<String, Object>> previousHiddenFields = new HashMap<>();
        final Map<String, Stamp> previousMembershipStamps = new HashMap<>();

        ActiveTransaction(TransactionOrigin origin, Stamp stamp, boolean remote) {
            this.origin = origin;
            this.stamp = stamp;
            this.remote = remote;
        }
    }
}
