package nl.bytesoflife.deltaboard.document;

import nl.bytesoflife.deltaboard.model.BoardObject;

import java.util.List;

/**
 * One recorded write with enough state to invert it.
 */
public sealed interface DocumentChange permits DocumentChange.ObjectChange, DocumentChange.OrderChange {

    DocumentChange inverse();

    /**
     * Object map write. {@code before == null} is an insert, {@code after == null} a delete.
     */
    record ObjectChange(String id, BoardObject before, BoardObject after) implements DocumentChange {
        public ObjectChange {
            if (id == null) throw new IllegalArgumentException("Object change requires an id");
            if (before == null && after == null) {
                throw new IllegalArgumentException("Object change for " + id + " has neither before nor after state");
            }
        }

        @Override
        public ObjectChange inverse() {
            return new ObjectChange(id, after, before);
        }

        public boolean isDelete() {
            return after == null;
        }

        public boolean isInsert() {
            return before == null;
        }
    }

    /**
     * Z-order splice at {@code index}: {@code removed} ids taken out, then {@code inserted} ids put in.
     */
    record OrderChange(int index, List<String> removed, List<String> inserted) implements DocumentChange {
        public OrderChange {
            if (index < 0) throw new IllegalArgumentException("Order index must be >= 0");
            removed = removed == null ? List.of() : List.copyOf(removed);
            inserted = inserted == null ? List.of() : List.copyOf(inserted);
        }

        @Override
        public OrderChange inverse() {
            return new OrderChange(index, inserted, removed);
        }
    }
}
