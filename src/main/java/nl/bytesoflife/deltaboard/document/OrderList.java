package nl.bytesoflife.deltaboard.document;

import java.util.List;

/**
 * Global paint order. Later entries paint on top.
 */
public interface OrderList {

    int size();

    String get(int index);

    void push(List<String> ids);

    default void push(String id) {
        push(List.of(id));
    }

    void delete(int index, int count);

    default int indexOf(String id) {
        for (int i = 0; i < size(); i++) {
            if (get(i).equals(id)) return i;
        }
        return -1;
    }

    default boolean contains(String id) {
        return indexOf(id) >= 0;
    }

    List<String> toList();
}
