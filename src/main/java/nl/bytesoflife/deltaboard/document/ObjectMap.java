package nl.bytesoflife.deltaboard.document;

import nl.bytesoflife.deltaboard.model.BoardObject;

import java.util.Collection;
import java.util.Set;

/**
 * Objects keyed by id.
 */
public interface ObjectMap {

    BoardObject get(String id);

    /**
     * Inserts or replaces the object stored under its id.
     */
    void set(BoardObject object);

    /**
     * @return true when an object was removed
     */
    boolean delete(String id);

    default boolean has(String id) {
        return get(id) != null;
    }

    Set<String> ids();

    Collection<BoardObject> values();

    int size();
}
