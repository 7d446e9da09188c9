package nl.bytesoflife.deltaboard.store;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of fresh object ids.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();

    /**
     * Predictable ids {@code prefix1, prefix2, ...}, handy for tests and fixtures.
     */
    static IdGenerator sequential(String prefix) {
        AtomicLong counter = new AtomicLong();
        return () -> prefix + counter.incrementAndGet();
    }
}
