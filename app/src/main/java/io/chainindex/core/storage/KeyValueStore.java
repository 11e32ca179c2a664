package io.chainindex.core.storage;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Ordered byte-keyed store. Keys compare as unsigned bytes. Implementations are safe for
 * one writer and any number of concurrent readers.
 */
public interface KeyValueStore extends AutoCloseable {

    /** Write operations collected for one atomic commit. */
    interface Batch {
        void put(byte[] key, byte[] value);

        void delete(byte[] key);
    }

    /** Opens a named store; {@code forSync} favours bulk writes over open file handles. */
    @FunctionalInterface
    interface Factory {
        KeyValueStore open(String name, boolean forSync);
    }

    byte[] get(byte[] key);

    void put(byte[] key, byte[] value);

    void delete(byte[] key);

    /** Runs {@code ops} against a fresh batch and commits it atomically. */
    void write(Consumer<Batch> ops);

    /**
     * Visits every entry whose key starts with {@code prefix}, in key order or reverse key
     * order, until {@code visitor} returns false.
     */
    void scan(byte[] prefix, boolean reverse, Predicate<KeyValue> visitor);

    /**
     * Forward variant of {@link #scan} that starts at the first key strictly greater than
     * {@code after}, or at the start of the prefix when {@code after} is null.
     */
    void scanAfter(byte[] prefix, byte[] after, Predicate<KeyValue> visitor);

    /** True if the store did not exist before it was opened. */
    boolean isNew();

    boolean forSync();

    @Override
    void close();
}
