package io.chainindex.core.storage;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Set;

/**
 * Persisted bookkeeping of the history database.
 *
 * <p>Encoding: one format byte followed by big-endian {@code dbVersion}, {@code flushCount},
 * {@code compFlushCount} and {@code compCursor} as 32-bit integers.
 */
public record HistoryState(int flushCount, int compFlushCount, int compCursor, int dbVersion) {
    static final byte FORMAT = 1;
    static final int ENCODED_SIZE = 1 + 4 * 4;
    public static final Set<Integer> DB_VERSIONS = Set.of(0);
    public static final int CURRENT_VERSION = 0;

    public static HistoryState initial() {
        return new HistoryState(0, -1, -1, CURRENT_VERSION);
    }

    public byte[] encode() {
        return ByteBuffer.allocate(ENCODED_SIZE)
                .put(FORMAT)
                .putInt(dbVersion)
                .putInt(flushCount)
                .putInt(compFlushCount)
                .putInt(compCursor)
                .array();
    }

    public static HistoryState decode(byte[] data) {
        if (data.length != ENCODED_SIZE || data[0] != FORMAT) {
            throw new DbException("failed reading state from history DB");
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(data, 1, data.length - 1);
            int dbVersion = buf.getInt();
            return new HistoryState(buf.getInt(), buf.getInt(), buf.getInt(), dbVersion);
        } catch (BufferUnderflowException e) {
            throw new DbException("failed reading state from history DB", e);
        }
    }
}
