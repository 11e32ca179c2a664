package io.chainindex.core.storage;

import io.chainindex.core.protocol.Hash;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Set;

/**
 * The UTXO database's singleton state record.
 *
 * <p>Encoding: a format byte, then big-endian {@code dbVersion}, the genesis hash,
 * {@code height}, {@code txCount}, {@code tip}, {@code utxoFlushCount}, {@code wallTimeSecs}
 * and a {@code firstSync} byte. Hashes are stored in internal byte order.
 */
public record ChainState(
        Hash genesisHash,
        int height,
        long txCount,
        Hash tip,
        int utxoFlushCount,
        double wallTimeSecs,
        boolean firstSync,
        int dbVersion
) {
    static final byte FORMAT = 1;
    static final int ENCODED_SIZE = 1 + 4 + 32 + 4 + 8 + 32 + 4 + 8 + 1;
    public static final Set<Integer> DB_VERSIONS = Set.of(6);
    public static final int CURRENT_VERSION = 6;

    /** State of a database that has not indexed any block. */
    public static ChainState empty(Hash genesisHash) {
        return new ChainState(genesisHash, -1, 0, Hash.ZERO, 0, 0.0, true, CURRENT_VERSION);
    }

    public byte[] encode() {
        return ByteBuffer.allocate(ENCODED_SIZE)
                .put(FORMAT)
                .putInt(dbVersion)
                .put(genesisHash.bytes())
                .putInt(height)
                .putLong(txCount)
                .put(tip.bytes())
                .putInt(utxoFlushCount)
                .putDouble(wallTimeSecs)
                .put((byte) (firstSync ? 1 : 0))
                .array();
    }

    public static ChainState decode(byte[] data) {
        if (data.length != ENCODED_SIZE || data[0] != FORMAT) {
            throw new DbException("failed reading state from DB");
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(data, 1, data.length - 1);
            int dbVersion = buf.getInt();
            byte[] genesis = new byte[32];
            buf.get(genesis);
            int height = buf.getInt();
            long txCount = buf.getLong();
            byte[] tip = new byte[32];
            buf.get(tip);
            int flushCount = buf.getInt();
            double wallTime = buf.getDouble();
            boolean firstSync = buf.get() != 0;
            return new ChainState(new Hash(genesis), height, txCount, new Hash(tip), flushCount,
                    wallTime, firstSync, dbVersion);
        } catch (BufferUnderflowException e) {
            throw new DbException("failed reading state from DB", e);
        }
    }
}
