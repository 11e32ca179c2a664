package io.chainindex.core.storage;

import io.chainindex.core.protocol.HashX;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-hashX history of confirmed transaction numbers.
 *
 * <p>Rows are keyed {@code hashX + be16(flushId)} and hold packed little-endian 32-bit tx
 * numbers; each flush writes at most one row per hashX. Compaction rewrites a hashX's rows
 * into fixed-capacity rows numbered from zero.
 */
public final class History {
    private static final Logger LOG = Logger.getLogger(History.class.getName());

    static final byte[] STATE_KEY = {'s', 't', 'a', 't', 'e', 0, 0};
    static final int KEY_LENGTH = HashX.LENGTH + 2;
    public static final int MAX_FLUSH_COUNT = 65535;
    public static final int MAX_ROW_ENTRIES = 12_500;
    public static final int DEFAULT_LIMIT = 1000;
    static final int COMPACTION_DONE = 65536;
    private static final int PAGE_ROWS = 8;

    private KeyValueStore db;
    private int flushCount;
    private int compFlushCount = -1;
    private int compCursor = -1;
    private int dbVersion = HistoryState.CURRENT_VERSION;
    private final Map<HashX, List<Long>> unflushed = new HashMap<>();
    private long unflushedCount;

    /**
     * Opens the history database, drops rows written after the last UTXO flush and, unless
     * {@code compacting}, cancels an interrupted compaction.
     *
     * @return the flush count, which the UTXO state adopts
     */
    public int open(KeyValueStore.Factory stores, boolean forSync, int utxoFlushCount, boolean compacting) {
        db = stores.open("hist", forSync);
        readState();
        clearExcess(utxoFlushCount);
        if (!compacting) {
            cancelCompaction();
        }
        return flushCount;
    }

    public void close() {
        if (db != null) {
            db.close();
            db = null;
        }
    }

    private void readState() {
        byte[] raw = db.get(STATE_KEY);
        HistoryState state = raw == null ? HistoryState.initial() : HistoryState.decode(raw);
        flushCount = state.flushCount();
        compFlushCount = state.compFlushCount();
        compCursor = state.compCursor();
        dbVersion = state.dbVersion();
        LOG.info(() -> "history DB version: " + dbVersion);
        if (!HistoryState.DB_VERSIONS.contains(dbVersion)) {
            throw new DbException("this software only handles history DB versions " + HistoryState.DB_VERSIONS);
        }
        LOG.info(() -> "flush count: " + flushCount);
    }

    private void writeState(KeyValueStore.Batch batch) {
        batch.put(STATE_KEY, new HistoryState(flushCount, compFlushCount, compCursor, dbVersion).encode());
    }

    public HistoryState state() {
        return new HistoryState(flushCount, compFlushCount, compCursor, dbVersion);
    }

    public int flushCount() {
        return flushCount;
    }

    /** Deletes rows whose flush id is beyond the UTXO database's flush count. */
    void clearExcess(int utxoFlushCount) {
        // The UTXO count can be ahead at the end of a compaction; that is fine.
        if (flushCount <= utxoFlushCount) {
            return;
        }
        LOG.info("DB shut down uncleanly. Scanning for excess history flushes...");
        List<byte[]> keys = new ArrayList<>();
        db.scan(new byte[0], false, kv -> {
            byte[] key = kv.key();
            if (key.length == KEY_LENGTH && !Arrays.equals(key, STATE_KEY)
                    && Keys.readBe16(key, HashX.LENGTH) > utxoFlushCount) {
                keys.add(key);
            }
            return true;
        });
        LOG.info(() -> "deleting " + keys.size() + " history entries");
        flushCount = utxoFlushCount;
        db.write(batch -> {
            keys.forEach(batch::delete);
            writeState(batch);
        });
        LOG.info("deleted excess history entries");
    }

    /** Buffers the hashXs touched by consecutive transactions starting at {@code firstTxNum}. */
    public void addUnflushed(List<? extends Iterable<HashX>> hashXsByTx, long firstTxNum) {
        long txNum = firstTxNum;
        long count = 0;
        for (Iterable<HashX> hashXs : hashXsByTx) {
            Set<HashX> unique = new LinkedHashSet<>();
            hashXs.forEach(unique::add);
            for (HashX hashX : unique) {
                unflushed.computeIfAbsent(hashX, k -> new ArrayList<>()).add(txNum);
            }
            count += unique.size();
            txNum++;
        }
        unflushedCount += count;
    }

    /** Rough heap footprint of the unflushed buffer in bytes. */
    public long unflushedMemsize() {
        return unflushed.size() * 180L + unflushedCount * 4;
    }

    public void assertFlushed() {
        if (!unflushed.isEmpty()) {
            throw new DbException("history has " + unflushed.size() + " unflushed addresses");
        }
    }

    /** Writes the buffered entries as one new row per hashX. */
    public void flush() {
        if (flushCount >= MAX_FLUSH_COUNT) {
            throw new DbException("history flush count exhausted at " + flushCount + "; run history compaction");
        }
        long start = System.nanoTime();
        flushCount++;
        byte[] flushId = Keys.be16(flushCount);
        Map<HashX, List<Long>> sorted = new TreeMap<>(unflushed);
        db.write(batch -> {
            for (Map.Entry<HashX, List<Long>> e : sorted.entrySet()) {
                batch.put(Keys.concat(e.getKey().bytes(), flushId), pack(e.getValue()));
            }
            writeState(batch);
        });
        int count = unflushed.size();
        unflushed.clear();
        unflushedCount = 0;
        if (db.forSync()) {
            double elapsed = (System.nanoTime() - start) / 1e9;
            LOG.info(() -> String.format("flushed history in %.1fs for %,d addrs", elapsed, count));
        }
    }

    /** Removes every entry at or above {@code txCount} for the given hashXs. Counts as a flush. */
    public void backup(Set<HashX> hashXs, long txCount) {
        if (flushCount >= MAX_FLUSH_COUNT) {
            throw new DbException("history flush count exhausted at " + flushCount + "; run history compaction");
        }
        flushCount++;
        long[] removed = {0};
        db.write(batch -> {
            for (HashX hashX : sortedNonNull(hashXs)) {
                List<byte[]> deletes = new ArrayList<>();
                Map<byte[], byte[]> puts = new LinkedHashMap<>();
                db.scan(hashX.bytes(), true, kv -> {
                    long[] entries = unpack(kv.value());
                    int idx = bisectLeft(entries, txCount);
                    removed[0] += entries.length - idx;
                    if (idx > 0) {
                        puts.put(kv.key(), Arrays.copyOf(kv.value(), idx * 4));
                        return false;
                    }
                    deletes.add(kv.key());
                    return true;
                });
                deletes.forEach(batch::delete);
                puts.forEach(batch::put);
            }
            writeState(batch);
        });
        LOG.info(() -> "backing up removed " + removed[0] + " history entries");
    }

    private static Set<HashX> sortedNonNull(Set<HashX> hashXs) {
        Set<HashX> sorted = new TreeSet<>();
        for (HashX h : hashXs) {
            if (h != null) sorted.add(h);
        }
        return sorted;
    }

    /**
     * Confirmed tx numbers of {@code hashX} in ascending order. Rows are read lazily as the
     * iterator advances; each call to {@code iterator()} starts again from the beginning.
     *
     * @param limit maximum entries; null or negative for no limit
     */
    public Iterable<Long> getTxNums(HashX hashX, Integer limit) {
        long max = limit == null || limit < 0 ? Long.MAX_VALUE : limit;
        KeyValueStore store = db;
        byte[] prefix = hashX.bytes();
        return () -> new Iterator<>() {
            private long remaining = max;
            private byte[] lastKey;
            private final List<long[]> rows = new ArrayList<>();
            private long[] row = new long[0];
            private int pos;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                if (remaining <= 0) return false;
                while (pos >= row.length) {
                    if (rows.isEmpty() && !fetchPage()) return false;
                    row = rows.remove(0);
                    pos = 0;
                }
                return true;
            }

            private boolean fetchPage() {
                if (exhausted) return false;
                int[] seen = {0};
                store.scanAfter(prefix, lastKey, kv -> {
                    if (kv.key().length == KEY_LENGTH) {
                        rows.add(unpack(kv.value()));
                    }
                    lastKey = kv.key();
                    return ++seen[0] < PAGE_ROWS;
                });
                if (seen[0] < PAGE_ROWS) exhausted = true;
                return !rows.isEmpty();
            }

            @Override
            public Long next() {
                if (!hasNext()) throw new NoSuchElementException();
                remaining--;
                return row[pos++];
            }
        };
    }

    // ---------------- compaction ----------------

    public int compFlushCount() { return compFlushCount; }

    public int compCursor() { return compCursor; }

    /** Resumes an interrupted compaction or starts a new one. */
    public void beginCompaction() {
        if (compCursor == -1) {
            compCursor = 0;
        }
        compFlushCount = Math.max(compFlushCount, 1);
    }

    /**
     * One compaction pass over consecutive 2-byte key prefixes, stopping once about
     * {@code limitBytes} of rows have been written.
     *
     * @return bytes written
     */
    public long compact(long limitBytes) {
        Set<byte[]> keysToDelete = new TreeSet<>(Arrays::compareUnsigned);
        List<KeyValue> writeItems = new ArrayList<>();
        long writeSize = 0;
        int cursor = compCursor;
        while (writeSize < limitBytes && cursor < COMPACTION_DONE) {
            writeSize += compactPrefix(Keys.be16(cursor), writeItems, keysToDelete);
            cursor++;
        }
        int maxRows = compFlushCount + 1;
        flushCompaction(cursor, writeItems, keysToDelete);
        long written = writeSize;
        int done = cursor;
        LOG.info(() -> String.format(
                "history compaction: wrote %,d rows (%.1f MB), removed %,d rows, largest: %,d, %.1f%% complete",
                writeItems.size(), written / 1_000_000.0, keysToDelete.size(), maxRows, 100.0 * done / COMPACTION_DONE));
        return writeSize;
    }

    private void flushCompaction(int cursor, List<KeyValue> writeItems, Set<byte[]> keysToDelete) {
        if (cursor == COMPACTION_DONE) {
            flushCount = compFlushCount;
            compCursor = -1;
            compFlushCount = -1;
        } else {
            compCursor = cursor;
        }
        db.write(batch -> {
            // old and new row keys overlap, so deletes must come first
            keysToDelete.forEach(batch::delete);
            writeItems.forEach(kv -> batch.put(kv.key(), kv.value()));
            writeState(batch);
        });
    }

    private long compactPrefix(byte[] prefix, List<KeyValue> writeItems, Set<byte[]> keysToDelete) {
        long[] writeSize = {0};
        HashX[] prior = {null};
        Map<byte[], byte[]> histMap = new TreeMap<>(Arrays::compareUnsigned);
        db.scan(prefix, false, kv -> {
            byte[] key = kv.key();
            if (key.length != KEY_LENGTH) {
                return true;
            }
            HashX hashX = HashX.of(key, 0);
            if (prior[0] != null && !hashX.equals(prior[0])) {
                writeSize[0] += compactHashX(prior[0], histMap, writeItems, keysToDelete);
                histMap.clear();
            }
            prior[0] = hashX;
            histMap.put(key, kv.value());
            return true;
        });
        if (prior[0] != null) {
            writeSize[0] += compactHashX(prior[0], histMap, writeItems, keysToDelete);
        }
        return writeSize[0];
    }

    private long compactHashX(HashX hashX, Map<byte[], byte[]> histMap,
                              List<KeyValue> writeItems, Set<byte[]> keysToDelete) {
        int maxRowSize = MAX_ROW_ENTRIES * 4;
        int total = 0;
        for (byte[] v : histMap.values()) total += v.length;
        byte[] full = new byte[total];
        int off = 0;
        for (byte[] v : histMap.values()) {
            System.arraycopy(v, 0, full, off, v.length);
            off += v.length;
        }
        int nrows = (full.length + maxRowSize - 1) / maxRowSize;
        if (nrows > 4) {
            LOG.info(() -> String.format("hashX %s is large: %,d entries across %,d rows",
                    hashX.hex(), full.length / 4, nrows));
        }
        long writeSize = 0;
        keysToDelete.addAll(histMap.keySet());
        for (int n = 0; n < nrows; n++) {
            byte[] chunk = Arrays.copyOfRange(full, n * maxRowSize, Math.min(full.length, (n + 1) * maxRowSize));
            byte[] key = Keys.concat(hashX.bytes(), Keys.be16(n));
            byte[] existing = histMap.get(key);
            if (existing != null && Arrays.equals(existing, chunk)) {
                keysToDelete.remove(key);
            } else {
                writeItems.add(new KeyValue(key, chunk));
                writeSize += chunk.length;
            }
        }
        compFlushCount = Math.max(compFlushCount, nrows - 1);
        return writeSize;
    }

    private void cancelCompaction() {
        if (compCursor != -1) {
            LOG.log(Level.WARNING, "cancelling in-progress history compaction");
            compFlushCount = -1;
            compCursor = -1;
        }
    }

    // ---------------- encoding ----------------

    static byte[] pack(List<Long> txNums) {
        byte[] out = new byte[txNums.size() * 4];
        for (int i = 0; i < txNums.size(); i++) {
            long v = txNums.get(i);
            out[4 * i] = (byte) v;
            out[4 * i + 1] = (byte) (v >>> 8);
            out[4 * i + 2] = (byte) (v >>> 16);
            out[4 * i + 3] = (byte) (v >>> 24);
        }
        return out;
    }

    static long[] unpack(byte[] row) {
        long[] out = new long[row.length / 4];
        for (int i = 0; i < out.length; i++) {
            out[i] = Keys.readLe32(row, 4 * i);
        }
        return out;
    }

    static int bisectLeft(long[] a, long x) {
        int lo = 0;
        int hi = a.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (a[mid] < x) lo = mid + 1; else hi = mid;
        }
        return lo;
    }
}
