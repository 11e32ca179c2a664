package io.chainindex.core.storage;

import java.util.Arrays;

/**
 * Cumulative transaction count at the end of each height. Appended by the block processor
 * ahead of the flushed state and searched by concurrent readers.
 */
public final class TxCounts {
    private long[] counts;
    private int size;

    public TxCounts() {
        this.counts = new long[1024];
    }

    static TxCounts fromLe32(byte[] data) {
        TxCounts t = new TxCounts();
        t.counts = new long[Math.max(1024, data.length / 4 + 1024)];
        for (int i = 0; i < data.length / 4; i++) {
            t.counts[i] = Keys.readLe32(data, 4 * i);
        }
        t.size = data.length / 4;
        return t;
    }

    public synchronized void append(long count) {
        if (size == counts.length) {
            counts = Arrays.copyOf(counts, counts.length * 2);
        }
        counts[size++] = count;
    }

    public synchronized long pop() {
        if (size == 0) {
            throw new IllegalStateException("tx counts are empty");
        }
        return counts[--size];
    }

    public synchronized long get(int height) {
        if (height < 0 || height >= size) {
            throw new IndexOutOfBoundsException("height " + height + " of " + size);
        }
        return counts[height];
    }

    public synchronized int size() {
        return size;
    }

    /** Last cumulative count, or 0 when empty. */
    public synchronized long last() {
        return size == 0 ? 0 : counts[size - 1];
    }

    /** Height whose block contains {@code txNum}: the first index with a count above it. */
    public synchronized int bisectRight(long txNum) {
        int lo = 0;
        int hi = size;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (txNum < counts[mid]) hi = mid; else lo = mid + 1;
        }
        return lo;
    }

    /** Little-endian 32-bit encoding of the counts from {@code fromHeight} on. */
    public synchronized byte[] toLe32(int fromHeight) {
        int n = Math.max(0, size - fromHeight);
        byte[] out = new byte[n * 4];
        for (int i = 0; i < n; i++) {
            System.arraycopy(Keys.le32(counts[fromHeight + i]), 0, out, 4 * i, 4);
        }
        return out;
    }
}
