package io.chainindex.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Caches one mid-tree level of the merkle tree over a growing sequence of hashes (block
 * header hashes in practice) so that branches can be produced without rehashing the whole
 * sequence. Results are identical to {@link Merkle#branchAndRoot} over the first
 * {@code length} source hashes.
 */
public final class MerkleCache {

    @FunctionalInterface
    public interface HashSource {
        /** Returns {@code count} hashes starting at {@code start}. */
        List<byte[]> hashes(int start, int count);
    }

    private final Merkle merkle;
    private final HashSource source;
    private int length;
    private int depthHigher;
    private List<byte[]> level = new ArrayList<>();
    private boolean initialized;

    public MerkleCache(Merkle merkle, HashSource source) {
        this.merkle = merkle;
        this.source = source;
    }

    public synchronized void initialize(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive");
        }
        this.length = length;
        this.depthHigher = merkle.treeDepth(length) / 2;
        this.level = new ArrayList<>(levelOf(source.hashes(0, length)));
        this.initialized = true;
    }

    public synchronized boolean isInitialized() {
        return initialized;
    }

    public synchronized int length() {
        return length;
    }

    /** Drops cached state beyond {@code length} hashes. Used when the chain is backed up. */
    public synchronized void truncate(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
        if (length >= this.length) {
            return;
        }
        length = leafStart(length);
        this.length = length;
        level.subList(length >> depthHigher, level.size()).clear();
    }

    public synchronized Merkle.BranchAndRoot branchAndRoot(int length, int index) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
        if (index < 0 || index >= length) {
            throw new IllegalArgumentException("index must be less than length");
        }
        if (!initialized) {
            initialize(length);
        }
        extendTo(length);
        int leafStart = leafStart(index);
        int count = Math.min(segmentLength(), length - leafStart);
        List<byte[]> leafHashes = source.hashes(leafStart, count);
        if (length < segmentLength()) {
            return merkle.branchAndRoot(leafHashes, index);
        }
        return merkle.branchAndRootFromLevel(levelFor(length), leafHashes, index, depthHigher);
    }

    private int segmentLength() {
        return 1 << depthHigher;
    }

    private int leafStart(int index) {
        return (index >> depthHigher) << depthHigher;
    }

    private List<byte[]> levelOf(List<byte[]> hashes) {
        if (hashes.isEmpty()) {
            return List.of();
        }
        return merkle.level(hashes, depthHigher);
    }

    private void extendTo(int length) {
        if (length <= this.length) {
            return;
        }
        // Start from the beginning of any final partial segment.
        int start = leafStart(this.length);
        List<byte[]> hashes = source.hashes(start, length - start);
        level.subList(start >> depthHigher, level.size()).clear();
        level.addAll(levelOf(hashes));
        this.length = length;
    }

    private List<byte[]> levelFor(int length) {
        if (length == this.length) {
            return level;
        }
        List<byte[]> result = new ArrayList<>(level.subList(0, length >> depthHigher));
        int leafStart = leafStart(length);
        int count = Math.min(segmentLength(), length - leafStart);
        if (count > 0) {
            result.addAll(levelOf(source.hashes(leafStart, count)));
        }
        return result;
    }
}
