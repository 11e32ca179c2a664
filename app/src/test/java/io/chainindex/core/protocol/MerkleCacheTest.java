package io.chainindex.core.protocol;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MerkleCacheTest {

    private final Merkle merkle = new Merkle();
    private final List<byte[]> source = new ArrayList<>();

    private MerkleCache cache() {
        for (int i = 0; i < 150; i++) {
            source.add(Hashes.sha256(ByteBuffer.allocate(4).putInt(i).array()));
        }
        return new MerkleCache(merkle, (start, count) -> new ArrayList<>(source.subList(start, start + count)));
    }

    private void assertSame(Merkle.BranchAndRoot expected, Merkle.BranchAndRoot actual) {
        assertArrayEquals(expected.root(), actual.root());
        assertEquals(expected.branch().size(), actual.branch().size());
        for (int i = 0; i < expected.branch().size(); i++) {
            assertArrayEquals(expected.branch().get(i), actual.branch().get(i));
        }
    }

    @Test
    void matchesUncachedBranchesForEveryLength() {
        MerkleCache cache = cache();
        cache.initialize(40);
        for (int length = 1; length <= 150; length += 7) {
            for (int index = 0; index < length; index += 5) {
                assertSame(merkle.branchAndRoot(source.subList(0, length), index),
                        cache.branchAndRoot(length, index));
            }
        }
        assertEquals(148, cache.length());
    }

    @Test
    void initializesLazilyOnFirstQuery() {
        MerkleCache cache = cache();
        assertFalse(cache.isInitialized());
        assertSame(merkle.branchAndRoot(source.subList(0, 100), 63), cache.branchAndRoot(100, 63));
        assertTrue(cache.isInitialized());
    }

    @Test
    void truncateThenRegrowFollowsReplacedHashes() {
        MerkleCache cache = cache();
        cache.initialize(120);
        cache.truncate(90);
        for (int i = 90; i < 120; i++) {
            source.set(i, Hashes.sha256(ByteBuffer.allocate(4).putInt(-i).array()));
        }
        assertSame(merkle.branchAndRoot(source.subList(0, 120), 100), cache.branchAndRoot(120, 100));
        assertSame(merkle.branchAndRoot(source.subList(0, 120), 3), cache.branchAndRoot(120, 3));
    }

    @Test
    void rejectsIndexOutsideLength() {
        MerkleCache cache = cache();
        assertThrows(IllegalArgumentException.class, () -> cache.branchAndRoot(10, 10));
        assertThrows(IllegalArgumentException.class, () -> cache.branchAndRoot(0, 0));
    }
}
