package io.chainindex.core.protocol;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MerkleTest {

    private final Merkle merkle = new Merkle();

    private static List<byte[]> leaves(int n) {
        List<byte[]> hashes = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            hashes.add(Hashes.sha256(ByteBuffer.allocate(4).putInt(i).array()));
        }
        return hashes;
    }

    @Test
    void singleHashIsItsOwnRoot() {
        List<byte[]> hashes = leaves(1);
        Merkle.BranchAndRoot result = merkle.branchAndRoot(hashes, 0);
        assertTrue(result.branch().isEmpty());
        assertArrayEquals(hashes.get(0), result.root());
    }

    @Test
    void oddLayerRepeatsLastHash() {
        List<byte[]> hashes = leaves(3);
        byte[] left = Hashes.doubleSha256(hashes.get(0), hashes.get(1));
        byte[] right = Hashes.doubleSha256(hashes.get(2), hashes.get(2));
        assertArrayEquals(Hashes.doubleSha256(left, right), merkle.root(hashes));
    }

    @Test
    void everyBranchProvesItsLeaf() {
        for (int n = 1; n <= 33; n++) {
            List<byte[]> hashes = leaves(n);
            byte[] root = merkle.root(hashes);
            for (int index = 0; index < n; index++) {
                Merkle.BranchAndRoot result = merkle.branchAndRoot(hashes, index);
                assertEquals(merkle.branchLength(n), result.branch().size());
                assertArrayEquals(root, result.root());
                assertArrayEquals(root, merkle.rootFromProof(hashes.get(index), result.branch(), index),
                        "leaf " + index + " of " + n);
            }
        }
    }

    @Test
    void branchLengthIsCeilLog2() {
        assertEquals(0, merkle.branchLength(1));
        assertEquals(1, merkle.branchLength(2));
        assertEquals(2, merkle.branchLength(3));
        assertEquals(10, merkle.branchLength(1024));
        assertEquals(11, merkle.branchLength(1025));
        assertThrows(IllegalArgumentException.class, () -> merkle.branchLength(0));
    }

    @Test
    void rejectsBadArguments() {
        List<byte[]> hashes = leaves(4);
        assertThrows(IllegalArgumentException.class, () -> merkle.branchAndRoot(hashes, 4));
        assertThrows(IllegalArgumentException.class, () -> merkle.branchAndRoot(hashes, 0, 1));
        Merkle.BranchAndRoot proof = merkle.branchAndRoot(hashes, 1);
        assertThrows(IllegalArgumentException.class,
                () -> merkle.rootFromProof(hashes.get(1), proof.branch(), 5));
    }

    @Test
    void levelMatchesSegmentRoots() {
        List<byte[]> hashes = leaves(10);
        List<byte[]> level = merkle.level(hashes, 2);
        assertEquals(3, level.size());
        assertArrayEquals(merkle.root(hashes.subList(0, 4), 2), level.get(0));
        assertArrayEquals(merkle.root(hashes.subList(8, 10), 2), level.get(2));
    }
}
