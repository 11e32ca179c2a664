package io.chainindex.core.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Merkle tree calculations over binary hashes. When a layer has an odd number of hashes the
 * last one is repeated, as Bitcoin does.
 */
public final class Merkle {

    /** A branch deepest-to-shallowest, and the root it leads to. */
    public record BranchAndRoot(List<byte[]> branch, byte[] root) {}

    private final BinaryOperator<byte[]> hashPair;

    public Merkle() {
        this(Hashes::doubleSha256);
    }

    public Merkle(BinaryOperator<byte[]> hashPair) {
        this.hashPair = hashPair;
    }

    public int treeDepth(int hashCount) {
        return branchLength(hashCount) + 1;
    }

    /** {@code ceil(log2(hashCount))}. */
    public int branchLength(int hashCount) {
        if (hashCount < 1) {
            throw new IllegalArgumentException("hash count must be at least 1");
        }
        return 32 - Integer.numberOfLeadingZeros(hashCount - 1);
    }

    public BranchAndRoot branchAndRoot(List<byte[]> hashes, int index) {
        return branchAndRoot(hashes, index, -1);
    }

    /**
     * Branch and root for the hash at {@code index}. A {@code length} of -1 uses the natural
     * branch length; a longer length pads the tree upwards.
     */
    public BranchAndRoot branchAndRoot(List<byte[]> hashes, int index, int length) {
        if (index < 0 || index >= hashes.size()) {
            throw new IllegalArgumentException("index out of range");
        }
        int natural = branchLength(hashes.size());
        if (length == -1) {
            length = natural;
        } else if (length < natural) {
            throw new IllegalArgumentException("length out of range");
        }

        List<byte[]> layer = new ArrayList<>(hashes);
        List<byte[]> branch = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            if ((layer.size() & 1) == 1) {
                layer.add(layer.get(layer.size() - 1));
            }
            branch.add(layer.get(index ^ 1));
            index >>= 1;
            List<byte[]> next = new ArrayList<>(layer.size() / 2);
            for (int n = 0; n < layer.size(); n += 2) {
                next.add(hashPair.apply(layer.get(n), layer.get(n + 1)));
            }
            layer = next;
        }
        return new BranchAndRoot(branch, layer.get(0));
    }

    public byte[] root(List<byte[]> hashes) {
        return branchAndRoot(hashes, 0, -1).root();
    }

    public byte[] root(List<byte[]> hashes, int length) {
        return branchAndRoot(hashes, 0, length).root();
    }

    /** Folds {@code branch} back up from {@code hash}; equal to the root when the proof holds. */
    public byte[] rootFromProof(byte[] hash, List<byte[]> branch, int index) {
        for (byte[] elt : branch) {
            if ((index & 1) == 1) {
                hash = hashPair.apply(elt, hash);
            } else {
                hash = hashPair.apply(hash, elt);
            }
            index >>= 1;
        }
        if (index != 0) {
            throw new IllegalArgumentException("index out of range for branch");
        }
        return hash;
    }

    /** The layer {@code depthHigher} above the leaves, one hash per full or partial segment. */
    public List<byte[]> level(List<byte[]> hashes, int depthHigher) {
        int size = 1 << depthHigher;
        List<byte[]> level = new ArrayList<>((hashes.size() + size - 1) / size);
        for (int n = 0; n < hashes.size(); n += size) {
            level.add(root(hashes.subList(n, Math.min(n + size, hashes.size())), depthHigher));
        }
        return level;
    }

    /**
     * Branch and root using a cached mid-tree {@code level}. {@code leafHashes} are the leaves of
     * the segment containing {@code index}.
     */
    public BranchAndRoot branchAndRootFromLevel(List<byte[]> level, List<byte[]> leafHashes, int index,
                                                int depthHigher) {
        int leafIndex = (index >> depthHigher) << depthHigher;
        BranchAndRoot leaf = branchAndRoot(leafHashes, index - leafIndex, depthHigher);
        int levelIndex = index >> depthHigher;
        BranchAndRoot upper = branchAndRoot(level, levelIndex);
        if (!Arrays.equals(leaf.root(), level.get(levelIndex))) {
            throw new IllegalArgumentException("leaf hashes inconsistent with level");
        }
        List<byte[]> branch = new ArrayList<>(leaf.branch().size() + upper.branch().size());
        branch.addAll(leaf.branch());
        branch.addAll(upper.branch());
        return new BranchAndRoot(branch, upper.root());
    }
}
