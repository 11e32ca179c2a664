package io.chainindex.core;

import io.chainindex.core.daemon.ChainSource;
import io.chainindex.core.daemon.DaemonException;
import io.chainindex.core.protocol.Hashes;
import io.chainindex.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** In-process daemon serving a {@link TestChain} and a settable mempool. */
public final class FakeChainSource implements ChainSource {
    private final List<byte[]> blocks = new ArrayList<>();
    private final Map<String, byte[]> blocksByHash = new HashMap<>();
    private final Map<String, byte[]> mempool = new LinkedHashMap<>();
    private final List<String> broadcasts = new ArrayList<>();
    private volatile int cachedHeight = -1;
    private String rejection;

    public FakeChainSource(TestChain chain) {
        setChain(chain);
    }

    /** Replaces the served chain, as a reorg on the node would. */
    public synchronized void setChain(TestChain chain) {
        blocks.clear();
        for (int h = 0; h <= chain.height(); h++) {
            blocks.add(chain.block(h));
            blocksByHash.put(Hashes.hashToHex(chain.blockHash(h)), chain.block(h));
        }
    }

    public synchronized void addMempoolTx(Transaction tx) {
        mempool.put(tx.hash().hex(), tx.serialize());
    }

    public synchronized void clearMempool() {
        mempool.clear();
    }

    public synchronized void rejectBroadcasts(String reason) {
        this.rejection = reason;
    }

    public synchronized List<String> broadcasts() {
        return List.copyOf(broadcasts);
    }

    @Override
    public synchronized int height() {
        cachedHeight = blocks.size() - 1;
        return cachedHeight;
    }

    @Override
    public int cachedHeight() {
        return cachedHeight;
    }

    @Override
    public synchronized List<String> blockHexHashes(int first, int count) {
        List<String> hashes = new ArrayList<>(count);
        for (int h = first; h < first + count && h < blocks.size(); h++) {
            hashes.add(Hashes.hashToHex(Hashes.doubleSha256(Arrays.copyOf(blocks.get(h), 80))));
        }
        return hashes;
    }

    @Override
    public synchronized List<byte[]> rawBlocks(List<String> hexHashes) {
        List<byte[]> out = new ArrayList<>(hexHashes.size());
        for (String hex : hexHashes) {
            byte[] block = blocksByHash.get(hex);
            if (block == null) {
                throw new DaemonException("block not found: " + hex);
            }
            out.add(block);
        }
        return out;
    }

    @Override
    public synchronized List<String> mempoolHashes() {
        return new ArrayList<>(mempool.keySet());
    }

    @Override
    public synchronized List<byte[]> rawTransactions(List<String> hexHashes, boolean replaceErrs) {
        List<byte[]> out = new ArrayList<>(hexHashes.size());
        for (String hex : hexHashes) {
            byte[] raw = mempool.get(hex);
            if (raw == null && !replaceErrs) {
                throw new DaemonException("No such mempool or blockchain transaction");
            }
            out.add(raw);
        }
        return out;
    }

    @Override
    public synchronized String broadcastTransaction(String rawTxHex) {
        if (rejection != null) {
            throw new DaemonException(rejection);
        }
        byte[] raw = Hashes.fromHex(rawTxHex);
        String hash = Hashes.hashToHex(Hashes.doubleSha256(raw));
        broadcasts.add(rawTxHex);
        mempool.put(hash, raw);
        return hash;
    }

    @Override
    public double estimateFee(int blocks) {
        return blocks == 0 ? -1 : 0.0002;
    }

    @Override
    public double relayFee() {
        return 0.00001;
    }
}
