package io.chainindex.core.daemon;

import java.util.List;

/** The full node the indexer follows. Hashes are in display (byte-reversed) hex. */
public interface ChainSource {

    /** Queries the current block height and remembers it. */
    int height();

    /** The height last returned by {@link #height()}, or -1 before the first query. */
    int cachedHeight();

    List<String> blockHexHashes(int first, int count);

    List<byte[]> rawBlocks(List<String> hexHashes);

    List<String> mempoolHashes();

    /**
     * Raw transactions in request order. With {@code replaceErrs} a transaction the node
     * cannot return becomes null instead of failing the whole call.
     */
    List<byte[]> rawTransactions(List<String> hexHashes, boolean replaceErrs);

    /** Submits a transaction and returns its hash. Rejections raise {@link DaemonException}. */
    String broadcastTransaction(String rawTxHex);

    /** Fee rate in coin units per kilobyte, or -1 if the node has no estimate. */
    double estimateFee(int blocks);

    double relayFee();
}
