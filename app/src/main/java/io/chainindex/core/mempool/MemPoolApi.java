package io.chainindex.core.mempool;

import io.chainindex.core.protocol.HashX;
import io.chainindex.core.protocol.Prevout;
import io.chainindex.core.storage.HashXValue;

import java.util.List;
import java.util.Set;

/** What the mempool needs from the daemon, the database and the notifier. */
public interface MemPoolApi {

    /** Queries the daemon's height. */
    int height();

    /** The daemon height last seen, without querying. */
    int cachedHeight();

    /** Display-hex hashes of every transaction in the daemon's mempool. */
    List<String> mempoolHashes();

    /** Raw transactions in request order; null where the daemon no longer has one. */
    List<byte[]> rawTransactions(List<String> hexHashes);

    /** Owner and value of each prevout if it is unspent in the database, else null. */
    List<HashXValue> lookupUtxos(List<Prevout> prevouts);

    /** Called after every refresh with the hashXs touched since the previous one. */
    void onMempool(Set<HashX> touched, int height);
}
