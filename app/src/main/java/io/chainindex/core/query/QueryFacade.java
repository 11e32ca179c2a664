package io.chainindex.core.query;

import io.chainindex.core.daemon.ChainSource;
import io.chainindex.core.daemon.DaemonException;
import io.chainindex.core.mempool.FeeHistogram;
import io.chainindex.core.mempool.MemPool;
import io.chainindex.core.mempool.MemPoolTxSummary;
import io.chainindex.core.protocol.HashX;
import io.chainindex.core.protocol.Merkle;
import io.chainindex.core.protocol.Prevout;
import io.chainindex.core.storage.ChainDb;
import io.chainindex.core.storage.HashXValue;
import io.chainindex.core.storage.TxLocation;
import io.chainindex.core.storage.Utxo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Read-side API over the chain database, the mempool and the daemon.
 *
 * <p>Confirmed histories are cached per hashX, least recently used first out. Entries are
 * dropped only for hashXs in a touched set passed to {@link #invalidate}.
 */
public final class QueryFacade {
    private static final Logger LOG = Logger.getLogger(QueryFacade.class.getName());

    public static final int MAX_CHUNK_SIZE = 2016;

    private final ChainDb db;
    private final MemPool mempool;
    private final ChainSource daemon;
    private final int maxHistory;
    private final Map<HashX, List<TxLocation>> historyCache;
    // bumped on every invalidation so a lookup racing one does not cache stale rows
    private long cacheGeneration;

    public QueryFacade(ChainDb db, MemPool mempool, ChainSource daemon, int historyCacheSize, int maxHistory) {
        this.db = db;
        this.mempool = mempool;
        this.daemon = daemon;
        this.maxHistory = maxHistory;
        this.historyCache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<HashX, List<TxLocation>> eldest) {
                return size() > historyCacheSize;
            }
        };
    }

    /** Drops cached histories of the touched hashXs. Registered as a notification listener. */
    public void invalidate(int height, Set<HashX> touched) {
        synchronized (historyCache) {
            cacheGeneration++;
            for (HashX hashX : touched) {
                historyCache.remove(hashX);
            }
        }
    }

    /** Confirmed history of {@code hashX}, oldest first, capped at the configured maximum. */
    public List<TxLocation> limitedHistory(HashX hashX) {
        long generation;
        synchronized (historyCache) {
            List<TxLocation> cached = historyCache.get(hashX);
            if (cached != null) {
                return cached;
            }
            generation = cacheGeneration;
        }
        List<TxLocation> history = List.copyOf(db.limitedHistory(hashX, maxHistory));
        synchronized (historyCache) {
            if (generation == cacheGeneration) {
                historyCache.put(hashX, history);
            }
        }
        return history;
    }

    int cachedHistories() {
        synchronized (historyCache) {
            return historyCache.size();
        }
    }

    public List<Utxo> allUtxos(HashX hashX) {
        return db.allUtxos(hashX);
    }

    public List<HashXValue> lookupUtxos(List<Prevout> prevouts) {
        return db.lookupUtxos(prevouts);
    }

    public Balance balance(HashX hashX) {
        long confirmed = 0;
        for (Utxo utxo : db.allUtxos(hashX)) {
            confirmed += utxo.value();
        }
        return new Balance(confirmed, mempool.balanceDelta(hashX));
    }

    /**
     * Unspent outputs of {@code hashX}: confirmed ones in database order, then mempool ones,
     * leaving out anything a mempool transaction may spend.
     */
    public List<Utxo> listUnspent(HashX hashX) {
        List<Utxo> utxos = new ArrayList<>(db.allUtxos(hashX));
        utxos.sort(Comparator.comparingLong(Utxo::txNum).thenComparingInt(Utxo::txPos));
        utxos.addAll(mempool.unorderedUtxos(hashX));
        Set<Prevout> spends = mempool.potentialSpends(hashX);
        List<Utxo> result = new ArrayList<>(utxos.size());
        for (Utxo utxo : utxos) {
            if (!spends.contains(new Prevout(utxo.txHash(), utxo.txPos()))) {
                result.add(utxo);
            }
        }
        return result;
    }

    public List<MemPoolTxSummary> mempoolSummaries(HashX hashX) {
        return mempool.transactionSummaries(hashX);
    }

    public long mempoolBalanceDelta(HashX hashX) {
        return mempool.balanceDelta(hashX);
    }

    public Set<Prevout> mempoolPotentialSpends(HashX hashX) {
        return mempool.potentialSpends(hashX);
    }

    public List<Utxo> mempoolUtxos(HashX hashX) {
        return mempool.unorderedUtxos(hashX);
    }

    public List<FeeHistogram.Bin> feeHistogram() {
        return mempool.compactFeeHistogram();
    }

    public int mempoolSize() {
        return mempool.size();
    }

    // ---------------- headers ----------------

    public int height() {
        return db.dbHeight();
    }

    public byte[] rawHeader(int height) {
        try {
            return db.rawHeader(height);
        } catch (IndexOutOfBoundsException e) {
            throw new BadRequestException(String.format("height %,d out of range", height));
        }
    }

    public Map<String, Object> electrumHeader(int height) {
        return db.codec().electrumHeader(rawHeader(height), height);
    }

    /** Up to {@value #MAX_CHUNK_SIZE} consecutive headers from {@code startHeight}. */
    public ChainDb.HeaderRange readHeaders(int startHeight, int count) {
        return db.readHeaders(startHeight, Math.min(count, MAX_CHUNK_SIZE));
    }

    /** Merkle proof of the header at {@code height} against the headers up to {@code cpHeight}. */
    public Merkle.BranchAndRoot headerProof(int cpHeight, int height) {
        int maxHeight = db.dbHeight();
        if (height > cpHeight || cpHeight > maxHeight) {
            throw new BadRequestException(String.format(
                    "require header height %,d <= cp_height %,d <= chain height %,d", height, cpHeight, maxHeight));
        }
        return db.headerBranchAndRoot(cpHeight + 1, height);
    }

    // ---------------- daemon passthroughs ----------------

    /** Relays a transaction and refreshes the mempool early; rejections become bad requests. */
    public String broadcast(String rawTxHex) {
        try {
            String hexHash = daemon.broadcastTransaction(rawTxHex);
            LOG.info(() -> "sent tx: " + hexHash);
            mempool.wakeup();
            return hexHash;
        } catch (DaemonException e) {
            LOG.info(() -> "error sending transaction: " + e.getMessage());
            throw new BadRequestException("the transaction was rejected by network rules.\n\n"
                    + e.getMessage() + "\n[" + rawTxHex + "]");
        }
    }

    public double estimateFee(int blocks) {
        return daemon.estimateFee(blocks);
    }

    public double relayFee() {
        return daemon.relayFee();
    }

    public int daemonHeight() {
        return daemon.cachedHeight();
    }
}
