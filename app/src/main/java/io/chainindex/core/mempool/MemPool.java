package io.chainindex.core.mempool;

import io.chainindex.core.codec.ChainCodec;
import io.chainindex.core.metrics.IndexMetrics;
import io.chainindex.core.protocol.Hash;
import io.chainindex.core.protocol.HashX;
import io.chainindex.core.protocol.Prevout;
import io.chainindex.core.protocol.TxInput;
import io.chainindex.core.protocol.TxOutput;
import io.chainindex.core.protocol.TxWithHash;
import io.chainindex.core.storage.HashXValue;
import io.chainindex.core.storage.Utxo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The daemon's mempool, kept in step by periodic refreshes.
 *
 * <p>Two maps are maintained: transaction hash to {@link MemPoolTx}, and hashX to the hashes
 * of the transactions touching it. Refreshes and histogram rebuilds are serialized by
 * {@code refreshLock}; queries read under {@code stateLock} and see either the state before or
 * after each mutation.
 */
public final class MemPool {
    private static final Logger LOG = Logger.getLogger(MemPool.class.getName());

    static final int FETCH_CHUNK = 200;
    static final long LOG_STATUS_MILLIS = 120_000;

    private final ChainCodec codec;
    private final MemPoolApi api;
    private final long refreshMillis;
    private final long histogramRefreshMillis;

    private final Map<Hash, MemPoolTx> txs = new HashMap<>();
    private final Map<HashX, Set<Hash>> hashXs = new HashMap<>();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();
    private final CompletableFuture<Void> synced = new CompletableFuture<>();
    private volatile List<FeeHistogram.Bin> histogram = List.of();

    private final ExecutorService workers;
    private ScheduledExecutorService scheduler;

    public MemPool(ChainCodec codec, MemPoolApi api, long refreshMillis, long histogramRefreshMillis) {
        this.codec = codec;
        this.api = api;
        this.refreshMillis = refreshMillis;
        this.histogramRefreshMillis = histogramRefreshMillis;
        this.workers = Executors.newFixedThreadPool(
                Math.max(2, Runtime.getRuntime().availableProcessors()), namedDaemon("mempool-worker"));
    }

    /** Starts the refresh, histogram and status logging tasks. */
    public synchronized void keepSynchronized() {
        if (scheduler != null) {
            return;
        }
        LOG.info("beginning processing of daemon mempool.  This can take some time...");
        long start = System.nanoTime();
        synced.thenRun(() -> LOG.info(() -> String.format("synced in %.2fs", (System.nanoTime() - start) / 1e9)));
        scheduler = Executors.newScheduledThreadPool(3, namedDaemon("mempool"));
        scheduler.scheduleWithFixedDelay(this::refreshSafely, 0, refreshMillis, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::refreshHistogramSafely, 0, histogramRefreshMillis, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::logStatus, LOG_STATUS_MILLIS, LOG_STATUS_MILLIS, TimeUnit.MILLISECONDS);
    }

    /** Refreshes now rather than at the next scheduled time, e.g. after a broadcast. */
    public synchronized void wakeup() {
        if (scheduler != null) {
            scheduler.execute(this::refreshSafely);
        }
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        workers.shutdownNow();
    }

    private void refreshSafely() {
        try {
            synchronize();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "mempool refresh failed", e);
        }
    }

    private void refreshHistogramSafely() {
        if (!synced.isDone()) {
            return;
        }
        try {
            refreshHistogram();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "fee histogram refresh failed", e);
        }
    }

    private void logStatus() {
        int txCount;
        int hashXCount;
        stateLock.readLock().lock();
        try {
            txCount = txs.size();
            hashXCount = hashXs.size();
        } finally {
            stateLock.readLock().unlock();
        }
        LOG.info(() -> String.format("%,d txs touching %,d addresses", txCount, hashXCount));
    }

    /**
     * One refresh cycle: reads the daemon's mempool at a stable height, drops transactions
     * that left it, adds the new ones and reports what was touched.
     */
    public void synchronize() {
        int height;
        List<String> hexHashes;
        while (true) {
            height = api.cachedHeight();
            hexHashes = api.mempoolHashes();
            if (height == api.height()) {
                break;
            }
        }
        Set<Hash> hashes = new HashSet<>(hexHashes.size());
        for (String hex : hexHashes) {
            hashes.add(Hash.fromHex(hex));
        }
        Set<HashX> touched;
        refreshLock.lock();
        try {
            touched = processMempool(hashes);
        } finally {
            refreshLock.unlock();
        }
        synced.complete(null);
        IndexMetrics.setMempoolSize(size());
        api.onMempool(touched, height);
    }

    private Set<HashX> processMempool(Set<Hash> allHashes) {
        Set<HashX> touched = new HashSet<>();
        List<Hash> newHashes = new ArrayList<>();
        stateLock.writeLock().lock();
        try {
            List<Hash> gone = new ArrayList<>();
            for (Hash hash : txs.keySet()) {
                if (!allHashes.contains(hash)) gone.add(hash);
            }
            for (Hash hash : gone) {
                MemPoolTx tx = txs.remove(hash);
                for (HashX hashX : hashXsOf(tx)) {
                    Set<Hash> owners = hashXs.get(hashX);
                    owners.remove(hash);
                    if (owners.isEmpty()) hashXs.remove(hashX);
                    touched.add(hashX);
                }
            }
            for (Hash hash : allHashes) {
                if (!txs.containsKey(hash)) newHashes.add(hash);
            }
        } finally {
            stateLock.writeLock().unlock();
        }
        if (newHashes.isEmpty()) {
            return touched;
        }

        List<CompletableFuture<Fetched>> fetches = new ArrayList<>();
        for (int i = 0; i < newHashes.size(); i += FETCH_CHUNK) {
            List<Hash> chunk = newHashes.subList(i, Math.min(i + FETCH_CHUNK, newHashes.size()));
            fetches.add(CompletableFuture.supplyAsync(() -> fetch(chunk, allHashes), workers));
        }
        Map<Hash, MemPoolTx> pending = new LinkedHashMap<>();
        Map<Prevout, HashXValue> utxos = new HashMap<>();
        for (CompletableFuture<Fetched> fetch : fetches) {
            Fetched fetched = fetch.join();
            pending.putAll(fetched.txs());
            utxos.putAll(fetched.utxos());
        }

        stateLock.writeLock().lock();
        try {
            int accepted = acceptTransactions(pending, utxos, touched);
            int dropped = pending.size() - accepted;
            if (dropped > 0) {
                LOG.info(() -> dropped + " txs dropped");
            }
        } finally {
            stateLock.writeLock().unlock();
        }
        return touched;
    }

    private record Fetched(Map<Hash, MemPoolTx> txs, Map<Prevout, HashXValue> utxos) {}

    private Fetched fetch(List<Hash> hashes, Set<Hash> allHashes) {
        List<String> hexHashes = new ArrayList<>(hashes.size());
        for (Hash hash : hashes) hexHashes.add(hash.hex());
        List<byte[]> rawTxs = api.rawTransactions(hexHashes);

        Map<Hash, MemPoolTx> fetched = new LinkedHashMap<>();
        for (int i = 0; i < hashes.size(); i++) {
            byte[] raw = rawTxs.get(i);
            // evicted, or mined since the hash list was read
            if (raw == null) {
                continue;
            }
            TxWithHash decoded = codec.deserializer(raw).readTx();
            List<Prevout> prevouts = new ArrayList<>();
            for (TxInput in : decoded.tx().inputs()) {
                if (!in.isGeneration()) prevouts.add(in.prevout());
            }
            List<HashXValue> outPairs = new ArrayList<>();
            for (TxOutput out : decoded.tx().outputs()) {
                outPairs.add(new HashXValue(codec.hashXFromScript(out.pkScript()), out.value()));
            }
            fetched.put(hashes.get(i), new MemPoolTx(prevouts, List.of(), outPairs, 0, decoded.vsize()));
        }

        List<Prevout> external = new ArrayList<>();
        for (MemPoolTx tx : fetched.values()) {
            for (Prevout prevout : tx.prevouts()) {
                if (!allHashes.contains(prevout.txHash())) external.add(prevout);
            }
        }
        List<HashXValue> found = external.isEmpty() ? List.of() : api.lookupUtxos(external);
        Map<Prevout, HashXValue> utxos = new HashMap<>();
        for (int i = 0; i < external.size(); i++) {
            if (found.get(i) != null) utxos.put(external.get(i), found.get(i));
        }
        return new Fetched(fetched, utxos);
    }

    /**
     * Accepts pending transactions parents first. A transaction waits on each parent still
     * pending; one whose inputs cannot all be resolved is left out.
     *
     * @return how many were accepted
     */
    int acceptTransactions(Map<Hash, MemPoolTx> pending, Map<Prevout, HashXValue> utxos, Set<HashX> touched) {
        Map<Hash, List<Hash>> waiting = new HashMap<>();
        Map<Hash, Integer> missing = new HashMap<>();
        Deque<Hash> ready = new ArrayDeque<>();
        for (Map.Entry<Hash, MemPoolTx> e : pending.entrySet()) {
            Set<Hash> parents = new HashSet<>();
            boolean resolvable = true;
            for (Prevout prevout : e.getValue().prevouts()) {
                if (utxos.containsKey(prevout) || txs.containsKey(prevout.txHash())) {
                    continue;
                }
                if (pending.containsKey(prevout.txHash()) && !prevout.txHash().equals(e.getKey())) {
                    parents.add(prevout.txHash());
                } else {
                    resolvable = false;
                    break;
                }
            }
            if (!resolvable) {
                continue;
            }
            if (parents.isEmpty()) {
                ready.add(e.getKey());
            } else {
                missing.put(e.getKey(), parents.size());
                for (Hash parent : parents) {
                    waiting.computeIfAbsent(parent, k -> new ArrayList<>()).add(e.getKey());
                }
            }
        }

        int accepted = 0;
        while (!ready.isEmpty()) {
            Hash hash = ready.poll();
            MemPoolTx tx = pending.get(hash);
            List<HashXValue> inPairs = resolveInputs(tx, utxos);
            if (inPairs == null) {
                continue;
            }
            tx = tx.accept(inPairs);
            txs.put(hash, tx);
            for (HashX hashX : hashXsOf(tx)) {
                touched.add(hashX);
                hashXs.computeIfAbsent(hashX, k -> new HashSet<>()).add(hash);
            }
            accepted++;
            for (Hash child : waiting.getOrDefault(hash, List.of())) {
                if (missing.merge(child, -1, Integer::sum) == 0) {
                    ready.add(child);
                }
            }
        }
        return accepted;
    }

    private List<HashXValue> resolveInputs(MemPoolTx tx, Map<Prevout, HashXValue> utxos) {
        List<HashXValue> inPairs = new ArrayList<>(tx.prevouts().size());
        for (Prevout prevout : tx.prevouts()) {
            HashXValue utxo = utxos.get(prevout);
            if (utxo == null) {
                MemPoolTx parent = txs.get(prevout.txHash());
                if (parent == null || prevout.index() >= parent.outPairs().size()) {
                    return null;
                }
                utxo = parent.outPairs().get(prevout.index());
            }
            inPairs.add(utxo);
        }
        return inPairs;
    }

    private static Set<HashX> hashXsOf(MemPoolTx tx) {
        Set<HashX> out = new HashSet<>();
        for (HashXValue pair : tx.inPairs()) {
            if (pair.hashX() != null) out.add(pair.hashX());
        }
        for (HashXValue pair : tx.outPairs()) {
            if (pair.hashX() != null) out.add(pair.hashX());
        }
        return out;
    }

    void refreshHistogram() {
        refreshLock.lock();
        try {
            List<MemPoolTx> snapshot;
            stateLock.readLock().lock();
            try {
                snapshot = new ArrayList<>(txs.values());
            } finally {
                stateLock.readLock().unlock();
            }
            histogram = List.copyOf(FeeHistogram.compact(snapshot));
            LOG.fine(() -> "compact fee histogram: " + histogram);
        } finally {
            refreshLock.unlock();
        }
    }

    // ---------------- queries ----------------

    /** Net unconfirmed change to the balance of {@code hashX}; may be negative. */
    public long balanceDelta(HashX hashX) {
        stateLock.readLock().lock();
        try {
            long value = 0;
            for (Hash hash : hashXs.getOrDefault(hashX, Set.of())) {
                MemPoolTx tx = txs.get(hash);
                for (HashXValue pair : tx.inPairs()) {
                    if (hashX.equals(pair.hashX())) value -= pair.value();
                }
                for (HashXValue pair : tx.outPairs()) {
                    if (hashX.equals(pair.hashX())) value += pair.value();
                }
            }
            return value;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /** The histogram from the last refresh. */
    public List<FeeHistogram.Bin> compactFeeHistogram() {
        return histogram;
    }

    /**
     * Prevouts spent by mempool transactions touching {@code hashX}. Not all need be spends
     * of {@code hashX}, but every mempool spend of it is included.
     */
    public Set<Prevout> potentialSpends(HashX hashX) {
        stateLock.readLock().lock();
        try {
            Set<Prevout> result = new HashSet<>();
            for (Hash hash : hashXs.getOrDefault(hashX, Set.of())) {
                result.addAll(txs.get(hash).prevouts());
            }
            return result;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public List<MemPoolTxSummary> transactionSummaries(HashX hashX) {
        stateLock.readLock().lock();
        try {
            List<MemPoolTxSummary> result = new ArrayList<>();
            for (Hash hash : hashXs.getOrDefault(hashX, Set.of())) {
                MemPoolTx tx = txs.get(hash);
                boolean unconfirmedInputs = false;
                for (Prevout prevout : tx.prevouts()) {
                    if (txs.containsKey(prevout.txHash())) {
                        unconfirmedInputs = true;
                        break;
                    }
                }
                result.add(new MemPoolTxSummary(hash, tx.fee(), unconfirmedInputs));
            }
            return result;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /** Outputs paying {@code hashX}, whether or not another mempool transaction spends them. */
    public List<Utxo> unorderedUtxos(HashX hashX) {
        stateLock.readLock().lock();
        try {
            List<Utxo> utxos = new ArrayList<>();
            for (Hash hash : hashXs.getOrDefault(hashX, Set.of())) {
                List<HashXValue> outs = txs.get(hash).outPairs();
                for (int pos = 0; pos < outs.size(); pos++) {
                    if (hashX.equals(outs.get(pos).hashX())) {
                        utxos.add(new Utxo(-1, pos, hash, 0, outs.get(pos).value()));
                    }
                }
            }
            return utxos;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public int size() {
        stateLock.readLock().lock();
        try {
            return txs.size();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    MemPoolTx transaction(Hash hash) {
        stateLock.readLock().lock();
        try {
            return txs.get(hash);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /** Completes after the first refresh. */
    public CompletableFuture<Void> synced() {
        return synced;
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
