package io.chainindex.core.node;

import io.chainindex.core.codec.ChainCodec;
import io.chainindex.core.codec.CoinSpec;
import io.chainindex.core.daemon.ChainSource;
import io.chainindex.core.metrics.IndexMetrics;
import io.chainindex.core.protocol.Block;
import io.chainindex.core.protocol.Hash;
import io.chainindex.core.protocol.HashX;
import io.chainindex.core.protocol.Prevout;
import io.chainindex.core.protocol.TxInput;
import io.chainindex.core.protocol.TxOutput;
import io.chainindex.core.protocol.TxWithHash;
import io.chainindex.core.storage.ChainDb;
import io.chainindex.core.storage.FlushData;
import io.chainindex.core.storage.StoredUtxo;
import io.chainindex.core.storage.UndoInfo;
import io.chainindex.core.storage.UtxoEntry;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Follows the daemon's chain: applies prefetched blocks to the UTXO cache and history,
 * unwinds blocks on reorgs, and decides when to flush to disk.
 *
 * <p>All mutable chain state is touched only with {@link #stateLock} held. Processing runs on
 * a dedicated thread started by {@link #start()}.
 */
public final class BlockProcessor {
    private static final Logger LOG = Logger.getLogger(BlockProcessor.class.getName());

    static final int REORG_CHUNK = 50;
    static final long CACHE_CHECK_INTERVAL_MILLIS = 30_000;
    private static final long ONE_MB = 1_000_000;

    private final ChainDb db;
    private final ChainSource daemon;
    private final ChainCodec codec;
    private final Notifications notifications;
    private final Event blocksEvent = new Event();
    private final Prefetcher prefetcher;
    private final ReentrantLock stateLock = new ReentrantLock();
    private final AtomicInteger reorgCount = new AtomicInteger();
    private final CompletableFuture<Integer> caughtUp = new CompletableFuture<>();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private volatile int height = -1;
    private Hash tip;
    private long txCount;
    private final List<byte[]> headers = new ArrayList<>();
    private final List<byte[]> txHashes = new ArrayList<>();
    private final List<UndoInfo> undoInfos = new ArrayList<>();
    private final Map<Prevout, UtxoEntry> utxoCache = new HashMap<>();
    private final List<byte[]> dbDeletes = new ArrayList<>();
    private Set<HashX> touched = new HashSet<>();
    private long nextCacheCheck;

    private volatile boolean running;
    private Thread processorThread;
    private Thread prefetchThread;

    public BlockProcessor(ChainDb db, ChainSource daemon, Notifications notifications, long pollingDelayMillis) {
        this.db = db;
        this.daemon = daemon;
        this.codec = db.codec();
        this.notifications = notifications;
        this.prefetcher = new Prefetcher(daemon, codec, blocksEvent, pollingDelayMillis);
    }

    /** Opens the databases for sync and adopts their state. */
    public void openDbs() {
        db.openForSync();
        stateLock.lock();
        try {
            height = db.dbHeight();
            tip = db.dbTip();
            txCount = db.dbTxCount();
        } finally {
            stateLock.unlock();
        }
        IndexMetrics.setHeight(height);
    }

    /** Starts prefetching and processing; {@link #openDbs()} must have been called. */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        prefetcher.resetHeight(height);
        prefetchThread = new Thread(prefetcher::mainLoop, "prefetcher");
        prefetchThread.setDaemon(true);
        prefetchThread.start();
        processorThread = new Thread(this::processLoop, "block-processor");
        processorThread.start();
    }

    /** Stops both threads and flushes everything for a clean shutdown. */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        prefetchThread.interrupt();
        // not interrupted: an interrupt would close the file channels mid-write
        blocksEvent.set();
        try {
            processorThread.join();
            prefetchThread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!terminated.isCompletedExceptionally()) {
            LOG.info("flushing to DB for a clean shutdown...");
            flush(true);
        }
        terminated.complete(null);
    }

    private void processLoop() {
        try {
            while (running) {
                int daemonHeight = daemon.cachedHeight();
                if (daemonHeight >= 0 && height == daemonHeight && !caughtUp.isDone()) {
                    firstCaughtUp();
                    caughtUp.complete(height);
                }
                if (!blocksEvent.await(1000)) {
                    continue;
                }
                blocksEvent.clear();
                if (!running) {
                    break;
                }
                int count = reorgCount.getAndSet(0);
                if (count > 0) {
                    reorgChain(count);
                } else {
                    checkAndAdvanceBlocks(prefetcher.takeBlocks());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "block processing failed", e);
            running = false;
            prefetchThread.interrupt();
            caughtUp.completeExceptionally(e);
            terminated.completeExceptionally(e);
        }
    }

    private void firstCaughtUp() {
        LOG.info(() -> "caught up to height " + height);
        boolean firstSync = db.firstSync();
        db.setFirstSync(false);
        flush(true);
        if (firstSync) {
            LOG.info(() -> String.format("synced to height %,d", height));
        }
        withStateLock(() -> {
            db.openForServing();
            return null;
        });
    }

    /** Advances if {@code rawBlocks} extend our tip; otherwise handles a reorg. */
    void checkAndAdvanceBlocks(List<byte[]> rawBlocks) {
        if (rawBlocks.isEmpty()) {
            return;
        }
        int first = height + 1;
        List<Block> blocks = new ArrayList<>(rawBlocks.size());
        for (int n = 0; n < rawBlocks.size(); n++) {
            blocks.add(codec.block(rawBlocks.get(n), first + n));
        }
        byte[] expectedPrev = tip.bytes();
        int mismatch = -1;
        for (int n = 0; n < blocks.size(); n++) {
            byte[] header = blocks.get(n).header();
            if (!Arrays.equals(codec.headerPrevHash(header), expectedPrev)) {
                mismatch = n;
                break;
            }
            expectedPrev = codec.headerHash(header);
        }

        if (mismatch < 0) {
            long start = System.nanoTime();
            IndexMetrics.recordBlocks(blocks.size(), () -> withStateLock(() -> {
                advanceBlocks(blocks);
                return null;
            }));
            maybeFlush();
            if (!db.firstSync()) {
                long size = 0;
                for (byte[] raw : rawBlocks) size += raw.length;
                double mb = size / 1e6;
                double elapsed = (System.nanoTime() - start) / 1e9;
                LOG.info(() -> String.format("processed %,d block%s size %.2f MB in %.2fs",
                        blocks.size(), blocks.size() == 1 ? "" : "s", mb, elapsed));
            }
            if (caughtUp.isDone()) {
                notifications.onBlock(Collections.unmodifiableSet(touched), height);
            }
            touched = new HashSet<>();
        } else if (mismatch == 0) {
            reorgChain(null);
        } else {
            LOG.warning("daemon blocks do not form a chain; resetting the prefetcher");
            prefetcher.resetHeight(height);
        }
    }

    private void advanceBlocks(List<Block> blocks) {
        int minHeight = db.minUndoHeight(daemon.cachedHeight());
        int h = height;
        for (Block block : blocks) {
            h++;
            List<UtxoEntry> undo = advanceTxs(block.transactions());
            if (h >= minHeight) {
                undoInfos.add(new UndoInfo(h, undo));
                db.writeRawBlock(block.raw(), h);
            }
            headers.add(block.header());
        }
        height = h;
        tip = new Hash(codec.headerHash(blocks.get(blocks.size() - 1).header()));
        IndexMetrics.setHeight(h);
    }

    private List<UtxoEntry> advanceTxs(List<TxWithHash> txs) {
        List<UtxoEntry> undo = new ArrayList<>();
        List<List<HashX>> hashXsByTx = new ArrayList<>(txs.size());
        ByteArrayOutputStream blockHashes = new ByteArrayOutputStream(txs.size() * Hash.LENGTH);
        long txNum = txCount;
        for (TxWithHash item : txs) {
            List<HashX> hashXs = new ArrayList<>();
            for (TxInput in : item.tx().inputs()) {
                if (in.isGeneration()) {
                    continue;
                }
                UtxoEntry spent = spendUtxo(in.prevout());
                undo.add(spent);
                hashXs.add(spent.hashX());
            }
            List<TxOutput> outputs = item.tx().outputs();
            for (int idx = 0; idx < outputs.size(); idx++) {
                HashX hashX = codec.hashXFromScript(outputs.get(idx).pkScript());
                if (hashX == null) {
                    continue;
                }
                hashXs.add(hashX);
                utxoCache.put(new Prevout(item.hash(), idx), new UtxoEntry(hashX, txNum, outputs.get(idx).value()));
            }
            hashXsByTx.add(hashXs);
            touched.addAll(hashXs);
            blockHashes.writeBytes(item.hash().bytes());
            txNum++;
        }
        db.history().addUnflushed(hashXsByTx, txCount);
        txHashes.add(blockHashes.toByteArray());
        txCount = txNum;
        db.txCounts().append(txNum);
        return undo;
    }

    /**
     * Removes an output from the cache, or marks its database keys for deletion.
     *
     * @throws ChainException if the output is not unspent
     */
    private UtxoEntry spendUtxo(Prevout prevout) {
        UtxoEntry cached = utxoCache.remove(prevout);
        if (cached != null) {
            return cached;
        }
        StoredUtxo stored = db.findStoredUtxo(prevout, false);
        if (stored == null) {
            throw new ChainException("UTXO " + prevout.txHash().hex() + " / " + prevout.index() + " not found");
        }
        dbDeletes.add(stored.hKey());
        dbDeletes.add(stored.uKey());
        return stored.entry();
    }

    // ---------------- reorgs ----------------

    /**
     * Unwinds blocks back to the fork point, or {@code count} blocks if given, then restarts
     * the prefetcher from the new height.
     */
    void reorgChain(Integer count) {
        if (count == null) {
            LOG.info("chain reorg detected");
        } else {
            LOG.info(() -> String.format("faking a reorg of %,d blocks", count));
        }
        flush(true);
        IndexMetrics.incrementReorgs();

        int[] range = calcReorgRange(count);
        int start = range[0];
        int n = range[1];
        if (n < 1) {
            LOG.warning(() -> "nothing to unwind at height " + height);
            return;
        }
        LOG.info(() -> String.format("chain was reorganised replacing %,d block%s at heights %,d-%,d",
                n, n == 1 ? "" : "s", start, start + n - 1));
        int last = start + n - 1;
        List<String> hexHashes = new ArrayList<>(n);
        List<byte[]> hashes = db.fsBlockHashes(start, n);
        for (int i = hashes.size() - 1; i >= 0; i--) {
            hexHashes.add(new Hash(hashes.get(i)).hex());
        }
        for (int from = 0; from < hexHashes.size(); from += REORG_CHUNK) {
            List<String> chunk = hexHashes.subList(from, Math.min(from + REORG_CHUNK, hexHashes.size()));
            List<byte[]> rawBlocks = rawBlocksForBackup(last, chunk);
            withStateLock(() -> {
                backupBlocks(rawBlocks);
                db.flushBackup(flushData(), touched);
                return null;
            });
            last -= rawBlocks.size();
        }
        IndexMetrics.setHeight(height);
        prefetcher.resetHeight(height);
    }

    private List<byte[]> rawBlocksForBackup(int lastHeight, List<String> hexHashes) {
        List<byte[]> blocks = new ArrayList<>(hexHashes.size());
        for (int h = lastHeight; h > lastHeight - hexHashes.size(); h--) {
            Optional<byte[]> raw = db.readRawBlock(h);
            if (raw.isEmpty()) {
                return daemon.rawBlocks(hexHashes);
            }
            blocks.add(raw.get());
        }
        LOG.info(() -> "read " + blocks.size() + " blocks from disk");
        return blocks;
    }

    /**
     * Start height and count of the blocks to unwind. Without {@code count}, searches
     * backwards in doubling steps for the first height where our hashes and the daemon's
     * differ.
     */
    int[] calcReorgRange(Integer count) {
        if (count != null) {
            int n = Math.min(count, maxReorgDepth());
            return new int[] {height - n + 1, n};
        }
        int start = height - 1;
        int n = 1;
        while (start > 0) {
            List<byte[]> ours = db.fsBlockHashes(start, n);
            List<String> theirs = daemon.blockHexHashes(start, n);
            int diff = diffPos(ours, theirs);
            if (diff > 0) {
                start += diff;
                break;
            }
            n = Math.min(n * 2, start);
            start -= n;
        }
        // the genesis block is fixed by the coin
        start = Math.max(start, 1);
        return new int[] {start, height - start + 1};
    }

    /** Blocks that can be unwound: never the genesis block, and only those with undo data. */
    int maxReorgDepth() {
        int h = height;
        return Math.max(0, Math.min(h, h - db.minUndoHeight(h) + 1));
    }

    private static int diffPos(List<byte[]> ours, List<String> theirs) {
        int len = Math.min(ours.size(), theirs.size());
        for (int i = 0; i < len; i++) {
            if (!new Hash(ours.get(i)).hex().equals(theirs.get(i))) {
                return i;
            }
        }
        return len;
    }

    private void backupBlocks(List<byte[]> rawBlocks) {
        db.assertFlushed(flushData());
        if (height < rawBlocks.size()) {
            throw new ChainException("cannot back up " + rawBlocks.size() + " blocks from height " + height);
        }
        for (byte[] raw : rawBlocks) {
            Block block = codec.block(raw, height);
            Hash headerHash = new Hash(codec.headerHash(block.header()));
            if (!headerHash.equals(tip)) {
                throw new ChainException("backup block " + headerHash.hex() + " not tip " + tip.hex()
                        + " at height " + height);
            }
            tip = new Hash(codec.headerPrevHash(block.header()));
            backupTxs(block.transactions());
            height--;
            db.txCounts().pop();
        }
        LOG.info(() -> String.format("backed up to height %,d", height));
    }

    private void backupTxs(List<TxWithHash> txs) {
        UndoInfo undo = db.readUndoInfo(height);
        if (undo == null) {
            throw new ChainException("no undo information found for height " + height);
        }
        List<UtxoEntry> spent = undo.spent();
        int n = spent.size();
        for (int t = txs.size() - 1; t >= 0; t--) {
            TxWithHash item = txs.get(t);
            List<TxOutput> outputs = item.tx().outputs();
            for (int idx = 0; idx < outputs.size(); idx++) {
                if (codec.hashXFromScript(outputs.get(idx).pkScript()) == null) {
                    continue;
                }
                touched.add(spendUtxo(new Prevout(item.hash(), idx)).hashX());
            }
            List<TxInput> inputs = item.tx().inputs();
            for (int i = inputs.size() - 1; i >= 0; i--) {
                TxInput in = inputs.get(i);
                if (in.isGeneration()) {
                    continue;
                }
                UtxoEntry restored = spent.get(--n);
                utxoCache.put(in.prevout(), restored);
                touched.add(restored.hashX());
            }
        }
        if (n != 0) {
            throw new ChainException("undo information for height " + height + " has "
                    + n + " unused entries");
        }
        txCount -= txs.size();
    }

    /**
     * Queues a reorg of {@code count} blocks; refused until caught up.
     *
     * @throws IllegalArgumentException if {@code count} is not positive or reaches past the
     *         blocks that can be unwound
     */
    public boolean forceReorg(int count) {
        if (!caughtUp.isDone()) {
            return false;
        }
        int limit = maxReorgDepth();
        if (count < 1 || count > limit) {
            throw new IllegalArgumentException("reorg count must be between 1 and " + limit + ", got " + count);
        }
        reorgCount.set(count);
        blocksEvent.set();
        return true;
    }

    // ---------------- flushing ----------------

    FlushData flushData() {
        return new FlushData(height, txCount, headers, txHashes, undoInfos, utxoCache, dbDeletes, tip);
    }

    void flush(boolean flushUtxos) {
        IndexMetrics.recordFlush(() -> withStateLock(() -> {
            db.flushDbs(flushData(), flushUtxos, this::estimateTxsRemaining);
            return null;
        }));
    }

    private void maybeFlush() {
        // once caught up, queries read the database, so keep it current
        if (caughtUp.isDone()) {
            flush(true);
        } else if (System.currentTimeMillis() > nextCacheCheck) {
            Boolean flushUtxos = checkCacheSize();
            if (flushUtxos != null) {
                flush(flushUtxos);
            }
            nextCacheCheck = System.currentTimeMillis() + CACHE_CHECK_INTERVAL_MILLIS;
        }
    }

    /**
     * Estimates memory held by unflushed state.
     *
     * @return null if no flush is needed, else whether the UTXO cache should be flushed too
     */
    Boolean checkCacheSize() {
        long utxoCacheSize = (long) utxoCache.size() * 205;
        long dbDeletesSize = (long) dbDeletes.size() * 57;
        long histCacheSize = db.history().unflushedMemsize();
        long txHashSize = (txCount - db.fsTxCount()) * 32 + (long) (height - db.fsHeight()) * 42;
        long utxoMb = (dbDeletesSize + utxoCacheSize) / ONE_MB;
        long histMb = (histCacheSize + txHashSize) / ONE_MB;
        LOG.info(() -> String.format("our height: %,d daemon: %,d UTXOs %,dMB hist %,dMB",
                height, daemon.cachedHeight(), utxoMb, histMb));
        int cacheMb = db.config().cacheMb();
        if (utxoMb + histMb >= cacheMb || histMb >= cacheMb / 5) {
            return utxoMb >= cacheMb * 4L / 5;
        }
        return null;
    }

    /** Rough count of transactions still to sync, used for the ETA in flush logs. */
    long estimateTxsRemaining() {
        CoinSpec coin = codec.coin();
        int txCountHeight = Math.max(1, coin.txCountHeight());
        long tailCount = daemon.cachedHeight() - Math.max(height, coin.txCountHeight());
        double realism = Math.max(2.0 - 0.9 * height / txCountHeight, 1.0);
        return (long) ((tailCount * coin.txPerBlock() + Math.max(coin.txCount() - txCount, 0)) * realism);
    }

    // ---------------- accessors ----------------

    /** Runs {@code action} while no block is being applied or flushed. */
    public <T> T withStateLock(Supplier<T> action) {
        stateLock.lock();
        try {
            return action.get();
        } finally {
            stateLock.unlock();
        }
    }

    public int height() {
        return height;
    }

    public Hash tip() {
        return withStateLock(() -> tip);
    }

    public long txCount() {
        return withStateLock(() -> txCount);
    }

    /** Completes with the height once the processor first catches up with the daemon. */
    public CompletableFuture<Integer> caughtUp() {
        return caughtUp;
    }

    /** Completes when processing stops, exceptionally if it failed. */
    public CompletableFuture<Void> terminated() {
        return terminated;
    }

    public ChainDb db() {
        return db;
    }

    Prefetcher prefetcher() {
        return prefetcher;
    }

    Set<HashX> touched() {
        return touched;
    }
}
