package io.chainindex.core.node;

import io.chainindex.core.IndexerConfig;
import io.chainindex.core.codec.ChainCodec;
import io.chainindex.core.codec.StandardCodec;
import io.chainindex.core.daemon.ChainSource;
import io.chainindex.core.daemon.DaemonClient;
import io.chainindex.core.mempool.MemPool;
import io.chainindex.core.mempool.MemPoolApi;
import io.chainindex.core.protocol.HashX;
import io.chainindex.core.protocol.Prevout;
import io.chainindex.core.query.QueryFacade;
import io.chainindex.core.storage.ChainDb;
import io.chainindex.core.storage.HashXValue;
import io.chainindex.core.storage.History;
import io.chainindex.core.storage.InMemoryKeyValueStore;
import io.chainindex.core.storage.KeyValueStore;
import io.chainindex.core.storage.RocksDBKeyValueStore;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the chain database, block processor, mempool, notifications and query facade.
 * Call {@link #start()} once; the mempool starts after the first catch-up.
 */
public final class Indexer implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Indexer.class.getName());

    static final long COMPACTION_LIMIT_BYTES = 8_000_000;
    static final long PREFETCH_POLL_MILLIS = 5_000;

    private final IndexerConfig config;
    private final ChainSource daemon;
    private final ChainDb db;
    private final Notifications notifications = new Notifications();
    private final BlockProcessor processor;
    private final MemPool mempool;
    private final QueryFacade query;
    private final CompletableFuture<Integer> serving = new CompletableFuture<>();

    public Indexer(IndexerConfig config, ChainCodec codec, ChainSource daemon, KeyValueStore.Factory stores,
                   long pollingDelayMillis) {
        this.config = config;
        this.daemon = daemon;
        this.db = new ChainDb(config, codec, stores);
        this.processor = new BlockProcessor(db, daemon, notifications, pollingDelayMillis);
        this.mempool = new MemPool(codec, new MemPoolBridge(), config.mempoolRefreshMillis(),
                config.histogramRefreshMillis());
        this.query = new QueryFacade(db, mempool, daemon, config.historyCacheSize(), config.maxHistory());
    }

    /** An indexer following the configured daemons, with RocksDB stores under the data directory. */
    public static Indexer rocks(IndexerConfig config) {
        return new Indexer(config, new StandardCodec(config.coin()), new DaemonClient(config.daemonUrls()),
                RocksDBKeyValueStore.factory(config.dataDir()), PREFETCH_POLL_MILLIS);
    }

    /** An indexer over in-memory stores; headers and hashes still go to the data directory. */
    public static Indexer inMemory(IndexerConfig config, ChainSource daemon, long pollingDelayMillis) {
        return new Indexer(config, new StandardCodec(config.coin()), daemon,
                InMemoryKeyValueStore.factory(), pollingDelayMillis);
    }

    /** Opens the databases and starts following the daemon. */
    public void start() {
        processor.openDbs();
        processor.caughtUp().thenAccept(this::startServing).exceptionally(e -> {
            LOG.log(Level.SEVERE, "indexer failed before serving", e);
            serving.completeExceptionally(e);
            return null;
        });
        processor.start();
    }

    private void startServing(int height) {
        db.populateHeaderMerkleCache();
        notifications.start(height, query::invalidate);
        mempool.keepSynchronized();
        LOG.info(() -> String.format("serving from height %,d", height));
        serving.complete(height);
    }

    /**
     * Rewrites the history database into full rows. Runs to completion on the calling
     * thread; the indexer must not be started.
     */
    public void compactHistory() {
        db.openForCompacting();
        try {
            if (db.firstSync()) {
                throw new IllegalStateException("cannot compact history before the initial sync completes");
            }
            History history = db.history();
            history.beginCompaction();
            while (history.compCursor() != -1) {
                history.compact(COMPACTION_LIMIT_BYTES);
            }
            db.setFlushCount(history.flushCount());
            LOG.info(() -> "history compaction complete, flush count " + history.flushCount());
        } finally {
            db.close();
        }
    }

    /** Completes with the height at which the mempool and queries came online. */
    public CompletableFuture<Integer> serving() {
        return serving;
    }

    /** Completes when block processing stops, exceptionally if it failed. */
    public CompletableFuture<Void> terminated() {
        return processor.terminated();
    }

    /**
     * Queues a reorg of {@code count} blocks; false until caught up.
     *
     * @throws IllegalArgumentException if {@code count} is outside 1 to the reorg depth limit
     */
    public boolean forceReorg(int count) {
        return processor.forceReorg(count);
    }

    @Override
    public void close() {
        mempool.stop();
        processor.stop();
        db.close();
    }

    public IndexerConfig config() { return config; }
    public ChainDb db() { return db; }
    public BlockProcessor processor() { return processor; }
    public MemPool mempool() { return mempool; }
    public QueryFacade query() { return query; }
    public ChainSource daemon() { return daemon; }

    private final class MemPoolBridge implements MemPoolApi {
        @Override
        public int height() {
            return daemon.height();
        }

        @Override
        public int cachedHeight() {
            return daemon.cachedHeight();
        }

        @Override
        public List<String> mempoolHashes() {
            return daemon.mempoolHashes();
        }

        @Override
        public List<byte[]> rawTransactions(List<String> hexHashes) {
            return daemon.rawTransactions(hexHashes, true);
        }

        @Override
        public List<HashXValue> lookupUtxos(List<Prevout> prevouts) {
            return processor.withStateLock(() -> db.lookupUtxos(prevouts));
        }

        @Override
        public void onMempool(Set<HashX> touched, int height) {
            notifications.onMempool(touched, height);
        }
    }
}
