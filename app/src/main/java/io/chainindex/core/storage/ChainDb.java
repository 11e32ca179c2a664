package io.chainindex.core.storage;

import io.chainindex.core.IndexerConfig;
import io.chainindex.core.codec.ChainCodec;
import io.chainindex.core.protocol.Hash;
import io.chainindex.core.protocol.HashX;
import io.chainindex.core.protocol.Merkle;
import io.chainindex.core.protocol.MerkleCache;
import io.chainindex.core.protocol.Prevout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Owns everything persisted by the indexer: the UTXO database, the history database and the
 * append-only files under {@code meta/}.
 *
 * <p>A single writer (the block processor) flushes and backs up; readers may run concurrently
 * and only observe state that has been committed. Readers that race a backup and find a tx
 * number without a hash retry after a short pause.
 */
public final class ChainDb implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ChainDb.class.getName());

    static final byte[] STATE_KEY = "state".getBytes(StandardCharsets.US_ASCII);
    static final byte PREFIX_UTXO = 'u';
    static final byte PREFIX_HASHX_LOOKUP = 'h';
    static final byte PREFIX_UNDO = 'U';
    static final long RETRY_MILLIS = 250;

    private final IndexerConfig config;
    private final ChainCodec codec;
    private final KeyValueStore.Factory stores;
    private final Path metaDir;
    private final Hash genesisHash;
    private final History history = new History();
    private final MerkleCache headerMerkleCache;

    private final LogicalFile headersFile;
    private final LogicalFile txCountsFile;
    private final LogicalFile hashesFile;
    private final LogicalFile headersOffsetsFile;

    private KeyValueStore utxoDb;
    private TxCounts txCounts;

    private volatile int dbHeight = -1;
    private volatile long dbTxCount;
    private volatile Hash dbTip = Hash.ZERO;
    private int dbVersion = ChainState.CURRENT_VERSION;
    private int utxoFlushCount;
    private double wallTime;
    private volatile boolean firstSync = true;
    private int fsHeight = -1;
    private long fsTxCount;
    private long lastFlushTxCount;
    private double lastFlush = nowSeconds();

    public ChainDb(IndexerConfig config, ChainCodec codec, KeyValueStore.Factory stores) {
        this.config = config;
        this.codec = codec;
        this.stores = stores;
        this.metaDir = config.dataDir().resolve("meta");
        this.genesisHash = Hash.fromHex(codec.coin().genesisHash());
        this.headersFile = new LogicalFile(metaDir.resolve("headers"), 2, 16_000_000);
        this.txCountsFile = new LogicalFile(metaDir.resolve("txcounts"), 2, 2_000_000);
        this.hashesFile = new LogicalFile(metaDir.resolve("hashes"), 4, 16_000_000);
        this.headersOffsetsFile = codec.staticHeaders()
                ? null
                : new LogicalFile(metaDir.resolve("headers_offsets"), 2, 16_000_000);
        this.headerMerkleCache = new MerkleCache(new Merkle(), this::fsBlockHashes);
    }

    // ---------------- opening ----------------

    /** Opens for initial sync, favouring bulk writes. */
    public void openForSync() {
        openDbs(true, false);
    }

    /** Reopens with settings suited to serving clients. */
    public void openForServing() {
        if (utxoDb != null) {
            LOG.info("closing DBs to re-open for serving");
            utxoDb.close();
            history.close();
            utxoDb = null;
        }
        openDbs(false, false);
    }

    public void openForCompacting() {
        openDbs(true, true);
    }

    private void openDbs(boolean forSync, boolean compacting) {
        if (utxoDb != null) {
            throw new IllegalStateException("databases are already open");
        }
        utxoDb = stores.open("utxo", forSync);
        if (utxoDb.isNew()) {
            LOG.info("created new database");
            createMeta();
        } else {
            LOG.info(() -> "opened UTXO DB (for sync: " + forSync + ")");
        }
        readUtxoState();
        utxoFlushCount = history.open(stores, forSync, utxoFlushCount, compacting);
        clearExcessUndoInfo();
        readTxCounts();
    }

    private void createMeta() {
        try {
            Files.createDirectories(metaDir);
            Path coinFile = config.dataDir().resolve("COIN");
            if (!Files.exists(coinFile)) {
                Files.writeString(coinFile, "chain-indexer databases and metadata for "
                        + codec.coin().displayName());
            }
        } catch (IOException e) {
            throw new StorageException("creating metadata directory " + metaDir + " failed", e);
        }
        if (headersOffsetsFile != null) {
            headersOffsetsFile.write(0, new byte[8]);
        }
    }

    private void readUtxoState() {
        byte[] raw = utxoDb.get(STATE_KEY);
        ChainState state;
        if (raw == null) {
            state = ChainState.empty(genesisHash);
        } else {
            state = ChainState.decode(raw);
            if (!ChainState.DB_VERSIONS.contains(state.dbVersion())) {
                throw new DbException("your UTXO DB version is " + state.dbVersion()
                        + " but this software only handles versions " + ChainState.DB_VERSIONS);
            }
            if (!state.genesisHash().equals(genesisHash)) {
                throw new DbException("DB genesis hash " + state.genesisHash().hex()
                        + " does not match coin " + genesisHash.hex());
            }
        }
        dbVersion = state.dbVersion();
        dbHeight = state.height();
        dbTxCount = state.txCount();
        dbTip = state.tip();
        utxoFlushCount = state.utxoFlushCount();
        wallTime = state.wallTimeSecs();
        firstSync = state.firstSync();

        fsHeight = dbHeight;
        fsTxCount = dbTxCount;
        lastFlushTxCount = fsTxCount;

        LOG.info(() -> "DB version: " + dbVersion);
        LOG.info(() -> "coin: " + codec.coin().displayName());
        LOG.info(() -> "height: " + dbHeight);
        LOG.info(() -> "tip: " + dbTip.hex());
        LOG.info(() -> "tx count: " + dbTxCount);
        if (firstSync) {
            LOG.info(() -> "sync time so far: " + formattedTime(wallTime));
        }
    }

    private void readTxCounts() {
        if (txCounts != null) {
            return;
        }
        int size = (dbHeight + 1) * 4;
        byte[] data = txCountsFile.read(0, size);
        if (data.length != size) {
            throw new DbException("tx counts file has " + data.length + " bytes, expected " + size);
        }
        TxCounts counts = TxCounts.fromLe32(data);
        if (counts.last() != dbTxCount) {
            throw new DbException("tx counts end at " + counts.last() + " but DB tx count is " + dbTxCount);
        }
        txCounts = counts;
    }

    /** Deletes undo records and raw block files below the reorg window. */
    void clearExcessUndoInfo() {
        int minHeight = minUndoHeight(dbHeight);
        List<byte[]> keys = new ArrayList<>();
        utxoDb.scan(new byte[] {PREFIX_UNDO}, false, kv -> {
            if (Keys.readBe32(kv.key(), 1) >= minHeight) {
                return false;
            }
            keys.add(kv.key());
            return true;
        });
        if (!keys.isEmpty()) {
            utxoDb.write(batch -> keys.forEach(batch::delete));
            LOG.info(() -> "deleted " + keys.size() + " stale undo entries");
        }

        if (!Files.isDirectory(metaDir)) {
            return;
        }
        List<Path> stale = new ArrayList<>();
        try (DirectoryStream<Path> dir = Files.newDirectoryStream(metaDir, "block*")) {
            for (Path p : dir) {
                String suffix = p.getFileName().toString().substring("block".length());
                if (!suffix.isEmpty() && suffix.chars().allMatch(Character::isDigit)
                        && Long.parseLong(suffix) < minHeight) {
                    stale.add(p);
                }
            }
            for (Path p : stale) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new StorageException("deleting stale block files failed", e);
        }
        if (!stale.isEmpty()) {
            LOG.info(() -> "deleted " + stale.size() + " stale block files");
        }
    }

    // ---------------- flushing ----------------

    /**
     * Flushes the block processor's pending state. History is always flushed; UTXOs only if
     * {@code flushUtxos}. Order: filesystem, history, then UTXOs and state in one batch.
     */
    public void flushDbs(FlushData flushData, boolean flushUtxos, LongSupplier estimateTxsRemaining) {
        if (flushData.height() == dbHeight) {
            assertFlushed(flushData);
            return;
        }
        double start = nowSeconds();
        double priorFlush = lastFlush;
        long txDelta = flushData.txCount() - lastFlushTxCount;

        flushFs(flushData);
        history.flush();
        utxoDb.write(batch -> {
            if (flushUtxos) {
                flushUtxoDb(batch, flushData);
            }
            flushState(batch);
        });

        double elapsed = lastFlush - start;
        LOG.info(() -> String.format("flush #%,d took %.1fs.  Height %,d txs: %,d (%+,d)",
                history.flushCount(), elapsed, flushData.height(), flushData.txCount(), txDelta));

        if (utxoDb.forSync() && wallTime > 0) {
            double interval = Math.max(lastFlush - priorFlush, 1e-3);
            long perSecGen = (long) (flushData.txCount() / wallTime);
            long perSecLast = 1 + (long) (txDelta / interval);
            double eta = estimateTxsRemaining.getAsLong() / (double) perSecLast;
            LOG.info(() -> String.format("tx/sec since genesis: %,d, since last flush: %,d", perSecGen, perSecLast));
            LOG.info(() -> "sync time: " + formattedTime(wallTime) + "  ETA: " + formattedTime(eta));
        }
    }

    /** Like {@link #flushDbs} but after a backup; UTXOs and state are always written. */
    public void flushBackup(FlushData flushData, Set<HashX> touched) {
        if (!flushData.headers().isEmpty() || !flushData.blockTxHashes().isEmpty()) {
            throw new IllegalStateException("backup flush with pending headers");
        }
        if (flushData.height() >= dbHeight) {
            throw new IllegalStateException("backup flush to height " + flushData.height()
                    + " not below DB height " + dbHeight);
        }
        history.assertFlushed();
        double start = nowSeconds();
        long txDelta = flushData.txCount() - lastFlushTxCount;

        int oldHeight = dbHeight;
        backupFs(flushData.height(), flushData.txCount());
        history.backup(touched, flushData.txCount());
        utxoDb.write(batch -> {
            // undo data of unwound blocks has been consumed
            for (int h = flushData.height() + 1; h <= oldHeight; h++) {
                batch.delete(undoKey(h));
            }
            flushUtxoDb(batch, flushData);
            flushState(batch);
        });

        double elapsed = lastFlush - start;
        LOG.info(() -> String.format("backup flush #%,d took %.1fs.  Height %,d txs: %,d (%+,d)",
                history.flushCount(), elapsed, flushData.height(), flushData.txCount(), txDelta));
    }

    private void flushFs(FlushData flushData) {
        long priorTxCount = fsHeight >= 0 ? txCounts.get(fsHeight) : 0;
        List<byte[]> headers = flushData.headers();
        List<byte[]> blockTxHashes = flushData.blockTxHashes();
        if (headers.size() != blockTxHashes.size()) {
            throw new DbException("headers and tx hashes disagree: " + headers.size() + " vs " + blockTxHashes.size());
        }
        if (flushData.height() != fsHeight + headers.size()) {
            throw new DbException("flush height " + flushData.height() + " does not follow filesystem height "
                    + fsHeight + " with " + headers.size() + " headers");
        }
        if (flushData.txCount() != txCounts.last() || txCounts.size() != flushData.height() + 1) {
            throw new DbException("tx counts out of step with flush at height " + flushData.height());
        }
        byte[] hashes = concat(blockTxHashes);
        blockTxHashes.clear();
        if (hashes.length % 32 != 0 || hashes.length / 32 != flushData.txCount() - priorTxCount) {
            throw new DbException("flushing " + hashes.length / 32 + " tx hashes, expected "
                    + (flushData.txCount() - priorTxCount));
        }

        long start = System.nanoTime();
        int heightStart = fsHeight + 1;
        long offset = headerOffset(heightStart);
        headersFile.write(offset, concat(headers));
        updateHeaderOffsets(offset, heightStart, headers);
        headers.clear();

        txCountsFile.write((long) heightStart * 4, txCounts.toLe32(heightStart));
        hashesFile.write(priorTxCount * 32, hashes);

        fsHeight = flushData.height();
        fsTxCount = flushData.txCount();

        if (utxoDb.forSync()) {
            double elapsed = (System.nanoTime() - start) / 1e9;
            LOG.info(() -> String.format("flushed filesystem data in %.2fs", elapsed));
        }
    }

    private void updateHeaderOffsets(long offsetStart, int heightStart, List<byte[]> headers) {
        if (headersOffsetsFile == null) {
            return;
        }
        // each entry is the offset of the header that follows, so writing starts one height up
        byte[] offsets = new byte[headers.size() * 8];
        long offset = offsetStart;
        for (int i = 0; i < headers.size(); i++) {
            offset += headers.get(i).length;
            System.arraycopy(Keys.le64(offset), 0, offsets, i * 8, 8);
        }
        headersOffsetsFile.write((long) (heightStart + 1) * 8, offsets);
    }

    private void backupFs(int height, long txCount) {
        fsHeight = height;
        fsTxCount = txCount;
        // header count is one more than the height
        headerMerkleCache.truncate(height + 1);
    }

    /** Writes spends, then new outputs, then undo data into {@code batch}. */
    private void flushUtxoDb(KeyValueStore.Batch batch, FlushData flushData) {
        long start = System.nanoTime();
        int addCount = flushData.adds().size();
        int spendCount = flushData.deletes().size() / 2;

        Set<byte[]> deletes = new TreeSet<>(Arrays::compareUnsigned);
        deletes.addAll(flushData.deletes());
        deletes.forEach(batch::delete);
        flushData.deletes().clear();

        for (Map.Entry<Prevout, UtxoEntry> e : flushData.adds().entrySet()) {
            Prevout prevout = e.getKey();
            UtxoEntry entry = e.getValue();
            byte[] suffix = Keys.concat(Keys.le16(prevout.index()), Keys.le32(entry.txNum()));
            batch.put(hashXLookupKey(prevout.txHash(), suffix), entry.hashX().bytes());
            batch.put(Keys.concat(new byte[] {PREFIX_UTXO}, entry.hashX().bytes(), suffix), Keys.le64(entry.value()));
        }
        flushData.adds().clear();

        for (UndoInfo undo : flushData.undoInfos()) {
            batch.put(undoKey(undo.height()), undo.encode());
        }
        flushData.undoInfos().clear();

        if (utxoDb.forSync()) {
            int blocks = flushData.height() - dbHeight;
            long txs = flushData.txCount() - dbTxCount;
            double elapsed = (System.nanoTime() - start) / 1e9;
            LOG.info(() -> String.format("flushed %,d blocks with %,d txs, %,d UTXO adds, %,d spends in %.1fs, committing...",
                    blocks, txs, addCount, spendCount, elapsed));
        }

        utxoFlushCount = history.flushCount();
        dbHeight = flushData.height();
        dbTxCount = flushData.txCount();
        dbTip = flushData.tip();
    }

    private void flushState(KeyValueStore.Batch batch) {
        double now = nowSeconds();
        wallTime += now - lastFlush;
        lastFlush = now;
        lastFlushTxCount = fsTxCount;
        writeUtxoState(batch);
    }

    private void writeUtxoState(KeyValueStore.Batch batch) {
        batch.put(STATE_KEY, state().encode());
    }

    /** Checks that nothing is pending and all three stores agree. */
    public void assertFlushed(FlushData flushData) {
        if (flushData.txCount() != fsTxCount || fsTxCount != dbTxCount) {
            throw new DbException("tx counts disagree: pending " + flushData.txCount() + ", filesystem "
                    + fsTxCount + ", DB " + dbTxCount);
        }
        if (flushData.height() != fsHeight || fsHeight != dbHeight) {
            throw new DbException("heights disagree: pending " + flushData.height() + ", filesystem "
                    + fsHeight + ", DB " + dbHeight);
        }
        if (!flushData.tip().equals(dbTip)) {
            throw new DbException("tip " + flushData.tip().hex() + " differs from DB tip " + dbTip.hex());
        }
        if (!flushData.headers().isEmpty() || !flushData.blockTxHashes().isEmpty()
                || !flushData.adds().isEmpty() || !flushData.deletes().isEmpty()
                || !flushData.undoInfos().isEmpty()) {
            throw new DbException("unflushed block data at height " + flushData.height());
        }
        history.assertFlushed();
    }

    /** Adopts the history flush count after a compaction. */
    public void setFlushCount(int count) {
        utxoFlushCount = count;
        utxoDb.write(this::writeUtxoState);
    }

    // ---------------- undo data and raw blocks ----------------

    public int minUndoHeight(int maxHeight) {
        return maxHeight - config.reorgLimit() + 1;
    }

    static byte[] undoKey(int height) {
        return Keys.concat(new byte[] {PREFIX_UNDO}, Keys.be32(height));
    }

    /** Undo data for {@code height}, or null if there is none. */
    public UndoInfo readUndoInfo(int height) {
        byte[] data = utxoDb.get(undoKey(height));
        return data == null ? null : UndoInfo.decode(height, data);
    }

    Path rawBlockPath(int height) {
        return metaDir.resolve("block" + height);
    }

    /** Reads a block kept for reorgs, if it is still on disk. */
    public Optional<byte[]> readRawBlock(int height) {
        try {
            return Optional.of(Files.readAllBytes(rawBlockPath(height)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("reading raw block " + height + " failed", e);
        }
    }

    /** Stores a raw block and removes the one that has just left the reorg window. */
    public void writeRawBlock(byte[] block, int height) {
        try {
            Files.createDirectories(metaDir);
            Files.write(rawBlockPath(height), block);
            Files.deleteIfExists(rawBlockPath(minUndoHeight(height) - 1));
        } catch (IOException e) {
            throw new StorageException("writing raw block " + height + " failed", e);
        }
    }

    // ---------------- reads ----------------

    /** Raw headers starting at {@code startHeight}; {@code count} may be cut short at the DB height. */
    public record HeaderRange(byte[] raw, int count) {}

    public HeaderRange readHeaders(int startHeight, int count) {
        if (startHeight < 0 || count < 0) {
            throw new IllegalArgumentException(count + " headers starting at " + startHeight + " not on disk");
        }
        int diskCount = Math.max(0, Math.min(count, dbHeight + 1 - startHeight));
        if (diskCount == 0) {
            return new HeaderRange(new byte[0], 0);
        }
        long offset = headerOffset(startHeight);
        long size = headerOffset(startHeight + diskCount) - offset;
        return new HeaderRange(headersFile.read(offset, (int) size), diskCount);
    }

    public byte[] rawHeader(int height) {
        HeaderRange range = readHeaders(height, 1);
        if (range.count() != 1) {
            throw new IndexOutOfBoundsException("height " + height + " out of range");
        }
        return range.raw();
    }

    /** Header hashes (internal byte order) of {@code count} blocks from {@code height}. */
    public List<byte[]> fsBlockHashes(int height, int count) {
        HeaderRange range = readHeaders(height, count);
        if (range.count() != count) {
            throw new DbException("only got " + range.count() + " headers starting at " + height + ", not " + count);
        }
        List<byte[]> hashes = new ArrayList<>(count);
        int offset = 0;
        for (int n = 0; n < count; n++) {
            int len = headerLength(height + n);
            hashes.add(codec.headerHash(Arrays.copyOfRange(range.raw(), offset, offset + len)));
            offset += len;
        }
        return hashes;
    }

    long headerOffset(int height) {
        if (headersOffsetsFile == null) {
            return codec.staticHeaderOffset(height);
        }
        byte[] b = headersOffsetsFile.read((long) height * 8, 8);
        if (b.length != 8) {
            throw new DbException("no header offset for height " + height);
        }
        return Keys.readLe64(b, 0);
    }

    int headerLength(int height) {
        if (headersOffsetsFile == null) {
            return (int) (codec.staticHeaderOffset(height + 1) - codec.staticHeaderOffset(height));
        }
        return (int) (headerOffset(height + 1) - headerOffset(height));
    }

    /** Hash and height of a tx number; the hash is null above the flushed height. */
    public TxLocation fsTxHash(long txNum) {
        int height = txCounts.bisectRight(txNum);
        if (height > dbHeight) {
            return new TxLocation(null, height);
        }
        byte[] raw = hashesFile.read(txNum * 32, 32);
        return new TxLocation(raw.length == 32 ? new Hash(raw) : null, height);
    }

    /**
     * Confirmed history of {@code hashX}, oldest first.
     *
     * @param limit maximum entries; null or negative for all
     */
    public List<TxLocation> limitedHistory(HashX hashX, Integer limit) {
        while (true) {
            List<TxLocation> out = new ArrayList<>();
            boolean complete = true;
            for (long txNum : history.getTxNums(hashX, limit)) {
                TxLocation loc = fsTxHash(txNum);
                if (loc.txHash() == null) {
                    complete = false;
                    break;
                }
                out.add(loc);
            }
            if (complete) {
                return out;
            }
            LOG.warning("limited_history: tx hash not found (reorg?), retrying...");
            pause();
        }
    }

    /** All UTXOs of {@code hashX}, in no particular order. */
    public List<Utxo> allUtxos(HashX hashX) {
        byte[] prefix = Keys.concat(new byte[] {PREFIX_UTXO}, hashX.bytes());
        while (true) {
            List<Utxo> utxos = new ArrayList<>();
            boolean[] complete = {true};
            utxoDb.scan(prefix, false, kv -> {
                byte[] key = kv.key();
                int txPos = Keys.readLe16(key, key.length - 6);
                long txNum = Keys.readLe32(key, key.length - 4);
                TxLocation loc = fsTxHash(txNum);
                if (loc.txHash() == null) {
                    complete[0] = false;
                    return false;
                }
                utxos.add(new Utxo(txNum, txPos, loc.txHash(), loc.height(), Keys.readLe64(kv.value(), 0)));
                return true;
            });
            if (complete[0]) {
                return utxos;
            }
            LOG.warning("all_utxos: tx hash not found (reorg?), retrying...");
            pause();
        }
    }

    /** For each prevout, its owner and value, or null if not in the UTXO set. */
    public List<HashXValue> lookupUtxos(List<Prevout> prevouts) {
        List<HashXValue> out = new ArrayList<>(prevouts.size());
        for (Prevout prevout : prevouts) {
            StoredUtxo stored = findStoredUtxo(prevout, true);
            out.add(stored == null ? null : new HashXValue(stored.entry().hashX(), stored.entry().value()));
        }
        return out;
    }

    /**
     * Locates a prevout in the database through its {@code h} key.
     *
     * @param confirmHash whether to compare full tx hashes even with a single candidate
     */
    public StoredUtxo findStoredUtxo(Prevout prevout, boolean confirmHash) {
        byte[] txHash = prevout.txHash().bytes();
        byte[] idx = Keys.le16(prevout.index());
        byte[] prefix = Keys.concat(new byte[] {PREFIX_HASHX_LOOKUP}, Arrays.copyOf(txHash, 4), idx);
        List<KeyValue> candidates = new ArrayList<>();
        utxoDb.scan(prefix, false, candidates::add);
        for (KeyValue candidate : candidates) {
            byte[] hKey = candidate.key();
            long txNum = Keys.readLe32(hKey, hKey.length - 4);
            if (confirmHash || candidates.size() > 1) {
                TxLocation loc = fsTxHash(txNum);
                if (loc.txHash() == null || !loc.txHash().equals(prevout.txHash())) {
                    continue;
                }
            }
            HashX hashX = HashX.of(candidate.value(), 0);
            byte[] uKey = Keys.concat(new byte[] {PREFIX_UTXO}, candidate.value(),
                    Arrays.copyOfRange(hKey, hKey.length - 6, hKey.length));
            byte[] value = utxoDb.get(uKey);
            if (value != null) {
                return new StoredUtxo(hKey, uKey, new UtxoEntry(hashX, txNum, Keys.readLe64(value, 0)));
            }
        }
        return null;
    }

    private static byte[] hashXLookupKey(Hash txHash, byte[] suffix) {
        return Keys.concat(new byte[] {PREFIX_HASHX_LOOKUP}, Arrays.copyOf(txHash.bytes(), 4), suffix);
    }

    // ---------------- merkle ----------------

    /** Fills the header merkle cache up to the start of the reorg window. */
    public void populateHeaderMerkleCache() {
        LOG.info("populating header merkle cache...");
        int length = Math.max(1, dbHeight - config.reorgLimit());
        long start = System.nanoTime();
        headerMerkleCache.initialize(length);
        double elapsed = (System.nanoTime() - start) / 1e9;
        LOG.info(() -> String.format("header merkle cache populated in %.1fs", elapsed));
    }

    public Merkle.BranchAndRoot headerBranchAndRoot(int length, int height) {
        return headerMerkleCache.branchAndRoot(length, height);
    }

    // ---------------- state ----------------

    public ChainState state() {
        return new ChainState(genesisHash, dbHeight, dbTxCount, dbTip, utxoFlushCount, wallTime,
                firstSync, dbVersion);
    }

    public int dbHeight() { return dbHeight; }

    public long dbTxCount() { return dbTxCount; }

    public Hash dbTip() { return dbTip; }

    public int fsHeight() { return fsHeight; }

    public long fsTxCount() { return fsTxCount; }

    public boolean firstSync() { return firstSync; }

    public void setFirstSync(boolean firstSync) { this.firstSync = firstSync; }

    public TxCounts txCounts() { return txCounts; }

    public History history() { return history; }

    public ChainCodec codec() { return codec; }

    public IndexerConfig config() { return config; }

    @Override
    public void close() {
        if (utxoDb != null) {
            utxoDb.close();
            utxoDb = null;
        }
        history.close();
    }

    // ---------------- helpers ----------------

    private static void pause() {
        try {
            Thread.sleep(RETRY_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("interrupted while retrying a read", e);
        }
    }

    private static byte[] concat(List<byte[]> parts) {
        return Keys.concat(parts.toArray(new byte[0][]));
    }

    private static double nowSeconds() {
        return System.currentTimeMillis() / 1000.0;
    }

    static String formattedTime(double seconds) {
        long t = (long) seconds;
        long d = t / 86_400;
        long h = (t % 86_400) / 3600;
        long m = (t % 3600) / 60;
        long s = t % 60;
        if (d > 0) return String.format("%dd %02dh %02dm", d, h, m);
        if (h > 0) return String.format("%dh %02dm %02ds", h, m, s);
        return String.format("%dm %02ds", m, s);
    }
}
