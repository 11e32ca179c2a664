package io.chainindex.core.storage;

import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Logger;

/** {@link KeyValueStore} backed by one RocksDB database directory. */
public final class RocksDBKeyValueStore implements KeyValueStore {
    private static final Logger LOG = Logger.getLogger(RocksDBKeyValueStore.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final Options options;
    private final boolean isNew;
    private final boolean forSync;

    private RocksDBKeyValueStore(RocksDB db, Options options, boolean isNew, boolean forSync) {
        this.db = db;
        this.options = options;
        this.isNew = isNew;
        this.forSync = forSync;
    }

    /** Opens or creates the database at {@code dir}. */
    public static RocksDBKeyValueStore open(Path dir, boolean forSync) {
        boolean isNew = !Files.exists(dir);
        Options opts = new Options()
                .setCreateIfMissing(true)
                .setMaxOpenFiles(forSync ? 1024 : 256);
        try {
            RocksDB db = RocksDB.open(opts, dir.toString());
            LOG.fine(() -> "Opened RocksDB at " + dir + " (for sync: " + forSync + ")");
            return new RocksDBKeyValueStore(db, opts, isNew, forSync);
        } catch (RocksDBException e) {
            opts.close();
            throw new StorageException("Failed to open RocksDB at " + dir, e);
        }
    }

    /** Factory placing each named store in a subdirectory of {@code dataDir}. */
    public static KeyValueStore.Factory factory(Path dataDir) {
        return (name, forSync) -> open(dataDir.resolve(name), forSync);
    }

    @Override
    public byte[] get(byte[] key) {
        try {
            return db.get(key);
        } catch (RocksDBException e) {
            throw new StorageException("get failed", e);
        }
    }

    @Override
    public void put(byte[] key, byte[] value) {
        try {
            db.put(key, value);
        } catch (RocksDBException e) {
            throw new StorageException("put failed", e);
        }
    }

    @Override
    public void delete(byte[] key) {
        try {
            db.delete(key);
        } catch (RocksDBException e) {
            throw new StorageException("delete failed", e);
        }
    }

    @Override
    public void write(Consumer<Batch> ops) {
        try (WriteBatch batch = new WriteBatch(); WriteOptions wo = new WriteOptions().setSync(false)) {
            ops.accept(new Batch() {
                @Override
                public void put(byte[] key, byte[] value) {
                    try {
                        batch.put(key, value);
                    } catch (RocksDBException e) {
                        throw new StorageException("batch put failed", e);
                    }
                }

                @Override
                public void delete(byte[] key) {
                    try {
                        batch.delete(key);
                    } catch (RocksDBException e) {
                        throw new StorageException("batch delete failed", e);
                    }
                }
            });
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new StorageException("write batch failed", e);
        }
    }

    @Override
    public void scan(byte[] prefix, boolean reverse, Predicate<KeyValue> visitor) {
        try (RocksIterator it = db.newIterator()) {
            if (reverse) {
                byte[] bound = Keys.upperBound(prefix);
                if (bound == null) {
                    it.seekToLast();
                } else {
                    it.seekForPrev(bound);
                    if (it.isValid() && Arrays.equals(it.key(), bound)) {
                        it.prev();
                    }
                }
            } else {
                it.seek(prefix);
            }
            while (it.isValid()) {
                byte[] key = it.key();
                if (!Keys.startsWith(key, prefix) || !visitor.test(new KeyValue(key, it.value()))) {
                    break;
                }
                if (reverse) it.prev(); else it.next();
            }
        }
    }

    @Override
    public void scanAfter(byte[] prefix, byte[] after, Predicate<KeyValue> visitor) {
        try (RocksIterator it = db.newIterator()) {
            it.seek(after == null ? prefix : after);
            if (after != null && it.isValid() && Arrays.equals(it.key(), after)) {
                it.next();
            }
            while (it.isValid()) {
                byte[] key = it.key();
                if (!Keys.startsWith(key, prefix) || !visitor.test(new KeyValue(key, it.value()))) {
                    break;
                }
                it.next();
            }
        }
    }

    @Override public boolean isNew() { return isNew; }

    @Override public boolean forSync() { return forSync; }

    @Override
    public void close() {
        db.close();
        options.close();
    }
}
