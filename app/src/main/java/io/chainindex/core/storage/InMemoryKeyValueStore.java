package io.chainindex.core.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Heap-backed {@link KeyValueStore}. Stores created by the same {@link #factory()} survive
 * close and reopen, which lets tests simulate restarts.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final NavigableMap<byte[], byte[]> map;
    private final ReadWriteLock lock;
    private final boolean isNew;
    private final boolean forSync;

    public InMemoryKeyValueStore() {
        this(new TreeMap<>(Arrays::compareUnsigned), new ReentrantReadWriteLock(), true, false);
    }

    private InMemoryKeyValueStore(NavigableMap<byte[], byte[]> map, ReadWriteLock lock,
                                  boolean isNew, boolean forSync) {
        this.map = map;
        this.lock = lock;
        this.isNew = isNew;
        this.forSync = forSync;
    }

    public static KeyValueStore.Factory factory() {
        Map<String, InMemoryKeyValueStore> stores = new HashMap<>();
        return (name, forSync) -> {
            synchronized (stores) {
                InMemoryKeyValueStore existing = stores.get(name);
                InMemoryKeyValueStore store = existing == null
                        ? new InMemoryKeyValueStore(new TreeMap<>(Arrays::compareUnsigned),
                                new ReentrantReadWriteLock(), true, forSync)
                        : new InMemoryKeyValueStore(existing.map, existing.lock, false, forSync);
                stores.put(name, store);
                return store;
            }
        };
    }

    @Override
    public byte[] get(byte[] key) {
        lock.readLock().lock();
        try {
            byte[] v = map.get(key);
            return v == null ? null : v.clone();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void put(byte[] key, byte[] value) {
        write(b -> b.put(key, value));
    }

    @Override
    public void delete(byte[] key) {
        write(b -> b.delete(key));
    }

    @Override
    public void write(Consumer<Batch> ops) {
        List<KeyValue> pending = new ArrayList<>();
        ops.accept(new Batch() {
            @Override
            public void put(byte[] key, byte[] value) {
                pending.add(new KeyValue(key.clone(), value.clone()));
            }

            @Override
            public void delete(byte[] key) {
                pending.add(new KeyValue(key.clone(), null));
            }
        });
        lock.writeLock().lock();
        try {
            for (KeyValue kv : pending) {
                if (kv.value() == null) {
                    map.remove(kv.key());
                } else {
                    map.put(kv.key(), kv.value());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void scan(byte[] prefix, boolean reverse, Predicate<KeyValue> visitor) {
        List<KeyValue> entries = snapshot(prefix, null);
        if (reverse) {
            for (int i = entries.size() - 1; i >= 0; i--) {
                if (!visitor.test(entries.get(i))) return;
            }
        } else {
            for (KeyValue kv : entries) {
                if (!visitor.test(kv)) return;
            }
        }
    }

    @Override
    public void scanAfter(byte[] prefix, byte[] after, Predicate<KeyValue> visitor) {
        for (KeyValue kv : snapshot(prefix, after)) {
            if (!visitor.test(kv)) return;
        }
    }

    private List<KeyValue> snapshot(byte[] prefix, byte[] after) {
        lock.readLock().lock();
        try {
            byte[] bound = Keys.upperBound(prefix);
            NavigableMap<byte[], byte[]> range = bound == null
                    ? map.tailMap(prefix, true)
                    : map.subMap(prefix, true, bound, false);
            if (after != null) {
                range = range.tailMap(after, false);
            }
            List<KeyValue> out = new ArrayList<>(range.size());
            range.forEach((k, v) -> out.add(new KeyValue(k.clone(), v.clone())));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return map.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override public boolean isNew() { return isNew; }

    @Override public boolean forSync() { return forSync; }

    @Override
    public void close() {
        // data is kept for a later reopen through the factory
    }
}
