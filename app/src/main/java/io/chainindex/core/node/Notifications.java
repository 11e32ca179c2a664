package io.chainindex.core.node;

import io.chainindex.core.protocol.HashX;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Joins block and mempool notifications so listeners only hear about a height once the
 * mempool has been refreshed against it. Touched hashXs from every block up to that height
 * are reported together.
 */
public class Notifications {
    private static final Logger LOG = Logger.getLogger(Notifications.class.getName());

    private final Map<Integer, Set<HashX>> touchedMempool = new TreeMap<>();
    private final Map<Integer, Set<HashX>> touchedBlocks = new TreeMap<>();
    private int highestBlock = -1;
    private BiConsumer<Integer, Set<HashX>> listener = (height, touched) -> {};

    /** Installs the listener and announces the starting height with nothing touched. */
    public synchronized void start(int height, BiConsumer<Integer, Set<HashX>> listener) {
        this.highestBlock = height;
        this.listener = listener;
        fire(height, new HashSet<>());
    }

    public synchronized void onMempool(Set<HashX> touched, int height) {
        touchedMempool.put(height, new HashSet<>(touched));
        maybeNotify();
    }

    public synchronized void onBlock(Set<HashX> touched, int height) {
        touchedBlocks.merge(height, new HashSet<>(touched), (a, b) -> {
            a.addAll(b);
            return a;
        });
        highestBlock = height;
        maybeNotify();
    }

    private void maybeNotify() {
        int height = -1;
        for (int h : touchedMempool.keySet()) {
            if (touchedBlocks.containsKey(h)) {
                height = Math.max(height, h);
            }
        }
        if (height < 0) {
            int maxMempool = touchedMempool.keySet().stream().mapToInt(Integer::intValue).max().orElse(-1);
            if (maxMempool >= 0 && maxMempool == highestBlock) {
                height = highestBlock;
            } else {
                // waiting for a block or for the mempool to catch up with one
                return;
            }
        }
        Set<HashX> touched = touchedMempool.remove(height);
        int limit = height;
        touchedMempool.keySet().removeIf(h -> h <= limit);
        var it = touchedBlocks.entrySet().iterator();
        while (it.hasNext()) {
            var e = it.next();
            if (e.getKey() <= height) {
                touched.addAll(e.getValue());
                it.remove();
            }
        }
        fire(height, touched);
    }

    private void fire(int height, Set<HashX> touched) {
        try {
            listener.accept(height, touched);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Notification listener failed at height " + height, e);
        }
    }
}
