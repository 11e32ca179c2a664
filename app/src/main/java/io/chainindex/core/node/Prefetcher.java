package io.chainindex.core.node;

import io.chainindex.core.codec.ChainCodec;
import io.chainindex.core.daemon.ChainSource;
import io.chainindex.core.daemon.DaemonException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Fetches raw blocks ahead of the block processor, keeping roughly
 * {@value #MIN_CACHE_SIZE} bytes queued.
 */
public final class Prefetcher {
    private static final Logger LOG = Logger.getLogger(Prefetcher.class.getName());

    static final long MIN_CACHE_SIZE = 10L * 1024 * 1024;
    static final int MAX_BLOCKS_PER_FETCH = 500;

    private final ChainSource daemon;
    private final ChainCodec codec;
    private final Event blocksEvent;
    private final Event refillEvent = new Event();
    private final long pollingDelayMillis;
    // held while fetching so a reset cannot interleave with a fetch
    private final Object fetchLock = new Object();

    private final List<byte[]> blocks = new ArrayList<>();
    private long cacheSize;
    private long aveSize = MIN_CACHE_SIZE / 10;
    private int fetchedHeight;
    private volatile boolean caughtUp;

    Prefetcher(ChainSource daemon, ChainCodec codec, Event blocksEvent, long pollingDelayMillis) {
        this.daemon = daemon;
        this.codec = codec;
        this.blocksEvent = blocksEvent;
        this.pollingDelayMillis = pollingDelayMillis;
    }

    /** Polls for blocks until interrupted. */
    void mainLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                if (!refillEvent.await(1000)) {
                    continue;
                }
                if (!prefetchBlocks()) {
                    Thread.sleep(pollingDelayMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (DaemonException e) {
                LOG.info(() -> "ignoring daemon error: " + e.getMessage());
            }
        }
    }

    /** Hands queued blocks to the processor and asks for more. */
    List<byte[]> takeBlocks() {
        synchronized (blocks) {
            List<byte[]> out = new ArrayList<>(blocks);
            blocks.clear();
            cacheSize = 0;
            refillEvent.set();
            return out;
        }
    }

    /** Restarts fetching just above {@code height}; used after reorgs. */
    void resetHeight(int height) {
        synchronized (fetchLock) {
            synchronized (blocks) {
                blocks.clear();
                cacheSize = 0;
            }
            fetchedHeight = height;
            refillEvent.set();
        }
        int daemonHeight = daemon.height();
        int behind = daemonHeight - height;
        if (behind > 0) {
            LOG.info(() -> String.format("catching up to daemon height %,d (%,d blocks behind)", daemonHeight, behind));
        } else {
            LOG.info(() -> String.format("caught up to daemon height %,d", daemonHeight));
        }
    }

    /**
     * Fetches until the queue is full or the daemon has nothing more.
     *
     * @return false if already caught up
     */
    boolean prefetchBlocks() {
        int daemonHeight = daemon.height();
        synchronized (fetchLock) {
            while (queuedSize() < MIN_CACHE_SIZE) {
                long cacheRoom = MIN_CACHE_SIZE / aveSize;
                long count = Math.min(daemonHeight - fetchedHeight, cacheRoom);
                count = Math.min(MAX_BLOCKS_PER_FETCH, Math.max(count, 0));
                if (count == 0) {
                    caughtUp = true;
                    return false;
                }
                int first = fetchedHeight + 1;
                List<String> hexHashes = daemon.blockHexHashes(first, (int) count);
                if (caughtUp) {
                    long n = count;
                    LOG.info(() -> String.format("new block height %,d hash %s",
                            first + n - 1, hexHashes.get(hexHashes.size() - 1)));
                }
                List<byte[]> fetched = new ArrayList<>(daemon.rawBlocks(hexHashes));
                if (fetched.size() != count) {
                    throw new DaemonException("asked for " + count + " blocks, got " + fetched.size());
                }
                if (first == 0) {
                    fetched.set(0, codec.genesisBlock(fetched.get(0)));
                    LOG.info(() -> "verified genesis block with hash " + hexHashes.get(0));
                }
                long size = 0;
                for (byte[] b : fetched) size += b.length;
                if (count >= 10) {
                    aveSize = Math.max(1, size / count);
                } else {
                    aveSize = Math.max(1, (size + (10 - count) * aveSize) / 10);
                }
                synchronized (blocks) {
                    blocks.addAll(fetched);
                    cacheSize += size;
                }
                fetchedHeight += (int) count;
                blocksEvent.set();
            }
        }
        refillEvent.clear();
        return true;
    }

    private long queuedSize() {
        synchronized (blocks) {
            return cacheSize;
        }
    }

    boolean caughtUp() {
        return caughtUp;
    }
}
