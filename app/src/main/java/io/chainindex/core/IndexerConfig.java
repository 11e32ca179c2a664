package io.chainindex.core;

import io.chainindex.core.codec.CoinSpec;

import java.nio.file.Path;
import java.util.List;

/** Immutable runtime configuration, built once by {@link Main} and passed to each component. */
public record IndexerConfig(
        Path dataDir,
        List<String> daemonUrls,
        CoinSpec coin,
        int cacheMb,
        int reorgLimit,
        long mempoolRefreshMillis,
        long histogramRefreshMillis,
        int historyCacheSize,
        int maxHistory,
        boolean enableSession,
        String sessionBind,
        int sessionPort,
        boolean enableRpc,
        String rpcBind,
        int rpcPort,
        String rpcToken
) {
    public static final int DEFAULT_CACHE_MB = 1200;
    public static final long DEFAULT_MEMPOOL_REFRESH_MILLIS = 5_000L;
    public static final long DEFAULT_HISTOGRAM_REFRESH_MILLIS = 60_000L;
    public static final int DEFAULT_HISTORY_CACHE_SIZE = 1000;
    public static final int DEFAULT_MAX_HISTORY = 1000;

    public IndexerConfig {
        daemonUrls = List.copyOf(daemonUrls);
        if (reorgLimit < 1) {
            throw new IllegalArgumentException("reorg limit must be positive");
        }
        if (cacheMb < 1) {
            throw new IllegalArgumentException("cache size must be positive");
        }
    }

    /** Local defaults for a coin: daemon on localhost, no servers. */
    public static IndexerConfig defaults(Path dataDir, CoinSpec coin) {
        return new IndexerConfig(
                dataDir,
                List.of("http://127.0.0.1:" + coin.rpcPort() + "/"),
                coin,
                DEFAULT_CACHE_MB,
                coin.reorgLimit(),
                DEFAULT_MEMPOOL_REFRESH_MILLIS,
                DEFAULT_HISTOGRAM_REFRESH_MILLIS,
                DEFAULT_HISTORY_CACHE_SIZE,
                DEFAULT_MAX_HISTORY,
                false, "127.0.0.1", 50001,
                false, "127.0.0.1", 8000, null
        );
    }

    public IndexerConfig withReorgLimit(int limit) {
        return new IndexerConfig(dataDir, daemonUrls, coin, cacheMb, limit, mempoolRefreshMillis,
                histogramRefreshMillis, historyCacheSize, maxHistory, enableSession, sessionBind,
                sessionPort, enableRpc, rpcBind, rpcPort, rpcToken);
    }

    public IndexerConfig withCacheMb(int mb) {
        return new IndexerConfig(dataDir, daemonUrls, coin, mb, reorgLimit, mempoolRefreshMillis,
                histogramRefreshMillis, historyCacheSize, maxHistory, enableSession, sessionBind,
                sessionPort, enableRpc, rpcBind, rpcPort, rpcToken);
    }

    public IndexerConfig withHistoryCacheSize(int size) {
        return new IndexerConfig(dataDir, daemonUrls, coin, cacheMb, reorgLimit, mempoolRefreshMillis,
                histogramRefreshMillis, size, maxHistory, enableSession, sessionBind,
                sessionPort, enableRpc, rpcBind, rpcPort, rpcToken);
    }

    public IndexerConfig withRefreshMillis(long mempoolMillis, long histogramMillis) {
        return new IndexerConfig(dataDir, daemonUrls, coin, cacheMb, reorgLimit, mempoolMillis,
                histogramMillis, historyCacheSize, maxHistory, enableSession, sessionBind,
                sessionPort, enableRpc, rpcBind, rpcPort, rpcToken);
    }
}
