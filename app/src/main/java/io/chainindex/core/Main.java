package io.chainindex.core;

import io.chainindex.core.codec.CoinSpec;
import io.chainindex.core.codec.Coins;
import io.chainindex.core.node.Indexer;
import io.chainindex.core.rpc.RpcServer;
import io.chainindex.core.session.SessionServer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args, System.getenv());
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        IndexerConfig config = options.config();
        Files.createDirectories(config.dataDir());
        Indexer indexer = Indexer.rocks(config);
        LOG.info(() -> "indexing " + config.coin().displayName() + " into " + config.dataDir());

        if (options.compactHistory()) {
            indexer.compactHistory();
            return;
        }

        SessionServer sessionServer = null;
        RpcServer rpcServer = null;
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "chain-index-shutdown"));
        indexer.terminated().whenComplete((ignored, e) -> shutdownLatch.countDown());

        try {
            indexer.start();
            if (config.enableRpc()) {
                rpcServer = new RpcServer(indexer, config.rpcBind(), config.rpcPort(), config.rpcToken());
                rpcServer.start();
            }
            if (config.enableSession()) {
                // clients are only served once the mempool and merkle cache are ready
                try {
                    indexer.serving().get();
                } catch (ExecutionException e) {
                    throw new IllegalStateException("indexer failed before serving", e.getCause());
                }
                sessionServer = new SessionServer(indexer.query(), config.sessionBind(), config.sessionPort());
                sessionServer.start();
            }
            LOG.info("Indexer running. Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            if (sessionServer != null) {
                sessionServer.stop();
            }
            if (rpcServer != null) {
                rpcServer.stop();
            }
            indexer.close();
        }
        if (indexer.terminated().isCompletedExceptionally()) {
            LOG.log(Level.SEVERE, "block processing stopped with an error; exiting");
            System.exit(1);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            boolean compactHistory,
            IndexerConfig config
    ) {
        static CliOptions parse(String[] args, Map<String, String> env) {
            Path dataDir = Path.of(envOrDefault(env, "CHAIN_INDEX_DATA_DIR", "./data/index"));
            List<String> daemonUrls = new ArrayList<>();
            addUrls(daemonUrls, env.get("CHAIN_INDEX_DAEMON_URL"));
            String coinName = envOrDefault(env, "CHAIN_INDEX_COIN", "bitcoin");
            String net = envOrDefault(env, "CHAIN_INDEX_NET", "mainnet");
            Integer cacheMb = null;
            Integer reorgLimit = null;
            Long mempoolRefresh = null;
            Long histogramRefresh = null;
            Integer historyCache = null;
            Integer maxHistory = null;
            boolean enableSession = "true".equalsIgnoreCase(env.get("CHAIN_INDEX_ENABLE_SESSION"));
            String sessionBind = envOrDefault(env, "CHAIN_INDEX_SESSION_BIND", "127.0.0.1");
            String sessionPortEnv = env.get("CHAIN_INDEX_SESSION_PORT");
            boolean enableRpc = "true".equalsIgnoreCase(env.get("CHAIN_INDEX_ENABLE_RPC"));
            String rpcBind = envOrDefault(env, "CHAIN_INDEX_RPC_BIND", "127.0.0.1");
            String rpcPortEnv = env.get("CHAIN_INDEX_RPC_PORT");
            String rpcToken = env.get("CHAIN_INDEX_RPC_TOKEN");
            boolean compact = false;
            boolean showHelp = false;
            String error = null;
            int sessionPort = 50001;
            int rpcPort = 8000;

            try {
                if (sessionPortEnv != null && !sessionPortEnv.isBlank()) {
                    sessionPort = parsePort(sessionPortEnv, "CHAIN_INDEX_SESSION_PORT");
                }
                if (rpcPortEnv != null && !rpcPortEnv.isBlank()) {
                    rpcPort = parsePort(rpcPortEnv, "CHAIN_INDEX_RPC_PORT");
                }
                String cacheEnv = env.get("CHAIN_INDEX_CACHE_MB");
                if (cacheEnv != null && !cacheEnv.isBlank()) {
                    cacheMb = (int) parsePositiveLong(cacheEnv, "CHAIN_INDEX_CACHE_MB");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(value(arg));
                        } else if (arg.startsWith("--daemon-url=")) {
                            addUrls(daemonUrls, value(arg));
                        } else if (arg.startsWith("--coin=")) {
                            coinName = value(arg);
                        } else if (arg.startsWith("--net=")) {
                            net = value(arg);
                        } else if (arg.startsWith("--cache-mb=")) {
                            cacheMb = (int) parsePositiveLong(value(arg), "--cache-mb");
                        } else if (arg.startsWith("--reorg-limit=")) {
                            reorgLimit = (int) parsePositiveLong(value(arg), "--reorg-limit");
                        } else if (arg.startsWith("--mempool-refresh-ms=")) {
                            mempoolRefresh = parsePositiveLong(value(arg), "--mempool-refresh-ms");
                        } else if (arg.startsWith("--histogram-refresh-ms=")) {
                            histogramRefresh = parsePositiveLong(value(arg), "--histogram-refresh-ms");
                        } else if (arg.startsWith("--history-cache=")) {
                            historyCache = (int) parsePositiveLong(value(arg), "--history-cache");
                        } else if (arg.startsWith("--max-history=")) {
                            maxHistory = (int) parsePositiveLong(value(arg), "--max-history");
                        } else if (arg.equals("--enable-session")) {
                            enableSession = true;
                        } else if (arg.startsWith("--session-bind=")) {
                            sessionBind = value(arg);
                        } else if (arg.startsWith("--session-port=")) {
                            sessionPort = parsePort(value(arg), "--session-port");
                        } else if (arg.equals("--enable-rpc")) {
                            enableRpc = true;
                        } else if (arg.startsWith("--rpc-bind=")) {
                            rpcBind = value(arg);
                        } else if (arg.startsWith("--rpc-port=")) {
                            rpcPort = parsePort(value(arg), "--rpc-port");
                        } else if (arg.startsWith("--rpc-token=")) {
                            rpcToken = value(arg);
                        } else if (arg.equals("--compact-history")) {
                            compact = true;
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        error = ex.getMessage();
                    }
                }
            }

            if (rpcToken != null && rpcToken.isBlank()) {
                rpcToken = null;
            }

            IndexerConfig config = null;
            if (error == null) {
                try {
                    CoinSpec coin = Coins.lookup(coinName, net);
                    IndexerConfig defaults = IndexerConfig.defaults(dataDir.toAbsolutePath().normalize(), coin);
                    config = new IndexerConfig(
                            defaults.dataDir(),
                            daemonUrls.isEmpty() ? defaults.daemonUrls() : daemonUrls,
                            coin,
                            cacheMb != null ? cacheMb : defaults.cacheMb(),
                            reorgLimit != null ? reorgLimit : defaults.reorgLimit(),
                            mempoolRefresh != null ? mempoolRefresh : defaults.mempoolRefreshMillis(),
                            histogramRefresh != null ? histogramRefresh : defaults.histogramRefreshMillis(),
                            historyCache != null ? historyCache : defaults.historyCacheSize(),
                            maxHistory != null ? maxHistory : defaults.maxHistory(),
                            enableSession,
                            sessionBind,
                            sessionPort,
                            enableRpc,
                            rpcBind,
                            rpcPort,
                            rpcToken
                    );
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            return new CliOptions(showHelp, error, compact, config);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: chain-index [options]

Options:
  --help, -h                   Show this help message and exit
  --data-dir=<path>            Directory for the databases and header files (default ./data/index)
  --daemon-url=<url>           Daemon JSON-RPC URL with credentials; repeatable or comma separated
  --coin=<name>                Coin to index (default bitcoin)
  --net=<network>              mainnet, testnet or regtest (default mainnet)
  --cache-mb=<n>               Memory for unflushed block data before a flush (default 1200)
  --reorg-limit=<n>            Blocks of undo data to keep (default depends on coin)
  --mempool-refresh-ms=<ms>    Mempool poll interval (default 5000)
  --histogram-refresh-ms=<ms>  Fee histogram rebuild interval (default 60000)
  --history-cache=<n>          Address histories kept in the query cache (default 1000)
  --max-history=<n>            Most history entries returned per address (default 1000)
  --enable-session             Serve Electrum clients (default bind 127.0.0.1:50001)
  --session-bind=<host>        Bind address for the session server
  --session-port=<port>        Port for the session server
  --enable-rpc                 Start the admin RPC server (default bind 127.0.0.1:8000)
  --rpc-bind=<host>            Bind address for the admin RPC server
  --rpc-port=<port>            Port for the admin RPC server
  --rpc-token=<token>          Require Bearer/X-API-Key token for the admin RPC server
  --compact-history            Compact the history database, then exit

Environment overrides:
  CHAIN_INDEX_DATA_DIR         Default for --data-dir
  CHAIN_INDEX_DAEMON_URL       Comma-separated daemon URLs
  CHAIN_INDEX_COIN             Default for --coin
  CHAIN_INDEX_NET              Default for --net
  CHAIN_INDEX_CACHE_MB         Default for --cache-mb
  CHAIN_INDEX_ENABLE_SESSION   Set to "true" to serve clients without the CLI flag
  CHAIN_INDEX_SESSION_BIND     Default for --session-bind
  CHAIN_INDEX_SESSION_PORT     Default for --session-port
  CHAIN_INDEX_ENABLE_RPC       Set to "true" to enable admin RPC without the CLI flag
  CHAIN_INDEX_RPC_BIND         Default for --rpc-bind
  CHAIN_INDEX_RPC_PORT         Default for --rpc-port
  CHAIN_INDEX_RPC_TOKEN        Token for admin RPC auth (if --rpc-token not supplied)
""");
        }

        private static String value(String arg) {
            return arg.substring(arg.indexOf('=') + 1);
        }

        private static void addUrls(List<String> urls, String value) {
            if (value == null || value.isBlank()) {
                return;
            }
            for (String url : value.split(",")) {
                if (!url.isBlank()) {
                    urls.add(url.trim());
                }
            }
        }

        private static String envOrDefault(Map<String, String> env, String key, String fallback) {
            String value = env.get(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed <= 0 || parsed > Integer.MAX_VALUE) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
