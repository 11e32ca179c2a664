package io.chainindex.core;

import io.chainindex.core.codec.Coins;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {}, Map.of());
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertFalse(options.compactHistory());

        IndexerConfig config = options.config();
        assertEquals(Coins.BITCOIN_MAINNET, config.coin());
        assertEquals(Path.of("./data/index").toAbsolutePath().normalize(), config.dataDir());
        assertEquals(List.of("http://127.0.0.1:8332/"), config.daemonUrls());
        assertEquals(IndexerConfig.DEFAULT_CACHE_MB, config.cacheMb());
        assertFalse(config.enableSession());
        assertEquals(50001, config.sessionPort());
        assertFalse(config.enableRpc());
        assertEquals(8000, config.rpcPort());
        assertNull(config.rpcToken());
    }

    @Test
    void enablesServersAndTunesTheIndex() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--coin=btc",
                "--net=regtest",
                "--daemon-url=http://u:p@node1:18443/,http://u:p@node2:18443/",
                "--daemon-url=http://u:p@node3:18443/",
                "--cache-mb=300",
                "--reorg-limit=50",
                "--history-cache=20",
                "--max-history=500",
                "--mempool-refresh-ms=250",
                "--enable-session",
                "--session-bind=0.0.0.0",
                "--session-port=50002",
                "--enable-rpc",
                "--rpc-port=9191",
                "--rpc-token=admin",
                "--compact-history"
        }, Map.of());
        assertNull(options.errorMessage());
        assertTrue(options.compactHistory());

        IndexerConfig config = options.config();
        assertEquals(Coins.BITCOIN_REGTEST, config.coin());
        assertEquals(3, config.daemonUrls().size());
        assertEquals("http://u:p@node3:18443/", config.daemonUrls().get(2));
        assertEquals(300, config.cacheMb());
        assertEquals(50, config.reorgLimit());
        assertEquals(20, config.historyCacheSize());
        assertEquals(500, config.maxHistory());
        assertEquals(250, config.mempoolRefreshMillis());
        assertEquals(IndexerConfig.DEFAULT_HISTOGRAM_REFRESH_MILLIS, config.histogramRefreshMillis());
        assertTrue(config.enableSession());
        assertEquals("0.0.0.0", config.sessionBind());
        assertEquals(50002, config.sessionPort());
        assertTrue(config.enableRpc());
        assertEquals(9191, config.rpcPort());
        assertEquals("admin", config.rpcToken());
    }

    @Test
    void environmentSuppliesDefaultsThatFlagsOverride() {
        Map<String, String> env = Map.of(
                "CHAIN_INDEX_COIN", "dogecoin",
                "CHAIN_INDEX_DAEMON_URL", "http://env:22555/",
                "CHAIN_INDEX_ENABLE_RPC", "true",
                "CHAIN_INDEX_RPC_PORT", "8100",
                "CHAIN_INDEX_RPC_TOKEN", "from-env",
                "CHAIN_INDEX_DATA_DIR", "/tmp/index-env");
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--rpc-port=8200"}, env);
        assertNull(options.errorMessage());

        IndexerConfig config = options.config();
        assertEquals(Coins.DOGECOIN_MAINNET, config.coin());
        assertEquals(List.of("http://env:22555/"), config.daemonUrls());
        assertTrue(config.enableRpc());
        assertEquals(8200, config.rpcPort());
        assertEquals("from-env", config.rpcToken());
        assertEquals(Path.of("/tmp/index-env"), config.dataDir());
    }

    @Test
    void invalidValuesSetAnError() {
        Main.CliOptions badPort = Main.CliOptions.parse(new String[] {"--rpc-port=70000"}, Map.of());
        assertTrue(badPort.showHelp());
        assertEquals("Invalid port for --rpc-port: 70000", badPort.errorMessage());
        assertNull(badPort.config());

        Main.CliOptions badCache = Main.CliOptions.parse(new String[] {"--cache-mb=0"}, Map.of());
        assertEquals("Invalid value for --cache-mb: 0", badCache.errorMessage());

        Main.CliOptions badEnv = Main.CliOptions.parse(new String[] {}, Map.of("CHAIN_INDEX_SESSION_PORT", "x"));
        assertEquals("Invalid port for CHAIN_INDEX_SESSION_PORT: x", badEnv.errorMessage());
    }

    @Test
    void unknownOptionsAndCoinsAreReported() {
        Main.CliOptions unknown = Main.CliOptions.parse(new String[] {"--demo"}, Map.of());
        assertTrue(unknown.showHelp());
        assertEquals("Unknown option: --demo", unknown.errorMessage());

        Main.CliOptions coin = Main.CliOptions.parse(new String[] {"--coin=litecoin", "--net=testnet"}, Map.of());
        assertEquals("Unknown coin litecoin on network testnet", coin.errorMessage());
        assertNull(coin.config());
    }

    @Test
    void helpFlagIsRecognised() {
        assertTrue(Main.CliOptions.parse(new String[] {"-h"}, Map.of()).showHelp());
        Main.CliOptions help = Main.CliOptions.parse(new String[] {"--help"}, Map.of());
        assertTrue(help.showHelp());
        assertNull(help.errorMessage());
    }
}
