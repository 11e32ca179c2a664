package io.chainindex.core.rpc;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.chainindex.core.metrics.HttpMetrics;
import io.chainindex.core.node.BlockProcessor;
import io.chainindex.core.node.Indexer;
import io.chainindex.core.protocol.Hash;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Local admin HTTP server: status, forced reorgs and metrics. */
public final class RpcServer {
    private static final Logger LOG = Logger.getLogger(RpcServer.class.getName());

    static final int DEFAULT_REORG_COUNT = 3;

    private final Indexer indexer;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public RpcServer(Indexer indexer, String bindAddress, int port, String authToken) {
        this.indexer = indexer;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("RPC server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/getinfo", new GetInfoHandler());
        server.createContext("/reorg", new ReorgHandler());
        server.createContext("/metrics", new MetricsHandler(this::ensureAuthorized));
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "RPC server listening on http://" + bindAddress + ':' + port()
                + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            executor.shutdownNow();
        }
    }

    /** The bound port, which differs from the configured one when that was 0. */
    public int port() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    final class GetInfoHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!"GET".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use GET for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                BlockProcessor processor = indexer.processor();
                Hash tip = processor.tip();
                ObjectNode resp = mapper.createObjectNode();
                resp.put("coin", indexer.config().coin().displayName());
                resp.put("height", processor.height());
                resp.put("db_height", indexer.db().dbHeight());
                resp.put("tip", tip == null ? null : tip.hex());
                resp.put("tx_count", processor.txCount());
                resp.put("daemon_height", indexer.daemon().cachedHeight());
                resp.put("caught_up", processor.caughtUp().isDone());
                resp.put("mempool_size", indexer.mempool().size());
                resp.put("history_flush_count", indexer.db().history().flushCount());
                status = sendJson(exchange, 200, resp);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "getinfo handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }
    }

    final class ReorgHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!"POST".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use POST for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                String countParam = queryParam(exchange.getRequestURI(), "count");
                int count;
                try {
                    count = countParam == null ? DEFAULT_REORG_COUNT : Integer.parseInt(countParam);
                } catch (NumberFormatException e) {
                    status = sendError(exchange, 400, "invalid_count", "Query parameter 'count' must be an integer");
                    return;
                }
                if (count < 1) {
                    status = sendError(exchange, 400, "invalid_count", "Query parameter 'count' must be positive");
                    return;
                }
                boolean queued;
                try {
                    queued = indexer.forceReorg(count);
                } catch (IllegalArgumentException e) {
                    status = sendError(exchange, 400, "invalid_count", e.getMessage());
                    return;
                }
                if (!queued) {
                    status = sendError(exchange, 409, "not_caught_up", "Still catching up with the daemon");
                    return;
                }
                LOG.info(() -> "forced reorg of " + count + " blocks queued");
                ObjectNode resp = mapper.createObjectNode()
                        .put("queued", true)
                        .put("count", count);
                status = sendJson(exchange, 200, resp);
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            String[] kv = pair.split("=", 2);
            if (kv.length == 2 && name.equals(URLDecoder.decode(kv[0], StandardCharsets.UTF_8))) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
