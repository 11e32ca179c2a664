package io.chainindex.core.daemon;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainindex.core.protocol.Hashes;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON-RPC client for a bitcoind-compatible node.
 *
 * <p>At most {@value #MAX_WORKQUEUE} requests are in flight at once. Connection problems,
 * timeouts, warm-up and a full work queue are retried with exponential backoff; once the
 * backoff reaches its ceiling the client moves on to the next configured URL.
 */
public final class DaemonClient implements ChainSource {
    private static final Logger LOG = Logger.getLogger(DaemonClient.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final int WARMING_UP = -28;
    public static final int METHOD_NOT_FOUND = -32601;
    static final int MAX_WORKQUEUE = 10;
    static final long INIT_RETRY_MILLIS = 250;
    static final long MAX_RETRY_MILLIS = 4000;

    private record Endpoint(URI uri, String authorization) {}

    private final List<Endpoint> endpoints;
    private final HttpClient http;
    private final Semaphore workQueue = new Semaphore(MAX_WORKQUEUE);
    private final AtomicLong ids = new AtomicLong();
    private final Map<String, Boolean> availableRpcs = new ConcurrentHashMap<>();
    private final long initRetryMillis;
    private final long maxRetryMillis;
    private volatile int urlIndex;
    private volatile int height = -1;

    public DaemonClient(List<String> urls) {
        this(urls, INIT_RETRY_MILLIS, MAX_RETRY_MILLIS);
    }

    DaemonClient(List<String> urls, long initRetryMillis, long maxRetryMillis) {
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("at least one daemon URL is required");
        }
        List<Endpoint> parsed = new ArrayList<>();
        for (String url : urls) {
            parsed.add(parseUrl(url));
        }
        this.endpoints = List.copyOf(parsed);
        this.initRetryMillis = initRetryMillis;
        this.maxRetryMillis = maxRetryMillis;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    private static Endpoint parseUrl(String url) {
        try {
            URI uri = new URI(url.trim());
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("daemon URL has no host: " + url);
            }
            String auth = null;
            if (uri.getRawUserInfo() != null) {
                String userInfo = uri.getUserInfo();
                auth = "Basic " + Base64.getEncoder().encodeToString(userInfo.getBytes(StandardCharsets.UTF_8));
            }
            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            URI clean = new URI(uri.getScheme() == null ? "http" : uri.getScheme(), null,
                    uri.getHost(), uri.getPort(), path, null, null);
            return new Endpoint(clean, auth);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid daemon URL: " + url, e);
        }
    }

    /** Current URL without credentials, for logging. */
    public String loggedUrl() {
        return endpoints.get(urlIndex).uri().toString();
    }

    boolean failover() {
        if (endpoints.size() > 1) {
            urlIndex = (urlIndex + 1) % endpoints.size();
            LOG.info(() -> "failing over to " + loggedUrl());
            return true;
        }
        return false;
    }

    // ---------------- transport ----------------

    private JsonNode sendData(String body) throws IOException, InterruptedException {
        Endpoint endpoint = endpoints.get(urlIndex);
        HttpRequest.Builder req = HttpRequest.newBuilder(endpoint.uri())
                .timeout(Duration.ofSeconds(60))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (endpoint.authorization() != null) {
            req.header("Authorization", endpoint.authorization());
        }
        workQueue.acquire();
        try {
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            String kind = resp.headers().firstValue("Content-Type").orElse("");
            if (kind.startsWith("application/json")) {
                return JSON.readTree(resp.body());
            }
            String text = resp.body() == null ? "" : resp.body().strip();
            if (text.contains("Work queue depth exceeded")) {
                throw new WorkQueueFullException();
            }
            throw new ServiceRefusedException(text.isEmpty() ? "HTTP " + resp.statusCode() : text);
        } finally {
            workQueue.release();
        }
    }

    private <T> T send(Object payload, Function<JsonNode, T> processor) {
        String body;
        try {
            body = JSON.writeValueAsString(payload);
        } catch (IOException e) {
            throw new IllegalArgumentException("cannot serialize request", e);
        }
        long retry = initRetryMillis;
        long lastErrorLog = 0;
        String onGoodMessage = null;
        while (true) {
            String error;
            try {
                T result = processor.apply(sendData(body));
                if (onGoodMessage != null) {
                    LOG.info(onGoodMessage);
                }
                return result;
            } catch (HttpTimeoutException e) {
                error = "timeout error";
            } catch (ConnectException e) {
                error = "connection problem - check your daemon is running";
                onGoodMessage = "connection restored";
            } catch (IOException e) {
                error = "connection problem: " + e.getMessage();
                onGoodMessage = "connection restored";
            } catch (ServiceRefusedException e) {
                error = "daemon service refused: " + e.getMessage();
                onGoodMessage = "running normally";
            } catch (WarmingUpException e) {
                error = "starting up checking blocks";
                onGoodMessage = "running normally";
            } catch (WorkQueueFullException e) {
                error = "work queue full";
                onGoodMessage = "running normally";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                CancellationException cancelled = new CancellationException("daemon request interrupted");
                cancelled.initCause(e);
                throw cancelled;
            }

            long now = System.currentTimeMillis();
            if (now - lastErrorLog > 60_000) {
                lastErrorLog = now;
                LOG.log(Level.SEVERE, error + ".  Retrying occasionally...");
            }
            if (retry == maxRetryMillis && failover()) {
                retry = 0;
            }
            try {
                Thread.sleep(retry);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                CancellationException cancelled = new CancellationException("daemon retry interrupted");
                cancelled.initCause(e);
                throw cancelled;
            }
            retry = Math.max(Math.min(maxRetryMillis, retry * 2), initRetryMillis);
        }
    }

    JsonNode sendSingle(String method, Object... params) {
        ObjectNode payload = JSON.createObjectNode();
        payload.put("method", method);
        payload.put("id", ids.getAndIncrement());
        if (params.length > 0) {
            payload.set("params", JSON.valueToTree(params));
        }
        return send(payload, result -> {
            JsonNode err = result.get("error");
            if (err == null || err.isNull()) {
                return result.get("result");
            }
            if (err.path("code").asInt() == WARMING_UP) {
                throw new WarmingUpException();
            }
            throw new DaemonException(err);
        });
    }

    List<JsonNode> sendVector(String method, List<Object[]> paramsList, boolean replaceErrs) {
        if (paramsList.isEmpty()) {
            return List.of();
        }
        ArrayNode payload = JSON.createArrayNode();
        for (Object[] params : paramsList) {
            payload.addObject()
                    .put("method", method)
                    .put("id", ids.getAndIncrement())
                    .set("params", JSON.valueToTree(params));
        }
        return send(payload, result -> {
            ArrayNode errs = JSON.createArrayNode();
            List<JsonNode> results = new ArrayList<>(result.size());
            for (JsonNode item : result) {
                JsonNode err = item.get("error");
                if (err != null && !err.isNull()) {
                    errs.add(err);
                }
                results.add(item.get("result"));
            }
            for (JsonNode err : errs) {
                if (err.path("code").asInt() == WARMING_UP) {
                    throw new WarmingUpException();
                }
            }
            if (errs.isEmpty() || replaceErrs) {
                return results;
            }
            throw new DaemonException(errs);
        });
    }

    boolean isRpcAvailable(String method) {
        Boolean known = availableRpcs.get(method);
        if (known != null) {
            return known;
        }
        boolean available = true;
        try {
            sendSingle(method);
        } catch (DaemonException e) {
            available = e.code() != METHOD_NOT_FOUND;
        }
        availableRpcs.put(method, available);
        return available;
    }

    // ---------------- ChainSource ----------------

    @Override
    public int height() {
        height = sendSingle("getblockcount").asInt();
        return height;
    }

    @Override
    public int cachedHeight() {
        return height;
    }

    @Override
    public List<String> blockHexHashes(int first, int count) {
        List<Object[]> params = new ArrayList<>(count);
        for (int h = first; h < first + count; h++) {
            params.add(new Object[] {h});
        }
        List<String> out = new ArrayList<>(count);
        for (JsonNode n : sendVector("getblockhash", params, false)) {
            out.add(n.asText());
        }
        return out;
    }

    @Override
    public List<byte[]> rawBlocks(List<String> hexHashes) {
        List<Object[]> params = new ArrayList<>(hexHashes.size());
        for (String h : hexHashes) {
            params.add(new Object[] {h, false});
        }
        List<byte[]> out = new ArrayList<>(hexHashes.size());
        for (JsonNode n : sendVector("getblock", params, false)) {
            out.add(Hashes.fromHex(n.asText()));
        }
        return out;
    }

    @Override
    public List<String> mempoolHashes() {
        List<String> out = new ArrayList<>();
        sendSingle("getrawmempool").forEach(n -> out.add(n.asText()));
        return out;
    }

    @Override
    public List<byte[]> rawTransactions(List<String> hexHashes, boolean replaceErrs) {
        List<Object[]> params = new ArrayList<>(hexHashes.size());
        for (String h : hexHashes) {
            params.add(new Object[] {h, 0});
        }
        List<byte[]> out = new ArrayList<>(hexHashes.size());
        for (JsonNode n : sendVector("getrawtransaction", params, replaceErrs)) {
            out.add(n == null || n.isNull() ? null : Hashes.fromHex(n.asText()));
        }
        return out;
    }

    @Override
    public String broadcastTransaction(String rawTxHex) {
        return sendSingle("sendrawtransaction", rawTxHex).asText();
    }

    @Override
    public double estimateFee(int blocks) {
        if (isRpcAvailable("estimatesmartfee")) {
            JsonNode estimate = sendSingle("estimatesmartfee", blocks);
            return estimate.has("feerate") ? estimate.get("feerate").asDouble() : -1;
        }
        return sendSingle("estimatefee", blocks).asDouble();
    }

    @Override
    public double relayFee() {
        return sendSingle("getnetworkinfo").path("relayfee").asDouble();
    }
}
