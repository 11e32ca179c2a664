package io.chainindex.core.rpc;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.chainindex.core.metrics.HttpMetrics;
import io.chainindex.core.metrics.IndexMetrics;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/** Serves the Micrometer registry as plain text. */
public final class MetricsHandler implements HttpHandler {

    /** Returns -1 if the exchange may proceed, otherwise the status it was answered with. */
    @FunctionalInterface
    interface Authorizer {
        int check(HttpExchange exchange) throws IOException;
    }

    private final Authorizer authorizer;

    MetricsHandler(Authorizer authorizer) {
        this.authorizer = authorizer;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getHttpContext().getPath();
        var sample = HttpMetrics.start();
        int status = 500;
        try {
            if (!"GET".equalsIgnoreCase(method)) {
                status = sendPlain(exchange, 405, "Method Not Allowed");
                return;
            }
            status = authorizer.check(exchange);
            if (status != -1) {
                return;
            }
            byte[] out = IndexMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
            status = 200;
        } finally {
            HttpMetrics.stop(sample, method, path, status);
            exchange.close();
        }
    }

    private int sendPlain(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        return status;
    }
}
