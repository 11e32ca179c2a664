package io.chainindex.core.daemon;

import com.fasterxml.jackson.databind.JsonNode;

/** The node answered with a JSON-RPC error, e.g. a rejected transaction. */
public class DaemonException extends RuntimeException {
    private final transient JsonNode error;

    public DaemonException(String message) {
        super(message);
        this.error = null;
    }

    public DaemonException(JsonNode error) {
        super(error == null ? "daemon error" : error.toString());
        this.error = error;
    }

    /** The JSON-RPC error object, or an array of them for batched calls. */
    public JsonNode error() {
        return error;
    }

    /** The error code of a single error object, or 0. */
    public int code() {
        return error != null && error.has("code") ? error.get("code").asInt() : 0;
    }
}
