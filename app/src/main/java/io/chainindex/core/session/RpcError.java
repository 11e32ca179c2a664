package io.chainindex.core.session;

/** A JSON-RPC error to be returned to the client as-is. */
public class RpcError extends RuntimeException {
    public static final int BAD_REQUEST = 1;
    public static final int DAEMON_ERROR = 2;
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INTERNAL_ERROR = -32603;

    private final int code;

    public RpcError(int code, String message) {
        super(message);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
