package io.chainindex.core.daemon;

/** The node is still loading its block index (RPC error -28); retried with backoff. */
public class WarmingUpException extends DaemonException {
    public WarmingUpException() {
        super("daemon is warming up");
    }
}
