package io.chainindex.core.node;

/** Blocks from the daemon cannot be applied to or removed from the index. */
public class ChainException extends RuntimeException {
    public ChainException(String message) {
        super(message);
    }
}
