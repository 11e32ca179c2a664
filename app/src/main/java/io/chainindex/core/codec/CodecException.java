package io.chainindex.core.codec;

/** Raised when block or header bytes do not match what the configured coin expects. */
public class CodecException extends IllegalArgumentException {
    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
