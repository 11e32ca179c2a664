package io.chainindex.core.protocol;

/** Thrown when a read runs past the end of the buffer being deserialized. */
public class LengthException extends IllegalArgumentException {
    public LengthException(String message) {
        super(message);
    }
}
