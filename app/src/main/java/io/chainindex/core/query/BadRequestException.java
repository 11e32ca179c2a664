package io.chainindex.core.query;

/** A client request with malformed or out-of-range arguments. */
public class BadRequestException extends RuntimeException {
    public BadRequestException(String message) {
        super(message);
    }
}
