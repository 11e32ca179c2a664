package io.chainindex.core.storage;

/** Wraps RocksDB and filesystem failures. */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
