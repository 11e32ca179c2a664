package io.chainindex.core.storage;

/**
 * The on-disk state is inconsistent or belongs to another coin or version. Never retried;
 * the process is expected to stop.
 */
public class DbException extends RuntimeException {
    public DbException(String message) {
        super(message);
    }

    public DbException(String message, Throwable cause) {
        super(message, cause);
    }
}
