package io.chainindex.core.daemon;

/** The node's HTTP work queue is full; retried with backoff. */
public class WorkQueueFullException extends DaemonException {
    public WorkQueueFullException() {
        super("work queue depth exceeded");
    }
}
