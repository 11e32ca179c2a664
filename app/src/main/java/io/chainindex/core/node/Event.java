package io.chainindex.core.node;

/** A resettable flag threads can wait on. */
final class Event {
    private boolean set;

    synchronized void set() {
        set = true;
        notifyAll();
    }

    synchronized void clear() {
        set = false;
    }

    synchronized boolean isSet() {
        return set;
    }

    /** Waits up to {@code timeoutMillis} for the flag; returns whether it is set. */
    synchronized boolean await(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!set) {
            long left = deadline - System.currentTimeMillis();
            if (left <= 0) {
                return false;
            }
            wait(left);
        }
        return true;
    }
}
