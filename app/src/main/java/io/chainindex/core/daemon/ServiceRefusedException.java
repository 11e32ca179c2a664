package io.chainindex.core.daemon;

/** The node answered with something other than JSON, e.g. an HTTP 401 page. */
public class ServiceRefusedException extends DaemonException {
    public ServiceRefusedException(String message) {
        super(message);
    }
}
