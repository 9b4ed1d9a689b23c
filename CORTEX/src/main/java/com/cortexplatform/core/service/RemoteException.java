package com.cortexplatform.core.service;

import java.time.Duration;

/**
 * Failure reported by, or while waiting on, the remote side of a call.
 *
 * <p>Transient failures are eligible for retry. Timeouts mean the caller's deadline expired.
 */
public class RemoteException extends McpException {

    private final boolean transientFailure;
    private final boolean timeout;

    public RemoteException(String service, String message, boolean transientFailure, boolean timeout, Throwable cause) {
        super(service, message, cause);
        this.transientFailure = transientFailure;
        this.timeout = timeout;
    }

    public static RemoteException transientFailure(String service, String message) {
        return new RemoteException(service, message, true, false, null);
    }

    public static RemoteException permanent(String service, String message, Throwable cause) {
        return new RemoteException(service, message, false, false, cause);
    }

    public static RemoteException timeout(String service, String operation, Duration deadline) {
        return new RemoteException(service,
                operation + " on '" + service + "' exceeded deadline of " + deadline.toMillis() + "ms",
                false, true, null);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
