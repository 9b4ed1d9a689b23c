package com.cortexplatform.core.service;

/**
 * Raised when a client cannot establish or has lost its connection.
 */
public class ConnectionException extends McpException {

    public ConnectionException(String service, String message) {
        super(service, message);
    }

    public ConnectionException(String service, String message, Throwable cause) {
        super(service, message, cause);
    }
}
