package com.cortexplatform.core.service;

/**
 * Base class for failures raised by a {@link ServiceClient}.
 */
public class McpException extends RuntimeException {

    private final String service;

    public McpException(String service, String message) {
        super(message);
        this.service = service;
    }

    public McpException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    /**
     * Name of the service the failure belongs to.
     */
    public String getService() {
        return service;
    }
}
