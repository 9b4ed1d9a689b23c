package com.cortexplatform.core.service;

/**
 * Raised when no declared resource matches a request, or the addressed record does not exist.
 */
public class ResourceNotFoundException extends McpException {

    private final String uri;

    public ResourceNotFoundException(String service, String uri) {
        super(service, "Resource not found on service '" + service + "': " + uri);
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }
}
