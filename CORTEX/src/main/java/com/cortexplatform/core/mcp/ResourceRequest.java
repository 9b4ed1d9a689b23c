package com.cortexplatform.core.mcp;

import java.util.Map;
import java.util.Objects;

/**
 * Request to read a resource on a named service. The template may be prefixed with the
 * service name, e.g. {@code memory/history/{conversation_id}}.
 */
public record ResourceRequest(String service, String uriTemplate, Map<String, String> parameters) {

    public ResourceRequest {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(uriTemplate, "uriTemplate");
        parameters = parameters != null ? parameters : Map.of();
    }
}
