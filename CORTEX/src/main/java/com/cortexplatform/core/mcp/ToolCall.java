package com.cortexplatform.core.mcp;

import java.util.Map;
import java.util.Objects;

/**
 * Request to invoke a tool on a named service.
 */
public record ToolCall(String service, String name, Map<String, Object> arguments) {

    public ToolCall {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(name, "name");
        arguments = arguments != null ? arguments : Map.of();
    }
}
