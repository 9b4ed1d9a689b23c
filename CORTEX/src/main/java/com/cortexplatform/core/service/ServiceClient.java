package com.cortexplatform.core.service;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Uniform facade for invoking tools and reading resources of one service.
 *
 * <p>Failures are signalled as {@link McpException} subtypes. Transient remote failures are
 * retried inside the client; everything else is returned to the caller as is.
 */
public interface ServiceClient {

    /**
     * Unique service name.
     */
    String getName();

    /**
     * Descriptor registered for this client.
     */
    ServiceDescriptor describe();

    /**
     * Establish the connection. Calling it again on a connected client is a no-op.
     */
    Mono<Void> connect();

    boolean isConnected();

    /**
     * Invoke a tool.
     *
     * @param toolName declared tool name
     * @param arguments tool arguments, validated against the tool schema
     * @param deadline upper bound for the whole call, retries included
     * @return the tool result
     */
    Mono<Map<String, Object>> callTool(String toolName, Map<String, Object> arguments, Duration deadline);

    /**
     * Read a resource.
     *
     * @param uriTemplate declared resource template, or a concrete URI matching one
     * @param parameters values for the template variables
     * @param deadline upper bound for the whole read, retries included
     * @return the resource content
     */
    Mono<Map<String, Object>> readResource(String uriTemplate, Map<String, String> parameters, Duration deadline);

    /**
     * Health probe. Emits {@code true} when the service answers as healthy.
     */
    Mono<Boolean> probe();

    List<ToolSpec> listTools();

    List<ResourceSpec> listResources();

    /**
     * Release the connection. Idempotent.
     */
    void close();
}
