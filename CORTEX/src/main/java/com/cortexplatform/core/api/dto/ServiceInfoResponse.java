package com.cortexplatform.core.api.dto;

import com.cortexplatform.core.mcp.ServiceSummary;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A registered service as exposed by the services endpoint.
 */
public record ServiceInfoResponse(
        String name,
        String transport,
        String endpoint,
        String status,
        List<ToolInfo> tools,
        List<ResourceInfo> resources
) {

    public record ToolInfo(String name, String description, Map<String, Object> inputSchema) {
    }

    public record ResourceInfo(String uriTemplate, String description) {
    }

    public static ServiceInfoResponse from(ServiceSummary summary) {
        return new ServiceInfoResponse(
                summary.descriptor().name(),
                summary.descriptor().transport().name().toLowerCase(Locale.ROOT),
                summary.descriptor().endpoint(),
                summary.descriptor().status().name().toLowerCase(Locale.ROOT),
                summary.tools().stream()
                        .map(t -> new ToolInfo(t.name(), t.description(), t.schema().toJsonSchema()))
                        .toList(),
                summary.resources().stream()
                        .map(r -> new ResourceInfo(r.uriTemplate(), r.description()))
                        .toList());
    }
}
