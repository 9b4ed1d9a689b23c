package com.cortexplatform.core.mcp;

import com.cortexplatform.core.service.ResourceSpec;
import com.cortexplatform.core.service.ServiceDescriptor;
import com.cortexplatform.core.service.ToolSpec;

import java.util.List;

/**
 * A registered service with the tools and resources it declares.
 */
public record ServiceSummary(ServiceDescriptor descriptor, List<ToolSpec> tools, List<ResourceSpec> resources) {
}
