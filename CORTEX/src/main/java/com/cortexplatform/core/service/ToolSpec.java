package com.cortexplatform.core.service;

import com.cortexplatform.core.service.schema.ToolSchema;

/**
 * A tool declared by a service: its name, a short description and its argument schema.
 */
public record ToolSpec(String name, String description, ToolSchema schema) {
}
