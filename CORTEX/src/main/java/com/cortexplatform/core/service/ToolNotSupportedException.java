package com.cortexplatform.core.service;

public class ToolNotSupportedException extends McpException {

    private final String toolName;

    public ToolNotSupportedException(String service, String toolName) {
        super(service, "Tool '" + toolName + "' is not supported by service '" + service + "'");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
