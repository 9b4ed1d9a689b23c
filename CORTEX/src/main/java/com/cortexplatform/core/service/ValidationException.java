package com.cortexplatform.core.service;

import java.util.List;

/**
 * Raised when tool arguments or resource parameters do not satisfy their declaration.
 */
public class ValidationException extends McpException {

    private final List<String> violations;

    public ValidationException(String service, List<String> violations) {
        super(service, "Invalid arguments: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String service, String violation) {
        this(service, List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
