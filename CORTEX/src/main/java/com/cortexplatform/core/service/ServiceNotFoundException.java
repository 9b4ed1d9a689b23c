package com.cortexplatform.core.service;

public class ServiceNotFoundException extends McpException {

    public ServiceNotFoundException(String service) {
        super(service, "Service not registered: " + service);
    }
}
