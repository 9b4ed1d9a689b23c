package com.cortexplatform.core.service;

/**
 * How a service client reaches its service.
 */
public enum TransportType {
    IN_PROCESS,
    NETWORK
}
