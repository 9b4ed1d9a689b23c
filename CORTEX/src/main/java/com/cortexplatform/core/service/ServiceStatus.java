package com.cortexplatform.core.service;

/**
 * Health of a registered service as last observed by the registry.
 */
public enum ServiceStatus {
    HEALTHY,
    DEGRADED,
    UNREACHABLE
}
