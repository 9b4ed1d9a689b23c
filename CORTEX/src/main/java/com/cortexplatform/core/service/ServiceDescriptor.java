package com.cortexplatform.core.service;

import java.util.Objects;

/**
 * Registry view of a service. Instances are immutable; the registry swaps them on status change.
 *
 * @param name unique service name, e.g. {@code memory}
 * @param transport how the service is reached
 * @param endpoint network endpoint, {@code null} for in-process services
 * @param status last observed health
 */
public record ServiceDescriptor(String name, TransportType transport, String endpoint, ServiceStatus status) {

    public ServiceDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(transport, "transport");
        status = status != null ? status : ServiceStatus.HEALTHY;
    }

    public static ServiceDescriptor inProcess(String name) {
        return new ServiceDescriptor(name, TransportType.IN_PROCESS, null, ServiceStatus.HEALTHY);
    }

    public ServiceDescriptor withStatus(ServiceStatus newStatus) {
        return new ServiceDescriptor(name, transport, endpoint, newStatus);
    }
}
