package com.cortexplatform.core.service;

import com.cortexplatform.core.config.CortexProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of service clients and their descriptors.
 *
 * <p>Lookups are lock-free. Registration changes and health updates are serialized, and the
 * registry is the only place a descriptor's status changes.
 */
@Component
@Slf4j
public class ServiceRegistry {

    private record Registration(ServiceDescriptor descriptor, ServiceClient client, int consecutiveFailures) {

        Registration withHealth(ServiceStatus status, int failures) {
            return new Registration(descriptor.withStatus(status), client, failures);
        }
    }

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private final Object lock = new Object();
    private final int unreachableThreshold;

    @Autowired
    public ServiceRegistry(List<ServiceClient> clients, CortexProperties properties) {
        this(properties.getHealth().getUnreachableThreshold());
        for (ServiceClient client : clients) {
            register(client.describe(), client);
        }
    }

    public ServiceRegistry(int unreachableThreshold) {
        if (unreachableThreshold < 1) {
            throw new IllegalArgumentException("Unreachable threshold must be at least 1");
        }
        this.unreachableThreshold = unreachableThreshold;
    }

    /**
     * Register a client, replacing and closing any client registered under the same name.
     *
     * @param descriptor the service descriptor
     * @param client the client serving it
     */
    public void register(ServiceDescriptor descriptor, ServiceClient client) {
        if (!descriptor.name().equals(client.getName())) {
            throw new IllegalArgumentException("Descriptor name '" + descriptor.name()
                    + "' does not match client name '" + client.getName() + "'");
        }
        Registration previous;
        synchronized (lock) {
            previous = registrations.put(descriptor.name(), new Registration(descriptor, client, 0));
        }
        if (previous != null && previous.client() != client) {
            log.info("Replaced service registration: {}", descriptor.name());
            previous.client().close();
        } else {
            log.info("Registered service: {} ({})", descriptor.name(), descriptor.transport());
        }
    }

    /**
     * Remove a registration and close its client.
     *
     * @param name the service name
     * @return true if a registration was removed
     */
    public boolean unregister(String name) {
        Registration removed;
        synchronized (lock) {
            removed = registrations.remove(name);
        }
        if (removed == null) {
            return false;
        }
        removed.client().close();
        log.info("Unregistered service: {}", name);
        return true;
    }

    /**
     * Get the client registered under a name.
     *
     * @throws ServiceNotFoundException if none is registered
     */
    public ServiceClient resolve(String name) {
        Registration registration = registrations.get(name);
        if (registration == null) {
            throw new ServiceNotFoundException(name);
        }
        return registration.client();
    }

    public Optional<ServiceDescriptor> descriptor(String name) {
        return Optional.ofNullable(registrations.get(name)).map(Registration::descriptor);
    }

    /**
     * All descriptors, ordered by service name.
     */
    public List<ServiceDescriptor> descriptors() {
        List<ServiceDescriptor> result = new ArrayList<>();
        registrations.values().forEach(r -> result.add(r.descriptor()));
        result.sort(Comparator.comparing(ServiceDescriptor::name));
        return result;
    }

    public List<ServiceClient> clients() {
        return registrations.values().stream()
                .sorted(Comparator.comparing(r -> r.descriptor().name()))
                .map(Registration::client)
                .toList();
    }

    /**
     * Set a service's status explicitly. Resets the consecutive failure count when healthy.
     *
     * @return false if the service is not registered
     */
    public boolean updateStatus(String name, ServiceStatus status) {
        synchronized (lock) {
            Registration current = registrations.get(name);
            if (current == null) {
                return false;
            }
            int failures = status == ServiceStatus.HEALTHY ? 0 : current.consecutiveFailures();
            apply(name, current, status, failures);
            return true;
        }
    }

    /**
     * Record the outcome of a health probe. A success marks the service healthy; consecutive
     * failures mark it degraded, and unreachable once the threshold is reached.
     *
     * @return the resulting status, or empty if the service is not registered
     */
    public Optional<ServiceStatus> recordProbe(String name, boolean healthy) {
        synchronized (lock) {
            Registration current = registrations.get(name);
            if (current == null) {
                return Optional.empty();
            }
            int failures = healthy ? 0 : current.consecutiveFailures() + 1;
            ServiceStatus status;
            if (healthy) {
                status = ServiceStatus.HEALTHY;
            } else if (failures >= unreachableThreshold) {
                status = ServiceStatus.UNREACHABLE;
            } else {
                status = ServiceStatus.DEGRADED;
            }
            apply(name, current, status, failures);
            return Optional.of(status);
        }
    }

    public int consecutiveFailures(String name) {
        Registration registration = registrations.get(name);
        return registration != null ? registration.consecutiveFailures() : 0;
    }

    private void apply(String name, Registration current, ServiceStatus status, int failures) {
        ServiceStatus previous = current.descriptor().status();
        registrations.put(name, current.withHealth(status, failures));
        if (previous != status) {
            if (status == ServiceStatus.HEALTHY) {
                log.info("Service {} status {} -> {}", name, previous, status);
            } else {
                log.warn("Service {} status {} -> {} ({} consecutive failures)", name, previous, status, failures);
            }
        }
    }

    /**
     * Close every registered client. Registrations are kept.
     */
    @PreDestroy
    public void closeAll() {
        for (Registration registration : registrations.values()) {
            try {
                registration.client().close();
            } catch (RuntimeException e) {
                log.warn("Error closing service client {}: {}", registration.descriptor().name(), e.getMessage());
            }
        }
    }
}
