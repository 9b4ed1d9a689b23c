package com.cortexplatform.core.health;

import com.cortexplatform.core.event.EventBus;
import com.cortexplatform.core.orchestration.ResponseOrchestrator;
import com.cortexplatform.core.service.ServiceDescriptor;
import com.cortexplatform.core.service.ServiceRegistry;
import com.cortexplatform.core.service.ServiceStatus;
import com.cortexplatform.core.stream.StreamBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for Cortex Core.
 * Reports the event bus state, each registered service's status and runtime counts.
 */
@Component
@Slf4j
public class CortexHealthIndicator implements ReactiveHealthIndicator {

    private final EventBus eventBus;
    private final ServiceRegistry serviceRegistry;
    private final ResponseOrchestrator orchestrator;
    private final StreamBroadcaster broadcaster;

    public CortexHealthIndicator(
            EventBus eventBus,
            ServiceRegistry serviceRegistry,
            ResponseOrchestrator orchestrator,
            StreamBroadcaster broadcaster) {
        this.eventBus = eventBus;
        this.serviceRegistry = serviceRegistry;
        this.orchestrator = orchestrator;
        this.broadcaster = broadcaster;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::buildHealth)
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Health buildHealth() {
        List<ServiceDescriptor> descriptors = serviceRegistry.descriptors();
        Map<String, String> services = new LinkedHashMap<>();
        boolean anyUnreachable = false;
        boolean anyDegraded = false;
        for (ServiceDescriptor descriptor : descriptors) {
            services.put(descriptor.name(), descriptor.status().name().toLowerCase(Locale.ROOT));
            anyUnreachable |= descriptor.status() == ServiceStatus.UNREACHABLE;
            anyDegraded |= descriptor.status() == ServiceStatus.DEGRADED;
        }

        Health.Builder builder;
        if (eventBus.isClosed()) {
            builder = Health.outOfService();
        } else if (anyUnreachable) {
            builder = Health.down();
        } else if (anyDegraded) {
            builder = Health.status("DEGRADED");
        } else {
            builder = Health.up();
        }

        return builder
                .withDetail("eventBus", eventBus.isClosed() ? "CLOSED" : "OPEN")
                .withDetail("subscriptions", eventBus.subscriptionCount())
                .withDetail("services", services)
                .withDetail("activeOrchestrations", orchestrator.activeOrchestrations())
                .withDetail("activeStreams", broadcaster.activeStreams())
                .build();
    }
}
