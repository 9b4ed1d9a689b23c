package com.cortexplatform.core.service;

import com.cortexplatform.core.config.CortexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Periodically probes every registered service and feeds the outcome to the registry.
 */
@Component
@Slf4j
public class ServiceHealthMonitor {

    private final ServiceRegistry registry;
    private final CortexProperties.HealthProperties config;

    public ServiceHealthMonitor(ServiceRegistry registry, CortexProperties properties) {
        this.registry = registry;
        this.config = properties.getHealth();
    }

    @Scheduled(fixedDelayString = "${cortex.health.probe-interval:30s}",
            initialDelayString = "${cortex.health.probe-interval:30s}")
    public void scheduledProbe() {
        if (!config.isEnabled()) {
            return;
        }
        probeAll().subscribe(
                results -> log.debug("Health probe results: {}", results),
                e -> log.error("Health probe run failed", e));
    }

    /**
     * Probe all registered services once.
     *
     * @return resulting status per service name
     */
    public Mono<Map<String, ServiceStatus>> probeAll() {
        return Flux.fromIterable(registry.clients())
                .flatMap(this::probe)
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private Mono<Map.Entry<String, ServiceStatus>> probe(ServiceClient client) {
        String name = client.getName();
        Duration timeout = config.getProbeTimeout();
        return client.probe()
                .timeout(timeout)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Health probe of {} failed: {}", name, e.toString());
                    return Mono.just(false);
                })
                .flatMap(healthy -> Mono.justOrEmpty(registry.recordProbe(name, healthy)))
                .map(status -> Map.entry(name, status));
    }
}
