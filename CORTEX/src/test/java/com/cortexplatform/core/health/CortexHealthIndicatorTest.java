package com.cortexplatform.core.health;

import com.cortexplatform.core.config.CortexProperties;
import com.cortexplatform.core.event.EventBus;
import com.cortexplatform.core.mcp.McpDispatcher;
import com.cortexplatform.core.orchestration.EchoResponseGenerator;
import com.cortexplatform.core.orchestration.ResponseOrchestrator;
import com.cortexplatform.core.service.ServiceRegistry;
import com.cortexplatform.core.service.ServiceStatus;
import com.cortexplatform.core.stream.StreamBroadcaster;
import com.cortexplatform.core.support.ScriptedServiceClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CortexHealthIndicatorTest {

    private EventBus eventBus;
    private ServiceRegistry registry;
    private StreamBroadcaster broadcaster;
    private CortexHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        eventBus = new EventBus(16, meterRegistry);
        registry = new ServiceRegistry(3);
        ScriptedServiceClient memory = new ScriptedServiceClient("memory");
        ScriptedServiceClient cognition = new ScriptedServiceClient("cognition");
        registry.register(memory.describe(), memory);
        registry.register(cognition.describe(), cognition);

        McpDispatcher dispatcher = new McpDispatcher(registry, Duration.ofSeconds(1), meterRegistry);
        ResponseOrchestrator orchestrator = new ResponseOrchestrator(eventBus, dispatcher,
                new EchoResponseGenerator(50, Duration.ZERO), new CortexProperties().getOrchestrator(), meterRegistry);
        broadcaster = new StreamBroadcaster(eventBus);
        indicator = new CortexHealthIndicator(eventBus, registry, orchestrator, broadcaster);
    }

    @Test
    @DisplayName("should be up with details when every service is healthy")
    void up() {
        broadcaster.attach("u1", "c1");

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("eventBus", "OPEN")
                            .containsEntry("subscriptions", 1)
                            .containsEntry("activeOrchestrations", 0)
                            .containsEntry("activeStreams", 1);
                    assertThat(health.getDetails().get("services"))
                            .isEqualTo(Map.of("cognition", "healthy", "memory", "healthy"));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should be degraded when a service is degraded")
    void degraded() {
        registry.recordProbe("memory", false);

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED"))
                .verifyComplete();
    }

    @Test
    @DisplayName("should be down when a service is unreachable")
    void down() {
        registry.updateStatus("cognition", ServiceStatus.UNREACHABLE);

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }

    @Test
    @DisplayName("should be out of service once the event bus is closed")
    void outOfService() {
        eventBus.close();

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE))
                .verifyComplete();
    }
}
