package com.cortexplatform.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the Cortex core.
 */
@Data
@Component
@ConfigurationProperties(prefix = "cortex")
public class CortexProperties {

    private EventBusProperties eventBus = new EventBusProperties();
    private DispatcherProperties dispatcher = new DispatcherProperties();
    private RetryProperties retry = new RetryProperties();
    private HealthProperties health = new HealthProperties();
    private OrchestratorProperties orchestrator = new OrchestratorProperties();
    private GeneratorProperties generator = new GeneratorProperties();

    @Data
    public static class EventBusProperties {
        private int queueCapacity = 256;
    }

    @Data
    public static class DispatcherProperties {
        private Duration defaultDeadline = Duration.ofSeconds(30);
    }

    @Data
    public static class RetryProperties {
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofMillis(100);
        private double multiplier = 2.0;
        private double jitter = 0.2; // +/- 20% of each backoff interval
    }

    @Data
    public static class HealthProperties {
        private boolean enabled = true;
        private Duration probeInterval = Duration.ofSeconds(30);
        private Duration probeTimeout = Duration.ofSeconds(5);
        private int unreachableThreshold = 3;
    }

    @Data
    public static class OrchestratorProperties {
        private int historyLimit = 20;
        private int contextLimit = 5;
        private boolean storeInput = true;
        private boolean streaming = true;
        private int maxQueuedInputs = 100;
        private Duration generationTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class GeneratorProperties {
        private int chunkSize = 50;
        private Duration chunkDelay = Duration.ZERO;
    }
}
