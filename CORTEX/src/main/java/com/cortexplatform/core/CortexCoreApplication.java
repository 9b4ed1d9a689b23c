package com.cortexplatform.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cortex Core - event routing and service orchestration.
 *
 * <p>Cortex Core provides:
 * <ul>
 *   <li>EventBus - typed, per-conversation ordered publish/subscribe</li>
 *   <li>MCP dispatch - tool calls and resource reads against registered services</li>
 *   <li>Memory and Cognition services - in-process conversation storage and context</li>
 *   <li>ResponseOrchestrator - input to streamed reply, one run per conversation</li>
 *   <li>StreamBroadcaster - output events to Server-Sent Event clients</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class CortexCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(CortexCoreApplication.class, args);
    }
}
