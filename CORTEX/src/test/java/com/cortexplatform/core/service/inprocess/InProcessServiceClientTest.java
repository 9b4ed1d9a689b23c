package com.cortexplatform.core.service.inprocess;

import com.cortexplatform.core.service.ConnectionException;
import com.cortexplatform.core.service.RemoteException;
import com.cortexplatform.core.service.ResourceNotFoundException;
import com.cortexplatform.core.service.ToolNotSupportedException;
import com.cortexplatform.core.service.ValidationException;
import com.cortexplatform.core.service.schema.ToolSchema;
import com.cortexplatform.core.service.schema.ToolSchema.JsonType;
import com.cortexplatform.core.support.ScriptedServiceClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InProcessServiceClientTest {

    private static final Duration DEADLINE = Duration.ofSeconds(2);
    private static final ToolSchema ECHO_SCHEMA = ToolSchema.builder()
            .required("text", JsonType.STRING, "Text to echo")
            .build();

    private AtomicInteger flakyFailures;
    private ScriptedServiceClient client;

    @BeforeEach
    void setUp() {
        flakyFailures = new AtomicInteger();
        client = new ScriptedServiceClient("scripted")
                .tool("echo", ECHO_SCHEMA, args -> Mono.just(Map.of("text", args.get("text"))))
                .tool("flaky", ToolSchema.empty(), args -> flakyFailures.getAndDecrement() > 0
                        ? Mono.error(RemoteException.transientFailure("scripted", "busy"))
                        : Mono.just(Map.of("status", "ok")))
                .tool("broken", ToolSchema.empty(), args -> Mono.error(new IllegalStateException("boom")))
                .tool("slow", ToolSchema.empty(), args -> Mono.never())
                .resource("item/{id}", params -> Mono.just(Map.of("id", params.get("id"))));
    }

    @Nested
    @DisplayName("Tool calls")
    class ToolCallTests {

        @Test
        @DisplayName("should connect lazily and return the tool result")
        void callsTool() {
            StepVerifier.create(client.callTool("echo", Map.of("text", "hi"), DEADLINE))
                    .expectNext(Map.of("text", "hi"))
                    .verifyComplete();

            assertThat(client.isConnected()).isTrue();
        }

        @Test
        @DisplayName("should reject an undeclared tool")
        void unknownTool() {
            StepVerifier.create(client.callTool("missing", Map.of(), DEADLINE))
                    .expectError(ToolNotSupportedException.class)
                    .verify();
        }

        @Test
        @DisplayName("should fail validation without invoking the tool")
        void invalidArguments() {
            StepVerifier.create(client.callTool("echo", Map.of("text", 7), DEADLINE))
                    .expectErrorSatisfies(e -> assertThat(((ValidationException) e).getViolations())
                            .containsExactly("property 'text' must be of type string"))
                    .verify();

            assertThat(client.invocations()).isZero();
        }

        @Test
        @DisplayName("should wrap unexpected handler failures as permanent remote errors")
        void wrapsUnexpectedFailure() {
            StepVerifier.create(client.callTool("broken", Map.of(), DEADLINE))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(RemoteException.class).hasMessageContaining("boom");
                        assertThat(((RemoteException) e).isTransient()).isFalse();
                    })
                    .verify();

            assertThat(client.invocations()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Retry")
    class RetryTests {

        @Test
        @DisplayName("should retry transient failures until success")
        void retriesTransientFailures() {
            flakyFailures.set(2);

            StepVerifier.create(client.callTool("flaky", Map.of(), DEADLINE))
                    .expectNext(Map.of("status", "ok"))
                    .verifyComplete();

            assertThat(client.invocations()).isEqualTo(3);
        }

        @Test
        @DisplayName("should give up after three retries")
        void exhaustsRetries() {
            flakyFailures.set(10);

            StepVerifier.create(client.callTool("flaky", Map.of(), DEADLINE))
                    .expectErrorSatisfies(e -> assertThat(((RemoteException) e).isTransient()).isTrue())
                    .verify();

            assertThat(client.invocations()).isEqualTo(4);
        }

        @Test
        @DisplayName("should fail with a timeout once the deadline expires")
        void enforcesDeadline() {
            StepVerifier.create(client.callTool("slow", Map.of(), Duration.ofMillis(50)))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(RemoteException.class);
                        assertThat(((RemoteException) e).isTimeout()).isTrue();
                    })
                    .verify(Duration.ofSeconds(1));
        }
    }

    @Nested
    @DisplayName("Resources")
    class ResourceTests {

        @Test
        @DisplayName("should read by template with parameters")
        void readsByTemplate() {
            StepVerifier.create(client.readResource("item/{id}", Map.of("id", "42"), DEADLINE))
                    .expectNext(Map.of("id", "42"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should read by concrete URI")
        void readsByConcreteUri() {
            StepVerifier.create(client.readResource("item/a%20b", Map.of(), DEADLINE))
                    .expectNext(Map.of("id", "a b"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject unknown resources and missing parameters")
        void rejectsBadReads() {
            StepVerifier.create(client.readResource("other/{id}", Map.of("id", "1"), DEADLINE))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
            StepVerifier.create(client.readResource("item/{id}", Map.of(), DEADLINE))
                    .expectError(ValidationException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should be idempotent on connect and close")
        void idempotentLifecycle() {
            client.connect().block();
            client.connect().block();
            client.close();
            client.close();

            assertThat(client.isConnected()).isFalse();
            assertThatThrownBy(() -> client.connect().block()).isInstanceOf(ConnectionException.class);
            StepVerifier.create(client.callTool("echo", Map.of("text", "x"), DEADLINE))
                    .expectError(ConnectionException.class)
                    .verify();
            StepVerifier.create(client.probe()).expectNext(false).verifyComplete();
        }

        @Test
        @DisplayName("should reject duplicate declarations")
        void rejectsDuplicates() {
            assertThatThrownBy(() -> client.tool("echo", ECHO_SCHEMA, args -> Mono.empty()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
