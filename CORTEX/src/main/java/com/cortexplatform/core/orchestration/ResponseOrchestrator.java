package com.cortexplatform.core.orchestration;

import com.cortexplatform.core.cognition.CognitionServiceClient;
import com.cortexplatform.core.config.CortexProperties;
import com.cortexplatform.core.domain.model.Message;
import com.cortexplatform.core.domain.model.MessageMapper;
import com.cortexplatform.core.domain.model.MessageRole;
import com.cortexplatform.core.event.BusClosedException;
import com.cortexplatform.core.event.ConversationKey;
import com.cortexplatform.core.event.Event;
import com.cortexplatform.core.event.EventBus;
import com.cortexplatform.core.event.EventSubscription;
import com.cortexplatform.core.event.EventTypes;
import com.cortexplatform.core.mcp.DispatchException;
import com.cortexplatform.core.mcp.McpDispatcher;
import com.cortexplatform.core.mcp.ResourceRequest;
import com.cortexplatform.core.mcp.ToolCall;
import com.cortexplatform.core.memory.MemoryServiceClient;
import com.cortexplatform.core.orchestration.ConversationRunner.ReplyStream;
import com.cortexplatform.core.stream.StreamLifecycleListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns "input" events into assistant replies.
 *
 * <p>For each input the orchestrator stores the input, reads the conversation history from the
 * Memory service, asks the Cognition service for related context, runs the
 * {@link ResponseGenerator} and publishes the reply as "output" events: one partial event per
 * generated chunk, then a single complete event carrying the same message ID. Any failure ends
 * the orchestration with one system-role output describing the error. A run cancelled after its
 * first partial output is closed with a complete system-role output of kind CANCELLED.
 *
 * <p>At most one orchestration runs per conversation. Further inputs for a busy conversation
 * wait in a bounded FIFO queue; different conversations proceed concurrently.
 */
@Component
@Slf4j
public class ResponseOrchestrator implements StreamLifecycleListener {

    public static final String ASSISTANT_SENDER_ID = "assistant";
    public static final String SYSTEM_SENDER_ID = "system";

    static final String ERROR_KIND = "error_kind";
    static final String ERROR_SERVICE = "error_service";
    static final String CANCELLED_KIND = "CANCELLED";

    private final EventBus eventBus;
    private final McpDispatcher dispatcher;
    private final ResponseGenerator generator;
    private final CortexProperties.OrchestratorProperties config;

    private final Map<ConversationKey, ConversationRunner> runners = new ConcurrentHashMap<>();
    private final List<OrchestrationListener> listeners = new CopyOnWriteArrayList<>();

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter cancelledCounter;
    private final Counter droppedInputCounter;
    private final Timer durationTimer;

    private EventSubscription inputSubscription;
    private Disposable inputLoop;
    private volatile boolean stopping;

    @Autowired
    public ResponseOrchestrator(
            EventBus eventBus,
            McpDispatcher dispatcher,
            ResponseGenerator generator,
            CortexProperties properties,
            MeterRegistry meterRegistry,
            ObjectProvider<OrchestrationListener> listenerProvider) {
        this(eventBus, dispatcher, generator, properties.getOrchestrator(), meterRegistry);
        listenerProvider.orderedStream().forEach(this::addListener);
    }

    public ResponseOrchestrator(
            EventBus eventBus,
            McpDispatcher dispatcher,
            ResponseGenerator generator,
            CortexProperties.OrchestratorProperties config,
            MeterRegistry meterRegistry) {
        this.eventBus = eventBus;
        this.dispatcher = dispatcher;
        this.generator = generator;
        this.config = config;

        this.completedCounter = Counter.builder("cortex.orchestration.completed")
                .description("Orchestrations that published a reply")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("cortex.orchestration.failed")
                .description("Orchestrations that ended with an error output")
                .register(meterRegistry);
        this.cancelledCounter = Counter.builder("cortex.orchestration.cancelled")
                .description("Orchestrations cancelled before completion")
                .register(meterRegistry);
        this.droppedInputCounter = Counter.builder("cortex.orchestration.inputs.dropped")
                .description("Queued inputs discarded because the conversation queue was full")
                .register(meterRegistry);
        this.durationTimer = Timer.builder("cortex.orchestration.duration")
                .description("Time from input to the end of its orchestration")
                .register(meterRegistry);
    }

    /**
     * Start consuming input events.
     */
    @PostConstruct
    public synchronized void start() {
        if (inputSubscription != null) {
            return;
        }
        stopping = false;
        inputSubscription = eventBus.subscribe(Set.of(EventTypes.INPUT), null);
        inputLoop = inputSubscription.asFlux()
                .subscribe(this::onInput, e -> log.error("Input loop terminated unexpectedly", e));
        log.info("ResponseOrchestrator started");
    }

    /**
     * Stop consuming inputs and cancel every in-flight orchestration. Queued inputs are discarded.
     */
    @PreDestroy
    public synchronized void stop() {
        if (inputSubscription == null) {
            return;
        }
        stopping = true;
        inputLoop.dispose();
        eventBus.unsubscribe(inputSubscription);
        inputSubscription = null;
        runners.values().forEach(ConversationRunner::cancelCurrent);
        log.info("ResponseOrchestrator stopped");
    }

    public void addListener(OrchestrationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(OrchestrationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Current phase of a conversation, {@link OrchestrationPhase#IDLE} when nothing is running.
     */
    public OrchestrationPhase phaseOf(String userId, String conversationId) {
        ConversationRunner runner = runners.get(new ConversationKey(userId, conversationId));
        return runner != null ? runner.phase() : OrchestrationPhase.IDLE;
    }

    /**
     * Number of conversations with an orchestration in flight.
     */
    public int activeOrchestrations() {
        return (int) runners.values().stream()
                .filter(runner -> runner.phase() != OrchestrationPhase.IDLE)
                .count();
    }

    /**
     * Cancel the in-flight orchestration of a conversation. Queued inputs of the conversation
     * still run afterwards.
     *
     * @return true if an orchestration was cancelled
     */
    public boolean cancel(String userId, String conversationId) {
        ConversationKey key = new ConversationKey(userId, conversationId);
        ConversationRunner runner = runners.get(key);
        boolean cancelled = runner != null && runner.cancelCurrent();
        if (cancelled) {
            log.info("Cancelling orchestration for {}", key);
        }
        return cancelled;
    }

    @Override
    public void onLastDetach(ConversationKey key) {
        cancel(key.userId(), key.conversationId());
    }

    private void onInput(Event input) {
        try {
            accept(input);
        } catch (RuntimeException e) {
            log.error("Failed to accept input #{} for {}", input.sequence(), input.conversationKey(), e);
        }
    }

    void accept(Event input) {
        if (stopping) {
            return;
        }
        ConversationKey key = input.conversationKey();
        AtomicBoolean startNow = new AtomicBoolean();
        AtomicReference<Event> evicted = new AtomicReference<>();

        ConversationRunner runner = runners.compute(key, (k, existing) -> {
            ConversationRunner r = existing != null ? existing : new ConversationRunner(k);
            if (r.isBusy()) {
                evicted.set(r.enqueue(input, config.getMaxQueuedInputs()));
            } else {
                r.markBusy();
                startNow.set(true);
            }
            return r;
        });

        if (evicted.get() != null) {
            droppedInputCounter.increment();
            log.warn("Input queue full for {}, dropped input #{}", key, evicted.get().sequence());
        }
        if (startNow.get()) {
            launch(runner, input);
        } else {
            log.debug("Queued input #{} for busy conversation {}", input.sequence(), key);
        }
    }

    private void launch(ConversationRunner runner, Event input) {
        Disposable.Swap handle = Disposables.swap();
        runner.attach(handle);
        ReplyStream reply = new ReplyStream(UUID.randomUUID().toString());
        long start = System.nanoTime();
        handle.update(orchestrate(runner, input, reply)
                .subscribeOn(Schedulers.boundedElastic())
                .doFinally(signal -> finish(runner, handle, signal, start, reply))
                .subscribe(
                        succeeded -> (succeeded ? completedCounter : failedCounter).increment(),
                        e -> log.error("Orchestration for {} terminated abnormally", runner.key(), e)));
    }

    private void finish(ConversationRunner runner, Disposable.Swap handle, SignalType signal, long start,
                        ReplyStream reply) {
        durationTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        boolean unterminated = reply.abandon();
        if (signal == SignalType.CANCEL) {
            cancelledCounter.increment();
            log.info("Orchestration for {} cancelled in phase {}", runner.key(), runner.phase());
            if (unterminated) {
                publishCancellation(runner.key(), reply.id());
            }
        }
        runner.detach(handle);
        transition(runner, OrchestrationPhase.IDLE);

        AtomicReference<Event> next = new AtomicReference<>();
        runners.computeIfPresent(runner.key(), (k, r) -> {
            if (r != runner) {
                return r;
            }
            Event queued = stopping ? null : r.pollPending();
            if (queued != null) {
                next.set(queued);
                return r;
            }
            r.markIdle();
            return null;
        });
        if (next.get() != null) {
            launch(runner, next.get());
        }
    }

    private Mono<Boolean> orchestrate(ConversationRunner runner, Event input, ReplyStream reply) {
        return Mono.defer(() -> {
            ConversationKey key = runner.key();
            String content = Objects.toString(input.payload().get("content"), "");
            String inputId = input.payloadString("message_id") != null
                    ? input.payloadString("message_id")
                    : UUID.randomUUID().toString();
            String responseId = reply.id();
            log.debug("Orchestrating input #{} for {} (reply {})", input.sequence(), key, responseId);

            transition(runner, OrchestrationPhase.AWAITING_HISTORY);
            return storeInput(key, inputId, content, input.payload().get("metadata"))
                    .then(Mono.defer(() -> readHistory(key)))
                    .flatMap(history -> {
                        transition(runner, OrchestrationPhase.AWAITING_CONTEXT);
                        return fetchContext(key, content, inputId)
                                .map(context -> new GenerationRequest(
                                        key.userId(), key.conversationId(), content, history, context));
                    })
                    .flatMap(request -> {
                        transition(runner, OrchestrationPhase.GENERATING);
                        return generate(key, reply, request);
                    })
                    .flatMap(text -> {
                        transition(runner, OrchestrationPhase.PUBLISHING);
                        return storeReply(key, responseId, inputId, text)
                                .then(Mono.<Void>fromRunnable(() -> reply.complete(() -> eventBus.publish(
                                        output(key, responseId, MessageRole.ASSISTANT, ASSISTANT_SENDER_ID,
                                                text, true, Map.of("reply_to", inputId))))));
                    })
                    .thenReturn(true)
                    .onErrorResume(e -> publishFailure(key, reply, e).thenReturn(false));
        });
    }

    private Mono<Void> storeInput(ConversationKey key, String inputId, String content, Object metadata) {
        if (!config.isStoreInput()) {
            return Mono.empty();
        }
        Map<String, Object> args = new HashMap<>();
        args.put("user_id", key.userId());
        args.put("conversation_id", key.conversationId());
        args.put("content", content);
        args.put("message_id", inputId);
        if (metadata instanceof Map<?, ?>) {
            args.put("metadata", metadata);
        }
        return dispatcher.callTool(new ToolCall(MemoryServiceClient.SERVICE_NAME,
                MemoryServiceClient.TOOL_STORE_INPUT, args)).then();
    }

    private Mono<List<Map<String, Object>>> readHistory(ConversationKey key) {
        ResourceRequest request = new ResourceRequest(MemoryServiceClient.SERVICE_NAME,
                MemoryServiceClient.SERVICE_NAME + "/" + MemoryServiceClient.RESOURCE_HISTORY,
                Map.of("conversation_id", key.conversationId(),
                        "limit", String.valueOf(config.getHistoryLimit())));
        return dispatcher.readResource(request).map(result -> listOfMaps(result.get("messages")));
    }

    private Mono<List<Map<String, Object>>> fetchContext(ConversationKey key, String query, String inputId) {
        Map<String, Object> args = new HashMap<>();
        args.put("user_id", key.userId());
        args.put("conversation_id", key.conversationId());
        args.put("query", query);
        args.put("limit", config.getContextLimit());
        args.put("exclude_message_id", inputId);
        return dispatcher.callTool(new ToolCall(CognitionServiceClient.SERVICE_NAME,
                        CognitionServiceClient.TOOL_GET_CONTEXT, args))
                .map(result -> listOfMaps(result.get("context")));
    }

    private Mono<String> generate(ConversationKey key, ReplyStream reply, GenerationRequest request) {
        StringBuilder text = new StringBuilder();
        return Flux.defer(() -> generator.generate(request))
                .concatMap(chunk -> {
                    text.append(chunk);
                    if (!config.isStreaming()) {
                        return Mono.<Void>empty();
                    }
                    return Mono.<Void>fromRunnable(() -> reply.partial(() -> eventBus.publish(output(key,
                            reply.id(), MessageRole.ASSISTANT, ASSISTANT_SENDER_ID, chunk, false, Map.of()))));
                })
                .then(Mono.fromCallable(text::toString))
                .timeout(config.getGenerationTimeout());
    }

    private Mono<Void> storeReply(ConversationKey key, String responseId, String inputId, String reply) {
        Map<String, Object> args = new HashMap<>();
        args.put("conversation_id", key.conversationId());
        args.put("sender_id", ASSISTANT_SENDER_ID);
        args.put("role", MessageRole.ASSISTANT.wireName());
        args.put("content", reply);
        args.put("message_id", responseId);
        args.put("metadata", Map.of("reply_to", inputId));
        return dispatcher.callTool(new ToolCall(MemoryServiceClient.SERVICE_NAME,
                MemoryServiceClient.TOOL_STORE_MESSAGE, args)).then();
    }

    private Mono<Void> publishFailure(ConversationKey key, ReplyStream reply, Throwable error) {
        String kind;
        String service;
        if (error instanceof DispatchException dispatch) {
            kind = dispatch.getKind().name();
            service = dispatch.getService();
        } else if (error instanceof TimeoutException) {
            kind = "TIMEOUT";
            service = "generator";
        } else {
            kind = "INTERNAL";
            service = "orchestrator";
        }
        log.warn("Orchestration for {} failed ({} from {}): {}", key, kind, service, error.getMessage());

        String content = "An error occurred while processing your request: "
                + (error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        return Mono.<Void>fromRunnable(() -> reply.complete(() -> eventBus.publish(output(key, reply.id(),
                        MessageRole.SYSTEM, SYSTEM_SENDER_ID, content, true,
                        Map.of(ERROR_KIND, kind, ERROR_SERVICE, service)))))
                .onErrorResume(BusClosedException.class, e -> {
                    log.warn("Could not publish failure for {}: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    private void publishCancellation(ConversationKey key, String responseId) {
        try {
            eventBus.publish(output(key, responseId, MessageRole.SYSTEM, SYSTEM_SENDER_ID,
                    "The response was cancelled before it completed.", true,
                    Map.of(ERROR_KIND, CANCELLED_KIND, ERROR_SERVICE, "orchestrator")));
        } catch (BusClosedException e) {
            log.warn("Could not publish cancellation for {}: {}", key, e.getMessage());
        }
    }

    private static Event output(ConversationKey key, String messageId, MessageRole role, String senderId,
                                String content, boolean complete, Map<String, Object> metadata) {
        Message message = Message.builder()
                .id(messageId)
                .conversationId(key.conversationId())
                .senderId(senderId)
                .role(role)
                .content(content)
                .timestamp(Instant.now())
                .metadata(new HashMap<>(metadata))
                .build();
        if (complete) {
            message.markComplete();
        }
        return Event.of(EventTypes.OUTPUT, key.userId(), key.conversationId(), MessageMapper.toMap(message));
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOfMaps(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(Map.class::isInstance)
                .map(item -> (Map<String, Object>) item)
                .toList();
    }

    private void transition(ConversationRunner runner, OrchestrationPhase next) {
        OrchestrationPhase previous = runner.phase(next);
        if (previous == next) {
            return;
        }
        log.debug("{}: {} -> {}", runner.key(), previous, next);
        for (OrchestrationListener listener : listeners) {
            try {
                listener.onPhaseChange(runner.key(), previous, next);
            } catch (RuntimeException e) {
                log.warn("Orchestration listener {} failed: {}", listener, e.getMessage());
            }
        }
    }
}
