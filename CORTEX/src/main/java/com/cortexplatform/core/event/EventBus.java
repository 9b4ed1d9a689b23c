package com.cortexplatform.core.event;

import com.cortexplatform.core.config.CortexProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process publish/subscribe bus for typed events.
 *
 * <p>Each published event is stamped with a sequence number that strictly increases per
 * {@code (user_id, conversation_id)} and is fanned out to every matching subscription.
 * Sequencing and enqueueing for one conversation happen under that conversation's lock, so
 * every subscriber observes a conversation's events in sequence order. Publishing never waits
 * on subscribers; full queues drop their oldest event.
 */
@Component
@Slf4j
public class EventBus {

    private final int defaultCapacity;
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();
    // Counters are never removed so sequence numbers are never reused.
    private final Map<ConversationKey, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final Counter publishedCounter;
    private final Counter droppedCounter;
    private volatile boolean closed;

    @Autowired
    public EventBus(CortexProperties properties, MeterRegistry meterRegistry) {
        this(properties.getEventBus().getQueueCapacity(), meterRegistry);
    }

    public EventBus(int defaultCapacity, MeterRegistry meterRegistry) {
        if (defaultCapacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + defaultCapacity);
        }
        this.defaultCapacity = defaultCapacity;
        this.publishedCounter = Counter.builder("cortex.eventbus.published")
                .description("Total events published")
                .register(meterRegistry);
        this.droppedCounter = Counter.builder("cortex.eventbus.dropped")
                .description("Events discarded from full subscription queues")
                .register(meterRegistry);
        log.info("Initialized EventBus (queue capacity: {})", defaultCapacity);
    }

    /**
     * Subscribe to events of the given types.
     *
     * @param eventTypes event types to receive
     * @param userFilter only receive events of this user, or {@code null} for all users
     * @return the subscription handle
     */
    public EventSubscription subscribe(Set<String> eventTypes, String userFilter) {
        return subscribe(eventTypes, userFilter, defaultCapacity);
    }

    /**
     * Subscribe with an explicit queue capacity.
     *
     * @param eventTypes event types to receive
     * @param userFilter only receive events of this user, or {@code null} for all users
     * @param capacity maximum number of undelivered events held for this subscriber
     * @return the subscription handle
     * @throws BusClosedException if the bus has been closed
     */
    public EventSubscription subscribe(Set<String> eventTypes, String userFilter, int capacity) {
        Objects.requireNonNull(eventTypes, "eventTypes");
        if (eventTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        if (closed) {
            throw new BusClosedException("Event bus is closed");
        }
        EventSubscription subscription = new EventSubscription(
                UUID.randomUUID().toString(), eventTypes, userFilter, capacity, droppedCounter::increment);
        subscriptions.add(subscription);
        log.debug("Subscribed {} to {} (user: {})", subscription.getId(), eventTypes,
                userFilter != null ? userFilter : "*");
        return subscription;
    }

    /**
     * Remove a subscription. Unknown or already removed handles are ignored.
     *
     * @param subscription the handle returned by {@link #subscribe}
     */
    public void unsubscribe(EventSubscription subscription) {
        if (subscription == null) {
            return;
        }
        if (subscriptions.remove(subscription)) {
            log.debug("Unsubscribed {}", subscription.getId());
        }
        subscription.close();
    }

    /**
     * Publish an event to every matching subscription.
     *
     * @param event the event to publish; any sequence or timestamp it carries is replaced
     * @return the event as published, with its assigned sequence and timestamp
     * @throws BusClosedException if the bus has been closed
     */
    public Event publish(Event event) {
        Objects.requireNonNull(event, "event");
        if (closed) {
            throw new BusClosedException("Event bus is closed");
        }

        AtomicLong sequence = sequences.computeIfAbsent(event.conversationKey(), k -> new AtomicLong());
        Event published;
        List<EventSubscription> toWake = null;
        synchronized (sequence) {
            published = event.sequenced(sequence.incrementAndGet(), Instant.now());
            for (EventSubscription subscription : subscriptions) {
                if (subscription.matches(published) && subscription.enqueue(published)) {
                    if (toWake == null) {
                        toWake = new ArrayList<>(2);
                    }
                    toWake.add(subscription);
                }
            }
        }
        publishedCounter.increment();

        if (toWake != null) {
            toWake.forEach(EventSubscription::wakeWaiter);
        }
        log.trace("Published {} #{} for {}", published.type(), published.sequence(), published.conversationKey());
        return published;
    }

    /**
     * Shut the bus down. Every subscription ends and further publishes fail.
     */
    @PreDestroy
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<EventSubscription> open = new ArrayList<>(subscriptions);
        subscriptions.clear();
        open.forEach(EventSubscription::close);
        log.info("EventBus closed ({} subscriptions ended)", open.size());
    }

    public boolean isClosed() {
        return closed;
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }
}
