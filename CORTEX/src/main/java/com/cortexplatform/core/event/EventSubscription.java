package com.cortexplatform.core.event;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A subscriber's bounded delivery queue on the {@link EventBus}.
 *
 * <p>When the queue is full the oldest queued event is discarded to make room for the new one,
 * so a slow subscriber never stalls a publisher. Only one read may be pending at a time.
 */
@Slf4j
public final class EventSubscription {

    private final String id;
    private final Set<String> eventTypes;
    private final String userFilter;
    private final int capacity;
    private final Runnable onDrop;

    private final Object lock = new Object();
    private final ArrayDeque<Event> queue;
    private final AtomicLong dropped = new AtomicLong();

    // guarded by lock
    private MonoSink<Event> waiter;
    private boolean closed;

    EventSubscription(String id, Set<String> eventTypes, String userFilter, int capacity, Runnable onDrop) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Subscription capacity must be positive: " + capacity);
        }
        this.id = id;
        this.eventTypes = Set.copyOf(eventTypes);
        this.userFilter = userFilter;
        this.capacity = capacity;
        this.onDrop = onDrop;
        this.queue = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public String getId() {
        return id;
    }

    boolean matches(Event event) {
        return eventTypes.contains(event.type())
                && (userFilter == null || userFilter.equals(event.userId()));
    }

    /**
     * Append an event, evicting the oldest when full.
     *
     * @return true when a pending reader should be woken
     */
    boolean enqueue(Event event) {
        boolean evicted = false;
        boolean wake;
        synchronized (lock) {
            if (closed) {
                return false;
            }
            if (queue.size() >= capacity) {
                queue.pollFirst();
                evicted = true;
            }
            queue.addLast(event);
            wake = waiter != null;
        }
        if (evicted) {
            long total = dropped.incrementAndGet();
            onDrop.run();
            log.debug("Subscription {} full, dropped oldest event (total dropped: {})", id, total);
        }
        return wake;
    }

    /**
     * Hand the head of the queue to the pending reader, if there is one.
     * Sink signals are emitted outside the lock.
     */
    void wakeWaiter() {
        MonoSink<Event> sink;
        Event next;
        synchronized (lock) {
            if (waiter == null || queue.isEmpty()) {
                return;
            }
            sink = waiter;
            waiter = null;
            next = queue.pollFirst();
        }
        sink.success(next);
    }

    /**
     * Next event in delivery order. Completes empty once the subscription is closed.
     * An event taken for a reader that cancels before receiving it goes back to the head
     * of the queue.
     *
     * @return a Mono of the next event
     */
    public Mono<Event> next() {
        return Mono.<Event>create(sink -> {
            Event ready;
            boolean ended = false;
            boolean busy = false;
            synchronized (lock) {
                ready = queue.pollFirst();
                if (ready == null) {
                    if (closed) {
                        ended = true;
                    } else if (waiter != null) {
                        busy = true;
                    } else {
                        waiter = sink;
                        sink.onDispose(() -> clearWaiter(sink));
                    }
                }
            }
            if (ready != null) {
                sink.success(ready);
            } else if (ended) {
                sink.success();
            } else if (busy) {
                sink.error(new IllegalStateException("Subscription " + id + " already has a pending read"));
            }
        }).doOnDiscard(Event.class, this::requeue);
    }

    private void requeue(Event event) {
        boolean evicted = false;
        synchronized (lock) {
            if (closed) {
                return;
            }
            if (queue.size() >= capacity) {
                evicted = true;
            } else {
                queue.addFirst(event);
            }
        }
        if (evicted) {
            // newer events filled the queue meanwhile; the undelivered one is the oldest
            dropped.incrementAndGet();
            onDrop.run();
            log.debug("Subscription {} full, dropped undelivered event #{}", id, event.sequence());
            return;
        }
        log.debug("Subscription {} reader cancelled, event #{} requeued", id, event.sequence());
        wakeWaiter();
    }

    /**
     * Continuous view of this subscription, completing when it is closed.
     */
    public Flux<Event> asFlux() {
        return Mono.defer(this::next)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .repeat()
                .takeWhile(Optional::isPresent)
                .map(Optional::get);
    }

    private void clearWaiter(MonoSink<Event> sink) {
        synchronized (lock) {
            if (waiter == sink) {
                waiter = null;
            }
        }
    }

    /**
     * Close the subscription. Queued events are discarded and a pending reader sees end of stream.
     */
    void close() {
        MonoSink<Event> sink;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            queue.clear();
            sink = waiter;
            waiter = null;
        }
        if (sink != null) {
            sink.success();
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int size() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    @Override
    public String toString() {
        return "EventSubscription{id=" + id + ", types=" + eventTypes + ", user=" + userFilter + "}";
    }
}
