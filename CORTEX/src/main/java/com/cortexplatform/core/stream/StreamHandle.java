package com.cortexplatform.core.stream;

import com.cortexplatform.core.event.ConversationKey;
import com.cortexplatform.core.event.Event;
import com.cortexplatform.core.event.EventSubscription;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A client's attachment to the output of one conversation.
 */
public final class StreamHandle {

    private final String id;
    private final ConversationKey key;
    private final EventSubscription subscription;
    private final AtomicBoolean detached = new AtomicBoolean();

    StreamHandle(String id, ConversationKey key, EventSubscription subscription) {
        this.id = id;
        this.key = key;
        this.subscription = subscription;
    }

    public String getId() {
        return id;
    }

    public ConversationKey getKey() {
        return key;
    }

    /**
     * Next output event of the conversation, or empty once the handle is detached.
     */
    public Mono<Event> next() {
        return asFlux().next();
    }

    /**
     * Output events of the conversation until the handle is detached.
     */
    public Flux<Event> asFlux() {
        return subscription.asFlux()
                .filter(event -> key.conversationId().equals(event.conversationId()));
    }

    public long droppedCount() {
        return subscription.droppedCount();
    }

    public boolean isDetached() {
        return detached.get();
    }

    EventSubscription subscription() {
        return subscription;
    }

    /**
     * @return true for the first caller only
     */
    boolean markDetached() {
        return detached.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "StreamHandle{id=" + id + ", conversation=" + key + "}";
    }
}
