package com.cortexplatform.core.stream;

import com.cortexplatform.core.event.ConversationKey;
import com.cortexplatform.core.event.EventBus;
import com.cortexplatform.core.event.EventSubscription;
import com.cortexplatform.core.event.EventTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges "output" events to client streams.
 *
 * <p>Each attached handle owns a bus subscription filtered to its user; the handle itself narrows
 * that to one conversation. Framing for a particular transport is left to the caller.
 */
@Component
@Slf4j
public class StreamBroadcaster {

    private final EventBus eventBus;
    private final List<StreamLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<ConversationKey, Set<StreamHandle>> handles = new ConcurrentHashMap<>();

    @Autowired
    public StreamBroadcaster(EventBus eventBus, ObjectProvider<StreamLifecycleListener> listenerProvider) {
        this(eventBus);
        listenerProvider.orderedStream().forEach(this::addListener);
    }

    public StreamBroadcaster(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public void addListener(StreamLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Attach a stream to a conversation's output.
     *
     * @param userId the user the stream belongs to
     * @param conversationId the conversation to follow
     * @return the handle to read from and later detach
     */
    public StreamHandle attach(String userId, String conversationId) {
        ConversationKey key = new ConversationKey(userId, conversationId);
        EventSubscription subscription = eventBus.subscribe(Set.of(EventTypes.OUTPUT), userId);
        StreamHandle handle = new StreamHandle(UUID.randomUUID().toString(), key, subscription);
        handles.compute(key, (k, existing) -> {
            Set<StreamHandle> set = existing != null ? existing : ConcurrentHashMap.newKeySet();
            set.add(handle);
            return set;
        });
        log.debug("Attached stream {} to {}", handle.getId(), key);
        return handle;
    }

    /**
     * Detach a stream. Safe to call more than once and at any time. When the last stream of a
     * conversation goes away, lifecycle listeners are notified.
     *
     * @param handle the handle returned by {@link #attach}
     */
    public void detach(StreamHandle handle) {
        if (handle == null || !handle.markDetached()) {
            return;
        }
        eventBus.unsubscribe(handle.subscription());

        ConversationKey key = handle.getKey();
        AtomicBoolean last = new AtomicBoolean();
        handles.computeIfPresent(key, (k, set) -> {
            set.remove(handle);
            if (set.isEmpty()) {
                last.set(true);
                return null;
            }
            return set;
        });
        log.debug("Detached stream {} from {}", handle.getId(), key);

        if (last.get()) {
            log.debug("No streams left for {}", key);
            for (StreamLifecycleListener listener : listeners) {
                try {
                    listener.onLastDetach(key);
                } catch (RuntimeException e) {
                    log.warn("Stream lifecycle listener {} failed for {}: {}", listener, key, e.getMessage());
                }
            }
        }
    }

    /**
     * Number of attached streams across all conversations.
     */
    public int activeStreams() {
        return handles.values().stream().mapToInt(Set::size).sum();
    }

    public int activeStreams(String userId, String conversationId) {
        Set<StreamHandle> set = handles.get(new ConversationKey(userId, conversationId));
        return set != null ? set.size() : 0;
    }
}
