package com.cortexplatform.core.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable typed record distributed by the {@link EventBus}.
 *
 * <p>Events are created unsequenced by publishers ({@link #of}); the bus assigns
 * {@code sequence} and {@code createdAt} at publish time.
 */
public record Event(
        @JsonProperty("type") String type,
        @JsonProperty("user_id") String userId,
        @JsonProperty("conversation_id") String conversationId,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("sequence") long sequence,
        @JsonProperty("timestamp") Instant createdAt
) {

    public Event {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(conversationId, "conversationId");
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Create an unsequenced event ready to publish.
     */
    public static Event of(String type, String userId, String conversationId, Map<String, Object> payload) {
        return new Event(type, userId, conversationId, payload, 0L, null);
    }

    /**
     * Copy of this event stamped by the bus.
     */
    Event sequenced(long sequence, Instant createdAt) {
        return new Event(type, userId, conversationId, payload, sequence, createdAt);
    }

    @JsonIgnore
    public ConversationKey conversationKey() {
        return new ConversationKey(userId, conversationId);
    }

    /**
     * Read a payload value as a string, or {@code null} when absent.
     */
    public String payloadString(String key) {
        Object value = payload.get(key);
        return value != null ? String.valueOf(value) : null;
    }
}
