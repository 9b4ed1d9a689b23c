package com.cortexplatform.core.domain.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts messages to and from the map form exchanged with services and carried in event payloads.
 */
public final class MessageMapper {

    public static final String ID = "id";
    public static final String CONVERSATION_ID = "conversation_id";
    public static final String SENDER_ID = "sender_id";
    public static final String ROLE = "role";
    public static final String CONTENT = "content";
    public static final String TIMESTAMP = "timestamp";
    public static final String METADATA = "metadata";
    public static final String IS_COMPLETE = "is_complete";

    private MessageMapper() {
    }

    public static Map<String, Object> toMap(Message message) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(ID, message.getId());
        map.put(CONVERSATION_ID, message.getConversationId());
        map.put(SENDER_ID, message.getSenderId());
        map.put(ROLE, message.getRole() != null ? message.getRole().wireName() : null);
        map.put(CONTENT, message.getContent());
        map.put(TIMESTAMP, message.getTimestamp() != null ? message.getTimestamp().toString() : null);
        map.put(METADATA, message.getMetadata() != null ? message.getMetadata() : Map.of());
        map.put(IS_COMPLETE, message.isComplete());
        return map;
    }

    @SuppressWarnings("unchecked")
    public static Message fromMap(Map<String, Object> map) {
        Object metadata = map.get(METADATA);
        Object timestamp = map.get(TIMESTAMP);
        Message message = Message.builder()
                .id(asString(map.get(ID)))
                .conversationId(asString(map.get(CONVERSATION_ID)))
                .senderId(asString(map.get(SENDER_ID)))
                .role(map.get(ROLE) != null ? MessageRole.fromWireName(asString(map.get(ROLE))) : null)
                .content(asString(map.get(CONTENT)))
                .timestamp(timestamp instanceof Instant instant ? instant
                        : timestamp != null ? Instant.parse(timestamp.toString()) : null)
                .metadata(metadata instanceof Map<?, ?> m ? new HashMap<>((Map<String, Object>) m) : new HashMap<>())
                .build();
        if (Boolean.TRUE.equals(map.get(IS_COMPLETE))) {
            message.markComplete();
        }
        return message;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
