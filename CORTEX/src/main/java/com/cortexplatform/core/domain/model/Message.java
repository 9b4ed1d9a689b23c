package com.cortexplatform.core.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A single message of a conversation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private String id;

    private String conversationId;

    /**
     * User ID for user messages, the assistant or system sender ID otherwise.
     */
    private String senderId;

    private MessageRole role;

    private String content;

    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * Set once, when the message content is final.
     */
    @Setter(AccessLevel.NONE)
    private boolean complete;

    /**
     * Mark the message final.
     *
     * @throws IllegalStateException if it is already complete
     */
    public void markComplete() {
        if (complete) {
            throw new IllegalStateException("Message " + id + " is already complete");
        }
        this.complete = true;
    }
}
