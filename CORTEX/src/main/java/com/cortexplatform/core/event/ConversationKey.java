package com.cortexplatform.core.event;

import java.util.Objects;

/**
 * Identifies one conversation of one user. Ordering and orchestration are scoped to this pair.
 */
public record ConversationKey(String userId, String conversationId) {

    public ConversationKey {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(conversationId, "conversationId");
    }

    @Override
    public String toString() {
        return userId + "/" + conversationId;
    }
}
