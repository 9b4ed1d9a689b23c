package com.cortexplatform.core.domain.repository;

import com.cortexplatform.core.domain.model.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository for conversation messages.
 */
public interface ConversationRepository {

    /**
     * Save a message, assigning an ID and timestamp when missing.
     *
     * @param message the message to save
     * @return the saved message
     */
    Mono<Message> save(Message message);

    /**
     * Find a message by ID within a conversation.
     *
     * @param conversationId the conversation ID
     * @param messageId the message ID
     * @return the message or empty
     */
    Mono<Message> findById(String conversationId, String messageId);

    /**
     * Most recent messages of a conversation, returned oldest first.
     *
     * @param conversationId the conversation ID
     * @param limit maximum number of messages
     * @return the messages
     */
    Flux<Message> findByConversationId(String conversationId, int limit);

    /**
     * All messages a sender wrote, newest first.
     *
     * @param senderId the sender ID
     * @return the messages
     */
    Flux<Message> findBySenderId(String senderId);

    Mono<Long> countByConversationId(String conversationId);
}
