package com.cortexplatform.core.domain.repository.impl;

import com.cortexplatform.core.domain.model.Message;
import com.cortexplatform.core.domain.repository.ConversationRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link ConversationRepository} implementation.
 */
@Repository
public class InMemoryConversationRepository implements ConversationRepository {

    private static final Comparator<Message> CHRONOLOGICAL =
            Comparator.comparing(Message::getTimestamp).thenComparing(Message::getId);

    // conversation id -> message id -> message
    private final Map<String, Map<String, Message>> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Message> save(Message message) {
        Objects.requireNonNull(message.getConversationId(), "conversationId");
        if (message.getId() == null || message.getId().isBlank()) {
            message.setId(UUID.randomUUID().toString());
        }
        if (message.getTimestamp() == null) {
            message.setTimestamp(Instant.now());
        }
        store.computeIfAbsent(message.getConversationId(), k -> new ConcurrentHashMap<>())
                .put(message.getId(), message);
        return Mono.just(message);
    }

    @Override
    public Mono<Message> findById(String conversationId, String messageId) {
        Map<String, Message> messages = store.get(conversationId);
        return Mono.justOrEmpty(messages != null ? messages.get(messageId) : null);
    }

    @Override
    public Flux<Message> findByConversationId(String conversationId, int limit) {
        Map<String, Message> messages = store.get(conversationId);
        if (messages == null || limit <= 0) {
            return Flux.empty();
        }
        List<Message> sorted = new ArrayList<>(messages.values());
        sorted.sort(CHRONOLOGICAL);
        return Flux.fromIterable(sorted.subList(Math.max(0, sorted.size() - limit), sorted.size()));
    }

    @Override
    public Flux<Message> findBySenderId(String senderId) {
        return Flux.fromStream(store.values().stream()
                .flatMap(messages -> messages.values().stream())
                .filter(message -> Objects.equals(message.getSenderId(), senderId))
                .sorted(CHRONOLOGICAL.reversed()));
    }

    @Override
    public Mono<Long> countByConversationId(String conversationId) {
        Map<String, Message> messages = store.get(conversationId);
        return Mono.just(messages != null ? (long) messages.size() : 0L);
    }
}
