package com.cortexplatform.core.memory;

import com.cortexplatform.core.config.CortexProperties;
import com.cortexplatform.core.domain.model.Message;
import com.cortexplatform.core.domain.model.MessageMapper;
import com.cortexplatform.core.domain.model.MessageRole;
import com.cortexplatform.core.domain.repository.ConversationRepository;
import com.cortexplatform.core.service.ResourceNotFoundException;
import com.cortexplatform.core.service.ValidationException;
import com.cortexplatform.core.service.inprocess.InProcessServiceClient;
import com.cortexplatform.core.service.schema.ToolSchema;
import com.cortexplatform.core.service.schema.ToolSchema.JsonType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process Memory service: the only writer of conversation messages.
 *
 * <p>Tools: {@code store_input}, {@code store_message}.
 * Resources: {@code history/{conversation_id}}, {@code message/{conversation_id}/{message_id}}.
 */
@Component
@Slf4j
public class MemoryServiceClient extends InProcessServiceClient {

    public static final String SERVICE_NAME = "memory";
    public static final String TOOL_STORE_INPUT = "store_input";
    public static final String TOOL_STORE_MESSAGE = "store_message";
    public static final String RESOURCE_HISTORY = "history/{conversation_id}";
    public static final String RESOURCE_MESSAGE = "message/{conversation_id}/{message_id}";

    private static final int DEFAULT_HISTORY_LIMIT = 50;

    private final ConversationRepository repository;

    public MemoryServiceClient(ConversationRepository repository, CortexProperties properties) {
        super(SERVICE_NAME, properties.getRetry());
        this.repository = repository;

        registerTool(TOOL_STORE_INPUT, "Store a user input message",
                ToolSchema.builder()
                        .required("user_id", JsonType.STRING, "Sending user")
                        .required("conversation_id", JsonType.STRING, "Conversation the input belongs to")
                        .required("content", JsonType.STRING, "Input text")
                        .property("message_id", JsonType.STRING, "Message ID to use, generated when absent")
                        .property("metadata", JsonType.OBJECT, "Arbitrary message metadata")
                        .build(),
                this::storeInput);

        registerTool(TOOL_STORE_MESSAGE, "Store a complete message of any role",
                ToolSchema.builder()
                        .required("conversation_id", JsonType.STRING, "Conversation the message belongs to")
                        .required("sender_id", JsonType.STRING, "Sender of the message")
                        .enumProperty("role", "Message role", true, "user", "assistant", "system", "tool")
                        .required("content", JsonType.STRING, "Message text")
                        .property("message_id", JsonType.STRING, "Message ID to use, generated when absent")
                        .property("metadata", JsonType.OBJECT, "Arbitrary message metadata")
                        .build(),
                this::storeMessage);

        registerResource(RESOURCE_HISTORY, "Most recent messages of a conversation, oldest first", this::history);
        registerResource(RESOURCE_MESSAGE, "A single message", this::message);
    }

    private Mono<Map<String, Object>> storeInput(Map<String, Object> args) {
        Message message = newMessage(args, (String) args.get("user_id"), MessageRole.USER);
        return repository.save(message)
                .doOnNext(saved -> log.debug("Stored input {} in conversation {}", saved.getId(),
                        saved.getConversationId()))
                .map(MemoryServiceClient::stored);
    }

    private Mono<Map<String, Object>> storeMessage(Map<String, Object> args) {
        MessageRole role = MessageRole.fromWireName((String) args.get("role"));
        Message message = newMessage(args, (String) args.get("sender_id"), role);
        return repository.save(message)
                .doOnNext(saved -> log.debug("Stored {} message {} in conversation {}", role.wireName(),
                        saved.getId(), saved.getConversationId()))
                .map(MemoryServiceClient::stored);
    }

    @SuppressWarnings("unchecked")
    private static Message newMessage(Map<String, Object> args, String senderId, MessageRole role) {
        Object metadata = args.get("metadata");
        Message message = Message.builder()
                .id((String) args.get("message_id"))
                .conversationId((String) args.get("conversation_id"))
                .senderId(senderId)
                .role(role)
                .content((String) args.get("content"))
                .timestamp(Instant.now())
                .metadata(metadata instanceof Map<?, ?> m ? new HashMap<>((Map<String, Object>) m) : new HashMap<>())
                .build();
        message.markComplete();
        return message;
    }

    private static Map<String, Object> stored(Message message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "stored");
        result.put("message_id", message.getId());
        result.put("message", MessageMapper.toMap(message));
        return result;
    }

    private Mono<Map<String, Object>> history(Map<String, String> params) {
        String conversationId = params.get("conversation_id");
        int limit = parseLimit(params.get("limit"));
        return repository.findByConversationId(conversationId, limit)
                .map(MessageMapper::toMap)
                .collectList()
                .map(messages -> {
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("conversation_id", conversationId);
                    result.put("messages", messages);
                    result.put("count", messages.size());
                    return result;
                });
    }

    private Mono<Map<String, Object>> message(Map<String, String> params) {
        String conversationId = params.get("conversation_id");
        String messageId = params.get("message_id");
        return repository.findById(conversationId, messageId)
                .map(MessageMapper::toMap)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException(SERVICE_NAME,
                        "message/" + conversationId + "/" + messageId)));
    }

    private int parseLimit(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_HISTORY_LIMIT;
        }
        try {
            int limit = Integer.parseInt(value.trim());
            if (limit < 0) {
                throw new ValidationException(SERVICE_NAME, "limit must not be negative: " + value);
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new ValidationException(SERVICE_NAME, List.of("limit must be an integer: " + value));
        }
    }
}
