package com.cortexplatform.core.cognition;

import com.cortexplatform.core.config.CortexProperties;
import com.cortexplatform.core.domain.model.Message;
import com.cortexplatform.core.domain.model.MessageMapper;
import com.cortexplatform.core.domain.repository.ConversationRepository;
import com.cortexplatform.core.service.inprocess.InProcessServiceClient;
import com.cortexplatform.core.service.schema.ToolSchema;
import com.cortexplatform.core.service.schema.ToolSchema.JsonType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-process Cognition service. Reads stored messages to build generation context and
 * conversation analyses; never writes.
 */
@Component
@Slf4j
public class CognitionServiceClient extends InProcessServiceClient {

    public static final String SERVICE_NAME = "cognition";
    public static final String TOOL_GET_CONTEXT = "get_context";
    public static final String TOOL_ANALYZE_CONVERSATION = "analyze_conversation";

    private static final int DEFAULT_LIMIT = 10;
    private static final double DEFAULT_RECENCY_WEIGHT = 0.5;

    private final ConversationRepository repository;

    public CognitionServiceClient(ConversationRepository repository, CortexProperties properties) {
        super(SERVICE_NAME, properties.getRetry());
        this.repository = repository;

        registerTool(TOOL_GET_CONTEXT, "Prior messages of the user most relevant to a query",
                ToolSchema.builder()
                        .required("user_id", JsonType.STRING, "User whose messages are searched")
                        .property("conversation_id", JsonType.STRING, "Conversation being answered")
                        .property("query", JsonType.STRING, "Text to rank messages against")
                        .property("limit", JsonType.INTEGER, "Maximum number of context items")
                        .property("recency_weight", JsonType.NUMBER, "Weight of recency against relevance, 0 to 1")
                        .property("exclude_message_id", JsonType.STRING, "Message to leave out, usually the input")
                        .build(),
                this::getContext);

        registerTool(TOOL_ANALYZE_CONVERSATION, "Summary, topic or sentiment statistics of a conversation",
                ToolSchema.builder()
                        .required("user_id", JsonType.STRING, "Requesting user")
                        .required("conversation_id", JsonType.STRING, "Conversation to analyze")
                        .enumProperty("analysis_type", "Kind of analysis", false,
                                ConversationAnalyzer.SUMMARY, ConversationAnalyzer.TOPICS,
                                ConversationAnalyzer.SENTIMENT)
                        .build(),
                this::analyzeConversation);
    }

    private Mono<Map<String, Object>> getContext(Map<String, Object> args) {
        String userId = (String) args.get("user_id");
        String query = (String) args.get("query");
        String excluded = (String) args.get("exclude_message_id");
        int limit = args.get("limit") instanceof Number n ? Math.max(0, n.intValue()) : DEFAULT_LIMIT;
        double recencyWeight = args.get("recency_weight") instanceof Number n
                ? Math.min(1.0, Math.max(0.0, n.doubleValue()))
                : DEFAULT_RECENCY_WEIGHT;

        return repository.findBySenderId(userId)
                .filter(message -> excluded == null || !Objects.equals(message.getId(), excluded))
                .take(limit * 2L)
                .collectList()
                .map(candidates -> {
                    List<Map<String, Object>> context = ContextRanker.rank(candidates, query, recencyWeight).stream()
                            .limit(limit)
                            .map(MessageMapper::toMap)
                            .toList();
                    log.debug("Context for {}: {} of {} candidates", userId, context.size(), candidates.size());

                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("context", context);
                    result.put("user_id", userId);
                    result.put("query", query);
                    result.put("count", context.size());
                    return result;
                });
    }

    private Mono<Map<String, Object>> analyzeConversation(Map<String, Object> args) {
        String conversationId = (String) args.get("conversation_id");
        String analysisType = args.get("analysis_type") != null
                ? (String) args.get("analysis_type")
                : ConversationAnalyzer.SUMMARY;

        return repository.findByConversationId(conversationId, Integer.MAX_VALUE)
                .collectList()
                .map(messages -> {
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("type", analysisType);
                    result.put("conversation_id", conversationId);
                    if (messages.isEmpty()) {
                        result.put("results", Map.of());
                        result.put("error", "Conversation not found");
                        return result;
                    }
                    result.put("results", analyze(analysisType, messages));
                    return result;
                });
    }

    private static Map<String, Object> analyze(String analysisType, List<Message> messages) {
        return switch (analysisType) {
            case ConversationAnalyzer.TOPICS -> ConversationAnalyzer.topics(messages);
            case ConversationAnalyzer.SENTIMENT -> ConversationAnalyzer.sentiment(messages);
            default -> ConversationAnalyzer.summary(messages);
        };
    }
}
