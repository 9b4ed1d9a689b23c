package com.cortexplatform.core.cognition;

import com.cortexplatform.core.config.CortexProperties;
import com.cortexplatform.core.domain.model.Message;
import com.cortexplatform.core.domain.model.MessageRole;
import com.cortexplatform.core.domain.repository.impl.InMemoryConversationRepository;
import com.cortexplatform.core.service.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CognitionServiceClientTest {

    private static final Duration DEADLINE = Duration.ofSeconds(2);
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryConversationRepository repository;
    private CognitionServiceClient cognition;

    @BeforeEach
    void setUp() {
        repository = new InMemoryConversationRepository();
        cognition = new CognitionServiceClient(repository, new CortexProperties());

        save("m1", "c1", "u1", MessageRole.USER, "how do I deploy the billing service", 0);
        save("r1", "c1", "assistant", MessageRole.ASSISTANT, "use the pipeline", 5);
        save("m2", "c2", "u1", MessageRole.USER, "what is for lunch", 10);
        save("m3", "c2", "u1", MessageRole.USER, "deploy failed again", 20);
        save("x1", "c9", "u2", MessageRole.USER, "someone else", 30);
    }

    private void save(String id, String conversationId, String sender, MessageRole role, String content, int offset) {
        repository.save(Message.builder()
                .id(id)
                .conversationId(conversationId)
                .senderId(sender)
                .role(role)
                .content(content)
                .timestamp(T0.plusSeconds(offset))
                .build()).block();
    }

    @SuppressWarnings("unchecked")
    private static List<String> contextIds(Map<String, Object> result) {
        return ((List<Map<String, Object>>) result.get("context")).stream()
                .map(m -> (String) m.get("id"))
                .toList();
    }

    @Nested
    @DisplayName("get_context")
    class GetContextTests {

        @Test
        @DisplayName("should return only the user's messages newest first without a query")
        void recencyOrder() {
            Map<String, Object> result = cognition.callTool(CognitionServiceClient.TOOL_GET_CONTEXT,
                    Map.of("user_id", "u1"), DEADLINE).block();

            assertThat(contextIds(result)).containsExactly("m3", "m2", "m1");
            assertThat(result).containsEntry("user_id", "u1").containsEntry("count", 3);
        }

        @Test
        @DisplayName("should rank relevant messages first and honour the limit")
        void rankedAndLimited() {
            Map<String, Object> result = cognition.callTool(CognitionServiceClient.TOOL_GET_CONTEXT, Map.of(
                    "user_id", "u1",
                    "query", "deploy billing",
                    "limit", 2,
                    "recency_weight", 0.1), DEADLINE).block();

            assertThat(contextIds(result)).containsExactly("m1", "m3");
        }

        @Test
        @DisplayName("should leave out the excluded message")
        void excludesMessage() {
            Map<String, Object> result = cognition.callTool(CognitionServiceClient.TOOL_GET_CONTEXT, Map.of(
                    "user_id", "u1", "exclude_message_id", "m3"), DEADLINE).block();

            assertThat(contextIds(result)).containsExactly("m2", "m1");
        }

        @Test
        @DisplayName("should require a user id")
        void requiresUser() {
            StepVerifier.create(cognition.callTool(CognitionServiceClient.TOOL_GET_CONTEXT, Map.of(), DEADLINE))
                    .expectError(ValidationException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("analyze_conversation")
    class AnalyzeTests {

        @Test
        @DisplayName("should default to a summary analysis")
        @SuppressWarnings("unchecked")
        void summaryByDefault() {
            Map<String, Object> result = cognition.callTool(CognitionServiceClient.TOOL_ANALYZE_CONVERSATION,
                    Map.of("user_id", "u1", "conversation_id", "c1"), DEADLINE).block();

            assertThat(result).containsEntry("type", "summary").containsEntry("conversation_id", "c1");
            assertThat((Map<String, Object>) result.get("results"))
                    .containsEntry("message_count", 2)
                    .containsEntry("participants", 2);
        }

        @Test
        @DisplayName("should report an unknown conversation")
        void unknownConversation() {
            Map<String, Object> result = cognition.callTool(CognitionServiceClient.TOOL_ANALYZE_CONVERSATION,
                    Map.of("user_id", "u1", "conversation_id", "nope", "analysis_type", "topics"), DEADLINE).block();

            assertThat(result).containsEntry("error", "Conversation not found").containsEntry("results", Map.of());
        }

        @Test
        @DisplayName("should reject an unknown analysis type")
        void rejectsUnknownType() {
            StepVerifier.create(cognition.callTool(CognitionServiceClient.TOOL_ANALYZE_CONVERSATION,
                            Map.of("user_id", "u1", "conversation_id", "c1", "analysis_type", "mood"), DEADLINE))
                    .expectError(ValidationException.class)
                    .verify();
        }
    }
}
