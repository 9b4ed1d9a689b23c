package com.cortexplatform.core.cognition;

import com.cortexplatform.core.domain.model.Message;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConversationAnalyzerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static Message message(String sender, String content, int secondsAfterStart) {
        return Message.builder().senderId(sender).content(content).timestamp(T0.plusSeconds(secondsAfterStart)).build();
    }

    @Test
    @DisplayName("should summarize message and participant counts with duration")
    void summary() {
        Map<String, Object> summary = ConversationAnalyzer.summary(List.of(
                message("u1", "hello", 0),
                message("assistant", "hi there", 10),
                message("u1", "thanks", 30)));

        assertThat(summary)
                .containsEntry("message_count", 3)
                .containsEntry("participants", 2)
                .containsEntry("duration_seconds", 30.0)
                .containsEntry("participant_counts", Map.of("u1", 2, "assistant", 1));
    }

    @Test
    @DisplayName("should extract frequent words longer than three letters")
    @SuppressWarnings("unchecked")
    void topics() {
        Map<String, Object> topics = ConversationAnalyzer.topics(List.of(
                message("u1", "deploy deploy pipeline the with", 0)));

        assertThat(topics).containsEntry("word_count", 5);
        List<Map<String, Object>> keywords = (List<Map<String, Object>>) topics.get("keywords");
        assertThat(keywords).containsExactly(
                Map.of("word", "deploy", "count", 2),
                Map.of("word", "pipeline", "count", 1));
    }

    @Test
    @DisplayName("should score sentiment from positive and negative words")
    void sentiment() {
        Map<String, Object> sentiment = ConversationAnalyzer.sentiment(List.of(
                message("u1", "great work, I love it", 0),
                message("u1", "one small problem", 5)));

        assertThat(sentiment).containsEntry("positive_count", 2).containsEntry("negative_count", 1);
        assertThat((Double) sentiment.get("sentiment_score")).isCloseTo(1.0 / 3, within(1e-9));
    }
}
