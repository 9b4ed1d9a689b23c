package com.cortexplatform.core.cognition;

import com.cortexplatform.core.domain.model.Message;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ContextRankerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static Message message(String id, String content, int secondsAfterStart) {
        return Message.builder().id(id).content(content).timestamp(T0.plusSeconds(secondsAfterStart)).build();
    }

    private final List<Message> candidates = List.of(
            message("old", "deploy the billing service", 0),
            message("mid", "lunch plans", 10),
            message("new", "weather today", 20));

    @Test
    @DisplayName("should order by recency when there is no query")
    void recencyOnly() {
        assertThat(ContextRanker.rank(candidates, null, 0.5)).extracting(Message::getId)
                .containsExactly("new", "mid", "old");
    }

    @Test
    @DisplayName("should promote relevant messages when relevance dominates")
    void relevanceWins() {
        assertThat(ContextRanker.rank(candidates, "billing deploy", 0.2)).extracting(Message::getId)
                .containsExactly("old", "new", "mid");
    }

    @Test
    @DisplayName("should keep recency order when recency dominates")
    void recencyWins() {
        assertThat(ContextRanker.rank(candidates, "billing deploy", 1.0)).extracting(Message::getId)
                .containsExactly("new", "mid", "old");
    }

    @Test
    @DisplayName("should score relevance as the fraction of matched query terms")
    void relevanceScore() {
        assertThat(ContextRanker.relevance("Deploy the BILLING service", "billing invoices")).isCloseTo(0.5, within(1e-9));
        assertThat(ContextRanker.relevance("anything", "   ")).isZero();
        assertThat(ContextRanker.relevance(null, "query")).isZero();
    }
}
