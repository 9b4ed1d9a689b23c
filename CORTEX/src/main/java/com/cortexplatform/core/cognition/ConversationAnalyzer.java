package com.cortexplatform.core.cognition;

import com.cortexplatform.core.domain.model.Message;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rule-based conversation statistics: summary, topics and sentiment.
 */
public final class ConversationAnalyzer {

    public static final String SUMMARY = "summary";
    public static final String TOPICS = "topics";
    public static final String SENTIMENT = "sentiment";

    private static final int MAX_TOPICS = 10;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "of", "to", "in", "is", "it", "that", "this", "for", "with");

    private static final Set<String> POSITIVE_WORDS = Set.of(
            "good", "great", "excellent", "amazing", "awesome", "fantastic", "wonderful", "happy", "like", "love");

    private static final Set<String> NEGATIVE_WORDS = Set.of(
            "bad", "terrible", "awful", "horrible", "disappointing", "sad", "hate", "dislike", "wrong", "problem");

    private ConversationAnalyzer() {
    }

    public static Map<String, Object> summary(List<Message> messages) {
        Map<String, Integer> perSender = new LinkedHashMap<>();
        for (Message message : messages) {
            String sender = message.getSenderId() != null ? message.getSenderId() : "unknown";
            perSender.merge(sender, 1, Integer::sum);
        }

        List<Instant> timestamps = messages.stream()
                .map(Message::getTimestamp)
                .filter(Objects::nonNull)
                .toList();
        double durationSeconds = 0.0;
        if (timestamps.size() >= 2) {
            Instant first = timestamps.stream().min(Comparator.naturalOrder()).orElseThrow();
            Instant last = timestamps.stream().max(Comparator.naturalOrder()).orElseThrow();
            durationSeconds = Duration.between(first, last).toMillis() / 1000.0;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message_count", messages.size());
        result.put("participants", perSender.size());
        result.put("duration_seconds", durationSeconds);
        result.put("participant_counts", perSender);
        return result;
    }

    public static Map<String, Object> topics(List<Message> messages) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        int wordCount = 0;
        for (Message message : messages) {
            if (message.getContent() == null) {
                continue;
            }
            for (String word : message.getContent().toLowerCase(Locale.ROOT).split("\\s+")) {
                if (word.isEmpty()) {
                    continue;
                }
                wordCount++;
                if (word.length() > 3 && !STOP_WORDS.contains(word)) {
                    counts.merge(word, 1, Integer::sum);
                }
            }
        }

        List<Map<String, Object>> keywords = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(MAX_TOPICS)
                .map(e -> Map.<String, Object>of("word", e.getKey(), "count", e.getValue()))
                .toList();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("keywords", keywords);
        result.put("word_count", wordCount);
        return result;
    }

    public static Map<String, Object> sentiment(List<Message> messages) {
        int positive = 0;
        int negative = 0;
        for (Message message : messages) {
            String content = message.getContent() != null ? message.getContent().toLowerCase(Locale.ROOT) : "";
            positive += (int) POSITIVE_WORDS.stream().filter(content::contains).count();
            negative += (int) NEGATIVE_WORDS.stream().filter(content::contains).count();
        }
        int total = positive + negative;
        double score = total > 0 ? (double) (positive - negative) / total : 0.0;

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("sentiment_score", score);
        result.put("positive_count", positive);
        result.put("negative_count", negative);
        return result;
    }
}
