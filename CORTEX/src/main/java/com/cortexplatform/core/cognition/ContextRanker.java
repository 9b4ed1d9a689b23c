package com.cortexplatform.core.cognition;

import com.cortexplatform.core.domain.model.Message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orders candidate context messages by a blend of query relevance and recency.
 */
public final class ContextRanker {

    private ContextRanker() {
    }

    /**
     * Rank messages.
     *
     * @param messages candidates, any order
     * @param query free text, or {@code null} to rank by recency only
     * @param recencyWeight weight of recency against relevance, in [0, 1]
     * @return the messages, best first
     */
    public static List<Message> rank(List<Message> messages, String query, double recencyWeight) {
        List<Message> byRecency = new ArrayList<>(messages);
        byRecency.sort(Comparator.comparing(Message::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder())));
        if (query == null || query.isBlank() || byRecency.isEmpty()) {
            return byRecency;
        }

        int count = byRecency.size();
        Map<Message, Double> scores = new IdentityHashMap<>();
        for (int rank = 0; rank < count; rank++) {
            Message message = byRecency.get(rank);
            double recency = 1.0 - (double) rank / count;
            scores.put(message, (1 - recencyWeight) * relevance(message.getContent(), query) + recencyWeight * recency);
        }

        List<Message> ranked = new ArrayList<>(byRecency);
        // stable sort keeps newest first on equal scores
        ranked.sort(Comparator.comparing(scores::get, Comparator.reverseOrder()));
        return ranked;
    }

    /**
     * Fraction of the query terms contained in the content, case-insensitive.
     */
    public static double relevance(String content, String query) {
        if (content == null || query == null) {
            return 0.0;
        }
        String[] terms = query.toLowerCase(Locale.ROOT).trim().split("\\s+");
        List<String> nonEmpty = Arrays.stream(terms).filter(t -> !t.isEmpty()).toList();
        if (nonEmpty.isEmpty()) {
            return 0.0;
        }
        String text = content.toLowerCase(Locale.ROOT);
        long matches = nonEmpty.stream().filter(text::contains).count();
        return (double) matches / nonEmpty.size();
    }
}
