package com.cortexplatform.core.orchestration;

import java.util.List;
import java.util.Map;

/**
 * Everything a {@link ResponseGenerator} may use to answer one input.
 *
 * @param userId requesting user
 * @param conversationId conversation being answered
 * @param content the input text
 * @param history recent conversation messages, oldest first
 * @param context related prior messages of the user, most relevant first
 */
public record GenerationRequest(
        String userId,
        String conversationId,
        String content,
        List<Map<String, Object>> history,
        List<Map<String, Object>> context
) {

    public GenerationRequest {
        history = history != null ? List.copyOf(history) : List.of();
        context = context != null ? List.copyOf(context) : List.of();
    }
}
