package com.cortexplatform.core.orchestration;

import com.cortexplatform.core.config.CortexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic generator that echoes the input, streamed in fixed-size chunks.
 * Used when no model-backed generator is configured.
 */
@Component
@Slf4j
public class EchoResponseGenerator implements ResponseGenerator {

    private final int chunkSize;
    private final Duration chunkDelay;

    @Autowired
    public EchoResponseGenerator(CortexProperties properties) {
        this(properties.getGenerator().getChunkSize(), properties.getGenerator().getChunkDelay());
    }

    public EchoResponseGenerator(int chunkSize, Duration chunkDelay) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.chunkDelay = chunkDelay != null ? chunkDelay : Duration.ZERO;
    }

    @Override
    public Flux<String> generate(GenerationRequest request) {
        String reply = reply(request);
        log.debug("Echo reply for {}/{}: {} chars", request.userId(), request.conversationId(), reply.length());
        Flux<String> chunks = Flux.fromIterable(chunk(reply, chunkSize));
        return chunkDelay.isZero() ? chunks : chunks.delayElements(chunkDelay);
    }

    static String reply(GenerationRequest request) {
        StringBuilder text = new StringBuilder("You said: ").append(request.content());
        if (!request.context().isEmpty()) {
            text.append(" (").append(request.context().size()).append(" related earlier messages)");
        }
        return text.toString();
    }

    static List<String> chunk(String text, int size) {
        List<String> chunks = new ArrayList<>();
        for (int i = 0; i < text.length(); i += size) {
            chunks.add(text.substring(i, Math.min(text.length(), i + size)));
        }
        return chunks;
    }
}
