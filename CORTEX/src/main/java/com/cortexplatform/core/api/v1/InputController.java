package com.cortexplatform.core.api.v1;

import com.cortexplatform.core.api.dto.InputRequest;
import com.cortexplatform.core.api.dto.InputResponse;
import com.cortexplatform.core.event.Event;
import com.cortexplatform.core.event.EventBus;
import com.cortexplatform.core.event.EventTypes;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller accepting user input.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Input", description = "Submit user input")
@Slf4j
public class InputController {

    public static final String USER_HEADER = "X-User-Id";

    private final EventBus eventBus;

    public InputController(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostMapping("/input")
    @Operation(summary = "Submit input", description = "Publish user input for a conversation; the reply arrives on the output stream")
    @ApiResponse(responseCode = "202", description = "Input accepted")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    @ApiResponse(responseCode = "503", description = "Shutting down")
    public Mono<ResponseEntity<InputResponse>> submitInput(
            @Parameter(description = "Caller identity set by the gateway") @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody InputRequest request) {

        return Mono.fromCallable(() -> {
            if (userId.isBlank()) {
                throw new IllegalArgumentException(USER_HEADER + " header must not be blank");
            }
            String messageId = UUID.randomUUID().toString();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("message_id", messageId);
            payload.put("content", request.getContent());
            if (request.getMetadata() != null) {
                payload.put("metadata", request.getMetadata());
            }

            Event published = eventBus.publish(
                    Event.of(EventTypes.INPUT, userId, request.getConversationId(), payload));
            log.info("Accepted input {} for {}/{} (#{})", messageId, userId,
                    request.getConversationId(), published.sequence());

            return ResponseEntity.status(HttpStatus.ACCEPTED).body(InputResponse.builder()
                    .status("accepted")
                    .messageId(messageId)
                    .conversationId(request.getConversationId())
                    .sequence(published.sequence())
                    .build());
        });
    }
}
