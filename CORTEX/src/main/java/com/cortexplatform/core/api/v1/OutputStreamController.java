package com.cortexplatform.core.api.v1;

import com.cortexplatform.core.event.Event;
import com.cortexplatform.core.stream.StreamBroadcaster;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Server-Sent Events endpoint for conversation output.
 */
@RestController
@RequestMapping("/api/v1/output")
@Tag(name = "Output", description = "Stream conversation output")
@Slf4j
public class OutputStreamController {

    private final StreamBroadcaster broadcaster;

    public OutputStreamController(StreamBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream output", description = "Follow a conversation's output events; closing the connection detaches the stream")
    @ApiResponse(responseCode = "200", description = "Event stream")
    public Flux<ServerSentEvent<Object>> streamOutput(
            @Parameter(description = "Caller identity set by the gateway")
            @RequestHeader(InputController.USER_HEADER) String userId,
            @Parameter(description = "Conversation to follow")
            @RequestParam("conversation_id") String conversationId) {

        if (userId.isBlank() || conversationId.isBlank()) {
            throw new IllegalArgumentException("User and conversation IDs must not be blank");
        }

        ServerSentEvent<Object> connected = ServerSentEvent.<Object>builder()
                .event("connected")
                .data(Map.of("conversation_id", conversationId))
                .build();

        return Flux.using(
                () -> broadcaster.attach(userId, conversationId),
                handle -> {
                    log.info("Output stream {} opened for {}/{}", handle.getId(), userId, conversationId);
                    return Flux.just(connected).concatWith(handle.asFlux().map(this::toServerSentEvent));
                },
                handle -> {
                    broadcaster.detach(handle);
                    log.info("Output stream {} closed for {}/{}", handle.getId(), userId, conversationId);
                });
    }

    private ServerSentEvent<Object> toServerSentEvent(Event event) {
        return ServerSentEvent.<Object>builder()
                .id(Long.toString(event.sequence()))
                .event(event.type())
                .data(event)
                .build();
    }
}
