package com.cortexplatform.core.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for the input endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InputRequest {

    @NotBlank(message = "Content is required")
    @Size(max = 50000, message = "Content must be less than 50000 characters")
    private String content;

    @NotBlank(message = "Conversation ID is required")
    @JsonAlias("conversation_id")
    private String conversationId;

    private Map<String, Object> metadata;
}
