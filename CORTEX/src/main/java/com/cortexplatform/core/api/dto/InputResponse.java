package com.cortexplatform.core.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement of an accepted input.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InputResponse {

    private String status;
    private String messageId;
    private String conversationId;
    private long sequence;
}
