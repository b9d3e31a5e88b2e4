package com.ai.screening.dto;

import com.ai.screening.exception.ScreeningErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * Result of processing one inbound message. Either every success field is set or error/message are.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScreeningResult {

    private final boolean success;
    private final UUID leadId;
    private final String phone;
    private final String reply;
    private final Integer tokensTotal;
    private final Long latencyMs;
    private final Double costUsd;
    private final ScreeningErrorCode error;
    private final String message;

    public static ScreeningResult success(UUID leadId, String phone, GenerationResult generation) {
        return new ScreeningResult(true, leadId, phone, generation.getText(), generation.getTokensTotal(),
                generation.getLatencyMs(), generation.getCostUsd(), null, null);
    }

    public static ScreeningResult failure(ScreeningErrorCode error, String message) {
        return new ScreeningResult(false, null, null, null, null, null, null, error, message);
    }
}
