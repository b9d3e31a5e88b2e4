package com.ai.screening.dto;

import com.ai.screening.exception.ScreeningErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EligibilityResult {

    private final boolean success;
    private final UUID leadId;
    private final Boolean eligible;
    private final String description;
    private final ScreeningErrorCode error;
    private final String message;

    public static EligibilityResult success(UUID leadId, boolean eligible, String description) {
        return new EligibilityResult(true, leadId, eligible, description, null, null);
    }

    public static EligibilityResult failure(ScreeningErrorCode error, String message) {
        return new EligibilityResult(false, null, null, null, error, message);
    }
}
