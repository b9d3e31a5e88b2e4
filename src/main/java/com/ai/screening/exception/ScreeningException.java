package com.ai.screening.exception;

/**
 * Business failure inside the screening service layer. Never crosses the orchestrator's public methods.
 */
public class ScreeningException extends RuntimeException {

    private final ScreeningErrorCode code;

    public ScreeningException(ScreeningErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ScreeningException(ScreeningErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ScreeningErrorCode code() {
        return code;
    }

    public static ScreeningException leadNotFound(Object leadId) {
        return new ScreeningException(ScreeningErrorCode.LEAD_NOT_FOUND, "Lead not found: " + leadId);
    }
}
