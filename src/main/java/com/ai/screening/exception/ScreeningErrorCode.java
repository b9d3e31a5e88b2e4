package com.ai.screening.exception;

import org.springframework.http.HttpStatus;

public enum ScreeningErrorCode {
    INVALID_CONTACT(HttpStatus.BAD_REQUEST),
    GENERATION_FAILED(HttpStatus.BAD_GATEWAY),
    LEAD_NOT_FOUND(HttpStatus.NOT_FOUND),
    REGION_MISSING(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_REGION(HttpStatus.BAD_REQUEST),
    PERSISTENCE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ScreeningErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
