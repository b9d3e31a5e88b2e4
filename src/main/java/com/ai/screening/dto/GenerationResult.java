package com.ai.screening.dto;

/**
 * Outcome of a language-model call: either a reply with usage metadata or a typed failure.
 * Usage fields are null when the provider did not report them.
 */
public final class GenerationResult {

    public enum Failure {
        TIMEOUT,
        UPSTREAM_ERROR
    }

    private final String text;
    private final Integer tokensInput;
    private final Integer tokensOutput;
    private final Integer tokensTotal;
    private final Double costUsd;
    private final Integer costCents;
    private final Long latencyMs;
    private final Failure failure;
    private final String errorMessage;

    private GenerationResult(String text, Integer tokensInput, Integer tokensOutput, Integer tokensTotal,
                             Double costUsd, Integer costCents, Long latencyMs,
                             Failure failure, String errorMessage) {
        this.text = text;
        this.tokensInput = tokensInput;
        this.tokensOutput = tokensOutput;
        this.tokensTotal = tokensTotal;
        this.costUsd = costUsd;
        this.costCents = costCents;
        this.latencyMs = latencyMs;
        this.failure = failure;
        this.errorMessage = errorMessage;
    }

    public static GenerationResult success(String text, Integer tokensInput, Integer tokensOutput,
                                           Integer tokensTotal, Double costUsd, Integer costCents,
                                           Long latencyMs) {
        return new GenerationResult(text != null ? text : "", tokensInput, tokensOutput, tokensTotal,
                costUsd, costCents, latencyMs, null, null);
    }

    public static GenerationResult failure(Failure failure, String errorMessage) {
        return new GenerationResult(null, null, null, null, null, null, null, failure, errorMessage);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String getText() {
        return text;
    }

    public Integer getTokensInput() {
        return tokensInput;
    }

    public Integer getTokensOutput() {
        return tokensOutput;
    }

    public Integer getTokensTotal() {
        return tokensTotal;
    }

    public Double getCostUsd() {
        return costUsd;
    }

    public Integer getCostCents() {
        return costCents;
    }

    public Long getLatencyMs() {
        return latencyMs;
    }

    public Failure getFailure() {
        return failure;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
