package com.ai.screening.entity;

import java.util.Arrays;

/**
 * Qualification funnel for a lead.
 * NEW -> IN_SCREENING -> AWAITING_RESPONSE -> SCHEDULED | NOT_ELIGIBLE,
 * with the side branch NO_RESPONSE -> RECOVERING -> INACTIVE.
 */
public enum LeadStatus {
    NEW("novo"),
    IN_SCREENING("em_triagem"),
    AWAITING_RESPONSE("aguardando_resposta"),
    SCHEDULED("agendado"),
    NOT_ELIGIBLE("nao_elegivel"),
    NO_RESPONSE("sem_resposta"),
    RECOVERING("recuperando"),
    INACTIVE("inativo");

    private final String code;

    LeadStatus(String code) {
        this.code = code;
    }

    /** Stable storage value; never changes once rows exist. */
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == SCHEDULED || this == NOT_ELIGIBLE || this == INACTIVE;
    }

    public static LeadStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown lead status code: " + code));
    }
}
