package com.ai.screening.entity;

import java.util.Arrays;

public enum SchedulingStatus {
    SCHEDULED("agendado"),
    CONFIRMED("confirmado"),
    COMPLETED("realizado"),
    CANCELLED("cancelado"),
    NO_SHOW("nao_compareceu");

    private final String code;

    SchedulingStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static SchedulingStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown scheduling status code: " + code));
    }
}
