package com.ai.screening.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class SchedulingStatusConverter implements AttributeConverter<SchedulingStatus, String> {

    @Override
    public String convertToDatabaseColumn(SchedulingStatus status) {
        return status == null ? null : status.getCode();
    }

    @Override
    public SchedulingStatus convertToEntityAttribute(String code) {
        return code == null ? null : SchedulingStatus.fromCode(code);
    }
}
