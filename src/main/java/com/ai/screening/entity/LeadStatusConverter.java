package com.ai.screening.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class LeadStatusConverter implements AttributeConverter<LeadStatus, String> {

    @Override
    public String convertToDatabaseColumn(LeadStatus status) {
        return status == null ? null : status.getCode();
    }

    @Override
    public LeadStatus convertToEntityAttribute(String code) {
        return code == null ? null : LeadStatus.fromCode(code);
    }
}
