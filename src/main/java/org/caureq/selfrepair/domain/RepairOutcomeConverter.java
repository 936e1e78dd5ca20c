package org.caureq.selfrepair.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class RepairOutcomeConverter implements AttributeConverter<RepairOutcome, String> {
    @Override
    public String convertToDatabaseColumn(RepairOutcome attribute) {
        return attribute == null ? null : attribute.dbValue();
    }

    @Override
    public RepairOutcome convertToEntityAttribute(String dbData) {
        return RepairOutcome.fromDb(dbData);
    }
}
