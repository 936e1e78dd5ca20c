package org.caureq.selfrepair.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class HealthStatusConverter implements AttributeConverter<HealthStatus, String> {
    @Override
    public String convertToDatabaseColumn(HealthStatus attribute) {
        return attribute == null ? null : attribute.dbValue();
    }

    @Override
    public HealthStatus convertToEntityAttribute(String dbData) {
        return HealthStatus.fromDb(dbData);
    }
}
