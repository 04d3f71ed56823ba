package com.licitia.etl.domain.entity;

import com.licitia.etl.domain.enums.Frequency;
import com.licitia.etl.exception.InvalidFrequencyException;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Converter
public class FrequencyConverter implements AttributeConverter<Frequency, String> {

    @Override
    public String convertToDatabaseColumn(Frequency attribute) {
        return attribute == null ? null : attribute.getLabel();
    }

    // rows written by hand without a usable label fall back to quarterly
    @Override
    public Frequency convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return Frequency.QUARTERLY;
        }
        try {
            return Frequency.parse(dbData);
        } catch (InvalidFrequencyException e) {
            log.warn("Unknown schedule_expr '{}', treating it as {}", dbData, Frequency.QUARTERLY.getLabel());
            return Frequency.QUARTERLY;
        }
    }
}
