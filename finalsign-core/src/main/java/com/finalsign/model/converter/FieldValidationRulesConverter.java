package com.finalsign.model.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finalsign.model.FieldValidationRules;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * JSONB column mapping for {@link FieldValidationRules}. Unknown keys written by older
 * clients are ignored on read.
 */
@Converter(autoApply = true)
public class FieldValidationRulesConverter implements AttributeConverter<FieldValidationRules, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public String convertToDatabaseColumn(FieldValidationRules attribute) {
        if (attribute == null) {
            return "{}";
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize validation rules", e);
        }
    }

    @Override
    public FieldValidationRules convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return FieldValidationRules.none();
        }
        try {
            return MAPPER.readValue(dbData, FieldValidationRules.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse validation rules: " + dbData, e);
        }
    }
}
