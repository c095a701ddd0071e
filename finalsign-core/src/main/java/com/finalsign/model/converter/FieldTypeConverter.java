package com.finalsign.model.converter;

import com.finalsign.model.FieldType;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class FieldTypeConverter extends PersistedEnumConverter<FieldType> {

    public FieldTypeConverter() {
        super(FieldType::fromValue);
    }
}
