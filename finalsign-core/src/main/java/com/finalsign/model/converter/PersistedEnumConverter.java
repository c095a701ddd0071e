package com.finalsign.model.converter;

import com.finalsign.model.PersistedEnum;
import jakarta.persistence.AttributeConverter;

import java.util.function.Function;

/**
 * Stores a {@link PersistedEnum} as its lower-case value, matching the CHECK constraints
 * in the schema.
 */
abstract class PersistedEnumConverter<E extends Enum<E> & PersistedEnum>
        implements AttributeConverter<E, String> {

    private final Function<String, E> parser;

    protected PersistedEnumConverter(Function<String, E> parser) {
        this.parser = parser;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        return dbData != null ? parser.apply(dbData) : null;
    }
}
