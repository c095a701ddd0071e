package com.finalsign.model.converter;

import com.finalsign.model.DocumentStatus;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class DocumentStatusConverter extends PersistedEnumConverter<DocumentStatus> {

    public DocumentStatusConverter() {
        super(DocumentStatus::fromValue);
    }
}
