package com.finalsign.model.converter;

import com.finalsign.model.AuditAction;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AuditActionConverter extends PersistedEnumConverter<AuditAction> {

    public AuditActionConverter() {
        super(AuditAction::fromValue);
    }
}
