package com.finalsign.model.converter;

import com.finalsign.model.SignerStatus;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class SignerStatusConverter extends PersistedEnumConverter<SignerStatus> {

    public SignerStatusConverter() {
        super(SignerStatus::fromValue);
    }
}
