package com.finalsign.modules.signature.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignatureCommand {
    /** Base64-encoded signature artifact. Stored as given, not verified. */
    private String signature;
    /** PEM certificate, optional. */
    private String certificate;
    /** Defaults to RSA-SHA256. */
    private String algorithm;
}
