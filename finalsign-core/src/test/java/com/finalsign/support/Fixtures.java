package com.finalsign.support;

import com.finalsign.modules.template.dto.FieldSpec;
import com.finalsign.modules.template.dto.SignerSpec;

import java.nio.charset.StandardCharsets;

public final class Fixtures {

    public static final byte[] PDF = "%PDF-1.7\n1 0 obj << /Type /Catalog >> endobj\n%%EOF\n"
            .getBytes(StandardCharsets.US_ASCII);

    private Fixtures() {
    }

    public static SignerSpec signer(int order, String name) {
        return SignerSpec.builder().order(order).name(name).color("#3B82F6").build();
    }

    public static FieldSpec field(String name, String type, int signerOrder) {
        return FieldSpec.builder()
                .name(name)
                .type(type)
                .signerOrder(signerOrder)
                .x(0.1)
                .y(0.2)
                .width(0.3)
                .height(0.05)
                .page(1)
                .required(true)
                .build();
    }
}
