package com.finalsign.modules.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Appends the completion manifest to the source PDF as a trailing comment block:
 *
 * <pre>
 * %FINALSIGN-MANIFEST &lt;base64 JSON&gt;
 * %%EOF
 * </pre>
 *
 * PDF readers ignore the comment, so the original pages render unchanged. Field values
 * are not drawn onto the pages.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ManifestDocumentComposer implements DocumentComposer {

    static final String MANIFEST_MARKER = "%FINALSIGN-MANIFEST ";

    private final ObjectMapper objectMapper;

    @Override
    public byte[] compose(byte[] sourcePdf, CompletionManifest manifest) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(manifest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize completion manifest", e);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(sourcePdf.length + json.length * 2);
        out.writeBytes(sourcePdf);
        String trailer = "\n" + MANIFEST_MARKER + Base64.getEncoder().encodeToString(json) + "\n%%EOF\n";
        out.writeBytes(trailer.getBytes(StandardCharsets.US_ASCII));
        log.debug("Composed final document {} ({} -> {} bytes)", manifest.getDocumentId(), sourcePdf.length,
                out.size());
        return out.toByteArray();
    }

    @Override
    public String mimeType() {
        return "application/pdf";
    }
}
