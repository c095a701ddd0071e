package com.finalsign.modules.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.finalsign.model.FieldPosition;
import com.finalsign.model.FieldValidationRules;
import com.finalsign.model.entity.Template;
import com.finalsign.model.entity.TemplateField;
import com.finalsign.model.entity.TemplateSigner;
import com.finalsign.service.crypto.Sha256;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Fingerprints a template's signer and field definitions. The serialization is
 * canonical: signers sorted by order, fields by name, map keys sorted, and fields refer
 * to their signer by order rather than row id so the hash depends only on content.
 */
@Component
public class TemplateSnapshotHasher {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    public String hash(Template template, List<TemplateSigner> signers, List<TemplateField> fields) {
        Map<UUID, Integer> orderBySignerId = signers.stream()
                .collect(Collectors.toMap(TemplateSigner::getId, TemplateSigner::getOrder));

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("templateId", String.valueOf(template.getId()));
        snapshot.put("version", template.getVersion());
        snapshot.put("contentHash", template.getContent() != null ? template.getContent().getContentHash() : null);
        snapshot.put("signers", signers.stream()
                .sorted(Comparator.comparing(TemplateSigner::getOrder))
                .map(this::signerEntry)
                .collect(Collectors.toList()));
        snapshot.put("fields", fields.stream()
                .sorted(Comparator.comparing(TemplateField::getName))
                .map(f -> fieldEntry(f, orderBySignerId.get(f.getSignerId())))
                .collect(Collectors.toList()));

        try {
            return Sha256.hex(canonicalMapper.writeValueAsBytes(snapshot));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize template snapshot", e);
        }
    }

    private Map<String, Object> signerEntry(TemplateSigner signer) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("order", signer.getOrder());
        entry.put("name", signer.getName());
        entry.put("color", signer.getColor());
        return entry;
    }

    private Map<String, Object> fieldEntry(TemplateField field, Integer signerOrder) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", field.getName());
        entry.put("type", field.getType() != null ? field.getType().getValue() : null);
        entry.put("signerOrder", signerOrder);
        entry.put("label", field.getLabel());
        entry.put("placeholder", field.getPlaceholder());
        entry.put("required", field.isRequired());
        FieldPosition p = field.getPosition();
        if (p != null) {
            entry.put("position", Arrays.asList(p.getX(), p.getY(), p.getWidth(), p.getHeight(), p.getPage()));
        }
        FieldValidationRules rules = field.getValidationRules();
        if (rules != null) {
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("minLength", rules.getMinLength());
            r.put("maxLength", rules.getMaxLength());
            r.put("pattern", rules.getPattern());
            entry.put("validationRules", r);
        }
        return entry;
    }
}
