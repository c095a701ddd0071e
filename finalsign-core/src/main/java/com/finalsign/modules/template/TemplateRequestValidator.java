package com.finalsign.modules.template;

import com.finalsign.exception.FieldError;
import com.finalsign.exception.ValidationException;
import com.finalsign.model.FieldType;
import com.finalsign.model.FieldValidationRules;
import com.finalsign.modules.template.dto.CreateTemplateCommand;
import com.finalsign.modules.template.dto.FieldSpec;
import com.finalsign.modules.template.dto.SignerSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Validates template input before anything is stored. Every problem in a request is
 * collected and reported together.
 */
@Component
public class TemplateRequestValidator {

    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");
    private static final String FIELD_TYPES = Arrays.stream(FieldType.values())
            .map(FieldType::getValue)
            .collect(Collectors.joining(", "));

    public void validateCreate(CreateTemplateCommand command) {
        List<FieldError> errors = new ArrayList<>();
        checkMetadata(command.getName(), command.getDescription(), errors);
        if (command.getPdf() == null || command.getPdf().length == 0) {
            errors.add(new FieldError("pdf", "PDF file is required"));
        }
        Set<Integer> orders = checkSigners(command.getSigners(), errors);
        checkFields(command.getFields(), orders, errors);
        throwIfAny(errors);
    }

    public void validateMetadata(String name, String description) {
        List<FieldError> errors = new ArrayList<>();
        checkMetadata(name, description, errors);
        throwIfAny(errors);
    }

    public void validateSigners(List<SignerSpec> signers) {
        List<FieldError> errors = new ArrayList<>();
        checkSigners(signers, errors);
        throwIfAny(errors);
    }

    /**
     * @param signerOrders orders of the signers the fields may reference
     */
    public void validateFields(List<FieldSpec> fields, Set<Integer> signerOrders) {
        List<FieldError> errors = new ArrayList<>();
        checkFields(fields, signerOrders, errors);
        throwIfAny(errors);
    }

    private void checkMetadata(String name, String description, List<FieldError> errors) {
        if (name == null || name.isBlank()) {
            errors.add(new FieldError("name", "template name is required"));
        } else if (name.trim().length() > MAX_NAME_LENGTH) {
            errors.add(new FieldError("name", "template name must be at most " + MAX_NAME_LENGTH + " characters"));
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            errors.add(new FieldError("description",
                    "description must be at most " + MAX_DESCRIPTION_LENGTH + " characters"));
        }
    }

    private Set<Integer> checkSigners(List<SignerSpec> signers, List<FieldError> errors) {
        Set<Integer> orders = new HashSet<>();
        if (signers == null || signers.isEmpty()) {
            errors.add(new FieldError("signers", "at least one signer is required"));
            return orders;
        }
        for (int i = 0; i < signers.size(); i++) {
            SignerSpec signer = signers.get(i);
            String prefix = "signers[" + i + "]";
            if (signer == null) {
                errors.add(new FieldError(prefix, "signer is required"));
                continue;
            }
            if (signer.getOrder() == null || signer.getOrder() <= 0) {
                errors.add(new FieldError(prefix + ".order", "signer order must be positive"));
            } else if (!orders.add(signer.getOrder())) {
                errors.add(new FieldError(prefix + ".order", "duplicate signer order " + signer.getOrder()));
            }
            if (signer.getName() == null || signer.getName().isBlank()) {
                errors.add(new FieldError(prefix + ".name", "signer name is required"));
            } else if (signer.getName().trim().length() > MAX_NAME_LENGTH) {
                errors.add(new FieldError(prefix + ".name", "signer name too long"));
            }
            if (signer.getColor() == null || !HEX_COLOR.matcher(signer.getColor()).matches()) {
                errors.add(new FieldError(prefix + ".color", "invalid color format '" + signer.getColor()
                        + "', must be hex color like #3B82F6"));
            }
        }
        return orders;
    }

    private void checkFields(List<FieldSpec> fields, Set<Integer> signerOrders, List<FieldError> errors) {
        if (fields == null) {
            return;
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < fields.size(); i++) {
            FieldSpec field = fields.get(i);
            String prefix = "fields[" + i + "]";
            if (field == null) {
                errors.add(new FieldError(prefix, "field is required"));
                continue;
            }
            if (field.getName() == null || field.getName().isBlank()) {
                errors.add(new FieldError(prefix + ".name", "field name is required"));
            } else if (field.getName().length() > MAX_NAME_LENGTH) {
                errors.add(new FieldError(prefix + ".name", "field name too long"));
            } else if (!names.add(field.getName())) {
                errors.add(new FieldError(prefix + ".name", "duplicate field name '" + field.getName() + "'"));
            }
            if (!isKnownType(field.getType())) {
                errors.add(new FieldError(prefix + ".type", "invalid field type '" + field.getType()
                        + "'. Must be one of: " + FIELD_TYPES));
            }
            if (field.getSignerOrder() == null || !signerOrders.contains(field.getSignerOrder())) {
                errors.add(new FieldError(prefix + ".signerOrder",
                        "references non-existent signer " + field.getSignerOrder()));
            }
            if (field.getLabel() != null && field.getLabel().length() > MAX_NAME_LENGTH) {
                errors.add(new FieldError(prefix + ".label", "label too long"));
            }
            if (field.getPlaceholder() != null && field.getPlaceholder().length() > MAX_NAME_LENGTH) {
                errors.add(new FieldError(prefix + ".placeholder", "placeholder too long"));
            }
            checkPosition(field, prefix, errors);
            checkRules(field.getValidationRules(), prefix, errors);
        }
    }

    private void checkPosition(FieldSpec field, String prefix, List<FieldError> errors) {
        checkOffset(field.getX(), prefix + ".x", errors);
        checkOffset(field.getY(), prefix + ".y", errors);
        checkExtent(field.getWidth(), prefix + ".width", errors);
        checkExtent(field.getHeight(), prefix + ".height", errors);
        if (field.getPage() != null && field.getPage() < 1) {
            errors.add(new FieldError(prefix + ".page", "page must be at least 1"));
        }
    }

    private void checkOffset(Double value, String path, List<FieldError> errors) {
        if (value == null) {
            errors.add(new FieldError(path, "missing required position value"));
        } else if (!Double.isFinite(value) || value < 0) {
            errors.add(new FieldError(path, "must be non-negative"));
        }
    }

    private void checkExtent(Double value, String path, List<FieldError> errors) {
        if (value == null) {
            errors.add(new FieldError(path, "missing required position value"));
        } else if (!Double.isFinite(value) || value <= 0) {
            errors.add(new FieldError(path, "must be greater than 0"));
        }
    }

    private void checkRules(FieldValidationRules rules, String prefix, List<FieldError> errors) {
        if (rules == null) {
            return;
        }
        if (rules.getMinLength() != null && rules.getMinLength() < 0) {
            errors.add(new FieldError(prefix + ".validationRules.minLength", "must be non-negative"));
        }
        if (rules.getMaxLength() != null && rules.getMaxLength() < 1) {
            errors.add(new FieldError(prefix + ".validationRules.maxLength", "must be positive"));
        }
        if (rules.getMinLength() != null && rules.getMaxLength() != null
                && rules.getMinLength() > rules.getMaxLength()) {
            errors.add(new FieldError(prefix + ".validationRules", "minLength exceeds maxLength"));
        }
        if (rules.getPattern() != null) {
            try {
                Pattern.compile(rules.getPattern());
            } catch (PatternSyntaxException e) {
                errors.add(new FieldError(prefix + ".validationRules.pattern", "invalid pattern"));
            }
        }
    }

    private static boolean isKnownType(String type) {
        return Arrays.stream(FieldType.values()).anyMatch(t -> t.getValue().equals(type));
    }

    private static void throwIfAny(List<FieldError> errors) {
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
