package com.finalsign.modules.submission;

import com.finalsign.exception.ValidationException;
import com.finalsign.model.EmailAddress;
import com.finalsign.model.FieldValidationRules;
import com.finalsign.model.entity.TemplateField;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks a submitted value against its field's type and rules and returns the value to
 * store. Blank values of optional fields normalize to null.
 */
@Component
public class FieldValueValidator {

    static final int MAX_VALUE_LENGTH = 1_048_576;

    private static final Pattern PHONE = Pattern.compile("^\\+?[0-9 ().-]{7,20}$");

    public String validate(TemplateField field, String value) {
        String name = field.getName();
        if (value == null || value.isBlank()) {
            if (field.isRequired()) {
                throw new ValidationException(name, "value is required");
            }
            return null;
        }
        if (value.length() > MAX_VALUE_LENGTH) {
            throw new ValidationException(name, "value is too large");
        }

        String normalized;
        switch (field.getType()) {
            case EMAIL -> normalized = requireEmail(name, value.trim());
            case PHONE -> normalized = requirePhone(name, value.trim());
            case DATE -> normalized = requireDate(name, value.trim());
            case CHECKBOX -> normalized = requireCheckbox(name, value.trim().toLowerCase(Locale.ROOT));
            default -> normalized = value;
        }

        applyRules(name, field.getValidationRules(), normalized);
        return normalized;
    }

    private static String requireEmail(String name, String value) {
        if (!EmailAddress.isValid(value)) {
            throw new ValidationException(name, "invalid email address");
        }
        return value;
    }

    private static String requirePhone(String name, String value) {
        if (!PHONE.matcher(value).matches()) {
            throw new ValidationException(name, "invalid phone number");
        }
        return value;
    }

    private static String requireDate(String name, String value) {
        try {
            LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(name, "date must be formatted as YYYY-MM-DD");
        }
        return value;
    }

    private static String requireCheckbox(String name, String value) {
        if (!"true".equals(value) && !"false".equals(value)) {
            throw new ValidationException(name, "checkbox value must be true or false");
        }
        return value;
    }

    private void applyRules(String name, FieldValidationRules rules, String value) {
        if (rules == null) {
            return;
        }
        if (rules.getMinLength() != null && value.length() < rules.getMinLength()) {
            throw new ValidationException(name, "must be at least " + rules.getMinLength() + " characters");
        }
        if (rules.getMaxLength() != null && value.length() > rules.getMaxLength()) {
            throw new ValidationException(name, "must be at most " + rules.getMaxLength() + " characters");
        }
        if (rules.getPattern() != null && !Pattern.compile(rules.getPattern()).matcher(value).matches()) {
            throw new ValidationException(name, "does not match the required format");
        }
    }
}
