package com.finalsign.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks sensitive data in log messages.
 * <ul>
 * <li>Recipient access tokens ({@code token=}, {@code access_token}): first 6 chars + "..."</li>
 * <li>Encryption key assignments: "[REDACTED]"</li>
 * <li>E-mail addresses: first character of the local part only</li>
 * <li>Phone numbers: last 4 digits only (***1234)</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.finalsign.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // token=<value>, access_token=<value> or "accessToken":"<value>"
    private static final Pattern TOKEN_PATTERN = Pattern
            .compile("((?:access_?token|accessToken|token)[\"=:]+\\s*[\"']?)([A-Za-z0-9_\\-]{6})[A-Za-z0-9_\\-]+");

    private static final Pattern KEY_ASSIGNMENT_PATTERN = Pattern
            .compile("((?:encryption[._-]?key|DOCUMENT_ENCRYPTION_KEY)[\"=:]+\\s*[\"']?)[^\"&\\s,]+");

    private static final Pattern EMAIL_PATTERN = Pattern
            .compile("\\b([A-Za-z0-9])[A-Za-z0-9._%+-]*@([A-Za-z0-9.-]+\\.[A-Za-z]{2,})\\b");

    private static final Pattern PHONE_PATTERN = Pattern.compile("(\\+\\d{1,4})(\\d+)(\\d{4})");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = TOKEN_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = KEY_ASSIGNMENT_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = EMAIL_PATTERN.matcher(masked).replaceAll("$1***@$2");
        masked = PHONE_PATTERN.matcher(masked).replaceAll("***$3");
        return masked;
    }
}
