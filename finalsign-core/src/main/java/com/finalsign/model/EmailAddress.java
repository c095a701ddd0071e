package com.finalsign.model;

import java.util.regex.Pattern;

/**
 * Syntactic e-mail check shared by recipient binding and {@code email} fields.
 */
public final class EmailAddress {

    private static final Pattern PATTERN = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private EmailAddress() {
        // utility class
    }

    public static boolean isValid(String value) {
        return value != null && PATTERN.matcher(value).matches();
    }
}
