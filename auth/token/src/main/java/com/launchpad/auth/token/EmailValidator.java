package com.launchpad.auth.token;

import java.util.regex.Pattern;

/**
 * Shape check only: one {@code @}, a dotted domain, no whitespace.
 */
public final class EmailValidator {
    private static final int MAX_LENGTH = 254;
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@.]+(\\.[^\\s@.]+)+$");

    private EmailValidator() {
    }

    public static boolean isValid(String candidate) {
        return candidate != null
                && candidate.length() <= MAX_LENGTH
                && EMAIL.matcher(candidate).matches();
    }
}
