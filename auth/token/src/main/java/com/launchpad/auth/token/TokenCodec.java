package com.launchpad.auth.token;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Mints and reads bearer tokens.
 *
 * IMPORTANT: a token is nothing more than the Base64 form of the user's email. It is not signed and
 * never expires, so anyone who knows an email can mint a token for it. Treat it as an obscured
 * identifier rather than a credential. Replacing it with a signed, expiring token changes what
 * clients see and has to be done deliberately.
 */
public final class TokenCodec {
    private TokenCodec() {
    }

    public static String encode(String email) {
        return Base64.getEncoder().encodeToString(email.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return the decoded email, or an empty string when {@code token} is null or not Base64
     */
    public static String decode(String token) {
        if (token == null || token.isBlank()) {
            return "";
        }
        try {
            return new String(Base64.getDecoder().decode(token.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
