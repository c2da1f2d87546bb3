package com.launchpad.api.graphql.args;

import java.util.Map;

/**
 * @param email as sent by the client; may be null or malformed, the login resolver decides
 */
public record LoginArgs(String email) {
    public static LoginArgs from(Map<String, Object> arguments) {
        Object email = arguments.get("email");
        return new LoginArgs(email != null ? email.toString().trim() : null);
    }
}
