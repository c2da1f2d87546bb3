package com.launchpad.api.graphql.args;

import java.util.Map;

final class Arguments {
    private Arguments() {
    }

    static String requiredId(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Argument '" + name + "' is required");
        }
        return value.toString();
    }
}
