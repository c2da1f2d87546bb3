package com.launchpad.api.graphql.args;

import java.util.Map;

public record LaunchArgs(String id) {
    public static LaunchArgs from(Map<String, Object> arguments) {
        return new LaunchArgs(Arguments.requiredId(arguments, "id"));
    }
}
