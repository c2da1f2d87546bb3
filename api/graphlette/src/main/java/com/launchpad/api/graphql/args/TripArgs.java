package com.launchpad.api.graphql.args;

import java.util.Map;

public record TripArgs(String launchId) {
    public static TripArgs from(Map<String, Object> arguments) {
        return new TripArgs(Arguments.requiredId(arguments, "launchId"));
    }
}
