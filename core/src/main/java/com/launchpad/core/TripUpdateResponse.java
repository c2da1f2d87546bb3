package com.launchpad.core;

import java.util.List;

/**
 * Outcome of a booking mutation. {@code launches} holds the launches the mutation touched that the
 * catalog could resolve.
 */
public record TripUpdateResponse(
        boolean success,
        String message,
        List<Launch> launches
) {
    public TripUpdateResponse {
        launches = launches != null ? List.copyOf(launches) : List.of();
    }
}
