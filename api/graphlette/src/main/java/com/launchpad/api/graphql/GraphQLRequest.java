package com.launchpad.api.graphql;

import java.util.Map;

public record GraphQLRequest(
        String query,
        String operationName,
        Map<String, Object> variables
) {
    public static GraphQLRequest of(String query) {
        return new GraphQLRequest(query, null, null);
    }
}
