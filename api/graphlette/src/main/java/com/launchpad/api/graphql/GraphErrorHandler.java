package com.launchpad.api.graphql;

import com.launchpad.core.AuthorizationException;
import graphql.ErrorType;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.execution.DataFetcherExceptionHandler;
import graphql.execution.DataFetcherExceptionHandlerParameters;
import graphql.execution.DataFetcherExceptionHandlerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns resolver failures into field errors carrying an {@code extensions.code}. The failing field
 * resolves to null and its siblings carry on.
 */
public class GraphErrorHandler implements DataFetcherExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GraphErrorHandler.class);

    public static final String UNAUTHENTICATED = "UNAUTHENTICATED";
    public static final String BAD_USER_INPUT = "BAD_USER_INPUT";
    public static final String INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";

    @Override
    public CompletableFuture<DataFetcherExceptionHandlerResult> handleException(DataFetcherExceptionHandlerParameters params) {
        Throwable exception = unwrap(params.getException());
        String code;

        if (exception instanceof AuthorizationException) {
            code = UNAUTHENTICATED;
            logger.debug("Rejected anonymous call to {}", params.getPath());
        } else if (exception instanceof IllegalArgumentException) {
            code = BAD_USER_INPUT;
            logger.debug("Bad input for {}: {}", params.getPath(), exception.getMessage());
        } else {
            code = INTERNAL_SERVER_ERROR;
            logger.error("Failed to resolve {}", params.getPath(), exception);
        }

        GraphQLError error = GraphqlErrorBuilder.newError()
                .message(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName())
                .path(params.getPath())
                .location(params.getSourceLocation())
                .errorType(ErrorType.DataFetchingException)
                .extensions(Map.of("code", code))
                .build();

        return CompletableFuture.completedFuture(DataFetcherExceptionHandlerResult.newResult().error(error).build());
    }

    static Throwable unwrap(Throwable exception) {
        Throwable current = exception;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
