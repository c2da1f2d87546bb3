package com.launchpad.api.graphql;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.launchpad.core.Auth;
import com.launchpad.core.CatalogSource;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.RequestContext;
import graphql.ExecutionInput;
import graphql.ExecutionResult;
import graphql.GraphQL;
import graphql.execution.AsyncExecutionStrategy;
import graphql.execution.AsyncSerialExecutionStrategy;
import graphql.schema.DataFetcher;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.RuntimeWiring;
import graphql.schema.idl.SchemaGenerator;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.dataloader.DataLoaderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Serves the launch graph over HTTP. Each request gets its own {@link RequestContext}, built from the
 * {@code Authorization} header, and its own {@link DataLoaderRegistry}.
 */
public class Graphlette extends HttpServlet {
    private static final Logger logger = LoggerFactory.getLogger(Graphlette.class);
    // Integral variables stay Long so ID and Int arguments coerce exactly
    private static final Gson gson = new GsonBuilder()
        .serializeNulls()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .create();
    private static final String SCHEMA = "launchpad.graphql";

    private final transient GraphQL graphQL;
    private final transient Auth auth;
    private final transient CatalogSource catalog;
    private final transient IdentitySource identity;

    public Graphlette(Auth auth, CatalogSource catalog, IdentitySource identity) {
        this(auth, catalog, identity, Root.create());
    }

    public Graphlette(
            Auth auth,
            CatalogSource catalog,
            IdentitySource identity,
            Map<String, Map<String, DataFetcher<?>>> fetchers
    ) {
        this.auth = auth;
        this.catalog = catalog;
        this.identity = identity;

        TypeDefinitionRegistry typeDefinitionRegistry = new SchemaParser().parse(loadSchema());

        RuntimeWiring.Builder builder = RuntimeWiring.newRuntimeWiring();
        fetchers.forEach((typeName, fields) -> builder.type(typeName, typeBuilder -> {
            fields.forEach(typeBuilder::dataFetcher);
            return typeBuilder;
        }));

        GraphQLSchema graphQLSchema = new SchemaGenerator().makeExecutableSchema(typeDefinitionRegistry, builder.build());

        GraphErrorHandler errorHandler = new GraphErrorHandler();
        this.graphQL = GraphQL.newGraphQL(graphQLSchema)
            .queryExecutionStrategy(new AsyncExecutionStrategy(errorHandler))
            .mutationExecutionStrategy(new AsyncSerialExecutionStrategy(errorHandler))
            .build();
    }

    /**
     * Runs one operation against an already built context.
     */
    public CompletableFuture<ExecutionResult> execute(GraphQLRequest request, RequestContext context) {
        // Fresh registry per request to prevent cache leaks
        DataLoaderRegistry registry = DataLoaderFactory.createRegistry(context);
        Map<Object, Object> graphQLContext = Map.of(RequestContext.class, context);

        ExecutionInput input = ExecutionInput.newExecutionInput()
            .query(request.query())
            .operationName(request.operationName())
            .variables(request.variables() != null ? request.variables() : Map.of())
            .dataLoaderRegistry(registry)
            .graphQLContext(graphQLContext)
            .build();

        return graphQL.executeAsync(input);
    }

    /**
     * Authenticates and executes without HTTP. The returned future fails when the context cannot be built.
     */
    public CompletableFuture<ExecutionResult> execute(GraphQLRequest request, String authorization) {
        return auth.authenticate(authorization, catalog, identity)
            .thenCompose(context -> execute(request, context));
    }

    /**
     * @return the response as JSON
     */
    public String executeInternal(String query, String authorization) {
        ExecutionResult result = execute(GraphQLRequest.of(query), authorization).join();
        return gson.toJson(result.toSpecification());
    }

    @Override
    protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
        response.setContentType("application/json");

        GraphQLRequest graphQLRequest;
        try {
            String body = request.getReader().lines().collect(Collectors.joining());
            graphQLRequest = gson.fromJson(body, GraphQLRequest.class);
        } catch (JsonParseException e) {
            writeError(response, HttpServletResponse.SC_BAD_REQUEST, "Request body is not valid JSON");
            return;
        }
        if (graphQLRequest == null || graphQLRequest.query() == null || graphQLRequest.query().isBlank()) {
            writeError(response, HttpServletResponse.SC_BAD_REQUEST, "Missing query");
            return;
        }

        RequestContext context;
        try {
            context = auth.authenticate(request.getHeader("Authorization"), catalog, identity).join();
        } catch (CompletionException e) {
            logger.error("Failed to build request context", GraphErrorHandler.unwrap(e));
            writeError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Could not resolve the caller");
            return;
        }

        try {
            ExecutionResult result = execute(graphQLRequest, context).join();
            response.setStatus(HttpServletResponse.SC_OK);
            response.getWriter().write(gson.toJson(result.toSpecification()));
        } catch (CompletionException e) {
            logger.error("Error processing GraphQL request", GraphErrorHandler.unwrap(e));
            writeError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Error processing GraphQL request");
        }
    }

    private static void writeError(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        response.getWriter().write(gson.toJson(Map.of("errors", List.of(Map.of("message", message)))));
    }

    private static String loadSchema() {
        try (InputStream in = Graphlette.class.getClassLoader().getResourceAsStream(SCHEMA)) {
            if (in == null) {
                throw new IllegalStateException("Schema " + SCHEMA + " not found on the classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema " + SCHEMA, e);
        }
    }
}
