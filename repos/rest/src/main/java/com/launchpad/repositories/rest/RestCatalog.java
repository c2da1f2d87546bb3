package com.launchpad.repositories.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchpad.core.CatalogException;
import com.launchpad.core.CatalogSource;
import com.launchpad.core.Launch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Catalog served by a SpaceX v2 style REST API: {@code GET /launches} lists everything and
 * {@code GET /launches?flight_number=N} filters by id.
 */
public class RestCatalog implements CatalogSource {
    private static final Logger logger = LoggerFactory.getLogger(RestCatalog.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final URI baseUrl;
    private final Duration timeout;

    public RestCatalog(URI baseUrl, Duration timeout) {
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public CompletableFuture<List<Launch>> listAll() {
        return fetch("launches").thenApply(this::reduceAll);
    }

    @Override
    public CompletableFuture<Launch> getById(String id) {
        String query = "launches?flight_number=" + URLEncoder.encode(id, StandardCharsets.UTF_8);
        return fetch(query).thenApply(body -> {
            List<Launch> launches = reduceAll(body);
            return launches.isEmpty() ? null : launches.get(0);
        });
    }

    /**
     * One listing call, filtered locally.
     */
    @Override
    public CompletableFuture<List<Launch>> getByIds(Collection<String> ids) {
        Set<String> wanted = new LinkedHashSet<>(ids);
        if (wanted.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return listAll().thenApply(all -> {
            Map<String, Launch> byId = new LinkedHashMap<>();
            for (Launch launch : all) {
                if (wanted.contains(launch.id())) {
                    byId.putIfAbsent(launch.id(), launch);
                }
            }
            return new ArrayList<>(byId.values());
        });
    }

    private CompletableFuture<JsonNode> fetch(String path) {
        URI uri = resolve(path);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        logger.debug("GET {}", uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw new CatalogException("Launch catalog unreachable at " + uri, error);
                    }
                    return handleResponse(uri, response);
                });
    }

    private JsonNode handleResponse(URI uri, HttpResponse<String> response) {
        if (response.statusCode() == 404) {
            return objectMapper.createArrayNode();
        }
        if (response.statusCode() / 100 != 2) {
            logger.error("Launch catalog answered {} for {}", response.statusCode(), uri);
            throw new CatalogException("HTTP error: " + response.statusCode());
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            logger.error("Error parsing response: {}", response.body(), e);
            throw new CatalogException("Failed to parse response", e);
        }
    }

    private List<Launch> reduceAll(JsonNode body) {
        List<Launch> launches = new ArrayList<>();
        if (body.isArray()) {
            body.forEach(node -> launches.add(LaunchReducer.reduce(node)));
        } else if (body.isObject()) {
            launches.add(LaunchReducer.reduce(body));
        }
        return launches;
    }

    private URI resolve(String path) {
        String base = baseUrl.toString();
        return URI.create(base.endsWith("/") ? base + path : base + "/" + path);
    }
}
