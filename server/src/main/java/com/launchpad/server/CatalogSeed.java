package com.launchpad.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchpad.core.Launch;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Launches bundled with the server for the in-memory catalog.
 */
final class CatalogSeed {
    static final String RESOURCE = "launches.json";
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private CatalogSeed() {
    }

    static List<Launch> load() {
        return load(RESOURCE);
    }

    static List<Launch> load(String resource) {
        try (InputStream in = CatalogSeed.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Seed catalog " + resource + " not found on the classpath");
            }
            return objectMapper.readValue(in, new TypeReference<List<Launch>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seed catalog " + resource, e);
        }
    }
}
