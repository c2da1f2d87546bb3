package com.launchpad.server;

import com.launchpad.auth.noop.NoAuth;
import com.launchpad.auth.token.TokenAuth;
import com.launchpad.core.Auth;
import com.launchpad.core.Config;
import com.launchpad.core.Plugin;
import com.launchpad.core.config.GraphletteConfig;
import com.launchpad.core.config.StorageConfig;
import com.launchpad.repos.sqlite.SQLiteConfig;
import com.launchpad.repos.sqlite.SQLitePlugin;
import com.launchpad.repositories.memory.InMemoryConfig;
import com.launchpad.repositories.memory.InMemoryPlugin;
import com.launchpad.repositories.rest.RestConfig;
import com.launchpad.repositories.rest.RestPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        logger.info("Starting Launchpad");

        int port = Integer.parseInt(getEnv("PORT", "4000"));
        String graphPath = getEnv("GRAPH_PATH", "/graphql");
        String catalogStorage = getEnv("CATALOG_STORAGE", "memory");
        String identityStorage = getEnv("IDENTITY_STORAGE", "memory");
        String sqliteFile = getEnv("SQLITE_FILE", "launchpad.db");
        String catalogUrl = getEnv("CATALOG_URL", "https://api.spacexdata.com/v2/");
        String authMode = getEnv("AUTH", "token");

        logger.info("Configuration: port={}, graphPath={}, catalog={}, identity={}, auth={}",
                port, graphPath, catalogStorage, identityStorage, authMode);

        Config config = Config.builder()
                .port(port)
                .graphlette(GraphletteConfig.builder()
                        .path(graphPath)
                        .catalog(storage(catalogStorage, sqliteFile, catalogUrl))
                        .identity(storage(identityStorage, sqliteFile, catalogUrl)))
                .build();

        Map<String, Plugin> plugins = new HashMap<>();
        plugins.put("memory", new InMemoryPlugin());
        plugins.put("sqlite", new SQLitePlugin());
        plugins.put("rest", new RestPlugin());

        Server server = new Server(plugins, auth(authMode));
        server.init(config);

        logger.info("Health check: http://localhost:{}/health", port);
        logger.info("GraphQL endpoint: http://localhost:{}{}", port, graphPath);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down server...");
            try {
                server.stop();
                logger.info("Server stopped successfully");
            } catch (Exception e) {
                logger.error("Error during shutdown", e);
            }
        }));

        Thread.currentThread().join();
    }

    static StorageConfig storage(String type, String sqliteFile, String catalogUrl) {
        switch (type) {
            case "memory":
                return new InMemoryConfig(CatalogSeed.load());
            case "sqlite":
                return new SQLiteConfig(sqliteFile, CatalogSeed.load());
            case "rest":
                return new RestConfig(URI.create(catalogUrl));
            default:
                throw new IllegalArgumentException("Unknown storage type: " + type);
        }
    }

    static Auth auth(String mode) {
        switch (mode) {
            case "token":
                return new TokenAuth();
            case "none":
                return new NoAuth();
            default:
                throw new IllegalArgumentException("Unknown auth mode: " + mode);
        }
    }

    private static String getEnv(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }
}
