package com.launchpad.repos.sqlite;

import com.launchpad.core.CatalogException;
import com.launchpad.core.CatalogSource;
import com.launchpad.core.IdentityException;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.Plugin;
import com.launchpad.core.config.StorageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

public class SQLitePlugin implements Plugin {
    private static final Logger log = LoggerFactory.getLogger(SQLitePlugin.class);
    private final Map<String, SQLiteDataSource> dataSources = new ConcurrentHashMap<>();
    private final List<SQLiteStore> stores = new CopyOnWriteArrayList<>();

    @Override
    public CatalogSource createCatalog(StorageConfig config) {
        SQLiteConfig c = cast(config);
        SQLiteCatalog catalog = new SQLiteCatalog(connect(c, e -> new CatalogException("Cannot open " + c.file, e)));
        catalog.initialize();
        stores.add(catalog);
        if (!c.launches.isEmpty()) {
            int seeded = catalog.seed(c.launches).join();
            log.info("Seeded {} launches into {}", seeded, c.file);
        }
        return catalog;
    }

    @Override
    public IdentitySource createIdentity(StorageConfig config) {
        SQLiteConfig c = cast(config);
        SQLiteIdentity identity = new SQLiteIdentity(connect(c, e -> new IdentityException("Cannot open " + c.file, e)));
        identity.initialize();
        stores.add(identity);
        return identity;
    }

    private static SQLiteConfig cast(StorageConfig config) {
        if (!(config instanceof SQLiteConfig)) {
            throw new IllegalArgumentException("Expected SQLiteConfig but got " + config.getClass().getSimpleName());
        }
        return (SQLiteConfig) config;
    }

    private Connection connect(SQLiteConfig c, Function<SQLException, RuntimeException> onError) {
        SQLiteDataSource dataSource = dataSources.computeIfAbsent(c.file, file -> {
            SQLiteDataSource ds = new SQLiteDataSource();
            ds.setUrl("jdbc:sqlite:" + file);
            return ds;
        });
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            log.error("Failed to open SQLite database {}", c.file);
            throw onError.apply(e);
        }
    }

    @Override
    public void cleanUp() {
        for (SQLiteStore store : stores) {
            store.close();
        }
        stores.clear();
    }
}
