package com.launchpad.repos.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Owns one SQLite connection and the single thread allowed to use it. Blocking JDBC work is handed to
 * that thread so callers only ever see futures.
 */
abstract class SQLiteStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SQLiteStore.class);

    protected final Connection connection;
    private final ExecutorService executor;
    private final Function<SQLException, RuntimeException> onError;

    @FunctionalInterface
    interface SqlCall<T> {
        T call(Connection connection) throws SQLException;
    }

    SQLiteStore(Connection connection, String name, Function<SQLException, RuntimeException> onError) {
        this.connection = connection;
        this.onError = onError;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "sqlite-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    protected void execute(String... statements) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA busy_timeout = 5000");
            for (String sql : statements) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite schema", e);
            throw onError.apply(e);
        }
    }

    protected <T> CompletableFuture<T> submit(SqlCall<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.call(connection);
            } catch (SQLException e) {
                throw onError.apply(e);
            }
        }, executor);
    }

    protected static String placeholders(int count) {
        StringBuilder placeholders = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                placeholders.append(", ");
            }
            placeholders.append("?");
        }
        return placeholders.toString();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            connection.close();
        } catch (SQLException e) {
            log.error("Failed to close SQLite connection", e);
        }
    }
}
