package com.launchpad.repos.sqlite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchpad.core.CatalogException;
import com.launchpad.core.CatalogSource;
import com.launchpad.core.Launch;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Launches stored as JSON payloads keyed by id.
 */
public class SQLiteCatalog extends SQLiteStore implements CatalogSource {
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SQLiteCatalog(Connection connection) {
        super(connection, "catalog", e -> new CatalogException("SQLite catalog failed", e));
    }

    public void initialize() {
        execute(
            "CREATE TABLE IF NOT EXISTS launches (" +
            "    _id INTEGER PRIMARY KEY AUTOINCREMENT, " +
            "    id TEXT NOT NULL UNIQUE, " +
            "    payload TEXT NOT NULL" +
            ");"
        );
    }

    public CompletableFuture<Void> save(Launch launch) {
        String payload = toJson(launch);
        return submit(c -> {
            try (PreparedStatement pstmt = c.prepareStatement(
                    "INSERT INTO launches (id, payload) VALUES (?, ?) " +
                    "ON CONFLICT(id) DO UPDATE SET payload = excluded.payload;")) {
                pstmt.setString(1, launch.id());
                pstmt.setString(2, payload);
                pstmt.executeUpdate();
            }
            return null;
        });
    }

    /**
     * Writes {@code launches} in one transaction unless the table already holds rows.
     *
     * @return the number of launches written
     */
    public CompletableFuture<Integer> seed(List<Launch> launches) {
        List<String> payloads = launches.stream().map(this::toJson).toList();
        return submit(c -> {
            try (Statement stmt = c.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM launches;")) {
                if (rs.next() && rs.getInt(1) > 0) {
                    return 0;
                }
            }

            c.setAutoCommit(false);
            try (PreparedStatement pstmt = c.prepareStatement(
                    "INSERT OR IGNORE INTO launches (id, payload) VALUES (?, ?);")) {
                for (int i = 0; i < launches.size(); i++) {
                    pstmt.setString(1, launches.get(i).id());
                    pstmt.setString(2, payloads.get(i));
                    pstmt.addBatch();
                }
                pstmt.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
            return launches.size();
        });
    }

    @Override
    public CompletableFuture<List<Launch>> listAll() {
        return submit(c -> {
            try (PreparedStatement pstmt = c.prepareStatement("SELECT payload FROM launches ORDER BY _id;");
                 ResultSet rs = pstmt.executeQuery()) {
                return readAll(rs);
            }
        });
    }

    @Override
    public CompletableFuture<Launch> getById(String id) {
        return submit(c -> {
            try (PreparedStatement pstmt = c.prepareStatement("SELECT payload FROM launches WHERE id = ?;")) {
                pstmt.setString(1, id);
                try (ResultSet rs = pstmt.executeQuery()) {
                    return rs.next() ? fromJson(rs.getString("payload")) : null;
                }
            }
        });
    }

    @Override
    public CompletableFuture<List<Launch>> getByIds(Collection<String> ids) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
        if (distinct.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        String query = String.format(
            "SELECT payload FROM launches WHERE id IN (%s) ORDER BY _id;", placeholders(distinct.size()));

        return submit(c -> {
            try (PreparedStatement pstmt = c.prepareStatement(query)) {
                int paramIndex = 1;
                for (String id : distinct) {
                    pstmt.setString(paramIndex++, id);
                }
                try (ResultSet rs = pstmt.executeQuery()) {
                    return readAll(rs);
                }
            }
        });
    }

    private List<Launch> readAll(ResultSet rs) throws SQLException {
        List<Launch> launches = new ArrayList<>();
        while (rs.next()) {
            launches.add(fromJson(rs.getString("payload")));
        }
        return launches;
    }

    private String toJson(Launch launch) {
        try {
            return objectMapper.writeValueAsString(launch);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Error serializing launch " + launch.id(), e);
        }
    }

    private Launch fromJson(String payload) {
        try {
            return objectMapper.readValue(payload, Launch.class);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Error parsing stored launch", e);
        }
    }
}
