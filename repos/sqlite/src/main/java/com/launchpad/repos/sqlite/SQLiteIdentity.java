package com.launchpad.repos.sqlite;

import com.fasterxml.uuid.Generators;
import com.launchpad.core.IdentityException;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Users and trips in SQLite. The UNIQUE constraint on {@code users.email} decides races between
 * concurrent creations: the losing insert is ignored and the follow-up select finds the winner.
 */
public class SQLiteIdentity extends SQLiteStore implements IdentitySource {
    private static final Logger log = LoggerFactory.getLogger(SQLiteIdentity.class);

    public SQLiteIdentity(Connection connection) {
        super(connection, "identity", e -> new IdentityException("SQLite identity store failed", e));
    }

    public void initialize() {
        execute(
            "CREATE TABLE IF NOT EXISTS users (" +
            "    id TEXT PRIMARY KEY, " +
            "    email TEXT UNIQUE, " +
            "    created_at INTEGER NOT NULL" +
            ");",
            "CREATE TABLE IF NOT EXISTS trips (" +
            "    user_id TEXT NOT NULL, " +
            "    launch_id TEXT NOT NULL, " +
            "    created_at INTEGER NOT NULL, " +
            "    PRIMARY KEY (user_id, launch_id)" +
            ");"
        );
    }

    @Override
    public CompletableFuture<User> findOrCreate(String email) {
        return submit(c -> {
            String id = Generators.timeBasedGenerator().generate().toString();

            try (PreparedStatement insert = c.prepareStatement(
                    "INSERT OR IGNORE INTO users (id, email, created_at) VALUES (?, ?, ?);")) {
                insert.setString(1, id);
                insert.setString(2, email);
                insert.setLong(3, System.currentTimeMillis());
                if (insert.executeUpdate() > 0) {
                    log.debug("Created user {}", id);
                }
            }

            if (email == null) {
                return new User(id, null);
            }

            try (PreparedStatement select = c.prepareStatement("SELECT id, email FROM users WHERE email = ?;")) {
                select.setString(1, email);
                try (ResultSet rs = select.executeQuery()) {
                    if (rs.next()) {
                        return new User(rs.getString("id"), rs.getString("email"));
                    }
                }
            }
            throw new SQLException("User row missing after insert for " + email);
        });
    }

    @Override
    public CompletableFuture<Void> addBooking(String userId, String launchId) {
        return submit(c -> {
            try (PreparedStatement pstmt = c.prepareStatement(
                    "INSERT OR IGNORE INTO trips (user_id, launch_id, created_at) VALUES (?, ?, ?);")) {
                pstmt.setString(1, userId);
                pstmt.setString(2, launchId);
                pstmt.setLong(3, System.currentTimeMillis());
                pstmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> removeBooking(String userId, String launchId) {
        return submit(c -> {
            try (PreparedStatement pstmt = c.prepareStatement(
                    "DELETE FROM trips WHERE user_id = ? AND launch_id = ?;")) {
                pstmt.setString(1, userId);
                pstmt.setString(2, launchId);
                pstmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Set<String>> listBookedLaunchIds(String userId) {
        return submit(c -> {
            try (PreparedStatement pstmt = c.prepareStatement("SELECT launch_id FROM trips WHERE user_id = ?;")) {
                pstmt.setString(1, userId);
                try (ResultSet rs = pstmt.executeQuery()) {
                    Set<String> booked = new HashSet<>();
                    while (rs.next()) {
                        booked.add(rs.getString("launch_id"));
                    }
                    return Set.copyOf(booked);
                }
            }
        });
    }
}
