package com.launchpad.repos.sqlite;

import com.launchpad.core.IdentityException;
import com.launchpad.core.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteIdentityTest {
    private Path file;
    private SQLiteIdentity identity;

    @BeforeEach
    void setUp() throws Exception {
        file = Files.createTempFile("launchpad-identity", ".db");
        identity = new SQLiteIdentity(DriverManager.getConnection("jdbc:sqlite:" + file));
        identity.initialize();
    }

    @AfterEach
    void tearDown() throws Exception {
        identity.close();
        Files.deleteIfExists(file);
    }

    @Test
    void findOrCreate_shouldPersistUsersAcrossConnections() throws Exception {
        User user = identity.findOrCreate("a@x.com").join();
        identity.addBooking(user.id(), "7").join();

        try (Connection other = DriverManager.getConnection("jdbc:sqlite:" + file);
             PreparedStatement pstmt = other.prepareStatement("SELECT COUNT(*) FROM users WHERE email = ?")) {
            pstmt.setString(1, "a@x.com");
            try (ResultSet rs = pstmt.executeQuery()) {
                assertTrue(rs.next());
                assertEquals(1, rs.getInt(1));
            }
        }
    }

    @Test
    void operations_shouldFailWithIdentityException_whenConnectionIsClosed() throws Exception {
        identity.connection.close();

        CompletionException e = assertThrows(CompletionException.class, () -> identity.findOrCreate("a@x.com").join());
        assertInstanceOf(IdentityException.class, e.getCause());
    }
}
