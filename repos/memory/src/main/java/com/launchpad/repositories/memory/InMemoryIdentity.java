package com.launchpad.repositories.memory;

import com.fasterxml.uuid.Generators;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Users and bookings held in memory. Email uniqueness rests on {@link ConcurrentHashMap#computeIfAbsent},
 * which runs the creation at most once per email.
 */
public class InMemoryIdentity implements IdentitySource {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryIdentity.class);

    private final Map<String, User> usersByEmail = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> bookings = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<User> findOrCreate(String email) {
        if (email == null) {
            return CompletableFuture.completedFuture(newUser(null));
        }
        return CompletableFuture.completedFuture(usersByEmail.computeIfAbsent(email, InMemoryIdentity::newUser));
    }

    @Override
    public CompletableFuture<Void> addBooking(String userId, String launchId) {
        bookings.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(launchId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> removeBooking(String userId, String launchId) {
        Set<String> booked = bookings.get(userId);
        if (booked != null) {
            booked.remove(launchId);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Set<String>> listBookedLaunchIds(String userId) {
        Set<String> booked = bookings.get(userId);
        return CompletableFuture.completedFuture(booked != null ? Set.copyOf(booked) : Set.of());
    }

    private static User newUser(String email) {
        User user = new User(Generators.timeBasedGenerator().generate().toString(), email);
        logger.debug("Created user {}", user.id());
        return user;
    }
}
