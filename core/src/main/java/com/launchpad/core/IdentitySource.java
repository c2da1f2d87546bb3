package com.launchpad.core;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Users and their bookings. The store is the only arbiter of email uniqueness: concurrent
 * {@link #findOrCreate(String)} calls for one email must end with a single user.
 */
public interface IdentitySource {
    /**
     * Returns the user owning {@code email}, creating it when unseen. A null email creates a fresh
     * anonymous identity.
     */
    CompletableFuture<User> findOrCreate(String email);

    /**
     * Records a booking. Booking an already booked launch leaves a single booking.
     */
    CompletableFuture<Void> addBooking(String userId, String launchId);

    /**
     * Drops a booking. Missing bookings are ignored.
     */
    CompletableFuture<Void> removeBooking(String userId, String launchId);

    CompletableFuture<Set<String>> listBookedLaunchIds(String userId);
}
