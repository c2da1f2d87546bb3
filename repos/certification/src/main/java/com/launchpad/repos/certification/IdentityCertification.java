package com.launchpad.repos.certification;

import com.launchpad.core.IdentitySource;
import com.launchpad.core.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link IdentitySource} must share. Subclasses provide an empty store.
 */
public abstract class IdentityCertification {
    protected IdentitySource identity;

    public abstract void init() throws Exception;

    public void tearDown() throws Exception {
    }

    @BeforeEach
    public void setUp() throws Exception {
        init();
    }

    @AfterEach
    public void cleanUp() throws Exception {
        tearDown();
    }

    @Test
    public void findOrCreateShouldCreateAnUnseenUser() {
        User user = identity.findOrCreate("a@x.com").join();

        assertNotNull(user.id());
        assertEquals("a@x.com", user.email());
    }

    @Test
    public void findOrCreateShouldReuseTheUserForAKnownEmail() {
        User first = identity.findOrCreate("a@x.com").join();
        User second = identity.findOrCreate("a@x.com").join();

        assertEquals(first.id(), second.id());
    }

    @Test
    public void findOrCreateShouldKeepDistinctEmailsApart() {
        User a = identity.findOrCreate("a@x.com").join();
        User b = identity.findOrCreate("b@x.com").join();

        assertNotEquals(a.id(), b.id());
    }

    @Test
    public void findOrCreateWithoutEmailShouldCreateAFreshIdentityEachTime() {
        User first = identity.findOrCreate(null).join();
        User second = identity.findOrCreate(null).join();

        assertNotNull(first.id());
        assertNull(first.email());
        assertNotEquals(first.id(), second.id());
    }

    @Test
    public void concurrentFindOrCreateShouldLeaveASingleUser() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<User>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return identity.findOrCreate("a@x.com").join();
                }));
            }
            start.countDown();

            Set<String> ids = results.stream()
                    .map(f -> {
                        try {
                            return f.get(10, TimeUnit.SECONDS).id();
                        } catch (Exception e) {
                            throw new AssertionError("findOrCreate failed", e);
                        }
                    })
                    .collect(Collectors.toSet());

            assertEquals(1, ids.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void addBookingShouldRecordTheLaunch() {
        User user = identity.findOrCreate("a@x.com").join();

        identity.addBooking(user.id(), "1").join();

        assertEquals(Set.of("1"), identity.listBookedLaunchIds(user.id()).join());
    }

    @Test
    public void addBookingTwiceShouldKeepOneBooking() {
        User user = identity.findOrCreate("a@x.com").join();

        identity.addBooking(user.id(), "1").join();
        identity.addBooking(user.id(), "1").join();

        assertEquals(Set.of("1"), identity.listBookedLaunchIds(user.id()).join());
    }

    @Test
    public void removeBookingShouldDropTheLaunch() {
        User user = identity.findOrCreate("a@x.com").join();
        identity.addBooking(user.id(), "1").join();
        identity.addBooking(user.id(), "2").join();

        identity.removeBooking(user.id(), "1").join();

        assertEquals(Set.of("2"), identity.listBookedLaunchIds(user.id()).join());
    }

    @Test
    public void removeBookingOfAnUnbookedLaunchShouldChangeNothing() {
        User user = identity.findOrCreate("a@x.com").join();
        identity.addBooking(user.id(), "1").join();

        CompletableFuture<Void> removal = identity.removeBooking(user.id(), "2");

        assertDoesNotThrow(removal::join);
        assertEquals(Set.of("1"), identity.listBookedLaunchIds(user.id()).join());
    }

    @Test
    public void bookingsShouldBeKeptPerUser() {
        User a = identity.findOrCreate("a@x.com").join();
        User b = identity.findOrCreate("b@x.com").join();

        identity.addBooking(a.id(), "1").join();
        identity.addBooking(b.id(), "2").join();

        assertEquals(Set.of("1"), identity.listBookedLaunchIds(a.id()).join());
        assertEquals(Set.of("2"), identity.listBookedLaunchIds(b.id()).join());
    }

    @Test
    public void listBookedLaunchIdsShouldBeEmptyForAUserWithoutBookings() {
        User user = identity.findOrCreate("a@x.com").join();

        assertTrue(identity.listBookedLaunchIds(user.id()).join().isEmpty());
    }
}
