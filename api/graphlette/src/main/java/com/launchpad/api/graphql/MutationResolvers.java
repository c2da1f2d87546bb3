package com.launchpad.api.graphql;

import com.launchpad.api.graphql.args.LoginArgs;
import com.launchpad.api.graphql.args.TripArgs;
import com.launchpad.auth.token.EmailValidator;
import com.launchpad.auth.token.TokenCodec;
import com.launchpad.core.AuthorizationException;
import com.launchpad.core.Launch;
import com.launchpad.core.RequestContext;
import com.launchpad.core.TripUpdateResponse;
import org.dataloader.DataLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Booking mutations require a resolved caller; anonymous calls fail before any store is touched.
 * A successful change drops the caller's entry from the request's {@code bookings} loader, so later
 * {@code isBooked} reads in the same operation see the new set.
 */
public class MutationResolvers {
    private static final Logger logger = LoggerFactory.getLogger(MutationResolvers.class);

    public CompletableFuture<TripUpdateResponse> bookTrip(
            TripArgs args,
            RequestContext context,
            DataLoader<String, Set<String>> bookings
    ) {
        if (!context.isAuthenticated()) {
            return CompletableFuture.failedFuture(new AuthorizationException("You must be logged in to book a trip"));
        }
        String userId = context.user().id();

        return context.identity().addBooking(userId, args.launchId())
                .thenCompose(booked -> {
                    bookings.clear(userId);
                    return context.catalog().getById(args.launchId());
                })
                .thenApply(launch -> {
                    logger.debug("User {} booked launch {}", userId, args.launchId());
                    return new TripUpdateResponse(true, "trip booked", touched(launch));
                });
    }

    public CompletableFuture<TripUpdateResponse> cancelTrip(
            TripArgs args,
            RequestContext context,
            DataLoader<String, Set<String>> bookings
    ) {
        if (!context.isAuthenticated()) {
            return CompletableFuture.failedFuture(new AuthorizationException("You must be logged in to cancel a trip"));
        }
        String userId = context.user().id();

        return context.identity().removeBooking(userId, args.launchId())
                .thenCompose(cancelled -> {
                    bookings.clear(userId);
                    return context.catalog().getById(args.launchId());
                })
                .thenApply(launch -> {
                    logger.debug("User {} cancelled launch {}", userId, args.launchId());
                    return new TripUpdateResponse(true, "trip cancelled", touched(launch));
                });
    }

    /**
     * Resolves to a fresh token, or to null when the email is unusable or no user could be resolved.
     * Store failures are not caught here.
     */
    public CompletableFuture<String> login(LoginArgs args, RequestContext context) {
        if (!EmailValidator.isValid(args.email())) {
            logger.debug("Rejected login with malformed email");
            return CompletableFuture.completedFuture(null);
        }
        return context.identity().findOrCreate(args.email())
                .thenApply(user -> user != null && user.email() != null ? TokenCodec.encode(user.email()) : null);
    }

    private static List<Launch> touched(Launch launch) {
        return launch != null ? List.of(launch) : List.of();
    }
}
