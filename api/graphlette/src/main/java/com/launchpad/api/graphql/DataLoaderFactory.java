package com.launchpad.api.graphql;

import com.launchpad.core.IdentitySource;
import com.launchpad.core.RequestContext;
import org.dataloader.BatchLoader;
import org.dataloader.DataLoader;
import org.dataloader.DataLoaderOptions;
import org.dataloader.DataLoaderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Builds the request-scoped loaders. A registry lives for exactly one execution, so its caches never
 * see another request.
 */
public class DataLoaderFactory {
    private static final Logger logger = LoggerFactory.getLogger(DataLoaderFactory.class);
    private static final int MAX_BATCH_SIZE = 100;

    public static final String BOOKINGS = "bookings";

    public static DataLoaderRegistry createRegistry(RequestContext context) {
        DataLoaderRegistry registry = new DataLoaderRegistry();
        registry.register(BOOKINGS, createBookingLoader(context.identity()));
        return registry;
    }

    /**
     * Loads booked launch ids keyed by user id.
     */
    public static DataLoader<String, Set<String>> createBookingLoader(IdentitySource identity) {
        BatchLoader<String, Set<String>> batchLoader = userIds -> {
            logger.debug("Booking loader invoked with {} user ids", userIds.size());

            List<CompletableFuture<Set<String>>> lookups = userIds.stream()
                .map(identity::listBookedLaunchIds)
                .toList();

            return CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0]))
                .thenApply(done -> lookups.stream()
                    .map(CompletableFuture::join)
                    .toList());
        };

        return DataLoader.newDataLoader(batchLoader,
            DataLoaderOptions.newOptions().setMaxBatchSize(MAX_BATCH_SIZE));
    }
}
