package com.launchpad.core;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to the launch catalog. Implementations may suspend on I/O, so every operation is a future.
 */
public interface CatalogSource {
    CompletableFuture<List<Launch>> listAll();

    /**
     * @return a future of the launch, or of {@code null} when the catalog has no launch with that id
     */
    CompletableFuture<Launch> getById(String id);

    /**
     * Looks up several launches in a single backing call. At most one launch is returned per id and
     * unknown ids are left out, so the result may be shorter than the input.
     */
    CompletableFuture<List<Launch>> getByIds(Collection<String> ids);
}
