package com.launchpad.repositories.memory;

import com.launchpad.core.CatalogSource;
import com.launchpad.core.Launch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A fixed catalog held in memory, in the order it was given.
 */
public class InMemoryCatalog implements CatalogSource {
    private final Map<String, Launch> launches = new LinkedHashMap<>();

    public InMemoryCatalog(Collection<Launch> launches) {
        for (Launch launch : launches) {
            this.launches.put(launch.id(), launch);
        }
    }

    @Override
    public CompletableFuture<List<Launch>> listAll() {
        return CompletableFuture.completedFuture(List.copyOf(launches.values()));
    }

    @Override
    public CompletableFuture<Launch> getById(String id) {
        return CompletableFuture.completedFuture(launches.get(id));
    }

    @Override
    public CompletableFuture<List<Launch>> getByIds(Collection<String> ids) {
        List<Launch> found = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            Launch launch = launches.get(id);
            if (launch != null) {
                found.add(launch);
            }
        }
        return CompletableFuture.completedFuture(found);
    }
}
