package com.launchpad.repositories.memory;

import com.launchpad.core.*;
import com.launchpad.core.config.StorageConfig;

import java.util.List;

public class InMemoryPlugin implements Plugin {
    private final InMemoryIdentity identity = new InMemoryIdentity();

    @Override
    public CatalogSource createCatalog(StorageConfig config) {
        List<Launch> launches = config instanceof InMemoryConfig ? ((InMemoryConfig) config).launches : List.of();
        return new InMemoryCatalog(launches);
    }

    @Override
    public IdentitySource createIdentity(StorageConfig config) {
        return identity;
    }

    @Override
    public void cleanUp() {
        // No cleanup needed
    }
}
