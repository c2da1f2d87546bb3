package com.launchpad.repositories.rest;

import com.launchpad.core.CatalogSource;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.Plugin;
import com.launchpad.core.config.StorageConfig;

/**
 * Serves the launch catalog only; users have to live in another store.
 */
public class RestPlugin implements Plugin {

    @Override
    public CatalogSource createCatalog(StorageConfig config) {
        if (!(config instanceof RestConfig)) {
            throw new IllegalArgumentException("Expected RestConfig but got " + config.getClass().getSimpleName());
        }
        RestConfig c = (RestConfig) config;
        return new RestCatalog(c.baseUrl, c.timeout);
    }

    @Override
    public IdentitySource createIdentity(StorageConfig config) {
        throw new UnsupportedOperationException("rest storage only serves the launch catalog");
    }

    @Override
    public void cleanUp() {
        // No cleanup needed
    }
}
