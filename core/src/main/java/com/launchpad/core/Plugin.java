package com.launchpad.core;

import com.launchpad.core.config.StorageConfig;

public interface Plugin {
    CatalogSource createCatalog(StorageConfig config);
    IdentitySource createIdentity(StorageConfig config);
    void cleanUp();
}
