package com.launchpad.auth.noop;

import com.launchpad.core.Auth;
import com.launchpad.core.CatalogSource;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.RequestContext;

import java.util.concurrent.CompletableFuture;

/**
 * Ignores the header and serves every request anonymously. Only public fields resolve.
 */
public class NoAuth implements Auth {

    @Override
    public CompletableFuture<RequestContext> authenticate(
            String authorization,
            CatalogSource catalog,
            IdentitySource identity
    ) {
        return CompletableFuture.completedFuture(RequestContext.anonymous(catalog, identity));
    }
}
