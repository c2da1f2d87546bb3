package com.launchpad.core;

import java.util.concurrent.CompletableFuture;

public interface Auth {
    /**
     * Builds the context for one request from its raw {@code Authorization} header.
     *
     * @param authorization header value, may be null
     * @return an anonymous context when no identity can be derived; a failed future only when a
     *         backing store fails
     */
    CompletableFuture<RequestContext> authenticate(
            String authorization,
            CatalogSource catalog,
            IdentitySource identity
    );
}
