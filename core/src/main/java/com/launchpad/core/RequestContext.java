package com.launchpad.core;

import java.util.Objects;

/**
 * Everything a field resolver may consult while serving one request. Built once per request by an
 * {@link Auth} and never mutated afterwards.
 *
 * @param user the resolved caller, or {@code null} for an anonymous request
 */
public record RequestContext(
        User user,
        CatalogSource catalog,
        IdentitySource identity
) {
    public RequestContext {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(identity, "identity");
    }

    public static RequestContext anonymous(CatalogSource catalog, IdentitySource identity) {
        return new RequestContext(null, catalog, identity);
    }

    public boolean isAuthenticated() {
        return user != null;
    }
}
