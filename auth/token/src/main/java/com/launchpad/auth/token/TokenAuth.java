package com.launchpad.auth.token;

import com.launchpad.core.Auth;
import com.launchpad.core.CatalogSource;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Resolves the caller from a {@link TokenCodec} token carried in the {@code Authorization} header.
 * The header may hold the bare token or {@code Bearer <token>}.
 *
 * A missing or malformed token is not an error: the request simply runs anonymously. A token that
 * decodes to an email is passed to {@link IdentitySource#findOrCreate(String)}, whose failures are
 * left on the returned future so the transport can report them.
 */
public class TokenAuth implements Auth {
    private static final Logger logger = LoggerFactory.getLogger(TokenAuth.class);
    private static final String BEARER = "Bearer ";

    @Override
    public CompletableFuture<RequestContext> authenticate(
            String authorization,
            CatalogSource catalog,
            IdentitySource identity
    ) {
        String token = stripScheme(authorization != null ? authorization : "");
        String email = TokenCodec.decode(token);

        if (!EmailValidator.isValid(email)) {
            if (!token.isEmpty()) {
                logger.debug("Token does not decode to an email, serving request anonymously");
            }
            return CompletableFuture.completedFuture(RequestContext.anonymous(catalog, identity));
        }

        return identity.findOrCreate(email)
                .thenApply(user -> {
                    logger.debug("Authenticated request as user {}", user != null ? user.id() : null);
                    return new RequestContext(user, catalog, identity);
                });
    }

    private static String stripScheme(String header) {
        String trimmed = header.trim();
        if (trimmed.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return trimmed.substring(BEARER.length()).trim();
        }
        return trimmed;
    }
}
