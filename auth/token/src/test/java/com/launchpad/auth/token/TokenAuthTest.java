package com.launchpad.auth.token;

import com.launchpad.core.CatalogSource;
import com.launchpad.core.IdentityException;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.RequestContext;
import com.launchpad.core.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TokenAuthTest {
    @Mock private CatalogSource catalog;
    @Mock private IdentitySource identity;

    private TokenAuth auth;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        auth = new TokenAuth();
    }

    @Test
    void authenticate_shouldBeAnonymous_whenHeaderIsNull() {
        RequestContext context = auth.authenticate(null, catalog, identity).join();

        assertFalse(context.isAuthenticated());
        assertNull(context.user());
        verifyNoInteractions(identity);
    }

    @Test
    void authenticate_shouldBeAnonymous_whenTokenIsMalformed() {
        RequestContext context = auth.authenticate("%%%garbage%%%", catalog, identity).join();

        assertNull(context.user());
        verifyNoInteractions(identity);
    }

    @Test
    void authenticate_shouldBeAnonymous_whenTokenDecodesToSomethingOtherThanAnEmail() {
        String token = TokenCodec.encode("not an email");

        RequestContext context = auth.authenticate(token, catalog, identity).join();

        assertNull(context.user());
        verifyNoInteractions(identity);
    }

    @Test
    void authenticate_shouldResolveUser_fromBareToken() {
        User user = new User("u-1", "a@x.com");
        when(identity.findOrCreate("a@x.com")).thenReturn(CompletableFuture.completedFuture(user));

        RequestContext context = auth.authenticate(TokenCodec.encode("a@x.com"), catalog, identity).join();

        assertTrue(context.isAuthenticated());
        assertEquals(user, context.user());
        assertSame(catalog, context.catalog());
        assertSame(identity, context.identity());
    }

    @Test
    void authenticate_shouldResolveUser_fromBearerHeader() {
        User user = new User("u-1", "a@x.com");
        when(identity.findOrCreate("a@x.com")).thenReturn(CompletableFuture.completedFuture(user));

        RequestContext context = auth.authenticate("Bearer " + TokenCodec.encode("a@x.com"), catalog, identity).join();

        assertEquals(user, context.user());
    }

    @Test
    void authenticate_shouldFail_whenIdentityStoreFails() {
        when(identity.findOrCreate(any()))
                .thenReturn(CompletableFuture.failedFuture(new IdentityException("store unreachable")));

        CompletableFuture<RequestContext> result = auth.authenticate(TokenCodec.encode("a@x.com"), catalog, identity);

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(IdentityException.class, e.getCause());
    }
}
