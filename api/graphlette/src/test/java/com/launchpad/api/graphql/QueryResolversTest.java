package com.launchpad.api.graphql;

import com.launchpad.api.graphql.args.LaunchArgs;
import com.launchpad.core.CatalogException;
import com.launchpad.core.CatalogSource;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.Launch;
import com.launchpad.core.RequestContext;
import com.launchpad.core.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.launchpad.api.graphql.TestUtils.launch;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class QueryResolversTest {
    @Mock private CatalogSource catalog;
    @Mock private IdentitySource identity;

    private QueryResolvers queries;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        queries = new QueryResolvers();
    }

    @Test
    void launches_shouldReturnTheWholeCatalog() {
        List<Launch> all = List.of(launch("1"), launch("2"));
        when(catalog.listAll()).thenReturn(CompletableFuture.completedFuture(all));

        List<Launch> result = queries.launches(RequestContext.anonymous(catalog, identity)).join();

        assertEquals(all, result);
    }

    @Test
    void launches_shouldPropagateCatalogFailures() {
        when(catalog.listAll()).thenReturn(CompletableFuture.failedFuture(new CatalogException("down")));

        CompletionException e = assertThrows(CompletionException.class,
                () -> queries.launches(RequestContext.anonymous(catalog, identity)).join());
        assertInstanceOf(CatalogException.class, e.getCause());
    }

    @Test
    void launch_shouldReturnNull_forAMissingId() {
        when(catalog.getById("missing")).thenReturn(CompletableFuture.completedFuture(null));

        Launch result = queries.launch(new LaunchArgs("missing"), RequestContext.anonymous(catalog, identity)).join();

        assertNull(result);
    }

    @Test
    void launch_shouldReturnTheLaunch() {
        when(catalog.getById("2")).thenReturn(CompletableFuture.completedFuture(launch("2")));

        Launch result = queries.launch(new LaunchArgs("2"), RequestContext.anonymous(catalog, identity)).join();

        assertEquals("2", result.id());
    }

    @Test
    void me_shouldReturnNull_forAnonymousRequests() {
        assertNull(queries.me(RequestContext.anonymous(catalog, identity)));
        verifyNoInteractions(identity);
    }

    @Test
    void me_shouldReturnTheContextUser() {
        User user = new User("u-1", "a@x.com");

        assertSame(user, queries.me(new RequestContext(user, catalog, identity)));
        verifyNoInteractions(identity);
    }
}
