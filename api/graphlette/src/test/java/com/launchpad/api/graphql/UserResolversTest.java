package com.launchpad.api.graphql;

import com.launchpad.core.CatalogException;
import com.launchpad.core.CatalogSource;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.Launch;
import com.launchpad.core.RequestContext;
import com.launchpad.core.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.launchpad.api.graphql.TestUtils.launch;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

class UserResolversTest {
    @Mock private CatalogSource catalog;
    @Mock private IdentitySource identity;

    private final User user = new User("u-1", "a@x.com");
    private RequestContext context;
    private UserResolvers users;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        context = new RequestContext(user, catalog, identity);
        users = new UserResolvers();
    }

    @Test
    void trips_shouldBeEmptyAndSkipTheCatalog_whenNothingIsBooked() {
        when(identity.listBookedLaunchIds("u-1")).thenReturn(CompletableFuture.completedFuture(Set.of()));

        List<Launch> trips = users.trips(user, context).join();

        assertNotNull(trips);
        assertTrue(trips.isEmpty());
        verify(catalog, never()).getByIds(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void trips_shouldFetchAllBookedLaunchesInOneCall() {
        when(identity.listBookedLaunchIds("u-1")).thenReturn(CompletableFuture.completedFuture(Set.of("1", "2")));
        List<Launch> found = List.of(launch("2"), launch("1"));
        when(catalog.getByIds(anyCollection())).thenReturn(CompletableFuture.completedFuture(found));

        List<Launch> trips = users.trips(user, context).join();

        ArgumentCaptor<Collection<String>> ids = ArgumentCaptor.forClass(Collection.class);
        verify(catalog, times(1)).getByIds(ids.capture());
        verify(catalog, never()).getById(any());
        assertEquals(Set.of("1", "2"), new HashSet<>(ids.getValue()));
        assertEquals(found, trips);
    }

    @Test
    void trips_shouldReturnOnlyWhatTheCatalogFound() {
        when(identity.listBookedLaunchIds("u-1")).thenReturn(CompletableFuture.completedFuture(Set.of("1", "gone")));
        when(catalog.getByIds(anyCollection())).thenReturn(CompletableFuture.completedFuture(List.of(launch("1"))));

        List<Launch> trips = users.trips(user, context).join();

        assertEquals(1, trips.size());
        assertEquals("1", trips.get(0).id());
    }

    @Test
    void trips_shouldPropagateCatalogFailures() {
        when(identity.listBookedLaunchIds("u-1")).thenReturn(CompletableFuture.completedFuture(Set.of("1", "2")));
        when(catalog.getByIds(anyCollection())).thenReturn(CompletableFuture.failedFuture(new CatalogException("partial failure")));

        CompletionException e = assertThrows(CompletionException.class, () -> users.trips(user, context).join());
        assertInstanceOf(CatalogException.class, e.getCause());
    }
}
