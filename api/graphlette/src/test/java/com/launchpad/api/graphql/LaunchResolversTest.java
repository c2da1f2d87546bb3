package com.launchpad.api.graphql;

import com.launchpad.api.graphql.args.PatchSizeArgs;
import com.launchpad.core.CatalogSource;
import com.launchpad.core.IdentitySource;
import com.launchpad.core.Launch;
import com.launchpad.core.PatchSize;
import com.launchpad.core.RequestContext;
import com.launchpad.core.User;
import org.dataloader.DataLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static com.launchpad.api.graphql.TestUtils.launch;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LaunchResolversTest {
    @Mock private CatalogSource catalog;
    @Mock private IdentitySource identity;

    private LaunchResolvers launches;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        launches = new LaunchResolvers();
    }

    @Test
    void isBooked_shouldBeFalse_forAnonymousRequests() {
        DataLoader<String, Set<String>> bookings = DataLoaderFactory.createBookingLoader(identity);

        boolean booked = launches.isBooked(launch("1"), RequestContext.anonymous(catalog, identity), bookings).join();

        assertFalse(booked);
        verifyNoInteractions(identity);
    }

    @Test
    void isBooked_shouldLoadTheBookedSetOnce_forManyLaunches() {
        when(identity.listBookedLaunchIds("u-1")).thenReturn(CompletableFuture.completedFuture(Set.of("2")));
        RequestContext context = new RequestContext(new User("u-1", "a@x.com"), catalog, identity);
        DataLoader<String, Set<String>> bookings = DataLoaderFactory.createBookingLoader(identity);

        List<Launch> all = List.of(launch("1"), launch("2"), launch("3"));
        List<CompletableFuture<Boolean>> results = all.stream()
                .map(l -> launches.isBooked(l, context, bookings))
                .toList();
        bookings.dispatch();

        assertEquals(List.of(false, true, false), results.stream().map(CompletableFuture::join).toList());
        verify(identity, times(1)).listBookedLaunchIds("u-1");
    }

    @Test
    void missionPatch_shouldPickTheRequestedSize() {
        Launch launch = launch("7");

        assertEquals("https://patch/7/small.png", launches.missionPatch(launch.mission(), new PatchSizeArgs(PatchSize.SMALL)));
        assertEquals("https://patch/7/large.png", launches.missionPatch(launch.mission(), new PatchSizeArgs(PatchSize.LARGE)));
    }

    @Test
    void missionPatch_shouldDefaultToLarge() {
        Launch launch = launch("7");

        assertEquals("https://patch/7/large.png", launches.missionPatch(launch.mission(), PatchSizeArgs.from(Map.of())));
        assertEquals("https://patch/7/small.png", launches.missionPatch(launch.mission(), PatchSizeArgs.from(Map.of("size", "SMALL"))));
    }
}
