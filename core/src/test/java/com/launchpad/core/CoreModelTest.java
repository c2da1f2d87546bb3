package com.launchpad.core;

import com.launchpad.core.config.GraphletteConfig;
import com.launchpad.core.config.StorageConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CoreModelTest {

    @Test
    void missionPatch_shouldPickTheRequestedSize() {
        Mission mission = new Mission("FalconSat", "small.png", "large.png");

        assertEquals("small.png", mission.missionPatch(PatchSize.SMALL));
        assertEquals("large.png", mission.missionPatch(PatchSize.LARGE));
    }

    @Test
    void tripUpdateResponse_shouldNeverCarryNullLaunches() {
        assertEquals(List.of(), new TripUpdateResponse(true, "trip cancelled", null).launches());
    }

    @Test
    void tripUpdateResponse_shouldCopyLaunches() {
        List<Launch> launches = new ArrayList<>();
        TripUpdateResponse response = new TripUpdateResponse(true, "trip booked", launches);
        launches.add(new Launch("1", null, null, null, null));

        assertTrue(response.launches().isEmpty());
    }

    @Test
    void requestContext_shouldBeAnonymousWithoutUser() {
        CatalogSource catalog = mock(CatalogSource.class);
        IdentitySource identity = mock(IdentitySource.class);

        assertFalse(RequestContext.anonymous(catalog, identity).isAuthenticated());
        assertTrue(new RequestContext(new User("u-1", "a@x.com"), catalog, identity).isAuthenticated());
        assertThrows(NullPointerException.class, () -> new RequestContext(null, null, identity));
    }

    @Test
    void config_shouldDefaultPortAndPath() {
        Config config = Config.builder()
                .graphlette(GraphletteConfig.builder()
                        .catalog(new StorageConfig("memory"))
                        .identity(new StorageConfig("sqlite")))
                .build();

        assertEquals(4000, config.port());
        assertEquals("/graphql", config.graphlettes().get(0).path());
        assertEquals("sqlite", config.graphlettes().get(0).identity().type);
    }

    @Test
    void graphletteConfig_shouldRequireBothStores() {
        GraphletteConfig.Builder builder = GraphletteConfig.builder().catalog(new StorageConfig("memory"));

        assertThrows(IllegalStateException.class, builder::build);
    }
}
