package com.launchpad.repos.certification;

import com.launchpad.core.CatalogSource;
import com.launchpad.core.Launch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link CatalogSource} must share. Subclasses build a catalog holding exactly
 * {@link CatalogFixtures#launches()}.
 */
public abstract class CatalogCertification {
    protected CatalogSource catalog;

    public abstract void init(List<Launch> launches) throws Exception;

    @BeforeEach
    public void setUp() throws Exception {
        init(CatalogFixtures.launches());
    }

    @Test
    public void listAllShouldReturnEveryLaunch() {
        List<Launch> result = catalog.listAll().join();

        assertEquals(Set.of("1", "2", "3", "4"), ids(result));
    }

    @Test
    public void getByIdShouldReturnTheLaunch() {
        Launch result = catalog.getById("2").join();

        assertNotNull(result);
        assertEquals("2", result.id());
        assertEquals("DemoSat", result.mission().name());
        assertEquals("Falcon 9", result.rocket().name());
        assertEquals(2007, result.year());
    }

    @Test
    public void getByIdShouldReturnNullForAnUnknownId() {
        assertNull(catalog.getById("missing").join());
    }

    @Test
    public void getByIdsShouldReturnTheRequestedLaunches() {
        List<Launch> result = catalog.getByIds(List.of("1", "3")).join();

        assertEquals(2, result.size());
        assertEquals(Set.of("1", "3"), ids(result));
    }

    @Test
    public void getByIdsShouldOmitUnknownIds() {
        List<Launch> result = catalog.getByIds(List.of("1", "missing", "4")).join();

        assertEquals(Set.of("1", "4"), ids(result));
    }

    @Test
    public void getByIdsShouldReturnOneLaunchPerId() {
        List<Launch> result = catalog.getByIds(List.of("2", "2", "2")).join();

        assertEquals(1, result.size());
        assertEquals("2", result.get(0).id());
    }

    @Test
    public void getByIdsShouldReturnNothingForNoIds() {
        assertTrue(catalog.getByIds(List.of()).join().isEmpty());
    }

    private static Set<String> ids(List<Launch> launches) {
        return launches.stream().map(Launch::id).collect(Collectors.toSet());
    }
}
