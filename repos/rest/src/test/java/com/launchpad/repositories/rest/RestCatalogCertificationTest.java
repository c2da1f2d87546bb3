package com.launchpad.repositories.rest;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.launchpad.core.Launch;
import com.launchpad.repos.certification.CatalogCertification;
import org.junit.jupiter.api.AfterEach;

import java.net.URI;
import java.util.List;

import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;

public class RestCatalogCertificationTest extends CatalogCertification {
    private WireMockServer server;

    @Override
    public void init(List<Launch> launches) {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        SpaceXStubs.stubLaunches(server, launches);

        this.catalog = new RestPlugin().createCatalog(new RestConfig(URI.create(server.baseUrl())));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }
}
