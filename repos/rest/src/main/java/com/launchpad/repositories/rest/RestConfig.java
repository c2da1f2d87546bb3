package com.launchpad.repositories.rest;

import com.launchpad.core.config.StorageConfig;

import java.net.URI;
import java.time.Duration;

public class RestConfig extends StorageConfig {
    public final URI baseUrl;
    public final Duration timeout;

    public RestConfig(URI baseUrl) {
        this(baseUrl, Duration.ofSeconds(10));
    }

    public RestConfig(URI baseUrl, Duration timeout) {
        super("rest");
        this.baseUrl = baseUrl;
        this.timeout = timeout;
    }
}
