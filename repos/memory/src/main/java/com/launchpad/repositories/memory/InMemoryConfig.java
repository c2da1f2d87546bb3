package com.launchpad.repositories.memory;

import com.launchpad.core.Launch;
import com.launchpad.core.config.StorageConfig;

import java.util.List;

public class InMemoryConfig extends StorageConfig {
    public final List<Launch> launches;

    public InMemoryConfig() {
        this(List.of());
    }

    public InMemoryConfig(List<Launch> launches) {
        super("memory");
        this.launches = List.copyOf(launches);
    }
}
