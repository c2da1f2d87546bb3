package com.launchpad.core.config;

public class StorageConfig {
    public final String type;

    public StorageConfig(String type) {
        this.type = type;
    }
}
