package com.launchpad.repos.sqlite;

import com.launchpad.core.Launch;
import com.launchpad.core.config.StorageConfig;

import java.util.List;

public class SQLiteConfig extends StorageConfig {
    public String file;
    /** Written to the catalog only when its table is empty. */
    public final List<Launch> launches;

    public SQLiteConfig(String file) {
        this(file, List.of());
    }

    public SQLiteConfig(String file, List<Launch> launches) {
        super("sqlite");
        this.file = file;
        this.launches = List.copyOf(launches);
    }
}
