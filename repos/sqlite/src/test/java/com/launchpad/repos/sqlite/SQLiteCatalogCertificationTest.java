package com.launchpad.repos.sqlite;

import com.launchpad.core.Launch;
import com.launchpad.repos.certification.CatalogCertification;
import org.junit.jupiter.api.AfterEach;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class SQLiteCatalogCertificationTest extends CatalogCertification {
    private SQLitePlugin plugin;
    private Path file;

    @Override
    public void init(List<Launch> launches) throws Exception {
        file = Files.createTempFile("launchpad-catalog", ".db");
        plugin = new SQLitePlugin();
        SQLiteCatalog sqliteCatalog = (SQLiteCatalog) plugin.createCatalog(new SQLiteConfig(file.toString()));
        for (Launch launch : launches) {
            sqliteCatalog.save(launch).join();
        }
        this.catalog = sqliteCatalog;
    }

    @AfterEach
    void tearDown() throws Exception {
        plugin.cleanUp();
        Files.deleteIfExists(file);
    }
}
