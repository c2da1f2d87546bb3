package com.launchpad.core.config;

/**
 * One mounted graph endpoint and the stores backing its two data sources.
 */
public record GraphletteConfig(
        String path,
        StorageConfig catalog,
        StorageConfig identity
) {
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String path = "/graphql";
        private StorageConfig catalog;
        private StorageConfig identity;

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder catalog(StorageConfig catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder identity(StorageConfig identity) {
            this.identity = identity;
            return this;
        }

        public GraphletteConfig build() {
            if (catalog == null || identity == null) {
                throw new IllegalStateException("Graphlette at " + path + " needs both a catalog and an identity store");
            }
            return new GraphletteConfig(path, catalog, identity);
        }
    }
}
