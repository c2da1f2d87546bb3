package com.launchpad.core;


import com.launchpad.core.config.GraphletteConfig;

import java.util.ArrayList;
import java.util.List;

public record Config(
        List<GraphletteConfig> graphlettes,
        int port
) {
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<GraphletteConfig> graphlettes = new ArrayList<>();
        private int port = 4000;

        public Builder graphlettes(List<GraphletteConfig> graphlettes) {
            this.graphlettes.addAll(graphlettes);
            return this;
        }

        public Builder graphlette(GraphletteConfig graphlette) {
            this.graphlettes.add(graphlette);
            return this;
        }

        public Builder graphlette(GraphletteConfig.Builder graphletteBuilder) {
            this.graphlettes.add(graphletteBuilder.build());
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Config build() {
            return new Config(
                List.copyOf(graphlettes),
                port
            );
        }
    }
}
