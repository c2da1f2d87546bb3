package com.launchpad.repositories.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.launchpad.core.Launch;
import com.launchpad.core.Mission;
import com.launchpad.core.Rocket;

/**
 * Maps a SpaceX v2 launch document onto {@link Launch}. The flight number becomes the launch id.
 */
final class LaunchReducer {
    private LaunchReducer() {
    }

    static Launch reduce(JsonNode node) {
        JsonNode links = node.path("links");
        JsonNode rocket = node.path("rocket");

        return new Launch(
                String.valueOf(node.path("flight_number").asInt(0)),
                text(node.path("launch_site"), "site_name"),
                new Mission(
                        text(node, "mission_name"),
                        text(links, "mission_patch_small"),
                        text(links, "mission_patch")
                ),
                new Rocket(
                        text(rocket, "rocket_id"),
                        text(rocket, "rocket_name"),
                        text(rocket, "rocket_type")
                ),
                year(node.path("launch_year"))
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static Integer year(JsonNode value) {
        if (value.isNumber()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            try {
                return Integer.valueOf(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
