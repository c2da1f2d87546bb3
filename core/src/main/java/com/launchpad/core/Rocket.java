package com.launchpad.core;

public record Rocket(
        String id,
        String name,
        String type
) {}
