package com.launchpad.core;

public record Launch(
        String id,
        String site,
        Mission mission,
        Rocket rocket,
        Integer year
) {}
