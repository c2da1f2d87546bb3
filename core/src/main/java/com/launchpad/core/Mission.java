package com.launchpad.core;

public record Mission(
        String name,
        String missionPatchSmall,
        String missionPatchLarge
) {
    public String missionPatch(PatchSize size) {
        return size == PatchSize.LARGE ? missionPatchLarge : missionPatchSmall;
    }
}
