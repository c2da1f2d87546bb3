package com.launchpad.api.graphql.args;

import com.launchpad.core.PatchSize;

import java.util.Map;

public record PatchSizeArgs(PatchSize size) {
    public static PatchSizeArgs from(Map<String, Object> arguments) {
        Object size = arguments.get("size");
        if (size == null) {
            return new PatchSizeArgs(PatchSize.LARGE);
        }
        if (size instanceof PatchSize) {
            return new PatchSizeArgs((PatchSize) size);
        }
        return new PatchSizeArgs(PatchSize.valueOf(size.toString()));
    }
}
