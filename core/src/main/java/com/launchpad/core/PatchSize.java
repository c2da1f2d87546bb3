package com.launchpad.core;

public enum PatchSize {
    SMALL,
    LARGE
}
