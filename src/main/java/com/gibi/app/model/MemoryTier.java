package com.gibi.app.model;

public enum MemoryTier {
    NORMAL,
    ELEVATED,
    CRITICAL;

    public MemoryTier lower() {
        return this == CRITICAL ? ELEVATED : NORMAL;
    }
}
