package com.gibi.app.model;

import java.time.Instant;

/** Leitura transitória de memória; nunca é persistida. */
public record MemorySample(long usedBytes, long limitBytes, double ratio, MemoryTier tier, Instant sampledAt) {

    public static MemorySample initial() {
        return new MemorySample(0L, 0L, 0.0, MemoryTier.NORMAL, Instant.now());
    }
}
