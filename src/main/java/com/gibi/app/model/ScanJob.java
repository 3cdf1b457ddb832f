package com.gibi.app.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Unidade de trabalho efêmera da fila. {@code previousPath} só existe em jobs MOVE.
 */
public record ScanJob(Path path, Path previousPath, ScanReason reason, ScanPriority priority, Instant enqueuedAt) {

    public ScanJob {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(reason, "reason");
        path = path.toAbsolutePath().normalize();
        previousPath = previousPath == null ? null : previousPath.toAbsolutePath().normalize();
        priority = priority == null ? reason.defaultPriority() : priority;
        enqueuedAt = enqueuedAt == null ? Instant.now() : enqueuedAt;
        if (reason == ScanReason.MOVE && previousPath == null) {
            throw new IllegalArgumentException("Job MOVE exige previousPath: " + path);
        }
    }

    public static ScanJob of(Path path, ScanReason reason) {
        return new ScanJob(path, null, reason, reason.defaultPriority(), Instant.now());
    }

    public static ScanJob move(Path from, Path to) {
        return new ScanJob(to, from, ScanReason.MOVE, ScanPriority.STRUCTURAL, Instant.now());
    }

    public ScanJob withReason(ScanReason newReason) {
        return new ScanJob(path, newReason == ScanReason.MOVE ? previousPath : null, newReason, priority, enqueuedAt);
    }
}
