package com.gibi.app.model;

import java.time.Instant;

/** Visão resumida de um registro para a camada de UI. */
public record ScanStatus(String path, ScanState scanState, String lastError, int consecutiveFailures, Instant lastScannedAt) {

    public static ScanStatus of(FileRecord r) {
        return new ScanStatus(r.path(), r.scanState(), r.lastError(), r.consecutiveFailures(), r.lastScannedAt());
    }
}
