package com.gibi.app.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Uma linha do índice por arquivo rastreado. {@code path} é o caminho absoluto normalizado.
 */
public record FileRecord(
        String path,
        long sizeBytes,
        long modifiedMillis,
        String fingerprint,
        ComicMetadata metadata,
        ScanState scanState,
        Instant lastScannedAt,
        String lastError,
        int consecutiveFailures
) {

    public FileRecord {
        Objects.requireNonNull(path, "path");
        metadata = metadata == null ? ComicMetadata.empty() : metadata;
        scanState = scanState == null ? ScanState.UNSCANNED : scanState;
        fingerprint = fingerprint == null ? FileStats.fingerprint(sizeBytes, modifiedMillis) : fingerprint;
        consecutiveFailures = Math.max(0, consecutiveFailures);
    }

    public static FileRecord unscanned(String path, FileStats stats) {
        return new FileRecord(path, stats.sizeBytes(), stats.modifiedMillis(), stats.fingerprint(),
                ComicMetadata.empty(), ScanState.UNSCANNED, null, null, 0);
    }

    public FileStats stats() {
        return new FileStats(sizeBytes, modifiedMillis);
    }

    public boolean matches(FileStats current) {
        return current != null && fingerprint.equals(current.fingerprint());
    }

    /**
     * Último scan terminou limpo e o arquivo não mudou desde então. Não olha {@code scanState}:
     * o registro já passou por QUEUED/SCANNING quando o worker pergunta.
     */
    public boolean cleanFor(FileStats current) {
        return lastScannedAt != null && lastError == null && consecutiveFailures == 0 && matches(current);
    }

    public FileRecord withPath(String newPath) {
        return new FileRecord(newPath, sizeBytes, modifiedMillis, fingerprint, metadata, scanState,
                lastScannedAt, lastError, consecutiveFailures);
    }
}
