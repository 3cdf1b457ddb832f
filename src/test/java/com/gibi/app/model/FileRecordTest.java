package com.gibi.app.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class FileRecordTest {

    private static final FileStats STATS = new FileStats(10, 20);

    private static FileRecord record(ScanState state, Instant scannedAt, String error, int failures) {
        return new FileRecord("/lib/a.cbz", STATS.sizeBytes(), STATS.modifiedMillis(), STATS.fingerprint(),
                ComicMetadata.empty(), state, scannedAt, error, failures);
    }

    @Test
    void cleanFor_survivesRequeueOfACleanRecord() {
        assertTrue(record(ScanState.CLEAN, Instant.now(), null, 0).cleanFor(STATS));
        assertTrue(record(ScanState.QUEUED, Instant.now(), null, 0).cleanFor(STATS));
    }

    @Test
    void cleanFor_rejectsNeverScannedFailedOrChanged() {
        assertFalse(record(ScanState.QUEUED, null, null, 0).cleanFor(STATS));
        assertFalse(record(ScanState.QUEUED, Instant.now(), "ZipException: x", 1).cleanFor(STATS));
        assertFalse(record(ScanState.CLEAN, Instant.now(), null, 0).cleanFor(new FileStats(11, 20)));
        assertFalse(record(ScanState.CLEAN, Instant.now(), null, 0).cleanFor(null));
    }
}
