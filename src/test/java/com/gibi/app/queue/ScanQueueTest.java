package com.gibi.app.queue;

import com.gibi.app.model.ScanJob;
import com.gibi.app.model.ScanPriority;
import com.gibi.app.model.ScanReason;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class ScanQueueTest {

    private static final Path A = Path.of("/lib/a.cbz").toAbsolutePath();
    private static final Path B = Path.of("/lib/b.cbz").toAbsolutePath();
    private static final Path C = Path.of("/lib/c.cbz").toAbsolutePath();

    @Test
    void enqueue_keepsOneJobPerPath() {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.of(A, ScanReason.MODIFY));
        q.enqueue(ScanJob.of(A, ScanReason.MODIFY));
        q.enqueue(ScanJob.of(A, ScanReason.CREATE));

        assertEquals(1, q.size());
        assertEquals(ScanReason.CREATE, q.pending(A).orElseThrow().reason(), "Equal priority replaces reason");
    }

    @Test
    void enqueue_neverDowngradesPendingPriority() {
        ScanQueue q = new ScanQueue();
        assertTrue(q.enqueue(ScanJob.of(A, ScanReason.MANUAL)));
        assertFalse(q.enqueue(ScanJob.of(A, ScanReason.SWEEP)), "Lower priority is dropped");

        ScanJob pending = q.pending(A).orElseThrow();
        assertEquals(ScanPriority.MANUAL, pending.priority());
        assertEquals(ScanReason.MANUAL, pending.reason());

        assertTrue(q.enqueue(ScanJob.of(A, ScanReason.DELETE)), "Structural outranks manual");
        assertEquals(ScanReason.DELETE, q.pending(A).orElseThrow().reason());
    }

    @Test
    void dequeue_highestPriorityFirstThenFifo() throws Exception {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.of(A, ScanReason.SWEEP));
        q.enqueue(ScanJob.of(B, ScanReason.MODIFY));
        q.enqueue(ScanJob.of(C, ScanReason.MODIFY));
        q.enqueue(ScanJob.of(Path.of("/lib/d.cbz"), ScanReason.MANUAL));

        assertEquals(ScanReason.MANUAL, q.dequeue().reason());
        assertEquals(B, q.dequeue().path());
        assertEquals(C, q.dequeue().path());
        assertEquals(A, q.dequeue().path());
        assertEquals(0, q.size());
    }

    @Test
    void move_dropsPendingJobForOldPath() {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.of(A, ScanReason.MODIFY));
        q.enqueue(ScanJob.move(A, B));

        assertFalse(q.contains(A));
        assertEquals(ScanReason.MOVE, q.pending(B).orElseThrow().reason());
    }

    @Test
    void chainedMoves_mergeIntoOneMoveFromOrigin() {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.move(A, B));
        q.enqueue(ScanJob.move(B, C));

        assertEquals(1, q.size());
        assertFalse(q.contains(B));
        ScanJob merged = q.pending(C).orElseThrow();
        assertEquals(ScanReason.MOVE, merged.reason());
        assertEquals(A, merged.previousPath(), "Index still holds the record at the first origin");
    }

    @Test
    void moveBackToOrigin_becomesRescanOfOrigin() {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.move(A, B));
        q.enqueue(ScanJob.move(B, A));

        assertEquals(1, q.size());
        assertEquals(ScanReason.MODIFY, q.pending(A).orElseThrow().reason());
    }

    @Test
    void deleteReplacingPendingMove_alsoDeletesOrigin() {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.move(A, B));
        q.enqueue(ScanJob.of(B, ScanReason.DELETE));

        assertEquals(ScanReason.DELETE, q.pending(B).orElseThrow().reason());
        assertEquals(ScanReason.DELETE, q.pending(A).orElseThrow().reason());
        assertEquals(2, q.size());
    }

    @Test
    void moveOntoPendingMoveTarget_deletesOverwrittenOrigin() {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.move(A, C));
        q.enqueue(ScanJob.move(B, C));

        assertEquals(B, q.pending(C).orElseThrow().previousPath());
        assertEquals(ScanReason.DELETE, q.pending(A).orElseThrow().reason());
    }

    @Test
    void lowerPriorityJob_leavesPendingMoveAlone() {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.move(A, B));
        assertFalse(q.enqueue(ScanJob.of(B, ScanReason.MODIFY)));

        assertEquals(A, q.pending(B).orElseThrow().previousPath());
        assertFalse(q.contains(A));
    }

    @Test
    void move_waitsWhileOriginIsInFlight() throws Exception {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.of(A, ScanReason.MODIFY));
        ScanJob scanning = q.dequeue();

        q.enqueue(ScanJob.move(A, B));
        q.enqueue(ScanJob.of(C, ScanReason.SWEEP));
        assertEquals(C, q.dequeue().path(), "Move of A waits for the worker holding A");

        q.complete(scanning);
        ScanJob move = q.dequeue();
        assertEquals(B, move.path());

        q.enqueue(ScanJob.of(A, ScanReason.CREATE));
        CompletableFuture<ScanJob> next = CompletableFuture.supplyAsync(() -> {
            try {
                return q.dequeue();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        assertThrows(TimeoutException.class, () -> next.get(200, TimeUnit.MILLISECONDS),
                "A running move holds its origin too");

        q.complete(move);
        assertEquals(A, next.get(2, TimeUnit.SECONDS).path());
    }

    @Test
    void dequeue_skipsPathAlreadyInFlight() throws Exception {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.of(A, ScanReason.MODIFY));
        ScanJob first = q.dequeue();

        q.enqueue(ScanJob.of(A, ScanReason.MANUAL));
        q.enqueue(ScanJob.of(B, ScanReason.SWEEP));

        assertEquals(B, q.dequeue().path(), "A is claimed by another worker");

        CompletableFuture<ScanJob> next = CompletableFuture.supplyAsync(() -> {
            try {
                return q.dequeue();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        assertThrows(TimeoutException.class, () -> next.get(200, TimeUnit.MILLISECONDS));

        q.complete(first);
        assertEquals(ScanReason.MANUAL, next.get(2, TimeUnit.SECONDS).reason());
    }

    @Test
    void defer_holdsJobUntilDelayElapses() throws Exception {
        ScanQueue q = new ScanQueue();
        long t0 = System.nanoTime();
        q.defer(ScanJob.of(A, ScanReason.RETRY), Duration.ofMillis(150));

        ScanJob job = q.dequeue();
        long waitedMs = (System.nanoTime() - t0) / 1_000_000;

        assertEquals(A, job.path());
        assertTrue(waitedMs >= 140, "Deferred job came out after " + waitedMs + " ms");
    }

    @Test
    void enqueue_supersedesDeferral() throws Exception {
        ScanQueue q = new ScanQueue();
        q.defer(ScanJob.of(A, ScanReason.RETRY), Duration.ofHours(1));
        q.enqueue(ScanJob.of(A, ScanReason.MODIFY));

        ScanJob job = CompletableFuture.supplyAsync(() -> {
            try {
                return q.dequeue();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        }).get(2, TimeUnit.SECONDS);
        assertEquals(ScanReason.MODIFY, job.reason());
    }

    @Test
    void shutdown_wakesBlockedConsumers() throws Exception {
        ScanQueue q = new ScanQueue();
        CompletableFuture<ScanJob> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return q.dequeue();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);
        q.shutdown();
        q.shutdown();

        ExecutionException e = assertThrows(ExecutionException.class, () -> waiting.get(2, TimeUnit.SECONDS));
        assertInstanceOf(QueueShutdownException.class, e.getCause());
        assertFalse(q.enqueue(ScanJob.of(A, ScanReason.MODIFY)));
    }

    @Test
    void awaitIdle_waitsForInFlightCompletion() throws Exception {
        ScanQueue q = new ScanQueue();
        q.enqueue(ScanJob.of(A, ScanReason.MODIFY));
        ScanJob job = q.dequeue();

        assertFalse(q.awaitIdle(Duration.ofMillis(100)));
        q.complete(job);
        assertTrue(q.awaitIdle(Duration.ofMillis(100)));
    }
}
