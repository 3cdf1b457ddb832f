package com.gibi.app.scanner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gibi.app.database.IndexStore;
import com.gibi.app.model.ComicMetadata;
import com.gibi.app.model.FileRecord;
import com.gibi.app.model.FileStats;
import com.gibi.app.model.MemoryTier;
import com.gibi.app.model.ScanJob;
import com.gibi.app.model.ScanReason;
import com.gibi.app.model.ScanState;
import com.gibi.app.queue.QueueShutdownException;
import com.gibi.app.queue.ScanQueue;
import com.gibi.app.service.MemoryPressureMonitor;

/**
 * Consome a fila: decodifica o ComicInfo.xml e entrega o resultado ao escritor do índice.
 * Várias instâncias rodam em paralelo; a fila garante que nenhuma pega o mesmo path ao mesmo tempo.
 */
public final class ScannerWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ScannerWorker.class);

    public record Limits(Duration criticalDeferDelay, Duration retryDelay, int maxConsecutiveFailures) {}

    private final ScanQueue queue;
    private final IndexStore store;
    private final MemoryPressureMonitor monitor;
    private final ArchiveReader reader;
    private final ComicInfoParser parser;
    private final DescriptorCache cache;
    private final ScanMetrics metrics;
    private final Limits limits;
    private final Consumer<ScanJob> resubmit;

    public ScannerWorker(ScanQueue queue, IndexStore store, MemoryPressureMonitor monitor, ArchiveReader reader,
                         ComicInfoParser parser, DescriptorCache cache, ScanMetrics metrics, Limits limits,
                         Consumer<ScanJob> resubmit) {
        this.queue = queue;
        this.store = store;
        this.monitor = monitor;
        this.reader = reader;
        this.parser = parser;
        this.cache = cache;
        this.metrics = metrics;
        this.limits = limits;
        this.resubmit = resubmit;
    }

    @Override
    public void run() {
        while (true) {
            ScanJob job;
            try {
                job = queue.dequeue();
            } catch (QueueShutdownException e) {
                logger.debug("{} saindo: fila encerrada", Thread.currentThread().getName());
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            try {
                ScanOutcome outcome = process(job);
                metrics.record(outcome);
                logger.debug("{} {} -> {}", job.reason(), job.path(), outcome);
            } catch (RuntimeException e) {
                // Erro de índice já marcou a saúde como degradada; o worker segue com o próximo
                logger.error("Job {} {} abortado: {}", job.reason(), job.path(), e.toString());
            } finally {
                queue.complete(job);
            }
        }
    }

    public ScanOutcome process(ScanJob job) {
        return switch (job.reason()) {
            case DELETE -> exists(job.path()) ? scan(job.withReason(ScanReason.MODIFY)) : remove(job.path());
            case MOVE -> move(job);
            default -> scan(job);
        };
    }

    private ScanOutcome remove(Path path) {
        cache.invalidate(path);
        boolean removed = await(store.delete(path));
        if (removed) logger.info("Removido do índice: {}", path);
        return removed ? ScanOutcome.DELETED : ScanOutcome.SKIPPED;
    }

    private ScanOutcome move(ScanJob job) {
        Path from = job.previousPath();
        Path to = job.path();
        if (!exists(to)) {
            // Moveu de novo antes de processarmos; o evento seguinte cuida do destino
            return remove(from);
        }

        Optional<FileRecord> moved = await(store.rename(from, to));
        cache.invalidate(from);
        if (moved.isEmpty()) {
            return scan(job.withReason(ScanReason.CREATE));
        }

        FileStats now = FileStats.readOrNull(to);
        FileRecord rec = moved.get();
        if (now == null) return remove(to);
        if (!rec.matches(now) || rec.scanState() != ScanState.CLEAN) {
            resubmit.accept(ScanJob.of(to, ScanReason.MODIFY));
        }
        logger.info("Movido no índice: {} -> {}", from, to);
        return ScanOutcome.MOVED;
    }

    private ScanOutcome scan(ScanJob job) {
        Path path = job.path();
        FileStats stats = FileStats.readOrNull(path);
        if (stats == null) return remove(path);

        boolean manual = job.reason() == ScanReason.MANUAL;
        if (!manual && monitor.currentTier() == MemoryTier.CRITICAL) {
            queue.defer(job, limits.criticalDeferDelay());
            return ScanOutcome.DEFERRED;
        }

        if (job.reason().isAutomatic()) {
            Optional<FileRecord> current = store.get(path);
            if (current.isPresent() && current.get().consecutiveFailures() >= limits.maxConsecutiveFailures()) {
                logger.debug("{} suprimido após {} falhas", path, current.get().consecutiveFailures());
                return ScanOutcome.SUPPRESSED;
            }
        }

        Optional<FileRecord> before = await(store.markScanning(path, stats, job.reason().resetsFailures()));

        if (!manual && before.isPresent() && before.get().cleanFor(stats)) {
            await(store.commitClean(path, stats, before.get().metadata()));
            return ScanOutcome.UNCHANGED;
        }

        try {
            ComicMetadata metadata = decode(path, stats, manual);
            boolean committed = await(store.commitClean(path, stats, metadata));
            return committed ? ScanOutcome.CLEAN : ScanOutcome.SKIPPED;
        } catch (IOException e) {
            if (!exists(path)) return remove(path);
            return fail(path, stats, e);
        }
    }

    private ComicMetadata decode(Path path, FileStats stats, boolean bypassCache) throws IOException {
        if (!bypassCache) {
            Optional<ComicMetadata> hit = cache.get(path, stats.fingerprint());
            if (hit.isPresent()) {
                metrics.cacheHits.increment();
                return hit.get();
            }
        }
        long t0 = System.nanoTime();
        Optional<byte[]> descriptor = reader.readDescriptor(path);
        metrics.descriptorReads.increment();
        ComicMetadata metadata = descriptor.isPresent() ? parser.parse(descriptor.get()) : ComicMetadata.empty();
        cache.put(path, stats.fingerprint(), metadata);
        logger.debug("Decodificado {} em {} ms ({} campos)", path, (System.nanoTime() - t0) / 1_000_000,
                metadata.fields().size());
        return metadata;
    }

    private ScanOutcome fail(Path path, FileStats stats, IOException e) {
        String error = e.getClass().getSimpleName() + ": " + e.getMessage();
        int failures = await(store.commitFailed(path, stats, error));
        if (failures < 0) return ScanOutcome.SKIPPED;
        if (failures < limits.maxConsecutiveFailures()) {
            logger.warn("Falha ao escanear {} ({}/{}), nova tentativa em {} ms: {}", path, failures,
                    limits.maxConsecutiveFailures(), limits.retryDelay().toMillis(), error);
            queue.defer(ScanJob.of(path, ScanReason.RETRY), limits.retryDelay());
        } else {
            logger.warn("Falha ao escanear {} ({} seguidas); retries suspensos até novo evento: {}", path, failures, error);
        }
        cache.invalidate(path);
        return ScanOutcome.FAILED;
    }

    private static boolean exists(Path path) {
        return Files.exists(path, LinkOption.NOFOLLOW_LINKS);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw e;
        }
    }
}
