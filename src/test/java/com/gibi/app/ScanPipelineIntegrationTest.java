package com.gibi.app;

import com.gibi.app.config.PipelineSettings;
import com.gibi.app.database.RecordFilter;
import com.gibi.app.model.ComicMetadata;
import com.gibi.app.model.FileRecord;
import com.gibi.app.model.MemoryTier;
import com.gibi.app.model.ScanJob;
import com.gibi.app.model.ScanReason;
import com.gibi.app.model.ScanState;
import com.gibi.app.scanner.ArchiveReader;
import com.gibi.app.scanner.ScanOutcome;
import com.gibi.app.service.MemoryProbe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static com.gibi.app.scanner.ArchiveFixtures.cbz;
import static com.gibi.app.scanner.ArchiveFixtures.comicInfo;
import static com.gibi.app.scanner.ArchiveFixtures.notAZip;
import static org.junit.jupiter.api.Assertions.*;

public class ScanPipelineIntegrationTest {

    private static final Duration IDLE = Duration.ofSeconds(15);

    @TempDir
    Path dir;

    private Path lib;
    private final AtomicLong usedPerMille = new AtomicLong(100);
    private final MemoryProbe probe = () -> new MemoryProbe.Usage(usedPerMille.get(), 1000);
    private CountingReader reader;
    private ScanPipeline pipeline;

    /** Conta leituras e, se armado, segura a primeira até ser liberada. */
    static final class CountingReader extends ArchiveReader {
        final AtomicInteger reads = new AtomicInteger();
        volatile CountDownLatch entered;
        volatile CountDownLatch release;

        CountingReader() {
            super(1024 * 1024, Duration.ofSeconds(10));
        }

        @Override
        public Optional<byte[]> readDescriptor(Path archive) throws IOException {
            reads.incrementAndGet();
            CountDownLatch r = release;
            if (r != null) {
                entered.countDown();
                try {
                    r.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.readDescriptor(archive);
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        lib = Files.createDirectories(dir.resolve("biblioteca"));
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) pipeline.close();
    }

    private PipelineSettings.Builder settings() {
        return PipelineSettings.builder(dir.resolve("db").resolve("index.sqlite"))
                .roots(List.of(lib))
                .workerCount(2)
                .quietPeriod(Duration.ofMillis(100))
                .memorySampleInterval(Duration.ofMillis(20))
                .criticalDeferDelay(Duration.ofMillis(50))
                .retryDelay(Duration.ofMillis(50))
                .watchRetry(Duration.ofMillis(50), Duration.ofMillis(200))
                .watchEnabled(false)
                .reconcileOnStart(false);
    }

    private ScanPipeline start(PipelineSettings s) {
        reader = new CountingReader();
        pipeline = new ScanPipeline(s, probe, reader);
        pipeline.start();
        return pipeline;
    }

    private void scan(Path p) throws InterruptedException {
        pipeline.requestScan(p);
        assertTrue(pipeline.awaitIdle(IDLE), "Pipeline should drain");
    }

    private FileRecord record(Path p) {
        return pipeline.store().get(p).orElseThrow(() -> new AssertionError("Not indexed: " + p));
    }

    @Test
    void archiveWithoutDescriptor_isCleanWithEmptyMetadata() throws Exception {
        start(settings().build());
        Path a = cbz(lib.resolve("A.cbz"), null);

        scan(a);

        FileRecord r = record(a);
        assertEquals(ScanState.CLEAN, r.scanState());
        assertTrue(r.metadata().isEmpty());
        assertEquals(1, reader.reads.get());
    }

    @Test
    void descriptor_isIndexedAndQueryable() throws Exception {
        start(settings().build());
        Path a = cbz(lib.resolve("monica-01.cbz"), comicInfo("Turma da Mônica", "1", 3, "infantil, humor"));

        scan(a);

        ComicMetadata m = record(a).metadata();
        assertEquals("Turma da Mônica", m.text(ComicMetadata.SERIES).orElseThrow());
        assertEquals("1", m.text(ComicMetadata.NUMBER).orElseThrow());
        assertEquals(3L, m.number(ComicMetadata.VOLUME).getAsLong());
        assertEquals(List.of("infantil", "humor"), m.list(ComicMetadata.TAGS));

        List<FileRecord> hits = pipeline.store().list(RecordFilter.all().whereListContains(ComicMetadata.TAGS, "humor"));
        assertEquals(1, hits.size());
        assertEquals(a.toAbsolutePath().normalize().toString(), hits.get(0).path());
    }

    @Test
    void modifiedArchive_isReindexed() throws Exception {
        start(settings().build());
        Path a = cbz(lib.resolve("a.cbz"), comicInfo("Cebolinha", "1", 1, "humor"));
        scan(a);

        cbz(a, comicInfo("Cebolinha", "2", 1, "humor, especial"));
        Files.setLastModifiedTime(a, FileTime.fromMillis(Files.getLastModifiedTime(a).toMillis() + 5_000));
        pipeline.submit(ScanJob.of(a, ScanReason.MODIFY));
        assertTrue(pipeline.awaitIdle(IDLE));

        assertEquals("2", record(a).metadata().text(ComicMetadata.NUMBER).orElseThrow());
        assertEquals(2, reader.reads.get());
    }

    @Test
    void deletedArchive_leavesIndex() throws Exception {
        start(settings().build());
        Path a = cbz(lib.resolve("a.cbz"), null);
        scan(a);

        Files.delete(a);
        pipeline.submit(ScanJob.of(a, ScanReason.DELETE));
        assertTrue(pipeline.awaitIdle(IDLE));

        assertTrue(pipeline.store().get(a).isEmpty());
        assertEquals(1, pipeline.metrics().count(ScanOutcome.DELETED));
    }

    @Test
    void scanOfVanishedFile_removesRecord() throws Exception {
        start(settings().build());
        Path a = cbz(lib.resolve("a.cbz"), null);
        scan(a);

        Files.delete(a);
        pipeline.submit(ScanJob.of(a, ScanReason.MODIFY));
        assertTrue(pipeline.awaitIdle(IDLE));
        assertTrue(pipeline.store().get(a).isEmpty());
    }

    @Test
    void rename_keepsMetadataWithoutRereading() throws Exception {
        start(settings().build());
        Path from = cbz(lib.resolve("velho.cbz"), comicInfo("Chico Bento", "7", 2, "roça"));
        scan(from);

        Path to = lib.resolve("sub").resolve("novo.cbz");
        Files.createDirectories(to.getParent());
        Files.move(from, to);
        pipeline.submit(ScanJob.move(from, to));
        assertTrue(pipeline.awaitIdle(IDLE));

        assertTrue(pipeline.store().get(from).isEmpty());
        FileRecord r = record(to);
        assertEquals("Chico Bento", r.metadata().text(ComicMetadata.SERIES).orElseThrow());
        assertEquals(ScanState.CLEAN, r.scanState());
        assertEquals(1, reader.reads.get(), "Metadata follows the file without decoding again");
        assertEquals(1, pipeline.metrics().count(ScanOutcome.MOVED));
    }

    /** Segura o único worker num arquivo qualquer para os jobs seguintes se acumularem na fila. */
    private CountDownLatch holdWorker() throws Exception {
        Path blocker = cbz(lib.resolve("bloqueio.cbz"), null);
        reader.entered = new CountDownLatch(1);
        reader.release = new CountDownLatch(1);
        pipeline.requestScan(blocker);
        assertTrue(reader.entered.await(10, TimeUnit.SECONDS), "Worker should be busy");
        CountDownLatch release = reader.release;
        reader.release = null;
        return release;
    }

    @Test
    void chainedMovesWhileQueued_leaveNoGhostRecord() throws Exception {
        start(settings().workerCount(1).build());
        Path a = cbz(lib.resolve("a.cbz"), comicInfo("Bidu", "3", 1, "cachorro"));
        scan(a);

        CountDownLatch release = holdWorker();
        Path b = lib.resolve("b.cbz");
        Path c = lib.resolve("c.cbz");
        Files.move(a, b);
        Files.move(b, c);
        pipeline.submit(ScanJob.move(a, b));
        pipeline.submit(ScanJob.move(b, c));
        release.countDown();
        assertTrue(pipeline.awaitIdle(IDLE));

        assertTrue(pipeline.store().get(a).isEmpty(), "Origin of the chain is gone");
        assertTrue(pipeline.store().get(b).isEmpty());
        assertEquals("Bidu", record(c).metadata().text(ComicMetadata.SERIES).orElseThrow());
        assertEquals(2, pipeline.store().count(), "c plus the blocker");
        assertEquals(2, reader.reads.get(), "Only a and the blocker were decoded");
    }

    @Test
    void deleteOfQueuedMoveTarget_removesOrigin() throws Exception {
        start(settings().workerCount(1).build());
        Path a = cbz(lib.resolve("a.cbz"), comicInfo("Bidu", "4", 1, "cachorro"));
        scan(a);

        CountDownLatch release = holdWorker();
        Path b = lib.resolve("b.cbz");
        Files.move(a, b);
        pipeline.submit(ScanJob.move(a, b));
        Files.delete(b);
        pipeline.submit(ScanJob.of(b, ScanReason.DELETE));
        release.countDown();
        assertTrue(pipeline.awaitIdle(IDLE));

        assertTrue(pipeline.store().get(a).isEmpty(), "No ghost record at the origin");
        assertTrue(pipeline.store().get(b).isEmpty());
        assertEquals(1, pipeline.store().count(), "Only the blocker remains");
    }

    @Test
    void unchangedArchive_isNotDecodedAgain() throws Exception {
        start(settings().build());
        Path a = cbz(lib.resolve("a.cbz"), comicInfo("Magali", "1", 1, "comida"));
        scan(a);
        ComicMetadata first = record(a).metadata();

        pipeline.cache().clear();

        pipeline.submit(ScanJob.of(a, ScanReason.SWEEP));
        assertTrue(pipeline.awaitIdle(IDLE));
        pipeline.submit(ScanJob.of(a, ScanReason.MODIFY));
        assertTrue(pipeline.awaitIdle(IDLE));

        assertEquals(1, reader.reads.get(), "Queued records still remember the last clean scan");
        assertEquals(0, pipeline.metrics().cacheHits.sum());
        assertEquals(2, pipeline.metrics().count(ScanOutcome.UNCHANGED));
        assertEquals(first, record(a).metadata());
        assertEquals(ScanState.CLEAN, record(a).scanState());
    }

    @Test
    void failedArchive_isDecodedAgainEvenWhenUnchanged() throws Exception {
        start(settings().maxConsecutiveFailures(1).build());
        Path bad = notAZip(lib.resolve("ruim.cbz"));
        scan(bad);
        assertEquals(ScanState.FAILED, record(bad).scanState());

        pipeline.submit(ScanJob.of(bad, ScanReason.MODIFY));
        assertTrue(pipeline.awaitIdle(IDLE));

        assertEquals(2, reader.reads.get());
        assertEquals(0, pipeline.metrics().count(ScanOutcome.UNCHANGED));
    }

    @Test
    void manualRescanDuringScan_runsAgainAfterwards() throws Exception {
        start(settings().build());
        Path a = cbz(lib.resolve("a.cbz"), comicInfo("Cascão", "1", 1, "humor"));
        reader.entered = new CountDownLatch(1);
        reader.release = new CountDownLatch(1);

        pipeline.requestScan(a);
        assertTrue(reader.entered.await(10, TimeUnit.SECONDS), "First scan should be reading");
        CountDownLatch release = reader.release;
        reader.release = null;

        pipeline.requestScan(a);
        release.countDown();
        assertTrue(pipeline.awaitIdle(IDLE));

        assertEquals(2, reader.reads.get());
        assertEquals(ScanState.CLEAN, record(a).scanState());
    }

    @Test
    void criticalMemory_defersBackgroundWork_butNotManual() throws Exception {
        start(settings().build());
        Path a = cbz(lib.resolve("a.cbz"), null);
        Path b = cbz(lib.resolve("b.cbz"), null);

        usedPerMille.set(950);
        pipeline.monitor().sampleNow();
        assertEquals(MemoryTier.CRITICAL, pipeline.monitor().currentTier());

        pipeline.submit(ScanJob.of(a, ScanReason.SWEEP));
        pipeline.requestScan(b);

        assertTrue(waitFor(() -> pipeline.store().get(b).map(r -> r.scanState() == ScanState.CLEAN).orElse(false)),
                "Manual scan runs under pressure");
        assertTrue(waitFor(() -> pipeline.metrics().count(ScanOutcome.DEFERRED) > 0));
        assertEquals(ScanState.QUEUED, record(a).scanState());

        usedPerMille.set(100);
        assertTrue(waitFor(() -> pipeline.monitor().currentTier() == MemoryTier.NORMAL));
        assertTrue(pipeline.awaitIdle(IDLE));
        assertEquals(ScanState.CLEAN, record(a).scanState());
    }

    @Test
    void repeatedFailures_suppressRetries_untilManualRescan() throws Exception {
        start(settings().build());
        Path bad = notAZip(lib.resolve("ruim.cbz"));

        scan(bad);

        FileRecord failed = record(bad);
        assertEquals(ScanState.FAILED, failed.scanState());
        assertEquals(3, failed.consecutiveFailures());
        assertNotNull(failed.lastError());
        assertEquals(3, pipeline.metrics().count(ScanOutcome.FAILED));

        assertFalse(pipeline.submit(ScanJob.of(bad, ScanReason.SWEEP)), "Background jobs are dropped");
        assertEquals(0, pipeline.fullSweep());
        assertTrue(pipeline.awaitIdle(IDLE));
        assertEquals(3, reader.reads.get());

        cbz(bad, comicInfo("Consertado", "1", 1, "ok"));
        scan(bad);

        FileRecord fixed = record(bad);
        assertEquals(ScanState.CLEAN, fixed.scanState());
        assertEquals(0, fixed.consecutiveFailures());
        assertEquals("Consertado", fixed.metadata().text(ComicMetadata.SERIES).orElseThrow());
    }

    @Test
    void reconcile_picksUpNewFilesAndDropsVanishedOnes() throws Exception {
        start(settings().build());
        Path x = cbz(lib.resolve("x.cbz"), null);
        Path y = cbz(lib.resolve("serie").resolve("y.zip"), null);
        cbz(lib.resolve(".oculta").resolve("z.cbz"), null);
        Files.writeString(lib.resolve("leia-me.txt"), "nada");

        pipeline.reconcile();
        assertTrue(pipeline.awaitIdle(IDLE));
        assertEquals(2, pipeline.store().count());
        assertEquals(ScanState.CLEAN, record(x).scanState());
        assertEquals(ScanState.CLEAN, record(y).scanState());

        Files.delete(x);
        Path w = cbz(lib.resolve("w.cbz"), null);
        pipeline.reconcile();
        assertTrue(pipeline.awaitIdle(IDLE));

        assertTrue(pipeline.store().get(x).isEmpty());
        assertEquals(ScanState.CLEAN, record(w).scanState());
        assertEquals(2, pipeline.store().count());
        assertEquals(3, reader.reads.get(), "y is settled and unchanged");
    }

    @Test
    void reopenedIndex_keepsRecords() throws Exception {
        PipelineSettings s = settings().build();
        start(s);
        Path a = cbz(lib.resolve("a.cbz"), comicInfo("Horácio", "1", 1, "filosofia"));
        scan(a);
        pipeline.close();

        start(s);
        assertEquals("Horácio", record(a).metadata().text(ComicMetadata.SERIES).orElseThrow());
    }

    @Test
    void watchedLibrary_indexesNewArchives() throws Exception {
        Path before = cbz(lib.resolve("antes.cbz"), comicInfo("Penadinho", "1", 1, "terror"));
        start(settings().watchEnabled(true).reconcileOnStart(true).build());

        assertTrue(waitFor(() -> pipeline.store().get(before).map(r -> r.scanState() == ScanState.CLEAN).orElse(false)),
                "Reconcile on start indexes existing files");

        Path after = cbz(lib.resolve("depois.cbz"), comicInfo("Penadinho", "2", 1, "terror"));
        assertTrue(waitFor(() -> pipeline.store().get(after).map(r -> r.scanState() == ScanState.CLEAN).orElse(false)),
                "Watcher indexes new files");
        assertTrue(pipeline.health().snapshot().healthy());
    }

    @Test
    void watchedRename_movesRecordWithoutRereading() throws Exception {
        Path from = cbz(lib.resolve("antigo.cbz"), comicInfo("Piteco", "1", 1, "pré-história"));
        start(settings().watchEnabled(true).build());
        scan(from);
        assertEquals(1, reader.reads.get());

        Path to = lib.resolve("renomeado.cbz");
        Files.move(from, to);

        assertTrue(waitFor(() -> pipeline.store().get(to).map(r -> r.scanState() == ScanState.CLEAN).orElse(false)),
                "Renamed file is indexed under its new path");
        assertTrue(pipeline.awaitIdle(IDLE));
        assertTrue(pipeline.store().get(from).isEmpty());
        assertEquals("Piteco", record(to).metadata().text(ComicMetadata.SERIES).orElseThrow());
        assertEquals(1, pipeline.metrics().count(ScanOutcome.MOVED));
        assertEquals(1, reader.reads.get(), "Rename is paired into a move, not delete plus create");
    }

    private static boolean waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) return true;
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
