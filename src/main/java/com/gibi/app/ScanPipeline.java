package com.gibi.app;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gibi.app.config.PipelineSettings;
import com.gibi.app.database.IndexDatabase;
import com.gibi.app.database.IndexStore;
import com.gibi.app.database.IndexWriter;
import com.gibi.app.database.RecordFilter;
import com.gibi.app.model.FileRecord;
import com.gibi.app.model.FileStats;
import com.gibi.app.model.ScanJob;
import com.gibi.app.model.ScanReason;
import com.gibi.app.queue.ScanQueue;
import com.gibi.app.scanner.ArchiveReader;
import com.gibi.app.scanner.ComicInfoParser;
import com.gibi.app.scanner.DescriptorCache;
import com.gibi.app.scanner.LibraryWalker;
import com.gibi.app.scanner.ScanMetrics;
import com.gibi.app.scanner.ScannerWorker;
import com.gibi.app.service.MemoryPressureMonitor;
import com.gibi.app.service.MemoryProbe;
import com.gibi.app.service.OshiMemoryProbe;
import com.gibi.app.service.PipelineHealth;
import com.gibi.app.watch.ArchiveFilter;
import com.gibi.app.watch.ChangeDetector;

/**
 * Dono explícito de todas as peças: índice, fila, monitor de memória, detector e workers.
 * <p>
 * Fluxo: detector → fila → workers → escritor → SQLite. Leitores usam {@link #store()}
 * e nunca passam pela fila.
 */
public final class ScanPipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScanPipeline.class);

    private final PipelineSettings settings;
    private final IndexDatabase db;
    private final PipelineHealth health = new PipelineHealth();
    private final IndexWriter writer;
    private final IndexStore store;
    private final ScanQueue queue = new ScanQueue();
    private final MemoryPressureMonitor monitor;
    private final DescriptorCache cache;
    private final ScanMetrics metrics = new ScanMetrics();
    private final ArchiveReader reader;
    private final ArchiveFilter filter;
    private final LibraryWalker walker;
    private final ChangeDetector detector;

    private final ExecutorService workers;
    private final ExecutorService maintenance;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public static ScanPipeline open(PipelineSettings settings) {
        return new ScanPipeline(settings,
                new OshiMemoryProbe(settings.memoryLimitBytes()),
                new ArchiveReader(settings.maxDescriptorBytes(), settings.archiveTimeout()));
    }

    public ScanPipeline(PipelineSettings settings, MemoryProbe probe, ArchiveReader reader) {
        this.settings = settings;
        this.reader = reader;
        this.db = IndexDatabase.open(settings.dbFile());
        this.writer = new IndexWriter(db, health);
        this.store = new IndexStore(db, writer);
        this.monitor = new MemoryPressureMonitor(probe, settings.elevatedRatio(), settings.criticalRatio(),
                settings.hysteresisMargin(), settings.memorySampleInterval());
        this.cache = new DescriptorCache(settings.descriptorCacheSize());
        this.monitor.onCritical(cache::clear);
        this.filter = new ArchiveFilter(settings.archiveExtensions(), settings.roots());
        this.walker = new LibraryWalker(filter);
        this.detector = new ChangeDetector(settings.quietPeriod(), filter, this::submit, this::requestReconcile,
                health, System::nanoTime)
                .withWatchRetry(settings.watchRetryInitial(), settings.watchRetryMax())
                .withMoveMatcher(this::isSameArchive);

        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.workerCount(), r -> {
            Thread t = new Thread(r, "gibi-scan-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.maintenance = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "gibi-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!started.compareAndSet(false, true)) return;
        monitor.start();

        ScannerWorker.Limits limits = new ScannerWorker.Limits(settings.criticalDeferDelay(), settings.retryDelay(),
                settings.maxConsecutiveFailures());
        ComicInfoParser parser = new ComicInfoParser();
        for (int i = 0; i < settings.workerCount(); i++) {
            workers.execute(new ScannerWorker(queue, store, monitor, reader, parser, cache, metrics, limits, this::submit));
        }

        detector.start();
        if (settings.watchEnabled()) {
            settings.roots().forEach(detector::watch);
        }
        if (settings.reconcileOnStart()) {
            settings.roots().forEach(this::requestReconcile);
        }
        logger.info("Pipeline iniciado: {} raiz(es), {} worker(s), índice em {}",
                settings.roots().size(), settings.workerCount(), db.file());
    }

    // --- Entrada de jobs -----------------------------------------------------

    /**
     * Porta de entrada de todo job. Jobs de scan marcam o registro como QUEUED antes de ir
     * para a fila; o escritor é FIFO, então isso sempre precede o SCANNING do worker.
     */
    public boolean submit(ScanJob job) {
        ScanReason reason = job.reason();
        if (reason == ScanReason.DELETE || reason == ScanReason.MOVE) {
            return queue.enqueue(job);
        }

        FileStats stats = FileStats.readOrNull(job.path());
        if (stats == null) {
            return queue.enqueue(ScanJob.of(job.path(), ScanReason.DELETE));
        }
        if (reason.isAutomatic()) {
            Optional<FileRecord> current = store.get(job.path());
            if (current.isPresent() && current.get().consecutiveFailures() >= settings.maxConsecutiveFailures()) {
                return false;
            }
        }

        store.markQueued(job.path(), stats, reason.resetsFailures())
                .exceptionally(e -> {
                    logger.warn("Não consegui marcar {} como QUEUED: {}", job.path(), e.toString());
                    return false;
                });
        return queue.enqueue(job);
    }

    /** Re-scan manual: passa na frente de mudanças e varreduras e libera arquivos suprimidos. */
    public boolean requestScan(Path path) {
        return submit(ScanJob.of(path, ScanReason.MANUAL));
    }

    /** Job de fundo para todo path rastreado que não esteja suprimido por falhas. */
    public int fullSweep() {
        List<Path> paths;
        try (Stream<FileRecord> records = store.query(RecordFilter.all())) {
            paths = records
                    .filter(r -> r.consecutiveFailures() < settings.maxConsecutiveFailures())
                    .map(r -> Path.of(r.path()))
                    .collect(Collectors.toCollection(ArrayList::new));
        }
        int accepted = 0;
        for (Path p : paths) {
            if (submit(ScanJob.of(p, ScanReason.SWEEP))) accepted++;
        }
        logger.info("Varredura completa: {} de {} paths enfileirados", accepted, paths.size());
        return accepted;
    }

    // --- Reconciliação -------------------------------------------------------

    /** Confronta todas as raízes com o índice. Síncrono. */
    public void reconcile() {
        for (Path root : settings.roots()) {
            try {
                reconcileRoot(root);
            } catch (IOException e) {
                logger.error("Reconciliação de {} falhou: {}", root, e.toString());
            }
        }
    }

    /**
     * Archives novos, alterados ou com estado pendente viram SWEEP; registros cujo arquivo
     * sumiu viram DELETE.
     */
    public void reconcileRoot(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            logger.warn("Raiz {} indisponível; reconciliação adiada", root);
            return;
        }
        Set<String> seen = new HashSet<>();
        AtomicInteger queued = new AtomicInteger();
        walker.walk(root, (path, stats) -> {
            seen.add(IndexStore.key(path));
            Optional<FileRecord> current = store.get(path);
            boolean stale = current.isEmpty()
                    || !current.get().matches(stats)
                    || !current.get().scanState().isSettled();
            if (stale && submit(ScanJob.of(path, ScanReason.SWEEP))) queued.incrementAndGet();
        });

        List<Path> vanished;
        try (Stream<FileRecord> tracked = store.query(RecordFilter.all().under(root))) {
            vanished = tracked.map(FileRecord::path)
                    .filter(p -> !seen.contains(p))
                    .map(Path::of)
                    .collect(Collectors.toCollection(ArrayList::new));
        }
        vanished.forEach(p -> queue.enqueue(ScanJob.of(p, ScanReason.DELETE)));
        logger.info("Reconciliação de {}: {} para escanear, {} removidos", root, queued.get(), vanished.size());
    }

    private void requestReconcile(Path root) {
        if (closed.get()) return;
        try {
            maintenance.execute(() -> {
                try {
                    reconcileRoot(root);
                } catch (IOException | RuntimeException e) {
                    logger.error("Reconciliação de {} falhou: {}", root, e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Reconciliação de {} ignorada: pipeline encerrando", root);
        }
    }

    private boolean isSameArchive(Path deleted, Path created) {
        FileStats now = FileStats.readOrNull(created);
        if (now == null) return false;
        return store.get(deleted).map(r -> r.sizeBytes() == now.sizeBytes()).orElse(false);
    }

    // --- Acesso --------------------------------------------------------------

    /**
     * Espera a fila esvaziar e o escritor gravar tudo.
     * Buckets do debounce ainda não vencidos não contam.
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        boolean idle = queue.awaitIdle(timeout);
        writer.sync();
        return idle;
    }

    public IndexStore store() { return store; }
    public ScanQueue queue() { return queue; }
    public MemoryPressureMonitor monitor() { return monitor; }
    public ChangeDetector detector() { return detector; }
    public PipelineHealth health() { return health; }
    public ScanMetrics metrics() { return metrics; }
    public DescriptorCache cache() { return cache; }
    public PipelineSettings settings() { return settings; }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        detector.close();
        maintenance.shutdownNow();
        queue.shutdown();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Workers não terminaram em 30s");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        reader.close();
        writer.close();
        monitor.close();
        db.close();
        logger.info("Pipeline encerrado ({})", metrics);
    }
}
