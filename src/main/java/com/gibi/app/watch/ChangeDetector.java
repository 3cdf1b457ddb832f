package com.gibi.app.watch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gibi.app.model.ScanJob;
import com.gibi.app.model.ScanReason;
import com.gibi.app.service.PipelineHealth;

/**
 * Transforma eventos crus do filesystem em jobs de scan.
 * <p>
 * CREATE/MODIFY ficam num bucket por path até passar o período de silêncio; cada evento novo
 * reinicia o prazo. DELETE e MOVE saem na hora. O sink recebe jobs fora do lock.
 */
public final class ChangeDetector implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

    private static final long MIN_TICK_MS = 50L;

    private record Bucket(Path path, FsEvent.Kind lastKind, long deadlineNanos) {}

    private final Duration quietPeriod;
    private final ArchiveFilter filter;
    private final Consumer<ScanJob> sink;
    private final Consumer<Path> reconcileRequest;
    private final PipelineHealth health;
    private final LongSupplier nanoClock;

    private final Object bucketLock = new Object();
    private final Map<Path, Bucket> buckets = new HashMap<>();

    private final Map<Path, WatchSource> sources = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger watchThreads = new AtomicInteger();

    private final ScheduledExecutorService timer;
    private final ExecutorService watchLoops;

    private Duration retryInitial = Duration.ofSeconds(1);
    private Duration retryMax = Duration.ofSeconds(60);
    private MoveMatcher moveMatcher = (deleted, created) -> false;

    public ChangeDetector(Duration quietPeriod, ArchiveFilter filter, Consumer<ScanJob> sink,
                          Consumer<Path> reconcileRequest, PipelineHealth health, LongSupplier nanoClock) {
        this.quietPeriod = quietPeriod;
        this.filter = filter;
        this.sink = sink;
        this.reconcileRequest = reconcileRequest;
        this.health = health;
        this.nanoClock = nanoClock;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gibi-debounce");
            t.setDaemon(true);
            return t;
        });
        this.watchLoops = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "gibi-watch-" + watchThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ChangeDetector withWatchRetry(Duration initial, Duration max) {
        this.retryInitial = initial;
        this.retryMax = max;
        return this;
    }

    /** Critério para promover DELETE+CREATE do mesmo diretório a MOVE. */
    public ChangeDetector withMoveMatcher(MoveMatcher matcher) {
        this.moveMatcher = matcher;
        return this;
    }

    // --- Entrada -------------------------------------------------------------

    /** Não bloqueia: no máximo atualiza um bucket ou repassa um job estrutural. */
    public void observe(FsEvent ev) {
        if (closed.get()) return;
        switch (ev.kind()) {
            case OVERFLOW -> {
                logger.warn("Eventos perdidos em {}; pedindo reconciliação", ev.path());
                reconcileRequest.accept(ev.path());
            }
            case DELETE -> {
                if (!filter.acceptsGone(ev.path())) return;
                cancel(ev.path());
                sink.accept(ScanJob.of(ev.path(), ScanReason.DELETE));
            }
            case MOVE -> onMove(ev);
            case CREATE, MODIFY -> {
                if (!filter.accepts(ev.path())) return;
                long deadline = nanoClock.getAsLong() + quietPeriod.toNanos();
                synchronized (bucketLock) {
                    buckets.put(ev.path(), new Bucket(ev.path(), ev.kind(), deadline));
                }
            }
        }
    }

    private void onMove(FsEvent ev) {
        boolean fromTracked = filter.acceptsGone(ev.oldPath());
        boolean toTracked = filter.accepts(ev.path());
        if (fromTracked && toTracked) {
            cancel(ev.oldPath());
            cancel(ev.path());
            sink.accept(ScanJob.move(ev.oldPath(), ev.path()));
        } else if (fromTracked) {
            // Renomeado para algo fora do filtro (ex.: ficou oculto)
            cancel(ev.oldPath());
            sink.accept(ScanJob.of(ev.oldPath(), ScanReason.DELETE));
        } else if (toTracked) {
            observe(FsEvent.create(ev.path()));
        }
    }

    private void cancel(Path path) {
        synchronized (bucketLock) {
            buckets.remove(path);
        }
    }

    // --- Debounce ------------------------------------------------------------

    /** Emite os buckets vencidos, em ordem de prazo. Devolve quantos saíram. */
    public int flushDue() {
        long now = nanoClock.getAsLong();
        List<Bucket> due = new ArrayList<>();
        synchronized (bucketLock) {
            Iterator<Bucket> it = buckets.values().iterator();
            while (it.hasNext()) {
                Bucket b = it.next();
                if (b.deadlineNanos() - now <= 0) {
                    due.add(b);
                    it.remove();
                }
            }
        }
        due.sort(Comparator.comparingLong(Bucket::deadlineNanos));
        for (Bucket b : due) {
            ScanReason reason = b.lastKind() == FsEvent.Kind.CREATE ? ScanReason.CREATE : ScanReason.MODIFY;
            sink.accept(ScanJob.of(b.path(), reason));
        }
        return due.size();
    }

    public int pendingBuckets() {
        synchronized (bucketLock) {
            return buckets.size();
        }
    }

    /** Liga o timer do debounce. */
    public void start() {
        long tick = Math.max(MIN_TICK_MS, quietPeriod.toMillis() / 4);
        timer.scheduleWithFixedDelay(() -> {
            try {
                flushDue();
            } catch (RuntimeException e) {
                logger.error("Falha ao emitir jobs do debounce", e);
            }
        }, tick, tick, TimeUnit.MILLISECONDS);
    }

    // --- Watch ---------------------------------------------------------------

    /**
     * Começa a observar a raiz. Se não der, marca a raiz como perdida e agenda novas tentativas.
     */
    public void watch(Path root) {
        Path r = root.toAbsolutePath().normalize();
        if (!tryWatch(r)) {
            scheduleRetry(r, retryInitial);
        }
    }

    private boolean tryWatch(Path root) {
        if (closed.get()) return true;
        WatchSource source = null;
        try {
            source = new WatchSource(root, this::observe, filter, moveMatcher, e -> onWatchFailure(root, e));
            source.start();
            sources.put(root, source);
            watchLoops.submit(source::loop);
            return true;
        } catch (WatchException e) {
            closeQuietly(source);
            onLost(root, e);
            return false;
        } catch (IOException e) {
            closeQuietly(source);
            onLost(root, new WatchException(root, "WatchService indisponível", e));
            return false;
        }
    }

    private void onWatchFailure(Path root, WatchException e) {
        closeQuietly(sources.remove(root));
        onLost(root, e);
        scheduleRetry(root, retryInitial);
    }

    private void onLost(Path root, WatchException e) {
        logger.error("Watch perdido: {}", e.getMessage());
        health.watchLost(root, e.getMessage());
    }

    private void scheduleRetry(Path root, Duration delay) {
        if (closed.get()) return;
        timer.schedule(() -> retry(root, delay), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void retry(Path root, Duration lastDelay) {
        if (closed.get()) return;
        if (Files.isDirectory(root) && tryWatch(root)) {
            health.watchRestored(root);
            reconcileRequest.accept(root);
            return;
        }
        Duration next = lastDelay.multipliedBy(2);
        if (next.compareTo(retryMax) > 0) next = retryMax;
        logger.debug("Raiz {} ainda indisponível; nova tentativa em {} ms", root, next.toMillis());
        scheduleRetry(root, next);
    }

    private static void closeQuietly(WatchSource source) {
        if (source == null) return;
        try {
            source.close();
        } catch (IOException e) {
            logger.debug("Falha ao fechar WatchService de {}: {}", source.root(), e.toString());
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        sources.values().forEach(ChangeDetector::closeQuietly);
        sources.clear();
        timer.shutdownNow();
        watchLoops.shutdownNow();
        try {
            watchLoops.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
