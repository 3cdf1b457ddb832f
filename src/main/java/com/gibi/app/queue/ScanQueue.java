package com.gibi.app.queue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gibi.app.model.ScanJob;
import com.gibi.app.model.ScanReason;

/**
 * Fila de scan com prioridade e deduplicação por path.
 * <p>
 * No máximo um job pendente por arquivo, e no máximo um worker com o mesmo arquivo em mãos
 * (claim liberado em {@link #complete(ScanJob)}). Um MOVE em execução segura origem e destino.
 * Dentro da mesma faixa, FIFO.
 */
public final class ScanQueue {

    private static final Logger logger = LoggerFactory.getLogger(ScanQueue.class);

    private record Entry(ScanJob job, long seq, long notBeforeNanos) {
        boolean deferred() {
            return notBeforeNanos != 0L;
        }
    }

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> -e.job().priority().rank())
            .thenComparingLong(Entry::seq);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<Path, Entry> byPath = new HashMap<>();
    private final TreeSet<Entry> ordered = new TreeSet<>(ORDER);
    private final Set<Path> inFlight = new HashSet<>();
    private final LongSupplier nanoClock;

    private long seq = 0L;
    private boolean shutdown = false;

    public ScanQueue() {
        this(System::nanoTime);
    }

    public ScanQueue(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    /**
     * Nunca bloqueia. Devolve false quando o job foi descartado (prioridade menor que a do
     * pendente, ou fila encerrada).
     * <p>
     * MOVE pendente nunca some sem deixar rastro: um MOVE encadeado (A->B e depois B->C) vira
     * A->C, e qualquer job que substitua um MOVE pendente gera DELETE da origem dele.
     */
    public boolean enqueue(ScanJob job) {
        lock.lock();
        try {
            if (shutdown) {
                logger.debug("Fila encerrada, descartando {}", job);
                return false;
            }
            return offer(job);
        } finally {
            lock.unlock();
        }
    }

    private boolean offer(ScanJob job) {
        if (job.reason() == ScanReason.MOVE) {
            Entry stale = byPath.remove(job.previousPath());
            if (stale != null) {
                ordered.remove(stale);
                if (stale.job().reason() == ScanReason.MOVE) {
                    // O índice ainda tem o registro na origem do primeiro MOVE
                    Path origin = stale.job().previousPath();
                    if (origin.equals(job.path())) {
                        return offer(ScanJob.of(origin, ScanReason.MODIFY));
                    }
                    logger.debug("MOVE encadeado: {} -> {} -> {}", origin, job.previousPath(), job.path());
                    job = ScanJob.move(origin, job.path());
                }
            }
        }
        Entry existing = byPath.get(job.path());
        if (existing != null) {
            if (existing.job().priority().outranks(job.priority())) {
                return false;
            }
            ordered.remove(existing);
        }
        put(new Entry(job, seq++, 0L));
        if (existing != null && existing.job().reason() == ScanReason.MOVE
                && !existing.job().previousPath().equals(job.previousPath())) {
            offer(ScanJob.of(existing.job().previousPath(), ScanReason.DELETE));
        }
        return true;
    }

    /**
     * Reinsere o job com horário mínimo de execução. Se já existe job pendente para o path,
     * ele prevalece e o adiamento é descartado.
     */
    public boolean defer(ScanJob job, Duration delay) {
        lock.lock();
        try {
            if (shutdown || byPath.containsKey(job.path())) return false;
            long notBefore = nanoClock.getAsLong() + Math.max(1L, delay.toNanos());
            if (notBefore == 0L) notBefore = 1L;
            put(new Entry(job, seq++, notBefore));
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void put(Entry e) {
        byPath.put(e.job().path(), e);
        ordered.add(e);
        changed.signalAll();
    }

    /**
     * Bloqueia até existir um job elegível: maior prioridade, mais antigo, sem adiamento pendente
     * e cujo path não esteja com outro worker.
     *
     * @throws QueueShutdownException depois de {@link #shutdown()}
     */
    public ScanJob dequeue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (shutdown) throw new QueueShutdownException();
                long now = nanoClock.getAsLong();
                long nextWake = Long.MAX_VALUE;
                Entry pick = null;
                for (Entry e : ordered) {
                    if (inFlight.contains(e.job().path())) continue;
                    Path origin = e.job().previousPath();
                    if (origin != null && inFlight.contains(origin)) continue;
                    if (e.deferred() && e.notBeforeNanos() - now > 0) {
                        nextWake = Math.min(nextWake, e.notBeforeNanos() - now);
                        continue;
                    }
                    pick = e;
                    break;
                }
                if (pick != null) {
                    ordered.remove(pick);
                    byPath.remove(pick.job().path());
                    inFlight.add(pick.job().path());
                    if (pick.job().previousPath() != null) inFlight.add(pick.job().previousPath());
                    return pick.job();
                }
                if (nextWake == Long.MAX_VALUE) {
                    changed.await();
                } else {
                    changed.awaitNanos(nextWake);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /** Libera o claim do path; um job enfileirado enquanto isso passa a ser elegível. */
    public void complete(ScanJob job) {
        lock.lock();
        try {
            boolean released = inFlight.remove(job.path());
            if (job.previousPath() != null) released |= inFlight.remove(job.previousPath());
            if (released) changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void shutdown() {
        lock.lock();
        try {
            if (!shutdown) {
                shutdown = true;
                logger.debug("Fila de scan encerrada com {} jobs pendentes", byPath.size());
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    /** Espera a fila esvaziar (incluindo adiados) e nenhum worker estar com job em mãos. */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!byPath.isEmpty() || !inFlight.isEmpty()) {
                if (remaining <= 0L) return false;
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return byPath.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlight() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(Path path) {
        return pending(path).isPresent();
    }

    public Optional<ScanJob> pending(Path path) {
        Path key = path.toAbsolutePath().normalize();
        lock.lock();
        try {
            Entry e = byPath.get(key);
            return e == null ? Optional.empty() : Optional.of(e.job());
        } finally {
            lock.unlock();
        }
    }
}
