package com.gibi.app.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gibi.app.model.MemorySample;
import com.gibi.app.model.MemoryTier;

/**
 * Amostra a memória em segundo plano e classifica em faixas com histerese.
 * <p>
 * Subir de faixa é imediato; descer exige a razão abaixo do limiar da faixa atual menos a
 * margem, uma faixa por amostra. {@link #currentTier()} só lê a última amostra.
 */
public final class MemoryPressureMonitor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MemoryPressureMonitor.class);

    private final MemoryProbe probe;
    private final double elevatedRatio;
    private final double criticalRatio;
    private final double margin;
    private final Duration interval;
    private final List<Runnable> criticalHooks = new CopyOnWriteArrayList<>();

    private volatile MemorySample current = MemorySample.initial();
    private ScheduledExecutorService sampler;

    public MemoryPressureMonitor(MemoryProbe probe, double elevatedRatio, double criticalRatio,
                                 double margin, Duration interval) {
        if (!(elevatedRatio > 0 && elevatedRatio < criticalRatio && criticalRatio <= 1.0)) {
            throw new IllegalArgumentException("Limiares inválidos: elevated=" + elevatedRatio + " critical=" + criticalRatio);
        }
        this.probe = probe;
        this.elevatedRatio = elevatedRatio;
        this.criticalRatio = criticalRatio;
        this.margin = Math.max(0.0, margin);
        this.interval = interval;
    }

    public MemoryTier currentTier() {
        return current.tier();
    }

    public MemorySample currentSample() {
        return current;
    }

    /** Registra um hook chamado a cada entrada em CRITICAL (ex.: esvaziar caches). */
    public void onCritical(Runnable hook) {
        criticalHooks.add(hook);
    }

    /** Faz uma leitura agora. Falha do probe conta como NORMAL. */
    public synchronized MemorySample sampleNow() {
        MemorySample prev = current;
        MemorySample next;
        try {
            MemoryProbe.Usage u = probe.sample();
            double ratio = u.ratio();
            next = new MemorySample(u.usedBytes(), u.limitBytes(), ratio, classify(prev.tier(), ratio), Instant.now());
        } catch (RuntimeException e) {
            logger.warn("Leitura de memória falhou; assumindo NORMAL: {}", e.toString());
            next = new MemorySample(0L, 0L, 0.0, MemoryTier.NORMAL, Instant.now());
        }
        current = next;

        if (next.tier() != prev.tier()) {
            if (next.tier() == MemoryTier.CRITICAL) {
                logger.warn("Memória em CRITICAL ({}%), pausando scans de fundo", Math.round(next.ratio() * 100));
                runCriticalHooks();
            } else {
                logger.info("Memória {} -> {} ({}%)", prev.tier(), next.tier(), Math.round(next.ratio() * 100));
            }
        }
        return next;
    }

    MemoryTier classify(MemoryTier tier, double ratio) {
        MemoryTier raw = ratio >= criticalRatio ? MemoryTier.CRITICAL
                : ratio >= elevatedRatio ? MemoryTier.ELEVATED
                : MemoryTier.NORMAL;
        if (raw.ordinal() >= tier.ordinal()) return raw;
        return ratio < threshold(tier) - margin ? tier.lower() : tier;
    }

    private double threshold(MemoryTier tier) {
        return switch (tier) {
            case CRITICAL -> criticalRatio;
            case ELEVATED -> elevatedRatio;
            case NORMAL -> 0.0;
        };
    }

    private void runCriticalHooks() {
        for (Runnable hook : criticalHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                logger.error("Hook de memória crítica falhou", e);
            }
        }
    }

    public synchronized void start() {
        if (sampler != null) return;
        sampler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gibi-memory");
            t.setDaemon(true);
            return t;
        });
        sampler.scheduleAtFixedRate(this::sampleNow, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        ScheduledExecutorService s;
        synchronized (this) {
            s = sampler;
            sampler = null;
        }
        if (s != null) s.shutdownNow();
    }
}
