package com.gibi.app.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parâmetros imutáveis do pipeline. Em produção vêm de {@link Config}; nos testes são montados pelo builder.
 */
public record PipelineSettings(
        Path dbFile,
        List<Path> roots,
        Set<String> archiveExtensions,
        Duration quietPeriod,
        int workerCount,
        Duration archiveTimeout,
        long maxDescriptorBytes,
        Duration memorySampleInterval,
        long memoryLimitBytes,
        double elevatedRatio,
        double criticalRatio,
        double hysteresisMargin,
        Duration criticalDeferDelay,
        Duration retryDelay,
        int maxConsecutiveFailures,
        int descriptorCacheSize,
        Duration watchRetryInitial,
        Duration watchRetryMax,
        boolean watchEnabled,
        boolean reconcileOnStart
) {

    public PipelineSettings {
        Objects.requireNonNull(dbFile, "dbFile");
        roots = roots.stream().map(p -> p.toAbsolutePath().normalize()).toList();
        archiveExtensions = Set.copyOf(archiveExtensions);
        if (workerCount < 1) throw new IllegalArgumentException("workerCount < 1");
        if (!(elevatedRatio < criticalRatio)) {
            throw new IllegalArgumentException("elevatedRatio deve ser menor que criticalRatio");
        }
    }

    public static PipelineSettings fromConfig() {
        return configBuilder().build();
    }

    /** Builder já preenchido a partir de {@link Config}, para ajustes pontuais (CLI). */
    public static Builder configBuilder() {
        return builder(Config.getDbFilePath())
                .roots(Config.getLibraryRoots())
                .archiveExtensions(Config.getArchiveExtensions())
                .quietPeriod(Duration.ofMillis(Config.getQuietPeriodMillis()))
                .workerCount(Config.getScanWorkers())
                .archiveTimeout(Duration.ofMillis(Config.getArchiveTimeoutMillis()))
                .maxDescriptorBytes(Config.getMaxDescriptorBytes())
                .memorySampleInterval(Duration.ofMillis(Config.getMemorySampleMillis()))
                .memoryLimitBytes(Config.getMemoryLimitBytes())
                .memoryThresholds(Config.getMemoryElevatedRatio(), Config.getMemoryCriticalRatio())
                .criticalDeferDelay(Duration.ofMillis(Config.getCriticalDeferMillis()))
                .retryDelay(Duration.ofMillis(Config.getRetryDelayMillis()))
                .descriptorCacheSize(Config.getDescriptorCacheSize());
    }

    public static Builder builder(Path dbFile) {
        return new Builder(dbFile);
    }

    public static final class Builder {
        private final Path dbFile;
        private List<Path> roots = List.of();
        private Set<String> archiveExtensions = Set.of("cbz", "zip");
        private Duration quietPeriod = Duration.ofSeconds(3);
        private int workerCount = 2;
        private Duration archiveTimeout = Duration.ofSeconds(30);
        private long maxDescriptorBytes = 1024L * 1024L;
        private Duration memorySampleInterval = Duration.ofSeconds(1);
        private long memoryLimitBytes = 0L;
        private double elevatedRatio = 0.75;
        private double criticalRatio = 0.90;
        private double hysteresisMargin = 0.05;
        private Duration criticalDeferDelay = Duration.ofSeconds(2);
        private Duration retryDelay = Duration.ofSeconds(30);
        private int maxConsecutiveFailures = 3;
        private int descriptorCacheSize = 2048;
        private Duration watchRetryInitial = Duration.ofSeconds(1);
        private Duration watchRetryMax = Duration.ofSeconds(60);
        private boolean watchEnabled = true;
        private boolean reconcileOnStart = true;

        private Builder(Path dbFile) {
            this.dbFile = dbFile;
        }

        public Builder roots(List<Path> roots) { this.roots = List.copyOf(roots); return this; }
        public Builder archiveExtensions(Set<String> extensions) { this.archiveExtensions = extensions; return this; }
        public Builder quietPeriod(Duration d) { this.quietPeriod = d; return this; }
        public Builder workerCount(int n) { this.workerCount = n; return this; }
        public Builder archiveTimeout(Duration d) { this.archiveTimeout = d; return this; }
        public Builder maxDescriptorBytes(long n) { this.maxDescriptorBytes = n; return this; }
        public Builder memorySampleInterval(Duration d) { this.memorySampleInterval = d; return this; }
        public Builder memoryLimitBytes(long n) { this.memoryLimitBytes = n; return this; }
        public Builder memoryThresholds(double elevated, double critical) {
            this.elevatedRatio = elevated;
            this.criticalRatio = critical;
            return this;
        }
        public Builder hysteresisMargin(double m) { this.hysteresisMargin = m; return this; }
        public Builder criticalDeferDelay(Duration d) { this.criticalDeferDelay = d; return this; }
        public Builder retryDelay(Duration d) { this.retryDelay = d; return this; }
        public Builder maxConsecutiveFailures(int n) { this.maxConsecutiveFailures = n; return this; }
        public Builder descriptorCacheSize(int n) { this.descriptorCacheSize = n; return this; }
        public Builder watchRetry(Duration initial, Duration max) {
            this.watchRetryInitial = initial;
            this.watchRetryMax = max;
            return this;
        }
        public Builder watchEnabled(boolean b) { this.watchEnabled = b; return this; }
        public Builder reconcileOnStart(boolean b) { this.reconcileOnStart = b; return this; }

        public PipelineSettings build() {
            return new PipelineSettings(dbFile, roots, archiveExtensions, quietPeriod, workerCount, archiveTimeout,
                    maxDescriptorBytes, memorySampleInterval, memoryLimitBytes, elevatedRatio, criticalRatio,
                    hysteresisMargin, criticalDeferDelay, retryDelay, maxConsecutiveFailures, descriptorCacheSize,
                    watchRetryInitial, watchRetryMax, watchEnabled, reconcileOnStart);
        }
    }
}
