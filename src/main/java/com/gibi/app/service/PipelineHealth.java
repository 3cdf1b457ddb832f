package com.gibi.app.service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Superfície de health-check do pipeline. Só registra o que é fatal para um subsistema:
 * raiz de biblioteca inobservável e índice degradado. Erros por arquivo não passam por aqui.
 */
public final class PipelineHealth {

    private static final Logger logger = LoggerFactory.getLogger(PipelineHealth.class);

    public enum Status { UP, DEGRADED }

    public record Snapshot(Status status, Map<String, String> lostRoots, boolean storeDegraded,
                           String lastStoreError, Instant storeErrorAt) {
        public boolean healthy() {
            return status == Status.UP;
        }
    }

    private final Map<Path, String> lostRoots = new ConcurrentHashMap<>();
    private volatile String lastStoreError;
    private volatile Instant storeErrorAt;

    public void watchLost(Path root, String reason) {
        if (lostRoots.put(root, reason) == null) {
            logger.error("Raiz {} ficou inobservável: {}", root, reason);
        }
    }

    public void watchRestored(Path root) {
        if (lostRoots.remove(root) != null) {
            logger.info("Raiz {} voltou a ser observada", root);
        }
    }

    public void storeDegraded(String operation, Throwable cause) {
        lastStoreError = operation + ": " + (cause == null ? "?" : cause.getMessage());
        storeErrorAt = Instant.now();
    }

    public void storeRecovered() {
        if (lastStoreError != null) {
            logger.info("Índice voltou a aceitar commits (último erro: {})", lastStoreError);
            lastStoreError = null;
            storeErrorAt = null;
        }
    }

    public boolean isWatchLost(Path root) {
        return lostRoots.containsKey(root);
    }

    public Snapshot snapshot() {
        Map<String, String> roots = new TreeMap<>();
        lostRoots.forEach((k, v) -> roots.put(k.toString(), v));
        String storeError = lastStoreError;
        boolean degraded = storeError != null;
        Status status = (degraded || !roots.isEmpty()) ? Status.DEGRADED : Status.UP;
        return new Snapshot(status, Map.copyOf(roots), degraded, storeError, storeErrorAt);
    }
}
