package com.gibi.app.service;

/**
 * Fonte de leitura de memória. Pode lançar {@link MemorySampleException} (ou qualquer
 * RuntimeException); o monitor trata as duas como "sem leitura".
 */
@FunctionalInterface
public interface MemoryProbe {

    record Usage(long usedBytes, long limitBytes) {
        public double ratio() {
            return limitBytes <= 0 ? 0.0 : (double) usedBytes / (double) limitBytes;
        }
    }

    Usage sample();
}
