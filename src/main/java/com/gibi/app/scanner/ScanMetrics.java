package com.gibi.app.scanner;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/** Contadores por resultado, compartilhados entre os workers. */
public final class ScanMetrics {

    private final Map<ScanOutcome, LongAdder> byOutcome = new EnumMap<>(ScanOutcome.class);
    public final LongAdder descriptorReads = new LongAdder();
    public final LongAdder cacheHits = new LongAdder();

    public ScanMetrics() {
        for (ScanOutcome o : ScanOutcome.values()) byOutcome.put(o, new LongAdder());
    }

    void record(ScanOutcome outcome) {
        byOutcome.get(outcome).increment();
    }

    public long count(ScanOutcome outcome) {
        return byOutcome.get(outcome).sum();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        byOutcome.forEach((k, v) -> {
            long n = v.sum();
            if (n > 0) sb.append(sb.length() == 0 ? "" : ", ").append(k.name().toLowerCase(Locale.ROOT)).append('=').append(n);
        });
        sb.append(sb.length() == 0 ? "" : ", ").append("reads=").append(descriptorReads.sum());
        return sb.toString();
    }
}
