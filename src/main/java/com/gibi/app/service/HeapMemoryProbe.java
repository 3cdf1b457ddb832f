package com.gibi.app.service;

/** Heap da JVM (usado/máximo). Útil quando o limite que importa é o -Xmx. */
public final class HeapMemoryProbe implements MemoryProbe {

    @Override
    public Usage sample() {
        Runtime rt = Runtime.getRuntime();
        long used = rt.totalMemory() - rt.freeMemory();
        long max = rt.maxMemory();
        if (max == Long.MAX_VALUE) max = rt.totalMemory();
        return new Usage(used, max);
    }
}
