package com.gibi.app.service;

import oshi.SystemInfo;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

/**
 * RSS do processo atual (via OSHI) contra o limite configurado ou a memória física total.
 */
public final class OshiMemoryProbe implements MemoryProbe {

    private final OperatingSystem os;
    private final long limitBytes;

    /** @param configuredLimitBytes limite explícito; {@code <= 0} usa a memória física */
    public OshiMemoryProbe(long configuredLimitBytes) {
        SystemInfo systemInfo = new SystemInfo();
        this.os = systemInfo.getOperatingSystem();
        this.limitBytes = configuredLimitBytes > 0
                ? configuredLimitBytes
                : systemInfo.getHardware().getMemory().getTotal();
    }

    @Override
    public Usage sample() {
        OSProcess self = os.getCurrentProcess();
        if (self == null) throw new MemorySampleException("OSHI não encontrou o processo atual");
        long rss = self.getResidentSetSize();
        if (rss <= 0) throw new MemorySampleException("RSS indisponível: " + rss);
        if (limitBytes <= 0) throw new MemorySampleException("Memória total indisponível");
        return new Usage(rss, limitBytes);
    }
}
