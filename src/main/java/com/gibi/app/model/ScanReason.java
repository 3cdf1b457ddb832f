package com.gibi.app.model;

public enum ScanReason {
    CREATE(ScanPriority.CHANGE),
    MODIFY(ScanPriority.CHANGE),
    DELETE(ScanPriority.STRUCTURAL),
    MOVE(ScanPriority.STRUCTURAL),
    MANUAL(ScanPriority.MANUAL),
    SWEEP(ScanPriority.BACKGROUND),
    RETRY(ScanPriority.BACKGROUND);

    private final ScanPriority defaultPriority;

    ScanReason(ScanPriority defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public ScanPriority defaultPriority() {
        return defaultPriority;
    }

    /** Jobs gerados pelo próprio pipeline (varredura ou retry), sem evento novo por trás. */
    public boolean isAutomatic() {
        return this == SWEEP || this == RETRY;
    }

    /** Evento de filesystem ou pedido manual: libera arquivos que estavam suprimidos por falhas seguidas. */
    public boolean resetsFailures() {
        return this == CREATE || this == MODIFY || this == MOVE || this == MANUAL;
    }
}
