package com.gibi.app.model;

/**
 * Faixas de prioridade da fila de scan. Delete/move ficam acima do pedido manual
 * para que o índice nunca aponte para um arquivo que não existe mais.
 */
public enum ScanPriority {
    BACKGROUND(0),
    CHANGE(1),
    MANUAL(2),
    STRUCTURAL(3);

    private final int rank;

    ScanPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean outranks(ScanPriority other) {
        return rank > other.rank;
    }

    public boolean atLeast(ScanPriority other) {
        return rank >= other.rank;
    }
}
