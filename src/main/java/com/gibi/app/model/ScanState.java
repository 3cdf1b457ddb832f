package com.gibi.app.model;

import java.util.Locale;

/**
 * Estado de indexação de um arquivo.
 * <p>
 * Caminho normal: UNSCANNED -> QUEUED -> SCANNING -> CLEAN | FAILED.
 * CLEAN e FAILED voltam para QUEUED quando chega um novo evento.
 */
public enum ScanState {
    UNSCANNED,
    QUEUED,
    SCANNING,
    CLEAN,
    FAILED;

    public boolean canTransitionTo(ScanState next) {
        if (next == null) return false;
        return switch (this) {
            case UNSCANNED -> next == QUEUED;
            case QUEUED -> next == QUEUED || next == SCANNING;
            case SCANNING -> next == CLEAN || next == FAILED;
            case CLEAN, FAILED -> next == QUEUED;
        };
    }

    public void requireTransition(ScanState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Transição inválida de scanState: " + this + " -> " + next);
        }
    }

    public boolean isSettled() {
        return this == CLEAN || this == FAILED;
    }

    /**
     * Leitura tolerante do valor gravado no banco: nulo ou desconhecido vira UNSCANNED.
     */
    public static ScanState parse(String raw) {
        if (raw == null || raw.isBlank()) return UNSCANNED;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNSCANNED;
        }
    }
}
