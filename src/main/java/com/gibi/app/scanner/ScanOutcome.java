package com.gibi.app.scanner;

/** O que um job acabou fazendo. Só para log, métricas e testes. */
public enum ScanOutcome {
    /** Registro removido (arquivo não existe mais). */
    DELETED,
    /** Registro migrado para o novo path. */
    MOVED,
    /** Descritor lido e gravado. */
    CLEAN,
    /** Fingerprint igual ao gravado; metadados mantidos sem abrir o archive. */
    UNCHANGED,
    FAILED,
    /** Memória crítica: job devolvido à fila com atraso. */
    DEFERRED,
    /** Falhas seguidas demais; só volta com evento novo ou pedido manual. */
    SUPPRESSED,
    /** Nada a fazer (linha sumiu no meio, ou evento velho). */
    SKIPPED
}
