package com.gibi.app.database;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.jdbi.v3.core.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gibi.app.service.PipelineHealth;

/**
 * Escritor único do índice. Toda mutação passa por esta thread, uma transação por intenção,
 * então nunca existem dois commits concorrentes no SQLite.
 */
public final class IndexWriter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IndexWriter.class);

    private final IndexDatabase db;
    private final PipelineHealth health;
    private final ExecutorService executor;

    // Só tocado pela thread do writer
    private Handle handle;
    private volatile boolean closed = false;

    public IndexWriter(IndexDatabase db, PipelineHealth health) {
        this.db = db;
        this.health = health;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "gibi-index-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Enfileira uma intenção de escrita. Roda numa transação; falha uma vez, tenta de novo;
     * falha de novo, completa o future com {@link StoreTransactionException}.
     */
    public <T> CompletableFuture<T> submit(String label, Function<FileRecordDao, T> intent) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (closed) {
            result.completeExceptionally(new StoreTransactionException(label, new IllegalStateException("writer fechado")));
            return result;
        }
        try {
            executor.execute(() -> run(label, intent, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new StoreTransactionException(label, e));
        }
        return result;
    }

    /** Barreira: retorna depois que tudo o que já foi submetido terminou. */
    public void sync() {
        try {
            submit("sync", dao -> Boolean.TRUE).join();
        } catch (RuntimeException e) {
            logger.debug("sync ignorado: {}", e.toString());
        }
    }

    private <T> void run(String label, Function<FileRecordDao, T> intent, CompletableFuture<T> result) {
        RuntimeException first = null;
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                T value = handle().inTransaction(h -> intent.apply(h.attach(FileRecordDao.class)));
                health.storeRecovered();
                result.complete(value);
                return;
            } catch (RuntimeException e) {
                if (first == null) first = e;
                logger.warn("Transação '{}' falhou (tentativa {}): {}", label, attempt, e.toString());
                resetHandle();
            }
        }
        health.storeDegraded(label, first);
        logger.error("Transação '{}' abandonada após retry", label, first);
        result.completeExceptionally(new StoreTransactionException(label, first));
    }

    private Handle handle() {
        if (handle == null) {
            handle = db.jdbi().open();
        }
        return handle;
    }

    private void resetHandle() {
        if (handle == null) return;
        try {
            handle.close();
        } catch (RuntimeException e) {
            logger.debug("Falha ao fechar handle do writer: {}", e.toString());
        }
        handle = null;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            executor.execute(this::resetHandle);
        } catch (RejectedExecutionException e) {
            logger.debug("Writer já encerrado");
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Writer não terminou em 30s; forçando parada");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
