package com.gibi.app.database;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.jdbi.v3.core.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gibi.app.model.ComicMetadata;
import com.gibi.app.model.FileRecord;
import com.gibi.app.model.FileStats;
import com.gibi.app.model.MetadataValue;
import com.gibi.app.model.ScanState;
import com.gibi.app.model.ScanStatus;

/**
 * Fachada do índice persistente.
 * <p>
 * Leituras vão direto pelo pool (WAL, nunca bloqueiam no escritor).
 * Escritas viram intenções no {@link IndexWriter} e devolvem um future.
 */
public final class IndexStore {

    private static final Logger logger = LoggerFactory.getLogger(IndexStore.class);

    // Linhas antigas com JSON quebrado não podem derrubar a consulta inteira
    private static final String VALID_JSON = "CASE WHEN json_valid(metadata_json) THEN metadata_json END";

    private final IndexDatabase db;
    private final IndexWriter writer;

    public IndexStore(IndexDatabase db, IndexWriter writer) {
        this.db = db;
        this.writer = writer;
    }

    /** Chave de um arquivo no índice: caminho absoluto normalizado. */
    public static String key(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    // --- Leitura -------------------------------------------------------------

    public Optional<FileRecord> get(Path path) {
        String k = key(path);
        return db.jdbi().withExtension(FileRecordDao.class, dao -> dao.find(k));
    }

    public Optional<ScanStatus> status(Path path) {
        return get(path).map(ScanStatus::of);
    }

    public long count() {
        return db.jdbi().withExtension(FileRecordDao.class, FileRecordDao::countAll);
    }

    public int schemaVersion() {
        return db.schemaVersion();
    }

    /**
     * Stream preguiçoso sobre o índice, ordenado por path. Segura uma conexão até ser fechado:
     * use sempre em try-with-resources.
     */
    public Stream<FileRecord> query(RecordFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM file_records WHERE 1 = 1");
        Map<String, Object> params = new LinkedHashMap<>();

        if (filter.pathPrefix() != null) {
            sql.append(" AND path LIKE :prefix ESCAPE '!'");
            params.put("prefix", escapeLike(filter.pathPrefix()) + "%");
        }
        if (filter.state() != null) {
            sql.append(" AND scan_state = :state");
            params.put("state", filter.state().name());
        }
        int i = 0;
        for (RecordFilter.FieldMatch m : filter.fields()) {
            String p = "p" + i;
            String v = "v" + i;
            if (m.listContains()) {
                sql.append(" AND EXISTS (SELECT 1 FROM json_each(").append(VALID_JSON).append(", :").append(p)
                        .append(") WHERE value = :").append(v).append(")");
            } else {
                sql.append(" AND json_extract(").append(VALID_JSON).append(", :").append(p).append(") = :").append(v);
            }
            params.put(p, "$." + m.field());
            MetadataValue value = m.value();
            params.put(v, value.kind() == MetadataValue.Kind.NUMBER ? value.number() : value.asText());
            i++;
        }
        sql.append(" ORDER BY path");
        if (filter.limit() > 0) {
            sql.append(" LIMIT ").append(filter.limit());
        }

        Handle handle = db.jdbi().open();
        try {
            return handle.createQuery(sql.toString())
                    .bindMap(params)
                    .map(new FileRecordDao.FileRecordMapper())
                    .stream()
                    .onClose(handle::close);
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    public List<FileRecord> list(RecordFilter filter) {
        try (Stream<FileRecord> s = query(filter)) {
            return s.collect(Collectors.toCollection(ArrayList::new));
        }
    }

    /** Todos os paths rastreados; mesmo contrato de fechamento de {@link #query}. */
    public Stream<Path> trackedPaths() {
        return query(RecordFilter.all()).map(r -> Path.of(r.path()));
    }

    static String escapeLike(String raw) {
        return raw.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    // --- Escrita -------------------------------------------------------------

    public CompletableFuture<Void> upsert(FileRecord record) {
        return writer.submit("upsert", dao -> {
            dao.upsert(record);
            return null;
        });
    }

    public CompletableFuture<Boolean> delete(Path path) {
        String k = key(path);
        return writer.submit("delete", dao -> dao.delete(k) > 0);
    }

    /**
     * Migra a linha de {@code from} para {@code to} numa transação só, preservando metadados
     * e fingerprint. Linha antiga em {@code to} é substituída.
     */
    public CompletableFuture<Optional<FileRecord>> rename(Path from, Path to) {
        String src = key(from);
        String dst = key(to);
        return writer.submit("rename", dao -> {
            Optional<FileRecord> old = dao.find(src);
            if (old.isEmpty()) return Optional.<FileRecord>empty();
            if (src.equals(dst)) return old;
            dao.delete(dst);
            dao.renamePath(src, dst, System.currentTimeMillis());
            return Optional.of(old.get().withPath(dst));
        });
    }

    /**
     * Marca o arquivo como na fila. Sem linha e com stats, cria o registro; em SCANNING não mexe
     * (o worker em curso decide o estado final).
     */
    public CompletableFuture<Boolean> markQueued(Path path, FileStats statsIfNew, boolean resetFailures) {
        String k = key(path);
        return writer.submit("markQueued", dao -> {
            long now = System.currentTimeMillis();
            Optional<FileRecord> current = dao.find(k);
            if (current.isEmpty()) {
                if (statsIfNew == null) return false;
                dao.upsert(FileRecord.unscanned(k, statsIfNew));
                dao.updateState(k, ScanState.QUEUED.name(), now);
                return true;
            }
            ScanState state = current.get().scanState();
            if (state == ScanState.SCANNING) return false;
            state.requireTransition(ScanState.QUEUED);
            dao.updateState(k, ScanState.QUEUED.name(), now);
            if (resetFailures) dao.resetFailures(k);
            return true;
        });
    }

    /**
     * Entra em SCANNING e devolve o registro como estava antes (vazio se o arquivo é novo).
     * Estados assentados passam por QUEUED no caminho.
     */
    public CompletableFuture<Optional<FileRecord>> markScanning(Path path, FileStats stats, boolean resetFailures) {
        String k = key(path);
        return writer.submit("markScanning", dao -> {
            long now = System.currentTimeMillis();
            Optional<FileRecord> before = dao.find(k);
            if (before.isEmpty()) {
                dao.upsert(FileRecord.unscanned(k, stats));
            } else {
                ScanState state = before.get().scanState();
                if (state != ScanState.SCANNING) {
                    if (state != ScanState.QUEUED) state.requireTransition(ScanState.QUEUED);
                    ScanState.QUEUED.requireTransition(ScanState.SCANNING);
                } else {
                    logger.debug("{} já estava em SCANNING (scan anterior interrompido)", k);
                }
                if (resetFailures) dao.resetFailures(k);
            }
            dao.updateState(k, ScanState.SCANNING.name(), now);
            return before;
        });
    }

    /** SCANNING -> CLEAN. Falso se a linha sumiu no meio do scan (delete concorrente). */
    public CompletableFuture<Boolean> commitClean(Path path, FileStats stats, ComicMetadata metadata) {
        String k = key(path);
        String json = MetadataJson.encode(metadata);
        return writer.submit("commitClean", dao -> {
            Optional<FileRecord> current = dao.find(k);
            if (current.isEmpty()) return false;
            checkSettling(current.get(), ScanState.CLEAN);
            return dao.markCleanRaw(k, stats.sizeBytes(), stats.modifiedMillis(), stats.fingerprint(),
                    json, System.currentTimeMillis()) > 0;
        });
    }

    /**
     * SCANNING -> FAILED, incrementando a contagem de falhas seguidas.
     * Devolve a nova contagem, ou -1 se a linha não existe mais.
     */
    public CompletableFuture<Integer> commitFailed(Path path, FileStats stats, String error) {
        String k = key(path);
        return writer.submit("commitFailed", dao -> {
            Optional<FileRecord> current = dao.find(k);
            if (current.isEmpty()) return -1;
            checkSettling(current.get(), ScanState.FAILED);
            FileStats s = stats != null ? stats : current.get().stats();
            dao.markFailedRaw(k, s.sizeBytes(), s.modifiedMillis(), s.fingerprint(), error,
                    System.currentTimeMillis());
            return dao.fetchFailures(k).orElse(-1);
        });
    }

    private static void checkSettling(FileRecord current, ScanState target) {
        if (current.scanState() != ScanState.SCANNING) {
            // Ex.: um markQueued de evento novo não pisa em SCANNING, então isto indica escrita fora de ordem
            logger.warn("{} em {} ao gravar {}", current.path(), current.scanState(), target);
        }
    }
}
