package com.gibi.app.database;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import com.gibi.app.model.FileRecord;
import com.gibi.app.model.FileStats;
import com.gibi.app.model.ScanState;

public interface FileRecordDao {

    // --- Leitura -------------------------------------------------------------

    @SqlQuery("SELECT * FROM file_records WHERE path = :path")
    @RegisterRowMapper(FileRecordMapper.class)
    Optional<FileRecord> find(@Bind("path") String path);

    @SqlQuery("SELECT consecutive_failures FROM file_records WHERE path = :path")
    Optional<Integer> fetchFailures(@Bind("path") String path);

    @SqlQuery("SELECT COUNT(*) FROM file_records")
    long countAll();

    @SqlQuery("SELECT value FROM schema_info WHERE key = 'schema_version'")
    String fetchSchemaVersion();

    // --- Escrita -------------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO file_records (path, size_bytes, modified_millis, fingerprint, metadata_json, scan_state,
                                  last_scanned_at, last_error, consecutive_failures, updated_at)
        VALUES (:path, :sizeBytes, :modifiedMillis, :fingerprint, :metadataJson, :scanState,
                :lastScannedAt, :lastError, :failures, :now)
        ON CONFLICT(path) DO UPDATE SET
            size_bytes = excluded.size_bytes,
            modified_millis = excluded.modified_millis,
            fingerprint = excluded.fingerprint,
            metadata_json = excluded.metadata_json,
            scan_state = excluded.scan_state,
            last_scanned_at = excluded.last_scanned_at,
            last_error = excluded.last_error,
            consecutive_failures = excluded.consecutive_failures,
            updated_at = excluded.updated_at
        """)
    int upsertRaw(@Bind("path") String path,
                  @Bind("sizeBytes") long sizeBytes,
                  @Bind("modifiedMillis") long modifiedMillis,
                  @Bind("fingerprint") String fingerprint,
                  @Bind("metadataJson") String metadataJson,
                  @Bind("scanState") String scanState,
                  @Bind("lastScannedAt") Long lastScannedAt,
                  @Bind("lastError") String lastError,
                  @Bind("failures") int failures,
                  @Bind("now") long now);

    default void upsert(FileRecord r) {
        upsertRaw(r.path(), r.sizeBytes(), r.modifiedMillis(), r.fingerprint(),
                MetadataJson.encode(r.metadata()), r.scanState().name(),
                r.lastScannedAt() == null ? null : r.lastScannedAt().toEpochMilli(),
                r.lastError(), r.consecutiveFailures(), System.currentTimeMillis());
    }

    @SqlUpdate("DELETE FROM file_records WHERE path = :path")
    int delete(@Bind("path") String path);

    @SqlUpdate("UPDATE file_records SET scan_state = :state, updated_at = :now WHERE path = :path")
    int updateState(@Bind("path") String path, @Bind("state") String state, @Bind("now") long now);

    @SqlUpdate("UPDATE file_records SET consecutive_failures = 0 WHERE path = :path")
    int resetFailures(@Bind("path") String path);

    @SqlUpdate("""
        UPDATE file_records
           SET size_bytes = :sizeBytes,
               modified_millis = :modifiedMillis,
               fingerprint = :fingerprint,
               updated_at = :now
         WHERE path = :path
        """)
    int updateStatsRaw(@Bind("path") String path,
                       @Bind("sizeBytes") long sizeBytes,
                       @Bind("modifiedMillis") long modifiedMillis,
                       @Bind("fingerprint") String fingerprint,
                       @Bind("now") long now);

    default int updateStats(String path, FileStats stats) {
        return updateStatsRaw(path, stats.sizeBytes(), stats.modifiedMillis(), stats.fingerprint(),
                System.currentTimeMillis());
    }

    @SqlUpdate("""
        UPDATE file_records
           SET scan_state = 'CLEAN',
               size_bytes = :sizeBytes,
               modified_millis = :modifiedMillis,
               fingerprint = :fingerprint,
               metadata_json = :metadataJson,
               last_scanned_at = :now,
               last_error = NULL,
               consecutive_failures = 0,
               updated_at = :now
         WHERE path = :path
        """)
    int markCleanRaw(@Bind("path") String path,
                     @Bind("sizeBytes") long sizeBytes,
                     @Bind("modifiedMillis") long modifiedMillis,
                     @Bind("fingerprint") String fingerprint,
                     @Bind("metadataJson") String metadataJson,
                     @Bind("now") long now);

    @SqlUpdate("""
        UPDATE file_records
           SET scan_state = 'FAILED',
               size_bytes = :sizeBytes,
               modified_millis = :modifiedMillis,
               fingerprint = :fingerprint,
               last_scanned_at = :now,
               last_error = :error,
               consecutive_failures = consecutive_failures + 1,
               updated_at = :now
         WHERE path = :path
        """)
    int markFailedRaw(@Bind("path") String path,
                      @Bind("sizeBytes") long sizeBytes,
                      @Bind("modifiedMillis") long modifiedMillis,
                      @Bind("fingerprint") String fingerprint,
                      @Bind("error") String error,
                      @Bind("now") long now);

    @SqlUpdate("UPDATE file_records SET path = :to, updated_at = :now WHERE path = :from")
    int renamePath(@Bind("from") String from, @Bind("to") String to, @Bind("now") long now);

    // --- Mapper --------------------------------------------------------------

    /**
     * Tolerante a bancos antigos: colunas ausentes viram valores vazios/zero.
     */
    final class FileRecordMapper implements RowMapper<FileRecord> {
        @Override
        public FileRecord map(ResultSet rs, StatementContext ctx) throws SQLException {
            ResultSetMetaData md = rs.getMetaData();

            String path = rs.getString("path");
            long size = longOr(rs, md, "size_bytes", 0L);
            long mtime = longOr(rs, md, "modified_millis", 0L);
            String fingerprint = stringOr(rs, md, "fingerprint");
            String metadataJson = stringOr(rs, md, "metadata_json");
            ScanState state = ScanState.parse(stringOr(rs, md, "scan_state"));

            Instant lastScannedAt = null;
            if (hasColumn(md, "last_scanned_at")) {
                long v = rs.getLong("last_scanned_at");
                if (!rs.wasNull()) lastScannedAt = Instant.ofEpochMilli(v);
            }
            String lastError = stringOr(rs, md, "last_error");
            int failures = (int) longOr(rs, md, "consecutive_failures", 0L);

            return new FileRecord(path, size, mtime, fingerprint, MetadataJson.decode(metadataJson), state,
                    lastScannedAt, lastError, failures);
        }

        private static boolean hasColumn(ResultSetMetaData md, String column) throws SQLException {
            for (int i = 1; i <= md.getColumnCount(); i++) {
                if (column.equalsIgnoreCase(md.getColumnLabel(i))) return true;
            }
            return false;
        }

        private static long longOr(ResultSet rs, ResultSetMetaData md, String column, long fallback) throws SQLException {
            if (!hasColumn(md, column)) return fallback;
            long v = rs.getLong(column);
            return rs.wasNull() ? fallback : v;
        }

        private static String stringOr(ResultSet rs, ResultSetMetaData md, String column) throws SQLException {
            if (!hasColumn(md, column)) return null;
            return rs.getString(column);
        }
    }
}
