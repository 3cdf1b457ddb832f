package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V1__file_index extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        ensureSchema(conn);
        recordSchemaVersion(conn, 1);
    }

    private void ensureSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS file_records (
                    path TEXT PRIMARY KEY,
                    size_bytes INTEGER NOT NULL DEFAULT 0,
                    modified_millis INTEGER NOT NULL DEFAULT 0,
                    fingerprint TEXT,
                    metadata_json TEXT,
                    scan_state TEXT NOT NULL DEFAULT 'UNSCANNED',
                    last_scanned_at INTEGER,
                    last_error TEXT
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS schema_info (
                    key TEXT PRIMARY KEY,
                    value TEXT,
                    updated_at TEXT NOT NULL DEFAULT (datetime('now'))
                )
                """);
        }
    }

    static void recordSchemaVersion(Connection conn, int version) throws SQLException {
        String sql = """
            INSERT INTO schema_info(key, value, updated_at)
            VALUES('schema_version', ?, datetime('now'))
            ON CONFLICT(key) DO UPDATE SET
                value = excluded.value,
                updated_at = excluded.updated_at
            """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }
}
