package db.migration;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V2__scan_failures extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();

        // Colunas novas sempre com DEFAULT: linhas antigas continuam legíveis.
        addColumnIfMissing(conn, "file_records", "consecutive_failures", "INTEGER NOT NULL DEFAULT 0");
        addColumnIfMissing(conn, "file_records", "updated_at", "INTEGER");

        try (Statement st = conn.createStatement()) {
            st.execute("CREATE INDEX IF NOT EXISTS idx_file_records_state ON file_records(scan_state)");
            st.execute("UPDATE file_records SET scan_state = 'UNSCANNED' WHERE scan_state IS NULL OR scan_state = ''");
        }

        V1__file_index.recordSchemaVersion(conn, 2);
    }

    private void addColumnIfMissing(Connection conn, String table, String column, String type) throws Exception {
        if (!tableExists(conn, table) || columnExists(conn, table, column)) return;
        try (var st = conn.createStatement()) {
            st.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + type);
        }
    }

    private boolean tableExists(Connection conn, String table) throws Exception {
        String sql = "SELECT name FROM sqlite_master WHERE type='table' AND name = ?";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private boolean columnExists(Connection conn, String table, String column) throws Exception {
        try (var st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                if (column.equalsIgnoreCase(rs.getString("name"))) return true;
            }
        }
        return false;
    }
}
