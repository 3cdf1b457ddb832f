package com.gibi.app.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Gerencia o arquivo SQLite do índice: pool, Jdbi e migrações.
 * <p>
 * WAL + synchronous=FULL: leitores nunca esperam o escritor e todo commit confirmado
 * sobrevive a um crash logo em seguida.
 */
public final class IndexDatabase implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IndexDatabase.class);

    private static final int POOL_SIZE = 8;

    private final Path dbFile;
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;
    private volatile boolean closed = false;

    private IndexDatabase(Path dbFile, HikariDataSource dataSource) {
        this.dbFile = dbFile;
        this.dataSource = dataSource;
        this.jdbi = Jdbi.create(dataSource);
        this.jdbi.installPlugin(new SqlObjectPlugin());
    }

    public static IndexDatabase open(Path dbFile) {
        Path file = dbFile.toAbsolutePath().normalize();
        try {
            Path parent = file.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Não foi possível criar diretório do índice: " + file.getParent(), e);
        }

        HikariDataSource ds = createDataSource(file);
        try {
            migrate(ds);
        } catch (RuntimeException e) {
            ds.close();
            throw e;
        }
        logger.info("Índice aberto em {}", file);
        return new IndexDatabase(file, ds);
    }

    private static HikariDataSource createDataSource(Path file) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + file);
        config.setPoolName("gibi-index");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(POOL_SIZE);
        // Pragmas por conexão via propriedades do driver sqlite-jdbc
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "FULL");
        config.addDataSourceProperty("busy_timeout", "10000");
        return new HikariDataSource(config);
    }

    private static void migrate(HikariDataSource ds) {
        Flyway flyway = Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                logger.warn("Flyway validation failed; attempting repair.", e);
                flyway.repair();
                flyway.migrate();
            }
        } catch (RuntimeException e) {
            logger.error("Flyway migration failed", e);
            throw new IllegalStateException("Flyway migration failed", e);
        }
    }

    public Jdbi jdbi() {
        if (closed) throw new IllegalStateException("Índice já foi fechado: " + dbFile);
        return jdbi;
    }

    public Path file() {
        return dbFile;
    }

    public int schemaVersion() {
        String v = jdbi().withExtension(FileRecordDao.class, FileRecordDao::fetchSchemaVersion);
        if (v == null) return 0;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            logger.warn("schema_version ilegível: '{}'", v);
            return 0;
        }
    }

    private void checkpoint() {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("PRAGMA wal_checkpoint(TRUNCATE);")) {
            ps.execute();
        } catch (SQLException e) {
            logger.warn("Checkpoint do WAL falhou: {}", e.toString());
        }
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        checkpoint();
        closed = true;
        dataSource.close();
        logger.info("Índice fechado: {}", dbFile);
    }
}
