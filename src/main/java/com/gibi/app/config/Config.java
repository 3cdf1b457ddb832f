package com.gibi.app.config;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Configuração central do indexador.
 * Ordem de resolução: system property (gibi.*) -> variável de ambiente (GIBI_*) -> arquivo .env -> padrão.
 */
public final class Config {

    private static final String APP_NAME = "Gibi";
    private static final String DEFAULT_DB_NAME = "index.sqlite";

    static final String ENV_DATA_DIR = "GIBI_DATA_DIR";
    static final String ENV_DB_NAME = "GIBI_DB_NAME";
    static final String ENV_LIBRARY_ROOTS = "GIBI_LIBRARY_ROOTS";
    static final String ENV_ARCHIVE_EXTENSIONS = "GIBI_ARCHIVE_EXTENSIONS";
    static final String ENV_QUIET_PERIOD_MS = "GIBI_QUIET_PERIOD_MS";
    static final String ENV_SCAN_WORKERS = "GIBI_SCAN_WORKERS";
    static final String ENV_ARCHIVE_TIMEOUT_MS = "GIBI_ARCHIVE_TIMEOUT_MS";
    static final String ENV_MAX_DESCRIPTOR_BYTES = "GIBI_MAX_DESCRIPTOR_BYTES";
    static final String ENV_MEMORY_SAMPLE_MS = "GIBI_MEMORY_SAMPLE_MS";
    static final String ENV_MEMORY_LIMIT_MB = "GIBI_MEMORY_LIMIT_MB";
    static final String ENV_MEMORY_ELEVATED = "GIBI_MEMORY_ELEVATED";
    static final String ENV_MEMORY_CRITICAL = "GIBI_MEMORY_CRITICAL";
    static final String ENV_CRITICAL_DEFER_MS = "GIBI_CRITICAL_DEFER_MS";
    static final String ENV_RETRY_DELAY_MS = "GIBI_RETRY_DELAY_MS";
    static final String ENV_DESCRIPTOR_CACHE = "GIBI_DESCRIPTOR_CACHE";

    // System property overrides (testes/CI)
    private static final Map<String, String> PROPERTY_KEYS = Map.ofEntries(
            Map.entry(ENV_DATA_DIR, "gibi.dataDir"),
            Map.entry(ENV_DB_NAME, "gibi.dbName"),
            Map.entry(ENV_LIBRARY_ROOTS, "gibi.libraryRoots"),
            Map.entry(ENV_ARCHIVE_EXTENSIONS, "gibi.archiveExtensions"),
            Map.entry(ENV_QUIET_PERIOD_MS, "gibi.quietPeriodMs"),
            Map.entry(ENV_SCAN_WORKERS, "gibi.scanWorkers"),
            Map.entry(ENV_ARCHIVE_TIMEOUT_MS, "gibi.archiveTimeoutMs"),
            Map.entry(ENV_MAX_DESCRIPTOR_BYTES, "gibi.maxDescriptorBytes"),
            Map.entry(ENV_MEMORY_SAMPLE_MS, "gibi.memorySampleMs"),
            Map.entry(ENV_MEMORY_LIMIT_MB, "gibi.memoryLimitMb"),
            Map.entry(ENV_MEMORY_ELEVATED, "gibi.memoryElevated"),
            Map.entry(ENV_MEMORY_CRITICAL, "gibi.memoryCritical"),
            Map.entry(ENV_CRITICAL_DEFER_MS, "gibi.criticalDeferMs"),
            Map.entry(ENV_RETRY_DELAY_MS, "gibi.retryDelayMs"),
            Map.entry(ENV_DESCRIPTOR_CACHE, "gibi.descriptorCache")
    );

    // Logger precisa existir antes de qualquer inicializador estático que o use
    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private static volatile String cachedDbPathKey;
    private static volatile Path cachedDbPath;

    private Config() {}

    public static String getDbUrl() {
        return "jdbc:sqlite:" + getDbFilePath().toAbsolutePath();
    }

    public static Path getDbFilePath() {
        String dbFileName = resolveDbFileName();
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);

        String key = (overrideDir == null ? "" : overrideDir) + "|" + dbFileName;
        Path current = cachedDbPath;
        if (current != null && key.equals(cachedDbPathKey)) {
            return current;
        }

        synchronized (Config.class) {
            current = cachedDbPath;
            if (current != null && key.equals(cachedDbPathKey)) {
                return current;
            }
            Path resolved = resolveDbPath(dbFileName, overrideDir);
            cachedDbPathKey = key;
            cachedDbPath = resolved;
            return resolved;
        }
    }

    /**
     * Raízes da biblioteca. Lista separada pelo separador de path do SO (":" ou ";").
     * Sem configuração, usa /data quando existir.
     */
    public static List<Path> getLibraryRoots() {
        String raw = getEnvOrDotenv(ENV_LIBRARY_ROOTS);
        List<Path> roots = new ArrayList<>();
        if (raw != null) {
            for (String part : StringUtils.split(raw, File.pathSeparator)) {
                if (StringUtils.isNotBlank(part)) {
                    roots.add(Paths.get(part.trim()).toAbsolutePath().normalize());
                }
            }
        }
        if (roots.isEmpty()) {
            Path fallback = Paths.get("/data");
            if (Files.isDirectory(fallback)) roots.add(fallback);
        }
        return List.copyOf(roots);
    }

    public static Set<String> getArchiveExtensions() {
        String raw = getEnvOrDotenv(ENV_ARCHIVE_EXTENSIONS);
        if (raw == null) return Set.of("cbz", "zip");
        Set<String> out = new LinkedHashSet<>();
        for (String part : StringUtils.split(raw, ",; ")) {
            String ext = StringUtils.removeStart(part.trim().toLowerCase(Locale.ROOT), ".");
            if (!ext.isEmpty()) out.add(ext);
        }
        return out.isEmpty() ? Set.of("cbz", "zip") : Set.copyOf(out);
    }

    public static long getQuietPeriodMillis() {
        return getLong(ENV_QUIET_PERIOD_MS, 3_000L, 10L);
    }

    public static int getScanWorkers() {
        return (int) getLong(ENV_SCAN_WORKERS, 2L, 1L);
    }

    public static long getArchiveTimeoutMillis() {
        return getLong(ENV_ARCHIVE_TIMEOUT_MS, 30_000L, 100L);
    }

    public static long getMaxDescriptorBytes() {
        return getLong(ENV_MAX_DESCRIPTOR_BYTES, 1024L * 1024L, 1024L);
    }

    public static long getMemorySampleMillis() {
        return getLong(ENV_MEMORY_SAMPLE_MS, 1_000L, 50L);
    }

    /** 0 = usa a memória física total como limite. */
    public static long getMemoryLimitBytes() {
        return getLong(ENV_MEMORY_LIMIT_MB, 0L, 0L) * 1024L * 1024L;
    }

    public static double getMemoryElevatedRatio() {
        return getRatio(ENV_MEMORY_ELEVATED, 0.75);
    }

    public static double getMemoryCriticalRatio() {
        return getRatio(ENV_MEMORY_CRITICAL, 0.90);
    }

    public static long getCriticalDeferMillis() {
        return getLong(ENV_CRITICAL_DEFER_MS, 2_000L, 10L);
    }

    public static long getRetryDelayMillis() {
        return getLong(ENV_RETRY_DELAY_MS, 30_000L, 10L);
    }

    public static int getDescriptorCacheSize() {
        return (int) getLong(ENV_DESCRIPTOR_CACHE, 2048L, 0L);
    }

    // --- Lógica de Resolução ---

    private static String resolveDbFileName() {
        String name = getEnvOrDotenv(ENV_DB_NAME);
        return name == null ? DEFAULT_DB_NAME : name;
    }

    private static long getLong(String key, long fallback, long min) {
        String v = getEnvOrDotenv(key);
        if (v == null) return fallback;
        try {
            return Math.max(min, Long.parseLong(v));
        } catch (NumberFormatException e) {
            logger.warn("Valor inválido para {}: '{}'. Usando padrão {}", key, v, fallback);
            return fallback;
        }
    }

    private static double getRatio(String key, double fallback) {
        String v = getEnvOrDotenv(key);
        if (v == null) return fallback;
        try {
            double d = Double.parseDouble(v);
            if (d <= 0.0 || d >= 1.0) throw new NumberFormatException("fora de (0,1)");
            return d;
        } catch (NumberFormatException e) {
            logger.warn("Valor inválido para {}: '{}'. Usando padrão {}", key, v, fallback);
            return fallback;
        }
    }

    /**
     * Tenta system property, depois variável de ambiente, depois o .env local (dotenv-java).
     */
    static String getEnvOrDotenv(String key) {
        String propKey = PROPERTY_KEYS.get(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (StringUtils.isNotBlank(propVal)) {
                return propVal.trim();
            }
        }

        String envVal = System.getenv(key);
        if (StringUtils.isNotBlank(envVal)) {
            return envVal.trim();
        }

        String fileVal = dotenv.get(key);
        if (StringUtils.isBlank(fileVal)) {
            return null;
        }
        return fileVal.trim();
    }

    private static Path resolveDbPath(String dbFileName, String overrideDir) {
        if (overrideDir != null) {
            Path p = Paths.get(overrideDir);
            try {
                Files.createDirectories(p);
            } catch (IOException e) {
                throw new IllegalStateException("Não foi possível criar diretório de dados: " + p, e);
            }
            logger.info("Índice localizado em (override): {}", p.toAbsolutePath());
            return p.resolve(dbFileName);
        }

        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");
        Path appDataDir;

        if (os.contains("win")) {
            String appDataEnv = System.getenv("APPDATA");
            if (StringUtils.isNotBlank(appDataEnv)) {
                appDataDir = Paths.get(appDataEnv, APP_NAME);
            } else {
                appDataDir = Paths.get(userHome, "AppData", "Roaming", APP_NAME);
            }
        } else if (os.contains("mac")) {
            appDataDir = Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            // Linux/Unix: padrão XDG (~/.local/share/Gibi)
            String xdgData = System.getenv("XDG_DATA_HOME");
            if (StringUtils.isNotBlank(xdgData)) {
                appDataDir = Paths.get(xdgData, APP_NAME);
            } else {
                appDataDir = Paths.get(userHome, ".local", "share", APP_NAME);
            }
        }

        try {
            Files.createDirectories(appDataDir);
            logger.info("Índice localizado em: {}", appDataDir.toAbsolutePath());
            return appDataDir.resolve(dbFileName);
        } catch (IOException e) {
            Path localPath = Paths.get(dbFileName).toAbsolutePath();
            logger.warn("Sem permissão para usar {}. Usando diretório local como fallback: {}", appDataDir, localPath);
            return localPath;
        }
    }
}
