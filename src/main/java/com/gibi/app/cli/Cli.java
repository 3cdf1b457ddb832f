package com.gibi.app.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gibi.app.ScanPipeline;
import com.gibi.app.config.PipelineSettings;
import com.gibi.app.database.RecordFilter;
import com.gibi.app.model.ComicMetadata;
import com.gibi.app.model.FileRecord;
import com.gibi.app.model.ScanState;
import com.gibi.app.model.ScanStatus;
import com.gibi.app.service.PipelineHealth;

public final class Cli {

    private static final Logger logger = LoggerFactory.getLogger(Cli.class);

    private static final Duration BATCH_TIMEOUT = Duration.ofHours(6);

    private Cli() {}

    public static void main(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public static int execute(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 0;
        }

        String cmd = safeLower(args[0]);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (cmd) {
                case "run" -> runWatch(rest);
                case "sweep" -> runSweep(rest);
                case "rescan" -> runRescan(rest);
                case "status" -> runStatus(rest);
                case "list" -> runList(rest);
                case "help", "-h", "--help" -> {
                    printUsage();
                    yield 0;
                }
                default -> {
                    System.err.println("Comando invalido: " + args[0]);
                    printUsage();
                    yield 2;
                }
            };
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrompido.");
            return 130;
        } catch (Exception e) {
            logger.error("Erro fatal", e);
            System.err.println("Erro fatal: " + safeMsg(e));
            return 1;
        }
    }

    // ----------------- run -----------------

    private static int runWatch(String[] args) throws InterruptedException {
        ParseResult<RunArgs> parsed = RunArgs.parse(args);
        if (parsed.help()) {
            printUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            return 2;
        }

        PipelineSettings.Builder b = PipelineSettings.configBuilder();
        if (!parsed.value().roots().isEmpty()) b.roots(parsed.value().roots());
        PipelineSettings settings = b.build();
        if (settings.roots().isEmpty()) {
            System.err.println("Nenhuma biblioteca configurada: use --root ou GIBI_LIBRARY_ROOTS");
            return 2;
        }

        CountDownLatch stop = new CountDownLatch(1);
        ScanPipeline pipeline = ScanPipeline.open(settings);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            pipeline.close();
            stop.countDown();
        }, "gibi-shutdown"));
        pipeline.start();
        log("Observando " + settings.roots() + " (Ctrl+C para sair)");
        stop.await();
        return 0;
    }

    // ----------------- sweep -----------------

    private static int runSweep(String[] args) throws InterruptedException {
        ParseResult<RunArgs> parsed = RunArgs.parse(args);
        if (parsed.help()) {
            printUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            return 2;
        }

        PipelineSettings.Builder b = PipelineSettings.configBuilder().watchEnabled(false).reconcileOnStart(false);
        if (!parsed.value().roots().isEmpty()) b.roots(parsed.value().roots());

        try (ScanPipeline pipeline = ScanPipeline.open(b.build())) {
            pipeline.start();
            pipeline.reconcile();
            pipeline.fullSweep();
            boolean idle = pipeline.awaitIdle(BATCH_TIMEOUT);
            log((idle ? "Concluído: " : "Tempo esgotado: ") + pipeline.metrics());
            log("Registros no índice: " + pipeline.store().count());
            return idle ? 0 : 1;
        }
    }

    // ----------------- rescan -----------------

    private static int runRescan(String[] args) throws InterruptedException {
        List<Path> paths = new ArrayList<>();
        for (String a : args) {
            if ("-h".equals(a) || "--help".equals(a)) {
                printUsage();
                return 0;
            }
            paths.add(Path.of(a).toAbsolutePath().normalize());
        }
        if (paths.isEmpty()) {
            System.err.println("Informe ao menos um arquivo");
            return 2;
        }

        PipelineSettings settings = PipelineSettings.configBuilder().watchEnabled(false).reconcileOnStart(false).build();
        try (ScanPipeline pipeline = ScanPipeline.open(settings)) {
            pipeline.start();
            for (Path p : paths) pipeline.requestScan(p);
            pipeline.awaitIdle(BATCH_TIMEOUT);
            for (Path p : paths) printStatus(p, pipeline.store().status(p));
        }
        return 0;
    }

    // ----------------- status -----------------

    private static int runStatus(String[] args) {
        PipelineSettings settings = PipelineSettings.configBuilder().watchEnabled(false).reconcileOnStart(false).build();
        try (ScanPipeline pipeline = ScanPipeline.open(settings)) {
            if (args.length == 0) {
                PipelineHealth.Snapshot h = pipeline.health().snapshot();
                log("Índice: " + settings.dbFile());
                log("Schema: v" + pipeline.store().schemaVersion());
                log("Registros: " + pipeline.store().count());
                for (ScanState s : ScanState.values()) {
                    long n;
                    try (Stream<FileRecord> records = pipeline.store().query(RecordFilter.all().inState(s))) {
                        n = records.count();
                    }
                    if (n > 0) log("  " + s + ": " + n);
                }
                log("Saúde: " + h.status());
                return 0;
            }
            for (String a : args) {
                Path p = Path.of(a).toAbsolutePath().normalize();
                printStatus(p, pipeline.store().status(p));
            }
        }
        return 0;
    }

    private static void printStatus(Path p, Optional<ScanStatus> status) {
        if (status.isEmpty()) {
            log(p + ": não indexado");
            return;
        }
        ScanStatus s = status.get();
        log(p + ": " + s.scanState()
                + (s.lastScannedAt() == null ? "" : " em " + s.lastScannedAt())
                + (s.consecutiveFailures() > 0 ? " (falhas seguidas: " + s.consecutiveFailures() + ")" : "")
                + (isBlank(s.lastError()) ? "" : " - " + s.lastError()));
    }

    // ----------------- list -----------------

    private static int runList(String[] args) {
        ParseResult<RecordFilter> parsed = ListArgs.parse(args);
        if (parsed.help()) {
            printUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            return 2;
        }

        PipelineSettings settings = PipelineSettings.configBuilder().watchEnabled(false).reconcileOnStart(false).build();
        try (ScanPipeline pipeline = ScanPipeline.open(settings);
             Stream<FileRecord> records = pipeline.store().query(parsed.value())) {
            records.forEach(r -> log(describe(r)));
        }
        return 0;
    }

    private static String describe(FileRecord r) {
        ComicMetadata m = r.metadata();
        String series = m.text(ComicMetadata.SERIES).orElse("-");
        String number = m.text(ComicMetadata.NUMBER).orElse("-");
        String title = m.text(ComicMetadata.TITLE).orElse("");
        return String.format(Locale.ROOT, "%-8s %s #%s %s  [%s]", r.scanState(), series, number, title, r.path());
    }

    // ----------------- usage -----------------

    private static void printUsage() {
        System.out.println("""
                Gibi Indexer
                Comandos:
                  run [--root <pasta>]...       observa as bibliotecas e mantém o índice
                  sweep [--root <pasta>]...     reconcilia e reescaneia tudo, depois sai
                  rescan <arquivo>...           força novo scan dos arquivos
                  status [<arquivo>...]         resumo do índice ou estado de arquivos
                  list [--series X] [--publisher X] [--tag X] [--state S] [--under <pasta>] [--limit n]
                  help
                """);
    }

    // ----------------- args -----------------

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Valor ausente para " + opt);
            return next();
        }
    }

    private record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    private record RunArgs(List<Path> roots) {
        static ParseResult<RunArgs> parse(String[] args) {
            List<Path> roots = new ArrayList<>();
            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--root" -> roots.add(Path.of(c.requireNext("--root")).toAbsolutePath().normalize());
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            for (Path r : roots) {
                if (!Files.isDirectory(r)) return ParseResult.errorResult("Pasta nao existe: " + r);
            }
            return ParseResult.okResult(new RunArgs(roots));
        }
    }

    private static final class ListArgs {
        static ParseResult<RecordFilter> parse(String[] args) {
            RecordFilter f = RecordFilter.all();
            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--series" -> f = f.whereText(ComicMetadata.SERIES, c.requireNext(t));
                        case "--publisher" -> f = f.whereText(ComicMetadata.PUBLISHER, c.requireNext(t));
                        case "--tag" -> f = f.whereListContains(ComicMetadata.TAGS, c.requireNext(t));
                        case "--state" -> f = f.inState(ScanState.valueOf(c.requireNext(t).trim().toUpperCase(Locale.ROOT)));
                        case "--under" -> f = f.under(Path.of(c.requireNext(t)));
                        case "--limit" -> f = f.limit(Integer.parseInt(c.requireNext(t).trim()));
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (NumberFormatException e) {
                return ParseResult.errorResult("Valor invalido para --limit");
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            return ParseResult.okResult(f);
        }
    }

    // ----------------- misc -----------------

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Erro" : t.getClass().getSimpleName())
                : m;
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }

    private static void log(String msg) {
        if (!isBlank(msg)) System.out.println(msg);
    }
}
