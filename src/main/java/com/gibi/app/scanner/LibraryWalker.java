package com.gibi.app.scanner;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gibi.app.model.FileStats;
import com.gibi.app.watch.ArchiveFilter;

/**
 * Varre uma raiz da biblioteca atrás de archives. Usado na reconciliação (start, overflow,
 * watch restaurado), nunca no caminho quente dos eventos.
 */
public final class LibraryWalker {

    private static final Logger logger = LoggerFactory.getLogger(LibraryWalker.class);

    public static final class WalkMetrics {
        public final LongAdder filesSeen = new LongAdder();
        public final LongAdder archivesFound = new LongAdder();
        public final LongAdder dirsSkipped = new LongAdder();
        public final LongAdder walkErrors = new LongAdder();
    }

    private final ArchiveFilter filter;

    public LibraryWalker(ArchiveFilter filter) {
        this.filter = filter;
    }

    /**
     * Chama {@code visitor} para cada archive encontrado, com os stats lidos na varredura.
     * Pastas ocultas são puladas inteiras; erros de leitura contam e seguem.
     */
    public WalkMetrics walk(Path root, BiConsumer<Path, FileStats> visitor) throws IOException {
        Path rootAbs = root.toAbsolutePath().normalize();
        WalkMetrics metrics = new WalkMetrics();

        Files.walkFileTree(rootAbs, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(rootAbs) && filter.isHidden(dir)) {
                    metrics.dirsSkipped.increment();
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) return FileVisitResult.CONTINUE;
                metrics.filesSeen.increment();
                if (filter.isArchiveName(file) && !filter.isHidden(file)) {
                    metrics.archivesFound.increment();
                    visitor.accept(file, new FileStats(attrs.size(), attrs.lastModifiedTime().toMillis()));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                metrics.walkErrors.increment();
                logger.debug("Falha lendo {}: {}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }
        });

        logger.info("Varredura de {}: {} arquivos, {} archives, {} pastas puladas, {} erros",
                rootAbs, metrics.filesSeen.sum(), metrics.archivesFound.sum(),
                metrics.dirsSkipped.sum(), metrics.walkErrors.sum());
        return metrics;
    }
}
