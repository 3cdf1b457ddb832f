package com.gibi.app.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fonte de eventos baseada em {@link WatchService} para uma raiz da biblioteca.
 * Registra a árvore inteira (menos pastas ocultas) e acompanha diretórios novos.
 */
final class WatchSource implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(WatchSource.class);

    private final Path root;
    private final Consumer<FsEvent> sink;
    private final ArchiveFilter filter;
    private final MoveMatcher moveMatcher;
    private final Consumer<WatchException> onFailure;

    private final WatchService watcher;
    private final Map<WatchKey, Path> keyToDir = new ConcurrentHashMap<>();
    private final AtomicBoolean alive = new AtomicBoolean(true);

    WatchSource(Path root, Consumer<FsEvent> sink, ArchiveFilter filter, MoveMatcher moveMatcher,
                Consumer<WatchException> onFailure) throws IOException {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.sink = sink;
        this.filter = filter;
        this.moveMatcher = moveMatcher;
        this.onFailure = onFailure;
        this.watcher = FileSystems.getDefault().newWatchService();
    }

    void start() throws WatchException {
        if (!Files.isDirectory(root)) {
            throw new WatchException(root, "Raiz não existe ou não é diretório");
        }
        try {
            registerTree(root);
        } catch (IOException e) {
            throw new WatchException(root, "Falha ao registrar watch", e);
        }
        logger.info("Observando {} ({} diretórios)", root, keyToDir.size());
    }

    void loop() {
        while (alive.get()) {
            WatchKey key;
            try {
                key = watcher.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            Path dir = keyToDir.get(key);
            if (dir == null) {
                key.reset();
                continue;
            }

            try {
                dispatch(dir, key.pollEvents());
            } catch (RuntimeException e) {
                logger.warn("Falha processando eventos de {}: {}", dir, e.toString());
                sink.accept(FsEvent.overflow(root));
            }

            boolean valid = key.reset();
            if (!valid) {
                keyToDir.remove(key);
                if (dir.equals(root)) {
                    if (alive.get()) onFailure.accept(new WatchException(root, "Watch key da raiz ficou inválida"));
                    return;
                }
            }
        }
    }

    private void dispatch(Path dir, List<WatchEvent<?>> events) {
        List<FsEvent> batch = new ArrayList<>(events.size());
        for (WatchEvent<?> ev : events) {
            WatchEvent.Kind<?> k = ev.kind();

            if (k == OVERFLOW) {
                batch.add(FsEvent.overflow(root));
                continue;
            }

            @SuppressWarnings("unchecked")
            WatchEvent<Path> pev = (WatchEvent<Path>) ev;
            Path full = dir.resolve(pev.context());

            if (k == ENTRY_CREATE) {
                if (Files.isDirectory(full, LinkOption.NOFOLLOW_LINKS)) {
                    onNewDirectory(full, batch);
                } else {
                    batch.add(FsEvent.create(full));
                }
            } else if (k == ENTRY_DELETE) {
                if (isWatchedDir(full)) {
                    // Pasta inteira sumiu: a reconciliação remove o que estava dentro
                    forget(full);
                    batch.add(FsEvent.overflow(root));
                } else {
                    batch.add(FsEvent.delete(full));
                }
            } else {
                batch.add(FsEvent.modify(full));
            }
        }
        pairRenames(batch).forEach(sink);
    }

    /**
     * O WatchService reporta rename como DELETE + CREATE no mesmo diretório.
     * Quando o índice confirma (mesmo tamanho), vira um MOVE só.
     */
    private List<FsEvent> pairRenames(List<FsEvent> batch) {
        List<FsEvent> out = new ArrayList<>(batch);
        for (int i = 0; i < out.size(); i++) {
            FsEvent del = out.get(i);
            if (del.kind() != FsEvent.Kind.DELETE || !filter.acceptsGone(del.path())) continue;
            for (int j = 0; j < out.size(); j++) {
                FsEvent cre = out.get(j);
                if (cre.kind() != FsEvent.Kind.CREATE || !filter.isArchiveName(cre.path())) continue;
                if (!Objects.equals(cre.path().getParent(), del.path().getParent())) continue;
                if (!moveMatcher.matches(del.path(), cre.path())) continue;
                out.set(j, FsEvent.move(del.path(), cre.path()));
                out.remove(i);
                i--;
                break;
            }
        }
        return out;
    }

    private void onNewDirectory(Path dir, List<FsEvent> batch) {
        try {
            registerTree(dir);
            try (var files = Files.walk(dir)) {
                files.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                        .forEach(p -> batch.add(FsEvent.create(p)));
            }
        } catch (IOException e) {
            logger.warn("Não consegui registrar diretório novo {}: {}", dir, e.toString());
            batch.add(FsEvent.overflow(root));
        }
    }

    private boolean isWatchedDir(Path path) {
        return keyToDir.containsValue(path);
    }

    private void forget(Path dir) {
        keyToDir.entrySet().removeIf(e -> {
            if (e.getValue().startsWith(dir)) {
                e.getKey().cancel();
                return true;
            }
            return false;
        });
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(root) && filter.isHidden(dir)) return FileVisitResult.SKIP_SUBTREE;
                registerDir(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.debug("Ignorando {}: {}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void registerDir(Path dir) throws IOException {
        WatchKey key = dir.register(watcher, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
        keyToDir.put(key, dir);
    }

    Path root() {
        return root;
    }

    @Override
    public void close() throws IOException {
        alive.set(false);
        watcher.close();
        keyToDir.clear();
    }
}
