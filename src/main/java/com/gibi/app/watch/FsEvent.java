package com.gibi.app.watch;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Evento bruto do filesystem, antes de debounce e filtro.
 * Em OVERFLOW, {@code path} é a raiz afetada.
 */
public record FsEvent(Kind kind, Path path, Path oldPath, Instant at) {

    public enum Kind { CREATE, MODIFY, DELETE, MOVE, OVERFLOW }

    public FsEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        path = path.toAbsolutePath().normalize();
        oldPath = oldPath == null ? null : oldPath.toAbsolutePath().normalize();
        at = at == null ? Instant.now() : at;
        if (kind == Kind.MOVE && oldPath == null) {
            throw new IllegalArgumentException("MOVE sem oldPath: " + path);
        }
    }

    public static FsEvent create(Path path) { return new FsEvent(Kind.CREATE, path, null, null); }
    public static FsEvent modify(Path path) { return new FsEvent(Kind.MODIFY, path, null, null); }
    public static FsEvent delete(Path path) { return new FsEvent(Kind.DELETE, path, null, null); }
    public static FsEvent move(Path from, Path to) { return new FsEvent(Kind.MOVE, to, from, null); }
    public static FsEvent overflow(Path root) { return new FsEvent(Kind.OVERFLOW, root, null, null); }
}
