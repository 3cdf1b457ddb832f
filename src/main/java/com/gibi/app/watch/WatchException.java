package com.gibi.app.watch;

import java.io.IOException;
import java.nio.file.Path;

/** Raiz da biblioteca deixou de ser observável (apagada, desmontada, key inválida). */
public class WatchException extends IOException {

    private final Path root;

    public WatchException(Path root, String message) {
        super(message + ": " + root);
        this.root = root;
    }

    public WatchException(Path root, String message, Throwable cause) {
        super(message + ": " + root, cause);
        this.root = root;
    }

    public Path root() {
        return root;
    }
}
