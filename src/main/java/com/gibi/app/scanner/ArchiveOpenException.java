package com.gibi.app.scanner;

import java.io.IOException;
import java.nio.file.Path;

/** Archive ilegível: zip corrompido, formato errado ou leitura que estourou o prazo. */
public class ArchiveOpenException extends IOException {

    private final Path archive;

    public ArchiveOpenException(Path archive, String message) {
        super(message + ": " + archive);
        this.archive = archive;
    }

    public ArchiveOpenException(Path archive, String message, Throwable cause) {
        super(message + ": " + archive, cause);
        this.archive = archive;
    }

    public Path archive() {
        return archive;
    }
}
