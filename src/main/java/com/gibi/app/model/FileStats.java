package com.gibi.app.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Tamanho + mtime do arquivo. O fingerprint é só a composição dos dois:
 * barato de calcular e suficiente para decidir se precisa reescanear.
 */
public record FileStats(long sizeBytes, long modifiedMillis) {

    public static FileStats read(Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        return new FileStats(attrs.size(), attrs.lastModifiedTime().toMillis());
    }

    /** Versão sem exceção para quem só quer "se existir". */
    public static FileStats readOrNull(Path file) {
        try {
            return read(file);
        } catch (IOException e) {
            return null;
        }
    }

    public String fingerprint() {
        return fingerprint(sizeBytes, modifiedMillis);
    }

    public static String fingerprint(long sizeBytes, long modifiedMillis) {
        return sizeBytes + ":" + modifiedMillis;
    }
}
