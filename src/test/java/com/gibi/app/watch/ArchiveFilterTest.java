package com.gibi.app.watch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ArchiveFilterTest {

    @TempDir
    Path root;

    @Test
    void extensions_areNormalizedAndCaseInsensitive() {
        ArchiveFilter f = new ArchiveFilter(Set.of(".CBZ", " zip ", ""), List.of(root));
        assertEquals(Set.of("cbz", "zip"), f.extensions());
        assertTrue(f.isArchiveName(root.resolve("Edicao 01.CbZ")));
        assertTrue(f.isArchiveName(root.resolve("pacote.zip")));
        assertFalse(f.isArchiveName(root.resolve("capa.jpg")));
        assertFalse(f.isArchiveName(root.resolve("cbz")));
    }

    @Test
    void hiddenSegments_belowRootAreRejected() {
        Path hiddenRoot = root.resolve(".biblioteca");
        ArchiveFilter f = new ArchiveFilter(Set.of("cbz"), List.of(hiddenRoot));

        assertTrue(f.acceptsGone(hiddenRoot.resolve("a.cbz")), "A dot in the root itself does not hide its contents");
        assertFalse(f.acceptsGone(hiddenRoot.resolve(".lixo").resolve("a.cbz")));
        assertFalse(f.acceptsGone(hiddenRoot.resolve("._a.cbz")));
    }

    @Test
    void accepts_rejectsDirectoriesNamedLikeArchives() throws Exception {
        ArchiveFilter f = new ArchiveFilter(Set.of("cbz"), List.of(root));
        Path folder = Files.createDirectories(root.resolve("volume.cbz"));

        assertFalse(f.accepts(folder));
        assertTrue(f.acceptsGone(folder));
        assertTrue(f.accepts(root.resolve("ainda-nao-existe.cbz")));
    }
}
