package com.gibi.app.scanner;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.zip.ZipFile;

import static org.junit.jupiter.api.Assertions.*;

public class ArchiveReaderTest {

    @TempDir
    Path dir;

    private final ArchiveReader reader = new ArchiveReader(64 * 1024, Duration.ofSeconds(10));

    @AfterEach
    void tearDown() {
        reader.close();
    }

    @Test
    void readDescriptor_returnsRootComicInfo() throws Exception {
        String xml = ArchiveFixtures.comicInfo("Asterix", "1", 1, "");
        Path cbz = ArchiveFixtures.cbz(dir.resolve("asterix.cbz"), xml);

        Optional<byte[]> bytes = reader.readDescriptor(cbz);

        assertTrue(bytes.isPresent());
        assertEquals(xml, new String(bytes.get(), StandardCharsets.UTF_8));
    }

    @Test
    void readDescriptor_findsNestedAndCaseInsensitiveName() throws Exception {
        Path cbz = ArchiveFixtures.cbz(dir.resolve("nested.cbz"), "Vol1/comicinfo.XML", "<ComicInfo/>");
        assertTrue(reader.readDescriptor(cbz).isPresent());
    }

    @Test
    void readDescriptor_emptyWhenArchiveHasNoDescriptor() throws Exception {
        Path cbz = ArchiveFixtures.cbz(dir.resolve("bare.cbz"), null);
        assertTrue(reader.readDescriptor(cbz).isEmpty());
    }

    @Test
    void readDescriptor_corruptArchiveIsArchiveOpenException() throws Exception {
        Path fake = ArchiveFixtures.notAZip(dir.resolve("broken.cbz"));
        ArchiveOpenException e = assertThrows(ArchiveOpenException.class, () -> reader.readDescriptor(fake));
        assertEquals(fake, e.archive());
    }

    @Test
    void readDescriptor_rejectsOversizedDescriptor() throws Exception {
        try (ArchiveReader tiny = new ArchiveReader(16, Duration.ofSeconds(10))) {
            Path cbz = ArchiveFixtures.cbz(dir.resolve("big.cbz"), ArchiveFixtures.comicInfo("Grande", "1", 1, "a, b, c"));
            assertThrows(DescriptorParseException.class, () -> tiny.readDescriptor(cbz));
        }
    }

    @Test
    void readDescriptor_hungOpenFailsWithinTimeout_andFreesTheIoThread() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        Path hung = ArchiveFixtures.cbz(dir.resolve("travado.cbz"), "<ComicInfo/>");
        Path fine = ArchiveFixtures.cbz(dir.resolve("ok.cbz"), "<ComicInfo/>");

        try (ArchiveReader stuck = new ArchiveReader(64 * 1024, Duration.ofMillis(200), 1) {
            @Override
            protected ZipFile open(Path archive) throws IOException {
                if (archive.equals(hung)) {
                    entered.countDown();
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new InterruptedIOException("cancelado");
                    }
                }
                return super.open(archive);
            }
        }) {
            long t0 = System.nanoTime();
            ArchiveOpenException e = assertThrows(ArchiveOpenException.class, () -> stuck.readDescriptor(hung));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

            assertTrue(entered.await(1, TimeUnit.SECONDS));
            assertEquals(hung, e.archive());
            assertTrue(elapsedMs < 5_000, "Gave up after " + elapsedMs + " ms");
            assertTrue(stuck.readDescriptor(fine).isPresent(), "Cancelled read releases the single I/O thread");
        }
    }
}
