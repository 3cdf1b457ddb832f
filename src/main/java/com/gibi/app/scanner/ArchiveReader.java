package com.gibi.app.scanner;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lê só o ComicInfo.xml de dentro do archive, sem extrair páginas.
 * <p>
 * ZipFile usa o diretório central (acesso aleatório), então o custo não cresce com o tamanho
 * do archive. A leitura é limitada em bytes, e abertura + leitura rodam num pool próprio
 * com prazo: um disco travado derruba só aquele archive, o worker segue.
 */
public class ArchiveReader implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveReader.class);

    public static final String DESCRIPTOR_NAME = "ComicInfo.xml";

    private static final int CHUNK = 8192;
    private static final int DEFAULT_IO_THREADS = 4;

    private final long maxDescriptorBytes;
    private final Duration timeout;
    private final ExecutorService io;

    public ArchiveReader(long maxDescriptorBytes, Duration timeout) {
        this(maxDescriptorBytes, timeout, DEFAULT_IO_THREADS);
    }

    public ArchiveReader(long maxDescriptorBytes, Duration timeout, int ioThreads) {
        if (maxDescriptorBytes <= 0) throw new IllegalArgumentException("maxDescriptorBytes deve ser > 0");
        if (ioThreads <= 0) throw new IllegalArgumentException("ioThreads deve ser > 0");
        this.maxDescriptorBytes = maxDescriptorBytes;
        this.timeout = timeout;
        AtomicInteger n = new AtomicInteger();
        this.io = Executors.newFixedThreadPool(ioThreads, r -> {
            Thread t = new Thread(r, "gibi-archive-io-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return bytes do descritor, ou vazio se o archive não tem um
     * @throws ArchiveOpenException archive corrompido ou prazo de I/O estourado
     * @throws DescriptorParseException descritor maior que o limite
     */
    public Optional<byte[]> readDescriptor(Path archive) throws IOException {
        Future<Optional<byte[]>> task = io.submit(() -> read(archive));
        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            logger.warn("Leitura de {} passou de {} ms; abandonada", archive, timeout.toMillis());
            throw new ArchiveOpenException(archive, "Leitura passou de " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrompido lendo " + archive);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioe) throw ioe;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new ArchiveOpenException(archive, "Falha lendo archive", cause);
        }
    }

    /** Ponto de abertura do zip; roda numa thread do pool de I/O. */
    protected ZipFile open(Path archive) throws IOException {
        return new ZipFile(archive.toFile());
    }

    private Optional<byte[]> read(Path archive) throws IOException {
        try (ZipFile zip = open(archive)) {
            ZipEntry entry = findDescriptor(zip);
            if (entry == null) {
                logger.debug("{} sem {}", archive, DESCRIPTOR_NAME);
                return Optional.empty();
            }
            if (entry.getSize() > maxDescriptorBytes) {
                throw new DescriptorParseException(DESCRIPTOR_NAME + " com " + entry.getSize()
                        + " bytes excede o limite de " + maxDescriptorBytes);
            }
            try (InputStream in = zip.getInputStream(entry)) {
                return Optional.of(readBounded(archive, in));
            }
        } catch (ZipException e) {
            throw new ArchiveOpenException(archive, "Archive inválido (" + e.getMessage() + ")", e);
        }
    }

    private byte[] readBounded(Path archive, InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[CHUNK];
        long total = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            total += n;
            if (total > maxDescriptorBytes) {
                throw new DescriptorParseException(DESCRIPTOR_NAME + " excede o limite de " + maxDescriptorBytes + " bytes");
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Leitura cancelada: " + archive);
            }
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    /** Prefere o descritor na raiz; senão aceita o primeiro numa subpasta. Nome sem diferenciar caixa. */
    static ZipEntry findDescriptor(ZipFile zip) {
        String wanted = DESCRIPTOR_NAME.toLowerCase(Locale.ROOT);
        ZipEntry nested = null;
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry e = entries.nextElement();
            if (e.isDirectory()) continue;
            String name = e.getName().replace('\\', '/').toLowerCase(Locale.ROOT);
            if (name.equals(wanted)) return e;
            if (nested == null && name.endsWith("/" + wanted)) nested = e;
        }
        return nested;
    }

    @Override
    public void close() {
        io.shutdownNow();
    }
}
