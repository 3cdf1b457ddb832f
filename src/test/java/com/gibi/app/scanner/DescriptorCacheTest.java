package com.gibi.app.scanner;

import com.gibi.app.model.ComicMetadata;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DescriptorCacheTest {

    private static final ComicMetadata META = ComicMetadata.builder().text(ComicMetadata.SERIES, "Mafalda").build();

    @Test
    void get_onlyHitsWhenFingerprintMatches() {
        DescriptorCache cache = new DescriptorCache(10);
        Path p = Path.of("/lib/mafalda.cbz");
        cache.put(p, "10:100", META);

        assertEquals(META, cache.get(p, "10:100").orElseThrow());
        assertTrue(cache.get(p, "11:200").isEmpty(), "Changed file must miss");
        assertEquals(0, cache.size(), "Stale entry is dropped on mismatch");
    }

    @Test
    void put_evictsLeastRecentlyUsed() {
        DescriptorCache cache = new DescriptorCache(2);
        Path a = Path.of("/lib/a.cbz");
        Path b = Path.of("/lib/b.cbz");
        Path c = Path.of("/lib/c.cbz");
        cache.put(a, "1:1", META);
        cache.put(b, "1:1", META);
        cache.get(a, "1:1");
        cache.put(c, "1:1", META);

        assertTrue(cache.get(a, "1:1").isPresent());
        assertTrue(cache.get(b, "1:1").isEmpty());
        assertTrue(cache.get(c, "1:1").isPresent());
    }

    @Test
    void clearAndInvalidate() {
        DescriptorCache cache = new DescriptorCache(10);
        cache.put(Path.of("/lib/a.cbz"), "1:1", META);
        cache.put(Path.of("/lib/b.cbz"), "1:1", META);

        cache.invalidate(Path.of("/lib/a.cbz"));
        assertEquals(1, cache.size());
        cache.clear();
        assertEquals(0, cache.size());
    }
}
