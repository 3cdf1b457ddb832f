package com.gibi.app.scanner;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.gibi.app.model.ComicMetadata;

/**
 * LRU de metadados já decodificados, por path. Só vale enquanto o fingerprint bate;
 * é esvaziado quando a memória entra em CRITICAL.
 */
public final class DescriptorCache {

    private record Entry(String fingerprint, ComicMetadata metadata) {}

    private final int max;
    private final LinkedHashMap<Path, Entry> map;

    public DescriptorCache(int max) {
        this.max = Math.max(1, max);
        this.map = new LinkedHashMap<>(256, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Path, Entry> eldest) {
                return size() > DescriptorCache.this.max;
            }
        };
    }

    public synchronized Optional<ComicMetadata> get(Path path, String fingerprint) {
        Entry e = map.get(path);
        if (e == null) return Optional.empty();
        if (!e.fingerprint().equals(fingerprint)) {
            map.remove(path);
            return Optional.empty();
        }
        return Optional.of(e.metadata());
    }

    public synchronized void put(Path path, String fingerprint, ComicMetadata metadata) {
        map.put(path, new Entry(fingerprint, metadata));
    }

    public synchronized void invalidate(Path path) {
        map.remove(path);
    }

    public synchronized void clear() {
        map.clear();
    }

    public synchronized int size() {
        return map.size();
    }
}
