package com.vidnyan.depindex.application.service;

import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.CacheStats;
import com.vidnyan.depindex.application.port.out.FactSource;
import com.vidnyan.depindex.domain.error.RecordNotFoundException;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import com.vidnyan.depindex.domain.model.ModulePaths;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded least-recently-used cache of fact records.
 * <p>
 * Both reads and inserts move an entry to the most-recent end; when full, the entry
 * accessed longest ago is evicted. The fact source is read outside the lock, so a slow
 * read does not block cache hits for other files.
 */
@Slf4j
public class RecordStore {

    private final FactSource factSource;
    private final ModulePaths paths;
    private final int maxEntries;

    // guards entries and all counters; access-ordered get() mutates the map
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, DependencyRecord> entries;
    private long hits;
    private long misses;
    private long loadNanos;

    public RecordStore(FactSource factSource, ModulePaths paths, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.factSource = factSource;
        this.paths = paths;
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, DependencyRecord> eldest) {
                if (size() > RecordStore.this.maxEntries) {
                    log.debug("Cache eviction: {}", eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * Load the record for a file, from cache when possible.
     * @throws RecordNotFoundException if no record exists for the file
     */
    public DependencyRecord load(String filePath) {
        String key = paths.normalize(filePath);

        lock.lock();
        try {
            DependencyRecord cached = entries.get(key);
            if (cached != null) {
                hits++;
                log.debug("Cache HIT: {}", key);
                return cached;
            }
            misses++;
        } finally {
            lock.unlock();
        }

        long start = System.nanoTime();
        DependencyRecord record = factSource.read(key)
                .orElseThrow(() -> new RecordNotFoundException(filePath));
        long elapsed = System.nanoTime() - start;

        lock.lock();
        try {
            loadNanos += elapsed;
            entries.put(key, record);
        } finally {
            lock.unlock();
        }
        log.debug("Cache MISS: {} (loaded in {}ms)", key, String.format("%.2f", elapsed / 1_000_000.0));
        return record;
    }

    /**
     * Whether a record is currently cached. Does not affect recency.
     */
    public boolean isCached(String filePath) {
        String key = paths.normalize(filePath);
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            long total = hits + misses;
            double hitRate = total > 0 ? hits * 100.0 / total : 0.0;
            return new CacheStats(hits, misses, hitRate, entries.size(), maxEntries, loadNanos / 1_000_000.0);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Empty the cache and reset all counters.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
            loadNanos = 0;
        } finally {
            lock.unlock();
        }
        log.info("Cache cleared");
    }
}
