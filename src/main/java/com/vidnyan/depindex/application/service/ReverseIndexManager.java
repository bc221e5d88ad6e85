package com.vidnyan.depindex.application.service;

import com.vidnyan.depindex.application.port.out.FactSource;
import com.vidnyan.depindex.application.port.out.ReverseIndexRepository;
import com.vidnyan.depindex.application.support.SingleFlight;
import com.vidnyan.depindex.domain.error.IndexCorruptException;
import com.vidnyan.depindex.domain.index.IndexState;
import com.vidnyan.depindex.domain.index.ReverseIndex;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import com.vidnyan.depindex.domain.model.ModulePaths;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the in-memory reverse index: lazy loading, full rebuilds, persistence.
 * <p>
 * State machine: {@code UNLOADED → LOADED} when read from the persisted file,
 * {@code → FRESH} after a full rebuild. Only {@code FRESH} guarantees the index
 * matches the current corpus. Lookups share a read lock; swapping in a new snapshot
 * takes the write lock. Concurrent rebuild requests share one in-flight build.
 */
@Slf4j
public class ReverseIndexManager {

    private final FactSource factSource;
    private final ReverseIndexRepository repository;
    private final ModulePaths paths;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private ReverseIndex index = ReverseIndex.empty();
    private IndexState state = IndexState.UNLOADED;

    private final SingleFlight<ReverseIndex> buildFlight = new SingleFlight<>();
    private final SingleFlight<ReverseIndex> loadFlight = new SingleFlight<>();

    public ReverseIndexManager(FactSource factSource, ReverseIndexRepository repository, ModulePaths paths) {
        this.factSource = factSource;
        this.repository = repository;
        this.paths = paths;
    }

    /**
     * Rebuild from every record of the corpus, persist, then swap in.
     */
    public ReverseIndex buildFull() {
        return buildFlight.execute(() -> {
            log.info("Building reverse index...");
            long start = System.currentTimeMillis();

            List<DependencyRecord> records = factSource.readAll();
            ReverseIndex built = ReverseIndex.build(records, paths);
            persist(built);
            swap(built, IndexState.FRESH);

            log.info("Reverse index built: {} symbols, {} files processed in {}ms",
                    built.symbolCount(), records.size(), System.currentTimeMillis() - start);
            return built;
        });
    }

    /**
     * Make an index available: no-op when one is loaded, else read the persisted file,
     * else build. A corrupt persisted file is replaced by a full rebuild.
     */
    public ReverseIndex loadOrBuild() {
        Optional<ReverseIndex> current = currentIfAvailable();
        if (current.isPresent()) {
            return current.get();
        }

        return loadFlight.execute(() -> {
            Optional<ReverseIndex> loadedMeanwhile = currentIfAvailable();
            if (loadedMeanwhile.isPresent()) {
                return loadedMeanwhile.get();
            }

            Optional<Map<String, List<String>>> persisted;
            try {
                persisted = repository.load();
            } catch (IndexCorruptException e) {
                log.warn("{} - rebuilding", e.getMessage());
                return buildFull();
            }

            if (persisted.isEmpty()) {
                log.info("No persisted reverse index at {}", repository.location());
                return buildFull();
            }

            ReverseIndex loaded = ReverseIndex.of(persisted.get());
            if (!swapIfUnloaded(loaded)) {
                // a full build finished first; keep the fresher index
                return currentIfAvailable().orElse(loaded);
            }
            log.info("Loaded reverse index: {} entries from {}", loaded.symbolCount(), repository.location());
            return loaded;
        });
    }

    /**
     * Files that depend on the given file. Loads or builds the index on first use.
     */
    public List<String> lookup(String filePath) {
        loadOrBuild();
        lock.readLock().lock();
        try {
            return index.lookup(filePath, paths);
        } finally {
            lock.readLock().unlock();
        }
    }

    public IndexState state() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Delete the persisted file and forget the in-memory index.
     */
    public boolean deletePersisted() {
        boolean deleted = repository.delete();
        swap(ReverseIndex.empty(), IndexState.UNLOADED);
        log.info("Reverse index reset (persisted file deleted: {})", deleted);
        return deleted;
    }

    public String location() {
        return repository.location();
    }

    private Optional<ReverseIndex> currentIfAvailable() {
        lock.readLock().lock();
        try {
            return state.isAvailable() ? Optional.of(index) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void persist(ReverseIndex built) {
        try {
            repository.save(built.asMap());
            log.info("Saved reverse index to {}", repository.location());
        } catch (UncheckedIOException e) {
            log.error("Failed to save reverse index to {}: {}", repository.location(), e.getMessage());
        }
    }

    private void swap(ReverseIndex next, IndexState nextState) {
        lock.writeLock().lock();
        try {
            index = next;
            state = nextState;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean swapIfUnloaded(ReverseIndex loaded) {
        lock.writeLock().lock();
        try {
            if (state != IndexState.UNLOADED) {
                return false;
            }
            index = loaded;
            state = IndexState.LOADED;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
