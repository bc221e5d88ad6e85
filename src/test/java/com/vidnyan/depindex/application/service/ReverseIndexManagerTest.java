package com.vidnyan.depindex.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.depindex.adapter.out.index.JsonReverseIndexRepository;
import com.vidnyan.depindex.config.DepIndexConfiguration;
import com.vidnyan.depindex.domain.index.IndexState;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import com.vidnyan.depindex.domain.model.ModulePaths;
import com.vidnyan.depindex.support.InMemoryFactSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class ReverseIndexManagerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new DepIndexConfiguration().objectMapper();
    private final InMemoryFactSource facts = new InMemoryFactSource();
    private Path indexFile;

    @BeforeEach
    void setUp() {
        indexFile = tempDir.resolve("_reverse_index.json");
        facts.add(DependencyRecord.builder("app.py").importModule("lib.utils").call("os.getenv").build())
                .add(DependencyRecord.builder("cli.py").importModule("lib.utils").build())
                .add(DependencyRecord.builder("lib/utils.py").importModule("lib.core").build());
    }

    private ReverseIndexManager manager() {
        return new ReverseIndexManager(facts, new JsonReverseIndexRepository(objectMapper, indexFile),
                ModulePaths.defaults());
    }

    @Test
    void lookup_WithoutPersistedIndexShouldBuildAndPersist() {
        ReverseIndexManager manager = manager();
        assertEquals(IndexState.UNLOADED, manager.state());

        List<String> dependents = manager.lookup("lib/utils.py");

        assertEquals(List.of("app.py", "cli.py"), dependents);
        assertEquals(IndexState.FRESH, manager.state());
        assertTrue(Files.exists(indexFile));
        assertEquals(1, facts.fullReads());
    }

    @Test
    void loadOrBuild_WithPersistedIndexShouldLoadWithoutReadingCorpus() {
        manager().buildFull();
        int readsAfterBuild = facts.fullReads();

        ReverseIndexManager fresh = manager();
        fresh.loadOrBuild();

        assertEquals(IndexState.LOADED, fresh.state());
        assertEquals(readsAfterBuild, facts.fullReads());
        assertEquals(List.of("app.py", "cli.py"), fresh.lookup("lib.utils"));
    }

    @Test
    void buildFull_ShouldBeByteIdenticalAcrossRuns() throws IOException {
        ReverseIndexManager manager = manager();

        manager.buildFull();
        byte[] first = Files.readAllBytes(indexFile);
        manager.buildFull();
        byte[] second = Files.readAllBytes(indexFile);

        assertArrayEquals(first, second);
    }

    @Test
    void buildFull_ShouldPickUpCorpusChanges() {
        ReverseIndexManager manager = manager();
        manager.loadOrBuild();

        facts.add(DependencyRecord.builder("worker.py").importModule("lib.utils").build());
        assertEquals(List.of("app.py", "cli.py"), manager.lookup("lib/utils.py"));

        manager.buildFull();
        assertEquals(List.of("app.py", "cli.py", "worker.py"), manager.lookup("lib/utils.py"));
    }

    @Test
    void loadOrBuild_CorruptIndexShouldTriggerRebuild() throws IOException {
        Files.writeString(indexFile, "{ not json");

        ReverseIndexManager manager = manager();
        manager.loadOrBuild();

        assertEquals(IndexState.FRESH, manager.state());
        assertEquals(List.of("app.py"), manager.lookup("os"));
        assertTrue(Files.readString(indexFile).contains("\"lib.utils\""));
    }

    @Test
    void loadOrBuild_NullEntriesInPersistedIndexShouldTriggerRebuild() throws IOException {
        Files.writeString(indexFile, "{\"lib.utils\": [null]}");

        ReverseIndexManager manager = manager();

        assertEquals(List.of("app.py", "cli.py"), manager.lookup("lib/utils.py"));
        assertEquals(IndexState.FRESH, manager.state());
        assertFalse(Files.readString(indexFile).contains("null"));
    }

    @Test
    void buildFull_SaveFailureShouldStillServeFreshIndex() throws IOException {
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "");
        ReverseIndexManager manager = new ReverseIndexManager(facts,
                new JsonReverseIndexRepository(objectMapper, blocker.resolve("_reverse_index.json")),
                ModulePaths.defaults());

        manager.buildFull();

        assertEquals(IndexState.FRESH, manager.state());
        assertEquals(List.of("app.py", "cli.py"), manager.lookup("lib/utils.py"));
    }

    @Test
    void deletePersisted_ShouldDeleteFileAndRebuildOnNextLookup() {
        ReverseIndexManager manager = manager();
        manager.buildFull();

        assertTrue(manager.deletePersisted());

        assertEquals(IndexState.UNLOADED, manager.state());
        assertFalse(Files.exists(indexFile));
        assertFalse(manager.deletePersisted());

        assertEquals(List.of("app.py", "cli.py"), manager.lookup("lib/utils.py"));
        assertEquals(IndexState.FRESH, manager.state());
        assertEquals(2, facts.fullReads());
    }

    @Test
    void lookup_ConcurrentFirstUseShouldBuildOnce() throws Exception {
        ReverseIndexManager manager = manager();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch go = new CountDownLatch(1);
            List<Future<List<String>>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return manager.lookup("lib/utils.py");
                }));
            }
            go.countDown();

            for (Future<List<String>> result : results) {
                assertEquals(List.of("app.py", "cli.py"), result.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, facts.fullReads());
        } finally {
            pool.shutdownNow();
        }
    }
}
