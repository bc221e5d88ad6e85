package com.vidnyan.depindex.domain.index;

import com.vidnyan.depindex.domain.model.DependencyRecord;
import com.vidnyan.depindex.domain.model.ModulePaths;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReverseIndexTest {

    private final ModulePaths paths = ModulePaths.defaults();

    private final List<DependencyRecord> corpus = List.of(
            DependencyRecord.builder("app.py")
                    .importModule("lib.utils")
                    .call("os.path.join")
                    .build(),
            DependencyRecord.builder("cli.py")
                    .importModule("lib.utils")
                    .importModule("json")
                    .build(),
            DependencyRecord.builder("lib/utils.py")
                    .importModule("lib.core")
                    .build()
    );

    @Test
    void build_ShouldIndexModulesStemsAndCallQualifiers() {
        ReverseIndex index = ReverseIndex.build(corpus, paths);

        assertEquals(List.of("app.py", "cli.py"), index.bucket("lib.utils"));
        assertEquals(List.of("app.py", "cli.py"), index.bucket("utils"));
        assertEquals(List.of("lib/utils.py"), index.bucket("core"));
        assertEquals(List.of("app.py"), index.bucket("os"));
        assertEquals(List.of("cli.py"), index.bucket("json"));
        assertEquals(List.of(), index.bucket("nothing"));
    }

    @Test
    void build_ShouldContainEveryDirectImporter() {
        ReverseIndex index = ReverseIndex.build(corpus, paths);

        for (DependencyRecord record : corpus) {
            for (String module : record.importedModules()) {
                assertTrue(index.bucket(module).contains(record.filePath()), module);
            }
        }
    }

    @Test
    void build_ShouldDeduplicateBuckets() {
        DependencyRecord record = DependencyRecord.builder("a.py")
                .importModule("x.json")
                .importModule("json")
                .call("json.loads")
                .build();

        ReverseIndex index = ReverseIndex.build(List.of(record), paths);

        assertEquals(List.of("a.py"), index.bucket("json"));
    }

    @Test
    void asMap_ShouldBeSortedByKey() {
        ReverseIndex index = ReverseIndex.build(corpus, paths);

        List<String> keys = List.copyOf(index.asMap().keySet());

        assertEquals(keys.stream().sorted().toList(), keys);
        assertEquals(6, index.symbolCount());
        assertEquals(3, index.fileCount());
    }

    @Test
    void lookup_ShouldMatchPathModuleNameAndStem() {
        ReverseIndex index = ReverseIndex.build(corpus, paths);

        assertEquals(List.of("app.py", "cli.py"), index.lookup("lib/utils.py", paths));
        assertEquals(List.of("app.py", "cli.py"), index.lookup("./lib/utils.py", paths));
        assertEquals(List.of("app.py", "cli.py"), index.lookup("lib.utils", paths));
        assertEquals(List.of("lib/utils.py"), index.lookup("lib/core.py", paths));
        assertEquals(List.of(), index.lookup("unused.py", paths));
    }

    @Test
    void lookup_ShouldNotReportFileAsItsOwnDependent() {
        DependencyRecord selfImport = DependencyRecord.builder("loop.py").importModule("loop").build();

        ReverseIndex index = ReverseIndex.build(List.of(selfImport), paths);

        assertEquals(List.of(), index.lookup("loop.py", paths));
    }

    @Test
    void of_ShouldWrapPersistedMap() {
        ReverseIndex index = ReverseIndex.of(Map.of(
                "utils", List.of("b.py", "a.py", "b.py"),
                "core", List.of()
        ));

        assertEquals(List.of("b.py", "a.py"), index.bucket("utils"));
        assertEquals(List.of("core", "utils"), List.copyOf(index.asMap().keySet()));
        assertTrue(ReverseIndex.empty().isEmpty());
    }
}
