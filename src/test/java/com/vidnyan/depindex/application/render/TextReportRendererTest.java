package com.vidnyan.depindex.application.render;

import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.DependencyReport;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.GraphQueryResult;
import com.vidnyan.depindex.domain.graph.DependencyGraph;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.GraphQueryResult.Query;
import static org.junit.jupiter.api.Assertions.*;

class TextReportRendererTest {

    private final TextReportRenderer renderer = new TextReportRenderer();

    @Test
    void render_ShouldShowOnlyNonEmptyCategories() {
        DependencyRecord record = DependencyRecord.builder("app.py")
                .importModule("lib.utils")
                .configFile("config.yaml", "yaml")
                .envVar("HOME", null)
                .build();
        DependencyReport report = new DependencyReport("app.py", record, List.of("cli.py"), List.of("lib.core"), 2);

        String text = renderer.render(report);

        assertTrue(text.startsWith("Dependencies for: app.py"));
        assertTrue(text.contains("📦 CODE DEPENDENCIES (Imports)"));
        assertTrue(text.contains("  • import lib.utils"));
        assertTrue(text.contains("  • config.yaml (yaml)"));
        assertTrue(text.contains("  • HOME"));
        assertTrue(text.contains("⬅️  REVERSE DEPENDENCIES"));
        assertTrue(text.contains("🔄 TRANSITIVE DEPENDENCIES (depth=2)"));
        assertFalse(text.contains("DATA INPUTS"));
        assertFalse(text.contains("SYSTEM COMMANDS"));
        assertFalse(text.contains("(no dependencies recorded)"));
    }

    @Test
    void render_ShouldListDataExternalAndSystemSections() {
        DependencyRecord record = DependencyRecord.builder("etl.py")
                .reads("in.csv")
                .writes("out.parquet")
                .apiCall("s3", "/bucket")
                .subprocess("gzip")
                .build();

        String text = renderer.render(new DependencyReport("etl.py", record, List.of(), List.of(), 0));

        assertTrue(text.contains("📥 DATA INPUTS (File Reads)\n" + "-".repeat(60) + "\n  • in.csv (open)"));
        assertTrue(text.contains("  • out.parquet (write)"));
        assertTrue(text.contains("  • s3: /bucket"));
        assertTrue(text.contains("🔧 SYSTEM COMMANDS"));
        assertTrue(text.contains("  • gzip"));
        assertFalse(text.contains("CODE DEPENDENCIES"));
    }

    @Test
    void render_EmptyRecordShouldSaySo() {
        DependencyReport report = new DependencyReport(
                "empty.py", DependencyRecord.builder("empty.py").build(), List.of(), List.of(), 0);

        assertTrue(renderer.render(report).endsWith("(no dependencies recorded)"));
    }

    @Test
    void render_CyclesShouldRepeatFirstNodeAndCapListing() {
        List<List<String>> cycles = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            cycles.add(List.of("a" + i, "b" + i));
        }

        String text = renderer.render(GraphQueryResult.success(Query.CYCLES, "*", cycles));

        assertTrue(text.startsWith("⚠️  Found 12 circular dependencies:"));
        assertTrue(text.contains("1. a0 → b0 → a0"));
        assertTrue(text.contains("... and 2 more"));
        assertFalse(text.contains("a11"));
    }

    @Test
    void render_NoCyclesShouldReportClean() {
        assertEquals("✅ No circular dependencies found",
                renderer.render(GraphQueryResult.success(Query.CYCLES, "*", List.of())));
    }

    @Test
    void render_PathAndStats() {
        String path = renderer.render(GraphQueryResult.success(Query.PATH, "a → c", List.of("a", "b", "c")));
        String stats = renderer.render(GraphQueryResult.success(Query.STATS, "*",
                new DependencyGraph.Stats(4, 3, 0.25, true, 3, 1, 1)));

        assertEquals("📍 Shortest path (3 steps):\n   a → b → c", path);
        assertTrue(stats.contains("Density: 0.2500"));
        assertTrue(stats.contains("Is DAG: true"));
    }

    @Test
    void render_UnavailableShouldExplain() {
        String text = renderer.render(GraphQueryResult.unavailable(Query.TRANSITIVE, "a", "no backend"));

        assertEquals("❌ Graph queries unavailable: no backend", text);
    }
}
