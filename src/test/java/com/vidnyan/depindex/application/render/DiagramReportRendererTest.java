package com.vidnyan.depindex.application.render;

import com.vidnyan.depindex.DepIndexProperties;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.DependencyReport;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.GraphQueryResult;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.GraphQueryResult.Query;
import static org.junit.jupiter.api.Assertions.*;

class DiagramReportRendererTest {

    private DiagramReportRenderer renderer(int maxNodes) {
        DepIndexProperties properties = new DepIndexProperties();
        properties.getRender().setDiagramMaxNodes(maxNodes);
        return new DiagramReportRenderer(properties);
    }

    @Test
    void render_ShouldStyleQueriedNodeAndLinkDependencies() {
        DependencyRecord record = DependencyRecord.builder("app.py")
                .importModule("lib.utils")
                .configFile("config.yaml", "yaml")
                .build();
        DependencyReport report = new DependencyReport("app.py", record, List.of("cli.py"), List.of(), 0);

        String diagram = renderer(10).render(report);

        assertTrue(diagram.startsWith("graph TD"));
        assertTrue(diagram.contains("MAIN[\"app.py\"]"));
        assertTrue(diagram.contains("IMP0[\"lib.utils\"]"));
        assertTrue(diagram.contains("MAIN --> IMP0"));
        assertTrue(diagram.contains("MAIN -.-> CFG0"));
        assertTrue(diagram.contains("REV0 --> MAIN"));
        assertTrue(diagram.contains("style MAIN " + DiagramReportRenderer.MAIN_STYLE));
    }

    @Test
    void render_ShouldCapNodeCount() {
        DependencyRecord.Builder builder = DependencyRecord.builder("big.py");
        for (int i = 0; i < 20; i++) {
            builder.importModule("mod" + i);
        }
        DependencyReport report = new DependencyReport("big.py", builder.build(), List.of(), List.of(), 0);

        String diagram = renderer(5).render(report);

        long nodes = diagram.lines().filter(l -> l.contains("[\"")).count();
        assertEquals(5, nodes);
        assertTrue(diagram.contains("%% 16 more nodes omitted"));
    }

    @Test
    void render_CycleShouldCloseTheLoop() {
        String diagram = renderer(10).render(
                GraphQueryResult.success(Query.CYCLES, "*", List.of(List.of("a", "b", "c"))));

        assertTrue(diagram.contains("C0 --> C1"));
        assertTrue(diagram.contains("C1 --> C2"));
        assertTrue(diagram.contains("C2 --> C0"));
    }

    @Test
    void render_UnavailableShouldBeComment() {
        String diagram = renderer(10).render(GraphQueryResult.unavailable(Query.PATH, "a → b", "disabled"));

        assertEquals("graph TD\n    %% graph queries unavailable: disabled", diagram);
    }

    @Test
    void render_ShouldEscapeQuotes() {
        DependencyReport report = new DependencyReport(
                "say \"hi\".py", DependencyRecord.builder("x").build(), List.of(), List.of(), 0);

        assertTrue(renderer(10).render(report).contains("MAIN[\"say #quot;hi#quot;.py\"]"));
    }
}
