package com.vidnyan.depindex.application.render;

import com.vidnyan.depindex.DepIndexProperties;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.DependencyReport;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.GraphQueryResult;
import com.vidnyan.depindex.domain.graph.DependencyGraph;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Mermaid {@code graph TD} fragment. The node count is capped by
 * {@code depindex.render.diagram-max-nodes}; the queried node is always drawn and styled.
 */
@Component
@RequiredArgsConstructor
public class DiagramReportRenderer implements ReportRenderer {

    static final String MAIN_STYLE = "fill:#f9f,stroke:#333,stroke-width:2px";

    private final DepIndexProperties properties;

    @Override
    public OutputFormat format() {
        return OutputFormat.DIAGRAM;
    }

    @Override
    public String render(DependencyReport report) {
        Mermaid diagram = new Mermaid(maxNodes());
        String main = diagram.main(report.filePath());

        DependencyRecord record = report.record();
        for (String module : record.importedModules()) {
            diagram.node("IMP", module).ifPresent(id -> diagram.edge(main, "-->", id));
        }
        for (DependencyRecord.ConfigFile cfg : record.configFiles()) {
            diagram.node("CFG", cfg.file()).ifPresent(id -> diagram.edge(main, "-.->", id));
        }
        for (String dependent : report.reverseDependencies()) {
            diagram.node("REV", dependent).ifPresent(id -> diagram.edge(id, "-->", main));
        }
        for (String transitive : report.transitiveDependencies()) {
            diagram.node("TRN", transitive).ifPresent(id -> diagram.edge(main, "-.->", id));
        }
        return diagram.toString();
    }

    @Override
    public String render(GraphQueryResult<?> result) {
        Mermaid diagram = new Mermaid(maxNodes());
        if (!result.isAvailable()) {
            diagram.comment("graph queries unavailable: " + result.message());
            return diagram.toString();
        }

        switch (result.query()) {
            case TRANSITIVE -> {
                String main = diagram.main(result.subject());
                for (Object dep : (List<?>) result.value()) {
                    diagram.node("TRN", String.valueOf(dep)).ifPresent(id -> diagram.edge(main, "-.->", id));
                }
            }
            case PATH -> {
                List<?> path = (List<?>) result.value();
                String previous = path.isEmpty() ? null : diagram.main(String.valueOf(path.get(0)));
                for (int i = 1; i < path.size() && previous != null; i++) {
                    Optional<String> next = diagram.node("P", String.valueOf(path.get(i)));
                    if (next.isPresent()) {
                        diagram.edge(previous, "-->", next.get());
                    }
                    previous = next.orElse(null);
                }
            }
            case CYCLES -> {
                for (Object c : (List<?>) result.value()) {
                    drawCycle(diagram, (List<?>) c);
                }
            }
            case STATS -> {
                DependencyGraph.Stats stats = (DependencyGraph.Stats) result.value();
                diagram.comment("nodes: " + stats.nodeCount() + ", edges: " + stats.edgeCount()
                        + ", acyclic: " + stats.acyclic());
            }
        }
        return diagram.toString();
    }

    private void drawCycle(Mermaid diagram, List<?> cycle) {
        List<String> ids = new ArrayList<>();
        for (Object node : cycle) {
            Optional<String> id = diagram.node("C", String.valueOf(node));
            if (id.isEmpty()) {
                return;
            }
            ids.add(id.get());
        }
        for (int i = 0; i < ids.size(); i++) {
            diagram.edge(ids.get(i), "-->", ids.get((i + 1) % ids.size()));
        }
    }

    private int maxNodes() {
        return Math.max(1, properties.getRender().getDiagramMaxNodes());
    }

    /**
     * Accumulates nodes and edges; refuses new nodes past the cap and counts them.
     */
    static final class Mermaid {

        private final int maxNodes;
        private final Map<String, String> idByLabel = new LinkedHashMap<>();
        private final Map<String, Integer> counters = new HashMap<>();
        private final Set<String> edges = new LinkedHashSet<>();
        private final List<String> comments = new ArrayList<>();
        private final Set<String> omitted = new HashSet<>();
        private String mainId;

        Mermaid(int maxNodes) {
            this.maxNodes = maxNodes;
        }

        String main(String label) {
            mainId = "MAIN";
            idByLabel.put(label, mainId);
            return mainId;
        }

        Optional<String> node(String prefix, String label) {
            String existing = idByLabel.get(label);
            if (existing != null) {
                return Optional.of(existing);
            }
            if (idByLabel.size() >= maxNodes) {
                omitted.add(label);
                return Optional.empty();
            }
            int n = counters.merge(prefix, 1, Integer::sum) - 1;
            String id = prefix + n;
            idByLabel.put(label, id);
            return Optional.of(id);
        }

        void edge(String from, String arrow, String to) {
            edges.add(from + " " + arrow + " " + to);
        }

        void comment(String text) {
            comments.add(text);
        }

        @Override
        public String toString() {
            StringBuilder out = new StringBuilder("graph TD");
            idByLabel.forEach((label, id) ->
                    out.append("\n    ").append(id).append("[\"").append(escape(label)).append("\"]"));
            edges.forEach(e -> out.append("\n    ").append(e));
            if (mainId != null) {
                out.append("\n    style ").append(mainId).append(' ').append(MAIN_STYLE);
            }
            comments.forEach(c -> out.append("\n    %% ").append(c));
            if (!omitted.isEmpty()) {
                out.append("\n    %% ").append(omitted.size()).append(" more nodes omitted");
            }
            return out.toString();
        }

        private static String escape(String label) {
            return label.replace("\"", "#quot;");
        }
    }
}
