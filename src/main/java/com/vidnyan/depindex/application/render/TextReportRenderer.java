package com.vidnyan.depindex.application.render;

import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.DependencyReport;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.GraphQueryResult;
import com.vidnyan.depindex.domain.graph.DependencyGraph;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Human-readable rendering with one labeled section per dependency category.
 * Empty categories are left out.
 */
@Component
public class TextReportRenderer implements ReportRenderer {

    private static final String RULE = "=".repeat(60);
    private static final String THIN_RULE = "-".repeat(60);
    private static final int MAX_CYCLES_SHOWN = 10;

    @Override
    public OutputFormat format() {
        return OutputFormat.TEXT;
    }

    @Override
    public String render(DependencyReport report) {
        DependencyRecord record = report.record();
        StringBuilder out = new StringBuilder();
        out.append("Dependencies for: ").append(report.filePath()).append('\n');
        out.append(RULE);

        if (!record.imports().isEmpty()) {
            section(out, "📦 CODE DEPENDENCIES (Imports)");
            for (DependencyRecord.ImportRef imp : record.imports()) {
                if (imp.name() != null && !imp.name().isBlank()) {
                    bullet(out, "from " + imp.effectiveModule() + " import " + imp.name());
                } else {
                    bullet(out, "import " + imp.effectiveModule());
                }
            }
        }

        if (!record.configFiles().isEmpty()) {
            section(out, "⚙️  CONFIG DEPENDENCIES");
            record.configFiles().forEach(c -> bullet(out, c.file() + suffix(c.type())));
        }

        if (!record.envVars().isEmpty()) {
            section(out, "🔐 ENVIRONMENT VARIABLES");
            record.envVars().forEach(e -> bullet(out, e.var()
                    + (e.defaultValue() != null ? " (default: " + e.defaultValue() + ")" : "")));
        }

        if (!record.fileReads().isEmpty()) {
            section(out, "📥 DATA INPUTS (File Reads)");
            record.fileReads().forEach(r -> bullet(out, r.path() + suffix(r.operation())));
        }

        if (!record.fileWrites().isEmpty()) {
            section(out, "📤 DATA OUTPUTS (File Writes)");
            record.fileWrites().forEach(w -> bullet(out, w.path() + suffix(w.operation())));
        }

        if (!record.apiCalls().isEmpty()) {
            section(out, "🌐 EXTERNAL APIS");
            record.apiCalls().forEach(a -> bullet(out,
                    (a.service() != null ? a.service() : "unknown") + ": " + (a.endpoint() != null ? a.endpoint() : "")));
        }

        if (!record.subprocessCalls().isEmpty()) {
            section(out, "🔧 SYSTEM COMMANDS");
            record.subprocessCalls().forEach(s -> bullet(out, s.command()));
        }

        if (!report.reverseDependencies().isEmpty()) {
            section(out, "⬅️  REVERSE DEPENDENCIES (Files that depend on this)");
            report.reverseDependencies().forEach(d -> bullet(out, d));
        }

        if (!report.transitiveDependencies().isEmpty()) {
            section(out, "🔄 TRANSITIVE DEPENDENCIES (depth=" + report.transitiveDepth() + ")");
            report.transitiveDependencies().forEach(d -> bullet(out, d));
        }

        if (record.hasNoDependencies() && report.reverseDependencies().isEmpty()) {
            out.append("\n(no dependencies recorded)");
        }
        return out.toString();
    }

    @Override
    public String render(GraphQueryResult<?> result) {
        if (!result.isAvailable()) {
            return "❌ Graph queries unavailable: " + result.message();
        }
        return switch (result.query()) {
            case TRANSITIVE -> renderTransitive(result.subject(), (List<?>) result.value());
            case CYCLES -> renderCycles((List<?>) result.value());
            case PATH -> renderPath((List<?>) result.value());
            case STATS -> renderStats((DependencyGraph.Stats) result.value());
        };
    }

    private String renderTransitive(String subject, List<?> deps) {
        StringBuilder out = new StringBuilder("🔄 Transitive dependencies for ").append(subject).append(':');
        if (deps.isEmpty()) {
            out.append("\n  (none found)");
        }
        deps.forEach(d -> bullet(out, String.valueOf(d)));
        return out.toString();
    }

    private String renderCycles(List<?> cycles) {
        if (cycles.isEmpty()) {
            return "✅ No circular dependencies found";
        }
        StringBuilder out = new StringBuilder("⚠️  Found ")
                .append(cycles.size()).append(" circular dependencies:\n");
        int shown = 0;
        for (Object c : cycles) {
            if (shown == MAX_CYCLES_SHOWN) {
                out.append("\n  ... and ").append(cycles.size() - MAX_CYCLES_SHOWN).append(" more");
                break;
            }
            List<?> cycle = (List<?>) c;
            shown++;
            out.append("\n  ").append(shown).append(". ").append(formatCycle(cycle));
        }
        return out.toString();
    }

    private String renderPath(List<?> path) {
        return "📍 Shortest path (" + path.size() + " steps):\n   " + join(path);
    }

    private String renderStats(DependencyGraph.Stats stats) {
        return "📊 Dependency Graph Statistics:"
                + "\n  Nodes: " + stats.nodeCount()
                + "\n  Edges: " + stats.edgeCount()
                + "\n  Density: " + String.format(Locale.ROOT, "%.4f", stats.density())
                + "\n  Is DAG: " + stats.acyclic()
                + "\n  Files: " + stats.fileCount()
                + "\n  Modules: " + stats.moduleCount()
                + "\n  Connected Components: " + stats.weaklyConnectedComponents();
    }

    /**
     * Format a cycle with its first node repeated at the end.
     */
    static String formatCycle(List<?> cycle) {
        if (cycle.isEmpty()) {
            return "";
        }
        return join(cycle) + " → " + cycle.get(0);
    }

    private static String join(List<?> nodes) {
        return String.join(" → ", nodes.stream().map(String::valueOf).toList());
    }

    private static void section(StringBuilder out, String title) {
        out.append("\n\n").append(title).append('\n').append(THIN_RULE);
    }

    private static void bullet(StringBuilder out, String text) {
        out.append("\n  • ").append(text);
    }

    private static String suffix(String detail) {
        return detail == null || detail.isBlank() ? "" : " (" + detail + ")";
    }
}
