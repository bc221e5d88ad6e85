package com.vidnyan.depindex.adapter.in.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.CacheStats;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.DependencyReport;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.GraphQueryResult;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.IndexSummary;
import com.vidnyan.depindex.application.render.OutputFormat;
import com.vidnyan.depindex.domain.error.DependencyIndexException;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CLI Runner for dependency queries.
 * The first non-option argument is the command; results go to stdout (or {@code --output}),
 * diagnostics to stderr.
 */
@Slf4j
@Component
public class DependencyCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_QUERY_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = """
            Usage: depindex <command> [arguments] [options]

            Commands:
              query-direct <file>              dependencies recorded for a file
              query-reverse <file>             files that depend on a file
              query-transitive <file>          dependencies up to --depth hops away
              query-cycles                     circular dependencies
              query-path <source> <target>     shortest dependency path
              query-stats                      dependency graph statistics
              rebuild-index [--clean]          rebuild and persist the reverse index
              rebuild-graph                    rebuild the dependency graph
              clear-cache                      empty the record cache
              get-cache-stats                  record cache statistics

            Options:
              --format=text|structured|diagram (default text)
              --depth=N                        transitive depth (default 3)
              --reverse                        include reverse dependencies in query-direct
              --stats                          append cache statistics
              --clean                          delete the persisted index before rebuild-index
              --output=<file>                  write the result to a file""";

    private final DependencyQueryUseCase queries;
    private final ObjectMapper json;
    private final PrintStream out;
    private final PrintStream err;

    private volatile int exitCode = EXIT_OK;

    @Autowired
    public DependencyCliRunner(DependencyQueryUseCase queries, ObjectMapper objectMapper) {
        this(queries, objectMapper, System.out, System.err);
    }

    DependencyCliRunner(DependencyQueryUseCase queries, ObjectMapper objectMapper, PrintStream out, PrintStream err) {
        this.queries = queries;
        this.json = objectMapper.copy().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Run one command and return its exit status.
     */
    int execute(String... args) {
        Invocation invocation;
        try {
            invocation = Invocation.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("❌ " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (invocation.command() == null) {
            log.info("No command specified.");
            log.info(USAGE);
            return EXIT_OK;
        }

        log.debug("Running {} {}", invocation.command(), invocation.operands());
        try {
            Outcome outcome = dispatch(invocation);
            String text = outcome.text();
            if (invocation.stats()) {
                text += "\n\n📊 Cache Statistics:\n" + toJson(queries.cacheStats());
            }
            emit(text, invocation.output());
            return outcome.success() ? EXIT_OK : EXIT_QUERY_FAILED;
        } catch (UsageException e) {
            err.println("❌ " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (DependencyIndexException e) {
            err.println("❌ " + e.getMessage());
            return EXIT_QUERY_FAILED;
        } catch (UncheckedIOException e) {
            log.error("I/O failure while running {}", invocation.command(), e);
            err.println("❌ " + e.getMessage());
            return EXIT_QUERY_FAILED;
        }
    }

    private Outcome dispatch(Invocation inv) {
        OutputFormat format = inv.format();
        if (inv.clean() && !"rebuild-index".equals(inv.command())) {
            throw new UsageException("--clean only applies to rebuild-index");
        }
        return switch (inv.command()) {
            case "query-direct" -> {
                DependencyReport report = queries.describe(inv.operand(0, "file"), inv.reverse(), 0);
                yield Outcome.ok(queries.render(report, format));
            }
            case "query-reverse" -> Outcome.ok(reverse(inv.operand(0, "file"), format));
            case "query-transitive" -> graph(queries.transitiveDependencies(inv.operand(0, "file"), inv.depth()), format);
            case "query-cycles" -> graph(queries.cycles(), format);
            case "query-path" -> graph(queries.shortestPath(inv.operand(0, "source"), inv.operand(1, "target")), format);
            case "query-stats" -> graph(queries.graphStats(), format);
            case "rebuild-index" -> Outcome.ok(rebuildIndex(format, inv.clean()));
            case "rebuild-graph" -> graph(queries.rebuildGraph(), format);
            case "clear-cache" -> {
                queries.clearCache();
                yield Outcome.ok("✅ Cache cleared");
            }
            case "get-cache-stats" -> Outcome.ok(format == OutputFormat.TEXT
                    ? "📊 Cache Statistics:\n" + toJson(queries.cacheStats())
                    : toJson(queries.cacheStats()));
            default -> throw new UsageException("Unknown command: " + inv.command());
        };
    }

    private Outcome graph(GraphQueryResult<?> result, OutputFormat format) {
        String rendered = queries.render(result, format);
        if (!result.isAvailable()) {
            err.println("❌ " + result.message());
            return new Outcome(rendered, false);
        }
        return Outcome.ok(rendered);
    }

    private String reverse(String file, OutputFormat format) {
        List<String> dependents = queries.reverseDependencies(file);
        if (format == OutputFormat.TEXT) {
            StringBuilder text = new StringBuilder("⬅️  Files that depend on ").append(file)
                    .append(" (").append(dependents.size()).append("):");
            if (dependents.isEmpty()) {
                text.append("\n  (none found)");
            }
            dependents.forEach(d -> text.append("\n  • ").append(d));
            return text.toString();
        }
        // the queried file need not have a record of its own
        DependencyReport report = new DependencyReport(
                file, DependencyRecord.builder(file).build(), dependents, List.of(), 0);
        return queries.render(report, format);
    }

    private String rebuildIndex(OutputFormat format, boolean clean) {
        boolean deleted = clean && queries.deletePersistedIndex();
        IndexSummary summary = queries.rebuildIndex();
        if (format == OutputFormat.TEXT) {
            return (deleted ? "🗑️  Deleted previous index\n" : "")
                    + "✅ Reverse index rebuilt: " + summary.symbolCount() + " symbols, "
                    + summary.fileCount() + " files (" + summary.durationMs() + "ms)"
                    + "\n   Saved to: " + summary.location();
        }
        return toJson(summary);
    }

    private void emit(String text, Path output) {
        if (output == null) {
            out.println(text);
            return;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, text + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + output, e);
        }
        out.println("✅ Output written to " + output);
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value instanceof CacheStats stats ? cacheStatsView(stats) : value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Map<String, Object> cacheStatsView(CacheStats stats) {
        return Map.of(
                "hits", stats.hits(),
                "misses", stats.misses(),
                "hit_rate", String.format(Locale.ROOT, "%.1f%%", stats.hitRate()),
                "size", stats.size(),
                "max_size", stats.maxSize(),
                "total_load_time_ms", Math.round(stats.totalLoadTimeMs() * 100) / 100.0
        );
    }

    private record Outcome(String text, boolean success) {
        static Outcome ok(String text) {
            return new Outcome(text, true);
        }
    }

    /**
     * Bad command line: unknown command or option, missing operand.
     */
    static final class UsageException extends IllegalArgumentException {
        UsageException(String message) {
            super(message);
        }
    }

    /**
     * Parsed command line.
     */
    record Invocation(
        String command,
        List<String> operands,
        OutputFormat format,
        int depth,
        boolean reverse,
        boolean stats,
        boolean clean,
        Path output
    ) {
        static final int DEFAULT_DEPTH = 3;

        static Invocation parse(String... args) {
            String command = null;
            List<String> operands = new ArrayList<>();
            OutputFormat format = OutputFormat.TEXT;
            int depth = DEFAULT_DEPTH;
            boolean reverse = false;
            boolean stats = false;
            boolean clean = false;
            Path output = null;

            for (String arg : args) {
                if (arg.startsWith("--")) {
                    String name = arg.contains("=") ? arg.substring(2, arg.indexOf('=')) : arg.substring(2);
                    String value = arg.contains("=") ? arg.substring(arg.indexOf('=') + 1) : null;
                    switch (name) {
                        case "format" -> format = OutputFormat.parse(required(name, value));
                        case "depth" -> depth = parseDepth(required(name, value));
                        case "reverse" -> reverse = true;
                        case "stats" -> stats = true;
                        case "clean" -> clean = true;
                        case "output" -> output = Path.of(required(name, value));
                        default -> {
                            // other --key=value pairs are Spring property overrides
                            if (value == null) {
                                throw new UsageException("Unknown option: " + arg);
                            }
                        }
                    }
                } else if (command == null) {
                    command = arg;
                } else {
                    operands.add(arg);
                }
            }
            return new Invocation(command, List.copyOf(operands), format, depth, reverse, stats, clean, output);
        }

        String operand(int index, String name) {
            if (index >= operands.size()) {
                throw new UsageException(command + ": missing <" + name + ">");
            }
            return operands.get(index);
        }

        private static String required(String option, String value) {
            if (value == null || value.isBlank()) {
                throw new UsageException("--" + option + " requires a value");
            }
            return value;
        }

        private static int parseDepth(String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new UsageException("--depth must be a number: " + value);
            }
        }
    }
}
