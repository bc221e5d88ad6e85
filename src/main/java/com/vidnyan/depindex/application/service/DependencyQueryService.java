package com.vidnyan.depindex.application.service;

import com.vidnyan.depindex.DepIndexProperties;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase;
import com.vidnyan.depindex.application.port.out.FactSource;
import com.vidnyan.depindex.application.port.out.GraphBackend;
import com.vidnyan.depindex.application.render.OutputFormat;
import com.vidnyan.depindex.application.render.ReportRenderer;
import com.vidnyan.depindex.application.support.SingleFlight;
import com.vidnyan.depindex.domain.graph.DependencyGraph;
import com.vidnyan.depindex.domain.index.IndexState;
import com.vidnyan.depindex.domain.index.ReverseIndex;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import com.vidnyan.depindex.domain.model.ModulePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.GraphQueryResult.Query;

/**
 * Main application service answering dependency queries.
 * <p>
 * Direct queries go to the record cache only. Reverse queries load or build the reverse
 * index on first use. Graph queries build the dependency graph once, on first use, and
 * reuse it until {@link #rebuildGraph()} is called; without a graph backend they return
 * an {@code UNAVAILABLE} result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DependencyQueryService implements DependencyQueryUseCase {

    static final String GRAPH_UNAVAILABLE =
            "no graph backend configured (set depindex.graph.enabled=true)";

    private final RecordStore recordStore;
    private final ReverseIndexManager reverseIndex;
    private final FactSource factSource;
    private final Optional<GraphBackend> graphBackend;
    private final List<ReportRenderer> renderers;
    private final DepIndexProperties properties;
    private final ModulePaths paths;

    private final AtomicReference<PublishedGraph> graph = new AtomicReference<>();
    private final AtomicLong graphGenerations = new AtomicLong();
    private final SingleFlight<DependencyGraph> graphFlight = new SingleFlight<>();
    private final SingleFlight<DependencyGraph> rebuildFlight = new SingleFlight<>();

    @Override
    public DirectDependencies directDependencies(String filePath) {
        DependencyRecord record = recordStore.load(filePath);
        return new DirectDependencies(paths.normalize(filePath), record);
    }

    @Override
    public List<String> reverseDependencies(String filePath) {
        return reverseIndex.lookup(filePath);
    }

    @Override
    public GraphQueryResult<List<String>> transitiveDependencies(String filePath, int maxDepth) {
        return withGraph(Query.TRANSITIVE, filePath, g -> g.transitiveClosure(filePath, maxDepth));
    }

    @Override
    public GraphQueryResult<List<List<String>>> cycles() {
        return withGraph(Query.CYCLES, "*", g -> {
            List<List<String>> cycles = g.findCycles(properties.getGraph().getMaxCycles());
            if (cycles.isEmpty()) {
                log.info("No circular dependencies found");
            } else {
                log.warn("Found {} circular dependencies", cycles.size());
            }
            return cycles;
        });
    }

    @Override
    public GraphQueryResult<List<String>> shortestPath(String source, String target) {
        return withGraph(Query.PATH, source + " → " + target, g -> g.shortestPath(source, target));
    }

    @Override
    public GraphQueryResult<DependencyGraph.Stats> graphStats() {
        return withGraph(Query.STATS, "*", DependencyGraph::stats);
    }

    @Override
    public DependencyReport describe(String filePath, boolean includeReverse, int transitiveDepth) {
        DependencyRecord record = recordStore.load(filePath);
        List<String> reverse = includeReverse ? reverseDependencies(filePath) : List.of();

        List<String> transitive = List.of();
        if (transitiveDepth > 0) {
            GraphQueryResult<List<String>> result = transitiveDependencies(filePath, transitiveDepth);
            if (result.isAvailable()) {
                transitive = result.value();
            }
        }
        return new DependencyReport(paths.normalize(filePath), record, reverse, transitive, transitiveDepth);
    }

    @Override
    public IndexSummary rebuildIndex() {
        long start = System.currentTimeMillis();
        ReverseIndex rebuilt = reverseIndex.buildFull();
        return new IndexSummary(
                rebuilt.symbolCount(),
                rebuilt.fileCount(),
                reverseIndex.state(),
                reverseIndex.location(),
                System.currentTimeMillis() - start
        );
    }

    @Override
    public boolean deletePersistedIndex() {
        return reverseIndex.deletePersisted();
    }

    @Override
    public GraphQueryResult<DependencyGraph.Stats> rebuildGraph() {
        if (graphBackend.isEmpty()) {
            return GraphQueryResult.unavailable(Query.STATS, "*", GRAPH_UNAVAILABLE);
        }
        DependencyGraph rebuilt = rebuildFlight.execute(this::buildGraph);
        return GraphQueryResult.success(Query.STATS, "*", rebuilt.stats());
    }

    @Override
    public void clearCache() {
        recordStore.clear();
    }

    @Override
    public CacheStats cacheStats() {
        return recordStore.stats();
    }

    @Override
    public IndexState indexState() {
        return reverseIndex.state();
    }

    @Override
    public String render(DependencyReport report, OutputFormat format) {
        return findRenderer(format).render(report);
    }

    @Override
    public String render(GraphQueryResult<?> result, OutputFormat format) {
        return findRenderer(format).render(result);
    }

    /**
     * Whether graph queries can be answered at all.
     */
    public boolean isGraphAvailable() {
        return graphBackend.isPresent();
    }

    private <T> GraphQueryResult<T> withGraph(Query query, String subject, Function<DependencyGraph, T> action) {
        Optional<DependencyGraph> built = ensureGraph();
        if (built.isEmpty()) {
            log.warn("Graph query {} skipped: {}", query, GRAPH_UNAVAILABLE);
            return GraphQueryResult.unavailable(query, subject, GRAPH_UNAVAILABLE);
        }
        return GraphQueryResult.success(query, subject, action.apply(built.get()));
    }

    private Optional<DependencyGraph> ensureGraph() {
        if (graphBackend.isEmpty()) {
            return Optional.empty();
        }
        PublishedGraph current = graph.get();
        if (current != null) {
            return Optional.of(current.graph());
        }
        return Optional.of(graphFlight.execute(() -> {
            PublishedGraph builtMeanwhile = graph.get();
            return builtMeanwhile != null ? builtMeanwhile.graph() : buildGraph();
        }));
    }

    private DependencyGraph buildGraph() {
        GraphBackend backend = graphBackend.orElseThrow();
        log.info("Building dependency graph ({})...", backend.name());
        long start = System.currentTimeMillis();
        long generation = graphGenerations.incrementAndGet();

        List<DependencyRecord> records = factSource.readAll();
        DependencyGraph built = backend.build(records);
        // a build that started later has already published a newer graph
        graph.accumulateAndGet(new PublishedGraph(generation, built),
                (current, next) -> current == null || next.generation() > current.generation() ? next : current);

        log.info("Dependency graph built: {} nodes, {} edges from {} files in {}ms",
                built.nodes().size(), built.edges().size(), records.size(),
                System.currentTimeMillis() - start);
        return built;
    }

    private ReportRenderer findRenderer(OutputFormat format) {
        return renderers.stream()
                .filter(r -> r.format() == format)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No renderer for format " + format));
    }

    private record PublishedGraph(long generation, DependencyGraph graph) {
    }
}
