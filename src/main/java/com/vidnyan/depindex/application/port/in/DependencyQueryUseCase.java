package com.vidnyan.depindex.application.port.in;

import com.vidnyan.depindex.application.render.OutputFormat;
import com.vidnyan.depindex.domain.error.GraphUnavailableException;
import com.vidnyan.depindex.domain.graph.DependencyGraph;
import com.vidnyan.depindex.domain.index.IndexState;
import com.vidnyan.depindex.domain.model.DependencyRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Primary use case: answer dependency questions about files of the analyzed corpus.
 * This is the main entry point to the application.
 */
public interface DependencyQueryUseCase {

    /**
     * Dependencies recorded for a file.
     * @throws com.vidnyan.depindex.domain.error.RecordNotFoundException if no record exists
     */
    DirectDependencies directDependencies(String filePath);

    /**
     * Files that depend on the given file, per the reverse index.
     */
    List<String> reverseDependencies(String filePath);

    GraphQueryResult<List<String>> transitiveDependencies(String filePath, int maxDepth);

    GraphQueryResult<List<List<String>>> cycles();

    GraphQueryResult<List<String>> shortestPath(String source, String target);

    GraphQueryResult<DependencyGraph.Stats> graphStats();

    /**
     * Combined view of one file: its record, optionally reverse and transitive dependencies.
     * @param transitiveDepth 0 to skip transitive dependencies
     */
    DependencyReport describe(String filePath, boolean includeReverse, int transitiveDepth);

    /**
     * Rebuild and persist the reverse index from the whole corpus.
     */
    IndexSummary rebuildIndex();

    /**
     * Delete the persisted reverse index and unload it; the next reverse query rebuilds.
     *
     * @return whether a persisted file existed
     */
    boolean deletePersistedIndex();

    /**
     * Discard the current graph and build a new one from the whole corpus.
     */
    GraphQueryResult<DependencyGraph.Stats> rebuildGraph();

    void clearCache();

    CacheStats cacheStats();

    IndexState indexState();

    String render(DependencyReport report, OutputFormat format);

    String render(GraphQueryResult<?> result, OutputFormat format);

    /**
     * Record of a single file, grouped by category.
     */
    record DirectDependencies(String filePath, DependencyRecord record) {

        public List<String> modules() {
            return record.importedModules();
        }

        /**
         * Category → plain string entries, only non-empty categories, in a fixed order.
         */
        public Map<String, List<String>> byCategory() {
            Map<String, List<String>> categories = new LinkedHashMap<>();
            put(categories, "imports", modules());
            put(categories, "function_calls", record.functionCalls().stream()
                    .map(DependencyRecord.FunctionCall::name).toList());
            put(categories, "config_files", record.configFiles().stream()
                    .map(DependencyRecord.ConfigFile::file).toList());
            put(categories, "file_reads", record.fileReads().stream()
                    .map(DependencyRecord.FileAccess::path).toList());
            put(categories, "file_writes", record.fileWrites().stream()
                    .map(DependencyRecord.FileAccess::path).toList());
            put(categories, "env_vars", record.envVars().stream()
                    .map(DependencyRecord.EnvVar::var).toList());
            put(categories, "api_calls", record.apiCalls().stream()
                    .map(a -> a.service() + ": " + a.endpoint()).toList());
            put(categories, "subprocess_calls", record.subprocessCalls().stream()
                    .map(DependencyRecord.SubprocessCall::command).toList());
            return categories;
        }

        private static void put(Map<String, List<String>> target, String key, List<String> values) {
            if (!values.isEmpty()) {
                target.put(key, values);
            }
        }
    }

    /**
     * Everything known about one file, ready for rendering.
     */
    record DependencyReport(
        String filePath,
        DependencyRecord record,
        List<String> reverseDependencies,
        List<String> transitiveDependencies,
        int transitiveDepth
    ) {
        public DependencyReport {
            reverseDependencies = reverseDependencies == null ? List.of() : List.copyOf(reverseDependencies);
            transitiveDependencies = transitiveDependencies == null ? List.of() : List.copyOf(transitiveDependencies);
        }
    }

    /**
     * Outcome of a graph query. {@code UNAVAILABLE} when no graph backend is configured.
     */
    record GraphQueryResult<T>(
        Query query,
        String subject,
        Status status,
        T value,
        String message
    ) {

        public enum Query {
            TRANSITIVE,
            CYCLES,
            PATH,
            STATS
        }

        public enum Status {
            SUCCESS,
            UNAVAILABLE
        }

        public static <T> GraphQueryResult<T> success(Query query, String subject, T value) {
            return new GraphQueryResult<>(query, subject, Status.SUCCESS, value, null);
        }

        public static <T> GraphQueryResult<T> unavailable(Query query, String subject, String reason) {
            return new GraphQueryResult<>(query, subject, Status.UNAVAILABLE, null, reason);
        }

        public boolean isAvailable() {
            return status == Status.SUCCESS;
        }

        /**
         * The value, or {@link GraphUnavailableException} for callers that prefer exceptions.
         */
        public T orThrow() {
            if (!isAvailable()) {
                throw new GraphUnavailableException(message);
            }
            return value;
        }
    }

    /**
     * Result of an index rebuild.
     */
    record IndexSummary(
        int symbolCount,
        int fileCount,
        IndexState state,
        String location,
        long durationMs
    ) {}

    /**
     * Record cache statistics. {@code hitRate} is a percentage.
     */
    record CacheStats(
        long hits,
        long misses,
        double hitRate,
        int size,
        int maxSize,
        double totalLoadTimeMs
    ) {}
}
