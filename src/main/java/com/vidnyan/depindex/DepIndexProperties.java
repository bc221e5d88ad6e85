package com.vidnyan.depindex;

import com.vidnyan.depindex.domain.model.ModulePaths;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the dependency index.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "depindex")
public class DepIndexProperties {

    /**
     * Root of the analyzed project. Absolute query paths under it are made relative.
     */
    private String projectRoot = ".";

    /**
     * Directory holding the *_dependencies.json fact records, relative to the project root.
     */
    private String factsDir = "docs/memory/dependencies";

    /**
     * Persisted reverse index. Blank means _reverse_index.json inside the facts directory.
     */
    private String indexFile = "";

    /**
     * File extensions stripped when deriving module names from paths.
     */
    private List<String> sourceExtensions = new ArrayList<>(ModulePaths.DEFAULT_SOURCE_EXTENSIONS);

    private Cache cache = new Cache();

    private Graph graph = new Graph();

    private Render render = new Render();

    @Data
    public static class Cache {
        /**
         * Maximum number of fact records held in memory.
         */
        private int maxEntries = 100;
    }

    @Data
    public static class Graph {
        /**
         * Disable to run without graph queries (transitive, cycles, paths, stats).
         */
        private boolean enabled = true;

        /**
         * Also add edges for dotted function calls (json.dumps → json).
         */
        private boolean includeCallEdges = false;

        /**
         * Stop cycle enumeration after this many cycles.
         */
        private int maxCycles = 1000;
    }

    @Data
    public static class Render {
        /**
         * Maximum nodes in a diagram, the queried node included.
         */
        private int diagramMaxNodes = 10;
    }

    public Path resolvedProjectRoot() {
        return Path.of(projectRoot).toAbsolutePath().normalize();
    }

    public Path resolvedFactsDir() {
        Path dir = Path.of(factsDir);
        return dir.isAbsolute() ? dir.normalize() : resolvedProjectRoot().resolve(dir).normalize();
    }

    public Path resolvedIndexFile() {
        if (indexFile == null || indexFile.isBlank()) {
            return resolvedFactsDir().resolve("_reverse_index.json");
        }
        Path file = Path.of(indexFile);
        return file.isAbsolute() ? file.normalize() : resolvedProjectRoot().resolve(file).normalize();
    }

    public ModulePaths modulePaths() {
        return new ModulePaths(resolvedProjectRoot(), sourceExtensions);
    }
}
