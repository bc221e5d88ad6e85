package com.vidnyan.depindex.adapter.out.graph;

import com.vidnyan.depindex.DepIndexProperties;
import com.vidnyan.depindex.application.port.out.GraphBackend;
import com.vidnyan.depindex.domain.graph.DependencyGraph;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import com.vidnyan.depindex.domain.model.ModulePaths;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Default graph backend: builds the in-memory {@link DependencyGraph}.
 * Disabled with {@code depindex.graph.enabled=false}.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "depindex.graph", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InMemoryGraphBackend implements GraphBackend {

    private final DepIndexProperties properties;
    private final ModulePaths paths;

    @Override
    public DependencyGraph build(Collection<DependencyRecord> records) {
        DependencyGraph.BuildOptions options =
                new DependencyGraph.BuildOptions(properties.getGraph().isIncludeCallEdges());
        return DependencyGraph.build(records, options, paths);
    }

    @Override
    public String name() {
        return "in-memory";
    }
}
