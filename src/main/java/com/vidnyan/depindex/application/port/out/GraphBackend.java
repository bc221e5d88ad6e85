package com.vidnyan.depindex.application.port.out;

import com.vidnyan.depindex.domain.graph.DependencyGraph;
import com.vidnyan.depindex.domain.model.DependencyRecord;

import java.util.Collection;

/**
 * Optional capability that turns fact records into a dependency graph.
 * When no backend is configured, graph queries report themselves unavailable.
 */
public interface GraphBackend {

    DependencyGraph build(Collection<DependencyRecord> records);

    String name();
}
