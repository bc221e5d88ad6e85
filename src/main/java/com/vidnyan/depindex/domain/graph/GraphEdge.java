package com.vidnyan.depindex.domain.graph;

/**
 * Directed dependency edge. At most one edge exists per (source, target) pair.
 */
public record GraphEdge(String source, String target, Kind kind) {

    public enum Kind {
        IMPORTS,    // import statement
        CALLS       // dotted call on a module prefix
    }
}
