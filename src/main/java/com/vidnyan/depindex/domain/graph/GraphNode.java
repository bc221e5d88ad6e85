package com.vidnyan.depindex.domain.graph;

/**
 * A vertex of the dependency graph: an analyzed file or an imported module.
 */
public record GraphNode(String id, Kind kind) {

    public enum Kind {
        FILE,       // has a fact record
        MODULE      // only known as an import target
    }

    public boolean isFile() {
        return kind == Kind.FILE;
    }
}
