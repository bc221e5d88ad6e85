package com.vidnyan.depindex.domain.error;

public class NodeNotFoundException extends DependencyIndexException {

    private final String node;

    public NodeNotFoundException(String node) {
        super("Node not found in dependency graph: " + node);
        this.node = node;
    }

    public String node() {
        return node;
    }
}
