package com.vidnyan.depindex.domain.error;

public class NoPathException extends DependencyIndexException {

    public NoPathException(String source, String target) {
        super("No path found from " + source + " to " + target);
    }
}
