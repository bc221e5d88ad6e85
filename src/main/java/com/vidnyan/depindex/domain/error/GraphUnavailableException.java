package com.vidnyan.depindex.domain.error;

/**
 * Graph queries were requested but no graph backend is configured.
 */
public class GraphUnavailableException extends DependencyIndexException {

    public GraphUnavailableException(String message) {
        super(message);
    }
}
