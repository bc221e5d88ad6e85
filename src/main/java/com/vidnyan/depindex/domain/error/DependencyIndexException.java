package com.vidnyan.depindex.domain.error;

/**
 * Base type for all failures raised by the dependency index.
 */
public class DependencyIndexException extends RuntimeException {

    public DependencyIndexException(String message) {
        super(message);
    }

    public DependencyIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
