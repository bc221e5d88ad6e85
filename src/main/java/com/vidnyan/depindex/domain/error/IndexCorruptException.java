package com.vidnyan.depindex.domain.error;

import java.nio.file.Path;

/**
 * The persisted reverse index cannot be parsed.
 */
public class IndexCorruptException extends DependencyIndexException {

    public IndexCorruptException(Path indexFile, Throwable cause) {
        super("Reverse index " + indexFile + " is corrupt: " + cause.getMessage(), cause);
    }
}
