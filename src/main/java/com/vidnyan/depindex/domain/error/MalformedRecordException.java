package com.vidnyan.depindex.domain.error;

import java.nio.file.Path;

/**
 * A fact record file exists but cannot be parsed.
 */
public class MalformedRecordException extends DependencyIndexException {

    private final Path source;

    public MalformedRecordException(Path source, Throwable cause) {
        super("Malformed dependency record " + source + ": " + cause.getMessage(), cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
