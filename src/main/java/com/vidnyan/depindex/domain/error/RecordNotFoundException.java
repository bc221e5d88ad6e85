package com.vidnyan.depindex.domain.error;

/**
 * No fact record exists for the requested file.
 */
public class RecordNotFoundException extends DependencyIndexException {

    private final String filePath;

    public RecordNotFoundException(String filePath) {
        super("No dependency record found for: " + filePath);
        this.filePath = filePath;
    }

    public String filePath() {
        return filePath;
    }
}
