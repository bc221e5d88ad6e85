package com.vidnyan.depindex.domain.index;

/**
 * Lifecycle of the in-memory reverse index.
 */
public enum IndexState {
    UNLOADED,   // nothing in memory yet
    LOADED,     // read from the persisted file, may predate corpus changes
    FRESH;      // built from the corpus by this process

    public boolean isAvailable() {
        return this != UNLOADED;
    }
}
