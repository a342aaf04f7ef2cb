package com.phillippitts.n8nsync.exception;

import java.nio.file.Path;

/**
 * Thrown when the last-synced state file cannot be written. Reading never throws: a missing
 * or corrupt file is treated as an empty state.
 */
public class SyncStateException extends N8nSyncException {

    private final Path stateFile;

    public SyncStateException(Path stateFile, Throwable cause) {
        super("Failed to persist sync state: " + stateFile, cause);
        this.stateFile = stateFile;
    }

    public Path getStateFile() {
        return stateFile;
    }
}
