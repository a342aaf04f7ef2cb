package com.phillippitts.n8nsync.exception;

import java.nio.file.Path;

/**
 * Thrown when a local workflow file is missing, unreadable or not valid JSON.
 */
public class WorkflowFileException extends N8nSyncException {

    private final Path path;

    public WorkflowFileException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public WorkflowFileException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
