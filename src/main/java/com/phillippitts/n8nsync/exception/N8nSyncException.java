package com.phillippitts.n8nsync.exception;

/**
 * Base exception for all n8n-sync application errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class N8nSyncException extends RuntimeException {

    public N8nSyncException(String message) {
        super(message);
    }

    public N8nSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
