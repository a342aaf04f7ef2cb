package com.phillippitts.n8nsync.exception;

/**
 * Thrown when a call to the remote n8n API fails.
 *
 * <p>{@code statusCode} is 0 when no HTTP response was received (connection refused,
 * timeout, DNS failure).
 */
public class RemoteApiException extends N8nSyncException {

    private final String operation;
    private final int statusCode;

    public RemoteApiException(String operation, int statusCode, String message) {
        super(message + " (operation: " + operation + ", status: " + statusCode + ")");
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public RemoteApiException(String operation, int statusCode, String message, Throwable cause) {
        super(message + " (operation: " + operation + ", status: " + statusCode + ")", cause);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    /**
     * Network failures and 5xx responses; the next poll or watch cycle retries naturally.
     */
    public boolean isTransient() {
        return statusCode == 0 || statusCode >= 500;
    }
}
