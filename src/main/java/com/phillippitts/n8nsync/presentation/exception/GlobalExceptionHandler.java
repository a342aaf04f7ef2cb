package com.phillippitts.n8nsync.presentation.exception;

import com.phillippitts.n8nsync.exception.RemoteApiException;
import com.phillippitts.n8nsync.exception.SyncStateException;
import com.phillippitts.n8nsync.exception.WorkflowFileException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the control API.
 *
 * Converts sync exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Remote failure: 404 when the workflow does not exist, 502 otherwise.
     */
    @ExceptionHandler(RemoteApiException.class)
    ResponseEntity<ApiError> handleRemoteFailure(RemoteApiException ex) {
        if (ex.isNotFound()) {
            LOG.warn("Remote workflow not found: operation={}", ex.getOperation());
            return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiError(
                    ex.getClass().getSimpleName(),
                    "Workflow not found on the n8n instance",
                    ex.getMessage(),
                    Instant.now()
                ));
        }
        LOG.error("Remote call failed: operation={}, status={}", ex.getOperation(), ex.getStatusCode());
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "n8n instance unavailable or rejected the request",
                ex.isTransient() ? "Please retry; the next poll retries automatically" : ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Local file missing or malformed (HTTP 422).
     */
    @ExceptionHandler(WorkflowFileException.class)
    ResponseEntity<ApiError> handleWorkflowFile(WorkflowFileException ex) {
        LOG.warn("Workflow file problem: {}", ex.getMessage());
        String file = ex.getPath() == null || ex.getPath().getFileName() == null
            ? "" : ex.getPath().getFileName().toString();
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Local workflow file is missing or not valid JSON",
                file,
                Instant.now()
            ));
    }

    /**
     * State file could not be written (HTTP 500).
     */
    @ExceptionHandler(SyncStateException.class)
    ResponseEntity<ApiError> handleSyncState(SyncStateException ex) {
        LOG.error("Sync state could not be persisted", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Sync state could not be saved",
                "Check permissions of the workflow directory",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
