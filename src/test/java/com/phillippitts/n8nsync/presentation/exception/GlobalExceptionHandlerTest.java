package com.phillippitts.n8nsync.presentation.exception;

import com.phillippitts.n8nsync.exception.RemoteApiException;
import com.phillippitts.n8nsync.exception.SyncStateException;
import com.phillippitts.n8nsync.exception.WorkflowFileException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesMissingRemoteWorkflowReturns404() {
        ResponseEntity<?> response = handler.handleRemoteFailure(new RemoteApiException("get", 404, "Not found"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString()).contains("RemoteApiException", "Workflow not found");
    }

    @Test
    void verifiesRemoteFailureReturns502() {
        ResponseEntity<?> response = handler.handleRemoteFailure(new RemoteApiException("list", 503, "down"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().toString()).contains("Please retry");
    }

    @Test
    void verifiesRejectedRequestKeepsRemoteMessage() {
        ResponseEntity<?> response = handler.handleRemoteFailure(
                new RemoteApiException("update", 400, "Request failed: bad nodes"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().toString()).contains("bad nodes");
    }

    @Test
    void verifiesWorkflowFileProblemReturns422WithoutFullPath() {
        WorkflowFileException ex = new WorkflowFileException(Path.of("/secret/dir/Orders.json"), "Malformed");

        ResponseEntity<?> response = handler.handleWorkflowFile(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().toString()).contains("Orders.json").doesNotContain("/secret/dir");
    }

    @Test
    void verifiesStateFailureReturns500() {
        ResponseEntity<?> response = handler.handleSyncState(
                new SyncStateException(Path.of(".n8n-state.json"), new IOException("read-only")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("SyncStateException");
    }

    @Test
    void verifiesUnexpectedErrorDoesNotLeakDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("internal secret"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("InternalServerError", "timestamp")
                .doesNotContain("internal secret");
    }
}
