package com.phillippitts.n8nsync.service.events;

import com.phillippitts.n8nsync.domain.WorkflowSyncStatus;
import com.phillippitts.n8nsync.exception.RemoteApiException;
import com.phillippitts.n8nsync.exception.WorkflowFileException;
import com.phillippitts.n8nsync.service.metrics.SyncMetrics;
import com.phillippitts.n8nsync.service.watch.event.SyncErrorEvent;
import com.phillippitts.n8nsync.service.watch.event.WorkflowStatusChangedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SyncEventsListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final SyncEventsListener l = new SyncEventsListener(new SyncMetrics(registry));

    @Test
    void throttlesRepeatLogs() {
        assertThat(l.shouldLog("remote-list")).isTrue();
        assertThat(l.shouldLog("remote-list")).isFalse();
        assertThat(l.shouldLog("remote-wf-1")).isTrue();
    }

    @Test
    void countsErrorsByKindEvenWhenThrottled() {
        RemoteApiException down = new RemoteApiException("list", 503, "down");
        l.onSyncError(SyncErrorEvent.of("Failed to list remote workflows", null, down));
        l.onSyncError(SyncErrorEvent.of("Failed to list remote workflows", null, down));
        l.onSyncError(SyncErrorEvent.of("Malformed workflow file a.json", null,
                new WorkflowFileException(Path.of("a.json"), "bad")));

        assertThat(registry.get("n8nsync.errors").tag("kind", "remote").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("n8nsync.errors").tag("kind", "local").counter().count()).isEqualTo(1.0);
    }

    @Test
    void handlersDoNotThrow() {
        for (WorkflowSyncStatus status : WorkflowSyncStatus.values()) {
            l.onStatusChanged(new WorkflowStatusChangedEvent("a.json", "wf-1", status, Instant.now()));
        }
        l.onSyncError(SyncErrorEvent.of("no cause", "wf-1", null));
    }
}
