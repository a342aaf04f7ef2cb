package com.phillippitts.n8nsync.service.health;

import com.phillippitts.n8nsync.domain.WorkflowStatus;
import com.phillippitts.n8nsync.domain.WorkflowSyncStatus;
import com.phillippitts.n8nsync.service.remote.N8nApiClient;
import com.phillippitts.n8nsync.service.watch.WorkflowWatcher;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SyncHealthIndicatorTest {

    private final N8nApiClient client = mock(N8nApiClient.class);
    private final WorkflowWatcher watcher = mock(WorkflowWatcher.class);
    private final SyncHealthIndicator indicator = new SyncHealthIndicator(client, watcher);

    private static WorkflowStatus row(String file, WorkflowSyncStatus status) {
        return new WorkflowStatus(file, "id-" + file, "l", "r", status);
    }

    @Test
    void upWhenReachableWithoutConflicts() {
        when(client.testConnection()).thenReturn(true);
        when(watcher.isRunning()).thenReturn(true);
        when(watcher.isRemoteStateKnown()).thenReturn(true);
        when(watcher.getStatusMatrix()).thenReturn(List.of(
                row("a.json", WorkflowSyncStatus.IN_SYNC),
                row("b.json", WorkflowSyncStatus.DELETED_REMOTELY)));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("remote", "reachable")
                .containsEntry("watching", true)
                .containsEntry("workflows", 2)
                .containsEntry("conflicts", 0L)
                .containsEntry("pendingDeletions", 1L);
    }

    @Test
    void degradedWhenConflictsWait() {
        when(client.testConnection()).thenReturn(true);
        when(watcher.isRemoteStateKnown()).thenReturn(true);
        when(watcher.getStatusMatrix()).thenReturn(List.of(row("a.json", WorkflowSyncStatus.CONFLICT)));

        assertThat(indicator.health().getStatus().getCode()).isEqualTo("DEGRADED");
    }

    @Test
    void downWhenRemoteUnreachable() {
        when(client.testConnection()).thenReturn(false);
        when(watcher.isRemoteStateKnown()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("remote", "unreachable");
        verify(watcher, never()).getStatusMatrix();
    }
}
