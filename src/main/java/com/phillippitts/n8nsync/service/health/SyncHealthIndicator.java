package com.phillippitts.n8nsync.service.health;

import com.phillippitts.n8nsync.domain.WorkflowStatus;
import com.phillippitts.n8nsync.domain.WorkflowSyncStatus;
import com.phillippitts.n8nsync.service.remote.N8nApiClient;
import com.phillippitts.n8nsync.service.watch.WorkflowWatcher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health of the sync service.
 *
 * <ul>
 *   <li>UP: remote reachable, no conflicts</li>
 *   <li>DEGRADED: remote reachable, but conflicts wait for manual resolution</li>
 *   <li>DOWN: remote unreachable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class SyncHealthIndicator implements HealthIndicator {

    private final N8nApiClient client;
    private final WorkflowWatcher watcher;

    public SyncHealthIndicator(N8nApiClient client, WorkflowWatcher watcher) {
        this.client = client;
        this.watcher = watcher;
    }

    @Override
    public Health health() {
        boolean reachable = client.testConnection();

        Health.Builder builder = reachable ? new Health.Builder().up() : new Health.Builder().down();
        builder.withDetail("remote", reachable ? "reachable" : "unreachable")
                .withDetail("watching", watcher.isRunning());

        if (watcher.isRemoteStateKnown()) {
            List<WorkflowStatus> matrix = watcher.getStatusMatrix();
            long conflicts = count(matrix, WorkflowSyncStatus.CONFLICT);
            long pendingDeletions = count(matrix, WorkflowSyncStatus.DELETED_LOCALLY)
                    + count(matrix, WorkflowSyncStatus.DELETED_REMOTELY);
            builder.withDetail("workflows", matrix.size())
                    .withDetail("conflicts", conflicts)
                    .withDetail("pendingDeletions", pendingDeletions);
            if (reachable && conflicts > 0) {
                builder.status("DEGRADED");
            }
        }
        return builder.build();
    }

    private static long count(List<WorkflowStatus> matrix, WorkflowSyncStatus status) {
        return matrix.stream().filter(s -> s.status() == status).count();
    }
}
