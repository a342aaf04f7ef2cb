package com.phillippitts.n8nsync.service.events;

import com.phillippitts.n8nsync.domain.WorkflowSyncStatus;
import com.phillippitts.n8nsync.exception.RemoteApiException;
import com.phillippitts.n8nsync.service.metrics.SyncMetrics;
import com.phillippitts.n8nsync.service.watch.event.SyncErrorEvent;
import com.phillippitts.n8nsync.service.watch.event.WorkflowStatusChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central log sink for watcher notifications. Errors are throttled per key to one line a
 * minute so a dead remote does not flood the log every poll.
 */
@Component
class SyncEventsListener {
    private static final Logger LOG = LogManager.getLogger(SyncEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final SyncMetrics metrics;

    SyncEventsListener(SyncMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onSyncError(SyncErrorEvent e) {
        boolean remote = e.cause() instanceof RemoteApiException;
        metrics.incrementObservationError(remote ? "remote" : "local");
        String key = (remote ? "remote-" : "local-") + (e.workflowId() == null ? e.message() : e.workflowId());
        if (shouldLog(key)) {
            String cause = e.cause() == null ? "" : e.cause().getMessage();
            LOG.warn("Sync error: {} {}", e.message(), cause);
        }
    }

    @EventListener
    void onStatusChanged(WorkflowStatusChangedEvent e) {
        if (e.status() == WorkflowSyncStatus.CONFLICT) {
            LOG.warn("Conflict: {} ({}) changed both locally and remotely; resolve with force-pull or force-push",
                    e.filename(), e.workflowId());
        } else if (e.status() == WorkflowSyncStatus.DELETED_LOCALLY) {
            LOG.info("{} ({}) deleted locally; remote copy archived, awaiting delete confirmation",
                    e.filename(), e.workflowId());
        } else {
            LOG.info("{} ({}) is now {}", e.filename(), e.workflowId(), e.status());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
