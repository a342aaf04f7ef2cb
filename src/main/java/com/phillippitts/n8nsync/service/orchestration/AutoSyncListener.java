package com.phillippitts.n8nsync.service.orchestration;

import com.phillippitts.n8nsync.exception.N8nSyncException;
import com.phillippitts.n8nsync.service.engine.SyncEngine;
import com.phillippitts.n8nsync.service.watch.event.WorkflowStatusChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;

/**
 * Reacts to status changes when {@code n8n.sync.auto-sync=true}: remote-side changes are
 * pulled, local-side changes are pushed. Conflicts and deletions are left for an explicit
 * decision.
 */
public class AutoSyncListener {

    private static final Logger LOG = LogManager.getLogger(AutoSyncListener.class);

    private final SyncEngine engine;

    public AutoSyncListener(SyncEngine engine) {
        this.engine = engine;
    }

    @Async("eventExecutor")
    @EventListener
    public void onStatusChanged(WorkflowStatusChangedEvent event) {
        try {
            switch (event.status()) {
                case EXIST_ONLY_REMOTELY, MODIFIED_REMOTELY -> engine.pull(event.workflowId());
                case EXIST_ONLY_LOCALLY -> engine.pushFile(event.filename());
                case MODIFIED_LOCALLY -> {
                    if (event.workflowId() != null) {
                        engine.push(event.workflowId());
                    }
                }
                default -> LOG.debug("Auto-sync leaves {} ({}) as {}", event.filename(), event.workflowId(),
                        event.status());
            }
        } catch (N8nSyncException e) {
            LOG.warn("Auto-sync of {} failed: {}", event.filename(), e.getMessage());
        }
    }
}
