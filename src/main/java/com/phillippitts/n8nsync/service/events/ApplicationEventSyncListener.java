package com.phillippitts.n8nsync.service.events;

import com.phillippitts.n8nsync.service.watch.SyncEventListener;
import com.phillippitts.n8nsync.service.watch.event.SyncErrorEvent;
import com.phillippitts.n8nsync.service.watch.event.WorkflowStatusChangedEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Republishes watcher notifications on the Spring event bus so {@code @EventListener}
 * components can react to them.
 */
public class ApplicationEventSyncListener implements SyncEventListener {

    private final ApplicationEventPublisher publisher;

    public ApplicationEventSyncListener(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void onStatusChanged(WorkflowStatusChangedEvent event) {
        publisher.publishEvent(event);
    }

    @Override
    public void onError(SyncErrorEvent event) {
        publisher.publishEvent(event);
    }
}
