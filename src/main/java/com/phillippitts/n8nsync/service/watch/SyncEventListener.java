package com.phillippitts.n8nsync.service.watch;

import com.phillippitts.n8nsync.service.watch.event.SyncErrorEvent;
import com.phillippitts.n8nsync.service.watch.event.WorkflowStatusChangedEvent;

/**
 * Subscriber channel injected into {@link WorkflowWatcher} at construction.
 *
 * <p>Callbacks run on the thread that observed the change (poll timer, debounce timer or the
 * caller of an engine operation) and must not block.
 */
public interface SyncEventListener {

    void onStatusChanged(WorkflowStatusChangedEvent event);

    default void onError(SyncErrorEvent event) {
    }
}
