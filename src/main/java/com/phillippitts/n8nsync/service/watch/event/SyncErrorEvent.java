package com.phillippitts.n8nsync.service.watch.event;

import java.time.Instant;

/**
 * Published when observation or synchronization fails. State is left as it was; the next
 * poll or watch cycle retries naturally.
 *
 * @param message human-readable description
 * @param workflowId affected workflow, null when the failure is not specific to one
 * @param cause underlying exception, may be null
 * @param at when the failure happened
 */
public record SyncErrorEvent(String message, String workflowId, Throwable cause, Instant at) {

    public static SyncErrorEvent of(String message, String workflowId, Throwable cause) {
        return new SyncErrorEvent(message, workflowId, cause, Instant.now());
    }
}
