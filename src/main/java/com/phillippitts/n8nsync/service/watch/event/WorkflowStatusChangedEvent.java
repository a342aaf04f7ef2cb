package com.phillippitts.n8nsync.service.watch.event;

import com.phillippitts.n8nsync.domain.WorkflowSyncStatus;

import java.time.Instant;

/**
 * Published when the derived status of a workflow differs from the last one broadcast.
 *
 * @param filename local filename, null when neither a file nor a name is known
 * @param workflowId remote id, null for a never-pushed local file
 * @param status new status
 * @param at when the change was observed
 */
public record WorkflowStatusChangedEvent(String filename, String workflowId, WorkflowSyncStatus status, Instant at) {
}
