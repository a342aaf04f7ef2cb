package com.phillippitts.n8nsync.domain;

/**
 * Point-in-time status of one workflow. Computed on demand, never persisted.
 *
 * @param filename local filename (derived from the name when no file exists yet)
 * @param workflowId remote id, null for a local file that was never pushed
 * @param localHash canonical hash of the local file, null when absent
 * @param remoteHash canonical hash of the remote workflow, null when absent
 * @param status derived sync status
 */
public record WorkflowStatus(
        String filename,
        String workflowId,
        String localHash,
        String remoteHash,
        WorkflowSyncStatus status
) {
}
