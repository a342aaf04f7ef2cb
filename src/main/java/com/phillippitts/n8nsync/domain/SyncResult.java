package com.phillippitts.n8nsync.domain;

/**
 * Outcome of one sync engine operation.
 *
 * @param workflowId the workflow id after the operation (differs from the requested id when
 *                   the workflow was re-created on the remote)
 * @param filename local filename operated on
 * @param action what was done
 */
public record SyncResult(String workflowId, String filename, SyncAction action) {

    public static SyncResult of(String workflowId, String filename, SyncAction action) {
        return new SyncResult(workflowId, filename, action);
    }

    public boolean changedSomething() {
        return action != SyncAction.SKIPPED
                && action != SyncAction.REFUSED_CONFLICT
                && action != SyncAction.AWAITING_DELETE_CONFIRMATION;
    }
}
