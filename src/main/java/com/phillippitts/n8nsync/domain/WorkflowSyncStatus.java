package com.phillippitts.n8nsync.domain;

/**
 * Reconciliation state of a single workflow, derived from its local hash, remote hash and
 * last-synced base hash.
 */
public enum WorkflowSyncStatus {
    EXIST_ONLY_LOCALLY,
    EXIST_ONLY_REMOTELY,
    IN_SYNC,
    MODIFIED_LOCALLY,
    MODIFIED_REMOTELY,
    DELETED_LOCALLY,
    DELETED_REMOTELY,
    CONFLICT
}
