package com.phillippitts.n8nsync.service.watch;

import com.phillippitts.n8nsync.domain.WorkflowSyncStatus;

import java.util.Objects;

/**
 * Three-way status derivation from the local hash (L), the remote hash (R) and the
 * last-synced base hash (B). Any of the three may be null.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>L only: {@code EXIST_ONLY_LOCALLY}</li>
 *   <li>R only: {@code EXIST_ONLY_REMOTELY}</li>
 *   <li>L equals R: {@code IN_SYNC} (the base is irrelevant)</li>
 *   <li>with a base:
 *     <ul>
 *       <li>no L and R equals B: {@code DELETED_LOCALLY}</li>
 *       <li>no R and L equals B: {@code DELETED_REMOTELY}</li>
 *       <li>otherwise compare each side to B: both changed is {@code CONFLICT}, one side
 *           changed names that side</li>
 *     </ul>
 *   </li>
 *   <li>anything else: {@code CONFLICT}</li>
 * </ol>
 *
 * <p>A missing local file counts as a local change against the base.
 */
public final class StatusCalculator {

    private StatusCalculator() {
    }

    public static WorkflowSyncStatus derive(String localHash, String remoteHash, String baseHash) {
        boolean hasLocal = localHash != null;
        boolean hasRemote = remoteHash != null;
        boolean hasBase = baseHash != null;

        if (hasLocal && !hasBase && !hasRemote) {
            return WorkflowSyncStatus.EXIST_ONLY_LOCALLY;
        }
        if (hasRemote && !hasBase && !hasLocal) {
            return WorkflowSyncStatus.EXIST_ONLY_REMOTELY;
        }
        if (hasLocal && localHash.equals(remoteHash)) {
            return WorkflowSyncStatus.IN_SYNC;
        }
        if (hasBase) {
            if (!hasLocal && baseHash.equals(remoteHash)) {
                return WorkflowSyncStatus.DELETED_LOCALLY;
            }
            if (!hasRemote && baseHash.equals(localHash)) {
                return WorkflowSyncStatus.DELETED_REMOTELY;
            }
            boolean localModified = !Objects.equals(localHash, baseHash);
            boolean remoteModified = hasRemote && !remoteHash.equals(baseHash);
            if (localModified && remoteModified) {
                return WorkflowSyncStatus.CONFLICT;
            }
            if (localModified) {
                return WorkflowSyncStatus.MODIFIED_LOCALLY;
            }
            if (remoteModified) {
                return WorkflowSyncStatus.MODIFIED_REMOTELY;
            }
        }
        return WorkflowSyncStatus.CONFLICT;
    }
}
