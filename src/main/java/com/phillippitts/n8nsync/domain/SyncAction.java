package com.phillippitts.n8nsync.domain;

/**
 * What a sync engine call actually did.
 */
public enum SyncAction {
    PULLED,
    PUSHED,
    CREATED,
    RECREATED,
    ARCHIVED,
    REMOTE_DELETED,
    ACTIVATION_CHANGED,
    RESTORED,
    /** Base of a deleted workflow was dropped. */
    DELETION_CONFIRMED,
    /** Status did not call for an action in the requested direction. */
    SKIPPED,
    /** Both sides diverged; only a forced operation may proceed. */
    REFUSED_CONFLICT,
    /** Local file was deleted; remote deletion needs an explicit confirmation call. */
    AWAITING_DELETE_CONFIRMATION
}
