package com.phillippitts.n8nsync.service.state;

import java.time.Instant;

/**
 * The base of the three-way comparison: the hash both sides had the last time they were
 * confirmed identical.
 */
public record SyncState(String lastSyncedHash, Instant lastSyncedAt) {
}
