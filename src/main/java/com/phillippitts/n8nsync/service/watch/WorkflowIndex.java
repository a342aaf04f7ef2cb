package com.phillippitts.n8nsync.service.watch;

import com.phillippitts.n8nsync.domain.WorkflowSyncStatus;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory view owned by {@link WorkflowWatcher}: local hashes by filename, remote hashes
 * and timestamps by id, the id/filename binding and the last broadcast status.
 *
 * <p>All access goes through one read/write lock. Nothing here is persisted; it is rebuilt
 * from the directory and the remote listing on start.
 */
final class WorkflowIndex {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, String> localHashes = new HashMap<>();
    private final Map<String, String> remoteHashes = new HashMap<>();
    private final Map<String, String> remoteUpdatedAt = new HashMap<>();
    private final Map<String, String> fileToId = new HashMap<>();
    private final Map<String, String> idToFile = new HashMap<>();
    private final Set<String> ignoredIds = new HashSet<>();
    private final Set<String> snapshottedIds = new HashSet<>();
    private final Map<String, WorkflowSyncStatus> lastBroadcast = new HashMap<>();

    String localHash(String filename) {
        lock.readLock().lock();
        try {
            return filename == null ? null : localHashes.get(filename);
        } finally {
            lock.readLock().unlock();
        }
    }

    void putLocalHash(String filename, String hash) {
        lock.writeLock().lock();
        try {
            localHashes.put(filename, hash);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void removeLocalHash(String filename) {
        lock.writeLock().lock();
        try {
            localHashes.remove(filename);
        } finally {
            lock.writeLock().unlock();
        }
    }

    Set<String> localFilenames() {
        lock.readLock().lock();
        try {
            return Set.copyOf(localHashes.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    String remoteHash(String workflowId) {
        lock.readLock().lock();
        try {
            return workflowId == null ? null : remoteHashes.get(workflowId);
        } finally {
            lock.readLock().unlock();
        }
    }

    String remoteUpdatedAt(String workflowId) {
        lock.readLock().lock();
        try {
            return remoteUpdatedAt.get(workflowId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records a remote hash. A null {@code updatedAt} forces a re-fetch on the next poll.
     */
    void putRemote(String workflowId, String hash, String updatedAt) {
        lock.writeLock().lock();
        try {
            remoteHashes.put(workflowId, hash);
            if (updatedAt == null) {
                remoteUpdatedAt.remove(workflowId);
            } else {
                remoteUpdatedAt.put(workflowId, updatedAt);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    void removeRemote(String workflowId) {
        lock.writeLock().lock();
        try {
            remoteHashes.remove(workflowId);
            remoteUpdatedAt.remove(workflowId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    Set<String> remoteIds() {
        lock.readLock().lock();
        try {
            return Set.copyOf(remoteHashes.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    String idForFile(String filename) {
        lock.readLock().lock();
        try {
            return filename == null ? null : fileToId.get(filename);
        } finally {
            lock.readLock().unlock();
        }
    }

    String fileForId(String workflowId) {
        lock.readLock().lock();
        try {
            return workflowId == null ? null : idToFile.get(workflowId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Binds {@code workflowId} to {@code filename}, dropping any previous binding of either.
     */
    void bind(String workflowId, String filename) {
        lock.writeLock().lock();
        try {
            String oldFile = idToFile.put(workflowId, filename);
            if (oldFile != null && !oldFile.equals(filename)) {
                fileToId.remove(oldFile);
            }
            String oldId = fileToId.put(filename, workflowId);
            if (oldId != null && !oldId.equals(workflowId)) {
                idToFile.remove(oldId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves everything known about {@code oldId} to {@code newId}.
     */
    void migrate(String oldId, String newId) {
        lock.writeLock().lock();
        try {
            String file = idToFile.remove(oldId);
            if (file != null) {
                idToFile.put(newId, file);
                fileToId.put(file, newId);
            }
            String hash = remoteHashes.remove(oldId);
            if (hash != null) {
                remoteHashes.put(newId, hash);
            }
            remoteUpdatedAt.remove(oldId);
            snapshottedIds.remove(oldId);
            WorkflowSyncStatus last = lastBroadcast.remove(oldId);
            if (last != null) {
                lastBroadcast.put(newId, last);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops all knowledge of an id except the local hash of its file.
     */
    void forget(String workflowId) {
        lock.writeLock().lock();
        try {
            remoteHashes.remove(workflowId);
            remoteUpdatedAt.remove(workflowId);
            snapshottedIds.remove(workflowId);
            lastBroadcast.remove(workflowId);
            String file = idToFile.remove(workflowId);
            if (file != null) {
                fileToId.remove(file, workflowId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    void setIgnored(String workflowId, boolean ignored) {
        lock.writeLock().lock();
        try {
            if (ignored) {
                ignoredIds.add(workflowId);
            } else {
                ignoredIds.remove(workflowId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    boolean isIgnored(String workflowId) {
        lock.readLock().lock();
        try {
            return workflowId != null && ignoredIds.contains(workflowId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** True the first time an id is marked; later calls return false until cleared. */
    boolean markSnapshotted(String workflowId) {
        lock.writeLock().lock();
        try {
            return snapshottedIds.add(workflowId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void clearSnapshotted(String workflowId) {
        lock.writeLock().lock();
        try {
            snapshottedIds.remove(workflowId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records {@code status} as broadcast for {@code key}.
     *
     * @return true when it differs from the previous broadcast
     */
    boolean recordBroadcast(String key, WorkflowSyncStatus status) {
        lock.writeLock().lock();
        try {
            return lastBroadcast.put(key, status) != status;
        } finally {
            lock.writeLock().unlock();
        }
    }

    void clearBroadcast(String key) {
        lock.writeLock().lock();
        try {
            lastBroadcast.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
