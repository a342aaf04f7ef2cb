package com.phillippitts.n8nsync.service.watch;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-workflow advisory guard.
 *
 * <p>A {@link Lease} serializes engine operations on one id and, while held, marks the id
 * paused and in progress so the watcher ignores remote polls and file events for it. Files
 * the engine writes under a lease are therefore never mistaken for user edits.
 *
 * <p>Ids are independent: holding a lease on one never blocks another. Locks are in-process
 * only.
 */
public class SyncGuard {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> paused = ConcurrentHashMap.newKeySet();
    private final Set<String> inProgress = ConcurrentHashMap.newKeySet();

    /**
     * Blocks until the id's lock is available, then pauses observation of the id.
     * The returned lease must be closed, typically with try-with-resources.
     */
    public Lease acquire(String workflowId) {
        ReentrantLock lock = locks.computeIfAbsent(workflowId, k -> new ReentrantLock());
        lock.lock();
        paused.add(workflowId);
        inProgress.add(workflowId);
        return new Lease(workflowId, lock);
    }

    public boolean isGuarded(String workflowId) {
        return workflowId != null && (paused.contains(workflowId) || inProgress.contains(workflowId));
    }

    public void pause(String workflowId) {
        paused.add(workflowId);
    }

    public void resume(String workflowId) {
        paused.remove(workflowId);
    }

    public void markSyncInProgress(String workflowId) {
        inProgress.add(workflowId);
    }

    public void markSyncComplete(String workflowId) {
        inProgress.remove(workflowId);
    }

    /**
     * Held guard on one workflow id. Closing is idempotent; a nested lease taken by the same
     * thread leaves the id guarded until the outermost lease closes.
     */
    public final class Lease implements AutoCloseable {

        private final String workflowId;
        private final ReentrantLock lock;
        private boolean closed;

        private Lease(String workflowId, ReentrantLock lock) {
            this.workflowId = workflowId;
            this.lock = lock;
        }

        public String workflowId() {
            return workflowId;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (lock.getHoldCount() == 1) {
                inProgress.remove(workflowId);
                paused.remove(workflowId);
            }
            lock.unlock();
        }
    }
}
