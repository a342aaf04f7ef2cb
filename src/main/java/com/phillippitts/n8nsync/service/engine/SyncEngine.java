package com.phillippitts.n8nsync.service.engine;

import com.phillippitts.n8nsync.domain.SyncAction;
import com.phillippitts.n8nsync.domain.SyncResult;
import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.domain.WorkflowStatus;
import com.phillippitts.n8nsync.domain.WorkflowSyncStatus;
import com.phillippitts.n8nsync.exception.N8nSyncException;
import com.phillippitts.n8nsync.exception.RemoteApiException;
import com.phillippitts.n8nsync.exception.WorkflowFileException;
import com.phillippitts.n8nsync.service.archive.WorkflowArchive;
import com.phillippitts.n8nsync.service.metrics.SyncMetrics;
import com.phillippitts.n8nsync.service.normalize.WorkflowNormalizer;
import com.phillippitts.n8nsync.service.remote.N8nApiClient;
import com.phillippitts.n8nsync.service.watch.SyncGuard;
import com.phillippitts.n8nsync.service.watch.WorkflowFiles;
import com.phillippitts.n8nsync.service.watch.WorkflowWatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Executes pull, push and recovery operations.
 *
 * <p>Pull strategy:
 * <pre>
 * EXIST_ONLY_REMOTELY, MODIFIED_REMOTELY  fetch, write, finalize
 * DELETED_REMOTELY                        archive local file (no finalize)
 * CONFLICT                                refuse
 * anything else                           no-op
 * </pre>
 *
 * <p>Push strategy:
 * <pre>
 * EXIST_ONLY_LOCALLY   create, write new id into the file, finalize
 * MODIFIED_LOCALLY     update, overwrite file with the server's copy, finalize
 *                      (a vanished remote is re-created under a new id)
 * DELETED_LOCALLY      wait for an explicit {@link #deleteRemote} + {@link #confirmDeletion}
 * CONFLICT             refuse
 * anything else        no-op
 * </pre>
 *
 * <p>Every operation holds the workflow's {@link SyncGuard} lease for its whole duration and
 * releases it on failure too. New base state is committed only through
 * {@link WorkflowWatcher#finalizeSync}, {@link WorkflowWatcher#migrateWorkflowId} and
 * {@link WorkflowWatcher#removeWorkflowState}.
 */
public class SyncEngine {

    private static final Logger LOG = LogManager.getLogger(SyncEngine.class);

    private static final String FILE_LOCK_PREFIX = "file:";

    private final N8nApiClient client;
    private final WorkflowWatcher watcher;
    private final WorkflowFiles files;
    private final WorkflowArchive archive;
    private final WorkflowNormalizer normalizer;
    private final SyncGuard guard;
    private final SyncMetrics metrics;

    public SyncEngine(N8nApiClient client,
                      WorkflowWatcher watcher,
                      WorkflowFiles files,
                      WorkflowArchive archive,
                      WorkflowNormalizer normalizer,
                      SyncMetrics metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.watcher = Objects.requireNonNull(watcher, "watcher");
        this.files = Objects.requireNonNull(files, "files");
        this.archive = Objects.requireNonNull(archive, "archive");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.guard = watcher.guard();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    // ---- Status-driven ----

    /**
     * Pulls {@code workflowId} according to {@code status}.
     */
    public SyncResult pull(String workflowId, String filename, WorkflowSyncStatus status) {
        return execute("pull", workflowId, () -> doPull(workflowId, filename, status));
    }

    /** Pulls using the status derived under the workflow's lease. */
    public SyncResult pull(String workflowId) {
        return execute("pull", workflowId, () -> {
            WorkflowStatus current = watcher.statusFor(workflowId);
            return doPull(workflowId, current.filename(), current.status());
        });
    }

    /**
     * Pushes {@code filename} according to {@code status}. {@code workflowId} is null for a
     * file that has never been pushed.
     */
    public SyncResult push(String filename, String workflowId, WorkflowSyncStatus status) {
        return execute("push", lockKey(workflowId, filename), () -> doPush(filename, workflowId, status));
    }

    /** Pushes a tracked workflow using the status derived under its lease. */
    public SyncResult push(String workflowId) {
        return execute("push", workflowId, () -> {
            WorkflowStatus current = watcher.statusFor(workflowId);
            return doPush(current.filename(), workflowId, current.status());
        });
    }

    /** Pushes a local file, creating the remote workflow when the file has no id yet. */
    public SyncResult pushFile(String filename) {
        String knownId = watcher.idForFile(filename);
        return execute("push", lockKey(knownId, filename), () -> {
            WorkflowStatus current = watcher.statusForFile(filename);
            return doPush(filename, current.workflowId(), current.status());
        });
    }

    private SyncResult doPull(String workflowId, String filename, WorkflowSyncStatus status) {
        switch (status) {
            case EXIST_ONLY_REMOTELY:
            case MODIFIED_REMOTELY: {
                Optional<Workflow> remote = client.get(workflowId);
                if (remote.isEmpty()) {
                    if (filename != null && files.exists(filename)) {
                        return archiveLocal(workflowId, filename);
                    }
                    throw new RemoteApiException("get", 404, "Workflow " + workflowId + " not found during pull");
                }
                String target = filename != null ? filename : WorkflowFiles.filenameFor(remote.get().name());
                writeRemoteCopy(workflowId, target, remote.get());
                watcher.finalizeSync(workflowId);
                return SyncResult.of(workflowId, target, SyncAction.PULLED);
            }
            case DELETED_REMOTELY: {
                if (client.get(workflowId).isPresent()) {
                    LOG.warn("Workflow {} reported deleted remotely but still exists; skipping", workflowId);
                    return SyncResult.of(workflowId, filename, SyncAction.SKIPPED);
                }
                return archiveLocal(workflowId, filename);
            }
            case CONFLICT:
                LOG.warn("Refusing to pull {} ({}): local and remote both changed", filename, workflowId);
                return SyncResult.of(workflowId, filename, SyncAction.REFUSED_CONFLICT);
            default:
                return SyncResult.of(workflowId, filename, SyncAction.SKIPPED);
        }
    }

    private SyncResult doPush(String filename, String workflowId, WorkflowSyncStatus status) {
        switch (status) {
            case EXIST_ONLY_LOCALLY: {
                Workflow local = files.read(filename);
                String newId = createRemote(filename, local);
                return SyncResult.of(newId, filename, SyncAction.CREATED);
            }
            case MODIFIED_LOCALLY:
                return updateOrRecreate(workflowId, filename);
            case DELETED_LOCALLY:
                LOG.info("{} ({}) was deleted locally; remote deletion needs explicit confirmation",
                        filename, workflowId);
                return SyncResult.of(workflowId, filename, SyncAction.AWAITING_DELETE_CONFIRMATION);
            case CONFLICT:
                LOG.warn("Refusing to push {} ({}): local and remote both changed", filename, workflowId);
                return SyncResult.of(workflowId, filename, SyncAction.REFUSED_CONFLICT);
            default:
                return SyncResult.of(workflowId, filename, SyncAction.SKIPPED);
        }
    }

    // ---- Forced / recovery ----

    /**
     * Overwrites the local file with the remote copy regardless of status.
     */
    public SyncResult forcePull(String workflowId) {
        return execute("force-pull", workflowId, () -> {
            Workflow remote = client.get(workflowId).orElseThrow(() ->
                    new RemoteApiException("get", 404, "Workflow " + workflowId + " not found"));
            String filename = watcher.fileForId(workflowId);
            if (filename == null) {
                filename = WorkflowFiles.filenameFor(remote.name());
            }
            writeRemoteCopy(workflowId, filename, remote);
            watcher.finalizeSync(workflowId);
            return SyncResult.of(workflowId, filename, SyncAction.PULLED);
        });
    }

    /**
     * Overwrites the remote with the local file regardless of status. If the remote no longer
     * exists the workflow is re-created and all state migrates to the new id.
     */
    public SyncResult forcePush(String workflowId) {
        return execute("force-push", workflowId, () -> updateOrRecreate(workflowId, watcher.fileForId(workflowId)));
    }

    /**
     * Deletes the remote workflow and moves the local file (if any) into the archive. The
     * remote copy is archived first unless an archive entry already exists. The base is kept
     * until {@link #confirmDeletion}.
     */
    public SyncResult deleteRemote(String workflowId) {
        return execute("delete", workflowId, () -> {
            String filename = watcher.fileForId(workflowId);
            if (filename != null && !archive.hasEntryFor(filename)) {
                client.get(workflowId).ifPresent(remote ->
                        archive.snapshot(filename, normalizer.forStorage(remote).withId(workflowId)));
            }
            if (!client.delete(workflowId)) {
                LOG.info("Workflow {} was already gone on the remote", workflowId);
            }
            if (filename != null && archive.moveToArchive(filename).isPresent()) {
                watcher.localFileRemoved(filename);
            }
            return SyncResult.of(workflowId, filename, SyncAction.REMOTE_DELETED);
        });
    }

    /**
     * Forgets the base of a deleted workflow. Until this runs the deletion is still visible
     * as a status.
     */
    public void confirmDeletion(String workflowId) {
        execute("confirm-delete", workflowId, () -> {
            String filename = watcher.fileForId(workflowId);
            watcher.removeWorkflowState(workflowId);
            return SyncResult.of(workflowId, filename, SyncAction.DELETION_CONFIRMED);
        });
    }

    /**
     * Restores the most recent archive entry of {@code filename} into the working directory
     * and removes the entry. An existing working copy is archived before it is replaced.
     *
     * @return false when the archive has no entry for the file
     */
    public boolean restoreFromArchive(String filename) {
        String knownId = watcher.idForFile(filename);
        SyncResult result = execute("restore", lockKey(knownId, filename), () -> {
            if (!archive.restore(filename)) {
                LOG.warn("No archive entry found for {}", filename);
                return SyncResult.of(knownId, filename, SyncAction.SKIPPED);
            }
            watcher.rehashLocalFile(filename);
            return SyncResult.of(watcher.idForFile(filename), filename, SyncAction.RESTORED);
        });
        return result.action() == SyncAction.RESTORED;
    }

    /**
     * Activates or deactivates a workflow remotely and mirrors the flag into the local file.
     * Content pushes never carry the flag, so this is its only write path.
     */
    public SyncResult setActive(String workflowId, boolean active) {
        return execute(active ? "activate" : "deactivate", workflowId, () -> {
            boolean wasInSync = watcher.statusFor(workflowId).status() == WorkflowSyncStatus.IN_SYNC;
            Workflow remote = active ? client.activate(workflowId) : client.deactivate(workflowId);
            String filename = watcher.fileForId(workflowId);
            if (filename != null && files.exists(filename)) {
                files.write(filename, files.read(filename).withActive(active));
            }
            if (wasInSync && filename != null && files.exists(filename)) {
                watcher.finalizeSync(workflowId);
            } else {
                watcher.updateRemoteHash(workflowId, remote);
                if (filename != null) {
                    watcher.rehashLocalFile(filename);
                }
            }
            return SyncResult.of(workflowId, filename, SyncAction.ACTIVATION_CHANGED);
        });
    }

    // ---- Helpers ----

    private SyncResult updateOrRecreate(String workflowId, String filename) {
        if (filename == null) {
            throw new WorkflowFileException(files.directory(), "No local file for workflow " + workflowId);
        }
        Workflow local = files.read(filename);
        Workflow updated;
        try {
            updated = client.update(workflowId, normalizer.forPush(local));
        } catch (RemoteApiException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            LOG.warn("Workflow {} no longer exists remotely; re-creating from {}", workflowId, filename);
            String newId = createRemote(filename, local, workflowId);
            return SyncResult.of(newId, filename, SyncAction.RECREATED);
        }
        // The server's copy becomes the local copy so both sides hash identically
        writeRemoteCopy(workflowId, filename, updated);
        watcher.finalizeSync(workflowId);
        return SyncResult.of(workflowId, filename, SyncAction.PUSHED);
    }

    private String createRemote(String filename, Workflow local) {
        return createRemote(filename, local, null);
    }

    /**
     * Creates {@code local} remotely, writes the new id into the file and finalizes. When
     * {@code previousId} is set, its state migrates to the new id first. A name that does not
     * map to {@code filename} is replaced by the file's stem.
     */
    private String createRemote(String filename, Workflow local, String previousId) {
        Workflow payload = normalizer.forPush(local);
        // The remote name must map back to this file, or the next pull would write a second one
        String stem = WorkflowFiles.stem(filename);
        if (payload.name() == null || payload.name().isBlank()) {
            payload = payload.withName(stem);
        } else if (!WorkflowFiles.filenameFor(payload.name()).equals(filename)) {
            LOG.warn("Name \"{}\" does not match {}; creating as \"{}\"", payload.name(), filename, stem);
            payload = payload.withName(stem);
        }
        Workflow created = client.create(payload);
        String newId = created.id();
        if (previousId != null) {
            watcher.migrateWorkflowId(previousId, newId);
        }
        try (SyncGuard.Lease lease = guard.acquire(newId)) {
            files.write(filename, normalizer.forStorage(local.withName(payload.name())).withId(newId));
            watcher.finalizeSync(newId);
        }
        LOG.info("Created remote workflow {} from {}", newId, filename);
        return newId;
    }

    private void writeRemoteCopy(String workflowId, String filename, Workflow remote) {
        files.write(filename, normalizer.forStorage(remote).withId(workflowId));
    }

    private SyncResult archiveLocal(String workflowId, String filename) {
        if (filename == null || archive.moveToArchive(filename).isEmpty()) {
            return SyncResult.of(workflowId, filename, SyncAction.SKIPPED);
        }
        watcher.localFileRemoved(filename);
        return SyncResult.of(workflowId, filename, SyncAction.ARCHIVED);
    }

    private static String lockKey(String workflowId, String filename) {
        return workflowId != null ? workflowId : FILE_LOCK_PREFIX + filename;
    }

    private SyncResult execute(String operation, String lockKey, Supplier<SyncResult> body) {
        String previousId = ThreadContext.get("workflowId");
        String previousOp = ThreadContext.get("operation");
        ThreadContext.put("workflowId", lockKey);
        ThreadContext.put("operation", operation);
        long start = System.nanoTime();
        try (SyncGuard.Lease lease = guard.acquire(lockKey)) {
            SyncResult result = body.get();
            metrics.recordOperation(operation, result.action(), System.nanoTime() - start);
            LOG.info("{} {} -> {}", operation, lockKey, result.action());
            return result;
        } catch (N8nSyncException e) {
            metrics.incrementFailure(operation, e.getClass().getSimpleName());
            LOG.error("{} of {} failed: {}", operation, lockKey, e.getMessage());
            throw e;
        } finally {
            restore("workflowId", previousId);
            restore("operation", previousOp);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, previous);
        }
    }
}
