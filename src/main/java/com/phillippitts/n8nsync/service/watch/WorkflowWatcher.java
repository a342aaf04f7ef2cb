package com.phillippitts.n8nsync.service.watch;

import com.phillippitts.n8nsync.config.properties.SyncProperties;
import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.domain.WorkflowStatus;
import com.phillippitts.n8nsync.domain.WorkflowSummary;
import com.phillippitts.n8nsync.domain.WorkflowSyncStatus;
import com.phillippitts.n8nsync.exception.N8nSyncException;
import com.phillippitts.n8nsync.exception.RemoteApiException;
import com.phillippitts.n8nsync.exception.WorkflowFileException;
import com.phillippitts.n8nsync.service.archive.WorkflowArchive;
import com.phillippitts.n8nsync.service.hash.CanonicalHasher;
import com.phillippitts.n8nsync.service.normalize.WorkflowNormalizer;
import com.phillippitts.n8nsync.service.remote.N8nApiClient;
import com.phillippitts.n8nsync.service.state.StateStore;
import com.phillippitts.n8nsync.service.watch.event.SyncErrorEvent;
import com.phillippitts.n8nsync.service.watch.event.WorkflowStatusChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Observes the sync directory and the remote instance and derives the sync status of every
 * workflow.
 *
 * <p>The watcher owns the local/remote hash maps and the id/filename binding, and is the only
 * writer of the {@link StateStore}. It never mutates files or the remote apart from one
 * exception: when a workflow is first seen as {@code DELETED_LOCALLY}, the remote copy is
 * archived before anything else can act on the status.
 *
 * <p>Observation sources:
 * <ul>
 *   <li>debounced filesystem events from {@link LocalDirectoryMonitor}</li>
 *   <li>remote polling every {@code n8n.sync.poll-interval-ms}; full content is fetched only
 *       when a workflow's {@code updatedAt} changed</li>
 * </ul>
 * Ids held by a {@link SyncGuard} lease are skipped by both, so engine writes are never
 * reported as user changes.
 *
 * <p>Status changes are pushed to the {@link SyncEventListener}s given at construction; a
 * status is broadcast only when it differs from the last one broadcast for that workflow.
 */
public class WorkflowWatcher implements SmartLifecycle, LocalDirectoryMonitor.Listener {

    private static final Logger LOG = LogManager.getLogger(WorkflowWatcher.class);

    private static final String FILE_KEY_PREFIX = "file:";

    private final WorkflowFiles files;
    private final StateStore stateStore;
    private final N8nApiClient client;
    private final WorkflowNormalizer normalizer;
    private final CanonicalHasher hasher;
    private final WorkflowArchive archive;
    private final SyncGuard guard;
    private final SyncProperties properties;
    private final TaskScheduler scheduler;
    private final List<SyncEventListener> listeners;

    private final WorkflowIndex index = new WorkflowIndex();

    private volatile boolean running;
    private volatile boolean remoteStateKnown;
    private volatile boolean localStateKnown;
    private LocalDirectoryMonitor monitor;
    private ScheduledFuture<?> pollTask;

    /**
     * @param scheduler drives polling and debounce timers; may be null, in which case
     *                  {@link #start()} performs the initial scan only
     */
    public WorkflowWatcher(WorkflowFiles files,
                           StateStore stateStore,
                           N8nApiClient client,
                           WorkflowNormalizer normalizer,
                           CanonicalHasher hasher,
                           WorkflowArchive archive,
                           SyncGuard guard,
                           SyncProperties properties,
                           TaskScheduler scheduler,
                           List<SyncEventListener> listeners) {
        this.files = Objects.requireNonNull(files, "files");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore");
        this.client = Objects.requireNonNull(client, "client");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.archive = Objects.requireNonNull(archive, "archive");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.scheduler = scheduler;
        this.listeners = List.copyOf(listeners);
    }

    // ---- Lifecycle ----

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        LOG.info("Starting workflow watcher on {}", files.directory());
        initialize();
        if (scheduler != null) {
            monitor = new LocalDirectoryMonitor(files.directory(),
                    Duration.ofMillis(properties.getDebounceMs()), scheduler, this);
            try {
                monitor.start();
            } catch (IOException e) {
                throw new WorkflowFileException(files.directory(), "Failed to watch workflow directory", e);
            }
            long interval = properties.getPollIntervalMs();
            if (interval > 0) {
                pollTask = scheduler.scheduleWithFixedDelay(this::pollSafely,
                        Instant.now().plusMillis(interval), Duration.ofMillis(interval));
            } else {
                LOG.info("Remote polling disabled (poll interval 0)");
            }
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (monitor != null) {
            monitor.close();
            monitor = null;
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isWatchOnStartup();
    }

    /**
     * Rebuilds the in-memory view from the directory and the remote, then broadcasts.
     */
    public void initialize() {
        rescanDirectory();
        refreshRemoteState();
    }

    /**
     * False until the first remote listing succeeds. Until then a missing remote hash means
     * "unknown", not "deleted", so no status is broadcast.
     */
    public boolean isRemoteStateKnown() {
        return remoteStateKnown;
    }

    /**
     * False until the directory was scanned once. Until then a missing local hash means
     * "not looked at yet", not "deleted locally".
     */
    public boolean isLocalStateKnown() {
        return localStateKnown;
    }

    // ---- Observation ----

    /**
     * Re-hashes every workflow file. Malformed files keep their previous hash and raise an
     * error event.
     */
    public void refreshLocalState() {
        rescanDirectory();
        broadcastChanges();
    }

    private void rescanDirectory() {
        List<String> present = files.list();
        for (String filename : present) {
            if (!guard.isGuarded(index.idForFile(filename))) {
                hashLocalFile(filename);
            }
        }
        Set<String> presentSet = new HashSet<>(present);
        for (String known : index.localFilenames()) {
            // The engine may have written the file after the listing above was taken
            if (!presentSet.contains(known) && !guard.isGuarded(index.idForFile(known))
                    && !files.exists(known)) {
                forgetLocalFile(known);
            }
        }
        localStateKnown = true;
    }

    /**
     * Lists the remote and refreshes hashes of workflows whose {@code updatedAt} moved. A
     * failed listing leaves the remote view untouched.
     */
    public void refreshRemoteState() {
        List<WorkflowSummary> summaries;
        try {
            summaries = client.list();
        } catch (RemoteApiException e) {
            LOG.warn("Remote listing failed, keeping previous remote state: {}", e.getMessage());
            emitError("Failed to list remote workflows", null, e);
            return;
        }

        // Active workflows claim filenames first
        List<WorkflowSummary> ordered = new ArrayList<>(summaries);
        ordered.sort(Comparator.comparing(WorkflowSummary::active).reversed());

        Set<String> seen = new HashSet<>();
        Map<String, String> claimedFilenames = new HashMap<>();
        for (WorkflowSummary summary : ordered) {
            String id = summary.id();
            if (id == null) {
                continue;
            }
            if (isIgnored(summary)) {
                index.setIgnored(id, true);
                index.removeRemote(id);
                continue;
            }
            index.setIgnored(id, false);
            seen.add(id);
            if (guard.isGuarded(id)) {
                continue;
            }

            String filename = index.fileForId(id);
            if (filename == null) {
                filename = WorkflowFiles.filenameFor(summary.name());
                String localOwner = index.idForFile(filename);
                if (localOwner != null && !localOwner.equals(id)) {
                    LOG.warn("Filename {} already belongs to workflow {}; skipping remote workflow {}",
                            filename, localOwner, id);
                    continue;
                }
            }
            String firstClaim = claimedFilenames.putIfAbsent(filename, id);
            if (firstClaim != null && !firstClaim.equals(id)) {
                LOG.warn("Workflows {} and {} both map to {}; keeping {}", firstClaim, id, filename, firstClaim);
                continue;
            }
            index.bind(id, filename);

            boolean stale = index.remoteHash(id) == null
                    || !Objects.equals(index.remoteUpdatedAt(id), summary.updatedAt());
            if (stale) {
                fetchRemote(id, summary.updatedAt(), seen);
            }
        }

        for (String id : index.remoteIds()) {
            if (!seen.contains(id) && !guard.isGuarded(id)) {
                index.removeRemote(id);
            }
        }
        remoteStateKnown = true;
        broadcastChanges();
    }

    private void fetchRemote(String id, String updatedAt, Set<String> seen) {
        try {
            Optional<Workflow> full = client.get(id);
            if (full.isEmpty()) {
                // Deleted between listing and fetch
                seen.remove(id);
                return;
            }
            index.putRemote(id, hashOf(full.get()), updatedAt);
        } catch (RemoteApiException e) {
            LOG.warn("Failed to fetch workflow {}: {}", id, e.getMessage());
            emitError("Failed to fetch remote workflow " + id, id, e);
        }
    }

    private boolean isIgnored(WorkflowSummary summary) {
        if (!properties.isSyncInactive() && !summary.active()) {
            return true;
        }
        List<String> ignoredTags = properties.normalizedIgnoredTags();
        return summary.tags().stream()
                .map(t -> t.name() == null ? "" : t.name().trim().toLowerCase(Locale.ROOT))
                .anyMatch(ignoredTags::contains);
    }

    /**
     * @return true when the stored hash changed
     */
    private boolean hashLocalFile(String filename) {
        Workflow workflow;
        try {
            workflow = files.read(filename);
        } catch (WorkflowFileException e) {
            LOG.warn("Skipping malformed workflow file {}: {}", filename, e.getMessage());
            emitError("Malformed workflow file " + filename, index.idForFile(filename), e);
            return false;
        }
        String id = workflow.id();
        if (id != null && !id.isBlank()) {
            String boundFile = index.fileForId(id);
            if (boundFile == null || boundFile.equals(filename) || !files.exists(boundFile)) {
                index.bind(id, filename);
                index.clearSnapshotted(id);
            } else {
                LOG.warn("Workflow id {} appears in both {} and {}; keeping {}", id, boundFile, filename, boundFile);
            }
        }
        String hash = hashOf(workflow);
        String previous = index.localHash(filename);
        index.putLocalHash(filename, hash);
        return !hash.equals(previous);
    }

    private void pollSafely() {
        try {
            refreshRemoteState();
        } catch (N8nSyncException e) {
            LOG.error("Remote poll failed", e);
            emitError("Remote poll failed: " + e.getMessage(), null, e);
        }
    }

    // ---- Filesystem callbacks ----

    @Override
    public void onFileChanged(String filename) {
        String id = index.idForFile(filename);
        if (guard.isGuarded(id)) {
            LOG.debug("Ignoring change of {} while workflow {} is syncing", filename, id);
            return;
        }
        if (hashLocalFile(filename)) {
            broadcastChanges();
        }
    }

    @Override
    public void onFileDeleted(String filename) {
        String id = index.idForFile(filename);
        if (guard.isGuarded(id)) {
            LOG.debug("Ignoring deletion of {} while workflow {} is syncing", filename, id);
            return;
        }
        if (index.localHash(filename) == null) {
            return;
        }
        forgetLocalFile(filename);
        broadcastChanges();
    }

    private void forgetLocalFile(String filename) {
        index.removeLocalHash(filename);
        if (index.idForFile(filename) == null) {
            index.clearBroadcast(FILE_KEY_PREFIX + filename);
        }
    }

    @Override
    public void onOverflow() {
        refreshLocalState();
    }

    // ---- Status ----

    public WorkflowStatus calculateStatus(String workflowId, String filename) {
        String localHash = index.localHash(filename);
        String remoteHash = index.remoteHash(workflowId);
        String baseHash = workflowId == null ? null : stateStore.lastSyncedHash(workflowId).orElse(null);
        return new WorkflowStatus(filename, workflowId, localHash, remoteHash,
                StatusCalculator.derive(localHash, remoteHash, baseHash));
    }

    /** Status of a workflow by id, using the file bound to it. */
    public WorkflowStatus statusFor(String workflowId) {
        return calculateStatus(workflowId, index.fileForId(workflowId));
    }

    /** Status of a local file, using the id bound to it (if any). */
    public WorkflowStatus statusForFile(String filename) {
        return calculateStatus(index.idForFile(filename), filename);
    }

    /**
     * Status of every known workflow: local files, remote ids and ids that still have a base
     * but vanished from both sides. Sorted by filename; entries without a filename last.
     */
    public List<WorkflowStatus> getStatusMatrix() {
        Map<String, WorkflowStatus> rows = new LinkedHashMap<>();
        Set<String> coveredIds = new HashSet<>();

        for (String filename : index.localFilenames()) {
            String id = index.idForFile(filename);
            if (index.isIgnored(id)) {
                continue;
            }
            if (id != null) {
                coveredIds.add(id);
            }
            rows.put(FILE_KEY_PREFIX + filename, calculateStatus(id, filename));
        }
        for (String id : index.remoteIds()) {
            if (coveredIds.add(id)) {
                rows.put(id, calculateStatus(id, index.fileForId(id)));
            }
        }
        for (String id : stateStore.trackedIds()) {
            if (!index.isIgnored(id) && coveredIds.add(id)) {
                rows.put(id, calculateStatus(id, index.fileForId(id)));
            }
        }

        List<WorkflowStatus> result = new ArrayList<>(rows.values());
        result.sort(Comparator.comparing(WorkflowStatus::filename, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(WorkflowStatus::workflowId, Comparator.nullsLast(Comparator.naturalOrder())));
        return result;
    }

    /** Recomputes every status and broadcasts those that changed. */
    public void broadcastChanges() {
        if (!remoteStateKnown || !localStateKnown) {
            return;
        }
        for (WorkflowStatus status : getStatusMatrix()) {
            broadcastStatus(status);
        }
    }

    private void broadcastStatus(WorkflowStatus status) {
        if (status.status() == WorkflowSyncStatus.DELETED_LOCALLY) {
            snapshotBeforeLocalDeletion(status);
        }
        String key = status.workflowId() != null ? status.workflowId() : FILE_KEY_PREFIX + status.filename();
        if (!index.recordBroadcast(key, status.status())) {
            return;
        }
        LOG.debug("Status of {} ({}): {}", status.filename(), status.workflowId(), status.status());
        WorkflowStatusChangedEvent event = new WorkflowStatusChangedEvent(
                status.filename(), status.workflowId(), status.status(), Instant.now());
        for (SyncEventListener listener : listeners) {
            try {
                listener.onStatusChanged(event);
            } catch (RuntimeException e) {
                LOG.error("Status listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private void snapshotBeforeLocalDeletion(WorkflowStatus status) {
        String id = status.workflowId();
        if (id == null || status.filename() == null || !index.markSnapshotted(id)) {
            return;
        }
        try {
            Optional<Workflow> remote = client.get(id);
            if (remote.isEmpty()) {
                index.clearSnapshotted(id);
                return;
            }
            archive.snapshot(status.filename(), normalizer.forStorage(remote.get()).withId(id));
        } catch (RemoteApiException | WorkflowFileException e) {
            index.clearSnapshotted(id);
            LOG.warn("Could not archive remote copy of locally deleted {}: {}", status.filename(), e.getMessage());
            emitError("Failed to archive remote copy of " + status.filename(), id, e);
        }
    }

    private void emitError(String message, String workflowId, Throwable cause) {
        SyncErrorEvent event = SyncErrorEvent.of(message, workflowId, cause);
        for (SyncEventListener listener : listeners) {
            try {
                listener.onError(event);
            } catch (RuntimeException e) {
                LOG.error("Error listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    // ---- Commits from the sync engine ----

    /**
     * Records a completed sync of {@code workflowId}: hashes the local file, stores that hash
     * as local, remote and base, and broadcasts {@code IN_SYNC}. The remote timestamp is
     * cleared so the next poll re-fetches and verifies the remote content.
     *
     * @throws WorkflowFileException when no local file carries the id
     */
    public void finalizeSync(String workflowId) {
        String filename = index.fileForId(workflowId);
        if (filename == null || !files.exists(filename)) {
            filename = findFileById(workflowId).orElseThrow(() -> new WorkflowFileException(
                    files.directory(), "Cannot finalize sync: no local file for workflow " + workflowId));
        }
        String hash = hashOf(files.read(filename));

        index.bind(workflowId, filename);
        index.putLocalHash(filename, hash);
        index.putRemote(workflowId, hash, null);
        index.clearSnapshotted(workflowId);
        index.clearBroadcast(FILE_KEY_PREFIX + filename);
        stateStore.put(workflowId, hash);

        LOG.info("Finalized sync of {} ({})", filename, workflowId);
        broadcastStatus(new WorkflowStatus(filename, workflowId, hash, hash, WorkflowSyncStatus.IN_SYNC));
    }

    /**
     * Moves all state of {@code oldId} to {@code newId} after a workflow was re-created
     * remotely under a new id.
     */
    public void migrateWorkflowId(String oldId, String newId) {
        index.migrate(oldId, newId);
        stateStore.migrate(oldId, newId);
        LOG.info("Migrated workflow state {} -> {}", oldId, newId);
    }

    /**
     * Drops the base and all cached knowledge of {@code workflowId}. This is the explicit
     * confirmation step of a deletion.
     */
    public void removeWorkflowState(String workflowId) {
        String filename = index.fileForId(workflowId);
        if (filename != null && !files.exists(filename)) {
            index.removeLocalHash(filename);
        }
        stateStore.remove(workflowId);
        index.forget(workflowId);
        LOG.info("Removed sync state of workflow {}", workflowId);
        broadcastChanges();
    }

    /**
     * Re-hashes one file and broadcasts if its status moved. Used by the engine for files it
     * rewrote without finalizing.
     */
    public void rehashLocalFile(String filename) {
        if (files.exists(filename)) {
            hashLocalFile(filename);
        } else {
            forgetLocalFile(filename);
        }
        broadcastChanges();
    }

    /**
     * Records that the engine moved {@code filename} out of the working directory.
     */
    public void localFileRemoved(String filename) {
        forgetLocalFile(filename);
    }

    /**
     * Records a remote hash observed by the engine outside the poll cycle.
     */
    public void updateRemoteHash(String workflowId, Workflow remote) {
        index.putRemote(workflowId, hashOf(remote), null);
    }

    private Optional<String> findFileById(String workflowId) {
        for (String filename : files.list()) {
            try {
                if (workflowId.equals(files.read(filename).id())) {
                    return Optional.of(filename);
                }
            } catch (WorkflowFileException e) {
                LOG.debug("Skipping unreadable {} while looking for {}", filename, workflowId);
            }
        }
        return Optional.empty();
    }

    private String hashOf(Workflow workflow) {
        return hasher.hash(normalizer.forStorage(workflow));
    }

    // ---- Bindings and guards ----

    public String fileForId(String workflowId) {
        return index.fileForId(workflowId);
    }

    public String idForFile(String filename) {
        return index.idForFile(filename);
    }

    public SyncGuard guard() {
        return guard;
    }

    public void pause(String workflowId) {
        guard.pause(workflowId);
    }

    public void resume(String workflowId) {
        guard.resume(workflowId);
    }

    public void markSyncInProgress(String workflowId) {
        guard.markSyncInProgress(workflowId);
    }

    public void markSyncComplete(String workflowId) {
        guard.markSyncComplete(workflowId);
    }
}
