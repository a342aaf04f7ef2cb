package com.phillippitts.n8nsync.service.orchestration;

import com.phillippitts.n8nsync.domain.SyncAction;
import com.phillippitts.n8nsync.domain.SyncResult;
import com.phillippitts.n8nsync.domain.WorkflowStatus;
import com.phillippitts.n8nsync.exception.N8nSyncException;
import com.phillippitts.n8nsync.exception.RemoteApiException;
import com.phillippitts.n8nsync.service.engine.SyncEngine;
import com.phillippitts.n8nsync.service.watch.WorkflowWatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Full-directory sweeps over the status matrix.
 *
 * <p>{@link #pullAll()} brings remote changes down, including accepted remote deletions
 * (archive, then confirm). {@link #pushAll()} sends local changes up but never propagates a
 * local deletion. Conflicts are reported, never resolved. Each workflow is handled
 * independently: one failure is recorded and the sweep moves on.
 */
public class SyncManager {

    private static final Logger LOG = LogManager.getLogger(SyncManager.class);

    private final WorkflowWatcher watcher;
    private final SyncEngine engine;

    public SyncManager(WorkflowWatcher watcher, SyncEngine engine) {
        this.watcher = watcher;
        this.engine = engine;
    }

    public SyncReport pullAll() {
        List<SyncResult> results = new ArrayList<>();
        List<SyncReport.Failure> failures = new ArrayList<>();
        for (WorkflowStatus status : currentMatrix()) {
            switch (status.status()) {
                case EXIST_ONLY_REMOTELY, MODIFIED_REMOTELY, CONFLICT ->
                        attempt("pull", status, () -> engine.pull(status.workflowId()), results, failures);
                case DELETED_REMOTELY -> attempt("pull", status, () -> {
                    SyncResult result = engine.pull(status.workflowId());
                    if (result.action() == SyncAction.ARCHIVED) {
                        engine.confirmDeletion(status.workflowId());
                    }
                    return result;
                }, results, failures);
                default -> {
                    // nothing to bring down
                }
            }
        }
        return log("pull", new SyncReport(results, failures));
    }

    public SyncReport pushAll() {
        return pushSweep(true);
    }

    private SyncReport pushSweep(boolean reportConflicts) {
        List<SyncResult> results = new ArrayList<>();
        List<SyncReport.Failure> failures = new ArrayList<>();
        for (WorkflowStatus status : currentMatrix()) {
            switch (status.status()) {
                case EXIST_ONLY_LOCALLY ->
                        attempt("push", status, () -> engine.pushFile(status.filename()), results, failures);
                case MODIFIED_LOCALLY -> {
                    // A base with neither file nor remote has nothing to push
                    if (status.localHash() != null) {
                        attempt("push", status, () -> engine.push(status.workflowId()), results, failures);
                    }
                }
                case DELETED_LOCALLY ->
                        attempt("push", status, () -> engine.push(status.workflowId()), results, failures);
                case CONFLICT -> {
                    if (reportConflicts) {
                        attempt("push", status, () -> engine.push(status.workflowId()), results, failures);
                    }
                }
                default -> {
                    // nothing to send up
                }
            }
        }
        return log("push", new SyncReport(results, failures));
    }

    /** Pull sweep followed by a push sweep; conflicts are reported once. */
    public SyncReport syncAll() {
        SyncReport pulled = pullAll();
        return pulled.merge(pushSweep(false));
    }

    private List<WorkflowStatus> currentMatrix() {
        if (!watcher.isLocalStateKnown()) {
            watcher.refreshLocalState();
        }
        if (!watcher.isRemoteStateKnown()) {
            watcher.refreshRemoteState();
        }
        if (!watcher.isRemoteStateKnown()) {
            throw new RemoteApiException("list", 0, "Remote state unavailable; refusing to sweep");
        }
        return watcher.getStatusMatrix();
    }

    private static void attempt(String operation,
                                WorkflowStatus status,
                                Supplier<SyncResult> action,
                                List<SyncResult> results,
                                List<SyncReport.Failure> failures) {
        try {
            results.add(action.get());
        } catch (N8nSyncException e) {
            LOG.warn("{} of {} ({}) failed: {}", operation, status.filename(), status.workflowId(), e.getMessage());
            failures.add(new SyncReport.Failure(status.workflowId(), status.filename(), operation, e.getMessage()));
        }
    }

    private static SyncReport log(String sweep, SyncReport report) {
        long changed = report.results().stream().filter(SyncResult::changedSomething).count();
        LOG.info("{} sweep finished: {} changed, {} untouched, {} failed",
                sweep, changed, report.results().size() - changed, report.failures().size());
        return report;
    }
}
