package com.phillippitts.n8nsync.service.orchestration;

import com.phillippitts.n8nsync.domain.SyncAction;
import com.phillippitts.n8nsync.domain.SyncResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batch sweep: one result per workflow that was acted on, one failure per
 * workflow whose operation threw. A failure never stops the sweep.
 */
public record SyncReport(List<SyncResult> results, List<Failure> failures) {

    public SyncReport {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public static SyncReport empty() {
        return new SyncReport(List.of(), List.of());
    }

    public long count(SyncAction action) {
        return results.stream().filter(r -> r.action() == action).count();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public SyncReport merge(SyncReport other) {
        List<SyncResult> mergedResults = new ArrayList<>(results);
        mergedResults.addAll(other.results());
        List<Failure> mergedFailures = new ArrayList<>(failures);
        mergedFailures.addAll(other.failures());
        return new SyncReport(mergedResults, mergedFailures);
    }

    /**
     * @param workflowId workflow id, null for a never-pushed file
     * @param filename local filename
     * @param operation operation that failed
     * @param message failure message
     */
    public record Failure(String workflowId, String filename, String operation, String message) {
    }
}
