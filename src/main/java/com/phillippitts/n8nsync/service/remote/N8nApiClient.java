package com.phillippitts.n8nsync.service.remote;

import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.domain.WorkflowSummary;
import com.phillippitts.n8nsync.exception.RemoteApiException;

import java.util.List;
import java.util.Optional;

/**
 * Remote workflow store.
 *
 * <p>Every method throws {@link RemoteApiException} on transport or server failure. A missing
 * workflow is never an exception on {@link #get} or {@link #delete}: it is reported as an
 * empty result so callers can treat it as a state signal.
 */
public interface N8nApiClient {

    /** All workflows, following pagination until exhausted. */
    List<WorkflowSummary> list();

    Optional<Workflow> get(String workflowId);

    /** Creates a workflow; the returned record carries the new id. */
    Workflow create(Workflow payload);

    /**
     * Replaces a workflow's content.
     *
     * @throws RemoteApiException with {@link RemoteApiException#isNotFound()} when the id no
     *         longer exists
     */
    Workflow update(String workflowId, Workflow payload);

    /** @return false when the workflow did not exist */
    boolean delete(String workflowId);

    Workflow activate(String workflowId);

    Workflow deactivate(String workflowId);

    /** Cheap authenticated round trip; never throws. */
    boolean testConnection();
}
